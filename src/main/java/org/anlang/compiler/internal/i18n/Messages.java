package org.anlang.compiler.internal.i18n;

import org.anlang.compiler.api.LexErrorCode;

import java.text.MessageFormat;
import java.util.Locale;
import java.util.MissingResourceException;
import java.util.ResourceBundle;

/**
 * Internal i18n facade for lexer messages, backed by the {@code lexer_messages} bundle.
 * <p>
 * Lookups never fall back to the JVM default locale: a locale without its own bundle
 * (English included) resolves to the base bundle.
 */
public final class Messages {

    private static final String BUNDLE_BASE_NAME = "lexer_messages";
    private static final ResourceBundle.Control NO_FALLBACK =
            ResourceBundle.Control.getNoFallbackControl(ResourceBundle.Control.FORMAT_PROPERTIES);

    private static volatile ResourceBundle bundle = ResourceBundle.getBundle(BUNDLE_BASE_NAME, Locale.getDefault(), NO_FALLBACK);

    private Messages() {}

    /**
     * Switches the language of all subsequent messages.
     * @param locale The new locale.
     */
    public static void setLocale(Locale locale) {
        bundle = ResourceBundle.getBundle(BUNDLE_BASE_NAME, locale, NO_FALLBACK);
    }

    /**
     * Formats the message of a lex error.
     * @param code The error code; its {@link LexErrorCode#messageKey()} selects the pattern.
     * @param args The pattern arguments: the expected alternatives and the delimiter name.
     * @return The formatted message.
     */
    public static String get(LexErrorCode code, Object... args) {
        return MessageFormat.format(get(code.messageKey()), args);
    }

    /**
     * Gets a message for the given key.
     * @param key The key of the message.
     * @return The message, or "!key!" if not found.
     */
    public static String get(String key) {
        try {
            return bundle.getString(key);
        } catch (MissingResourceException e) {
            return "!" + key + "!";
        }
    }
}
