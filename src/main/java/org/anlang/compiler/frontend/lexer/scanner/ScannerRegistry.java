package org.anlang.compiler.frontend.lexer.scanner;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * A registry for token-tree scanners. Scanners are looked up through a table indexed by
 * the first byte of the token tree, so dispatch never tries more than one alternative.
 */
public class ScannerRegistry {

    private final ITokenTreeScanner[] table = new ITokenTreeScanner[128];
    private final Set<String> starters = new LinkedHashSet<>();

    /**
     * Registers a scanner for every ASCII byte it can start with.
     * @param scanner The scanner.
     * @throws IllegalStateException if the scanner's start bytes overlap an already registered scanner.
     */
    public void register(ITokenTreeScanner scanner) {
        for (int c = 0; c < table.length; c++) {
            if (!scanner.canStart(c)) continue;
            if (table[c] != null) {
                throw new IllegalStateException(String.format("Byte 0x%02x is claimed by both %s and %s",
                        c, table[c].getClass().getSimpleName(), scanner.getClass().getSimpleName()));
            }
            table[c] = scanner;
        }
        starters.addAll(scanner.labels());
    }

    /**
     * Gets the scanner for a token tree starting with the given byte.
     * @param c An unsigned byte value, or {@code -1} at the end of input.
     * @return An {@link Optional} containing the scanner if one is registered, otherwise empty.
     */
    public Optional<ITokenTreeScanner> get(int c) {
        if (c < 0 || c >= table.length) return Optional.empty();
        return Optional.ofNullable(table[c]);
    }

    public boolean canStart(int c) {
        return get(c).isPresent();
    }

    /**
     * @return The labels of all registered scanners, in registration order.
     */
    public Set<String> expectedStarters() {
        return Collections.unmodifiableSet(starters);
    }

    /**
     * Initializes the registry with all the built-in scanners.
     * @return A new instance of {@link ScannerRegistry} with all scanners registered.
     */
    public static ScannerRegistry initialize() {
        ScannerRegistry registry = new ScannerRegistry();
        registry.register(new BareTokenScanner());
        registry.register(new OperatorScanner());
        registry.register(new StringScanner());
        registry.register(new ParenthesisScanner());
        registry.register(new CommentScanner());
        return registry;
    }
}
