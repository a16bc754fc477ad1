package org.anlang.compiler.frontend.lexer;

/**
 * Tags a bare token (identifier or integer) with whether another bare token follows it
 * on the same line. The parser uses this to recognise juxtaposition such as {@code f x}.
 */
public enum Adjacency {
    /** Another bare token follows on the same line. */
    SEQUENTIAL,
    /** The token is the last bare token of its run. */
    TERMINAL,
    /** The token is not a bare token; adjacency does not apply. */
    NONE
}
