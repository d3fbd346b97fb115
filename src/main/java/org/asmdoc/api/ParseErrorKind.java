package org.asmdoc.api;

/**
 * The kinds of failures a syntax front end can report.
 */
public enum ParseErrorKind {
    /** No lexical rule matches the input at some position. */
    INVALID_INPUT,
    /** A rule was entered with no input left. */
    UNEXPECTED_EOF,
    /** A specific token type was required but something else (or nothing) was found. */
    UNEXPECTED,
    /** A token of the right type carried an unacceptable value. */
    INVALID_SYNTAX
}
