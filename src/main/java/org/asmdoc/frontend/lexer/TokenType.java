package org.asmdoc.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Directive keywords.
    /** {@code bits} */
    BITS,
    /** {@code section} */
    SECTION,
    /** {@code global} */
    GLOBAL,
    /** {@code extern} */
    EXTERN,
    /** {@code %include} */
    INCLUDE,
    /** {@code %define} */
    DEFINE,
    /** {@code %macro} */
    MACRO,
    /** {@code %endmacro} */
    END_MACRO,

    // Size hints.
    /** {@code qword} */
    QWORD,
    /** {@code dword} */
    DWORD,

    /** An instruction or pseudo-instruction name, such as {@code mov} or {@code db}. */
    MNEMONIC,
    /** A macro invocation, such as {@code $print}. */
    MACRO_CALL,
    /** A macro argument placeholder, such as {@code %1}. */
    MACRO_ARG,
    /** A numbered register, such as {@code r8}. */
    REGISTER,
    /** An identifier, such as a label or section name. */
    SYMBOL,
    /** A lone {@code $}. */
    CURRENT_POSITION,
    /** A numeric literal. */
    NUMBER,
    /** A single- or double-quoted string literal. */
    STRING,
    /** A {@code ;} comment running to the end of the line. */
    COMMENT,

    // Single-character tokens.
    COLON,
    COMMA,
    LEFT_BRACKET,
    RIGHT_BRACKET,
    PLUS,
    MINUS,
    ASTERISK,
    SLASH,
    BIT_NOT,
    BIT_OR,
    BIT_XOR,
    BIT_AND,
    LEFT_PAREN,
    RIGHT_PAREN,

    /** A newline character; statements are newline-terminated. */
    NEWLINE,
    /** Represents the end of the source file. */
    END_OF_FILE
}
