package org.asmdoc.frontend.lexer;

import java.util.Set;

/**
 * The closed set of instruction and pseudo-instruction names the lexer classifies
 * as {@link TokenType#MNEMONIC}. Operands are never decoded, so only the names matter.
 */
public final class Mnemonics {

    private static final Set<String> NAMES = Set.of(
            // data movement
            "mov", "movzx", "movsx", "movsxd", "lea", "push", "pop", "xchg",
            // arithmetic and logic
            "add", "sub", "mul", "imul", "div", "idiv", "inc", "dec", "neg",
            "and", "or", "xor", "not", "shl", "shr", "sal", "sar", "rol", "ror",
            "cmp", "test", "cqo", "cdq",
            // control flow
            "jmp", "call", "ret", "je", "jne", "jz", "jnz", "jg", "jge", "jl", "jle",
            "ja", "jae", "jb", "jbe", "js", "jns", "syscall", "leave", "nop", "hlt",
            // pseudo-instructions
            "db", "dw", "dd", "dq", "resb", "resw", "resd", "resq", "align", "equ", "times"
    );

    private Mnemonics() {}

    /**
     * Checks whether the given identifier is a known mnemonic. Matching is exact.
     * @param text The identifier text.
     * @return true if the text names a mnemonic.
     */
    public static boolean isMnemonic(String text) {
        return NAMES.contains(text);
    }
}
