package org.asmdoc.model;

import org.asmdoc.api.SourceInfo;
import org.asmdoc.frontend.lexer.Token;

import java.util.List;

/**
 * A {@code %macro ... %endmacro} definition.
 *
 * @param name The macro name as written.
 * @param argCount The declared number of arguments.
 * @param rawBody The uninterpreted body tokens between the header and {@code %endmacro}.
 * @param source Where the definition starts.
 */
public record AssemblyMacro(String name, int argCount, List<Token> rawBody, SourceInfo source) {

    public AssemblyMacro {
        rawBody = List.copyOf(rawBody);
    }
}
