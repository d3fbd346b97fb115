package org.asmdoc.model;

import org.asmdoc.api.SourceInfo;
import org.asmdoc.frontend.lexer.Token;

import java.util.List;

/**
 * A {@code %define} directive.
 *
 * @param name The defined name.
 * @param rawValue The uninterpreted tokens after the name up to the end of the line.
 * @param source Where the directive starts.
 */
public record AssemblyDefine(String name, List<Token> rawValue, SourceInfo source) {

    public AssemblyDefine {
        rawValue = List.copyOf(rawValue);
    }
}
