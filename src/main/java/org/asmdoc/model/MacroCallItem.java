package org.asmdoc.model;

import org.asmdoc.api.SourceInfo;
import org.asmdoc.frontend.lexer.Token;

import java.util.List;

/**
 * A macro invocation (e.g. {@code $print msg, len}).
 *
 * @param name The macro name token text, including its sigil.
 * @param rawArguments The uninterpreted tokens following the name up to the end of the line.
 * @param source Where the invocation starts.
 */
public record MacroCallItem(String name, List<Token> rawArguments, SourceInfo source) implements AssemblyItem {

    public MacroCallItem {
        rawArguments = List.copyOf(rawArguments);
    }
}
