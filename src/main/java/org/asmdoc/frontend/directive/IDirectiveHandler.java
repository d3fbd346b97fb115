package org.asmdoc.frontend.directive;

import org.asmdoc.api.ParseException;
import org.asmdoc.frontend.parser.ParsingContext;

/**
 * The base interface for all grammar rule handlers.
 * Each handler is responsible for one top-level construct (e.g. a {@code global}
 * directive) and records what it parsed into the file model of the context.
 */
public interface IDirectiveHandler {

    /**
     * The rule name shown in parser traces.
     * @return The rule name.
     */
    String ruleName();

    /**
     * Parses the construct starting at the current token.
     *
     * @param context The context that provides access to the token stream and the file model.
     * @throws ParseException if the tokens do not match the rule.
     */
    void parse(ParsingContext context) throws ParseException;
}
