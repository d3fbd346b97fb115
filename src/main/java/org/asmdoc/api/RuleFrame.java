package org.asmdoc.api;

/**
 * One entry of a parser rule trace: the grammar rule that was active and the
 * location at which it was entered.
 *
 * @param rule The rule name, or a token type / {@code end-of-file} for the innermost frame.
 * @param location Where the rule was entered.
 */
public record RuleFrame(String rule, SourceInfo location) {

    @Override
    public String toString() {
        return rule + "(" + location + ")";
    }
}
