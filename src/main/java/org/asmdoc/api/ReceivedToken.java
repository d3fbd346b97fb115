package org.asmdoc.api;

/**
 * The token found where a parse rule required a different one.
 *
 * @param type The name of the token's type, e.g. {@code NEWLINE}.
 * @param text The exact source text of the token.
 */
public record ReceivedToken(String type, String text) {
}
