package org.asmdoc.api;

import org.asmdoc.model.AssemblyFile;

/**
 * The contract every assembly dialect front end implements.
 * Parsing is all-or-nothing: either a complete {@link AssemblyFile} is returned
 * or a {@link ParseException} describes the first failure.
 */
public interface ISyntax {

    /**
     * The dialect name used to select this front end (e.g. {@code nasm}).
     * @return The dialect name.
     */
    String name();

    /**
     * Parses one source file.
     *
     * @param source The complete source text.
     * @param fileName The logical file name used in token locations and diagnostics.
     * @return The parsed file model.
     * @throws ParseException if the source cannot be tokenized or does not match the grammar.
     */
    AssemblyFile parse(String source, String fileName) throws ParseException;
}
