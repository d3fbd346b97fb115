package org.asmdoc.frontend;

import org.asmdoc.api.ISyntax;
import org.asmdoc.api.ParseException;
import org.asmdoc.frontend.lexer.Lexer;
import org.asmdoc.frontend.lexer.Token;
import org.asmdoc.frontend.parser.Parser;
import org.asmdoc.model.AssemblyFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * The NASM front end: runs the {@link Lexer} and then the {@link Parser} on one file.
 * Instances are stateless and may be shared between threads.
 */
public class NasmSyntax implements ISyntax {

    private static final Logger LOG = LoggerFactory.getLogger(NasmSyntax.class);

    @Override
    public String name() {
        return "nasm";
    }

    @Override
    public AssemblyFile parse(String source, String fileName) throws ParseException {
        List<Token> tokens = new Lexer(source, fileName).scanTokens();
        LOG.debug("Parsing {} ({} tokens)", fileName, tokens.size());
        return new Parser(tokens).parse();
    }
}
