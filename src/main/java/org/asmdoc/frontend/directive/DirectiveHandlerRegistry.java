package org.asmdoc.frontend.directive;

import org.asmdoc.frontend.lexer.TokenType;
import org.asmdoc.frontend.parser.features.bits.BitsDirectiveHandler;
import org.asmdoc.frontend.parser.features.def.DefineDirectiveHandler;
import org.asmdoc.frontend.parser.features.include.IncludeDirectiveHandler;
import org.asmdoc.frontend.parser.features.macro.MacroCallHandler;
import org.asmdoc.frontend.parser.features.macro.MacroDirectiveHandler;
import org.asmdoc.frontend.parser.features.mnemonic.MnemonicHandler;
import org.asmdoc.frontend.parser.features.section.SectionDirectiveHandler;
import org.asmdoc.frontend.parser.features.visibility.ExternDirectiveHandler;
import org.asmdoc.frontend.parser.features.visibility.GlobalDirectiveHandler;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * A registry for rule handlers. This class maps the token type that starts a
 * top-level construct to the handler that parses it.
 */
public class DirectiveHandlerRegistry {
    private final Map<TokenType, IDirectiveHandler> handlers = new EnumMap<>(TokenType.class);

    /**
     * Registers a new handler.
     * @param leadingToken The token type that starts the construct.
     * @param handler The handler for the construct.
     */
    public void register(TokenType leadingToken, IDirectiveHandler handler) {
        handlers.put(leadingToken, handler);
    }

    /**
     * Gets the handler for a given leading token type.
     * @param leadingToken The token type.
     * @return An {@link Optional} containing the handler if it exists, otherwise empty.
     */
    public Optional<IDirectiveHandler> get(TokenType leadingToken) {
        return Optional.ofNullable(handlers.get(leadingToken));
    }

    /**
     * Initializes the registry with all the built-in NASM handlers.
     * Labels are not registered here because they are recognized by lookahead.
     * @return A new instance of {@link DirectiveHandlerRegistry} with all handlers registered.
     */
    public static DirectiveHandlerRegistry initialize() {
        DirectiveHandlerRegistry registry = new DirectiveHandlerRegistry();
        registry.register(TokenType.BITS, new BitsDirectiveHandler());
        registry.register(TokenType.SECTION, new SectionDirectiveHandler());
        registry.register(TokenType.MNEMONIC, new MnemonicHandler());
        registry.register(TokenType.GLOBAL, new GlobalDirectiveHandler());
        registry.register(TokenType.EXTERN, new ExternDirectiveHandler());
        registry.register(TokenType.INCLUDE, new IncludeDirectiveHandler());
        registry.register(TokenType.DEFINE, new DefineDirectiveHandler());
        registry.register(TokenType.MACRO, new MacroDirectiveHandler());
        registry.register(TokenType.MACRO_CALL, new MacroCallHandler());
        return registry;
    }
}
