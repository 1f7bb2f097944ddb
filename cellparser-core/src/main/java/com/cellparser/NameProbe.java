package com.cellparser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.Set;

/**
 * Finds the name a cell declares from its first few tokens, without
 * parsing it. Works on incomplete and invalid input.
 *
 * <pre>
 *   START --viewof|mutable|async--&gt; MODIFIER --name--&gt; NAME --'='--&gt; name
 *   START --name--&gt; NAME
 *   START --function|class--&gt; FUNCTION ('*' skipped) --name--&gt; name
 * </pre>
 *
 * A function or class name is only accepted when more input follows it.
 */
public final class NameProbe {

    private static final Logger logger = LoggerFactory.getLogger(NameProbe.class);

    private static final Set<String> MODIFIERS = Set.of("viewof", "mutable", "async");

    private enum State {
        START,
        MODIFIER,
        NAME,
        FUNCTION
    }

    private NameProbe() {
    }

    /**
     * The declared name of the first cell in {@code input}, or empty when it
     * has none or the tokens give no clear answer. Never throws.
     */
    public static Optional<String> peekId(String input) {
        State state = State.START;
        Token name = null;
        try {
            Lexer lexer = new Lexer(input);
            for (Token token = lexer.nextToken(); token.type() != TokenType.EOF; token = lexer.nextToken()) {
                switch (state) {
                    case START:
                    case MODIFIER:
                        if (token.type() == TokenType.IDENTIFIER) {
                            if (state == State.START && MODIFIERS.contains(token.lexeme())) {
                                state = State.MODIFIER;
                                continue;
                            }
                            state = State.NAME;
                            name = token;
                            continue;
                        }
                        if (token.type() == TokenType.FUNCTION || token.type() == TokenType.CLASS) {
                            state = State.FUNCTION;
                            continue;
                        }
                        break;
                    case NAME:
                        if (token.type() == TokenType.ASSIGN) {
                            return Optional.of(name.lexeme());
                        }
                        break;
                    case FUNCTION:
                        if (token.type() == TokenType.STAR) {
                            continue;
                        }
                        if (token.type() == TokenType.IDENTIFIER && token.endPosition() < input.length()) {
                            return Optional.of(token.lexeme());
                        }
                        break;
                }
                return Optional.empty();
            }
        } catch (ParseException e) {
            logger.debug("No cell name: {} at {}:{}", e.getMessage(), e.line(), e.column());
        } catch (RuntimeException e) {
            logger.warn("Name probe failed", e);
        }
        return Optional.empty();
    }
}
