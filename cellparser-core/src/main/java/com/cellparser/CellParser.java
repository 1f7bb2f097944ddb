package com.cellparser;

import com.cellparser.ast.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses notebook cells: an optional name ({@code x =}, {@code viewof x =},
 * {@code mutable x =}) followed by a block or an expression, or an import
 * declaration with optional {@code with} injections.
 *
 * <p>Cell code is strict mode code and is parsed as the body of an async
 * generator function, so {@code await} and {@code yield} are allowed at the
 * top level. The cell records whether it uses them there.</p>
 *
 * <p>Inside cell code, {@code viewof x} and {@code mutable x} are expressions,
 * and {@code FileAttachment} must be called with a single literal string.</p>
 */
public class CellParser extends Parser {

    private static final Logger logger = LoggerFactory.getLogger(CellParser.class);

    static final String FILE_ATTACHMENT_MESSAGE = "FileAttachment() requires a single literal string as its argument.";
    static final String FILE_ATTACHMENT_REASSIGN_MESSAGE = "FileAttachment() cannot be reassigned.";

    private CellScope scope = new CellScope();

    public CellParser(String source) {
        super(source, true);
    }

    /**
     * Parses a source text holding exactly one cell. References are not
     * resolved; see {@link CellParsing#parseCell(String)}.
     */
    public static Cell parseCell(String source) {
        return new CellParser(source).parseCell();
    }

    public Cell parseCell() {
        return parseCell(true);
    }

    /**
     * Parses the cell at the current token. With {@code eof} the cell must
     * span the whole input; otherwise parsing stops after the cell's
     * terminator.
     */
    protected Cell parseCell(boolean eof) {
        scope = new CellScope();
        Token startToken = peek();
        enterFunctionBody(true, true);

        CellName id = null;
        Node body = null;
        String kind = "empty";

        // Classify with an independent lexer so the primary cursor stays put
        Lexer lookahead = new Lexer(source(), startToken);
        Token token = lookahead.nextToken();

        if (token.type() == TokenType.IMPORT && lookahead.nextToken().type() != TokenType.LPAREN) {
            body = parseImport();
            kind = "import";
        } else if (token.type() != TokenType.EOF && token.type() != TokenType.SEMICOLON) {
            if (token.type() == TokenType.IDENTIFIER) {
                if (token.isContextual("viewof") || token.isContextual("mutable")) {
                    Token name = lookahead.nextToken();
                    if (name.type() != TokenType.IDENTIFIER) {
                        throw new UnexpectedTokenException(name, "cell name");
                    }
                }
                if (lookahead.nextToken().type() == TokenType.ASSIGN) {
                    id = parseCellName();
                    consume(TokenType.ASSIGN, "Expected '=' after cell name");
                }
            }

            if (check(TokenType.LBRACE)) {
                body = parseBlockStatement();
                kind = "block";
            } else {
                if (check(TokenType.FUNCTION)
                    || (peek().isContextual("async") && checkAhead(1, TokenType.FUNCTION))) {
                    scope.expectDeclaredFunction();
                }
                Expression expression = parseExpression();
                // An explicit name wins over the function's or class's own name
                if (id == null) {
                    if (expression instanceof FunctionExpression function) {
                        id = function.id();
                    } else if (expression instanceof ClassExpression classExpression) {
                        id = classExpression.id();
                    }
                }
                body = expression;
                kind = "expression";
            }
        }

        consumeSemicolon("cell");
        if (eof && !isAtEnd()) {
            throw new UnexpectedTokenException(peek(), "cell");
        }
        exitFunctionBody();

        if (logger.isTraceEnabled()) {
            logger.trace("Cell at {}: {} cell, id {}, async {}, generator {}",
                startToken.position(), kind, id == null ? null : id.identifier().name(), scope.async(), scope.generator());
        }

        if (eof) {
            SourceLocation.Position end = positionOf(source().length());
            return new Cell(0, source().length(), 1, 0, end.line(), end.column(),
                id, body, scope.async(), scope.generator(), scope.fileAttachments(), null);
        }
        Token endToken = previous();
        return new Cell(getStart(startToken), getEnd(endToken), startToken.line(), startToken.column(),
            endToken.endLine(), endToken.endColumn(), id, body, scope.async(), scope.generator(),
            scope.fileAttachments(), null);
    }

    private CellName parseCellName() {
        Token token = advance();
        if (token.isContextual("viewof")) {
            return parseModifiedName(token, true);
        }
        if (token.isContextual("mutable")) {
            return parseModifiedName(token, false);
        }
        checkUnreserved(token.lexeme(), token);
        return identifier(token);
    }

    // viewof/mutable already consumed; exactly one identifier follows
    private CellName parseModifiedName(Token keyword, boolean view) {
        Token name = peek();
        if (name.type() != TokenType.IDENTIFIER) {
            throw new UnexpectedTokenException(name, keyword.lexeme());
        }
        advance();
        checkUnreserved(name.lexeme(), name);
        Identifier id = identifier(name);
        if (view) {
            return new ViewExpression(getStart(keyword), getEnd(name), keyword.line(), keyword.column(),
                name.endLine(), name.endColumn(), id);
        }
        return new MutableExpression(getStart(keyword), getEnd(name), keyword.line(), keyword.column(),
            name.endLine(), name.endColumn(), id);
    }

    // ========================================================================
    // Imports
    // ========================================================================

    private ImportDeclaration parseImport() {
        Token importToken = advance();
        List<ImportSpecifier> specifiers = parseImportSpecifiers();
        List<ImportSpecifier> injections = null;
        if (match(TokenType.WITH)) {
            injections = parseImportSpecifiers();
        }
        if (!peek().isContextual("from")) {
            throw new UnexpectedTokenException(peek(), "import declaration");
        }
        advance();
        if (!check(TokenType.STRING)) {
            throw new UnexpectedTokenException(peek(), "import source");
        }
        Literal source = parseStringLiteral();
        Token endToken = previous();
        return new ImportDeclaration(getStart(importToken), getEnd(endToken), importToken.line(), importToken.column(),
            endToken.endLine(), endToken.endColumn(), specifiers, injections, source);
    }

    // '{' [viewof|mutable] name [as local], ... '}' with an optional trailing comma
    private List<ImportSpecifier> parseImportSpecifiers() {
        if (!match(TokenType.LBRACE)) {
            throw new UnexpectedTokenException(peek(), "import specifiers");
        }
        List<ImportSpecifier> specifiers = new ArrayList<>();
        while (!match(TokenType.RBRACE)) {
            if (!specifiers.isEmpty()) {
                if (!match(TokenType.COMMA)) {
                    throw new UnexpectedTokenException(peek(), "import specifiers");
                }
                if (match(TokenType.RBRACE)) {
                    break;
                }
            }
            Token startToken = peek();
            boolean view = false;
            boolean mutable = false;
            if (startToken.isContextual("viewof")) {
                advance();
                view = true;
            } else if (startToken.isContextual("mutable")) {
                advance();
                mutable = true;
            }
            Identifier imported = parseBindingIdentifier();
            Identifier local = imported;
            if (peek().isContextual("as")) {
                advance();
                local = parseBindingIdentifier();
            }
            Token endToken = previous();
            specifiers.add(new ImportSpecifier(getStart(startToken), getEnd(endToken), startToken.line(),
                startToken.column(), endToken.endLine(), endToken.endColumn(), imported, local, view, mutable));
        }
        return specifiers;
    }

    // ========================================================================
    // Expression Extensions
    // ========================================================================

    @Override
    protected Expression parseIdentifierAtom(Token token) {
        if (token.isContextual("viewof")) {
            return (Expression) parseModifiedName(token, true);
        }
        if (token.isContextual("mutable")) {
            return (Expression) parseModifiedName(token, false);
        }
        if (token.isContextual("FileAttachment")) {
            return parseFileAttachment(token);
        }
        return super.parseIdentifierAtom(token);
    }

    // FileAttachment("name") or FileAttachment(`name`); the callee is already consumed
    private Expression parseFileAttachment(Token callee) {
        if (!match(TokenType.LPAREN)) {
            throw errorAt(peek().position(), FILE_ATTACHMENT_REASSIGN_MESSAGE);
        }
        Expression argument;
        String name;
        if (check(TokenType.STRING)) {
            Literal literal = parseStringLiteral();
            argument = literal;
            name = (String) literal.value();
        } else if (check(TokenType.TEMPLATE_LITERAL) || check(TokenType.TEMPLATE_HEAD)) {
            TemplateLiteral template = parseTemplateLiteral(false);
            if (!template.expressions().isEmpty()) {
                throw errorAt(template.expressions().get(0).start(), FILE_ATTACHMENT_MESSAGE);
            }
            argument = template;
            name = template.quasis().get(0).value().cooked();
        } else {
            throw errorAt(peek().position(), FILE_ATTACHMENT_MESSAGE);
        }
        if (!match(TokenType.RPAREN)) {
            throw errorAt(peek().position(), FILE_ATTACHMENT_MESSAGE);
        }
        scope.recordFileAttachment(name, new Span(argument.start(), argument.end()));
        Token endToken = previous();
        return new CallExpression(getStart(callee), getEnd(endToken), callee.line(), callee.column(),
            endToken.endLine(), endToken.endColumn(), identifier(callee), List.of(argument), false);
    }

    @Override
    protected void checkUnreserved(String name, Token token) {
        if (name.equals("viewof") || name.equals("mutable")) {
            throw new ExpectedTokenException("Unexpected keyword '" + name + "'", token);
        }
        super.checkUnreserved(name, token);
    }

    // ========================================================================
    // Async and Generator Tracking
    // ========================================================================

    @Override
    protected Expression parseAwaitExpr() {
        if (isCellLevel()) {
            scope.markAsync();
        }
        return super.parseAwaitExpr();
    }

    @Override
    protected Expression parseYieldExpr() {
        if (isCellLevel()) {
            scope.markGenerator();
        }
        return super.parseYieldExpr();
    }

    @Override
    protected Statement parseForInOf(Token forToken, Node left, boolean isAwait) {
        if (isAwait && isCellLevel()) {
            scope.markAsync();
        }
        return super.parseForInOf(forToken, left, isAwait);
    }

    @Override
    protected void enterFunctionBody(boolean isAsync, boolean isGenerator) {
        boolean atCellLevel = functionDepth() == 1;
        super.enterFunctionBody(isAsync, isGenerator);
        if (atCellLevel) {
            scope.enterFunction();
        }
    }

    @Override
    protected void exitFunctionBody() {
        if (functionDepth() == 2 && scope.inDeclaredFunction()) {
            scope.exitDeclaredFunction();
        }
        super.exitFunctionBody();
    }

    // The cell's own function level, or the body of the function the cell declares
    private boolean isCellLevel() {
        return functionDepth() == 1 || (functionDepth() == 2 && scope.inDeclaredFunction());
    }
}
