package com.cellparser;

import com.cellparser.ast.*;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Parser for ECMAScript 2020 script code: recursive descent for statements,
 * a Pratt loop for expressions.
 *
 * <p>The grammar can be extended by subclasses through the protected hooks
 * {@link #parseIdentifierAtom(Token)}, {@link #parseAwaitExpr()},
 * {@link #parseYieldExpr()}, {@link #parseForInOf(Token, Node, boolean)} and
 * {@link #checkUnreserved(String, Token)}. Every function-like construct
 * (declarations, expressions, arrows, methods, accessors) runs inside
 * {@link #enterFunctionBody(boolean, boolean)} / {@link #exitFunctionBody()},
 * which keep {@link #functionDepth()} current.</p>
 *
 * <p>A parser instance parses one source text once.</p>
 */
public class Parser {
    // ========================================================================
    // Binding Power Constants for Pratt Parser
    // ========================================================================
    // Higher binding power = tighter binding
    private static final int BP_COMMA = 1;          // Comma/Sequence operator
    private static final int BP_ASSIGNMENT = 2;     // Assignment (=, +=, etc.) - right-associative
    private static final int BP_TERNARY = 3;        // Conditional (? :)
    private static final int BP_NULLISH = 4;        // Nullish coalescing (??)
    private static final int BP_OR = 5;             // Logical OR (||)
    private static final int BP_AND = 6;            // Logical AND (&&)
    private static final int BP_BIT_OR = 7;         // Bitwise OR (|)
    private static final int BP_BIT_XOR = 8;        // Bitwise XOR (^)
    private static final int BP_BIT_AND = 9;        // Bitwise AND (&)
    private static final int BP_EQUALITY = 10;      // Equality (==, !=, ===, !==)
    private static final int BP_RELATIONAL = 11;    // Relational (<, <=, >, >=, instanceof, in)
    private static final int BP_SHIFT = 12;         // Shift (<<, >>, >>>)
    private static final int BP_ADDITIVE = 13;      // Additive (+, -)
    private static final int BP_MULTIPLICATIVE = 14;// Multiplicative (*, /, %)
    private static final int BP_EXPONENT = 15;      // Exponentiation (**) - right-associative
    private static final int BP_UNARY = 16;         // Prefix unary (!, -, +, ~, typeof, void, delete, ++, --)
    private static final int BP_POSTFIX = 17;       // Postfix (x++, x--, call, member access, optional chaining)

    // Words that only reach the parser as identifiers when spelled with escapes
    private static final Set<String> RESERVED_WORDS = Set.of(
        "break", "case", "catch", "class", "const", "continue", "debugger", "default", "delete",
        "do", "else", "enum", "export", "extends", "false", "finally", "for", "function", "if",
        "import", "in", "instanceof", "new", "null", "return", "super", "switch", "this", "throw",
        "true", "try", "typeof", "var", "void", "while", "with"
    );

    private static final Set<String> STRICT_RESERVED_WORDS = Set.of(
        "implements", "interface", "let", "package", "private", "protected", "public", "static", "yield"
    );

    private static final Set<TokenType> KEYWORDS = EnumSet.range(TokenType.VAR, TokenType.ENUM);

    private final String source;
    private final Lexer lexer;
    // Tokens scanned so far, and the lexer state before each of them
    private final List<Token> tokens = new ArrayList<>();
    private final List<Lexer.State> lexerStates = new ArrayList<>();
    private final LineInfo lineInfo;
    private int current = 0;
    private boolean allowIn = true;
    private boolean inGenerator = false;
    private boolean inAsyncContext = false;

    // Context flags for super, new.target and return validation
    private boolean inFunction = false;
    private boolean allowNewTarget = false;
    private boolean allowSuperProperty = false;
    private boolean allowSuperCall = false;
    private boolean inDerivedClass = false;
    private boolean inFormalParameters = false;

    // ?? must not be mixed with && or || at the same level
    private boolean inCoalesceChain = false;
    private boolean inLogicalChain = false;

    // break/continue validation; labels map to true for iteration labels
    private int loopDepth = 0;
    private int switchDepth = 0;
    private Map<String, Boolean> labelMap = new HashMap<>();

    private boolean strictMode;
    private int functionDepth = 0;

    // Pratt parser context - outer expression start for infix handlers
    private int exprStartPos = 0;
    private SourceLocation.Position exprStartLoc = null;

    // First `{a = 1}` shorthand seen in an object literal that has not been
    // turned into a pattern yet, and the number of enclosing constructs that
    // may still turn it into one
    private Token pendingCoverInit = null;
    private int coverInitDeferrals = 0;

    // Parenthesized array and object literals, which can never become patterns
    private final Set<Node> parenthesized = Collections.newSetFromMap(new IdentityHashMap<>());

    // ========================================================================
    // Scope Tracking for Redeclaration Validation
    // ========================================================================
    private static final class Scope {
        final Set<String> lexicalDeclarations = new HashSet<>();
        final Set<String> varDeclarations = new HashSet<>();
        final Set<String> functionDeclarations = new HashSet<>();
        final boolean isFunctionScope;

        Scope(boolean isFunctionScope) {
            this.isFunctionScope = isFunctionScope;
        }
    }

    private final ArrayDeque<Scope> scopeStack = new ArrayDeque<>();

    private void pushScope(boolean isFunctionScope) {
        scopeStack.push(new Scope(isFunctionScope));
    }

    private void popScope() {
        scopeStack.pop();
    }

    private void declareLexicalName(Identifier id) {
        Scope scope = scopeStack.peek();
        String name = id.name();
        if (name.equals("let")) {
            throw errorAt(id.start(), "let is disallowed as a lexically bound name");
        }
        if (scope.lexicalDeclarations.contains(name) || scope.varDeclarations.contains(name)
            || scope.functionDeclarations.contains(name)) {
            throw errorAt(id.start(), "Identifier '" + name + "' has already been declared");
        }
        scope.lexicalDeclarations.add(name);
    }

    private void declareVarName(Identifier id) {
        String name = id.name();
        for (Scope scope : scopeStack) {
            if (scope.lexicalDeclarations.contains(name)
                || (!scope.isFunctionScope && scope.functionDeclarations.contains(name))) {
                throw errorAt(id.start(), "Identifier '" + name + "' has already been declared");
            }
            if (scope.isFunctionScope) {
                break;
            }
        }
        // Recorded up to the function boundary so later lexical declarations see the hoisted var
        for (Scope scope : scopeStack) {
            scope.varDeclarations.add(name);
            if (scope.isFunctionScope) {
                break;
            }
        }
    }

    private void declareFunctionName(Identifier id) {
        Scope scope = scopeStack.peek();
        String name = id.name();
        boolean clash = scope.lexicalDeclarations.contains(name)
            || (!scope.isFunctionScope && scope.varDeclarations.contains(name))
            || (!scope.isFunctionScope && strictMode && scope.functionDeclarations.contains(name));
        if (clash) {
            throw errorAt(id.start(), "Identifier '" + name + "' has already been declared");
        }
        scope.functionDeclarations.add(name);
    }

    // ========================================================================
    // Function Context
    // ========================================================================
    private record FunctionContext(
        boolean inFunction,
        boolean inGenerator,
        boolean inAsyncContext,
        boolean allowNewTarget,
        boolean allowSuperProperty,
        boolean allowSuperCall,
        boolean inFormalParameters,
        boolean strictMode,
        boolean allowIn,
        int loopDepth,
        int switchDepth,
        Map<String, Boolean> labelMap
    ) {}

    private FunctionContext saveContext() {
        return new FunctionContext(inFunction, inGenerator, inAsyncContext, allowNewTarget,
            allowSuperProperty, allowSuperCall, inFormalParameters, strictMode, allowIn,
            loopDepth, switchDepth, labelMap);
    }

    private void restoreContext(FunctionContext context) {
        inFunction = context.inFunction();
        inGenerator = context.inGenerator();
        inAsyncContext = context.inAsyncContext();
        allowNewTarget = context.allowNewTarget();
        allowSuperProperty = context.allowSuperProperty();
        allowSuperCall = context.allowSuperCall();
        inFormalParameters = context.inFormalParameters();
        strictMode = context.strictMode();
        allowIn = context.allowIn();
        loopDepth = context.loopDepth();
        switchDepth = context.switchDepth();
        labelMap = context.labelMap();
    }

    /**
     * Opens a function scope: await and yield follow the given flags, return
     * is allowed, loops and labels start empty.
     */
    protected void enterFunctionBody(boolean isAsync, boolean isGenerator) {
        functionDepth++;
        pushScope(true);
        inFunction = true;
        allowNewTarget = true;
        inAsyncContext = isAsync;
        inGenerator = isGenerator;
        inFormalParameters = false;
        allowIn = true;
        loopDepth = 0;
        switchDepth = 0;
        labelMap = new HashMap<>();
    }

    protected void exitFunctionBody() {
        popScope();
        functionDepth--;
    }

    /**
     * Number of function scopes currently open.
     */
    protected final int functionDepth() {
        return functionDepth;
    }

    // ========================================================================
    // Entry Points
    // ========================================================================

    public Parser(String source) {
        this(source, false);
    }

    protected Parser(String source, boolean strict) {
        this.source = source;
        this.lexer = new Lexer(source);
        this.lineInfo = new LineInfo(source);
        this.strictMode = strict;
    }

    public Program parse() {
        pushScope(true);
        List<Statement> body = parseStatementList(TokenType.EOF, true);
        popScope();
        SourceLocation.Position end = lineInfo.position(source.length());
        return new Program(0, source.length(), 1, 0, end.line(), end.column(), body, "script");
    }

    public static Program parseScript(String source) {
        return new Parser(source).parse();
    }

    protected final String source() {
        return source;
    }

    // ========================================================================
    // Statements
    // ========================================================================

    // Statement list items up to the terminator, with a directive prologue when allowed
    private List<Statement> parseStatementList(TokenType terminator, boolean directives) {
        List<Statement> statements = new ArrayList<>();
        boolean inPrologue = directives;
        while (!check(terminator)) {
            if (isAtEnd()) {
                throw new UnexpectedTokenException(peek(), "statement");
            }
            Statement statement = parseStatement();
            if (inPrologue) {
                String directive = directiveOf(statement);
                if (directive == null) {
                    inPrologue = false;
                } else {
                    ExpressionStatement es = (ExpressionStatement) statement;
                    statement = new ExpressionStatement(es.start(), es.end(), es.startLine(), es.startCol(),
                        es.endLine(), es.endCol(), es.expression(), directive);
                    if (directive.equals("use strict")) {
                        strictMode = true;
                    }
                }
            }
            statements.add(statement);
        }
        return statements;
    }

    // The directive text of an unparenthesized string literal statement, else null
    private String directiveOf(Statement statement) {
        if (statement instanceof ExpressionStatement es
            && es.expression() instanceof Literal literal
            && literal.value() instanceof String
            && literal.start() == es.start()
            && literal.regex() == null) {
            return source.substring(literal.start() + 1, literal.end() - 1);
        }
        return null;
    }

    private Statement parseStatement() {
        Token token = peek();
        if (token.type() == TokenType.FUNCTION) {
            advance();
            return parseFunctionDeclaration(token, false);
        }
        if (token.type() == TokenType.CLASS) {
            advance();
            return parseClassDeclaration(token);
        }
        if (token.type() == TokenType.CONST || (token.type() == TokenType.LET && isLetDeclaration())) {
            return parseVariableStatement();
        }
        if (token.isContextual("async") && checkAhead(1, TokenType.FUNCTION)
            && tokenAt(current + 1).line() == token.endLine()) {
            advance();
            advance();
            return parseFunctionDeclaration(token, true);
        }
        return parseNestedStatement();
    }

    // A statement in a position where declarations are not allowed
    private Statement parseNestedStatement() {
        Token token = peek();
        return switch (token.type()) {
            case LBRACE -> parseBlockStatement();
            case SEMICOLON -> parseEmptyStatement();
            case VAR -> parseVariableStatement();
            case IF -> parseIfStatement();
            case FOR -> parseForStatement();
            case WHILE -> parseWhileStatement();
            case DO -> parseDoWhileStatement();
            case RETURN -> parseReturnStatement();
            case BREAK -> parseBreakStatement();
            case CONTINUE -> parseContinueStatement();
            case SWITCH -> parseSwitchStatement();
            case THROW -> parseThrowStatement();
            case TRY -> parseTryStatement();
            case WITH -> parseWithStatement();
            case DEBUGGER -> parseDebuggerStatement();
            case FUNCTION -> {
                if (strictMode) {
                    throw new ExpectedTokenException(
                        "In strict mode code, functions can only be declared at top level or inside a block", token);
                }
                advance();
                yield parseFunctionDeclaration(token, false);
            }
            case CLASS, CONST -> throw new UnexpectedTokenException(token, "statement");
            case LET -> {
                if (checkAhead(1, TokenType.LBRACKET)) {
                    throw new UnexpectedTokenException(token, "statement");
                }
                yield parseExpressionStatement();
            }
            case IMPORT -> {
                if (!checkAhead(1, TokenType.LPAREN)) {
                    throw new ExpectedTokenException("'import' and 'export' may appear only with 'sourceType: module'", token);
                }
                yield parseExpressionStatement();
            }
            case EXPORT -> throw new ExpectedTokenException("'import' and 'export' may appear only with 'sourceType: module'", token);
            case IDENTIFIER -> checkAhead(1, TokenType.COLON) ? parseLabeledStatement() : parseExpressionStatement();
            default -> parseExpressionStatement();
        };
    }

    private boolean isLetDeclaration() {
        return strictMode || checkAhead(1, TokenType.IDENTIFIER) || checkAhead(1, TokenType.LBRACKET)
            || checkAhead(1, TokenType.LBRACE);
    }

    private Statement parseExpressionStatement() {
        Token startToken = peek();
        Expression expression = parseExpression();
        consumeSemicolon("expression statement");
        Token endToken = previous();
        return new ExpressionStatement(getStart(startToken), getEnd(endToken), startToken.line(), startToken.column(),
            endToken.endLine(), endToken.endColumn(), expression, null);
    }

    protected BlockStatement parseBlockStatement() {
        Token lbrace = consume(TokenType.LBRACE, "Expected '{'");
        pushScope(false);
        List<Statement> body = parseStatementList(TokenType.RBRACE, false);
        consume(TokenType.RBRACE, "Expected '}' after block");
        popScope();
        Token endToken = previous();
        return new BlockStatement(getStart(lbrace), getEnd(endToken), lbrace.line(), lbrace.column(),
            endToken.endLine(), endToken.endColumn(), body);
    }

    private EmptyStatement parseEmptyStatement() {
        Token semicolon = advance();
        return new EmptyStatement(getStart(semicolon), getEnd(semicolon), semicolon.line(), semicolon.column(),
            semicolon.endLine(), semicolon.endColumn());
    }

    private DebuggerStatement parseDebuggerStatement() {
        Token debuggerToken = advance();
        consumeSemicolon("debugger statement");
        Token endToken = previous();
        return new DebuggerStatement(getStart(debuggerToken), getEnd(endToken), debuggerToken.line(), debuggerToken.column(),
            endToken.endLine(), endToken.endColumn());
    }

    private VariableDeclaration parseVariableStatement() {
        Token startToken = peek();
        VariableDeclaration declaration = parseVariableDeclaration(false);
        consumeSemicolon("variable declaration");
        Token endToken = previous();
        return new VariableDeclaration(getStart(startToken), getEnd(endToken), startToken.line(), startToken.column(),
            endToken.endLine(), endToken.endColumn(), declaration.declarations(), declaration.kind());
    }

    // var/let/const and its declarators; initializers are checked by the caller inside for heads
    private VariableDeclaration parseVariableDeclaration(boolean inForHead) {
        Token kindToken = advance();
        String kind = kindToken.lexeme();
        List<VariableDeclarator> declarations = new ArrayList<>();
        do {
            Token idToken = peek();
            Pattern id = parseBindingTarget();
            List<Identifier> names = new ArrayList<>();
            collectBindingIdentifiers(id, names);
            for (Identifier name : names) {
                if (kind.equals("var")) {
                    declareVarName(name);
                } else {
                    declareLexicalName(name);
                }
            }
            Expression init = null;
            if (match(TokenType.ASSIGN)) {
                init = parseExpr(BP_ASSIGNMENT);
            } else if (!inForHead) {
                if (kind.equals("const")) {
                    throw new ExpectedTokenException("Missing initializer in const declaration", peek());
                }
                if (!(id instanceof Identifier)) {
                    throw new ExpectedTokenException("Complex binding patterns require an initialization value", peek());
                }
            }
            Token endToken = previous();
            declarations.add(new VariableDeclarator(getStart(idToken), getEnd(endToken), idToken.line(), idToken.column(),
                endToken.endLine(), endToken.endColumn(), id, init));
        } while (match(TokenType.COMMA));
        Token endToken = previous();
        return new VariableDeclaration(getStart(kindToken), getEnd(endToken), kindToken.line(), kindToken.column(),
            endToken.endLine(), endToken.endColumn(), declarations, kind);
    }

    private IfStatement parseIfStatement() {
        Token ifToken = advance();
        consume(TokenType.LPAREN, "Expected '(' after 'if'");
        Expression test = parseExpression();
        consume(TokenType.RPAREN, "Expected ')' after if condition");
        Statement consequent = parseNestedStatement();
        Statement alternate = match(TokenType.ELSE) ? parseNestedStatement() : null;
        Token endToken = previous();
        return new IfStatement(getStart(ifToken), getEnd(endToken), ifToken.line(), ifToken.column(),
            endToken.endLine(), endToken.endColumn(), test, consequent, alternate);
    }

    private WhileStatement parseWhileStatement() {
        Token whileToken = advance();
        consume(TokenType.LPAREN, "Expected '(' after 'while'");
        Expression test = parseExpression();
        consume(TokenType.RPAREN, "Expected ')' after while condition");
        Statement body = parseLoopBody();
        Token endToken = previous();
        return new WhileStatement(getStart(whileToken), getEnd(endToken), whileToken.line(), whileToken.column(),
            endToken.endLine(), endToken.endColumn(), test, body);
    }

    private DoWhileStatement parseDoWhileStatement() {
        Token doToken = advance();
        Statement body = parseLoopBody();
        consume(TokenType.WHILE, "Expected 'while' after do-while body");
        consume(TokenType.LPAREN, "Expected '(' after 'while'");
        Expression test = parseExpression();
        consume(TokenType.RPAREN, "Expected ')' after do-while condition");
        // The semicolon after do-while is always optional
        match(TokenType.SEMICOLON);
        Token endToken = previous();
        return new DoWhileStatement(getStart(doToken), getEnd(endToken), doToken.line(), doToken.column(),
            endToken.endLine(), endToken.endColumn(), body, test);
    }

    private Statement parseLoopBody() {
        loopDepth++;
        Statement body = parseNestedStatement();
        loopDepth--;
        return body;
    }

    private Statement parseForStatement() {
        Token forToken = advance();
        boolean isAwait = false;
        if (peek().isContextual("await")) {
            if (!inAsyncContext) {
                throw new UnexpectedTokenException(peek(), "for statement");
            }
            advance();
            isAwait = true;
        }
        consume(TokenType.LPAREN, "Expected '(' after 'for'");
        pushScope(false);
        Statement statement = parseForRest(forToken, isAwait);
        popScope();
        return statement;
    }

    private Statement parseForRest(Token forToken, boolean isAwait) {
        Node init = null;
        if (check(TokenType.VAR) || check(TokenType.CONST) || (check(TokenType.LET) && isLetDeclaration())) {
            boolean savedAllowIn = allowIn;
            allowIn = false;
            VariableDeclaration declaration = parseVariableDeclaration(true);
            allowIn = savedAllowIn;
            if (check(TokenType.IN) || peek().isContextual("of")) {
                String loop = check(TokenType.IN) ? "for-in" : "for-of";
                if (declaration.declarations().size() != 1) {
                    throw errorAt(declaration.start(), "Must have a single binding.");
                }
                if (declaration.declarations().get(0).init() != null) {
                    throw errorAt(declaration.start(), loop + " loop variable declaration may not have an initializer.");
                }
                return parseForInOf(forToken, declaration, isAwait);
            }
            for (VariableDeclarator declarator : declaration.declarations()) {
                if (declarator.init() == null
                    && (declaration.kind().equals("const") || !(declarator.id() instanceof Identifier))) {
                    throw errorAt(declarator.end(), "Missing initializer in " + declaration.kind() + " declaration");
                }
            }
            init = declaration;
        } else if (!check(TokenType.SEMICOLON)) {
            boolean savedAllowIn = allowIn;
            allowIn = false;
            coverInitDeferrals++;
            Expression expression = parseExpression();
            coverInitDeferrals--;
            allowIn = savedAllowIn;
            if (check(TokenType.IN) || peek().isContextual("of")) {
                return parseForInOf(forToken, toAssignable(expression), isAwait);
            }
            checkCoverInit();
            init = expression;
        }
        if (isAwait) {
            throw new UnexpectedTokenException(peek(), "for await statement");
        }
        consume(TokenType.SEMICOLON, "Expected ';' after for-loop initializer");
        Expression test = check(TokenType.SEMICOLON) ? null : parseExpression();
        consume(TokenType.SEMICOLON, "Expected ';' after for-loop condition");
        Expression update = check(TokenType.RPAREN) ? null : parseExpression();
        consume(TokenType.RPAREN, "Expected ')' after for-loop clauses");
        Statement body = parseLoopBody();
        Token endToken = previous();
        return new ForStatement(getStart(forToken), getEnd(endToken), forToken.line(), forToken.column(),
            endToken.endLine(), endToken.endColumn(), init, test, update, body);
    }

    /**
     * Finishes a for-in or for-of statement; the current token is {@code in}
     * or {@code of}. {@code left} is the declaration or assignment target of
     * the head.
     */
    protected Statement parseForInOf(Token forToken, Node left, boolean isAwait) {
        boolean isOf = peek().isContextual("of");
        if (isAwait && !isOf) {
            throw new UnexpectedTokenException(peek(), "for await statement");
        }
        advance();
        Expression right = isOf ? parseExprAllowIn(BP_ASSIGNMENT) : parseExprAllowIn(BP_COMMA);
        consume(TokenType.RPAREN, "Expected ')' after " + (isOf ? "for-of" : "for-in") + " head");
        Statement body = parseLoopBody();
        Token endToken = previous();
        if (isOf) {
            return new ForOfStatement(getStart(forToken), getEnd(endToken), forToken.line(), forToken.column(),
                endToken.endLine(), endToken.endColumn(), left, right, body, isAwait);
        }
        return new ForInStatement(getStart(forToken), getEnd(endToken), forToken.line(), forToken.column(),
            endToken.endLine(), endToken.endColumn(), left, right, body);
    }

    private ReturnStatement parseReturnStatement() {
        Token returnToken = advance();
        if (!inFunction) {
            throw new ExpectedTokenException("'return' outside of function", returnToken);
        }
        Expression argument = null;
        if (!check(TokenType.SEMICOLON) && !check(TokenType.RBRACE) && !isAtEnd()
            && peek().line() == returnToken.endLine()) {
            argument = parseExpression();
        }
        consumeSemicolon("return statement");
        Token endToken = previous();
        return new ReturnStatement(getStart(returnToken), getEnd(endToken), returnToken.line(), returnToken.column(),
            endToken.endLine(), endToken.endColumn(), argument);
    }

    private BreakStatement parseBreakStatement() {
        Token breakToken = advance();
        Identifier label = null;
        if (check(TokenType.IDENTIFIER) && peek().line() == breakToken.endLine()) {
            Token labelToken = advance();
            if (!labelMap.containsKey(labelToken.lexeme())) {
                throw new ExpectedTokenException("Unsyntactic break", breakToken);
            }
            label = identifier(labelToken);
        } else if (loopDepth == 0 && switchDepth == 0) {
            throw new ExpectedTokenException("Unsyntactic break", breakToken);
        }
        consumeSemicolon("break statement");
        Token endToken = previous();
        return new BreakStatement(getStart(breakToken), getEnd(endToken), breakToken.line(), breakToken.column(),
            endToken.endLine(), endToken.endColumn(), label);
    }

    private ContinueStatement parseContinueStatement() {
        Token continueToken = advance();
        Identifier label = null;
        if (check(TokenType.IDENTIFIER) && peek().line() == continueToken.endLine()) {
            Token labelToken = advance();
            if (!Boolean.TRUE.equals(labelMap.get(labelToken.lexeme()))) {
                throw new ExpectedTokenException("Unsyntactic continue", continueToken);
            }
            label = identifier(labelToken);
        } else if (loopDepth == 0) {
            throw new ExpectedTokenException("Unsyntactic continue", continueToken);
        }
        consumeSemicolon("continue statement");
        Token endToken = previous();
        return new ContinueStatement(getStart(continueToken), getEnd(endToken), continueToken.line(), continueToken.column(),
            endToken.endLine(), endToken.endColumn(), label);
    }

    private LabeledStatement parseLabeledStatement() {
        Token labelToken = advance();
        checkUnreserved(labelToken.lexeme(), labelToken);
        advance(); // ':'
        String name = labelToken.lexeme();
        if (labelMap.containsKey(name)) {
            throw new ExpectedTokenException("Label '" + name + "' is already declared", labelToken);
        }
        labelMap.put(name, check(TokenType.FOR) || check(TokenType.WHILE) || check(TokenType.DO));
        Statement body = parseNestedStatement();
        labelMap.remove(name);
        Token endToken = previous();
        return new LabeledStatement(getStart(labelToken), getEnd(endToken), labelToken.line(), labelToken.column(),
            endToken.endLine(), endToken.endColumn(), identifier(labelToken), body);
    }

    private SwitchStatement parseSwitchStatement() {
        Token switchToken = advance();
        consume(TokenType.LPAREN, "Expected '(' after 'switch'");
        Expression discriminant = parseExpression();
        consume(TokenType.RPAREN, "Expected ')' after switch discriminant");
        consume(TokenType.LBRACE, "Expected '{' before switch body");
        pushScope(false);
        switchDepth++;
        List<SwitchCase> cases = new ArrayList<>();
        boolean sawDefault = false;
        while (!match(TokenType.RBRACE)) {
            Token caseToken = peek();
            Expression test = null;
            if (match(TokenType.CASE)) {
                test = parseExpression();
            } else if (match(TokenType.DEFAULT)) {
                if (sawDefault) {
                    throw new ExpectedTokenException("Multiple default clauses", caseToken);
                }
                sawDefault = true;
            } else {
                throw new UnexpectedTokenException(caseToken, "switch case");
            }
            consume(TokenType.COLON, "Expected ':' after case");
            List<Statement> consequent = new ArrayList<>();
            while (!check(TokenType.CASE) && !check(TokenType.DEFAULT) && !check(TokenType.RBRACE)) {
                if (isAtEnd()) {
                    throw new UnexpectedTokenException(peek(), "switch case");
                }
                consequent.add(parseStatement());
            }
            Token endToken = previous();
            cases.add(new SwitchCase(getStart(caseToken), getEnd(endToken), caseToken.line(), caseToken.column(),
                endToken.endLine(), endToken.endColumn(), test, consequent));
        }
        switchDepth--;
        popScope();
        Token endToken = previous();
        return new SwitchStatement(getStart(switchToken), getEnd(endToken), switchToken.line(), switchToken.column(),
            endToken.endLine(), endToken.endColumn(), discriminant, cases);
    }

    private ThrowStatement parseThrowStatement() {
        Token throwToken = advance();
        if (peek().line() > throwToken.endLine()) {
            throw new ExpectedTokenException("Illegal newline after throw", throwToken);
        }
        Expression argument = parseExpression();
        consumeSemicolon("throw statement");
        Token endToken = previous();
        return new ThrowStatement(getStart(throwToken), getEnd(endToken), throwToken.line(), throwToken.column(),
            endToken.endLine(), endToken.endColumn(), argument);
    }

    private TryStatement parseTryStatement() {
        Token tryToken = advance();
        BlockStatement block = parseBlockStatement();
        CatchClause handler = null;
        if (check(TokenType.CATCH)) {
            Token catchToken = advance();
            pushScope(false);
            Pattern param = null;
            if (match(TokenType.LPAREN)) {
                param = parseBindingTarget();
                List<Identifier> names = new ArrayList<>();
                collectBindingIdentifiers(param, names);
                for (Identifier name : names) {
                    declareLexicalName(name);
                }
                consume(TokenType.RPAREN, "Expected ')' after catch parameter");
            }
            BlockStatement body = parseBlockStatement();
            popScope();
            Token endToken = previous();
            handler = new CatchClause(getStart(catchToken), getEnd(endToken), catchToken.line(), catchToken.column(),
                endToken.endLine(), endToken.endColumn(), param, body);
        }
        BlockStatement finalizer = match(TokenType.FINALLY) ? parseBlockStatement() : null;
        if (handler == null && finalizer == null) {
            throw new ExpectedTokenException("Missing catch or finally clause", tryToken);
        }
        Token endToken = previous();
        return new TryStatement(getStart(tryToken), getEnd(endToken), tryToken.line(), tryToken.column(),
            endToken.endLine(), endToken.endColumn(), block, handler, finalizer);
    }

    private WithStatement parseWithStatement() {
        Token withToken = advance();
        if (strictMode) {
            throw new ExpectedTokenException("'with' in strict mode", withToken);
        }
        consume(TokenType.LPAREN, "Expected '(' after 'with'");
        Expression object = parseExpression();
        consume(TokenType.RPAREN, "Expected ')' after with object");
        Statement body = parseNestedStatement();
        Token endToken = previous();
        return new WithStatement(getStart(withToken), getEnd(endToken), withToken.line(), withToken.column(),
            endToken.endLine(), endToken.endColumn(), object, body);
    }

    // ========================================================================
    // Functions and Classes
    // ========================================================================

    private record FunctionParts(List<Pattern> params, BlockStatement body) {}

    // 'function' (and 'async') already consumed
    private FunctionDeclaration parseFunctionDeclaration(Token startToken, boolean isAsync) {
        boolean isGenerator = match(TokenType.STAR);
        Identifier id = parseBindingIdentifier();
        declareFunctionName(id);
        FunctionContext saved = saveContext();
        enterFunctionBody(isAsync, isGenerator);
        FunctionParts parts = parseFunctionRest(true);
        exitFunctionBody();
        restoreContext(saved);
        Token endToken = previous();
        return new FunctionDeclaration(getStart(startToken), getEnd(endToken), startToken.line(), startToken.column(),
            endToken.endLine(), endToken.endColumn(), id, false, isGenerator, isAsync, parts.params(), parts.body());
    }

    // 'function' (and 'async') already consumed
    private FunctionExpression parseFunctionExpression(Token startToken, boolean isAsync) {
        boolean isGenerator = match(TokenType.STAR);
        FunctionContext saved = saveContext();
        enterFunctionBody(isAsync, isGenerator);
        // The name of a function expression follows the function's own await/yield rules
        Identifier id = check(TokenType.LPAREN) ? null : parseBindingIdentifier();
        FunctionParts parts = parseFunctionRest(true);
        exitFunctionBody();
        restoreContext(saved);
        Token endToken = previous();
        return new FunctionExpression(getStart(startToken), getEnd(endToken), startToken.line(), startToken.column(),
            endToken.endLine(), endToken.endColumn(), id, false, isGenerator, isAsync, parts.params(), parts.body());
    }

    // Method, getter, setter or constructor; the function node starts at '('
    private FunctionExpression parseMethodFunction(boolean isAsync, boolean isGenerator, boolean isConstructor) {
        Token startToken = peek();
        boolean derived = inDerivedClass;
        FunctionContext saved = saveContext();
        enterFunctionBody(isAsync, isGenerator);
        allowSuperProperty = true;
        allowSuperCall = isConstructor && derived;
        FunctionParts parts = parseFunctionRest(false);
        exitFunctionBody();
        restoreContext(saved);
        Token endToken = previous();
        return new FunctionExpression(getStart(startToken), getEnd(endToken), startToken.line(), startToken.column(),
            endToken.endLine(), endToken.endColumn(), null, false, isGenerator, isAsync, parts.params(), parts.body());
    }

    // '(' params ')' '{' body '}' inside an already opened function scope
    private FunctionParts parseFunctionRest(boolean allowDuplicateParams) {
        consume(TokenType.LPAREN, "Expected '(' before parameters");
        List<Pattern> params = parseFormalParameters();
        boolean simple = params.stream().allMatch(p -> p instanceof Identifier);
        declareParameters(params, allowDuplicateParams && simple && !strictMode);
        BlockStatement body = parseFunctionBody(params);
        return new FunctionParts(params, body);
    }

    // After '('; consumes the closing ')'
    private List<Pattern> parseFormalParameters() {
        boolean savedInFormalParameters = inFormalParameters;
        inFormalParameters = true;
        List<Pattern> params = new ArrayList<>();
        while (!match(TokenType.RPAREN)) {
            if (match(TokenType.DOT_DOT_DOT)) {
                Token restStart = previous();
                Pattern argument = parseBindingTarget();
                Token restEnd = previous();
                params.add(new RestElement(getStart(restStart), getEnd(restEnd), restStart.line(), restStart.column(),
                    restEnd.endLine(), restEnd.endColumn(), argument));
                if (check(TokenType.COMMA)) {
                    throw new ExpectedTokenException("Comma is not permitted after the rest element", peek());
                }
                consume(TokenType.RPAREN, "Expected ')' after rest parameter");
                break;
            }
            params.add(parseBindingElement());
            if (!check(TokenType.RPAREN)) {
                consume(TokenType.COMMA, "Expected ',' or ')' in parameter list");
            }
        }
        inFormalParameters = savedInFormalParameters;
        return params;
    }

    private void declareParameters(List<Pattern> params, boolean allowDuplicates) {
        List<Identifier> names = new ArrayList<>();
        for (Pattern param : params) {
            collectBindingIdentifiers(param, names);
        }
        Set<String> seen = new HashSet<>();
        Scope scope = scopeStack.peek();
        for (Identifier name : names) {
            if (!seen.add(name.name()) && !allowDuplicates) {
                throw errorAt(name.start(), "Argument name clash");
            }
            scope.varDeclarations.add(name.name());
        }
    }

    // Function body with its directive prologue; a "use strict" directive re-checks the parameters
    private BlockStatement parseFunctionBody(List<Pattern> params) {
        Token lbrace = consume(TokenType.LBRACE, "Expected '{' before function body");
        boolean wasStrict = strictMode;
        List<Statement> body = parseStatementList(TokenType.RBRACE, true);
        consume(TokenType.RBRACE, "Expected '}' after function body");
        if (strictMode && !wasStrict) {
            if (!params.stream().allMatch(p -> p instanceof Identifier)) {
                throw errorAt(lbrace.position(), "Illegal 'use strict' directive in function with non-simple parameter list");
            }
            Set<String> seen = new HashSet<>();
            for (Pattern param : params) {
                Identifier id = (Identifier) param;
                checkStrictBinding(id.name(), id.start());
                if (!seen.add(id.name())) {
                    throw errorAt(id.start(), "Argument name clash");
                }
            }
        }
        Token endToken = previous();
        return new BlockStatement(getStart(lbrace), getEnd(endToken), lbrace.line(), lbrace.column(),
            endToken.endLine(), endToken.endColumn(), body);
    }

    // current is just past '('; true when the matching ')' is followed by '=>'
    private boolean isArrowFunctionParameters(int index) {
        int depth = 1;
        for (int i = index; ; i++) {
            TokenType type = tokenAt(i).type();
            switch (type) {
                case LPAREN, LBRACKET, LBRACE, TEMPLATE_HEAD -> depth++;
                case RPAREN, RBRACKET, RBRACE, TEMPLATE_TAIL -> depth--;
                case EOF -> {
                    return false;
                }
                default -> {
                }
            }
            if (depth == 0) {
                return type == TokenType.RPAREN && tokenAt(i + 1).type() == TokenType.ARROW;
            }
        }
    }

    // At 'async' (when isAsync), a lone parameter, or '('
    private Expression parseArrowFunction(Token startToken, boolean isAsync) {
        if (isAsync) {
            advance();
        }
        boolean savedInFormalParameters = inFormalParameters;
        boolean savedInAsyncContext = inAsyncContext;
        inFormalParameters = true;
        if (isAsync) {
            inAsyncContext = true;
        }
        List<Pattern> params = new ArrayList<>();
        if (match(TokenType.LPAREN)) {
            params = parseFormalParameters();
        } else {
            params.add(parseBindingIdentifier());
        }
        inFormalParameters = savedInFormalParameters;
        inAsyncContext = savedInAsyncContext;

        Token arrow = peek();
        if (arrow.line() != previous().endLine()) {
            throw new UnexpectedTokenException(arrow, "arrow function");
        }
        consume(TokenType.ARROW, "Expected '=>'");

        FunctionContext saved = saveContext();
        enterFunctionBody(isAsync, false);
        // Arrows see the new.target and super of their enclosing function
        allowNewTarget = saved.allowNewTarget();
        allowSuperProperty = saved.allowSuperProperty();
        allowSuperCall = saved.allowSuperCall();
        allowIn = saved.allowIn();
        declareParameters(params, false);
        Node body;
        boolean expression;
        if (check(TokenType.LBRACE)) {
            allowIn = true;
            body = parseFunctionBody(params);
            expression = false;
        } else {
            body = parseExpr(BP_ASSIGNMENT);
            expression = true;
        }
        exitFunctionBody();
        restoreContext(saved);
        Token endToken = previous();
        return new ArrowFunctionExpression(getStart(startToken), getEnd(endToken), startToken.line(), startToken.column(),
            endToken.endLine(), endToken.endColumn(), null, expression, false, isAsync, params, body);
    }

    private ClassDeclaration parseClassDeclaration(Token classToken) {
        boolean savedStrict = strictMode;
        strictMode = true;
        Identifier id = parseBindingIdentifier();
        strictMode = savedStrict;
        declareLexicalName(id);
        ClassTail tail = parseClassTail();
        Token endToken = previous();
        return new ClassDeclaration(getStart(classToken), getEnd(endToken), classToken.line(), classToken.column(),
            endToken.endLine(), endToken.endColumn(), id, tail.superClass(), tail.body());
    }

    private ClassExpression parseClassExpression(Token classToken) {
        Identifier id = null;
        if (check(TokenType.IDENTIFIER)) {
            boolean savedStrict = strictMode;
            strictMode = true;
            id = parseBindingIdentifier();
            strictMode = savedStrict;
        }
        ClassTail tail = parseClassTail();
        Token endToken = previous();
        return new ClassExpression(getStart(classToken), getEnd(endToken), classToken.line(), classToken.column(),
            endToken.endLine(), endToken.endColumn(), id, tail.superClass(), tail.body());
    }

    private record ClassTail(Expression superClass, ClassBody body) {}

    // Class heritage and body; both are strict mode code
    private ClassTail parseClassTail() {
        boolean savedStrict = strictMode;
        boolean savedDerived = inDerivedClass;
        strictMode = true;
        Expression superClass = null;
        if (match(TokenType.EXTENDS)) {
            superClass = parseExpr(BP_POSTFIX);
        }
        Token lbrace = consume(TokenType.LBRACE, "Expected '{' before class body");
        inDerivedClass = superClass != null;
        List<MethodDefinition> members = new ArrayList<>();
        boolean hasConstructor = false;
        while (!match(TokenType.RBRACE)) {
            if (match(TokenType.SEMICOLON)) {
                continue;
            }
            if (isAtEnd()) {
                throw new UnexpectedTokenException(peek(), "class body");
            }
            MethodDefinition member = parseClassMember();
            if (member.kind().equals("constructor")) {
                if (hasConstructor) {
                    throw errorAt(member.start(), "Duplicate constructor in the same class");
                }
                hasConstructor = true;
            }
            members.add(member);
        }
        Token endToken = previous();
        inDerivedClass = savedDerived;
        strictMode = savedStrict;
        ClassBody body = new ClassBody(getStart(lbrace), getEnd(endToken), lbrace.line(), lbrace.column(),
            endToken.endLine(), endToken.endColumn(), members);
        return new ClassTail(superClass, body);
    }

    private MethodDefinition parseClassMember() {
        Token startToken = peek();
        boolean isStatic = false;
        if (startToken.isContextual("static") && !isPropertyNameEnd(tokenAt(current + 1))) {
            advance();
            isStatic = true;
        }
        Token modifier = peek();
        boolean isAsync = false;
        String kind = "method";
        if (modifier.isContextual("async") && !isPropertyNameEnd(tokenAt(current + 1))
            && tokenAt(current + 1).line() == modifier.endLine()) {
            advance();
            isAsync = true;
        } else if ((modifier.isContextual("get") || modifier.isContextual("set"))
            && !isPropertyNameEnd(tokenAt(current + 1))) {
            advance();
            kind = modifier.lexeme();
        }
        boolean isGenerator = match(TokenType.STAR);
        boolean computed = check(TokenType.LBRACKET);
        Expression key = parsePropertyKey();
        String name = computed ? null : propertyName(key);

        boolean isConstructor = !isStatic && "constructor".equals(name);
        if (isConstructor) {
            if (!kind.equals("method")) {
                throw errorAt(key.start(), "Constructor can't have get/set modifier");
            }
            if (isAsync) {
                throw errorAt(key.start(), "Constructor can't be an async method");
            }
            if (isGenerator) {
                throw errorAt(key.start(), "Constructor can't be a generator");
            }
            kind = "constructor";
        }
        if (isStatic && "prototype".equals(name)) {
            throw errorAt(key.start(), "Classes may not have a static property named prototype");
        }
        FunctionExpression value = parseMethodFunction(isAsync, isGenerator, isConstructor);
        checkAccessorParams(kind, value);
        Token endToken = previous();
        return new MethodDefinition(getStart(startToken), getEnd(endToken), startToken.line(), startToken.column(),
            endToken.endLine(), endToken.endColumn(), key, value, kind, computed, isStatic);
    }

    private void checkAccessorParams(String kind, FunctionExpression value) {
        if (kind.equals("get") && !value.params().isEmpty()) {
            throw errorAt(value.start(), "getter should have no params");
        }
        if (kind.equals("set")) {
            if (value.params().size() != 1) {
                throw errorAt(value.start(), "setter should have exactly one param");
            }
            if (value.params().get(0) instanceof RestElement) {
                throw errorAt(value.params().get(0).start(), "Setter cannot use rest params");
            }
        }
    }

    // A token that ends a property name, so a preceding get/set/async/static is the name itself
    private static boolean isPropertyNameEnd(Token token) {
        return switch (token.type()) {
            case COMMA, COLON, LPAREN, RBRACE, ASSIGN, SEMICOLON, EOF -> true;
            default -> false;
        };
    }

    private static String propertyName(Node key) {
        if (key instanceof Identifier id) {
            return id.name();
        }
        if (key instanceof Literal literal && literal.value() instanceof String s) {
            return s;
        }
        return null;
    }

    // Identifier names (keywords included), strings, numbers or [computed]
    private Expression parsePropertyKey() {
        Token token = peek();
        if (token.type() == TokenType.LBRACKET) {
            advance();
            Expression key = parseExprAllowIn(BP_ASSIGNMENT);
            consume(TokenType.RBRACKET, "Expected ']' after computed property name");
            return key;
        }
        if (token.type() == TokenType.STRING) {
            advance();
            return prefixString(this, token);
        }
        if (token.type() == TokenType.NUMBER) {
            advance();
            return prefixNumber(this, token);
        }
        if (isIdentifierName(token)) {
            advance();
            return identifier(token);
        }
        throw new UnexpectedTokenException(token, "property name");
    }

    // ========================================================================
    // Binding Patterns
    // ========================================================================

    private Pattern parseBindingTarget() {
        Token token = peek();
        if (match(TokenType.LBRACKET)) {
            return parseArrayPattern(token);
        }
        if (match(TokenType.LBRACE)) {
            return parseObjectPattern(token);
        }
        return parseBindingIdentifier();
    }

    private Pattern parseBindingElement() {
        Token startToken = peek();
        Pattern target = parseBindingTarget();
        if (match(TokenType.ASSIGN)) {
            Expression defaultValue = parseExprAllowIn(BP_ASSIGNMENT);
            Token endToken = previous();
            return new AssignmentPattern(getStart(startToken), getEnd(endToken), startToken.line(), startToken.column(),
                endToken.endLine(), endToken.endColumn(), target, defaultValue);
        }
        return target;
    }

    protected Identifier parseBindingIdentifier() {
        Token token = peek();
        if (!check(TokenType.IDENTIFIER) && !(check(TokenType.LET) && !strictMode)) {
            if (KEYWORDS.contains(token.type())) {
                throw new ExpectedTokenException("Unexpected keyword '" + token.lexeme() + "'", token);
            }
            throw new UnexpectedTokenException(token, "binding identifier");
        }
        advance();
        checkUnreserved(token.lexeme(), token);
        checkStrictBinding(token.lexeme(), token.position());
        return identifier(token);
    }

    private ArrayPattern parseArrayPattern(Token lbracket) {
        List<Pattern> elements = new ArrayList<>();
        while (!match(TokenType.RBRACKET)) {
            if (match(TokenType.COMMA)) {
                elements.add(null);
                continue;
            }
            if (match(TokenType.DOT_DOT_DOT)) {
                Token restStart = previous();
                Pattern argument = parseBindingTarget();
                Token restEnd = previous();
                elements.add(new RestElement(getStart(restStart), getEnd(restEnd), restStart.line(), restStart.column(),
                    restEnd.endLine(), restEnd.endColumn(), argument));
                if (check(TokenType.COMMA)) {
                    throw new ExpectedTokenException("Comma is not permitted after the rest element", peek());
                }
                consume(TokenType.RBRACKET, "Expected ']' after rest element");
                break;
            }
            elements.add(parseBindingElement());
            if (!check(TokenType.RBRACKET)) {
                consume(TokenType.COMMA, "Expected ',' or ']' in array pattern");
            }
        }
        Token endToken = previous();
        return new ArrayPattern(getStart(lbracket), getEnd(endToken), lbracket.line(), lbracket.column(),
            endToken.endLine(), endToken.endColumn(), elements);
    }

    private ObjectPattern parseObjectPattern(Token lbrace) {
        List<Node> properties = new ArrayList<>();
        while (!match(TokenType.RBRACE)) {
            if (match(TokenType.DOT_DOT_DOT)) {
                Token restStart = previous();
                Identifier argument = parseBindingIdentifier();
                Token restEnd = previous();
                properties.add(new RestElement(getStart(restStart), getEnd(restEnd), restStart.line(), restStart.column(),
                    restEnd.endLine(), restEnd.endColumn(), argument));
                if (check(TokenType.COMMA)) {
                    throw new ExpectedTokenException("Comma is not permitted after the rest element", peek());
                }
                consume(TokenType.RBRACE, "Expected '}' after rest element");
                break;
            }
            properties.add(parseBindingProperty());
            if (!check(TokenType.RBRACE)) {
                consume(TokenType.COMMA, "Expected ',' or '}' in object pattern");
            }
        }
        Token endToken = previous();
        return new ObjectPattern(getStart(lbrace), getEnd(endToken), lbrace.line(), lbrace.column(),
            endToken.endLine(), endToken.endColumn(), properties);
    }

    private Property parseBindingProperty() {
        Token keyToken = peek();
        boolean computed = check(TokenType.LBRACKET);
        Expression key = parsePropertyKey();
        Pattern value;
        boolean shorthand = false;
        if (match(TokenType.COLON)) {
            value = parseBindingElement();
        } else {
            if (computed || keyToken.type() != TokenType.IDENTIFIER) {
                throw new UnexpectedTokenException(peek(), "object pattern");
            }
            checkUnreserved(keyToken.lexeme(), keyToken);
            checkStrictBinding(keyToken.lexeme(), keyToken.position());
            Identifier id = identifier(keyToken);
            value = id;
            if (match(TokenType.ASSIGN)) {
                Expression defaultValue = parseExprAllowIn(BP_ASSIGNMENT);
                Token endToken = previous();
                value = new AssignmentPattern(getStart(keyToken), getEnd(endToken), keyToken.line(), keyToken.column(),
                    endToken.endLine(), endToken.endColumn(), id, defaultValue);
            }
            shorthand = true;
        }
        Token endToken = previous();
        return new Property(getStart(keyToken), getEnd(endToken), keyToken.line(), keyToken.column(),
            endToken.endLine(), endToken.endColumn(), key, value, "init", false, shorthand, computed);
    }

    static void collectBindingIdentifiers(Node pattern, List<Identifier> names) {
        if (pattern instanceof Identifier id) {
            names.add(id);
        } else if (pattern instanceof ObjectPattern object) {
            for (Node property : object.properties()) {
                if (property instanceof Property p) {
                    collectBindingIdentifiers(p.value(), names);
                } else {
                    collectBindingIdentifiers(property, names);
                }
            }
        } else if (pattern instanceof ArrayPattern array) {
            for (Pattern element : array.elements()) {
                if (element != null) {
                    collectBindingIdentifiers(element, names);
                }
            }
        } else if (pattern instanceof RestElement rest) {
            collectBindingIdentifiers(rest.argument(), names);
        } else if (pattern instanceof AssignmentPattern assignment) {
            collectBindingIdentifiers(assignment.left(), names);
        }
    }

    // ========================================================================
    // Assignment Targets
    // ========================================================================

    // Reinterprets an expression (array and object literals included) as an assignment target
    private Pattern toAssignable(Node node) {
        if (node instanceof ObjectExpression object) {
            if (parenthesized.contains(object)) {
                throw errorAt(object.start(), "Parenthesized pattern");
            }
            List<Node> properties = new ArrayList<>();
            List<Node> members = object.properties();
            for (int i = 0; i < members.size(); i++) {
                Node member = members.get(i);
                if (member instanceof SpreadElement spread) {
                    if (i != members.size() - 1) {
                        throw errorAt(spread.start(), "Comma is not permitted after the rest element");
                    }
                    properties.add(toRestElement(spread));
                } else {
                    Property property = (Property) member;
                    if (!property.kind().equals("init") || property.method()) {
                        throw errorAt(property.key().start(), "Object pattern can't contain getter or setter");
                    }
                    properties.add(new Property(property.start(), property.end(), property.startLine(), property.startCol(),
                        property.endLine(), property.endCol(), property.key(), toAssignable(property.value()),
                        "init", false, property.shorthand(), property.computed()));
                }
            }
            if (pendingCoverInit != null && pendingCoverInit.position() >= object.start()
                && pendingCoverInit.position() < object.end()) {
                pendingCoverInit = null;
            }
            return new ObjectPattern(object.start(), object.end(), object.startLine(), object.startCol(),
                object.endLine(), object.endCol(), properties);
        }
        if (node instanceof ArrayExpression array) {
            if (parenthesized.contains(array)) {
                throw errorAt(array.start(), "Parenthesized pattern");
            }
            List<Pattern> elements = new ArrayList<>();
            List<Expression> items = array.elements();
            for (int i = 0; i < items.size(); i++) {
                Expression item = items.get(i);
                if (item == null) {
                    elements.add(null);
                } else if (item instanceof SpreadElement spread) {
                    if (i != items.size() - 1) {
                        throw errorAt(spread.start(), "Comma is not permitted after the rest element");
                    }
                    elements.add(toRestElement(spread));
                } else {
                    elements.add(toAssignable(item));
                }
            }
            return new ArrayPattern(array.start(), array.end(), array.startLine(), array.startCol(),
                array.endLine(), array.endCol(), elements);
        }
        if (node instanceof AssignmentExpression assignment && assignment.operator().equals("=")) {
            return new AssignmentPattern(assignment.start(), assignment.end(), assignment.startLine(), assignment.startCol(),
                assignment.endLine(), assignment.endCol(), assignment.left(), assignment.right());
        }
        if (node instanceof Expression expression) {
            return toSimpleTarget(expression);
        }
        throw errorAt(node.start(), "Assigning to rvalue");
    }

    private RestElement toRestElement(SpreadElement spread) {
        Pattern argument = toAssignable(spread.argument());
        if (argument instanceof AssignmentPattern) {
            throw errorAt(argument.start(), "Rest elements cannot have a default value");
        }
        return new RestElement(spread.start(), spread.end(), spread.startLine(), spread.startCol(),
            spread.endLine(), spread.endCol(), argument);
    }

    // Targets of compound assignment and update: member expressions and assignable names
    private Pattern toSimpleTarget(Expression expression) {
        if (expression instanceof MemberExpression member) {
            return member;
        }
        if (expression instanceof CellName name && name.assignable()) {
            if (name instanceof Identifier id && strictMode
                && (id.name().equals("eval") || id.name().equals("arguments"))) {
                throw errorAt(id.start(), "Assigning to " + id.name() + " in strict mode");
            }
            return (Pattern) name;
        }
        throw errorAt(expression.start(), "Assigning to rvalue");
    }

    private void checkCoverInit() {
        if (pendingCoverInit != null) {
            throw new ExpectedTokenException("Shorthand property assignments are valid only in destructuring patterns",
                pendingCoverInit);
        }
    }

    // ========================================================================
    // Expressions
    // ========================================================================

    protected Expression parseExpression() {
        return parseExpr(BP_COMMA);
    }

    private Expression parseExprAllowIn(int minBp) {
        boolean savedAllowIn = allowIn;
        allowIn = true;
        Expression expression = parseExpr(minBp);
        allowIn = savedAllowIn;
        return expression;
    }

    private Expression parseExpr(int minBp) {
        Token startToken = peek();
        TokenType startType = startToken.type();
        Expression left = null;

        // ??, && and || may be mixed again inside a fresh expression context
        boolean savedInCoalesceChain = inCoalesceChain;
        boolean savedInLogicalChain = inLogicalChain;
        boolean shouldResetChainFlags = minBp <= BP_TERNARY;
        if (shouldResetChainFlags) {
            inCoalesceChain = false;
            inLogicalChain = false;
        }

        if (startType == TokenType.IDENTIFIER && !startToken.escaped()) {
            String lexeme = startToken.lexeme();
            if (lexeme.equals("yield") && inGenerator && minBp <= BP_ASSIGNMENT) {
                left = parseYieldExpr();
            } else if (lexeme.equals("await") && inAsyncContext) {
                left = parseAwaitExpr();
            }
        }

        // Arrow functions: id =>, async id =>, (params) =>, async (params) =>
        if (left == null && minBp <= BP_ASSIGNMENT) {
            if (startType == TokenType.IDENTIFIER || (startType == TokenType.LET && !strictMode)) {
                if (checkAhead(1, TokenType.ARROW)) {
                    left = parseArrowFunction(startToken, false);
                } else if (startToken.isContextual("async") && tokenAt(current + 1).line() == startToken.endLine()) {
                    Token next = tokenAt(current + 1);
                    if (next.type() == TokenType.IDENTIFIER && checkAhead(2, TokenType.ARROW)) {
                        left = parseArrowFunction(startToken, true);
                    } else if (next.type() == TokenType.LPAREN && isArrowFunctionParameters(current + 2)) {
                        left = parseArrowFunction(startToken, true);
                    }
                }
            } else if (startType == TokenType.LPAREN && isArrowFunctionParameters(current + 1)) {
                left = parseArrowFunction(startToken, false);
            }
        }

        if (left == null) {
            left = parsePrefix();
        }

        // ========================================================================
        // Infix loop (LED - Left Denotation)
        // ========================================================================

        int outerStartPos = getStart(startToken);
        SourceLocation.Position outerStartLoc = new SourceLocation.Position(startToken.line(), startToken.column());

        boolean hasOptionalChaining = false;

        while (true) {
            Token token = peek();

            // A bare yield with no argument ends at a line break
            if (left instanceof YieldExpression ye && ye.argument() == null && left.start() == outerStartPos
                && previous().endLine() < token.line()) {
                break;
            }

            // After an operand a slash is division
            if (token.type() == TokenType.REGEX) {
                token = rescanSlash(Lexer.SlashMode.DIVISION);
            }

            // Postfix ++/-- with the no-line-terminator restriction
            if (token.type() == TokenType.INCREMENT || token.type() == TokenType.DECREMENT) {
                if (previous().endLine() < token.line() || BP_POSTFIX < minBp) {
                    break;
                }
                if (hasOptionalChaining) {
                    throw errorAt(left.start(), "Assigning to rvalue");
                }
                Pattern target = toSimpleTarget(left);
                advance();
                Token endToken = previous();
                left = new UpdateExpression(outerStartPos, getEnd(endToken), startToken.line(), startToken.column(),
                    endToken.endLine(), endToken.endColumn(), token.lexeme(), false, (Expression) target);
                continue;
            }

            TokenType tt = token.type();
            int lbp = switch (tt) {
                case COMMA -> BP_COMMA;
                case ASSIGN, PLUS_ASSIGN, MINUS_ASSIGN, STAR_ASSIGN, SLASH_ASSIGN, PERCENT_ASSIGN,
                     STAR_STAR_ASSIGN, LEFT_SHIFT_ASSIGN, RIGHT_SHIFT_ASSIGN, UNSIGNED_RIGHT_SHIFT_ASSIGN,
                     BIT_AND_ASSIGN, BIT_OR_ASSIGN, BIT_XOR_ASSIGN -> BP_ASSIGNMENT;
                case QUESTION -> BP_TERNARY;
                case QUESTION_QUESTION -> BP_NULLISH;
                case OR -> BP_OR;
                case AND -> BP_AND;
                case BIT_OR -> BP_BIT_OR;
                case BIT_XOR -> BP_BIT_XOR;
                case BIT_AND -> BP_BIT_AND;
                case EQ, NE, EQ_STRICT, NE_STRICT -> BP_EQUALITY;
                case LT, LE, GT, GE, INSTANCEOF, IN -> BP_RELATIONAL;
                case LEFT_SHIFT, RIGHT_SHIFT, UNSIGNED_RIGHT_SHIFT -> BP_SHIFT;
                case PLUS, MINUS -> BP_ADDITIVE;
                case STAR, SLASH, PERCENT -> BP_MULTIPLICATIVE;
                case STAR_STAR -> BP_EXPONENT;
                case DOT, QUESTION_DOT, LBRACKET, LPAREN, TEMPLATE_LITERAL, TEMPLATE_HEAD -> BP_POSTFIX;
                default -> -1;
            };

            if (lbp < 0 || lbp < minBp) {
                break;
            }
            if (tt == TokenType.IN && !allowIn) {
                break;
            }

            // An arrow function with a block body cannot be called or indexed on the next line
            if (previous().endLine() < token.line() && (tt == TokenType.LBRACKET || tt == TokenType.LPAREN)
                && left instanceof ArrowFunctionExpression arrow && arrow.body() instanceof BlockStatement) {
                break;
            }

            if (hasOptionalChaining && (tt == TokenType.TEMPLATE_LITERAL || tt == TokenType.TEMPLATE_HEAD)) {
                throw new ExpectedTokenException("Optional chaining cannot appear in the tag of tagged template expressions", token);
            }

            boolean isChainOperator = tt == TokenType.QUESTION_DOT
                || (hasOptionalChaining && (tt == TokenType.DOT || tt == TokenType.LBRACKET || tt == TokenType.LPAREN));
            if (tt == TokenType.QUESTION_DOT) {
                hasOptionalChaining = true;
            } else if (hasOptionalChaining && !isChainOperator) {
                Token chainEndToken = previous();
                left = new ChainExpression(outerStartPos, getEnd(chainEndToken), startToken.line(), startToken.column(),
                    chainEndToken.endLine(), chainEndToken.endColumn(), left);
                hasOptionalChaining = false;
            }

            if (tt == TokenType.QUESTION_QUESTION && inLogicalChain) {
                throw new ExpectedTokenException("Logical expressions and coalesce expressions cannot be mixed. Wrap either by parentheses", token);
            }
            if ((tt == TokenType.AND || tt == TokenType.OR) && inCoalesceChain) {
                throw new ExpectedTokenException("Logical expressions and coalesce expressions cannot be mixed. Wrap either by parentheses", token);
            }
            if (tt == TokenType.QUESTION_QUESTION) {
                inCoalesceChain = true;
            } else if (tt == TokenType.AND || tt == TokenType.OR) {
                inLogicalChain = true;
            }

            advance();
            Token opToken = previous();
            exprStartPos = outerStartPos;
            exprStartLoc = outerStartLoc;
            left = switch (tt) {
                case COMMA -> infixComma(this, left, opToken);
                case ASSIGN, PLUS_ASSIGN, MINUS_ASSIGN, STAR_ASSIGN, SLASH_ASSIGN, PERCENT_ASSIGN,
                     STAR_STAR_ASSIGN, LEFT_SHIFT_ASSIGN, RIGHT_SHIFT_ASSIGN, UNSIGNED_RIGHT_SHIFT_ASSIGN,
                     BIT_AND_ASSIGN, BIT_OR_ASSIGN, BIT_XOR_ASSIGN -> infixAssignment(this, left, opToken);
                case QUESTION -> infixTernary(this, left, opToken);
                case QUESTION_QUESTION, OR, AND -> infixLogical(this, left, opToken);
                case DOT -> infixMember(this, left, opToken);
                case QUESTION_DOT -> infixOptionalChain(this, left, opToken);
                case LBRACKET -> infixComputed(this, left, opToken);
                case LPAREN -> infixCall(this, left, opToken);
                case TEMPLATE_LITERAL, TEMPLATE_HEAD -> infixTaggedTemplate(this, left, opToken);
                default -> infixBinary(this, left, opToken);
            };
        }

        if (hasOptionalChaining) {
            Token endToken = previous();
            left = new ChainExpression(outerStartPos, getEnd(endToken), startToken.line(), startToken.column(),
                endToken.endLine(), endToken.endColumn(), left);
        }

        if (shouldResetChainFlags) {
            inCoalesceChain = savedInCoalesceChain;
            inLogicalChain = savedInLogicalChain;
        }

        if (minBp <= BP_ASSIGNMENT && coverInitDeferrals == 0) {
            checkCoverInit();
        }

        return left;
    }

    // Prefix handling (NUD - Null Denotation)
    private Expression parsePrefix() {
        Token token = peek();
        if (token.type() == TokenType.SLASH || token.type() == TokenType.SLASH_ASSIGN) {
            token = rescanSlash(Lexer.SlashMode.REGEX);
        }
        advance();
        return switch (token.type()) {
            case NUMBER -> prefixNumber(this, token);
            case STRING -> prefixString(this, token);
            case TRUE -> prefixTrue(this, token);
            case FALSE -> prefixFalse(this, token);
            case NULL -> prefixNull(this, token);
            case REGEX -> prefixRegex(this, token);
            case IDENTIFIER -> prefixIdentifier(this, token);
            case LET -> prefixLet(this, token);
            case THIS -> prefixThis(this, token);
            case SUPER -> prefixSuper(this, token);
            case LPAREN -> prefixGrouped(this, token);
            case LBRACKET -> prefixArray(this, token);
            case LBRACE -> prefixObject(this, token);
            case FUNCTION -> prefixFunction(this, token);
            case CLASS -> prefixClass(this, token);
            case NEW -> prefixNew(this, token);
            case BANG, MINUS, PLUS, TILDE, TYPEOF, VOID, DELETE -> prefixUnary(this, token);
            case INCREMENT, DECREMENT -> prefixUpdate(this, token);
            case TEMPLATE_LITERAL, TEMPLATE_HEAD -> prefixTemplate(this, token);
            case IMPORT -> prefixImport(this, token);
            default -> {
                if (KEYWORDS.contains(token.type())) {
                    throw new ExpectedTokenException("Unexpected keyword '" + token.lexeme() + "'", token);
                }
                throw new UnexpectedTokenException(token, "expression");
            }
        };
    }

    // ========================================================================
    // Prefix Handlers (NUD)
    // ========================================================================

    private static Expression prefixNumber(Parser p, Token token) {
        String lexeme = token.lexeme();
        if (lexeme.endsWith("n")) {
            String digits = lexeme.substring(0, lexeme.length() - 1);
            String bigint = digits;
            if (digits.length() > 2 && digits.charAt(0) == '0') {
                int radix = switch (Character.toLowerCase(digits.charAt(1))) {
                    case 'x' -> 16;
                    case 'o' -> 8;
                    case 'b' -> 2;
                    default -> 10;
                };
                if (radix != 10) {
                    bigint = new java.math.BigInteger(digits.substring(2), radix).toString();
                }
            }
            return new Literal(p.getStart(token), p.getEnd(token), token.line(), token.column(), token.endLine(),
                token.endColumn(), null, lexeme, null, bigint);
        }
        if (p.strictMode && lexeme.length() > 1 && lexeme.charAt(0) == '0' && Character.isDigit(lexeme.charAt(1))) {
            throw new ExpectedTokenException("Invalid number", token);
        }
        // Infinity has no JSON form; ESTree leaves the value null
        Object value = token.literal();
        if (value instanceof Double d && (d.isInfinite() || d.isNaN())) {
            value = null;
        }
        return new Literal(p.getStart(token), p.getEnd(token), token.line(), token.column(), token.endLine(),
            token.endColumn(), value, lexeme, null, null);
    }

    private static Literal prefixString(Parser p, Token token) {
        if (p.strictMode && hasOctalEscape(token.lexeme())) {
            throw new ExpectedTokenException("Octal literal in strict mode", token);
        }
        return new Literal(p.getStart(token), p.getEnd(token), token.line(), token.column(), token.endLine(),
            token.endColumn(), token.literal(), token.lexeme(), null, null);
    }

    // \1 to \7, or \0 followed by a digit
    private static boolean hasOctalEscape(String raw) {
        for (int i = 0; i < raw.length() - 1; i++) {
            if (raw.charAt(i) == '\\') {
                char next = raw.charAt(i + 1);
                if (next >= '1' && next <= '7') {
                    return true;
                }
                if (next == '0' && i + 2 < raw.length() && Character.isDigit(raw.charAt(i + 2))) {
                    return true;
                }
                i++;
            }
        }
        return false;
    }

    private static Expression prefixTrue(Parser p, Token token) {
        return new Literal(p.getStart(token), p.getEnd(token), token.line(), token.column(), token.endLine(),
            token.endColumn(), true, "true", null, null);
    }

    private static Expression prefixFalse(Parser p, Token token) {
        return new Literal(p.getStart(token), p.getEnd(token), token.line(), token.column(), token.endLine(),
            token.endColumn(), false, "false", null, null);
    }

    private static Expression prefixNull(Parser p, Token token) {
        return new Literal(p.getStart(token), p.getEnd(token), token.line(), token.column(), token.endLine(),
            token.endColumn(), null, "null", null, null);
    }

    private static Expression prefixRegex(Parser p, Token token) {
        // The value is an empty object; the pattern and flags go in 'regex'
        Literal.RegexInfo regexInfo = (Literal.RegexInfo) token.literal();
        return new Literal(p.getStart(token), p.getEnd(token), token.line(), token.column(), token.endLine(),
            token.endColumn(), Collections.emptyMap(), token.lexeme(), regexInfo, null);
    }

    private static Expression prefixIdentifier(Parser p, Token token) {
        return p.parseIdentifierAtom(token);
    }

    private static Expression prefixLet(Parser p, Token token) {
        if (p.strictMode) {
            throw new ExpectedTokenException("The keyword 'let' is reserved", token);
        }
        return p.identifier(token);
    }

    private static Expression prefixThis(Parser p, Token token) {
        return new ThisExpression(p.getStart(token), p.getEnd(token), token.line(), token.column(), token.endLine(),
            token.endColumn());
    }

    private static Expression prefixSuper(Parser p, Token token) {
        if (p.check(TokenType.LPAREN)) {
            if (!p.allowSuperCall) {
                throw new ExpectedTokenException("super() call outside constructor of a subclass", token);
            }
        } else if (p.check(TokenType.DOT) || p.check(TokenType.LBRACKET)) {
            if (!p.allowSuperProperty) {
                throw new ExpectedTokenException("'super' keyword outside a method", token);
            }
        } else {
            throw new UnexpectedTokenException(p.peek(), "super");
        }
        return new Super(p.getStart(token), p.getEnd(token), token.line(), token.column(), token.endLine(),
            token.endColumn());
    }

    private static Expression prefixGrouped(Parser p, Token lparen) {
        if (p.check(TokenType.RPAREN)) {
            throw new UnexpectedTokenException(p.peek(), "parenthesized expression");
        }
        Expression expression = p.parseExprAllowIn(BP_COMMA);
        p.consume(TokenType.RPAREN, "Expected ')' after expression");
        if (expression instanceof ObjectExpression || expression instanceof ArrayExpression) {
            p.parenthesized.add(expression);
        }
        return expression;
    }

    private static Expression prefixArray(Parser p, Token lbracket) {
        p.coverInitDeferrals++;
        List<Expression> elements = new ArrayList<>();
        while (!p.match(TokenType.RBRACKET)) {
            if (p.match(TokenType.COMMA)) {
                elements.add(null); // hole
                continue;
            }
            if (p.match(TokenType.DOT_DOT_DOT)) {
                elements.add(p.finishSpread(p.previous()));
            } else {
                elements.add(p.parseExprAllowIn(BP_ASSIGNMENT));
            }
            if (!p.check(TokenType.RBRACKET)) {
                p.consume(TokenType.COMMA, "Expected ',' or ']' in array literal");
            }
        }
        p.coverInitDeferrals--;
        Token endToken = p.previous();
        return new ArrayExpression(p.getStart(lbracket), p.getEnd(endToken), lbracket.line(), lbracket.column(),
            endToken.endLine(), endToken.endColumn(), elements);
    }

    private static Expression prefixObject(Parser p, Token lbrace) {
        p.coverInitDeferrals++;
        List<Node> properties = new ArrayList<>();
        while (!p.match(TokenType.RBRACE)) {
            properties.add(p.parseObjectMember());
            if (!p.check(TokenType.RBRACE)) {
                p.consume(TokenType.COMMA, "Expected ',' or '}' in object literal");
            }
        }
        p.coverInitDeferrals--;
        Token endToken = p.previous();
        return new ObjectExpression(p.getStart(lbrace), p.getEnd(endToken), lbrace.line(), lbrace.column(),
            endToken.endLine(), endToken.endColumn(), properties);
    }

    private static Expression prefixFunction(Parser p, Token token) {
        return p.parseFunctionExpression(token, false);
    }

    private static Expression prefixClass(Parser p, Token token) {
        return p.parseClassExpression(token);
    }

    private static Expression prefixNew(Parser p, Token newToken) {
        if (p.match(TokenType.DOT)) {
            Token property = p.peek();
            if (!property.isContextual("target")) {
                throw new ExpectedTokenException("The only valid meta property for new is 'new.target'", property);
            }
            p.advance();
            if (!p.allowNewTarget) {
                throw new ExpectedTokenException("'new.target' can only be used in functions", newToken);
            }
            return new MetaProperty(p.getStart(newToken), p.getEnd(property), newToken.line(), newToken.column(),
                property.endLine(), property.endColumn(), p.identifier(newToken), p.identifier(property));
        }
        Expression callee = p.parseNewCallee();
        List<Expression> args = new ArrayList<>();
        if (p.match(TokenType.LPAREN)) {
            args = p.parseArgumentList();
        }
        Token endToken = p.previous();
        return new NewExpression(p.getStart(newToken), p.getEnd(endToken), newToken.line(), newToken.column(),
            endToken.endLine(), endToken.endColumn(), callee, args);
    }

    private static Expression prefixUnary(Parser p, Token op) {
        Expression argument = p.parseExpr(BP_UNARY);
        if (op.type() == TokenType.DELETE && p.strictMode && argument instanceof Identifier) {
            throw new ExpectedTokenException("Deleting local variable in strict mode", op);
        }
        Token endToken = p.previous();
        return new UnaryExpression(p.getStart(op), p.getEnd(endToken), op.line(), op.column(), endToken.endLine(),
            endToken.endColumn(), op.lexeme(), true, argument);
    }

    private static Expression prefixUpdate(Parser p, Token op) {
        Expression argument = p.parseExpr(BP_UNARY);
        Pattern target = p.toSimpleTarget(argument);
        Token endToken = p.previous();
        return new UpdateExpression(p.getStart(op), p.getEnd(endToken), op.line(), op.column(), endToken.endLine(),
            endToken.endColumn(), op.lexeme(), true, (Expression) target);
    }

    private static Expression prefixTemplate(Parser p, Token token) {
        p.current--;
        return p.parseTemplateLiteral(false);
    }

    private static Expression prefixImport(Parser p, Token importToken) {
        if (p.check(TokenType.DOT)) {
            throw new ExpectedTokenException("Cannot use 'import.meta' outside a module", importToken);
        }
        p.consume(TokenType.LPAREN, "Expected '(' after import");
        Expression source = p.parseExprAllowIn(BP_ASSIGNMENT);
        p.consume(TokenType.RPAREN, "Expected ')' after import source");
        Token endToken = p.previous();
        return new ImportExpression(p.getStart(importToken), p.getEnd(endToken), importToken.line(), importToken.column(),
            endToken.endLine(), endToken.endColumn(), source);
    }

    /**
     * Parses an expression that starts with an identifier token, which has
     * already been consumed.
     */
    protected Expression parseIdentifierAtom(Token token) {
        if (token.isContextual("async") && check(TokenType.FUNCTION) && peek().line() == token.endLine()) {
            advance();
            return parseFunctionExpression(token, true);
        }
        checkUnreserved(token.lexeme(), token);
        return identifier(token);
    }

    /**
     * Parses {@code await expr}; the current token is {@code await}.
     */
    protected Expression parseAwaitExpr() {
        Token awaitToken = advance();
        if (inFormalParameters) {
            throw new ExpectedTokenException("Await expression cannot be a default value", awaitToken);
        }
        Expression argument = parseExpr(BP_UNARY);
        Token endToken = previous();
        return new AwaitExpression(getStart(awaitToken), getEnd(endToken), awaitToken.line(), awaitToken.column(),
            endToken.endLine(), endToken.endColumn(), argument);
    }

    /**
     * Parses {@code yield}, {@code yield expr} or {@code yield* expr}; the
     * current token is {@code yield}.
     */
    protected Expression parseYieldExpr() {
        Token yieldToken = advance();
        if (inFormalParameters) {
            throw new ExpectedTokenException("Yield expression cannot be a default value", yieldToken);
        }
        boolean delegate = false;
        Expression argument = null;
        if (peek().line() == yieldToken.endLine()) {
            if (match(TokenType.STAR)) {
                delegate = true;
                argument = parseExpr(BP_ASSIGNMENT);
            } else if (startsExpression(peek().type())) {
                argument = parseExpr(BP_ASSIGNMENT);
            }
        }
        Token endToken = previous();
        return new YieldExpression(getStart(yieldToken), getEnd(endToken), yieldToken.line(), yieldToken.column(),
            endToken.endLine(), endToken.endColumn(), delegate, argument);
    }

    private static boolean startsExpression(TokenType type) {
        return switch (type) {
            case NUMBER, STRING, REGEX, TEMPLATE_LITERAL, TEMPLATE_HEAD, TRUE, FALSE, NULL, IDENTIFIER,
                 LET, FUNCTION, CLASS, NEW, TYPEOF, VOID, DELETE, THIS, SUPER, IMPORT,
                 LPAREN, LBRACKET, LBRACE, PLUS, MINUS, BANG, TILDE, INCREMENT, DECREMENT,
                 SLASH, SLASH_ASSIGN -> true;
            default -> false;
        };
    }

    // ========================================================================
    // Infix Handlers (LED)
    // ========================================================================

    private static Expression infixComma(Parser p, Expression left, Token op) {
        int savedStartPos = p.exprStartPos;
        SourceLocation.Position savedStartLoc = p.exprStartLoc;

        List<Expression> expressions = new ArrayList<>();
        expressions.add(left);
        expressions.add(p.parseExpr(BP_COMMA + 1));
        while (p.match(TokenType.COMMA)) {
            expressions.add(p.parseExpr(BP_COMMA + 1));
        }
        Token endToken = p.previous();
        return new SequenceExpression(savedStartPos, p.getEnd(endToken), savedStartLoc.line(), savedStartLoc.column(),
            endToken.endLine(), endToken.endColumn(), expressions);
    }

    private static Expression infixAssignment(Parser p, Expression left, Token op) {
        int savedStartPos = p.exprStartPos;
        SourceLocation.Position savedStartLoc = p.exprStartLoc;

        Pattern target;
        if (op.type() == TokenType.ASSIGN && (left instanceof ObjectExpression || left instanceof ArrayExpression)) {
            target = p.toAssignable(left);
        } else {
            target = p.toSimpleTarget(left);
        }
        Expression right = p.parseExpr(BP_ASSIGNMENT);
        Token endToken = p.previous();
        return new AssignmentExpression(savedStartPos, p.getEnd(endToken), savedStartLoc.line(), savedStartLoc.column(),
            endToken.endLine(), endToken.endColumn(), op.lexeme(), target, right);
    }

    private static Expression infixTernary(Parser p, Expression test, Token question) {
        int savedStartPos = p.exprStartPos;
        SourceLocation.Position savedStartLoc = p.exprStartLoc;

        // The consequent always allows 'in'; the alternate inherits
        boolean oldAllowIn = p.allowIn;
        p.allowIn = true;
        Expression consequent = p.parseExpr(BP_ASSIGNMENT);
        p.consume(TokenType.COLON, "Expected ':'");
        p.allowIn = oldAllowIn;
        Expression alternate = p.parseExpr(BP_ASSIGNMENT);
        Token endToken = p.previous();
        return new ConditionalExpression(savedStartPos, p.getEnd(endToken), savedStartLoc.line(), savedStartLoc.column(),
            endToken.endLine(), endToken.endColumn(), test, consequent, alternate);
    }

    private static Expression infixLogical(Parser p, Expression left, Token op) {
        int savedStartPos = p.exprStartPos;
        SourceLocation.Position savedStartLoc = p.exprStartLoc;

        int rbp = switch (op.type()) {
            case QUESTION_QUESTION -> BP_NULLISH + 1;
            case OR -> BP_OR + 1;
            default -> BP_AND + 1;
        };
        Expression right = p.parseExpr(rbp);
        Token endToken = p.previous();
        return new LogicalExpression(savedStartPos, p.getEnd(endToken), savedStartLoc.line(), savedStartLoc.column(),
            endToken.endLine(), endToken.endColumn(), op.lexeme(), left, right);
    }

    private static Expression infixBinary(Parser p, Expression left, Token op) {
        int savedStartPos = p.exprStartPos;
        SourceLocation.Position savedStartLoc = p.exprStartLoc;

        // A bare unary (or await) operand cannot be the base of **; (-x) ** y is fine
        if (op.type() == TokenType.STAR_STAR && p.exprStartPos == left.start()
            && (left instanceof UnaryExpression || left instanceof AwaitExpression)) {
            throw new ExpectedTokenException(
                "Unary operator used immediately before exponentiation expression. Parenthesis must be used to disambiguate operator precedence", op);
        }

        // Left-associative operators bind their right side one level tighter; ** is right-associative
        int rbp = switch (op.type()) {
            case BIT_OR -> BP_BIT_OR + 1;
            case BIT_XOR -> BP_BIT_XOR + 1;
            case BIT_AND -> BP_BIT_AND + 1;
            case EQ, NE, EQ_STRICT, NE_STRICT -> BP_EQUALITY + 1;
            case LT, LE, GT, GE, INSTANCEOF, IN -> BP_RELATIONAL + 1;
            case LEFT_SHIFT, RIGHT_SHIFT, UNSIGNED_RIGHT_SHIFT -> BP_SHIFT + 1;
            case PLUS, MINUS -> BP_ADDITIVE + 1;
            case STAR, SLASH, PERCENT -> BP_MULTIPLICATIVE + 1;
            case STAR_STAR -> BP_EXPONENT;
            default -> throw new UnexpectedTokenException(op, "binary expression");
        };
        Expression right = p.parseExpr(rbp);
        Token endToken = p.previous();
        return new BinaryExpression(savedStartPos, p.getEnd(endToken), savedStartLoc.line(), savedStartLoc.column(),
            endToken.endLine(), endToken.endColumn(), op.lexeme(), left, right);
    }

    private static Expression infixMember(Parser p, Expression object, Token dot) {
        Token propertyToken = p.peek();
        if (!isIdentifierName(propertyToken)) {
            throw new ExpectedTokenException("identifier name after '.'", propertyToken);
        }
        p.advance();
        Expression property = p.identifier(propertyToken);
        return new MemberExpression(p.exprStartPos, p.getEnd(propertyToken), p.exprStartLoc.line(), p.exprStartLoc.column(),
            propertyToken.endLine(), propertyToken.endColumn(), object, property, false, false);
    }

    private static Expression infixOptionalChain(Parser p, Expression object, Token questionDot) {
        int savedStartPos = p.exprStartPos;
        SourceLocation.Position savedStartLoc = p.exprStartLoc;

        if (p.match(TokenType.LPAREN)) {
            List<Expression> args = p.parseArgumentList();
            Token endToken = p.previous();
            return new CallExpression(savedStartPos, p.getEnd(endToken), savedStartLoc.line(), savedStartLoc.column(),
                endToken.endLine(), endToken.endColumn(), object, args, true);
        }
        if (p.match(TokenType.LBRACKET)) {
            Expression property = p.parseExprAllowIn(BP_COMMA);
            p.consume(TokenType.RBRACKET, "Expected ']' after computed property");
            Token endToken = p.previous();
            return new MemberExpression(savedStartPos, p.getEnd(endToken), savedStartLoc.line(), savedStartLoc.column(),
                endToken.endLine(), endToken.endColumn(), object, property, true, true);
        }
        Token propertyToken = p.peek();
        if (!isIdentifierName(propertyToken)) {
            throw new ExpectedTokenException("property name after '?.'", propertyToken);
        }
        p.advance();
        Expression property = p.identifier(propertyToken);
        return new MemberExpression(savedStartPos, p.getEnd(propertyToken), savedStartLoc.line(), savedStartLoc.column(),
            propertyToken.endLine(), propertyToken.endColumn(), object, property, false, true);
    }

    private static Expression infixComputed(Parser p, Expression object, Token lbracket) {
        int savedStartPos = p.exprStartPos;
        SourceLocation.Position savedStartLoc = p.exprStartLoc;

        Expression property = p.parseExprAllowIn(BP_COMMA);
        p.consume(TokenType.RBRACKET, "Expected ']' after computed property");
        Token endToken = p.previous();
        return new MemberExpression(savedStartPos, p.getEnd(endToken), savedStartLoc.line(), savedStartLoc.column(),
            endToken.endLine(), endToken.endColumn(), object, property, true, false);
    }

    private static Expression infixCall(Parser p, Expression callee, Token lparen) {
        int savedStartPos = p.exprStartPos;
        SourceLocation.Position savedStartLoc = p.exprStartLoc;

        List<Expression> args = p.parseArgumentList();
        Token endToken = p.previous();
        return new CallExpression(savedStartPos, p.getEnd(endToken), savedStartLoc.line(), savedStartLoc.column(),
            endToken.endLine(), endToken.endColumn(), callee, args, false);
    }

    private static Expression infixTaggedTemplate(Parser p, Expression tag, Token templateStart) {
        int savedStartPos = p.exprStartPos;
        SourceLocation.Position savedStartLoc = p.exprStartLoc;

        // Back up one token since parseTemplateLiteral starts at the template token
        p.current--;
        TemplateLiteral quasi = p.parseTemplateLiteral(true);
        Token endToken = p.previous();
        return new TaggedTemplateExpression(savedStartPos, quasi.end(), savedStartLoc.line(), savedStartLoc.column(),
            endToken.endLine(), endToken.endColumn(), tag, quasi);
    }

    // ========================================================================
    // Expression Helpers
    // ========================================================================

    // new's callee: member accesses and tagged templates, but no call
    private Expression parseNewCallee() {
        Token startToken = peek();
        if (startToken.type() == TokenType.IMPORT) {
            throw new ExpectedTokenException("Cannot use new with import()", startToken);
        }
        Expression callee = parsePrefix();
        int savedStartPos = exprStartPos;
        SourceLocation.Position savedStartLoc = exprStartLoc;
        while (true) {
            Token token = peek();
            if (token.type() == TokenType.QUESTION_DOT) {
                throw new ExpectedTokenException("Invalid optional chain from new expression", token);
            }
            if (token.type() != TokenType.DOT && token.type() != TokenType.LBRACKET
                && token.type() != TokenType.TEMPLATE_LITERAL && token.type() != TokenType.TEMPLATE_HEAD) {
                break;
            }
            advance();
            exprStartPos = getStart(startToken);
            exprStartLoc = new SourceLocation.Position(startToken.line(), startToken.column());
            callee = switch (token.type()) {
                case DOT -> infixMember(this, callee, token);
                case LBRACKET -> infixComputed(this, callee, token);
                default -> infixTaggedTemplate(this, callee, token);
            };
        }
        exprStartPos = savedStartPos;
        exprStartLoc = savedStartLoc;
        return callee;
    }

    // After '('; consumes the closing ')'
    private List<Expression> parseArgumentList() {
        List<Expression> args = new ArrayList<>();
        while (!match(TokenType.RPAREN)) {
            if (match(TokenType.DOT_DOT_DOT)) {
                args.add(finishSpread(previous()));
            } else {
                args.add(parseExprAllowIn(BP_ASSIGNMENT));
            }
            if (!check(TokenType.RPAREN)) {
                consume(TokenType.COMMA, "Expected ',' or ')' in argument list");
            }
        }
        return args;
    }

    private SpreadElement finishSpread(Token spreadToken) {
        Expression argument = parseExprAllowIn(BP_ASSIGNMENT);
        Token endToken = previous();
        return new SpreadElement(getStart(spreadToken), getEnd(endToken), spreadToken.line(), spreadToken.column(),
            endToken.endLine(), endToken.endColumn(), argument);
    }

    private Node parseObjectMember() {
        Token startToken = peek();
        if (match(TokenType.DOT_DOT_DOT)) {
            return finishSpread(startToken);
        }
        boolean isAsync = false;
        String kind = "init";
        Token next = tokenAt(current + 1);
        if (startToken.isContextual("async") && !isPropertyNameEnd(next) && next.line() == startToken.endLine()) {
            advance();
            isAsync = true;
        } else if ((startToken.isContextual("get") || startToken.isContextual("set")) && !isPropertyNameEnd(next)) {
            advance();
            kind = startToken.lexeme();
        }
        boolean isGenerator = match(TokenType.STAR);
        boolean computed = check(TokenType.LBRACKET);
        Token keyToken = peek();
        Expression key = parsePropertyKey();

        if (!kind.equals("init")) {
            FunctionExpression value = parseMethodFunction(false, false, false);
            checkAccessorParams(kind, value);
            Token endToken = previous();
            return new Property(getStart(startToken), getEnd(endToken), startToken.line(), startToken.column(),
                endToken.endLine(), endToken.endColumn(), key, value, kind, false, false, computed);
        }
        if (isAsync || isGenerator || check(TokenType.LPAREN)) {
            FunctionExpression value = parseMethodFunction(isAsync, isGenerator, false);
            Token endToken = previous();
            return new Property(getStart(startToken), getEnd(endToken), startToken.line(), startToken.column(),
                endToken.endLine(), endToken.endColumn(), key, value, "init", true, false, computed);
        }
        if (match(TokenType.COLON)) {
            Expression value = parseExprAllowIn(BP_ASSIGNMENT);
            Token endToken = previous();
            return new Property(getStart(startToken), getEnd(endToken), startToken.line(), startToken.column(),
                endToken.endLine(), endToken.endColumn(), key, value, "init", false, false, computed);
        }

        // Shorthand: {a} or, inside a future destructuring target, {a = 1}
        if (computed || keyToken.type() != TokenType.IDENTIFIER) {
            throw new UnexpectedTokenException(peek(), "object literal");
        }
        checkUnreserved(keyToken.lexeme(), keyToken);
        Identifier id = identifier(keyToken);
        Expression value = id;
        if (check(TokenType.ASSIGN)) {
            Token assign = advance();
            if (pendingCoverInit == null) {
                pendingCoverInit = assign;
            }
            Expression defaultValue = parseExprAllowIn(BP_ASSIGNMENT);
            Token endToken = previous();
            value = new AssignmentExpression(getStart(keyToken), getEnd(endToken), keyToken.line(), keyToken.column(),
                endToken.endLine(), endToken.endColumn(), "=", id, defaultValue);
        }
        Token endToken = previous();
        return new Property(getStart(startToken), getEnd(endToken), startToken.line(), startToken.column(),
            endToken.endLine(), endToken.endColumn(), id, value, "init", false, true, false);
    }

    /**
     * Parses a template literal starting at the current TEMPLATE_LITERAL or
     * TEMPLATE_HEAD token. Invalid escapes are only allowed in tagged templates.
     */
    protected TemplateLiteral parseTemplateLiteral(boolean tagged) {
        Token first = advance();
        List<TemplateElement> quasis = new ArrayList<>();
        List<Expression> expressions = new ArrayList<>();
        quasis.add(templateElement(first, tagged));
        Token chunk = first;
        while (chunk.type() == TokenType.TEMPLATE_HEAD || chunk.type() == TokenType.TEMPLATE_MIDDLE) {
            expressions.add(parseExprAllowIn(BP_COMMA));
            if (!check(TokenType.TEMPLATE_MIDDLE) && !check(TokenType.TEMPLATE_TAIL)) {
                throw new ExpectedTokenException("Expected '}' after template expression", peek());
            }
            chunk = advance();
            quasis.add(templateElement(chunk, tagged));
        }
        return new TemplateLiteral(getStart(first), getEnd(chunk), first.line(), first.column(),
            chunk.endLine(), chunk.endColumn(), quasis, expressions);
    }

    // The text between the delimiters: ` or } before, ` or ${ after
    private TemplateElement templateElement(Token chunk, boolean tagged) {
        boolean tail = chunk.type() == TokenType.TEMPLATE_LITERAL || chunk.type() == TokenType.TEMPLATE_TAIL;
        String cooked = (String) chunk.literal();
        if (cooked == null && !tagged) {
            throw new ExpectedTokenException("Bad escape sequence in untagged template literal", chunk);
        }
        int start = chunk.position() + 1;
        int end = chunk.endPosition() - (tail ? 1 : 2);
        SourceLocation.Position startPos = lineInfo.position(start);
        SourceLocation.Position endPos = lineInfo.position(end);
        return new TemplateElement(start, end, startPos.line(), startPos.column(), endPos.line(), endPos.column(),
            new TemplateElement.TemplateElementValue(chunk.raw(), cooked), tail);
    }

    /**
     * Parses the string literal at the current token.
     */
    protected Literal parseStringLiteral() {
        Token token = consume(TokenType.STRING, "Expected string literal");
        return prefixString(this, token);
    }

    // ========================================================================
    // Identifier Validation
    // ========================================================================

    /**
     * Rejects identifier names that are reserved in the current context.
     * Called for every identifier reference and binding name.
     */
    protected void checkUnreserved(String name, Token token) {
        if (RESERVED_WORDS.contains(name)) {
            // Only escaped keywords reach the parser as identifiers
            throw new ExpectedTokenException("Escape sequence in keyword " + name, token);
        }
        if (strictMode && STRICT_RESERVED_WORDS.contains(name)) {
            throw new ExpectedTokenException("The keyword '" + name + "' is reserved", token);
        }
        if (inGenerator && name.equals("yield")) {
            throw new ExpectedTokenException("Cannot use 'yield' as identifier inside a generator", token);
        }
        if (inAsyncContext && name.equals("await")) {
            throw new ExpectedTokenException("Cannot use 'await' as identifier inside an async function", token);
        }
    }

    private void checkStrictBinding(String name, int position) {
        if (strictMode && (name.equals("eval") || name.equals("arguments"))) {
            throw errorAt(position, "Binding " + name + " in strict mode");
        }
    }

    private static boolean isIdentifierName(Token token) {
        TokenType type = token.type();
        return type == TokenType.IDENTIFIER || KEYWORDS.contains(type)
            || type == TokenType.TRUE || type == TokenType.FALSE || type == TokenType.NULL;
    }

    // ========================================================================
    // Helper Methods
    // ========================================================================

    protected Identifier identifier(Token token) {
        return new Identifier(getStart(token), getEnd(token), token.line(), token.column(), token.endLine(),
            token.endColumn(), token.lexeme());
    }

    /**
     * A syntax error at a source offset.
     */
    protected ParseException errorAt(int offset, String message) {
        SourceLocation.Position position = lineInfo.position(offset);
        return new ParseException("SyntaxError", message, offset, position.line(), position.column());
    }

    protected SourceLocation.Position positionOf(int offset) {
        return lineInfo.position(offset);
    }

    protected int getStart(Token token) {
        return token.position();
    }

    protected int getEnd(Token token) {
        return token.endPosition();
    }

    protected boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    protected boolean check(TokenType type) {
        return peek().type() == type;
    }

    protected boolean checkAhead(int offset, TokenType type) {
        return tokenAt(current + offset).type() == type;
    }

    protected Token advance() {
        if (!isAtEnd()) {
            current++;
        }
        return previous();
    }

    protected boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    protected Token peek() {
        return tokenAt(current);
    }

    // Scans up to the token at index; past the end of input this is the EOF token
    private Token tokenAt(int index) {
        while (tokens.size() <= index) {
            if (!tokens.isEmpty() && tokens.get(tokens.size() - 1).type() == TokenType.EOF) {
                return tokens.get(tokens.size() - 1);
            }
            lexerStates.add(lexer.save());
            tokens.add(lexer.nextToken());
        }
        return tokens.get(index);
    }

    /**
     * Scans the current token again with its leading slash read as given,
     * dropping every token scanned after it.
     */
    private Token rescanSlash(Lexer.SlashMode slashMode) {
        peek();
        lexer.restore(lexerStates.get(current));
        tokens.subList(current, tokens.size()).clear();
        lexerStates.subList(current + 1, lexerStates.size()).clear();
        tokens.add(lexer.nextToken(slashMode));
        return tokens.get(current);
    }

    protected Token previous() {
        return tokens.get(current - 1);
    }

    protected Token consume(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw new ExpectedTokenException(message, peek());
    }

    // ASI-aware semicolon consumption: a semicolon may be left out before
    // '}', at the end of input, or after a line break
    protected void consumeSemicolon(String context) {
        if (match(TokenType.SEMICOLON)) {
            return;
        }
        if (check(TokenType.RBRACE) || isAtEnd()) {
            return;
        }
        if (current > 0 && previous().endLine() < peek().line()) {
            return;
        }
        throw new UnexpectedTokenException(peek(), context);
    }
}
