package com.cellparser;

import com.cellparser.ast.Literal;
import com.cellparser.ast.SourceLocation;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * On-demand ECMAScript 2020 tokenizer.
 *
 * <p>A lexer can start at any offset of its source; line and column numbers
 * stay absolute, so tokens produced by a lexer started mid-text carry the
 * same positions as tokens produced by one started at offset 0. Several
 * lexers may read the same source independently.</p>
 *
 * <p>By default a slash starts a regular expression unless the previous
 * token ends an operand. A parser that knows better asks for the other
 * reading with {@link #nextToken(SlashMode)} after {@link #restore(State)}.</p>
 */
public class Lexer {

    /**
     * How a {@code /} at the start of a token is read.
     */
    public enum SlashMode {
        GUESS,
        REGEX,
        DIVISION
    }

    /**
     * Everything the lexer needs to resume scanning at a token boundary.
     */
    public record State(int pos, int line, int lineStart, TokenType lastType, int braceDepth,
                        List<Integer> templateDepths) {
    }

    private static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
        Map.entry("var", TokenType.VAR),
        Map.entry("let", TokenType.LET),
        Map.entry("const", TokenType.CONST),
        Map.entry("function", TokenType.FUNCTION),
        Map.entry("class", TokenType.CLASS),
        Map.entry("extends", TokenType.EXTENDS),
        Map.entry("return", TokenType.RETURN),
        Map.entry("if", TokenType.IF),
        Map.entry("else", TokenType.ELSE),
        Map.entry("for", TokenType.FOR),
        Map.entry("while", TokenType.WHILE),
        Map.entry("do", TokenType.DO),
        Map.entry("break", TokenType.BREAK),
        Map.entry("continue", TokenType.CONTINUE),
        Map.entry("switch", TokenType.SWITCH),
        Map.entry("case", TokenType.CASE),
        Map.entry("default", TokenType.DEFAULT),
        Map.entry("try", TokenType.TRY),
        Map.entry("catch", TokenType.CATCH),
        Map.entry("finally", TokenType.FINALLY),
        Map.entry("throw", TokenType.THROW),
        Map.entry("new", TokenType.NEW),
        Map.entry("typeof", TokenType.TYPEOF),
        Map.entry("void", TokenType.VOID),
        Map.entry("delete", TokenType.DELETE),
        Map.entry("this", TokenType.THIS),
        Map.entry("super", TokenType.SUPER),
        Map.entry("in", TokenType.IN),
        Map.entry("instanceof", TokenType.INSTANCEOF),
        Map.entry("import", TokenType.IMPORT),
        Map.entry("export", TokenType.EXPORT),
        Map.entry("with", TokenType.WITH),
        Map.entry("debugger", TokenType.DEBUGGER),
        Map.entry("enum", TokenType.ENUM),
        Map.entry("true", TokenType.TRUE),
        Map.entry("false", TokenType.FALSE),
        Map.entry("null", TokenType.NULL)
    );

    private final String source;
    private final int length;
    private int pos;
    private int line = 1;
    private int lineStart = 0;   // offset of the first character of the current line

    // Type of the last token produced; null before the first one
    private TokenType lastType = null;

    // Open braces, and the brace depth at which each open template substitution began
    private int braceDepth = 0;
    private final Deque<Integer> templateDepths = new ArrayDeque<>();

    public Lexer(String source) {
        this(source, 0);
    }

    public Lexer(String source, int offset) {
        this.source = source;
        this.length = source.length();
        // Count the line terminators before the start offset so positions stay absolute
        int i = 0;
        while (i < offset) {
            char ch = source.charAt(i);
            if (ch == '\r' && i + 1 < offset && source.charAt(i + 1) == '\n') {
                i++;
            }
            if (isLineTerminator(ch)) {
                line++;
                lineStart = i + 1;
            }
            i++;
        }
        this.pos = offset;
    }

    /**
     * Starts at a token already scanned by another lexer over the same
     * source, without recounting the lines before it.
     */
    public Lexer(String source, Token start) {
        this.source = source;
        this.length = source.length();
        this.pos = start.position();
        this.line = start.line();
        this.lineStart = start.position() - start.column();
    }

    public State save() {
        return new State(pos, line, lineStart, lastType, braceDepth, List.copyOf(templateDepths));
    }

    public void restore(State state) {
        pos = state.pos();
        line = state.line();
        lineStart = state.lineStart();
        lastType = state.lastType();
        braceDepth = state.braceDepth();
        templateDepths.clear();
        templateDepths.addAll(state.templateDepths());
    }

    /**
     * Tokenizes the rest of the source. The last token is always EOF.
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (token.type() != TokenType.EOF);
        return tokens;
    }

    /**
     * Scans the next token. Once the end is reached every call returns EOF.
     */
    public Token nextToken() {
        return nextToken(SlashMode.GUESS);
    }

    public Token nextToken(SlashMode slashMode) {
        skipTrivia();
        int start = pos;
        int startLine = line;
        int startCol = pos - lineStart;
        if (pos >= length) {
            return make(TokenType.EOF, "", null, start, startLine, startCol, null, false);
        }

        char c = source.charAt(pos);
        Token token;
        if (c == '}' && !templateDepths.isEmpty() && templateDepths.peek() == braceDepth) {
            token = scanTemplate(start, startLine, startCol, false);
        } else if (c == '`') {
            token = scanTemplate(start, startLine, startCol, true);
        } else if (c == '\\' || isIdentifierStart(source.codePointAt(pos))) {
            token = scanIdentifier(start, startLine, startCol);
        } else if (isDigit(c) || (c == '.' && isDigit(peekAt(1)))) {
            token = scanNumber(start, startLine, startCol);
        } else if (c == '"' || c == '\'') {
            token = scanString(start, startLine, startCol);
        } else if (c == '/' && slashMode == SlashMode.REGEX) {
            token = scanRegex(start, startLine, startCol);
        } else if (c == '/' && slashMode == SlashMode.GUESS && regexAllowed()) {
            token = guessRegex(start, startLine, startCol);
        } else {
            token = scanPunctuator(start, startLine, startCol);
        }
        lastType = token.type();
        return token;
    }

    // ========================================================================
    // Whitespace and comments
    // ========================================================================

    private void skipTrivia() {
        while (pos < length) {
            char c = source.charAt(pos);
            if (c == ' ' || c == '\t' || c == '\u000B' || c == '\f' || c == '\u00A0' || c == '\uFEFF') {
                pos++;
            } else if (isLineTerminator(c)) {
                consumeLineTerminator();
            } else if (c == '/' && peekAt(1) == '/') {
                pos += 2;
                while (pos < length && !isLineTerminator(source.charAt(pos))) {
                    pos++;
                }
            } else if (c == '/' && peekAt(1) == '*') {
                int commentStart = pos;
                int commentLine = line;
                int commentCol = pos - lineStart;
                pos += 2;
                while (true) {
                    if (pos >= length) {
                        throw new ParseException("SyntaxError", "Unterminated comment", commentStart, commentLine, commentCol);
                    }
                    char ch = source.charAt(pos);
                    if (ch == '*' && peekAt(1) == '/') {
                        pos += 2;
                        break;
                    }
                    if (isLineTerminator(ch)) {
                        consumeLineTerminator();
                    } else {
                        pos++;
                    }
                }
            } else if (c > 127 && Character.getType(c) == Character.SPACE_SEPARATOR) {
                pos++;
            } else {
                return;
            }
        }
    }

    // pos is on a line terminator; CRLF counts as one
    private void consumeLineTerminator() {
        char c = source.charAt(pos++);
        if (c == '\r' && pos < length && source.charAt(pos) == '\n') {
            pos++;
        }
        line++;
        lineStart = pos;
    }

    // ========================================================================
    // Identifiers and keywords
    // ========================================================================

    private Token scanIdentifier(int start, int startLine, int startCol) {
        StringBuilder name = new StringBuilder();
        boolean escaped = false;
        boolean first = true;
        while (pos < length) {
            int cp = source.codePointAt(pos);
            if (cp == '\\') {
                if (peekAt(1) != 'u') {
                    throw error("Expecting Unicode escape sequence \\uXXXX", pos);
                }
                int escapeStart = pos;
                pos += 2;
                int decoded = readUnicodeEscape();
                if (decoded < 0 || (first ? !isIdentifierStart(decoded) : !isIdentifierPart(decoded))) {
                    throw error("Invalid Unicode escape", escapeStart);
                }
                name.appendCodePoint(decoded);
                escaped = true;
            } else if (first ? isIdentifierStart(cp) : isIdentifierPart(cp)) {
                name.appendCodePoint(cp);
                pos += Character.charCount(cp);
            } else {
                break;
            }
            first = false;
        }
        String lexeme = name.toString();
        // Escaped keywords stay identifiers; the parser rejects them where a keyword is reserved
        TokenType type = escaped ? TokenType.IDENTIFIER : KEYWORDS.getOrDefault(lexeme, TokenType.IDENTIFIER);
        return make(type, lexeme, null, start, startLine, startCol, null, escaped);
    }

    // ========================================================================
    // Numbers
    // ========================================================================

    private Token scanNumber(int start, int startLine, int startCol) {
        char c = source.charAt(pos);
        char next = peekAt(1);
        Object value;

        if (c == '0' && "xXoObB".indexOf(next) >= 0) {
            int radix = switch (Character.toLowerCase(next)) {
                case 'x' -> 16;
                case 'o' -> 8;
                default -> 2;
            };
            pos += 2;
            String digits = readDigits(radix);
            if (digits.isEmpty()) {
                throw error("Expected number in radix " + radix, start);
            }
            if (peekAt(0) == 'n') {
                pos++;
                return finishNumber(start, startLine, startCol, null);
            }
            value = new BigInteger(digits, radix).doubleValue();
        } else if (c == '0' && isDigit(next)) {
            // Legacy octal (or a decimal with a leading zero, like 089)
            pos++;
            String digits = readDigits(10);
            boolean octal = digits.chars().allMatch(d -> d < '8');
            value = octal ? new BigInteger(digits, 8).doubleValue() : Double.parseDouble(digits);
        } else {
            StringBuilder text = new StringBuilder(readDigits(10));
            if (peekAt(0) == 'n' && text.length() > 0) {
                pos++;
                return finishNumber(start, startLine, startCol, null);
            }
            if (peekAt(0) == '.') {
                pos++;
                text.append('.').append(readDigits(10));
            }
            char e = peekAt(0);
            if (e == 'e' || e == 'E') {
                pos++;
                text.append('e');
                char sign = peekAt(0);
                if (sign == '+' || sign == '-') {
                    pos++;
                    text.append(sign);
                }
                String exponent = readDigits(10);
                if (exponent.isEmpty()) {
                    throw error("Invalid number", start);
                }
                text.append(exponent);
            }
            value = Double.parseDouble(text.toString());
        }
        return finishNumber(start, startLine, startCol, value);
    }

    // BigInt literals carry a null value; the parser reads them from the lexeme
    private Token finishNumber(int start, int startLine, int startCol, Object value) {
        if (pos < length && isIdentifierStart(source.codePointAt(pos))) {
            throw error("Identifier directly after number", pos);
        }
        return make(TokenType.NUMBER, source.substring(start, pos), value, start, startLine, startCol, null, false);
    }

    private String readDigits(int radix) {
        int begin = pos;
        while (pos < length) {
            int digit = hexValue(source.charAt(pos));
            if (digit < 0 || digit >= radix) {
                break;
            }
            pos++;
        }
        return source.substring(begin, pos);
    }

    // ========================================================================
    // Strings and templates
    // ========================================================================

    private Token scanString(int start, int startLine, int startCol) {
        char quote = source.charAt(pos++);
        StringBuilder value = new StringBuilder();
        while (true) {
            if (pos >= length) {
                throw error("Unterminated string constant", start);
            }
            char c = source.charAt(pos);
            if (c == quote) {
                pos++;
                break;
            }
            if (c == '\\') {
                pos++;
                int escapeStart = pos - 1;
                if (!readEscape(value, false)) {
                    throw error("Bad character escape sequence", escapeStart);
                }
            } else if (c == '\n' || c == '\r') {
                throw error("Unterminated string constant", start);
            } else {
                value.append(c);
                pos++;
            }
        }
        return make(TokenType.STRING, source.substring(start, pos), value.toString(), start, startLine, startCol, null, false);
    }

    /**
     * Scans one template chunk: from the opening backtick (or the brace that
     * closes a substitution) up to and including the closing backtick or the
     * {@code ${} that opens the next substitution.
     */
    private Token scanTemplate(int start, int startLine, int startCol, boolean opening) {
        pos++; // ` or }
        if (!opening) {
            templateDepths.pop();
        }
        StringBuilder cooked = new StringBuilder();
        boolean valid = true;
        int rawStart = pos;
        int rawEnd;
        TokenType type;
        while (true) {
            if (pos >= length) {
                throw error("Unterminated template", start);
            }
            char c = source.charAt(pos);
            if (c == '`') {
                rawEnd = pos;
                pos++;
                type = opening ? TokenType.TEMPLATE_LITERAL : TokenType.TEMPLATE_TAIL;
                break;
            }
            if (c == '$' && peekAt(1) == '{') {
                rawEnd = pos;
                pos += 2;
                type = opening ? TokenType.TEMPLATE_HEAD : TokenType.TEMPLATE_MIDDLE;
                templateDepths.push(braceDepth);
                break;
            }
            if (c == '\\') {
                pos++;
                if (!readEscape(cooked, true)) {
                    valid = false;
                }
            } else if (c == '\r') {
                consumeLineTerminator();
                cooked.append('\n');
            } else if (isLineTerminator(c)) {
                consumeLineTerminator();
                cooked.append(c);
            } else {
                cooked.append(c);
                pos++;
            }
        }
        String raw = source.substring(rawStart, rawEnd).replace("\r\n", "\n").replace('\r', '\n');
        Object literal = valid ? cooked.toString() : null;
        return make(type, source.substring(start, pos), literal, start, startLine, startCol, raw, false);
    }

    /**
     * Reads one escape sequence; pos is just past the backslash. Appends the
     * decoded text and returns true, or returns false for an escape that is
     * invalid in this context (the caller decides whether that is an error).
     */
    private boolean readEscape(StringBuilder out, boolean inTemplate) {
        if (pos >= length) {
            return false;
        }
        char c = source.charAt(pos);
        switch (c) {
            case 'n' -> { out.append('\n'); pos++; }
            case 't' -> { out.append('\t'); pos++; }
            case 'r' -> { out.append('\r'); pos++; }
            case 'b' -> { out.append('\b'); pos++; }
            case 'f' -> { out.append('\f'); pos++; }
            case 'v' -> { out.append('\u000B'); pos++; }
            case 'x' -> {
                pos++;
                int hi = hexValue(peekAt(0));
                int lo = hexValue(peekAt(1));
                if (hi < 0 || lo < 0) {
                    return false;
                }
                pos += 2;
                out.append((char) (hi * 16 + lo));
            }
            case 'u' -> {
                pos++;
                int cp = readUnicodeEscape();
                if (cp < 0) {
                    return false;
                }
                out.appendCodePoint(cp);
            }
            case '\r', '\n', '\u2028', '\u2029' -> consumeLineTerminator(); // line continuation
            default -> {
                if (c >= '0' && c <= '9') {
                    if (c == '0' && !isDigit(peekAt(1))) {
                        out.append('\0');
                        pos++;
                        return true;
                    }
                    if (inTemplate) {
                        pos++;
                        return false;
                    }
                    if (c >= '8') {
                        out.append(c);
                        pos++;
                        return true;
                    }
                    // Legacy octal escape: up to three digits, value at most 0377
                    int value = 0;
                    int count = 0;
                    while (count < 3 && peekAt(0) >= '0' && peekAt(0) <= '7' && value * 8 + (peekAt(0) - '0') <= 255) {
                        value = value * 8 + (source.charAt(pos) - '0');
                        pos++;
                        count++;
                    }
                    out.append((char) value);
                    return true;
                }
                out.append(c);
                pos++;
            }
        }
        return true;
    }

    // pos is just past "\\u"; returns the code point, or -1 if malformed
    private int readUnicodeEscape() {
        if (peekAt(0) == '{') {
            int close = source.indexOf('}', pos);
            if (close < 0 || close == pos + 1) {
                return -1;
            }
            String hex = source.substring(pos + 1, close);
            for (int i = 0; i < hex.length(); i++) {
                if (hexValue(hex.charAt(i)) < 0) {
                    return -1;
                }
            }
            BigInteger value = new BigInteger(hex, 16);
            if (value.compareTo(BigInteger.valueOf(0x10FFFF)) > 0) {
                return -1;
            }
            pos = close + 1;
            return value.intValue();
        }
        if (pos + 4 > length) {
            return -1;
        }
        int value = 0;
        for (int i = 0; i < 4; i++) {
            int digit = hexValue(source.charAt(pos + i));
            if (digit < 0) {
                return -1;
            }
            value = value * 16 + digit;
        }
        pos += 4;
        return value;
    }

    // ========================================================================
    // Regular expressions
    // ========================================================================

    // A slash starts a regex unless the previous token ends an operand
    private boolean regexAllowed() {
        if (lastType == null) {
            return true;
        }
        return switch (lastType) {
            case NUMBER, STRING, REGEX, TEMPLATE_LITERAL, TEMPLATE_TAIL, IDENTIFIER,
                 RPAREN, RBRACKET, THIS, SUPER, TRUE, FALSE, NULL, INCREMENT, DECREMENT -> false;
            default -> true;
        };
    }

    // A guessed regex that does not close on its line is read as division instead
    private Token guessRegex(int start, int startLine, int startCol) {
        try {
            return scanRegex(start, startLine, startCol);
        } catch (ParseException e) {
            pos = start;
            return scanPunctuator(start, startLine, startCol);
        }
    }

    private Token scanRegex(int start, int startLine, int startCol) {
        pos++; // opening /
        boolean inClass = false;
        while (true) {
            if (pos >= length || isLineTerminator(source.charAt(pos))) {
                throw error("Unterminated regular expression", start);
            }
            char c = source.charAt(pos);
            if (c == '\\') {
                pos++;
                if (pos < length && !isLineTerminator(source.charAt(pos))) {
                    pos++;
                }
                continue;
            }
            if (c == '[') {
                inClass = true;
            } else if (c == ']' && inClass) {
                inClass = false;
            } else if (c == '/' && !inClass) {
                break;
            }
            pos++;
        }
        String pattern = source.substring(start + 1, pos);
        pos++; // closing /
        int flagsStart = pos;
        while (pos < length && isIdentifierPart(source.codePointAt(pos))) {
            pos += Character.charCount(source.codePointAt(pos));
        }
        String flags = source.substring(flagsStart, pos);
        for (int i = 0; i < flags.length(); i++) {
            char flag = flags.charAt(i);
            if ("gimsuy".indexOf(flag) < 0 || flags.indexOf(flag, i + 1) >= 0) {
                throw error("Invalid regular expression flag", start);
            }
        }
        return make(TokenType.REGEX, source.substring(start, pos), new Literal.RegexInfo(pattern, flags),
            start, startLine, startCol, null, false);
    }

    // ========================================================================
    // Punctuators
    // ========================================================================

    private Token scanPunctuator(int start, int startLine, int startCol) {
        char c = source.charAt(pos);
        TokenType type = switch (c) {
            case '(' -> single(TokenType.LPAREN);
            case ')' -> single(TokenType.RPAREN);
            case '{' -> {
                braceDepth++;
                yield single(TokenType.LBRACE);
            }
            case '}' -> {
                braceDepth--;
                yield single(TokenType.RBRACE);
            }
            case '[' -> single(TokenType.LBRACKET);
            case ']' -> single(TokenType.RBRACKET);
            case ';' -> single(TokenType.SEMICOLON);
            case ',' -> single(TokenType.COMMA);
            case ':' -> single(TokenType.COLON);
            case '~' -> single(TokenType.TILDE);
            case '.' -> {
                if (peekAt(1) == '.' && peekAt(2) == '.') {
                    pos += 3;
                    yield TokenType.DOT_DOT_DOT;
                }
                yield single(TokenType.DOT);
            }
            case '?' -> {
                if (peekAt(1) == '?') {
                    pos += 2;
                    yield TokenType.QUESTION_QUESTION;
                }
                // ?.5 is a conditional followed by a number
                if (peekAt(1) == '.' && !isDigit(peekAt(2))) {
                    pos += 2;
                    yield TokenType.QUESTION_DOT;
                }
                yield single(TokenType.QUESTION);
            }
            case '=' -> {
                if (peekAt(1) == '>') {
                    pos += 2;
                    yield TokenType.ARROW;
                }
                if (peekAt(1) == '=') {
                    if (peekAt(2) == '=') {
                        pos += 3;
                        yield TokenType.EQ_STRICT;
                    }
                    pos += 2;
                    yield TokenType.EQ;
                }
                yield single(TokenType.ASSIGN);
            }
            case '!' -> {
                if (peekAt(1) == '=') {
                    if (peekAt(2) == '=') {
                        pos += 3;
                        yield TokenType.NE_STRICT;
                    }
                    pos += 2;
                    yield TokenType.NE;
                }
                yield single(TokenType.BANG);
            }
            case '+' -> operator('+', TokenType.PLUS, TokenType.INCREMENT, TokenType.PLUS_ASSIGN);
            case '-' -> operator('-', TokenType.MINUS, TokenType.DECREMENT, TokenType.MINUS_ASSIGN);
            case '*' -> {
                if (peekAt(1) == '*') {
                    if (peekAt(2) == '=') {
                        pos += 3;
                        yield TokenType.STAR_STAR_ASSIGN;
                    }
                    pos += 2;
                    yield TokenType.STAR_STAR;
                }
                yield withAssign(TokenType.STAR, TokenType.STAR_ASSIGN);
            }
            case '/' -> withAssign(TokenType.SLASH, TokenType.SLASH_ASSIGN);
            case '%' -> withAssign(TokenType.PERCENT, TokenType.PERCENT_ASSIGN);
            case '^' -> withAssign(TokenType.BIT_XOR, TokenType.BIT_XOR_ASSIGN);
            case '&' -> operator('&', TokenType.BIT_AND, TokenType.AND, TokenType.BIT_AND_ASSIGN);
            case '|' -> operator('|', TokenType.BIT_OR, TokenType.OR, TokenType.BIT_OR_ASSIGN);
            case '<' -> {
                if (peekAt(1) == '<') {
                    if (peekAt(2) == '=') {
                        pos += 3;
                        yield TokenType.LEFT_SHIFT_ASSIGN;
                    }
                    pos += 2;
                    yield TokenType.LEFT_SHIFT;
                }
                yield withAssign(TokenType.LT, TokenType.LE);
            }
            case '>' -> {
                if (peekAt(1) == '>') {
                    if (peekAt(2) == '>') {
                        if (peekAt(3) == '=') {
                            pos += 4;
                            yield TokenType.UNSIGNED_RIGHT_SHIFT_ASSIGN;
                        }
                        pos += 3;
                        yield TokenType.UNSIGNED_RIGHT_SHIFT;
                    }
                    if (peekAt(2) == '=') {
                        pos += 3;
                        yield TokenType.RIGHT_SHIFT_ASSIGN;
                    }
                    pos += 2;
                    yield TokenType.RIGHT_SHIFT;
                }
                yield withAssign(TokenType.GT, TokenType.GE);
            }
            default -> throw error("Unexpected character '" + new String(Character.toChars(source.codePointAt(pos))) + "'", pos);
        };
        return make(type, source.substring(start, pos), null, start, startLine, startCol, null, false);
    }

    private TokenType single(TokenType type) {
        pos++;
        return type;
    }

    // X or X=
    private TokenType withAssign(TokenType plain, TokenType assign) {
        if (peekAt(1) == '=') {
            pos += 2;
            return assign;
        }
        pos++;
        return plain;
    }

    // X, XX or X=
    private TokenType operator(char ch, TokenType plain, TokenType doubled, TokenType assign) {
        if (peekAt(1) == ch) {
            pos += 2;
            return doubled;
        }
        return withAssign(plain, assign);
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private Token make(TokenType type, String lexeme, Object literal, int start, int startLine, int startCol,
                       String raw, boolean escaped) {
        return new Token(type, lexeme, literal, startLine, startCol, start, pos, line, pos - lineStart, raw, escaped);
    }

    // Error at an offset on the current line or an earlier one
    private ParseException error(String message, int offset) {
        SourceLocation.Position at = LineInfo.of(source, offset);
        return new ParseException("SyntaxError", message, offset, at.line(), at.column());
    }

    private char peekAt(int ahead) {
        int index = pos + ahead;
        return index < length ? source.charAt(index) : '\0';
    }

    static boolean isLineTerminator(char c) {
        return c == '\n' || c == '\r' || c == '\u2028' || c == '\u2029';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    // ASCII only; other Unicode digits are not part of numeric literals
    private static int hexValue(char c) {
        if (c >= '0' && c <= '9') {
            return c - '0';
        }
        if (c >= 'a' && c <= 'f') {
            return c - 'a' + 10;
        }
        if (c >= 'A' && c <= 'F') {
            return c - 'A' + 10;
        }
        return -1;
    }

    static boolean isIdentifierStart(int cp) {
        if (cp < 128) {
            return (cp >= 'a' && cp <= 'z') || (cp >= 'A' && cp <= 'Z') || cp == '$' || cp == '_';
        }
        return Character.isUnicodeIdentifierStart(cp);
    }

    static boolean isIdentifierPart(int cp) {
        if (cp < 128) {
            return (cp >= 'a' && cp <= 'z') || (cp >= 'A' && cp <= 'Z') || (cp >= '0' && cp <= '9')
                || cp == '$' || cp == '_';
        }
        return cp == '\u200C' || cp == '\u200D'
            || (Character.isUnicodeIdentifierPart(cp) && !Character.isIdentifierIgnorable(cp));
    }
}
