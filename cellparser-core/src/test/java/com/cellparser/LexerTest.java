package com.cellparser;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class LexerTest {

    @Test
    @DisplayName("Tokens carry absolute offsets and 1-based lines")
    void testPositions() {
        List<Token> tokens = new Lexer("a = 1\nb").tokenize();

        assertEquals(5, tokens.size());
        assertEquals(TokenType.IDENTIFIER, tokens.get(0).type());
        assertEquals(TokenType.ASSIGN, tokens.get(1).type());
        assertEquals(TokenType.NUMBER, tokens.get(2).type());
        assertEquals(1.0, tokens.get(2).literal());

        Token b = tokens.get(3);
        assertEquals("b", b.lexeme());
        assertEquals(6, b.position());
        assertEquals(7, b.endPosition());
        assertEquals(2, b.line());
        assertEquals(0, b.column());

        assertEquals(TokenType.EOF, tokens.get(4).type());
    }

    @Test
    @DisplayName("A lexer started at an offset keeps absolute lines and columns")
    void testOffsetStart() {
        String source = "x = 1\ny = 2";
        Token token = new Lexer(source, 6).nextToken();

        assertEquals("y", token.lexeme());
        assertEquals(6, token.position());
        assertEquals(2, token.line());
        assertEquals(0, token.column());
    }

    @Test
    void testKeywordsAndContextualWords() {
        List<Token> tokens = new Lexer("import viewof with").tokenize();

        assertEquals(TokenType.IMPORT, tokens.get(0).type());
        assertEquals(TokenType.IDENTIFIER, tokens.get(1).type());
        assertTrue(tokens.get(1).isContextual("viewof"));
        assertEquals(TokenType.WITH, tokens.get(2).type());
    }

    @Test
    void testStringLiteralValue() {
        Token token = new Lexer("\"a\\nb\"").nextToken();

        assertEquals(TokenType.STRING, token.type());
        assertEquals("a\nb", token.literal());
        assertEquals("\"a\\nb\"", token.lexeme());
    }

    @Test
    @DisplayName("Slash after an operand is division, elsewhere a regex")
    void testRegexOrDivision() {
        List<Token> division = new Lexer("a / b").tokenize();
        assertEquals(TokenType.SLASH, division.get(1).type());

        List<Token> regex = new Lexer("x = /ab+c/g").tokenize();
        assertEquals(TokenType.REGEX, regex.get(2).type());
        assertEquals("/ab+c/g", regex.get(2).lexeme());
    }

    @Test
    void testTemplateParts() {
        List<Token> tokens = new Lexer("`a${b}c`").tokenize();

        assertEquals(TokenType.TEMPLATE_HEAD, tokens.get(0).type());
        assertEquals(TokenType.IDENTIFIER, tokens.get(1).type());
        assertEquals(TokenType.TEMPLATE_TAIL, tokens.get(2).type());
        assertEquals(TokenType.EOF, tokens.get(3).type());
    }

    @Test
    void testTemplateWithoutSubstitutions() {
        Token token = new Lexer("`data.csv`").nextToken();

        assertEquals(TokenType.TEMPLATE_LITERAL, token.type());
        assertEquals("data.csv", token.literal());
    }

    @Test
    void testCommentsAreSkipped() {
        List<Token> tokens = new Lexer("// note\n/* block */ a").tokenize();

        assertEquals(2, tokens.size());
        assertEquals("a", tokens.get(0).lexeme());
        assertEquals(2, tokens.get(0).line());
    }

    @Test
    @DisplayName("A lexer started at another lexer's token skips the line count")
    void testStartAtToken() {
        String source = "x = 1\ny = 2";
        Token y = new Lexer(source).tokenize().get(3);

        Lexer lexer = new Lexer(source, y);
        Token first = lexer.nextToken();
        Token second = lexer.nextToken();

        assertEquals("y", first.lexeme());
        assertEquals(2, first.line());
        assertEquals(0, first.column());
        assertEquals(TokenType.ASSIGN, second.type());
        assertEquals(2, second.line());
        assertEquals(2, second.column());
    }

    @Test
    void testSlashRescannedAsRegex() {
        Lexer lexer = new Lexer(") /a/g");
        lexer.nextToken();
        Lexer.State beforeSlash = lexer.save();

        assertEquals(TokenType.SLASH, lexer.nextToken().type());

        lexer.restore(beforeSlash);
        Token regex = lexer.nextToken(Lexer.SlashMode.REGEX);
        assertEquals(TokenType.REGEX, regex.type());
        assertEquals("/a/g", regex.lexeme());
        assertEquals(TokenType.EOF, lexer.nextToken().type());
    }

    @Test
    void testRegexRescannedAsDivisionInsideTemplate() {
        Lexer lexer = new Lexer("`${ {} / 2 / 1 }`");
        for (int i = 0; i < 3; i++) {
            lexer.nextToken();
        }
        Lexer.State beforeSlash = lexer.save();
        assertEquals(TokenType.REGEX, lexer.nextToken().type());

        lexer.restore(beforeSlash);
        assertEquals(TokenType.SLASH, lexer.nextToken(Lexer.SlashMode.DIVISION).type());
        assertEquals(TokenType.NUMBER, lexer.nextToken().type());
        assertEquals(TokenType.SLASH, lexer.nextToken().type());
        assertEquals(TokenType.NUMBER, lexer.nextToken().type());
        assertEquals(TokenType.TEMPLATE_TAIL, lexer.nextToken().type());
    }

    @Test
    @DisplayName("A guessed regex that never closes is read as division")
    void testUnclosedGuessIsDivision() {
        List<Token> tokens = new Lexer("{} / 2").tokenize();

        assertEquals(TokenType.SLASH, tokens.get(2).type());
        assertEquals(TokenType.NUMBER, tokens.get(3).type());
    }

    @Test
    void testForcedRegexReportsErrors() {
        Lexer lexer = new Lexer("/abc");
        ParseException e = assertThrows(ParseException.class, () -> lexer.nextToken(Lexer.SlashMode.REGEX));
        assertEquals("Unterminated regular expression", e.getMessage());
    }

    @Test
    @DisplayName("Only ASCII digits make up numbers and escapes")
    void testNonAsciiDigits() {
        ParseException e = assertThrows(ParseException.class, () -> new Lexer("x 1\u0663").tokenize());
        assertEquals(3, e.position());
        assertEquals("Unexpected character '\u0663'", e.getMessage());

        assertThrows(ParseException.class, () -> new Lexer("0x\uFF11").tokenize());
        assertThrows(ParseException.class, () -> new Lexer("0\u0669").tokenize());
        assertThrows(ParseException.class, () -> new Lexer("'\\x\u0661\u0662'").tokenize());
        assertThrows(ParseException.class, () -> new Lexer("'\\u\uFF10041'").tokenize());
    }

    @Test
    void testUnterminatedString() {
        ParseException e = assertThrows(ParseException.class, () -> new Lexer("x = 'abc").tokenize());

        assertEquals("Unterminated string constant", e.getMessage());
        assertEquals(4, e.position());
        assertEquals(1, e.line());
        assertEquals(4, e.column());
    }

    @Test
    void testUnterminatedTemplate() {
        assertThrows(ParseException.class, () -> new Lexer("`abc").tokenize());
    }

    @Test
    void testEofRepeats() {
        Lexer lexer = new Lexer("");
        assertEquals(TokenType.EOF, lexer.nextToken().type());
        assertEquals(TokenType.EOF, lexer.nextToken().type());
    }
}
