package com.cellparser;

import com.cellparser.ast.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ParserTest {

    private static Expression expression(String source) {
        Program program = Parser.parseScript(source);
        assertEquals(1, program.body().size());
        return ((ExpressionStatement) program.body().get(0)).expression();
    }

    @Test
    void testVariableDeclaration() {
        Program program = Parser.parseScript("var a = 1, b;");

        assertEquals("script", program.sourceType());
        VariableDeclaration declaration = (VariableDeclaration) program.body().get(0);
        assertEquals("var", declaration.kind());
        assertEquals(2, declaration.declarations().size());
        assertEquals("a", ((Identifier) declaration.declarations().get(0).id()).name());
        assertNull(declaration.declarations().get(1).init());
    }

    @Test
    @DisplayName("Multiplication binds tighter than addition")
    void testPrecedence() {
        BinaryExpression sum = (BinaryExpression) expression("a + b * c");

        assertEquals("+", sum.operator());
        assertEquals("a", ((Identifier) sum.left()).name());
        BinaryExpression product = (BinaryExpression) sum.right();
        assertEquals("*", product.operator());
    }

    @Test
    void testExponentIsRightAssociative() {
        BinaryExpression power = (BinaryExpression) expression("a ** b ** c");

        assertEquals("a", ((Identifier) power.left()).name());
        assertInstanceOf(BinaryExpression.class, power.right());
    }

    @Test
    void testAssignmentChain() {
        AssignmentExpression outer = (AssignmentExpression) expression("a = b = 1");

        assertEquals("a", ((Identifier) outer.left()).name());
        assertInstanceOf(AssignmentExpression.class, outer.right());
    }

    @Test
    void testDestructuringAssignment() {
        AssignmentExpression assignment = (AssignmentExpression) expression("[a, {b}] = c");

        ArrayPattern pattern = (ArrayPattern) assignment.left();
        assertEquals(2, pattern.elements().size());
        assertInstanceOf(ObjectPattern.class, pattern.elements().get(1));
    }

    @Test
    void testArrowFunction() {
        ArrowFunctionExpression arrow = (ArrowFunctionExpression) expression("(a, b) => a + b");

        assertTrue(arrow.expression());
        assertEquals(2, arrow.params().size());
        assertFalse(arrow.async());
    }

    @Test
    void testAsyncArrowFunction() {
        ArrowFunctionExpression arrow = (ArrowFunctionExpression) expression("async x => await x");

        assertTrue(arrow.async());
        assertInstanceOf(AwaitExpression.class, arrow.body());
    }

    @Test
    void testOptionalChaining() {
        ChainExpression chain = (ChainExpression) expression("a?.b.c");

        MemberExpression outer = (MemberExpression) chain.expression();
        assertEquals("c", ((Identifier) outer.property()).name());
    }

    @Test
    void testTemplateLiteral() {
        TemplateLiteral template = (TemplateLiteral) expression("`a${b}c`");

        assertEquals(2, template.quasis().size());
        assertEquals(1, template.expressions().size());
        assertEquals("a", template.quasis().get(0).value().cooked());
        assertTrue(template.quasis().get(1).tail());
    }

    @Test
    void testTaggedTemplate() {
        TaggedTemplateExpression tagged = (TaggedTemplateExpression) expression("html`<b>${x}</b>`");

        assertEquals("html", ((Identifier) tagged.tag()).name());
        assertEquals(1, tagged.quasi().expressions().size());
    }

    @Test
    void testClassDeclaration() {
        Program program = Parser.parseScript("class A extends B { constructor() { super(); } static m() {} get x() { return 1; } }");

        ClassDeclaration declaration = (ClassDeclaration) program.body().get(0);
        assertEquals("A", declaration.id().name());
        assertEquals("B", ((Identifier) declaration.superClass()).name());
        assertEquals(3, declaration.body().body().size());
        MethodDefinition method = declaration.body().body().get(1);
        assertTrue(method.isStatic());
        assertEquals("get", declaration.body().body().get(2).kind());
    }

    @Test
    void testDynamicImport() {
        assertInstanceOf(ImportExpression.class, expression("import(\"module\")"));
    }

    @Test
    void testNumberLiteral() {
        Literal literal = (Literal) expression("0x10");

        assertEquals(16.0, literal.value());
        assertEquals("0x10", literal.raw());
    }

    @Test
    void testNodePositions() {
        Program program = Parser.parseScript("a;\n  b + c;");

        ExpressionStatement second = (ExpressionStatement) program.body().get(1);
        assertEquals(5, second.start());
        assertEquals(11, second.end());
        assertEquals(2, second.startLine());
        assertEquals(2, second.startCol());
        assertEquals(new SourceLocation.Position(2, 8), second.loc().end());
    }

    @Test
    void testAutomaticSemicolonInsertion() {
        Program program = Parser.parseScript("a = 1\nb = 2");
        assertEquals(2, program.body().size());
    }

    @Test
    void testMissingSemicolon() {
        assertThrows(UnexpectedTokenException.class, () -> Parser.parseScript("a b"));
    }

    @Test
    void testUnexpectedEndOfInput() {
        UnexpectedTokenException e = assertThrows(UnexpectedTokenException.class, () -> Parser.parseScript("a +"));
        assertEquals("Unexpected end of input", e.getMessage());
    }

    @Test
    @DisplayName("Mixing ?? with || needs parentheses")
    void testNullishMixing() {
        assertThrows(ParseException.class, () -> Parser.parseScript("a ?? b || c"));
        assertDoesNotThrow(() -> Parser.parseScript("(a ?? b) || c"));
    }

    @Test
    void testWithStatementInSloppyCode() {
        assertDoesNotThrow(() -> Parser.parseScript("with (obj) { x = 1; }"));
    }

    @Test
    @DisplayName("A 'use strict' directive applies to the rest of the program")
    void testStrictDirective() {
        assertThrows(ParseException.class, () -> Parser.parseScript("\"use strict\"; with (obj) {}"));
        assertThrows(ParseException.class, () -> Parser.parseScript("function f() { \"use strict\"; with (obj) {} }"));
    }

    @Test
    void testDirectiveIsRecorded() {
        Program program = Parser.parseScript("'use strict';");
        assertEquals("use strict", ((ExpressionStatement) program.body().get(0)).directive());
    }

    @Test
    void testLexicalRedeclaration() {
        assertThrows(ParseException.class, () -> Parser.parseScript("let a; let a;"));
        assertDoesNotThrow(() -> Parser.parseScript("var a; var a;"));
    }

    @Test
    void testReturnOutsideFunction() {
        assertThrows(ParseException.class, () -> Parser.parseScript("return 1;"));
        assertDoesNotThrow(() -> Parser.parseScript("function f() { return 1; }"));
    }

    @Test
    void testInvalidAssignmentTarget() {
        assertThrows(ParseException.class, () -> Parser.parseScript("1 = a"));
        assertThrows(ParseException.class, () -> Parser.parseScript("a + b = c"));
    }

    @Test
    void testStatements() {
        String source = """
            label: for (let i = 0; i < 10; i++) {
              if (i % 2) continue label;
              switch (i) { case 1: break; default: }
            }
            for (const k in o) {}
            for (const v of list) {}
            while (false) {}
            do {} while (false)
            try { throw new Error("x"); } catch ({message}) {} finally {}
            """;

        Program program = Parser.parseScript(source);

        assertEquals(7, program.body().size());
        assertInstanceOf(LabeledStatement.class, program.body().get(0));
        assertInstanceOf(ForInStatement.class, program.body().get(1));
        assertInstanceOf(ForOfStatement.class, program.body().get(2));
        assertInstanceOf(TryStatement.class, program.body().get(6));
    }

    @Test
    @DisplayName("A slash after a parenthesized condition starts a regex")
    void testRegexAfterCondition() {
        Program program = Parser.parseScript("if (a) /re/g.test(b);");

        IfStatement statement = (IfStatement) program.body().get(0);
        CallExpression call = (CallExpression) ((ExpressionStatement) statement.consequent()).expression();
        Literal regex = (Literal) ((MemberExpression) call.callee()).object();
        assertEquals(new Literal.RegexInfo("re", "g"), regex.regex());
    }

    @Test
    @DisplayName("A slash after an object literal is division")
    void testDivisionAfterObjectLiteral() {
        AssignmentExpression assignment = (AssignmentExpression) expression("x = ({} / 2)");

        BinaryExpression division = (BinaryExpression) assignment.right();
        assertEquals("/", division.operator());
        assertInstanceOf(ObjectExpression.class, division.left());
        assertEquals(2.0, ((Literal) division.right()).value());
    }

    @Test
    void testDivisionAcrossLines() {
        AssignmentExpression assignment = (AssignmentExpression) expression("x = {}\n/c/g");

        BinaryExpression outer = (BinaryExpression) assignment.right();
        assertEquals("g", ((Identifier) outer.right()).name());
        BinaryExpression inner = (BinaryExpression) outer.left();
        assertInstanceOf(ObjectExpression.class, inner.left());
        assertEquals("c", ((Identifier) inner.right()).name());
    }

    @Test
    void testDivisionInsideTemplateSubstitution() {
        TemplateLiteral template = (TemplateLiteral) expression("`${ {} / 2 / 1 }`");

        assertEquals(2, template.quasis().size());
        BinaryExpression division = (BinaryExpression) template.expressions().get(0);
        assertEquals("/", division.operator());
        assertInstanceOf(BinaryExpression.class, division.left());
    }

    @Test
    void testRegexAfterYield() {
        Program program = Parser.parseScript("function* g() { yield /re/g; }");

        FunctionDeclaration function = (FunctionDeclaration) program.body().get(0);
        YieldExpression yieldExpression = (YieldExpression)
            ((ExpressionStatement) function.body().body().get(0)).expression();
        assertEquals("re", ((Literal) yieldExpression.argument()).regex().pattern());
    }

    @Test
    void testRegexStartingWithEquals() {
        Program program = Parser.parseScript("if (a) /=a/.test(b);");

        IfStatement statement = (IfStatement) program.body().get(0);
        CallExpression call = (CallExpression) ((ExpressionStatement) statement.consequent()).expression();
        Literal regex = (Literal) ((MemberExpression) call.callee()).object();
        assertEquals("=a", regex.regex().pattern());
    }

    @Test
    void testUnterminatedRegex() {
        ParseException e = assertThrows(ParseException.class, () -> Parser.parseScript("x = /abc"));

        assertEquals("Unterminated regular expression", e.getMessage());
        assertEquals(4, e.position());
    }

    @Test
    void testNonAsciiDigitIsSyntaxError() {
        ParseException e = assertThrows(ParseException.class, () -> Parser.parseScript("x = 2\u0663"));
        assertEquals(5, e.position());
    }

    @Test
    void testAwaitIsAnIdentifierInScripts() {
        assertInstanceOf(Identifier.class, expression("await"));
    }
}
