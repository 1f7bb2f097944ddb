package com.cellparser;

import com.cellparser.ast.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CellParserTest {

    @Nested
    class Names {

        @Test
        void testPlainName() {
            Cell cell = CellParser.parseCell("x = 1");

            Identifier id = assertInstanceOf(Identifier.class, cell.id());
            assertEquals("x", id.name());
            assertEquals(CellName.Kind.PLAIN, id.kind());
            assertInstanceOf(Literal.class, cell.body());
        }

        @Test
        void testViewName() {
            Cell cell = CellParser.parseCell("viewof x = 1");

            ViewExpression id = assertInstanceOf(ViewExpression.class, cell.id());
            assertEquals("x", id.id().name());
            assertEquals(CellName.Kind.VIEW, id.kind());
            assertFalse(id.assignable());
            assertEquals(0, id.start());
            assertEquals(8, id.end());
        }

        @Test
        void testMutableName() {
            Cell cell = CellParser.parseCell("mutable x = 1");

            MutableExpression id = assertInstanceOf(MutableExpression.class, cell.id());
            assertEquals("x", id.identifier().name());
            assertEquals(CellName.Kind.MUTABLE, id.kind());
            assertTrue(id.assignable());
        }

        @Test
        void testAnonymousExpression() {
            Cell cell = CellParser.parseCell("x + 1");

            assertNull(cell.id());
            assertInstanceOf(BinaryExpression.class, cell.body());
        }

        @Test
        void testBlockCell() {
            Cell cell = CellParser.parseCell("x = { const a = 1; return a * 2; }");

            assertEquals("x", cell.id().identifier().name());
            BlockStatement block = assertInstanceOf(BlockStatement.class, cell.body());
            assertEquals(2, block.body().size());
        }

        @Test
        void testObjectLiteralNeedsParentheses() {
            Cell cell = CellParser.parseCell("x = ({a: 1})");
            assertInstanceOf(ObjectExpression.class, cell.body());
        }

        @Test
        void testFunctionNameBecomesCellName() {
            Cell cell = CellParser.parseCell("function f(a) { return a; }");

            assertEquals("f", cell.id().identifier().name());
            FunctionExpression function = assertInstanceOf(FunctionExpression.class, cell.body());
            assertEquals(1, function.params().size());
        }

        @Test
        void testClassNameBecomesCellName() {
            Cell cell = CellParser.parseCell("class Point { constructor(x) { this.x = x; } }");

            assertEquals("Point", cell.id().identifier().name());
            assertInstanceOf(ClassExpression.class, cell.body());
        }

        @Test
        @DisplayName("An explicit name wins over the function's own name")
        void testExplicitNameWins() {
            Cell cell = CellParser.parseCell("f = function g() {}");

            assertEquals("f", cell.id().identifier().name());
            assertEquals("g", ((FunctionExpression) cell.body()).id().name());
        }

        @Test
        void testAnonymousFunction() {
            Cell cell = CellParser.parseCell("function() { return 1; }");
            assertNull(cell.id());
        }

        @Test
        void testEmptyCell() {
            Cell cell = CellParser.parseCell("");

            assertNull(cell.id());
            assertNull(cell.body());
            assertFalse(cell.async());
            assertFalse(cell.generator());
        }

        @Test
        void testCommentOnlyCell() {
            Cell cell = CellParser.parseCell("// nothing here\n");
            assertNull(cell.body());
        }

        @Test
        void testCellSpansWholeInput() {
            Cell cell = CellParser.parseCell("  x = 1;  ");

            assertEquals(0, cell.start());
            assertEquals(10, cell.end());
        }

        @Test
        void testViewofInsideBody() {
            Cell cell = CellParser.parseCell("viewof x.value");

            MemberExpression member = assertInstanceOf(MemberExpression.class, cell.body());
            assertInstanceOf(ViewExpression.class, member.object());
        }

        @Test
        @DisplayName("mutable x is a valid assignment target inside a cell")
        void testMutableAssignment() {
            Cell cell = CellParser.parseCell("{ mutable count += 1; }");

            BlockStatement block = (BlockStatement) cell.body();
            AssignmentExpression assignment = (AssignmentExpression) ((ExpressionStatement) block.body().get(0)).expression();
            assertInstanceOf(MutableExpression.class, assignment.left());
            assertEquals("+=", assignment.operator());
        }

        @Test
        void testViewofIsNotAssignable() {
            assertThrows(ParseException.class, () -> CellParser.parseCell("{ viewof x = 1; }"));
        }

        @Test
        void testViewofWithoutName() {
            UnexpectedTokenException e = assertThrows(UnexpectedTokenException.class,
                () -> CellParser.parseCell("viewof = 1"));
            assertEquals(7, e.position());
        }

        @Test
        void testModifierAsBindingName() {
            ParseException e = assertThrows(ParseException.class, () -> CellParser.parseCell("{ let viewof = 1; }"));
            assertEquals("Unexpected keyword 'viewof'", e.getMessage());

            e = assertThrows(ParseException.class, () -> CellParser.parseCell("function(mutable) {}"));
            assertEquals("Unexpected keyword 'mutable'", e.getMessage());
        }

        @Test
        void testModifierAsPropertyName() {
            assertDoesNotThrow(() -> CellParser.parseCell("x = ({viewof: 1, mutable: 2}).viewof"));
        }

        @Test
        void testTrailingInput() {
            assertThrows(UnexpectedTokenException.class, () -> CellParser.parseCell("x = 1; y = 2"));
            assertThrows(UnexpectedTokenException.class, () -> CellParser.parseCell("x = 1 }"));
        }

        @Test
        void testCellCodeIsStrict() {
            assertThrows(ParseException.class, () -> CellParser.parseCell("{ with (o) {} }"));
            assertThrows(ParseException.class, () -> CellParser.parseCell("x = 010"));
        }
    }

    @Nested
    class Imports {

        @Test
        void testSpecifiers() {
            Cell cell = CellParser.parseCell("import {a, b as c} from \"m\"");

            ImportDeclaration declaration = assertInstanceOf(ImportDeclaration.class, cell.body());
            assertEquals(2, declaration.specifiers().size());
            assertEquals("a", declaration.specifiers().get(0).local().name());
            assertEquals("b", declaration.specifiers().get(1).imported().name());
            assertEquals("c", declaration.specifiers().get(1).local().name());
            assertNull(declaration.injections());
            assertEquals("m", declaration.source().value());
            assertNull(cell.id());
        }

        @Test
        void testInjections() {
            Cell cell = CellParser.parseCell("import {a} with {b} from \"m\"");

            ImportDeclaration declaration = (ImportDeclaration) cell.body();
            assertEquals(1, declaration.specifiers().size());
            assertEquals("a", declaration.specifiers().get(0).local().name());
            assertEquals(1, declaration.injections().size());
            assertEquals("b", declaration.injections().get(0).imported().name());
        }

        @Test
        void testInjectionRenamed() {
            Cell cell = CellParser.parseCell("import {chart} with {data as source} from \"@d3/bar-chart\"");

            ImportSpecifier injection = ((ImportDeclaration) cell.body()).injections().get(0);
            assertEquals("data", injection.imported().name());
            assertEquals("source", injection.local().name());
        }

        @Test
        void testModifiedSpecifiers() {
            Cell cell = CellParser.parseCell("import {viewof a, mutable b as c} from \"m\"");

            List<ImportSpecifier> specifiers = ((ImportDeclaration) cell.body()).specifiers();
            assertTrue(specifiers.get(0).view());
            assertFalse(specifiers.get(0).mutable());
            assertEquals("a", specifiers.get(0).imported().name());
            assertTrue(specifiers.get(1).mutable());
            assertEquals("c", specifiers.get(1).local().name());
            assertEquals(8, specifiers.get(0).start());
        }

        @Test
        void testTrailingCommaAndEmptyList() {
            assertEquals(2, ((ImportDeclaration) CellParser.parseCell("import {a, b,} from \"m\"").body()).specifiers().size());
            assertEquals(0, ((ImportDeclaration) CellParser.parseCell("import {} from \"m\"").body()).specifiers().size());
        }

        @Test
        void testMalformedImports() {
            assertThrows(ParseException.class, () -> CellParser.parseCell("import a from \"m\""));
            assertThrows(ParseException.class, () -> CellParser.parseCell("import {a} \"m\""));
            assertThrows(ParseException.class, () -> CellParser.parseCell("import {a} from m"));
            assertThrows(ParseException.class, () -> CellParser.parseCell("import {a b} from \"m\""));
            assertThrows(ParseException.class, () -> CellParser.parseCell("import {a} with from \"m\""));
            assertThrows(ParseException.class, () -> CellParser.parseCell("import {default} from \"m\""));
        }

        @Test
        @DisplayName("import followed by '(' is a dynamic import expression")
        void testDynamicImportIsAnExpression() {
            Cell cell = CellParser.parseCell("d3 = import(\"d3\")");

            assertEquals("d3", cell.id().identifier().name());
            assertInstanceOf(ImportExpression.class, cell.body());
        }
    }

    @Nested
    class FileAttachments {

        @Test
        void testStringArgument() {
            String source = "FileAttachment(\"x.csv\")";
            Cell cell = CellParser.parseCell(source);

            List<Span> spans = cell.fileAttachments().get("x.csv");
            assertEquals(List.of(new Span(15, 22)), spans);
            assertEquals("\"x.csv\"", spans.get(0).slice(source));

            CallExpression call = assertInstanceOf(CallExpression.class, cell.body());
            assertEquals("FileAttachment", ((Identifier) call.callee()).name());
        }

        @Test
        void testTemplateArgument() {
            Cell cell = CellParser.parseCell("data = FileAttachment(`a b.json`).json()");

            assertEquals(List.of(new Span(22, 32)), cell.fileAttachments().get("a b.json"));
        }

        @Test
        @DisplayName("Every occurrence is recorded, in source order")
        void testRepeatedAttachments() {
            String source = "{ const a = FileAttachment('f.txt'); const b = FileAttachment('g.txt'); return FileAttachment('f.txt'); }";
            Cell cell = CellParser.parseCell(source);

            assertEquals(List.of("f.txt", "g.txt"), List.copyOf(cell.fileAttachments().keySet()));
            List<Span> spans = cell.fileAttachments().get("f.txt");
            assertEquals(2, spans.size());
            for (Span span : spans) {
                assertEquals("'f.txt'", span.slice(source));
            }
        }

        @Test
        void testNoAttachments() {
            assertTrue(CellParser.parseCell("x = 1").fileAttachments().isEmpty());
        }

        @Test
        void testNonLiteralArgument() {
            ParseException e = assertThrows(ParseException.class, () -> CellParser.parseCell("FileAttachment(x)"));

            assertEquals(CellParser.FILE_ATTACHMENT_MESSAGE, e.getMessage());
            assertEquals(15, e.position());
        }

        @Test
        void testInterpolatedTemplate() {
            ParseException e = assertThrows(ParseException.class, () -> CellParser.parseCell("FileAttachment(`${name}.csv`)"));

            assertEquals(CellParser.FILE_ATTACHMENT_MESSAGE, e.getMessage());
            assertEquals(18, e.position());
        }

        @Test
        void testExtraArgument() {
            ParseException e = assertThrows(ParseException.class, () -> CellParser.parseCell("FileAttachment(\"a\", \"b\")"));
            assertEquals(CellParser.FILE_ATTACHMENT_MESSAGE, e.getMessage());
        }

        @Test
        void testNoArgument() {
            ParseException e = assertThrows(ParseException.class, () -> CellParser.parseCell("FileAttachment()"));
            assertEquals(CellParser.FILE_ATTACHMENT_MESSAGE, e.getMessage());
        }

        @Test
        @DisplayName("FileAttachment without an immediate call is a reassignment")
        void testReassignment() {
            ParseException e = assertThrows(ParseException.class, () -> CellParser.parseCell("x = FileAttachment"));
            assertEquals(CellParser.FILE_ATTACHMENT_REASSIGN_MESSAGE, e.getMessage());

            e = assertThrows(ParseException.class, () -> CellParser.parseCell("{ FileAttachment = 1; }"));
            assertEquals(CellParser.FILE_ATTACHMENT_REASSIGN_MESSAGE, e.getMessage());
            assertEquals(17, e.position());
        }

        @Test
        void testErrorLocation() {
            ParseException e = assertThrows(ParseException.class, () -> CellParser.parseCell("x = 1 +\nFileAttachment(y)"));

            assertEquals(23, e.position());
            assertEquals(2, e.line());
            assertEquals(15, e.column());
        }
    }

    @Nested
    class AsyncAndGenerator {

        @Test
        void testTopLevelAwait() {
            Cell cell = CellParser.parseCell("x = await fetch(url)");

            assertTrue(cell.async());
            assertFalse(cell.generator());
        }

        @Test
        void testTopLevelYield() {
            Cell cell = CellParser.parseCell("{ let i = 0; while (true) { yield i++; } }");

            assertTrue(cell.generator());
            assertFalse(cell.async());
        }

        @Test
        void testForAwait() {
            assertTrue(CellParser.parseCell("{ for await (const chunk of stream) {} }").async());
        }

        @Test
        void testPlainCell() {
            Cell cell = CellParser.parseCell("x = y + 1");

            assertFalse(cell.async());
            assertFalse(cell.generator());
        }

        @Test
        @DisplayName("An async function cell awaiting in its own body is async")
        void testDeclaredAsyncFunction() {
            assertTrue(CellParser.parseCell("async function f() { await g(); }").async());
        }

        @Test
        void testDeclaredGeneratorFunction() {
            assertTrue(CellParser.parseCell("function* f() { yield 1; }").generator());
        }

        @Test
        @DisplayName("await in a nested function does not make the cell async")
        void testNestedAwait() {
            assertFalse(CellParser.parseCell("function f() { async function g() { await x; } }").async());
            assertFalse(CellParser.parseCell("async function f() { return async () => { await x; }; }").async());
        }

        @Test
        void testArrowCellIsNotAsync() {
            assertFalse(CellParser.parseCell("f = async () => { await x; }").async());
            assertFalse(CellParser.parseCell("async () => await x").async());
        }

        @Test
        void testMethodBodiesDoNotCount() {
            Cell cell = CellParser.parseCell("class A { async m() { await x; } *g() { yield 1; } }");

            assertFalse(cell.async());
            assertFalse(cell.generator());
        }

        @Test
        void testAwaitAfterNestedFunction() {
            Cell cell = CellParser.parseCell("{ const f = async () => { await a; }; return await f(); }");
            assertTrue(cell.async());
        }

        @Test
        @DisplayName("Only the function the cell declares counts, not a later one")
        void testFunctionInsideBlock() {
            assertFalse(CellParser.parseCell("{ async function f() { await x; } return f; }").async());
        }
    }

    @Nested
    class Slashes {

        @Test
        void testDivisionAfterObjectLiteral() {
            Cell cell = CellParser.parseCell("x = ({} / 2)");

            assertEquals("x", cell.id().identifier().name());
            BinaryExpression body = (BinaryExpression) cell.body();
            assertEquals("/", body.operator());
            assertInstanceOf(ObjectExpression.class, body.left());
        }

        @Test
        void testRegexAfterCondition() {
            Cell cell = CellParser.parseCell("{ if (a) /re/.test(b); }");

            BlockStatement block = (BlockStatement) cell.body();
            IfStatement statement = (IfStatement) block.body().get(0);
            CallExpression call = (CallExpression) ((ExpressionStatement) statement.consequent()).expression();
            Literal regex = (Literal) ((MemberExpression) call.callee()).object();
            assertEquals("re", regex.regex().pattern());
        }

        @Test
        @DisplayName("A digit from another script is a located syntax error")
        void testNonAsciiDigit() {
            ParseException e = assertThrows(ParseException.class, () -> CellParser.parseCell("a = 1\u0663"));

            assertEquals(5, e.position());
            assertEquals(1, e.line());
            assertEquals(5, e.column());
        }
    }
}
