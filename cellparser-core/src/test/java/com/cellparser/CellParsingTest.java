package com.cellparser;

import com.cellparser.ast.*;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class CellParsingTest {

    @Test
    void testParseCellResolvesReferences() {
        Cell cell = CellParsing.parseCell("viewof x = html`<input type=range>`");

        assertInstanceOf(ViewExpression.class, cell.id());
        assertEquals(1, cell.references().size());
        assertEquals("html", cell.references().get(0).identifier().name());
    }

    @Test
    void testImportAndEmptyCellsHaveNoReferences() {
        assertNull(CellParsing.parseCell("import {a} from \"@x/y\"").references());
        assertNull(CellParsing.parseCell("").references());
        assertNull(CellParsing.parseCell("  // nothing\n").references());
    }

    @Test
    void testCellWithoutFreeNames() {
        assertEquals(List.of(), CellParsing.parseCell("1 + 2").references());
    }

    @Test
    void testReferenceErrorIsASyntaxError() {
        ParseException e = assertThrows(ParseException.class, () -> CellParsing.parseCell("{ arguments }"));

        assertEquals("SyntaxError", e.errorType());
        assertEquals("arguments is not allowed (1:2)", e.getMessage());
        assertEquals(2, e.position());
        assertEquals(1, e.line());
        assertEquals(2, e.column());
        assertInstanceOf(IllegalReferenceException.class, e.getCause());
    }

    @Test
    void testSyntaxErrorsPassThrough() {
        ParseException e = assertThrows(ParseException.class, () -> CellParsing.parseCell("a = "));
        assertNull(e.getCause());
    }

    @Test
    void testCustomGlobals() {
        ParseOptions options = ParseOptions.defaults().withGlobals(Set.of("d3"));

        Cell cell = CellParsing.parseCell("d3.sum(Math.abs(x))", options);

        List<String> names = cell.references().stream().map(name -> name.identifier().name()).toList();
        assertEquals(List.of("Math", "x"), names);
        assertTrue(ParseOptions.defaults().globals().contains("Math"));
    }

    @Test
    void testGlobalsAreCopied() {
        Set<String> globals = new java.util.HashSet<>(Set.of("a"));
        ParseOptions options = new ParseOptions(globals);
        globals.add("b");

        assertEquals(Set.of("a"), options.globals());
        assertThrows(NullPointerException.class, () -> new ParseOptions(null));
    }

    @Test
    void testPeekId() {
        assertEquals(Optional.of("chart"), CellParsing.peekId("chart = {"));
        assertEquals(Optional.empty(), CellParsing.peekId("1 + "));
    }

    @Test
    void testParseModuleResolvesEachCell() {
        CellModule module = CellParsing.parseModule("a = b + 1\nimport {b} from \"@x/y\"\nc = a * mutable d\n");

        assertEquals(3, module.cells().size());
        assertEquals(List.of("b"), module.cells().get(0).references().stream()
            .map(name -> name.identifier().name()).toList());
        assertNull(module.cells().get(1).references());

        List<CellName> third = module.cells().get(2).references();
        assertEquals(2, third.size());
        assertEquals(CellName.Kind.PLAIN, third.get(0).kind());
        assertEquals(CellName.Kind.MUTABLE, third.get(1).kind());
    }

    @Test
    void testModuleReferenceErrorReportsLine() {
        ParseException e = assertThrows(ParseException.class,
            () -> CellParsing.parseModule("a = 1\n{ Math = 2 }"));

        assertEquals("Assignment to constant variable Math (2:2)", e.getMessage());
        assertEquals(8, e.position());
        assertEquals(2, e.line());
        assertEquals(2, e.column());
    }

    @Test
    void testNonAsciiDigitInModule() {
        ParseException e = assertThrows(ParseException.class,
            () -> CellParsing.parseModule("a = 1\nb = 2\u0663"));

        assertEquals(11, e.position());
        assertEquals(2, e.line());
        assertEquals(5, e.column());
    }

    @Test
    void testFileAttachmentSpans() {
        String source = "data = FileAttachment(\"sales.csv\").csv()";

        Cell cell = CellParsing.parseCell(source);

        List<Span> spans = cell.fileAttachments().get("sales.csv");
        assertEquals(List.of(new Span(22, 33)), spans);
        assertEquals("\"sales.csv\"", spans.get(0).slice(source));
    }
}
