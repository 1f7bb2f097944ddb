package com.cellparser;

import com.cellparser.ast.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ModuleParserTest {

    @Test
    @DisplayName("Cells come back in source order, each independently valid")
    void testTwoCells() {
        String source = "a = 1\nb = 2";
        CellModule module = ModuleParser.parseModule(source);

        assertEquals("Program", module.type());
        List<Cell> cells = module.cells();
        assertEquals(2, cells.size());
        assertEquals("a", cells.get(0).id().identifier().name());
        assertEquals("b", cells.get(1).id().identifier().name());

        assertEquals(0, cells.get(0).start());
        assertEquals(5, cells.get(0).end());
        assertEquals(6, cells.get(1).start());
        assertEquals(2, cells.get(1).startLine());
        assertEquals(0, module.start());
        assertEquals(source.length(), module.end());
    }

    @Test
    void testCellsCarryTheWholeInput() {
        String source = "x = 1; y = x + 1;";
        CellModule module = ModuleParser.parseModule(source);

        assertEquals(2, module.cells().size());
        for (Cell cell : module.cells()) {
            assertSame(source, cell.input());
        }
    }

    @Test
    void testMixedCellKinds() {
        String source = """
            import {chart} with {data} from "@d3/bar-chart"
            viewof n = slider()
            mutable total = 0
            {
              let sum = 0;
              for (const v of values) sum += v;
              return sum;
            }
            function area(r) { return Math.PI * r * r; }
            data = FileAttachment("data.csv").csv()
            """;
        List<Cell> cells = ModuleParser.parseModule(source).cells();

        assertEquals(6, cells.size());
        assertInstanceOf(ImportDeclaration.class, cells.get(0).body());
        assertInstanceOf(ViewExpression.class, cells.get(1).id());
        assertInstanceOf(MutableExpression.class, cells.get(2).id());
        assertInstanceOf(BlockStatement.class, cells.get(3).body());
        assertNull(cells.get(3).id());
        assertEquals("area", cells.get(4).id().identifier().name());
        assertTrue(cells.get(5).fileAttachments().containsKey("data.csv"));
        assertTrue(cells.get(0).fileAttachments().isEmpty());
    }

    @Test
    @DisplayName("Each cell tracks its own async and generator flags")
    void testFlagsArePerCell() {
        List<Cell> cells = ModuleParser.parseModule("a = await b\nc = d\ne = { yield 1; }").cells();

        assertTrue(cells.get(0).async());
        assertFalse(cells.get(1).async());
        assertFalse(cells.get(1).generator());
        assertTrue(cells.get(2).generator());
    }

    @Test
    void testEmptyModule() {
        assertTrue(ModuleParser.parseModule("").cells().isEmpty());
        assertTrue(ModuleParser.parseModule("  // only a comment\n").cells().isEmpty());
    }

    @Test
    void testEmptyStatementsBecomeEmptyCells() {
        List<Cell> cells = ModuleParser.parseModule("a = 1;;").cells();

        assertEquals(2, cells.size());
        assertNull(cells.get(1).body());
    }

    @Test
    @DisplayName("A failing cell fails the whole module")
    void testFailureAbortsModule() {
        ParseException e = assertThrows(ParseException.class,
            () -> ModuleParser.parseModule("a = 1\nb = FileAttachment(c)\nd = 2"));

        assertEquals(CellParser.FILE_ATTACHMENT_MESSAGE, e.getMessage());
        assertEquals(2, e.line());
    }

    @Test
    void testStrayClosingBrace() {
        assertThrows(UnexpectedTokenException.class, () -> ModuleParser.parseModule("a = 1 }"));
    }
}
