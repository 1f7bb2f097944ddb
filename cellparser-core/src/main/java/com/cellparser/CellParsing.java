package com.cellparser;

import com.cellparser.ast.Cell;
import com.cellparser.ast.CellModule;
import com.cellparser.ast.ImportDeclaration;
import com.cellparser.ast.SourceLocation;

import java.util.Optional;

/**
 * Entry points for parsing notebook source text.
 *
 * <pre>{@code
 * Cell cell = CellParsing.parseCell("viewof x = html`<input>`");
 * cell.id();          // ViewExpression x
 * cell.references();  // [html]
 * }</pre>
 *
 * Every operation other than {@link #peekId(String)} fails with a
 * {@link ParseException} on the first syntax or reference error.
 */
public final class CellParsing {

    private CellParsing() {
    }

    public static Cell parseCell(String input) {
        return parseCell(input, ParseOptions.defaults());
    }

    /**
     * Parses a source text holding one cell and resolves its references
     * against {@code options.globals()}.
     */
    public static Cell parseCell(String input, ParseOptions options) {
        Cell cell = CellParser.parseCell(input);
        resolveReferences(cell, new LineInfo(input), options);
        return cell;
    }

    /**
     * The declared name of the first cell, if its leading tokens show one.
     * Never throws.
     */
    public static Optional<String> peekId(String input) {
        return NameProbe.peekId(input);
    }

    public static CellModule parseModule(String input) {
        return parseModule(input, ParseOptions.defaults());
    }

    /**
     * Parses a source text as a sequence of cells and resolves the
     * references of each.
     */
    public static CellModule parseModule(String input, ParseOptions options) {
        CellModule module = ModuleParser.parseModule(input);
        LineInfo lineInfo = new LineInfo(input);
        for (Cell cell : module.cells()) {
            resolveReferences(cell, lineInfo, options);
        }
        return module;
    }

    // Import cells and empty cells have no references
    private static void resolveReferences(Cell cell, LineInfo lineInfo, ParseOptions options) {
        if (cell.body() == null || cell.body() instanceof ImportDeclaration) {
            return;
        }
        try {
            cell.setReferences(ReferenceFinder.findReferences(cell, options.globals()));
        } catch (IllegalReferenceException e) {
            int offset = e.node().start();
            SourceLocation.Position position = lineInfo.position(offset);
            ParseException error = new ParseException("SyntaxError",
                e.getMessage() + " (" + position.line() + ":" + position.column() + ")",
                offset, position.line(), position.column());
            error.initCause(e);
            throw error;
        }
    }
}
