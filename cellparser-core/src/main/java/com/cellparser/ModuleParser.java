package com.cellparser;

import com.cellparser.ast.Cell;
import com.cellparser.ast.CellModule;
import com.cellparser.ast.SourceLocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses a source text as a sequence of cells, in source order. Each cell
 * carries the whole source text as its {@link Cell#input()}.
 */
public class ModuleParser extends CellParser {

    private static final Logger logger = LoggerFactory.getLogger(ModuleParser.class);

    public ModuleParser(String source) {
        super(source);
    }

    public static CellModule parseModule(String source) {
        return new ModuleParser(source).parseModule();
    }

    public CellModule parseModule() {
        List<Cell> cells = new ArrayList<>();
        while (!isAtEnd()) {
            cells.add(parseCell(false).withInput(source()));
        }
        logger.debug("Parsed {} cells from {} characters", cells.size(), source().length());
        SourceLocation.Position end = positionOf(source().length());
        return new CellModule(0, source().length(), 1, 0, end.line(), end.column(), cells);
    }
}
