package com.cellparser;

import java.util.Objects;
import java.util.Set;

/**
 * Options for {@link CellParsing}.
 *
 * @param globals names a cell may read without declaring them; any other
 *                free name is a reference to another cell
 */
public record ParseOptions(Set<String> globals) {

    private static final ParseOptions DEFAULTS = new ParseOptions(DefaultGlobals.NAMES);

    public ParseOptions {
        globals = Set.copyOf(Objects.requireNonNull(globals, "globals"));
    }

    /**
     * The {@link DefaultGlobals#NAMES default globals}.
     */
    public static ParseOptions defaults() {
        return DEFAULTS;
    }

    public ParseOptions withGlobals(Set<String> globals) {
        return new ParseOptions(globals);
    }
}
