package com.cellparser;

import com.cellparser.ast.Span;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * State collected while one cell body is parsed: the FileAttachment
 * literals and whether the cell's own function level awaits or yields.
 *
 * <p>When the cell body is a function (named or not), that function's body
 * belongs to the cell's own level too.</p>
 */
final class CellScope {

    private final Map<String, List<Span>> fileAttachments = new LinkedHashMap<>();
    private boolean async;
    private boolean generator;

    private boolean declaresFunction;
    private boolean declaredFunctionEntered;
    private boolean inDeclaredFunction;

    void recordFileAttachment(String name, Span span) {
        fileAttachments.computeIfAbsent(name, k -> new ArrayList<>()).add(span);
    }

    void markAsync() {
        async = true;
    }

    void markGenerator() {
        generator = true;
    }

    boolean async() {
        return async;
    }

    boolean generator() {
        return generator;
    }

    Map<String, List<Span>> fileAttachments() {
        Map<String, List<Span>> copy = new LinkedHashMap<>();
        fileAttachments.forEach((name, spans) -> copy.put(name, List.copyOf(spans)));
        return Collections.unmodifiableMap(copy);
    }

    /**
     * The body about to be parsed starts with {@code function} or
     * {@code async function}.
     */
    void expectDeclaredFunction() {
        declaresFunction = true;
    }

    // Called for every function scope opened directly at the cell level
    void enterFunction() {
        if (declaresFunction && !declaredFunctionEntered) {
            declaredFunctionEntered = true;
            inDeclaredFunction = true;
        }
    }

    void exitDeclaredFunction() {
        inDeclaredFunction = false;
    }

    boolean inDeclaredFunction() {
        return inDeclaredFunction;
    }
}
