package com.cellparser.ast;

/**
 * Half-open source range {@code [start, end)}.
 */
public record Span(int start, int end) {

    public String slice(String source) {
        return source.substring(start, end);
    }
}
