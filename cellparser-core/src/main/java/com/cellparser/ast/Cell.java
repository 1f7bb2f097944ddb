package com.cellparser.ast;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * One reactively evaluated unit of a notebook.
 *
 * <p>Everything except {@link #references()} is fixed at parse time. The
 * references are filled in exactly once by the reference resolver; import
 * cells and empty cells never receive them.</p>
 */
public final class Cell implements Node {

    private final int start;
    private final int end;
    private final int startLine;
    private final int startCol;
    private final int endLine;
    private final int endCol;
    private final CellName id;
    private final Node body;
    private final boolean async;
    private final boolean generator;
    private final Map<String, List<Span>> fileAttachments;
    private final String input;
    private List<CellName> references;

    public Cell(
        int start,
        int end,
        int startLine,
        int startCol,
        int endLine,
        int endCol,
        CellName id,
        Node body,
        boolean async,
        boolean generator,
        Map<String, List<Span>> fileAttachments,
        String input
    ) {
        this.start = start;
        this.end = end;
        this.startLine = startLine;
        this.startCol = startCol;
        this.endLine = endLine;
        this.endCol = endCol;
        this.id = id;
        this.body = body;
        this.async = async;
        this.generator = generator;
        this.fileAttachments = Collections.unmodifiableMap(fileAttachments);
        this.input = input;
    }

    /**
     * Returns a copy of this cell that carries the full source text it was
     * parsed from.
     */
    public Cell withInput(String input) {
        if (references != null) {
            throw new IllegalStateException("Cell references are already resolved");
        }
        return new Cell(start, end, startLine, startCol, endLine, endCol,
            id, body, async, generator, fileAttachments, input);
    }

    @Override
    public String type() {
        return "Cell";
    }

    @Override
    public int start() {
        return start;
    }

    @Override
    public int end() {
        return end;
    }

    @Override
    public int startLine() {
        return startLine;
    }

    @Override
    public int startCol() {
        return startCol;
    }

    @Override
    public int endLine() {
        return endLine;
    }

    @Override
    public int endCol() {
        return endCol;
    }

    /**
     * The declared name, or null for an anonymous cell.
     */
    public CellName id() {
        return id;
    }

    /**
     * ImportDeclaration, BlockStatement or an Expression; null for an empty cell.
     */
    public Node body() {
        return body;
    }

    public boolean async() {
        return async;
    }

    public boolean generator() {
        return generator;
    }

    /**
     * Every literal passed to {@code FileAttachment(...)}, mapped to the spans
     * of the literal tokens in source order.
     */
    public Map<String, List<Span>> fileAttachments() {
        return fileAttachments;
    }

    /**
     * The source text of the whole module, when the cell was parsed as part
     * of one; otherwise null.
     */
    public String input() {
        return input;
    }

    /**
     * The free references of the body, or null until resolved.
     */
    public List<CellName> references() {
        return references;
    }

    public void setReferences(List<CellName> references) {
        if (this.references != null) {
            throw new IllegalStateException("Cell references are already resolved");
        }
        this.references = List.copyOf(references);
    }

    @Override
    public String toString() {
        return "Cell[id=" + id + ", body=" + (body == null ? null : body.type())
            + ", async=" + async + ", generator=" + generator + "]";
    }
}
