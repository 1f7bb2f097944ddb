package com.cellparser;

import com.cellparser.ast.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps source offsets to 1-based lines and 0-based columns.
 * LF, CR, CRLF, LS and PS all end a line.
 */
public final class LineInfo {

    private final int length;
    private final int[] lineOffsets; // Starting offset of each line

    public LineInfo(String source) {
        this.length = source.length();
        this.lineOffsets = buildLineOffsetIndex(source);
    }

    /**
     * One-off lookup; builds a throwaway index.
     */
    public static SourceLocation.Position of(String source, int offset) {
        return new LineInfo(source).position(offset);
    }

    public SourceLocation.Position position(int offset) {
        offset = Math.max(0, Math.min(offset, length));

        // Binary search for the last line starting at or before the offset
        int low = 0;
        int high = lineOffsets.length - 1;
        int line = 1;
        while (low <= high) {
            int mid = (low + high) / 2;
            if (lineOffsets[mid] <= offset) {
                line = mid + 1;
                low = mid + 1;
            } else {
                high = mid - 1;
            }
        }
        return new SourceLocation.Position(line, offset - lineOffsets[line - 1]);
    }

    private static int[] buildLineOffsetIndex(String source) {
        List<Integer> offsets = new ArrayList<>();
        offsets.add(0);
        int length = source.length();
        for (int i = 0; i < length; i++) {
            char ch = source.charAt(i);
            if (ch == '\r' && i + 1 < length && source.charAt(i + 1) == '\n') {
                i++;
            }
            if (Lexer.isLineTerminator(ch)) {
                offsets.add(i + 1);
            }
        }
        return offsets.stream().mapToInt(Integer::intValue).toArray();
    }
}
