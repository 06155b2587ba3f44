package com.vidnyan.calltree.adapter.out.parser;

import java.util.List;

/**
 * Several physical lines joined with single spaces, remembering where each one
 * starts so offsets can be mapped back to (line, column).
 */
record LogicalLine(String text, List<Segment> segments) {

    /**
     * One physical line inside the joined text.
     *
     * @param lineIndex index into the file's line list
     * @param lineNumber 1-based line number
     * @param offset where the line's first character sits in the joined text
     * @param length length of the line's code
     */
    record Segment(int lineIndex, int lineNumber, int offset, int length) {
    }

    LogicalLine {
        segments = List.copyOf(segments);
    }

    int firstLineNumber() {
        return segments.get(0).lineNumber();
    }

    int lastLineNumber() {
        return segments.get(segments.size() - 1).lineNumber();
    }

    /**
     * Segment holding the character at the given offset of the joined text.
     * Offsets falling on a joining space belong to the preceding line.
     */
    Segment segmentAt(int offset) {
        Segment found = segments.get(0);
        for (Segment segment : segments) {
            if (segment.offset() <= offset) {
                found = segment;
            } else {
                break;
            }
        }
        return found;
    }
}
