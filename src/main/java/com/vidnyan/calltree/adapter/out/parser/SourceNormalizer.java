package com.vidnyan.calltree.adapter.out.parser;

import com.vidnyan.calltree.domain.model.SourceLine;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Removes C comments while keeping string and character literals intact.
 * <p>
 * Line structure is preserved: a block comment spanning several lines leaves the
 * same number of (emptied) lines behind, so line numbers stay stable. A block
 * comment that never closes is not stripped: its opening marker stays in place
 * as plain code, everything after it is normalized as usual, and the opening
 * line is reported.
 */
@Slf4j
public class SourceNormalizer {

    private enum State {
        CODE,
        LINE_COMMENT,
        BLOCK_COMMENT,
        STRING,
        CHAR
    }

    /**
     * Normalize a whole file.
     */
    public NormalizedSource normalize(String content) {
        Scan scan = scan(content, content.length());
        int unterminatedLine = 0;
        if (scan.openBlockOffset() >= 0) {
            unterminatedLine = scan.openBlockLine();
            log.debug("Block comment opened on line {} is never closed, keeping the marker as raw text",
                    unterminatedLine);
            scan = scan(content, scan.openBlockOffset());
        }
        return new NormalizedSource(markDirectives(scan.lines()), unterminatedLine);
    }

    /**
     * One pass of the comment state machine. A block comment marker at or after
     * {@code rawMarkersFrom} is kept as code instead of opening a comment.
     */
    private Scan scan(String content, int rawMarkersFrom) {
        List<SourceLine> lines = new ArrayList<>();
        StringBuilder text = new StringBuilder();
        StringBuilder code = new StringBuilder();
        boolean stripped = false;
        State state = State.CODE;
        int lineNumber = 1;
        int blockOffset = -1;
        int blockLine = 0;

        int n = content.length();
        for (int i = 0; i < n; i++) {
            char c = content.charAt(i);
            char next = i + 1 < n ? content.charAt(i + 1) : '\0';

            if (c == '\r') {
                if (next == '\n') {
                    continue;
                }
                c = '\n';
            }

            if (c == '\n') {
                if (state == State.STRING || state == State.CHAR) {
                    // an unterminated literal ends with its line
                    state = State.CODE;
                } else if (state == State.LINE_COMMENT) {
                    state = State.CODE;
                }
                lines.add(new SourceLine(lineNumber, text.toString(), code.toString(), stripped, false));
                text.setLength(0);
                code.setLength(0);
                stripped = state == State.BLOCK_COMMENT;
                lineNumber++;
                continue;
            }

            switch (state) {
                case CODE -> {
                    if (c == '/' && next == '/') {
                        state = State.LINE_COMMENT;
                        stripped = true;
                        i++;
                    } else if (c == '/' && next == '*' && i >= rawMarkersFrom) {
                        text.append("/*");
                        code.append("/*");
                        i++;
                    } else if (c == '/' && next == '*') {
                        blockOffset = i;
                        blockLine = lineNumber;
                        state = State.BLOCK_COMMENT;
                        stripped = true;
                        text.append(' ');
                        code.append(' ');
                        i++;
                    } else {
                        if (c == '"') {
                            state = State.STRING;
                        } else if (c == '\'') {
                            state = State.CHAR;
                        }
                        text.append(c);
                        code.append(c);
                    }
                }
                case LINE_COMMENT -> {
                    // dropped
                }
                case BLOCK_COMMENT -> {
                    if (c == '*' && next == '/') {
                        state = State.CODE;
                        i++;
                    }
                }
                case STRING, CHAR -> {
                    char quote = state == State.STRING ? '"' : '\'';
                    if (c == '\\' && next != '\0' && next != '\n' && next != '\r') {
                        text.append(c).append(next);
                        code.append("  ");
                        i++;
                    } else if (c == quote) {
                        state = State.CODE;
                        text.append(c);
                        code.append(c);
                    } else {
                        text.append(c);
                        code.append(' ');
                    }
                }
            }
        }

        if (text.length() > 0 || stripped) {
            lines.add(new SourceLine(lineNumber, text.toString(), code.toString(), stripped, false));
        }
        return state == State.BLOCK_COMMENT
                ? new Scan(lines, blockOffset, blockLine)
                : new Scan(lines, -1, 0);
    }

    private record Scan(List<SourceLine> lines, int openBlockOffset, int openBlockLine) {
    }

    /**
     * Logically join the code of lines {@code [from, to]} into one header string,
     * skipping preprocessor lines, and keep the originating line range.
     */
    LogicalLine join(List<SourceLine> lines, int from, int to) {
        StringBuilder joined = new StringBuilder();
        List<LogicalLine.Segment> segments = new ArrayList<>();
        for (int i = from; i <= to; i++) {
            SourceLine line = lines.get(i);
            if (line.directive()) {
                continue;
            }
            if (joined.length() > 0) {
                joined.append(' ');
            }
            segments.add(new LogicalLine.Segment(i, line.number(), joined.length(), line.code().length()));
            joined.append(line.code());
        }
        return new LogicalLine(joined.toString(), segments);
    }

    /**
     * Flag preprocessor lines, following backslash continuations.
     */
    private List<SourceLine> markDirectives(List<SourceLine> lines) {
        List<SourceLine> marked = new ArrayList<>(lines.size());
        boolean continuing = false;
        for (SourceLine line : lines) {
            String trimmed = line.code().strip();
            boolean directive = continuing || trimmed.startsWith("#");
            continuing = directive && trimmed.endsWith("\\");
            marked.add(directive
                    ? new SourceLine(line.number(), line.text(), line.code(), line.commentStripped(), true)
                    : line);
        }
        return marked;
    }
}
