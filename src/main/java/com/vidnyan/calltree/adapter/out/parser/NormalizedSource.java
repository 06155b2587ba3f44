package com.vidnyan.calltree.adapter.out.parser;

import com.vidnyan.calltree.domain.model.SourceLine;

import java.util.List;

/**
 * Comment-free view of one file.
 *
 * @param lines                    one entry per physical line, numbered from 1
 * @param unterminatedCommentLine  line where a block comment opened without closing, 0 if none
 */
record NormalizedSource(List<SourceLine> lines, int unterminatedCommentLine) {

    NormalizedSource {
        lines = List.copyOf(lines);
    }

    boolean hasUnterminatedComment() {
        return unterminatedCommentLine > 0;
    }
}
