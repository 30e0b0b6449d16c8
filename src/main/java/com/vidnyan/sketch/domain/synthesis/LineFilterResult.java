package com.vidnyan.sketch.domain.synthesis;

import java.util.List;

/**
 * Text left after a line-removal pass plus the 1-indexed numbers of the removed lines,
 * numbered against the pass input.
 */
public record LineFilterResult(
    String text,
    List<Integer> removedLines
) {

    public LineFilterResult {
        removedLines = List.copyOf(removedLines);
    }

    public static LineFilterResult unchanged(String text) {
        return new LineFilterResult(text, List.of());
    }

    public int removedCount() {
        return removedLines.size();
    }
}
