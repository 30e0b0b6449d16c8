package com.vidnyan.sketch.domain.hint;

import java.util.List;

/**
 * Hints from one analysis, already ranked against the cursor. Owned by the caller.
 */
public record HintReport(
    List<Hint> hints,
    CursorPosition cursor,
    EditorState editorState
) {

    public HintReport {
        hints = List.copyOf(hints);
    }

    public static HintReport empty(CursorPosition cursor, EditorState editorState) {
        return new HintReport(List.of(), cursor, editorState);
    }

    /**
     * Hints rendered as {@code "<message> (line N)"}.
     */
    public List<String> inlineHints() {
        return hints.stream().map(Hint::format).toList();
    }

    public boolean isEmpty() {
        return hints.isEmpty();
    }

    public long count(HintSeverity severity) {
        return hints.stream().filter(h -> h.severity() == severity).count();
    }
}
