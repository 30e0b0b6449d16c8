package com.vidnyan.sketch.domain.hint;

/**
 * Caret position, zero-based line and column.
 */
public record CursorPosition(int line, int column) {

    public CursorPosition {
        line = Math.max(0, line);
        column = Math.max(0, column);
    }

    public static CursorPosition start() {
        return new CursorPosition(0, 0);
    }

    public static CursorPosition of(int line, int column) {
        return new CursorPosition(line, column);
    }

    /**
     * Convert an absolute character offset into line/column; the offset is clamped to the text.
     */
    public static CursorPosition ofOffset(int offset, String code) {
        String text = code == null ? "" : code;
        int clamped = Math.max(0, Math.min(text.length(), offset));
        String upTo = text.substring(0, clamped);

        int line = 0;
        for (int i = 0; i < upTo.length(); i++) {
            if (upTo.charAt(i) == '\n') {
                line++;
            }
        }
        int lastNewline = upTo.lastIndexOf('\n');
        int column = lastNewline < 0 ? clamped : clamped - lastNewline - 1;
        return new CursorPosition(line, column);
    }
}
