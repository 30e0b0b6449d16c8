package com.vidnyan.sketch.domain.model;

import java.util.List;

/**
 * Immutable view of a sketch as an ordered list of lines.
 * Line numbers exposed to callers are 1-indexed.
 */
public record SourceText(List<String> lines) {

    public SourceText {
        lines = List.copyOf(lines);
    }

    /**
     * Split text on '\n', keeping trailing empty lines so that line numbers
     * always line up with the text they were derived from.
     */
    public static SourceText of(String text) {
        if (text == null || text.isEmpty()) {
            return new SourceText(List.of(""));
        }
        String[] parts = text.split("\n", -1);
        String[] cleaned = new String[parts.length];
        for (int i = 0; i < parts.length; i++) {
            String part = parts[i];
            cleaned[i] = part.endsWith("\r") ? part.substring(0, part.length() - 1) : part;
        }
        return new SourceText(List.of(cleaned));
    }

    public int lineCount() {
        return lines.size();
    }

    /**
     * Line by 1-indexed number.
     */
    public String line(int lineNumber) {
        return lines.get(lineNumber - 1);
    }

    public String text() {
        return String.join("\n", lines);
    }
}
