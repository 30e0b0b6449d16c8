package com.vidnyan.sketch.domain.hint;

import lombok.Builder;

import java.util.Set;

/**
 * Inline hint tied to a line of the sketch.
 * Immutable value object.
 */
@Builder
public record Hint(
    String message,
    int line,
    int column,
    HintSeverity severity,
    String hintType,
    Set<String> tags
) {

    public Hint {
        tags = tags == null ? Set.of() : Set.copyOf(tags);
    }

    /**
     * Format for direct display next to the editor.
     */
    public String format() {
        return message + " (line " + line + ")";
    }

    public static class HintBuilder {
        private int line = 1;
        private HintSeverity severity = HintSeverity.INFO;
        private String hintType = "general";
        private Set<String> tags = Set.of();

        public HintBuilder tags(String... tags) {
            this.tags = Set.of(tags);
            return this;
        }
    }
}
