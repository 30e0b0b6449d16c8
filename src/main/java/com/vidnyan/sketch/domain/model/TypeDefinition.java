package com.vidnyan.sketch.domain.model;

import java.util.List;

/**
 * A user-defined struct, class or enum lifted out of a sketch.
 * The raw lines are the author's original text, comments included.
 */
public record TypeDefinition(
    Kind kind,
    String name,
    List<String> rawLines,
    int order,
    int startLine,
    int endLine
) {

    public enum Kind {
        STRUCT,
        CLASS,
        ENUM;

        public static Kind fromKeyword(String keyword) {
            return switch (keyword) {
                case "struct" -> STRUCT;
                case "class" -> CLASS;
                case "enum" -> ENUM;
                default -> throw new IllegalArgumentException("Not a type keyword: " + keyword);
            };
        }
    }

    public TypeDefinition {
        rawLines = List.copyOf(rawLines);
    }

    public String text() {
        return String.join("\n", rawLines);
    }
}
