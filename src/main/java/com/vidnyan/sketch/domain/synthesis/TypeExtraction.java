package com.vidnyan.sketch.domain.synthesis;

import com.vidnyan.sketch.domain.model.TypeDefinition;

import java.util.List;

/**
 * Output of {@link TypeDefinitionExtractor}: the lifted definitions in first-seen order
 * and the source that remains once their lines are taken out.
 */
public record TypeExtraction(
    List<TypeDefinition> typeDefinitions,
    String remainder
) {

    public TypeExtraction {
        typeDefinitions = List.copyOf(typeDefinitions);
    }

    /**
     * Definitions joined by a blank line, or an empty string when there are none.
     */
    public String typeBlock() {
        return String.join("\n\n", typeDefinitions.stream().map(TypeDefinition::text).toList());
    }

    public boolean hasTypes() {
        return !typeDefinitions.isEmpty();
    }
}
