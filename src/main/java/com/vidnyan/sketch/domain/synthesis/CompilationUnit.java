package com.vidnyan.sketch.domain.synthesis;

import com.vidnyan.sketch.domain.model.FunctionSignature;
import com.vidnyan.sketch.domain.model.TypeDefinition;

import java.util.List;
import java.util.Set;

/**
 * Single translation unit rebuilt from a sketch, ready for the compiler.
 */
public record CompilationUnit(
    String text,
    List<TypeDefinition> typeDefinitions,
    Set<String> customTypes,
    List<FunctionSignature> prototypes,
    List<Integer> removedControlFlowLines,
    List<Integer> removedPrototypeLines,
    String body
) {

    public CompilationUnit {
        typeDefinitions = List.copyOf(typeDefinitions);
        customTypes = Set.copyOf(customTypes);
        prototypes = List.copyOf(prototypes);
        removedControlFlowLines = List.copyOf(removedControlFlowLines);
        removedPrototypeLines = List.copyOf(removedPrototypeLines);
    }

    public List<String> prototypeLines() {
        return prototypes.stream().map(FunctionSignature::toPrototype).toList();
    }
}
