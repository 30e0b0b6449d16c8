package com.vidnyan.sketch.domain.synthesis;

import com.vidnyan.sketch.domain.model.FunctionSignature;
import com.vidnyan.sketch.domain.scan.BraceScanner;
import com.vidnyan.sketch.domain.scan.LexicalScrubber;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Set;

/**
 * Rebuilds a sketch into one compilable unit.
 * <p>
 * Pipeline:
 * 1. Drop body-less control flow at file scope
 * 2. Lift struct/class/enum definitions
 * 3. Derive custom type names
 * 4. Drop manual prototypes that use those types
 * 5. Synthesize prototypes for the remaining functions
 * 6. Render: umbrella include, type block, prototypes, body
 * </p>
 */
@Slf4j
public class CompilationUnitSynthesizer {

    public static final String UMBRELLA_INCLUDE = "#include <Arduino.h>";
    public static final String TYPE_BLOCK_MARKER = "// Forward declarations for custom types";
    public static final String PROTOTYPE_BLOCK_MARKER = "// Function prototypes";

    private final LexicalScrubber scrubber;
    private final GlobalControlFlowFilter controlFlowFilter;
    private final TypeDefinitionExtractor typeExtractor;
    private final ManualPrototypeFilter manualPrototypeFilter;
    private final PrototypeSynthesizer prototypeSynthesizer;

    public CompilationUnitSynthesizer() {
        LexicalScrubber sharedScrubber = new LexicalScrubber();
        BraceScanner braceScanner = new BraceScanner();
        this.scrubber = sharedScrubber;
        this.controlFlowFilter = new GlobalControlFlowFilter(sharedScrubber, braceScanner);
        this.typeExtractor = new TypeDefinitionExtractor(sharedScrubber, braceScanner);
        this.manualPrototypeFilter = new ManualPrototypeFilter(sharedScrubber, braceScanner);
        this.prototypeSynthesizer = new PrototypeSynthesizer(sharedScrubber, braceScanner);
    }

    public CompilationUnit synthesize(String source) {
        String sketch = source == null ? "" : source;

        LineFilterResult controlFlow = controlFlowFilter.filter(sketch);
        TypeExtraction extraction = typeExtractor.extract(controlFlow.text());
        Set<String> customTypes = CustomTypeNames.derive(
                extraction.typeDefinitions(), scrubber.scrub(controlFlow.text()));
        LineFilterResult manualPrototypes = manualPrototypeFilter.filter(extraction.remainder(), customTypes);
        List<FunctionSignature> prototypes = prototypeSynthesizer.synthesize(manualPrototypes.text(), customTypes);

        log.debug("Synthesis: {} types, {} custom type names, {} prototypes, {} statements removed",
                extraction.typeDefinitions().size(), customTypes.size(), prototypes.size(),
                controlFlow.removedCount() + manualPrototypes.removedCount());

        String text = render(extraction, prototypes, manualPrototypes.text());
        return new CompilationUnit(
                text,
                extraction.typeDefinitions(),
                customTypes,
                prototypes,
                controlFlow.removedLines(),
                manualPrototypes.removedLines(),
                manualPrototypes.text());
    }

    private static String render(TypeExtraction extraction, List<FunctionSignature> prototypes, String body) {
        StringBuilder unit = new StringBuilder();
        unit.append(UMBRELLA_INCLUDE).append("\n\n");

        if (extraction.hasTypes()) {
            unit.append(TYPE_BLOCK_MARKER).append('\n');
            unit.append(extraction.typeBlock()).append("\n\n");
        }

        if (!prototypes.isEmpty()) {
            unit.append(PROTOTYPE_BLOCK_MARKER).append('\n');
            for (FunctionSignature prototype : prototypes) {
                unit.append(prototype.toPrototype()).append('\n');
            }
            unit.append('\n');
        }

        unit.append(body);
        return unit.toString();
    }
}
