package com.vidnyan.sketch.domain.synthesis;

import com.vidnyan.sketch.domain.model.FunctionSignature;
import com.vidnyan.sketch.domain.model.SourceText;
import com.vidnyan.sketch.domain.scan.BraceScanner;
import com.vidnyan.sketch.domain.scan.LexicalScrubber;
import com.vidnyan.sketch.domain.scan.ScopeMap;
import com.vidnyan.sketch.domain.scan.SourcePatterns;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;

/**
 * Builds forward declarations for the sketch's own functions so they can be called
 * before their definition.
 * <p>
 * Only file-scope definitions are considered. {@code setup}/{@code loop}, out-of-class
 * method definitions and anything whose signature touches a custom type are skipped;
 * the latter rely on the hoisted type block and their natural order instead. Functions
 * declaring default arguments are skipped too, because repeating the default in a
 * prototype and the definition does not compile.
 * </p>
 */
@Slf4j
public class PrototypeSynthesizer {

    private static final Set<String> ENTRY_POINTS = Set.of("setup", "loop");

    private final LexicalScrubber scrubber;
    private final BraceScanner braceScanner;

    public PrototypeSynthesizer() {
        this(new LexicalScrubber(), new BraceScanner());
    }

    public PrototypeSynthesizer(LexicalScrubber scrubber, BraceScanner braceScanner) {
        this.scrubber = scrubber;
        this.braceScanner = braceScanner;
    }

    public List<FunctionSignature> synthesize(String source, Set<String> customTypes) {
        if (source == null || source.isBlank()) {
            return List.of();
        }

        List<String> lines = SourceText.of(scrubber.scrub(source)).lines();
        ScopeMap scope = braceScanner.scan(SourceText.of(scrubber.mask(String.join("\n", lines))).lines());

        Set<String> rendered = new LinkedHashSet<>();
        List<FunctionSignature> signatures = new ArrayList<>();

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (scope.depthBefore(i) != 0 || line.strip().startsWith("#")) {
                continue;
            }
            Matcher matcher = SourcePatterns.FUNCTION_DEFINITION.matcher(line);
            if (!matcher.find()) {
                continue;
            }

            FunctionSignature signature = new FunctionSignature(
                    matcher.group(1).strip(),
                    matcher.group(2).strip(),
                    matcher.group(3).strip());

            if (!isEligible(signature, customTypes)) {
                continue;
            }
            if (rendered.add(signature.toPrototype())) {
                signatures.add(signature);
                log.debug("Synthesized prototype {}", signature.toPrototype());
            }
        }

        return signatures;
    }

    static boolean isEligible(FunctionSignature signature, Set<String> customTypes) {
        String returnType = signature.returnType();
        if (ENTRY_POINTS.contains(signature.name())) {
            return false;
        }
        if (returnType.contains("::") || returnType.startsWith("#")) {
            return false;
        }
        if (SourcePatterns.CONTROL_KEYWORDS.contains(signature.name())
                || SourcePatterns.mentionsAny(returnType, SourcePatterns.CONTROL_KEYWORDS)) {
            return false;
        }
        if (signature.parameters().contains("=")) {
            return false;
        }
        if (SourcePatterns.mentionsAny(returnType + " " + signature.parameters(), customTypes)) {
            log.debug("Skipping prototype for {}: signature uses a custom type", signature.name());
            return false;
        }
        return true;
    }
}
