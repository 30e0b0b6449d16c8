package com.vidnyan.sketch.domain.synthesis;

import com.vidnyan.sketch.domain.memory.ScalarType;
import com.vidnyan.sketch.domain.model.SourceText;
import com.vidnyan.sketch.domain.scan.BraceScanner;
import com.vidnyan.sketch.domain.scan.LexicalScrubber;
import com.vidnyan.sketch.domain.scan.ScopeMap;
import com.vidnyan.sketch.domain.scan.SourcePatterns;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;

/**
 * Drops hand-written prototypes that mention a custom type.
 * <p>
 * Authors often declare {@code void update(Point& p);} above the struct it needs. Once the
 * struct is hoisted the definition order is right again and the early prototype only gets
 * in the way, so it is removed. Object construction at file scope
 * ({@code Led status(13);}) has the same shape and is kept: every parameter must read as a
 * declaration (a type, a pointer/reference, or a type followed by a name).
 * </p>
 */
@Slf4j
public class ManualPrototypeFilter {

    private static final Set<String> LIBRARY_TYPES = Set.of("void", "String", "auto", "unsigned", "signed", "short");

    private final LexicalScrubber scrubber;
    private final BraceScanner braceScanner;

    public ManualPrototypeFilter() {
        this(new LexicalScrubber(), new BraceScanner());
    }

    public ManualPrototypeFilter(LexicalScrubber scrubber, BraceScanner braceScanner) {
        this.scrubber = scrubber;
        this.braceScanner = braceScanner;
    }

    public LineFilterResult filter(String source, Set<String> customTypes) {
        if (source == null || customTypes.isEmpty()) {
            return LineFilterResult.unchanged(source == null ? "" : source);
        }

        List<String> original = SourceText.of(source).lines();
        List<String> detection = SourceText.of(scrubber.scrub(source)).lines();
        ScopeMap scope = braceScanner.scan(SourceText.of(scrubber.structural(source)).lines());

        List<String> kept = new ArrayList<>(original.size());
        List<Integer> removed = new ArrayList<>();

        for (int i = 0; i < original.size(); i++) {
            if (scope.isGlobal(i) && isCustomTypedPrototype(detection.get(i), customTypes)) {
                log.info("Dropping manual prototype that uses a custom type (line {}): {}",
                        i + 1, original.get(i).strip());
                removed.add(i + 1);
                continue;
            }
            kept.add(original.get(i));
        }

        return new LineFilterResult(String.join("\n", kept), removed);
    }

    static boolean isCustomTypedPrototype(String line, Set<String> customTypes) {
        Matcher matcher = SourcePatterns.PROTOTYPE_DECLARATION.matcher(line);
        if (!matcher.find()) {
            return false;
        }
        String returnType = matcher.group(1);
        String name = matcher.group(2);
        String parameters = matcher.group(3);

        if (SourcePatterns.mentionsAny(returnType + " " + name, SourcePatterns.CONTROL_KEYWORDS)) {
            return false;
        }
        if (!parametersDeclareTypes(parameters, customTypes)) {
            return false;
        }
        return SourcePatterns.mentionsAny(returnType + " " + parameters, customTypes);
    }

    private static boolean parametersDeclareTypes(String parameters, Set<String> customTypes) {
        String trimmed = parameters.strip();
        if (trimmed.isEmpty() || trimmed.equals("void")) {
            return true;
        }
        for (String parameter : trimmed.split(",")) {
            if (!looksLikeDeclaration(parameter.strip(), customTypes)) {
                return false;
            }
        }
        return true;
    }

    private static boolean looksLikeDeclaration(String parameter, Set<String> customTypes) {
        if (parameter.isEmpty() || parameter.startsWith("\"") || parameter.startsWith("'")
                || Character.isDigit(parameter.charAt(0))) {
            return false;
        }
        if (parameter.contains("*") || parameter.contains("&")) {
            return true;
        }
        String[] tokens = parameter.split("\\s+");
        if (tokens.length >= 2) {
            return true;
        }
        String token = tokens[0];
        return customTypes.contains(token) || LIBRARY_TYPES.contains(token) || ScalarType.isKeyword(token);
    }
}
