package com.vidnyan.sketch.domain.synthesis;

import com.vidnyan.sketch.domain.model.SourceText;
import com.vidnyan.sketch.domain.model.TypeDefinition;
import com.vidnyan.sketch.domain.scan.BraceScanner;
import com.vidnyan.sketch.domain.scan.LexicalScrubber;
import com.vidnyan.sketch.domain.scan.ScopeMap;
import com.vidnyan.sketch.domain.scan.SourcePatterns;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lifts file-scope struct, class and enum definitions out of a sketch.
 * <p>
 * Detection runs on the scrubbed text; the captured lines are taken from the original
 * so comments inside a definition travel with it. Forward declarations
 * ({@code struct Foo;}) are left where the author put them.
 * </p>
 * Two full definitions with the same name are both extracted.
 */
@Slf4j
public class TypeDefinitionExtractor {

    /** Tail lines allowed after a closing brace, e.g. {@code } Point, *PointPtr;}. */
    private static final Pattern DECLARATOR_TAIL = Pattern.compile("^[\\w\\s,*&\\[\\]]*;?\\s*$");

    private final LexicalScrubber scrubber;
    private final BraceScanner braceScanner;

    public TypeDefinitionExtractor() {
        this(new LexicalScrubber(), new BraceScanner());
    }

    public TypeDefinitionExtractor(LexicalScrubber scrubber, BraceScanner braceScanner) {
        this.scrubber = scrubber;
        this.braceScanner = braceScanner;
    }

    public TypeExtraction extract(String source) {
        if (source == null || source.isBlank()) {
            return new TypeExtraction(List.of(), source == null ? "" : source);
        }

        List<String> original = SourceText.of(source).lines();
        List<String> detection = SourceText.of(scrubber.structural(source)).lines();
        ScopeMap scope = braceScanner.scan(detection);

        List<TypeDefinition> definitions = new ArrayList<>();
        Set<Integer> removed = new HashSet<>();
        Set<String> seenNames = new HashSet<>();

        int i = 0;
        while (i < detection.size()) {
            String line = detection.get(i);
            Matcher head = SourcePatterns.TYPE_HEAD.matcher(line);

            if (!scope.isGlobal(i) || !head.find()) {
                i++;
                continue;
            }
            if (isForwardDeclaration(line) || isInitializedVariable(line) || isFunctionHead(line)) {
                i++;
                continue;
            }

            int end = findDefinitionEnd(detection, i);
            if (end < 0) {
                log.debug("Type head at line {} has no balanced body, leaving it in place", i + 1);
                i++;
                continue;
            }

            String name = head.group(2);
            if (!seenNames.add(name)) {
                log.warn("Type '{}' is defined more than once (again at line {})", name, i + 1);
            }

            definitions.add(new TypeDefinition(
                    TypeDefinition.Kind.fromKeyword(head.group(1)),
                    name,
                    original.subList(i, end),
                    definitions.size(),
                    i + 1,
                    end));
            for (int k = i; k < end; k++) {
                removed.add(k);
            }
            log.debug("Extracted {} {} (lines {}-{})", head.group(1), name, i + 1, end);
            i = end;
        }

        List<String> remainder = new ArrayList<>(original.size() - removed.size());
        for (int idx = 0; idx < original.size(); idx++) {
            if (!removed.contains(idx)) {
                remainder.add(original.get(idx));
            }
        }

        return new TypeExtraction(definitions, String.join("\n", remainder));
    }

    private static boolean isForwardDeclaration(String line) {
        return line.strip().endsWith(";") && !line.contains("{");
    }

    /** {@code struct Point origin = {0, 0};} declares a variable, not a type. */
    private static boolean isInitializedVariable(String line) {
        int brace = line.indexOf('{');
        int equals = line.indexOf('=');
        return equals >= 0 && (brace < 0 || equals < brace);
    }

    /** {@code struct Point makePoint(int x)} opens a function returning the type. */
    private static boolean isFunctionHead(String line) {
        return SourcePatterns.FUNCTION_HEAD_OPEN.matcher(line).find()
                || SourcePatterns.FUNCTION_HEAD_WITH_BRACE.matcher(line).find();
    }

    /**
     * Exclusive end index of the definition starting at {@code start}, or -1 when the
     * body never opens or never balances.
     */
    private static int findDefinitionEnd(List<String> lines, int start) {
        int balance = 0;
        boolean opened = false;
        int j = start;

        while (j < lines.size()) {
            String line = lines.get(j);
            int opens = SourcePatterns.count(line, '{');
            if (!opened && opens == 0 && line.strip().endsWith(";")) {
                return -1;
            }
            balance += opens - SourcePatterns.count(line, '}');
            opened |= opens > 0;
            j++;
            if (opened && balance <= 0) {
                break;
            }
        }
        if (!opened || balance > 0) {
            return -1;
        }

        if (lines.get(j - 1).strip().endsWith(";")) {
            return j;
        }
        // closing brace without semicolon: take a trailing alias line such as "} Point;" split over lines
        int k = j;
        while (k < lines.size()) {
            String tail = lines.get(k);
            if (tail.isBlank() || !DECLARATOR_TAIL.matcher(tail).matches()) {
                return j;
            }
            k++;
            if (tail.contains(";")) {
                return k;
            }
        }
        return j;
    }
}
