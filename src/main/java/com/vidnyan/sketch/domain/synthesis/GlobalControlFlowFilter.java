package com.vidnyan.sketch.domain.synthesis;

import com.vidnyan.sketch.domain.model.SourceText;
import com.vidnyan.sketch.domain.scan.BraceScanner;
import com.vidnyan.sketch.domain.scan.LexicalScrubber;
import com.vidnyan.sketch.domain.scan.ScopeMap;
import com.vidnyan.sketch.domain.scan.SourcePatterns;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deletes body-less control flow statements ({@code if (x);}, {@code else;},
 * {@code while (x);} ...) that sit at file scope, where they can never compile.
 */
@Slf4j
public class GlobalControlFlowFilter {

    private static final Pattern CONDITIONAL_HEAD = Pattern.compile("^\\s*(?:else\\s+if|if|while|for|switch)\\s*\\(");
    private static final Pattern BARE_ELSE = Pattern.compile("^\\s*else\\s*;");

    private final LexicalScrubber scrubber;
    private final BraceScanner braceScanner;

    public GlobalControlFlowFilter() {
        this(new LexicalScrubber(), new BraceScanner());
    }

    public GlobalControlFlowFilter(LexicalScrubber scrubber, BraceScanner braceScanner) {
        this.scrubber = scrubber;
        this.braceScanner = braceScanner;
    }

    public LineFilterResult filter(String source) {
        if (source == null || source.isBlank()) {
            return LineFilterResult.unchanged(source == null ? "" : source);
        }

        List<String> original = SourceText.of(source).lines();
        List<String> detection = SourceText.of(scrubber.structural(source)).lines();
        ScopeMap scope = braceScanner.scan(detection);

        List<String> kept = new ArrayList<>(original.size());
        List<Integer> removed = new ArrayList<>();

        for (int i = 0; i < original.size(); i++) {
            if (scope.isGlobal(i) && isBodylessControlFlow(detection.get(i))) {
                log.info("Removing invalid global statement at line {}: {}", i + 1, abbreviate(original.get(i)));
                removed.add(i + 1);
                continue;
            }
            kept.add(original.get(i));
        }

        if (!removed.isEmpty()) {
            log.info("Removed {} invalid global control flow statement(s)", removed.size());
        }
        return new LineFilterResult(String.join("\n", kept), removed);
    }

    static boolean isBodylessControlFlow(String line) {
        String trimmed = line.strip();
        if (!trimmed.endsWith(";")) {
            return false;
        }
        if (BARE_ELSE.matcher(trimmed).find()) {
            return true;
        }
        Matcher head = CONDITIONAL_HEAD.matcher(trimmed);
        if (!head.find() || !trimmed.endsWith(");") || !SourcePatterns.parensBalanced(trimmed)) {
            return false;
        }
        // the condition itself must end right before the semicolon: "if (a) b();" has a body
        return closingParen(trimmed, head.end() - 1) == trimmed.length() - 2;
    }

    private static int closingParen(String line, int open) {
        int depth = 0;
        for (int i = open; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')' && --depth == 0) {
                return i;
            }
        }
        return -1;
    }

    private static String abbreviate(String line) {
        String trimmed = line.strip();
        return trimmed.length() <= 80 ? trimmed : trimmed.substring(0, 80);
    }
}
