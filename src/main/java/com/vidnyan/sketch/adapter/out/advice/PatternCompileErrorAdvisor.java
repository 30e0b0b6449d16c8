package com.vidnyan.sketch.adapter.out.advice;

import com.vidnyan.sketch.application.port.out.CompileErrorAdvisor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Rule-based compile error advisor.
 * Matches known error phrases in the compiler output and proposes fixes; the more
 * specific and frequent the phrase, the higher the confidence.
 */
@Slf4j
@Component
public class PatternCompileErrorAdvisor implements CompileErrorAdvisor {

    static final double FALLBACK_CONFIDENCE = 0.2;

    private static final List<KnownIssue> KNOWN_ISSUES = List.of(
            new KnownIssue("Missing semicolon",
                    List.of("Add a semicolon at the end of the highlighted line",
                            "Check the line above the reported one"),
                    List.of("missing semicolon", "expected ';'")),
            new KnownIssue("Undeclared identifier",
                    List.of("Declare the variable before using it",
                            "Check the spelling and capitalisation of the name",
                            "Include the library that defines it"),
                    List.of("undeclared identifier", "was not declared in this scope")),
            new KnownIssue("Not enough memory",
                    List.of("Move constant strings to flash with F(\"...\") or PROGMEM",
                            "Reduce buffer and array sizes",
                            "Select a board with more RAM"),
                    List.of("not enough memory")),
            new KnownIssue("Duplicate definition",
                    List.of("Remove or rename the second definition",
                            "Check for a header included twice without include guards"),
                    List.of("redefinition of"))
    );

    @Override
    public List<ErrorAdvice> advise(String errorOutput) {
        String haystack = errorOutput == null ? "" : errorOutput.toLowerCase(Locale.ROOT);

        List<ErrorAdvice> advice = new ArrayList<>();
        for (KnownIssue issue : KNOWN_ISSUES) {
            for (String needle : issue.needles()) {
                int occurrences = countOccurrences(haystack, needle);
                if (occurrences > 0) {
                    advice.add(new ErrorAdvice(issue.title(), issue.suggestions(), confidence(needle, occurrences)));
                    break;
                }
            }
        }

        if (advice.isEmpty()) {
            log.debug("No known error pattern in compiler output");
            return List.of(new ErrorAdvice("Unrecognised compile error",
                    List.of("Read the first error in the output; later errors often follow from it"),
                    FALLBACK_CONFIDENCE));
        }

        advice.sort(Comparator.comparingDouble(ErrorAdvice::confidence).reversed());
        log.info("Matched {} known compile error patterns", advice.size());
        return advice;
    }

    static double confidence(String needle, int occurrences) {
        double specificity = Math.min(needle.length() / 40.0, 0.4);
        return Math.min(1.0, 0.5 + specificity + (occurrences - 1) * 0.05);
    }

    private static int countOccurrences(String haystack, String needle) {
        int count = 0;
        int from = haystack.indexOf(needle);
        while (from >= 0) {
            count++;
            from = haystack.indexOf(needle, from + needle.length());
        }
        return count;
    }

    private record KnownIssue(String title, List<String> suggestions, List<String> needles) {
    }
}
