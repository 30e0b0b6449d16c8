package com.vidnyan.sketch.application.port.out;

import java.util.List;

/**
 * Port for turning raw compiler errors into recovery advice.
 */
public interface CompileErrorAdvisor {

    /**
     * Advice ordered by confidence, never empty.
     */
    List<ErrorAdvice> advise(String errorOutput);

    /**
     * Potential fixes for one recognised issue.
     */
    record ErrorAdvice(
        String issue,
        List<String> suggestions,
        double confidence
    ) {
        public ErrorAdvice {
            suggestions = List.copyOf(suggestions);
        }
    }
}
