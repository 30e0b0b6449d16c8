package com.vidnyan.sketch.adapter.out.hint;

import com.vidnyan.sketch.domain.hint.Hint;
import com.vidnyan.sketch.domain.hint.HintContext;
import com.vidnyan.sketch.domain.hint.HintDetector;
import com.vidnyan.sketch.domain.hint.HintSeverity;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Suggests millis() over long blocking delay() calls inside loop().
 */
@Component
public class DelayInLoopDetector implements HintDetector {

    private static final Pattern DELAY = Pattern.compile("\\bdelay\\s*\\(\\s*(\\d+)\\s*\\)");

    private final long thresholdMs;

    public DelayInLoopDetector(@Value("${sketch.analysis.delay-threshold-ms:50}") long thresholdMs) {
        this.thresholdMs = thresholdMs;
    }

    @Override
    public List<Hint> detect(HintContext context) {
        List<String> lines = context.structural().lines();
        List<Hint> hints = new ArrayList<>();

        for (int i = 0; i < lines.size(); i++) {
            if (!context.scope().inLoop(i)) {
                continue;
            }
            Matcher matcher = DELAY.matcher(lines.get(i));
            while (matcher.find()) {
                if (exceedsThreshold(matcher.group(1))) {
                    hints.add(Hint.builder()
                            .message("Consider using millis() instead of delay() for non-blocking code")
                            .line(i + 1)
                            .column(matcher.start())
                            .severity(HintSeverity.TIP)
                            .hintType("timing")
                            .tags("delay", "millis")
                            .build());
                }
            }
        }
        return hints;
    }

    private boolean exceedsThreshold(String digits) {
        // more digits than a long holds is certainly above the threshold
        if (digits.length() > 18) {
            return true;
        }
        return Long.parseLong(digits) > thresholdMs;
    }
}
