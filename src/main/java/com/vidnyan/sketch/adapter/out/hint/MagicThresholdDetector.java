package com.vidnyan.sketch.adapter.out.hint;

import com.vidnyan.sketch.domain.hint.Hint;
import com.vidnyan.sketch.domain.hint.HintContext;
import com.vidnyan.sketch.domain.hint.HintDetector;
import com.vidnyan.sketch.domain.hint.HintSeverity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Suggests a named constant for literal sensor thresholds such as {@code analogRead(A0) > 512}.
 */
@Component
public class MagicThresholdDetector implements HintDetector {

    private static final Pattern THRESHOLD = Pattern.compile(
            "\\b(analogRead|digitalRead)\\s*\\([^)]+\\)\\s*([<>=!]+)\\s*(\\d{2,})");

    @Override
    public List<Hint> detect(HintContext context) {
        List<String> lines = context.structural().lines();
        List<Hint> hints = new ArrayList<>();

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (DetectorSupport.isConstantDefinition(line)) {
                continue;
            }
            Matcher matcher = THRESHOLD.matcher(line);
            while (matcher.find()) {
                hints.add(Hint.builder()
                        .message("Consider using a named constant for threshold value " + matcher.group(3))
                        .line(i + 1)
                        .column(matcher.start())
                        .severity(HintSeverity.TIP)
                        .hintType("magic-number")
                        .tags("readability", "constants")
                        .build());
            }
        }
        return hints;
    }
}
