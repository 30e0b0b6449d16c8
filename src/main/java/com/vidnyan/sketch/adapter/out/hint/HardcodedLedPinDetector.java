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
 * Suggests LED_BUILTIN where pin 13 is hardcoded.
 */
@Component
public class HardcodedLedPinDetector implements HintDetector {

    private static final Pattern PIN_MODE_13 = Pattern.compile("pinMode\\s*\\(\\s*13\\s*,");
    private static final Pattern DIGITAL_WRITE_13 = Pattern.compile("digitalWrite\\s*\\(\\s*13\\s*,");

    @Override
    public List<Hint> detect(HintContext context) {
        List<String> lines = context.structural().lines();
        List<Hint> hints = new ArrayList<>();

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);

            Matcher pinMode = PIN_MODE_13.matcher(line);
            if (pinMode.find()) {
                hints.add(tip(i + 1, pinMode.start(), "Use LED_BUILTIN instead of 13 for the built-in LED"));
            }
            Matcher digitalWrite = DIGITAL_WRITE_13.matcher(line);
            if (digitalWrite.find()) {
                hints.add(tip(i + 1, digitalWrite.start(), "Use LED_BUILTIN instead of hardcoding 13"));
            }
        }
        return hints;
    }

    private static Hint tip(int line, int column, String message) {
        return Hint.builder()
                .message(message)
                .line(line)
                .column(column)
                .severity(HintSeverity.TIP)
                .hintType("led-builtin")
                .tags("pins", "LED_BUILTIN")
                .build();
    }
}
