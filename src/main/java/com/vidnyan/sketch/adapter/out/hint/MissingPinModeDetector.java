package com.vidnyan.sketch.adapter.out.hint;

import com.vidnyan.sketch.domain.hint.Hint;
import com.vidnyan.sketch.domain.hint.HintContext;
import com.vidnyan.sketch.domain.hint.HintDetector;
import com.vidnyan.sketch.domain.hint.HintSeverity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Flags named pins that are read or written but never configured with pinMode().
 * Each pin is reported once, at its first use.
 */
@Component
public class MissingPinModeDetector implements HintDetector {

    private static final Pattern PIN_MODE = Pattern.compile("pinMode\\s*\\(\\s*(\\w+)\\s*,");
    private static final Pattern DIGITAL_IO = Pattern.compile("\\b(digitalWrite|digitalRead)\\s*\\(\\s*(\\w+)");

    @Override
    public List<Hint> detect(HintContext context) {
        List<String> lines = context.structural().lines();

        Set<String> configured = new HashSet<>();
        for (String line : lines) {
            Matcher matcher = PIN_MODE.matcher(line);
            while (matcher.find()) {
                configured.add(matcher.group(1));
            }
        }

        Set<String> reported = new HashSet<>();
        List<Hint> hints = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            Matcher matcher = DIGITAL_IO.matcher(lines.get(i));
            while (matcher.find()) {
                String pin = matcher.group(2);
                if (isNumeric(pin) || configured.contains(pin) || !reported.add(pin)) {
                    continue;
                }
                hints.add(Hint.builder()
                        .message("Don't forget to set pinMode for pin '" + pin + "' in setup()")
                        .line(i + 1)
                        .column(matcher.start())
                        .severity(HintSeverity.INFO)
                        .hintType("missing-pinmode")
                        .tags("pinMode", "pins")
                        .build());
            }
        }
        return hints;
    }

    private static boolean isNumeric(String pin) {
        return pin.chars().allMatch(Character::isDigit);
    }
}
