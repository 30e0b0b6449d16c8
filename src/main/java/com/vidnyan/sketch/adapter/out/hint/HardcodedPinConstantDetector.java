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
 * Suggests named constants for numeric pins passed to pinMode/digitalWrite/digitalRead.
 * Pin 13 is left to {@link HardcodedLedPinDetector}.
 */
@Component
public class HardcodedPinConstantDetector implements HintDetector {

    private static final Pattern NUMERIC_PIN = Pattern.compile(
            "\\b(pinMode|digitalWrite|digitalRead)\\s*\\(\\s*(\\d{1,2})\\s*[,)]");

    @Override
    public List<Hint> detect(HintContext context) {
        List<String> lines = context.structural().lines();
        List<Hint> hints = new ArrayList<>();

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (DetectorSupport.isConstantDefinition(line)) {
                continue;
            }
            Matcher matcher = NUMERIC_PIN.matcher(line);
            while (matcher.find()) {
                String pin = matcher.group(2);
                if ("13".equals(pin)) {
                    continue;
                }
                hints.add(Hint.builder()
                        .message("Consider using a named constant instead of pin " + pin)
                        .line(i + 1)
                        .column(matcher.start())
                        .severity(HintSeverity.TIP)
                        .hintType("pin-constant")
                        .tags("pins", "readability")
                        .build());
                break;
            }
        }
        return hints;
    }
}
