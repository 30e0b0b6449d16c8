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

@Component
public class AnalogPinModeDetector implements HintDetector {

    private static final Pattern ANALOG_INPUT = Pattern.compile("pinMode\\s*\\(\\s*A[0-7]\\s*,\\s*INPUT\\s*\\)");

    @Override
    public List<Hint> detect(HintContext context) {
        List<String> lines = context.structural().lines();
        List<Hint> hints = new ArrayList<>();

        for (int i = 0; i < lines.size(); i++) {
            Matcher matcher = ANALOG_INPUT.matcher(lines.get(i));
            if (matcher.find()) {
                hints.add(Hint.builder()
                        .message("pinMode is not required for analogRead() on analog pins")
                        .line(i + 1)
                        .column(matcher.start())
                        .severity(HintSeverity.INFO)
                        .hintType("analog-pinmode")
                        .tags("analogRead", "pinMode")
                        .build());
            }
        }
        return hints;
    }
}
