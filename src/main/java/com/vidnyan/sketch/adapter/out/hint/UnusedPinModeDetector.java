package com.vidnyan.sketch.adapter.out.hint;

import com.vidnyan.sketch.domain.hint.Hint;
import com.vidnyan.sketch.domain.hint.HintContext;
import com.vidnyan.sketch.domain.hint.HintDetector;
import com.vidnyan.sketch.domain.hint.HintSeverity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Warns about pins configured with pinMode() that are never read or written.
 */
@Component
public class UnusedPinModeDetector implements HintDetector {

    private static final Pattern PIN_MODE = Pattern.compile(
            "pinMode\\s*\\(\\s*(\\w+)\\s*,\\s*(OUTPUT|INPUT|INPUT_PULLUP)\\s*\\)");
    private static final Pattern PIN_USAGE = Pattern.compile(
            "(digitalWrite|digitalRead|analogWrite|analogRead)\\s*\\(\\s*(\\w+)");

    @Override
    public List<Hint> detect(HintContext context) {
        List<String> lines = context.structural().lines();

        Map<String, Integer> definitions = new LinkedHashMap<>();
        Map<String, Integer> columns = new LinkedHashMap<>();
        for (int i = 0; i < lines.size(); i++) {
            Matcher matcher = PIN_MODE.matcher(lines.get(i));
            while (matcher.find()) {
                if (definitions.putIfAbsent(matcher.group(1), i + 1) == null) {
                    columns.put(matcher.group(1), matcher.start());
                }
            }
        }
        if (definitions.isEmpty()) {
            return List.of();
        }

        Set<String> used = new HashSet<>();
        for (String line : lines) {
            Matcher matcher = PIN_USAGE.matcher(line);
            while (matcher.find()) {
                used.add(matcher.group(2));
            }
        }

        List<Hint> hints = new ArrayList<>();
        definitions.forEach((pin, line) -> {
            if (!used.contains(pin)) {
                hints.add(Hint.builder()
                        .message("pinMode() called for " + pin + " but the pin is never used")
                        .line(line)
                        .column(columns.get(pin))
                        .severity(HintSeverity.WARNING)
                        .hintType("unused-pin")
                        .tags("pinMode", "usage")
                        .build());
            }
        });
        return hints;
    }
}
