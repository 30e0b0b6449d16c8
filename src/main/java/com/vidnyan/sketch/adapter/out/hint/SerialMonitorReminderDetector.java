package com.vidnyan.sketch.adapter.out.hint;

import com.vidnyan.sketch.domain.hint.Hint;
import com.vidnyan.sketch.domain.hint.HintContext;
import com.vidnyan.sketch.domain.hint.HintDetector;
import com.vidnyan.sketch.domain.hint.HintSeverity;
import com.vidnyan.sketch.domain.scan.LexicalScrubber;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reminds the user to open the Serial Monitor when the sketch prints over Serial
 * and no comment already mentions the monitor.
 */
@Component
public class SerialMonitorReminderDetector implements HintDetector {

    private static final Pattern SERIAL_USAGE = Pattern.compile("\\bSerial\\.(begin|print|println|write)\\b");

    private final LexicalScrubber scrubber = new LexicalScrubber();

    @Override
    public List<Hint> detect(HintContext context) {
        if (commentsMentionMonitor(context.rawText())) {
            return List.of();
        }

        List<String> lines = context.structural().lines();
        for (int i = 0; i < lines.size(); i++) {
            Matcher matcher = SERIAL_USAGE.matcher(lines.get(i));
            if (matcher.find()) {
                return List.of(Hint.builder()
                        .message("Remember to open the Serial Monitor to see output (Tools > Serial Monitor)")
                        .line(i + 1)
                        .column(matcher.start())
                        .severity(HintSeverity.INFO)
                        .hintType("serial-reminder")
                        .tags("Serial", "monitor")
                        .build());
            }
        }
        return List.of();
    }

    private boolean commentsMentionMonitor(String raw) {
        return scrubber.comments(raw).toLowerCase(Locale.ROOT).contains("monitor");
    }
}
