package com.vidnyan.sketch.adapter.out.hint;

import com.vidnyan.sketch.domain.hint.Hint;
import com.vidnyan.sketch.domain.hint.HintContext;
import com.vidnyan.sketch.domain.hint.HintDetector;
import com.vidnyan.sketch.domain.hint.HintSeverity;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Points at Serial.begin() while the editor reports the Serial Monitor closed.
 * Reports the first occurrence only.
 */
@Component
public class SerialMonitorStateDetector implements HintDetector {

    private static final String SERIAL_BEGIN = "Serial.begin";

    @Override
    public List<Hint> detect(HintContext context) {
        if (context.editorState().serialMonitorOpen()) {
            return List.of();
        }

        List<String> lines = context.structural().lines();
        for (int i = 0; i < lines.size(); i++) {
            int column = lines.get(i).indexOf(SERIAL_BEGIN);
            if (column >= 0) {
                return List.of(Hint.builder()
                        .message("Serial.begin() detected but Serial Monitor appears to be closed")
                        .line(i + 1)
                        .column(column)
                        .severity(HintSeverity.INFO)
                        .hintType("serial-monitor")
                        .tags("Serial", "monitor")
                        .build());
            }
        }
        return List.of();
    }
}
