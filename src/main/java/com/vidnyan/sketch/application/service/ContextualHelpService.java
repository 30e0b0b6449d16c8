package com.vidnyan.sketch.application.service;

import com.vidnyan.sketch.domain.hint.CursorPosition;
import com.vidnyan.sketch.domain.hint.EditorState;
import com.vidnyan.sketch.domain.hint.Hint;
import com.vidnyan.sketch.domain.hint.HintContext;
import com.vidnyan.sketch.domain.hint.HintDetector;
import com.vidnyan.sketch.domain.hint.HintReport;
import com.vidnyan.sketch.domain.hint.HintSeverity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Runs every registered hint detector over a sketch and ranks the result around the cursor.
 * Holds no state between calls; each report is built fresh.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ContextualHelpService {

    private final List<HintDetector> detectors;

    public HintReport analyze(String code, CursorPosition cursor, EditorState editorState) {
        CursorPosition position = cursor == null ? CursorPosition.start() : cursor;
        EditorState state = editorState == null ? EditorState.defaults() : editorState;
        if (code == null || code.isBlank()) {
            return HintReport.empty(position, state);
        }

        HintContext context = HintContext.of(code, state);
        List<Hint> hints = new ArrayList<>();
        for (HintDetector detector : detectors) {
            try {
                List<Hint> found = detector.detect(context);
                if (!found.isEmpty()) {
                    log.debug("  {} reported {} hints", detector.getName(), found.size());
                }
                hints.addAll(found);
            } catch (Exception e) {
                log.error("Error running hint detector {}: {}", detector.getName(), e.getMessage());
            }
        }

        hints.sort(rankingAround(position));
        return new HintReport(hints, position, state);
    }

    /**
     * Analyze with the cursor given as an absolute character offset into the code.
     */
    public HintReport analyzeAtOffset(String code, int offset, EditorState editorState) {
        return analyze(code, CursorPosition.ofOffset(offset, code), editorState);
    }

    /**
     * Nearest to the cursor first, warnings before other severities, then by line.
     */
    static Comparator<Hint> rankingAround(CursorPosition cursor) {
        int cursorLine = cursor.line() + 1;
        return Comparator.<Hint>comparingInt(h -> Math.abs(h.line() - cursorLine))
                .thenComparingInt(h -> h.severity() == HintSeverity.WARNING ? 0 : 1)
                .thenComparingInt(Hint::line);
    }
}
