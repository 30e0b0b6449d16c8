package com.vidnyan.sketch.application.service;

import com.vidnyan.sketch.adapter.out.hint.DelayInLoopDetector;
import com.vidnyan.sketch.adapter.out.hint.HardcodedLedPinDetector;
import com.vidnyan.sketch.adapter.out.hint.SerialMonitorStateDetector;
import com.vidnyan.sketch.domain.hint.CursorPosition;
import com.vidnyan.sketch.domain.hint.EditorState;
import com.vidnyan.sketch.domain.hint.Hint;
import com.vidnyan.sketch.domain.hint.HintDetector;
import com.vidnyan.sketch.domain.hint.HintReport;
import com.vidnyan.sketch.domain.hint.HintSeverity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ContextualHelpServiceTest {

    private static Hint hint(int line, HintSeverity severity) {
        return Hint.builder().message("hint at " + line).line(line).severity(severity).build();
    }

    @Test
    void analyze_ShouldRankByDistanceThenWarningsThenLine() {
        HintDetector fixed = context -> List.of(
                hint(1, HintSeverity.TIP),
                hint(5, HintSeverity.INFO),
                hint(4, HintSeverity.TIP),
                hint(6, HintSeverity.WARNING));
        ContextualHelpService service = new ContextualHelpService(List.of(fixed));

        HintReport report = service.analyze("x", CursorPosition.of(4, 0), EditorState.defaults());

        assertEquals(List.of(5, 6, 4, 1), report.hints().stream().map(Hint::line).toList());
    }

    @Test
    void analyze_ShouldBreakDistanceTiesByLineNumber() {
        HintDetector fixed = context -> List.of(hint(7, HintSeverity.TIP), hint(3, HintSeverity.TIP));
        ContextualHelpService service = new ContextualHelpService(List.of(fixed));

        HintReport report = service.analyze("x", CursorPosition.of(4, 0), EditorState.defaults());

        assertEquals(List.of(3, 7), report.hints().stream().map(Hint::line).toList());
    }

    @Test
    void analyze_ShouldSurviveFailingDetector() {
        HintDetector broken = context -> {
            throw new IllegalStateException("boom");
        };
        ContextualHelpService service = new ContextualHelpService(List.of(broken, new HardcodedLedPinDetector()));

        HintReport report = service.analyze("pinMode(13, OUTPUT);\n", CursorPosition.start(), EditorState.defaults());

        assertEquals(1, report.hints().size());
    }

    @Test
    void analyze_ShouldRenderInlineHints() {
        ContextualHelpService service = new ContextualHelpService(List.of(
                new HardcodedLedPinDetector(), new DelayInLoopDetector(50), new SerialMonitorStateDetector()));

        HintReport report = service.analyze("pinMode(13, OUTPUT);\n", null, null);

        assertEquals(List.of("Use LED_BUILTIN instead of 13 for the built-in LED (line 1)"), report.inlineHints());
        assertEquals(1, report.count(HintSeverity.TIP));
        assertTrue(report.editorState().serialMonitorOpen());
    }

    @Test
    void analyze_ShouldReturnEmptyReportForBlankCode() {
        ContextualHelpService service = new ContextualHelpService(List.of(new HardcodedLedPinDetector()));

        HintReport report = service.analyze("  ", CursorPosition.start(), EditorState.defaults());

        assertTrue(report.isEmpty());
        assertTrue(report.inlineHints().isEmpty());
    }

    @Test
    void analyzeAtOffset_ShouldConvertOffsetToCursorLine() {
        ContextualHelpService service = new ContextualHelpService(List.of());

        HintReport report = service.analyzeAtOffset("a\nb\nc", 4, EditorState.defaults());

        assertEquals(CursorPosition.of(2, 0), report.cursor());
    }
}
