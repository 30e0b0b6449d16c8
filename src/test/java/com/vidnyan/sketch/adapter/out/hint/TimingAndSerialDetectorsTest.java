package com.vidnyan.sketch.adapter.out.hint;

import com.vidnyan.sketch.domain.hint.EditorState;
import com.vidnyan.sketch.domain.hint.Hint;
import com.vidnyan.sketch.domain.hint.HintContext;
import com.vidnyan.sketch.domain.hint.HintSeverity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TimingAndSerialDetectorsTest {

    private static final EditorState MONITOR_CLOSED = new EditorState(false);

    @Test
    void delayInLoop_ShouldSuggestMillisForSameLineLoopBody() {
        List<Hint> hints = new DelayInLoopDetector(50)
                .detect(HintContext.of("void loop(){ delay(200); }\n", EditorState.defaults()));

        assertEquals(1, hints.size());
        Hint hint = hints.get(0);
        assertEquals(HintSeverity.TIP, hint.severity());
        assertEquals(1, hint.line());
        assertEquals(13, hint.column());
        assertTrue(hint.message().contains("millis()"));
    }

    @Test
    void delayInLoop_ShouldOnlyReportLongDelaysInsideLoop() {
        String code = "void setup() {\n"
                + "  delay(1000);\n"
                + "}\n"
                + "void loop()\n"
                + "{\n"
                + "  delay(50);\n"
                + "  delay(51);\n"
                + "}\n"
                + "void helper() {\n"
                + "  delay(500);\n"
                + "}\n";

        List<Hint> hints = new DelayInLoopDetector(50).detect(HintContext.of(code, EditorState.defaults()));

        assertEquals(List.of(7), hints.stream().map(Hint::line).toList());
    }

    @Test
    void delayInLoop_ShouldHonourConfiguredThreshold() {
        HintContext context = HintContext.of("void loop() {\n  delay(80);\n}\n", EditorState.defaults());

        assertTrue(new DelayInLoopDetector(100).detect(context).isEmpty());
        assertEquals(1, new DelayInLoopDetector(50).detect(context).size());
    }

    @Test
    void serialMonitorState_ShouldPointAtFirstBeginWhenMonitorClosed() {
        String code = "void setup() {\n  Serial.begin(9600);\n  Serial.begin(115200);\n}\n";

        List<Hint> closed = new SerialMonitorStateDetector().detect(HintContext.of(code, MONITOR_CLOSED));
        List<Hint> open = new SerialMonitorStateDetector().detect(HintContext.of(code, EditorState.defaults()));

        assertEquals(1, closed.size());
        assertEquals(2, closed.get(0).line());
        assertEquals(HintSeverity.INFO, closed.get(0).severity());
        assertTrue(open.isEmpty());
    }

    @Test
    void serialMonitorReminder_ShouldRemindAtFirstSerialUsage() {
        String code = "void setup() {\n  Serial.begin(9600);\n}\nvoid loop() {\n  Serial.println(\"monitor\");\n}\n";

        List<Hint> hints = new SerialMonitorReminderDetector().detect(HintContext.of(code, EditorState.defaults()));

        assertEquals(1, hints.size());
        assertEquals(2, hints.get(0).line());
        assertEquals("serial-reminder", hints.get(0).hintType());
    }

    @Test
    void serialMonitorReminder_ShouldStayQuietWhenCommentMentionsMonitor() {
        String code = "// open the Serial Monitor at 9600 baud\nvoid setup() {\n  Serial.begin(9600);\n}\n";

        assertTrue(new SerialMonitorReminderDetector().detect(HintContext.of(code, EditorState.defaults())).isEmpty());
    }

    @Test
    void serialMonitorReminder_ShouldIgnoreSketchesWithoutSerial() {
        String code = "void loop() {\n  digitalWrite(LED_BUILTIN, HIGH);\n}\n";

        assertTrue(new SerialMonitorReminderDetector().detect(HintContext.of(code, EditorState.defaults())).isEmpty());
    }
}
