package com.vidnyan.sketch.adapter.in.web;

import com.vidnyan.sketch.SketchAnalysisProperties;
import com.vidnyan.sketch.adapter.in.web.SketchAnalysisController.AnalyzeRequest;
import com.vidnyan.sketch.adapter.in.web.SketchAnalysisController.AnalyzeResponse;
import com.vidnyan.sketch.adapter.in.web.SketchAnalysisController.DiagnosticsRequest;
import com.vidnyan.sketch.adapter.in.web.SketchAnalysisController.DiagnosticsResponse;
import com.vidnyan.sketch.adapter.in.web.SketchAnalysisController.RamResponse;
import com.vidnyan.sketch.adapter.in.web.SketchAnalysisController.SourceRequest;
import com.vidnyan.sketch.adapter.in.web.SketchAnalysisController.SynthesizeResponse;
import com.vidnyan.sketch.adapter.out.advice.PatternCompileErrorAdvisor;
import com.vidnyan.sketch.adapter.out.hint.SerialMonitorStateDetector;
import com.vidnyan.sketch.application.port.out.SketchCompiler;
import com.vidnyan.sketch.application.service.ContextualHelpService;
import com.vidnyan.sketch.application.service.SketchAnalysisService;
import com.vidnyan.sketch.domain.memory.FlashUsageEstimator;
import com.vidnyan.sketch.domain.memory.RamUsageEstimator;
import com.vidnyan.sketch.domain.model.BoardMemoryProfile;
import com.vidnyan.sketch.domain.model.BoardProfileCatalog;
import com.vidnyan.sketch.domain.synthesis.CompilationUnitSynthesizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SketchAnalysisControllerTest {

    private SketchAnalysisController controller;

    @BeforeEach
    void setUp() {
        BoardProfileCatalog catalog = BoardProfileCatalog.builtIn();
        CompilationUnitSynthesizer synthesizer = new CompilationUnitSynthesizer();
        RamUsageEstimator ram = new RamUsageEstimator(catalog);
        PatternCompileErrorAdvisor advisor = new PatternCompileErrorAdvisor();
        SketchAnalysisService service = new SketchAnalysisService(
                synthesizer,
                ram,
                new FlashUsageEstimator(),
                new ContextualHelpService(List.of(new SerialMonitorStateDetector())),
                request -> SketchCompiler.BuildResult.failed("not used"),
                advisor,
                new SketchAnalysisProperties());
        controller = new SketchAnalysisController(service, synthesizer, ram, catalog, advisor);
    }

    @Test
    void analyze_ShouldPassEditorStateToDetectors() {
        AnalyzeRequest request = new AnalyzeRequest(
                "void setup(){Serial.begin(9600);}\nvoid loop(){}\n",
                "Arduino Uno",
                null,
                Map.of("serial_monitor_open", false));

        AnalyzeResponse response = controller.analyze(request);

        assertEquals(184, response.ramBytes());
        assertEquals("Arduino Uno", response.boardProfile());
        assertEquals(1, response.hints().size());
        assertEquals("serial-monitor", response.hints().get(0).hintType());
        assertEquals(1, response.inlineHints().size());
    }

    @Test
    void analyze_ShouldRejectMissingSource() {
        AnalyzeRequest request = new AnalyzeRequest(null, "Arduino Uno", null, null);

        assertThrows(IllegalArgumentException.class, () -> controller.analyze(request));
    }

    @Test
    void synthesize_ShouldReportHoistedTypesAndPrototypes() {
        String source = """
                struct Point { int x; int y; };
                void setup() {}
                void loop() {}
                int area(Point p) { return p.x * p.y; }
                int twice(int v) { return 2 * v; }
                """;

        SynthesizeResponse response = controller.synthesize(new SourceRequest(source, null));

        assertEquals(List.of("Point"), response.hoistedTypes());
        assertEquals(List.of("int twice(int v);"), response.prototypes());
        assertTrue(response.compilationUnit().startsWith("#include <Arduino.h>"));
    }

    @Test
    void ram_ShouldReportResolvedProfile() {
        RamResponse response = controller.ram(new SourceRequest("int x;", "Arduino Uno"));

        assertEquals("Arduino Uno", response.resolvedProfile());
        assertEquals(11, response.ramBytes());
    }

    @Test
    void ram_ShouldFallBackForUnknownBoard() {
        RamResponse response = controller.ram(new SourceRequest("int x;", "Mystery Board"));

        assertEquals("Mystery Board", response.board());
        assertEquals(BoardProfileCatalog.DEFAULT_PROFILE.boardName(), response.resolvedProfile());
    }

    @Test
    void diagnostics_ShouldMapErrorsToHintsAndAdvice() {
        DiagnosticsResponse response = controller.diagnostics(new DiagnosticsRequest(
                "/tmp/sketch/sketch.ino:12:5: error: expected ';' before 'delay'\n"));

        assertEquals(1, response.hints().size());
        assertEquals(12, response.hints().get(0).line());
        assertEquals(4, response.hints().get(0).column());
        assertEquals("Missing semicolon", response.advice().get(0).issue());
    }

    @Test
    void diagnostics_ShouldRejectMissingOutput() {
        assertThrows(IllegalArgumentException.class, () -> controller.diagnostics(new DiagnosticsRequest(null)));
    }

    @Test
    void boards_ShouldListBuiltInProfiles() {
        List<BoardMemoryProfile> boards = controller.boards();

        assertTrue(boards.stream().anyMatch(b -> b.boardName().equals("Arduino Mega 2560")));
        assertTrue(boards.stream().anyMatch(b -> b.boardName().equals("ESP32 Dev Module") && b.is32Bit()));
    }
}
