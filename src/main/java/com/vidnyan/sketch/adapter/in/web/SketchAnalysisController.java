package com.vidnyan.sketch.adapter.in.web;

import com.vidnyan.sketch.application.port.in.AnalyzeSketchUseCase;
import com.vidnyan.sketch.application.port.in.AnalyzeSketchUseCase.SketchAnalysisRequest;
import com.vidnyan.sketch.application.port.in.AnalyzeSketchUseCase.SketchAnalysisResult;
import com.vidnyan.sketch.application.port.out.CompileErrorAdvisor;
import com.vidnyan.sketch.domain.diagnostic.CompilerDiagnosticParser;
import com.vidnyan.sketch.domain.hint.CursorPosition;
import com.vidnyan.sketch.domain.hint.EditorState;
import com.vidnyan.sketch.domain.hint.Hint;
import com.vidnyan.sketch.domain.memory.RamUsageEstimator;
import com.vidnyan.sketch.domain.model.BoardMemoryProfile;
import com.vidnyan.sketch.domain.model.BoardProfileCatalog;
import com.vidnyan.sketch.domain.synthesis.CompilationUnit;
import com.vidnyan.sketch.domain.synthesis.CompilationUnitSynthesizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST API used by the editor.
 */
@Slf4j
@RestController
@RequestMapping("/api/sketch")
@RequiredArgsConstructor
public class SketchAnalysisController {

    private final AnalyzeSketchUseCase analyzeSketchUseCase;
    private final CompilationUnitSynthesizer synthesizer;
    private final RamUsageEstimator ramUsageEstimator;
    private final BoardProfileCatalog boardProfileCatalog;
    private final CompileErrorAdvisor compileErrorAdvisor;

    @PostMapping("/analyze")
    public AnalyzeResponse analyze(@RequestBody AnalyzeRequest request) {
        requireSource(request.source());
        log.info("Received analysis request for board '{}'", request.board());

        SketchAnalysisResult result = analyzeSketchUseCase.analyze(new SketchAnalysisRequest(
                request.source(),
                request.board(),
                request.cursor(),
                EditorState.fromMap(request.editorState())));

        return new AnalyzeResponse(
                result.compilationUnit().text(),
                result.memory().ramBytes(),
                result.memory().flashBytes(),
                result.memory().resolvedProfile(),
                result.hints().hints(),
                result.inlineHints());
    }

    @PostMapping("/synthesize")
    public SynthesizeResponse synthesize(@RequestBody SourceRequest request) {
        requireSource(request.source());
        CompilationUnit unit = synthesizer.synthesize(request.source());
        return new SynthesizeResponse(
                unit.text(),
                unit.typeDefinitions().stream().map(t -> t.name()).toList(),
                unit.prototypeLines(),
                unit.removedControlFlowLines(),
                unit.removedPrototypeLines());
    }

    @PostMapping("/ram")
    public RamResponse ram(@RequestBody SourceRequest request) {
        requireSource(request.source());
        BoardMemoryProfile profile = boardProfileCatalog.resolve(request.board());
        int bytes = ramUsageEstimator.estimate(request.source(), request.board());
        return new RamResponse(request.board(), profile.boardName(), bytes);
    }

    /**
     * Parse raw compiler output into editor hints plus recovery advice.
     */
    @PostMapping("/diagnostics")
    public DiagnosticsResponse diagnostics(@RequestBody DiagnosticsRequest request) {
        if (request.output() == null) {
            throw new IllegalArgumentException("output is required");
        }
        List<Hint> hints = CompilerDiagnosticParser.parse(request.output()).stream()
                .map(d -> d.toHint())
                .toList();
        return new DiagnosticsResponse(hints, compileErrorAdvisor.advise(request.output()));
    }

    @GetMapping("/boards")
    public List<BoardMemoryProfile> boards() {
        return boardProfileCatalog.profiles();
    }

    private static void requireSource(String source) {
        if (source == null) {
            throw new IllegalArgumentException("source is required");
        }
    }

    public record AnalyzeRequest(
        String source,
        String board,
        CursorPosition cursor,
        Map<String, Object> editorState
    ) {}

    public record AnalyzeResponse(
        String compilationUnit,
        int ramBytes,
        int flashBytes,
        String boardProfile,
        List<Hint> hints,
        List<String> inlineHints
    ) {}

    public record SourceRequest(
        String source,
        String board
    ) {}

    public record SynthesizeResponse(
        String compilationUnit,
        List<String> hoistedTypes,
        List<String> prototypes,
        List<Integer> removedControlFlowLines,
        List<Integer> removedPrototypeLines
    ) {}

    public record RamResponse(
        String board,
        String resolvedProfile,
        int ramBytes
    ) {}

    public record DiagnosticsRequest(
        String output
    ) {}

    public record DiagnosticsResponse(
        List<Hint> hints,
        List<CompileErrorAdvisor.ErrorAdvice> advice
    ) {}
}
