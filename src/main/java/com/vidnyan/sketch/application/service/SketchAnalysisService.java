package com.vidnyan.sketch.application.service;

import com.vidnyan.sketch.SketchAnalysisProperties;
import com.vidnyan.sketch.application.port.in.AnalyzeSketchUseCase;
import com.vidnyan.sketch.application.port.out.CompileErrorAdvisor;
import com.vidnyan.sketch.application.port.out.SketchCompiler;
import com.vidnyan.sketch.domain.diagnostic.CompilerDiagnostic;
import com.vidnyan.sketch.domain.hint.Hint;
import com.vidnyan.sketch.domain.hint.HintReport;
import com.vidnyan.sketch.domain.memory.FlashUsageEstimator;
import com.vidnyan.sketch.domain.memory.MemoryEstimate;
import com.vidnyan.sketch.domain.memory.RamUsageEstimator;
import com.vidnyan.sketch.domain.model.SourceText;
import com.vidnyan.sketch.domain.synthesis.CompilationUnit;
import com.vidnyan.sketch.domain.synthesis.CompilationUnitSynthesizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Main application service that orchestrates the sketch analysis workflow.
 * Implements the primary use case.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SketchAnalysisService implements AnalyzeSketchUseCase {

    private static final String SKETCH_NAME = "sketch";

    private final CompilationUnitSynthesizer synthesizer;
    private final RamUsageEstimator ramUsageEstimator;
    private final FlashUsageEstimator flashUsageEstimator;
    private final ContextualHelpService contextualHelpService;
    private final SketchCompiler sketchCompiler;
    private final CompileErrorAdvisor compileErrorAdvisor;
    private final SketchAnalysisProperties properties;

    @Override
    public SketchAnalysisResult analyze(SketchAnalysisRequest request) {
        Instant startTime = Instant.now();
        String source = request.source() == null ? "" : request.source();
        String boardName = boardOrDefault(request.boardName());
        log.info("Starting analysis of {} characters for board '{}'", source.length(), boardName);

        // Step 1: Synthesize the compilation unit
        CompilationUnit unit = synthesizer.synthesize(source);
        log.info("Synthesized: {} types hoisted, {} prototypes",
                unit.typeDefinitions().size(), unit.prototypes().size());

        // Step 2: Estimate memory
        MemoryEstimate memory = new MemoryEstimate(
                boardName,
                ramUsageEstimator.catalog().resolve(boardName).boardName(),
                ramUsageEstimator.estimate(source, boardName),
                flashUsageEstimator.estimate(source));
        log.info("Estimated: {} bytes RAM, {} bytes flash", memory.ramBytes(), memory.flashBytes());

        // Step 3: Hints around the cursor
        HintReport hints = contextualHelpService.analyze(source, request.cursor(), request.editorState());

        Duration totalDuration = Duration.between(startTime, Instant.now());
        AnalysisStats stats = new AnalysisStats(
                SourceText.of(source).lineCount(),
                unit.typeDefinitions().size(),
                unit.prototypes().size(),
                unit.removedControlFlowLines().size() + unit.removedPrototypeLines().size(),
                hints.hints().size(),
                totalDuration.toMillis()
        );

        log.info("Analysis complete: {} hints in {}ms", stats.hintsReported(), stats.totalDurationMs());
        return new SketchAnalysisResult(unit, memory, hints, stats);
    }

    @Override
    public CompileOutcome compile(SketchAnalysisRequest request, String fqbn) {
        String board = fqbn == null || fqbn.isBlank() ? properties.getDefaultFqbn() : fqbn;
        CompilationUnit unit = synthesizer.synthesize(request.source());

        log.info("Compiling synthesized sketch for {}", board);
        SketchCompiler.BuildResult build = sketchCompiler.compile(
                new SketchCompiler.BuildRequest(SKETCH_NAME, unit.text(), board));

        List<Hint> diagnosticHints = build.diagnostics().stream()
                .map(CompilerDiagnostic::toHint)
                .toList();

        List<CompileErrorAdvisor.ErrorAdvice> advice = build.success()
                ? List.of()
                : compileErrorAdvisor.advise(build.output());

        log.info("Build {}: {} diagnostics", build.success() ? "succeeded" : "failed", diagnosticHints.size());
        return new CompileOutcome(unit, build, diagnosticHints, advice);
    }

    private String boardOrDefault(String boardName) {
        return boardName == null || boardName.isBlank() ? properties.getDefaultBoard() : boardName;
    }
}
