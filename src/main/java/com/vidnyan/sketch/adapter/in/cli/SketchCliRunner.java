package com.vidnyan.sketch.adapter.in.cli;

import com.vidnyan.sketch.SketchEngineException;
import com.vidnyan.sketch.application.port.in.AnalyzeSketchUseCase;
import com.vidnyan.sketch.application.port.in.AnalyzeSketchUseCase.CompileOutcome;
import com.vidnyan.sketch.application.port.in.AnalyzeSketchUseCase.SketchAnalysisRequest;
import com.vidnyan.sketch.application.port.in.AnalyzeSketchUseCase.SketchAnalysisResult;
import com.vidnyan.sketch.application.port.out.CompileErrorAdvisor;
import com.vidnyan.sketch.domain.hint.CursorPosition;
import com.vidnyan.sketch.domain.hint.EditorState;
import com.vidnyan.sketch.domain.hint.Hint;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * CLI Runner for standalone sketch analysis.
 * Runs analysis when sketch.analyze.path property is set.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SketchCliRunner implements CommandLineRunner {

    private final AnalyzeSketchUseCase analyzeSketchUseCase;
    private final ConfigurableApplicationContext context;

    @Value("${sketch.analyze.path:}")
    private String sketchPath;

    @Value("${sketch.analyze.board:}")
    private String boardName;

    @Value("${sketch.analyze.compile:false}")
    private boolean compile;

    @Value("${sketch.analyze.fqbn:}")
    private String fqbn;

    @Override
    public void run(String... args) throws Exception {
        if (sketchPath == null || sketchPath.isBlank()) {
            log.info("No sketch specified. Set sketch.analyze.path property.");
            return;
        }

        try {
            log.info("════════════════════════════════════════════════════════════════");
            log.info(" Sketch Analysis Engine");
            log.info(" Analyzing: {}", sketchPath);
            log.info("════════════════════════════════════════════════════════════════");

            String source = readSketch(Path.of(sketchPath));
            SketchAnalysisRequest request = new SketchAnalysisRequest(
                    source, boardName, CursorPosition.start(), EditorState.defaults());
            SketchAnalysisResult result = analyzeSketchUseCase.analyze(request);
            printResults(result);

            if (compile) {
                printBuild(analyzeSketchUseCase.compile(request, fqbn));
            }

            log.info("");
            log.info("Analysis complete!");
        } finally {
            // Ensure application shuts down after analysis
            SpringApplication.exit(context, () -> 0);
        }
    }

    private String readSketch(Path path) {
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SketchEngineException("Cannot read sketch " + path + ": " + e.getMessage(), e);
        }
    }

    private void printResults(SketchAnalysisResult result) {
        log.info("");
        log.info(" Board:            {} (profile: {})",
                result.memory().boardName(), result.memory().resolvedProfile());
        log.info(" Lines analyzed:   {}", result.stats().linesAnalyzed());
        log.info(" Types hoisted:    {}", result.stats().typesHoisted());
        log.info(" Prototypes:       {}", result.stats().prototypesSynthesized());
        log.info(" Removed lines:    {}", result.stats().statementsRemoved());
        log.info(" RAM estimate:     {} bytes", result.memory().ramBytes());
        log.info(" Flash estimate:   {} bytes", result.memory().flashBytes());
        log.info(" Duration:         {}ms", result.stats().totalDurationMs());
        log.info("────────────────────────────────────────────────────────────────");
        log.info(" COMPILATION UNIT:");
        for (String line : result.compilationUnit().text().split("\n", -1)) {
            log.info("   {}", line);
        }

        log.info("────────────────────────────────────────────────────────────────");
        if (result.hints().isEmpty()) {
            log.info(" No hints. Looks good.");
            return;
        }
        log.info(" HINTS:");
        for (Hint hint : result.hints().hints()) {
            log.info("   [{}] {}", hint.severity().label(), hint.format());
        }
    }

    private void printBuild(CompileOutcome outcome) {
        log.info("");
        log.info("────────────────────────────────────────────────────────────────");
        log.info(" BUILD {}", outcome.success() ? "SUCCEEDED" : "FAILED");
        for (Hint hint : outcome.diagnosticHints()) {
            log.info("   {}", hint.format());
        }
        for (CompileErrorAdvisor.ErrorAdvice advice : outcome.advice()) {
            log.info("   {} ({}%)", advice.issue(), Math.round(advice.confidence() * 100));
            advice.suggestions().forEach(s -> log.info("     - {}", s));
        }
    }
}
