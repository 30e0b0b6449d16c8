package com.vidnyan.sketch.application.port.in;

import com.vidnyan.sketch.application.port.out.CompileErrorAdvisor.ErrorAdvice;
import com.vidnyan.sketch.application.port.out.SketchCompiler.BuildResult;
import com.vidnyan.sketch.domain.hint.CursorPosition;
import com.vidnyan.sketch.domain.hint.EditorState;
import com.vidnyan.sketch.domain.hint.Hint;
import com.vidnyan.sketch.domain.hint.HintReport;
import com.vidnyan.sketch.domain.memory.MemoryEstimate;
import com.vidnyan.sketch.domain.synthesis.CompilationUnit;

import java.util.List;

/**
 * Primary use case: analyze one sketch for the editor.
 * Every call works on its own copies; results belong to the caller.
 */
public interface AnalyzeSketchUseCase {

    /**
     * Synthesize the compilation unit, estimate memory and rank hints for one sketch.
     * @param request Analysis request parameters
     * @return Analysis result owned by the caller
     */
    SketchAnalysisResult analyze(SketchAnalysisRequest request);

    /**
     * Synthesize the unit and hand it to the external compiler.
     */
    CompileOutcome compile(SketchAnalysisRequest request, String fqbn);

    /**
     * Analysis request parameters.
     */
    record SketchAnalysisRequest(
        String source,
        String boardName,      // null = configured default board
        CursorPosition cursor,
        EditorState editorState
    ) {
        public static SketchAnalysisRequest forSource(String source) {
            return new SketchAnalysisRequest(source, null, CursorPosition.start(), EditorState.defaults());
        }
    }

    /**
     * Analysis result.
     */
    record SketchAnalysisResult(
        CompilationUnit compilationUnit,
        MemoryEstimate memory,
        HintReport hints,
        AnalysisStats stats
    ) {
        public List<String> inlineHints() {
            return hints.inlineHints();
        }
    }

    /**
     * Analysis statistics.
     */
    record AnalysisStats(
        int linesAnalyzed,
        int typesHoisted,
        int prototypesSynthesized,
        int statementsRemoved,
        int hintsReported,
        long totalDurationMs
    ) {}

    /**
     * Compiler run with its diagnostics as hints and recovery advice.
     */
    record CompileOutcome(
        CompilationUnit compilationUnit,
        BuildResult build,
        List<Hint> diagnosticHints,
        List<ErrorAdvice> advice
    ) {
        public boolean success() {
            return build.success();
        }
    }
}
