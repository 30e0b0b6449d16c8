package com.vidnyan.sketch.application.port.out;

import com.vidnyan.sketch.domain.diagnostic.CompilerDiagnostic;

import java.util.List;

/**
 * Port for the external toolchain that compiles a synthesized unit.
 * Implementations must not throw for a failed build; failure is part of the result.
 */
public interface SketchCompiler {

    BuildResult compile(BuildRequest request);

    /**
     * Build request.
     */
    record BuildRequest(
        String sketchName,
        String source,
        String fqbn
    ) {}

    /**
     * Build result.
     */
    record BuildResult(
        boolean success,
        int exitCode,
        String output,
        List<CompilerDiagnostic> diagnostics
    ) {
        public static BuildResult failed(String message) {
            return new BuildResult(false, -1, message, List.of());
        }
    }
}
