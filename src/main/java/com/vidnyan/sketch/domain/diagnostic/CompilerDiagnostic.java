package com.vidnyan.sketch.domain.diagnostic;

import com.vidnyan.sketch.domain.hint.Hint;
import com.vidnyan.sketch.domain.hint.HintSeverity;

/**
 * One {@code file:line:column: error: message} entry from compiler output.
 */
public record CompilerDiagnostic(
    String file,
    int line,
    int column,
    String message
) {

    public static final String HINT_TYPE = "compiler-error";

    /**
     * Surface the diagnostic through the same shape as the editor hints.
     */
    public Hint toHint() {
        return Hint.builder()
                .message(message)
                .line(line)
                .column(Math.max(0, column - 1))
                .severity(HintSeverity.WARNING)
                .hintType(HINT_TYPE)
                .tags("compiler", "error")
                .build();
    }

    public String format() {
        return file + ":" + line + ":" + column;
    }
}
