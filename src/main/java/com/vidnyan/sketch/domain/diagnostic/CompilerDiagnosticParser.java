package com.vidnyan.sketch.domain.diagnostic;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts error diagnostics from gcc-style compiler output.
 */
public final class CompilerDiagnosticParser {

    private static final Pattern ERROR_LINE = Pattern.compile(
            "^(?<file>[^:\\n]+):(?<line>\\d+):(?<column>\\d+):\\s*error:\\s*(?<message>.+)$",
            Pattern.MULTILINE);

    private CompilerDiagnosticParser() {
    }

    public static List<CompilerDiagnostic> parse(String output) {
        if (output == null || output.isEmpty()) {
            return List.of();
        }
        List<CompilerDiagnostic> diagnostics = new ArrayList<>();
        Matcher matcher = ERROR_LINE.matcher(output.replace("\r\n", "\n"));
        while (matcher.find()) {
            diagnostics.add(new CompilerDiagnostic(
                    matcher.group("file").strip(),
                    Integer.parseInt(matcher.group("line")),
                    Integer.parseInt(matcher.group("column")),
                    matcher.group("message").strip()));
        }
        return diagnostics;
    }
}
