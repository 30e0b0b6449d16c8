package com.vidnyan.sketch.adapter.out.compiler;

import com.vidnyan.sketch.SketchAnalysisProperties;
import com.vidnyan.sketch.SketchEngineException;
import com.vidnyan.sketch.application.port.out.SketchCompiler;
import com.vidnyan.sketch.domain.diagnostic.CompilerDiagnostic;
import com.vidnyan.sketch.domain.diagnostic.CompilerDiagnosticParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.exec.CommandLine;
import org.apache.commons.exec.DefaultExecutor;
import org.apache.commons.exec.ExecuteWatchdog;
import org.apache.commons.exec.PumpStreamHandler;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Compiles a synthesized unit with arduino-cli.
 * The unit is written to a throw-away sketch folder ({@code <name>/<name>.ino}) which is
 * removed after the run.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ArduinoCliCompiler implements SketchCompiler {

    private final SketchAnalysisProperties properties;

    @Override
    public BuildResult compile(BuildRequest request) {
        SketchAnalysisProperties.Cli cli = properties.getCli();
        Path workRoot = null;
        try {
            workRoot = createWorkRoot(cli.getWorkDir());
            Path sketchDir = writeSketch(workRoot, request);

            ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
            ByteArrayOutputStream errorStream = new ByteArrayOutputStream();

            CommandLine cmdLine = new CommandLine(cli.getExecutable());
            cmdLine.addArgument("compile");
            cmdLine.addArgument("--fqbn");
            cmdLine.addArgument(request.fqbn(), false);
            cmdLine.addArgument(sketchDir.toString(), false);

            ExecuteWatchdog watchdog = ExecuteWatchdog.builder()
                    .setTimeout(Duration.ofSeconds(cli.getTimeoutSeconds()))
                    .get();
            DefaultExecutor executor = DefaultExecutor.builder()
                    .setWorkingDirectory(workRoot.toFile())
                    .get();
            executor.setStreamHandler(new PumpStreamHandler(outputStream, errorStream));
            executor.setWatchdog(watchdog);
            // a failing build is a result, not an exception
            executor.setExitValues(null);

            log.info("Running: {}", cmdLine);
            int exitCode = executor.execute(cmdLine);

            String output = outputStream.toString(StandardCharsets.UTF_8)
                    + errorStream.toString(StandardCharsets.UTF_8);
            if (watchdog.killedProcess()) {
                log.warn("Compilation timed out after {}s", cli.getTimeoutSeconds());
                return new BuildResult(false, exitCode,
                        output + "\nCompilation timed out after " + cli.getTimeoutSeconds() + "s", List.of());
            }

            List<CompilerDiagnostic> diagnostics = CompilerDiagnosticParser.parse(output);
            log.info("Compiler exited with {} ({} errors)", exitCode, diagnostics.size());
            return new BuildResult(exitCode == 0, exitCode, output, diagnostics);
        } catch (IOException e) {
            log.warn("Compiler '{}' could not be run: {}", cli.getExecutable(), e.getMessage());
            return BuildResult.failed("Compiler '" + cli.getExecutable() + "' could not be run: " + e.getMessage());
        } catch (SketchEngineException e) {
            log.warn(e.getMessage());
            return BuildResult.failed(e.getMessage());
        } finally {
            if (workRoot != null) {
                deleteQuietly(workRoot);
            }
        }
    }

    private Path createWorkRoot(String workDir) {
        try {
            if (workDir == null || workDir.isBlank()) {
                return Files.createTempDirectory("sketch-build-");
            }
            Path base = Files.createDirectories(Path.of(workDir));
            return Files.createTempDirectory(base, "sketch-build-");
        } catch (IOException e) {
            throw new SketchEngineException("Cannot create build directory: " + e.getMessage(), e);
        }
    }

    private Path writeSketch(Path workRoot, BuildRequest request) {
        try {
            Path sketchDir = Files.createDirectories(workRoot.resolve(request.sketchName()));
            Files.writeString(sketchDir.resolve(request.sketchName() + ".ino"), request.source(), StandardCharsets.UTF_8);
            return sketchDir;
        } catch (IOException e) {
            throw new SketchEngineException("Cannot write sketch " + request.sketchName() + ": " + e.getMessage(), e);
        }
    }

    private void deleteQuietly(Path workRoot) {
        try {
            FileSystemUtils.deleteRecursively(workRoot);
        } catch (IOException e) {
            log.warn("Failed to clean up {}: {}", workRoot, e.getMessage());
        }
    }
}
