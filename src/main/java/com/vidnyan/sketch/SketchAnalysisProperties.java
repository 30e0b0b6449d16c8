package com.vidnyan.sketch;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the sketch analysis engine.
 */
@Data
@Component
@ConfigurationProperties(prefix = "sketch.analysis")
public class SketchAnalysisProperties {

    /**
     * Board used when a request names none.
     */
    private String defaultBoard = "Arduino Uno";

    /**
     * Fully qualified board name used when compiling without an explicit one.
     */
    private String defaultFqbn = "arduino:avr:uno";

    /**
     * delay(N) inside loop() is reported when N exceeds this value.
     */
    private long delayThresholdMs = 50;

    /**
     * Extra board memory profiles (JSON), merged over the built-in table.
     */
    private String boardProfilesPath = "classpath*:boards/*.json";

    private Cli cli = new Cli();

    @Data
    public static class Cli {
        private String executable = "arduino-cli";
        private long timeoutSeconds = 120;
        private String workDir;
    }
}
