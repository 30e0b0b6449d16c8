package com.vidnyan.sketch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Sketch Analysis Engine
 *
 * Static analysis of Arduino sketches: compilation unit synthesis, memory estimates
 * and inline hints for the editor.
 */
@SpringBootApplication
public class SketchEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(SketchEngineApplication.class, args);
    }
}
