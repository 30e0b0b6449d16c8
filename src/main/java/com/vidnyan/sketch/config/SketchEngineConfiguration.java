package com.vidnyan.sketch.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vidnyan.sketch.application.port.out.BoardProfileRepository;
import com.vidnyan.sketch.domain.hint.HintDetector;
import com.vidnyan.sketch.domain.memory.FlashUsageEstimator;
import com.vidnyan.sketch.domain.memory.RamUsageEstimator;
import com.vidnyan.sketch.domain.model.BoardProfileCatalog;
import com.vidnyan.sketch.domain.synthesis.CompilationUnitSynthesizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Spring configuration for the sketch engine.
 * The domain classes are plain Java; this wires them into the application.
 */
@Slf4j
@Configuration
public class SketchEngineConfiguration {

    /**
     * ObjectMapper for JSON parsing.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    /**
     * Built-in boards merged with the profiles from the repository.
     */
    @Bean
    public BoardProfileCatalog boardProfileCatalog(BoardProfileRepository boardProfileRepository) {
        BoardProfileCatalog catalog = BoardProfileCatalog.builtIn()
                .withOverrides(boardProfileRepository.findAll());
        log.info("Board catalog ready with {} profiles", catalog.profiles().size());
        return catalog;
    }

    @Bean
    public RamUsageEstimator ramUsageEstimator(BoardProfileCatalog boardProfileCatalog) {
        return new RamUsageEstimator(boardProfileCatalog);
    }

    @Bean
    public FlashUsageEstimator flashUsageEstimator() {
        return new FlashUsageEstimator();
    }

    @Bean
    public CompilationUnitSynthesizer compilationUnitSynthesizer() {
        return new CompilationUnitSynthesizer();
    }

    /**
     * Log available detectors on startup.
     */
    @Bean
    public String logDetectors(List<HintDetector> detectors) {
        log.info("Registered {} hint detectors:", detectors.size());
        detectors.forEach(d -> log.info("  - {}", d.getName()));
        return "detectors-logged";
    }
}
