package com.vidnyan.sketch.adapter.out.board;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.sketch.domain.model.BoardMemoryProfile;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ClasspathBoardProfileRepositoryTest {

    @TempDir
    Path boardsDir;

    private List<BoardMemoryProfile> load(String pattern) {
        ClasspathBoardProfileRepository repository = new ClasspathBoardProfileRepository(new ObjectMapper(), pattern);
        repository.loadProfiles();
        return repository.findAll();
    }

    @Test
    void loadProfiles_ShouldReadBundledBoards() {
        List<BoardMemoryProfile> profiles = load("classpath*:boards/*.json");

        BoardMemoryProfile esp = profiles.stream()
                .filter(p -> p.boardName().equals("Arduino Nano ESP32"))
                .findFirst()
                .orElseThrow();
        assertTrue(esp.is32Bit());
        assertEquals(25600, esp.baseOverheadBytes());
        assertTrue(profiles.stream().anyMatch(p -> p.boardName().equals("Arduino Nano Every")));
    }

    @Test
    void loadProfiles_ShouldApplyWidthOverridesAndSkipBrokenFiles() throws Exception {
        Files.writeString(boardsDir.resolve("custom.json"), """
                {"boards": [
                  {"name": "Custom AVR", "architecture": "avr", "baseOverheadBytes": 30},
                  {"name": "Custom ARM", "architecture": "arm", "baseOverheadBytes": 64, "intWidthBytes": 2}
                ]}
                """);
        Files.writeString(boardsDir.resolve("broken.json"), "{ not json");

        List<BoardMemoryProfile> profiles = load("file:" + boardsDir.toAbsolutePath() + "/*.json");

        assertEquals(2, profiles.size());
        BoardMemoryProfile avr = profiles.stream().filter(p -> p.boardName().equals("Custom AVR")).findFirst().orElseThrow();
        assertFalse(avr.is32Bit());
        assertEquals(2, avr.intWidthBytes());
        BoardMemoryProfile arm = profiles.stream().filter(p -> p.boardName().equals("Custom ARM")).findFirst().orElseThrow();
        assertTrue(arm.is32Bit());
        assertEquals(2, arm.intWidthBytes());
        assertEquals(4, arm.pointerWidthBytes());
    }

    @Test
    void loadProfiles_ShouldSkipEntriesWithoutName() throws Exception {
        Files.writeString(boardsDir.resolve("nameless.json"), """
                {"boards": [{"architecture": "avr", "baseOverheadBytes": 30}]}
                """);

        assertTrue(load("file:" + boardsDir.toAbsolutePath() + "/*.json").isEmpty());
    }

    @Test
    void findAll_ShouldBeEmptyWhenNothingMatches() {
        assertTrue(load("file:" + boardsDir.toAbsolutePath() + "/*.json").isEmpty());
    }
}
