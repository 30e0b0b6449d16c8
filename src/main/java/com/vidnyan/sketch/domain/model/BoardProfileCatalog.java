package com.vidnyan.sketch.domain.model;

import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lookup table of board name to memory profile with a mandatory fallback entry.
 * Resolution is an exact match on the display name.
 */
@Slf4j
public final class BoardProfileCatalog {

    public static final BoardMemoryProfile DEFAULT_PROFILE = BoardMemoryProfile.avr("Default AVR", 9);

    private final Map<String, BoardMemoryProfile> profiles;
    private final BoardMemoryProfile fallback;

    private BoardProfileCatalog(Map<String, BoardMemoryProfile> profiles, BoardMemoryProfile fallback) {
        this.profiles = Map.copyOf(profiles);
        this.fallback = fallback;
    }

    /**
     * Profiles for the boards shipped with the editor.
     */
    public static BoardProfileCatalog builtIn() {
        Map<String, BoardMemoryProfile> table = new LinkedHashMap<>();
        put(table, BoardMemoryProfile.avr("Arduino Uno", 9));
        put(table, BoardMemoryProfile.avr("Arduino Nano", 9));
        put(table, BoardMemoryProfile.avr("Arduino Pro Mini", 9));
        put(table, BoardMemoryProfile.avr("Arduino Leonardo", 20));
        put(table, BoardMemoryProfile.avr("Arduino Micro", 20));
        put(table, BoardMemoryProfile.avr("Arduino Mega 2560", 12));
        put(table, BoardMemoryProfile.wide("Arduino Due", 100));
        put(table, BoardMemoryProfile.wide("Arduino Uno R4 WiFi", 100));
        put(table, BoardMemoryProfile.wide("Arduino Uno R4 Minima", 100));
        put(table, BoardMemoryProfile.wide("ESP32 Dev Module", 25600));
        put(table, BoardMemoryProfile.wide("ESP8266 NodeMCU", 26624));
        return new BoardProfileCatalog(table, DEFAULT_PROFILE);
    }

    /**
     * New catalog with the given profiles added; same-name entries replace existing ones.
     */
    public BoardProfileCatalog withOverrides(Collection<BoardMemoryProfile> overrides) {
        Map<String, BoardMemoryProfile> merged = new LinkedHashMap<>(profiles);
        for (BoardMemoryProfile profile : overrides) {
            if (profile.boardName() == null || profile.boardName().isBlank()) {
                log.warn("Ignoring board profile without a name: {}", profile);
                continue;
            }
            put(merged, profile);
        }
        return new BoardProfileCatalog(merged, fallback);
    }

    public BoardMemoryProfile resolve(String boardName) {
        if (boardName == null) {
            return fallback;
        }
        BoardMemoryProfile profile = profiles.get(boardName);
        if (profile == null) {
            log.debug("Unknown board '{}', using {}", boardName, fallback.boardName());
            return fallback;
        }
        return profile;
    }

    public boolean isKnown(String boardName) {
        return boardName != null && profiles.containsKey(boardName);
    }

    public BoardMemoryProfile fallback() {
        return fallback;
    }

    public List<BoardMemoryProfile> profiles() {
        return profiles.values().stream()
                .sorted((a, b) -> a.boardName().compareToIgnoreCase(b.boardName()))
                .toList();
    }

    private static void put(Map<String, BoardMemoryProfile> table, BoardMemoryProfile profile) {
        table.put(profile.boardName(), profile);
    }
}
