package com.vidnyan.sketch.adapter.out.board;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.sketch.application.port.out.BoardProfileRepository;
import com.vidnyan.sketch.domain.model.BoardMemoryProfile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Board profile repository backed by JSON files.
 * Loads profiles from every resource matching the configured pattern; unreadable files
 * are skipped.
 */
@Slf4j
@Component
public class ClasspathBoardProfileRepository implements BoardProfileRepository {

    private final ObjectMapper objectMapper;
    private final String profilesPath;

    private final List<BoardMemoryProfile> profiles = new ArrayList<>();

    public ClasspathBoardProfileRepository(
            ObjectMapper objectMapper,
            @Value("${sketch.analysis.board-profiles-path:classpath*:boards/*.json}") String profilesPath) {
        this.objectMapper = objectMapper;
        this.profilesPath = profilesPath;
    }

    @PostConstruct
    public void loadProfiles() {
        profiles.clear();
        try {
            PathMatchingResourcePatternResolver resolver = new PathMatchingResourcePatternResolver();
            Resource[] resources = resolver.getResources(profilesPath);

            for (Resource resource : resources) {
                try {
                    BoardFileDto file = objectMapper.readValue(resource.getInputStream(), BoardFileDto.class);
                    if (file.boards == null) {
                        continue;
                    }
                    for (BoardDto dto : file.boards) {
                        BoardMemoryProfile profile = mapToProfile(dto);
                        profiles.add(profile);
                        log.debug("Loaded board profile: {} ({} bytes base)",
                                profile.boardName(), profile.baseOverheadBytes());
                    }
                } catch (Exception e) {
                    log.warn("Failed to load board profiles from {}: {}", resource.getFilename(), e.getMessage());
                }
            }

            log.info("Loaded {} board profiles from {}", profiles.size(), profilesPath);
        } catch (IOException e) {
            log.error("Failed to load board profiles", e);
        }
    }

    @Override
    public List<BoardMemoryProfile> findAll() {
        return List.copyOf(profiles);
    }

    private BoardMemoryProfile mapToProfile(BoardDto dto) {
        if (dto.name == null || dto.name.isBlank()) {
            throw new IllegalArgumentException("board entry without a name");
        }
        BoardMemoryProfile base = is32Bit(dto.architecture)
                ? BoardMemoryProfile.wide(dto.name, dto.baseOverheadBytes)
                : BoardMemoryProfile.avr(dto.name, dto.baseOverheadBytes);
        return new BoardMemoryProfile(
                base.boardName(),
                base.baseOverheadBytes(),
                dto.intWidthBytes != null ? dto.intWidthBytes : base.intWidthBytes(),
                dto.pointerWidthBytes != null ? dto.pointerWidthBytes : base.pointerWidthBytes(),
                base.is32Bit());
    }

    private boolean is32Bit(String architecture) {
        if (architecture == null) return false;
        return switch (architecture.toLowerCase(Locale.ROOT)) {
            case "32bit", "32-bit", "arm", "esp32", "esp8266", "renesas" -> true;
            default -> false;
        };
    }

    // DTO classes for JSON deserialization
    static class BoardFileDto {
        public List<BoardDto> boards;
    }

    static class BoardDto {
        public String name;
        public String architecture;
        public int baseOverheadBytes;
        public Integer intWidthBytes;
        public Integer pointerWidthBytes;
    }
}
