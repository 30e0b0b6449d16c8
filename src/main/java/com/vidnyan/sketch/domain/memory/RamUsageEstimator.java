package com.vidnyan.sketch.domain.memory;

import com.vidnyan.sketch.domain.model.BoardMemoryProfile;
import com.vidnyan.sketch.domain.model.BoardProfileCatalog;
import com.vidnyan.sketch.domain.scan.LexicalScrubber;
import lombok.extern.slf4j.Slf4j;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Conservative static estimate of the RAM a sketch will use once compiled.
 * <p>
 * Board base overhead, plus declared scalars, arrays, pointers and String objects,
 * plus fixed buffers for recognised libraries. Every term only adds, so more
 * declarations never lower the estimate. Declarations stored with {@code PROGMEM}
 * live in flash and are not counted.
 * </p>
 */
@Slf4j
public class RamUsageEstimator {

    static final int SERIAL_PORT_BYTES = 175;
    static final int WIRE_BYTES = 32;
    static final int ETHERNET_BYTES = 8192;
    static final int SD_BYTES = 512;
    static final int WIFI_BYTES = 1024;
    static final int SERVO_BYTES = 1;
    static final int LIQUID_CRYSTAL_BYTES = 8;
    static final int SOFTWARE_SERIAL_BYTES = 64;
    static final int STRING_OBJECT_BYTES = 6;

    private static final Pattern PROGMEM_DECLARATION = Pattern.compile("[^;{}]*\\bPROGMEM\\b[^;]*;");
    private static final Pattern SIZED_ARRAY = Pattern.compile("\\b(\\w+)\\s+(\\w+)\\s*\\[(\\d+)\\]\\s*(?:=|;)");
    private static final Pattern INITIALIZED_ARRAY = Pattern.compile("\\b(\\w+)\\s+\\w+\\s*\\[\\s*\\]\\s*=\\s*\\{([^}]+)\\}");
    /** Declarations only: the type must open a statement, so {@code a = b * c;} is not a pointer. */
    private static final Pattern POINTER = Pattern.compile(
            "(?:^|(?<=[;{}]))\\s*(?:(?:const|static|volatile|unsigned|signed|struct)\\s+)*(\\w+)\\s*\\*\\s*(\\w+)\\s*(?:=|;)",
            Pattern.MULTILINE);
    private static final Set<String> NON_TYPE_WORDS = Set.of("return", "case", "else", "do", "goto", "delete");
    private static final Pattern STRING_OBJECT = Pattern.compile("\\bString\\s+(\\w+(?:\\s*,\\s*\\w+)*)\\s*(?:=|;|\\()");
    private static final Pattern SERVO_INSTANCE = Pattern.compile("\\bServo\\s+\\w+");
    private static final Pattern SOFTWARE_SERIAL_INSTANCE = Pattern.compile("\\bSoftwareSerial\\s+\\w+\\s*\\(");

    /** Fixed per-library cost, charged once when any of the patterns occurs. */
    private static final List<LibraryCost> LIBRARY_COSTS = List.of(
            new LibraryCost("Serial", SERIAL_PORT_BYTES, false, Pattern.compile("\\bSerial\\.")),
            new LibraryCost("Serial1", SERIAL_PORT_BYTES, false, Pattern.compile("\\bSerial1\\.")),
            new LibraryCost("Serial2", SERIAL_PORT_BYTES, false, Pattern.compile("\\bSerial2\\.")),
            new LibraryCost("Serial3", SERIAL_PORT_BYTES, false, Pattern.compile("\\bSerial3\\.")),
            new LibraryCost("Wire", WIRE_BYTES, false, Pattern.compile("\\bWire\\.|[<\"]Wire\\.h[>\"]")),
            new LibraryCost("Ethernet", ETHERNET_BYTES, false, Pattern.compile("\\bEthernet\\.|#include\\s*[<\"]Ethernet")),
            new LibraryCost("SD", SD_BYTES, false, Pattern.compile("\\bSD\\.|[<\"]SD\\.h[>\"]")),
            new LibraryCost("WiFi", WIFI_BYTES, true, Pattern.compile("\\bWiFi\\.")),
            new LibraryCost("LiquidCrystal", LIQUID_CRYSTAL_BYTES, false, Pattern.compile("LiquidCrystal")));

    private static final Map<ScalarType, Pattern> SCALAR_DECLARATIONS = ScalarType.mostSpecificFirst().stream()
            .collect(Collectors.toMap(t -> t, RamUsageEstimator::declarationPattern, (a, b) -> a,
                    LinkedHashMap::new));

    private record LibraryCost(String name, int bytes, boolean espOnly, Pattern usage) {
    }

    private final BoardProfileCatalog catalog;
    private final LexicalScrubber scrubber;

    public RamUsageEstimator(BoardProfileCatalog catalog) {
        this.catalog = catalog;
        this.scrubber = new LexicalScrubber();
    }

    /**
     * Estimated RAM in bytes; 0 for a blank sketch. Unknown boards use the default AVR profile.
     */
    public int estimate(String source, String boardName) {
        if (source == null || source.isBlank()) {
            return 0;
        }

        BoardMemoryProfile profile = catalog.resolve(boardName);
        if (!catalog.isKnown(boardName)) {
            log.warn("No memory profile for board '{}', estimating with {}", boardName, profile.boardName());
        }

        String code = scrubber.scrub(source);
        String ramCode = PROGMEM_DECLARATION.matcher(code).replaceAll(";");

        long total = profile.baseOverheadBytes();
        total += scalarBytes(ramCode, profile);
        total += sizedArrayBytes(ramCode, profile);
        total += initializedArrayBytes(ramCode, profile);
        total += (long) pointerDeclarations(ramCode) * profile.pointerWidthBytes();
        total += stringObjectBytes(code);
        total += libraryBytes(source, boardName);

        int bytes = (int) Math.max(0, Math.min(Integer.MAX_VALUE, total));
        log.debug("RAM estimate for '{}' on {}: {} bytes", abbreviate(source), profile.boardName(), bytes);
        return bytes;
    }

    public BoardProfileCatalog catalog() {
        return catalog;
    }

    private static Pattern declarationPattern(ScalarType type) {
        String keyword = Pattern.quote(type.keyword()).replace(" ", "\\E\\s+\\Q");
        return Pattern.compile("\\b" + keyword
                + "\\s+(?:(?:static|volatile|const)\\s+)*(\\w+(?:\\s*,\\s*\\w+)*)\\s*(?:=|;)");
    }

    /**
     * Each declaration is charged to the most specific keyword that matches it; the
     * start of the name list identifies a declaration.
     */
    private static long scalarBytes(String code, BoardMemoryProfile profile) {
        Set<Integer> claimed = new HashSet<>();
        long total = 0;
        for (Map.Entry<ScalarType, Pattern> entry : SCALAR_DECLARATIONS.entrySet()) {
            Matcher matcher = entry.getValue().matcher(code);
            while (matcher.find()) {
                if (!claimed.add(matcher.start(1))) {
                    continue;
                }
                int names = matcher.group(1).split(",").length;
                total += (long) names * entry.getKey().widthOn(profile);
            }
        }
        return total;
    }

    private static long sizedArrayBytes(String code, BoardMemoryProfile profile) {
        long total = 0;
        Matcher matcher = SIZED_ARRAY.matcher(code);
        while (matcher.find()) {
            long length = Math.min(Integer.MAX_VALUE, parseLength(matcher.group(3)));
            total += length * elementWidth(matcher.group(1), profile);
        }
        return total;
    }

    private static long initializedArrayBytes(String code, BoardMemoryProfile profile) {
        long total = 0;
        Matcher matcher = INITIALIZED_ARRAY.matcher(code);
        while (matcher.find()) {
            int elements = 0;
            for (String element : matcher.group(2).split(",")) {
                if (!element.isBlank()) {
                    elements++;
                }
            }
            total += (long) elements * elementWidth(matcher.group(1), profile);
        }
        return total;
    }

    private static long stringObjectBytes(String code) {
        long total = 0;
        Matcher matcher = STRING_OBJECT.matcher(code);
        while (matcher.find()) {
            total += matcher.group(1).split(",").length * STRING_OBJECT_BYTES;
        }
        return total;
    }

    private static long libraryBytes(String source, String boardName) {
        boolean esp = isEspFamily(boardName);
        long total = 0;
        for (LibraryCost cost : LIBRARY_COSTS) {
            if (cost.espOnly() && !esp) {
                continue;
            }
            if (cost.usage().matcher(source).find()) {
                total += cost.bytes();
            }
        }
        total += countMatches(SERVO_INSTANCE, source) * SERVO_BYTES;
        total += countMatches(SOFTWARE_SERIAL_INSTANCE, source) * SOFTWARE_SERIAL_BYTES;
        return total;
    }

    static boolean isEspFamily(String boardName) {
        return boardName != null && boardName.contains("ESP");
    }

    private static int elementWidth(String typeName, BoardMemoryProfile profile) {
        return ScalarType.fromKeyword(typeName).map(t -> t.widthOn(profile)).orElse(1);
    }

    private static int pointerDeclarations(String code) {
        int count = 0;
        Matcher matcher = POINTER.matcher(code);
        while (matcher.find()) {
            if (!NON_TYPE_WORDS.contains(matcher.group(1))) {
                count++;
            }
        }
        return count;
    }

    private static long parseLength(String digits) {
        try {
            return Long.parseLong(digits);
        } catch (NumberFormatException e) {
            return Integer.MAX_VALUE;
        }
    }

    private static int countMatches(Pattern pattern, String text) {
        int count = 0;
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    private static String abbreviate(String source) {
        String firstLine = source.strip().split("\n", 2)[0];
        return firstLine.length() <= 40 ? firstLine : firstLine.substring(0, 40) + "...";
    }
}
