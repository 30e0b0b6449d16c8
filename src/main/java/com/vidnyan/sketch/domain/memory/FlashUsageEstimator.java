package com.vidnyan.sketch.domain.memory;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rough program-storage estimate: runtime base, per-function and per-line costs,
 * string literals and library code.
 */
public class FlashUsageEstimator {

    static final int BASE_BYTES = 1500;
    static final int FUNCTION_BYTES = 150;
    static final int LINE_BYTES = 15;

    private static final Pattern FUNCTION = Pattern.compile("\\w+\\s+\\w+\\s*\\([^)]*\\)\\s*\\{");
    private static final Pattern STRING_LITERAL = Pattern.compile("\"((?:[^\"\\\\\\n]|\\\\.)*)\"");

    private static final Pattern SERIAL = Pattern.compile("Serial\\.begin");
    private static final Pattern WIRE = Pattern.compile("Wire\\.|#include\\s*<Wire\\.h>");
    private static final Pattern SPI = Pattern.compile("SPI\\.|#include\\s*<SPI\\.h>");
    private static final Pattern SERVO = Pattern.compile("Servo");
    private static final Pattern LCD = Pattern.compile("LCD|lcd\\.");

    public int estimate(String source) {
        if (source == null || source.isBlank()) {
            return 0;
        }

        int total = BASE_BYTES;
        total += count(FUNCTION, source) * FUNCTION_BYTES;

        Matcher literal = STRING_LITERAL.matcher(source);
        while (literal.find()) {
            total += literal.group(1).length();
        }

        for (String line : source.split("\n")) {
            String trimmed = line.strip();
            if (!trimmed.isEmpty() && !trimmed.startsWith("//")) {
                total += LINE_BYTES;
            }
        }

        if (SERIAL.matcher(source).find()) {
            total += 1000;
        }
        if (WIRE.matcher(source).find()) {
            total += 1500;
        }
        if (SPI.matcher(source).find()) {
            total += 800;
        }
        if (SERVO.matcher(source).find()) {
            total += 1200;
        }
        if (LCD.matcher(source).find()) {
            total += 2000;
        }
        return total;
    }

    private static int count(Pattern pattern, String text) {
        int count = 0;
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            count++;
        }
        return count;
    }
}
