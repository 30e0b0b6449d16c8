package com.vidnyan.sketch.domain.memory;

import com.vidnyan.sketch.domain.model.BoardMemoryProfile;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Scalar type keywords counted by the RAM model and how wide each one is on a board.
 */
public enum ScalarType {
    INT("int", Width.INT),
    UNSIGNED_INT("unsigned int", Width.INT),
    INT8_T("int8_t", Width.ONE),
    UINT8_T("uint8_t", Width.ONE),
    INT16_T("int16_t", Width.TWO),
    UINT16_T("uint16_t", Width.TWO),
    INT32_T("int32_t", Width.FOUR),
    UINT32_T("uint32_t", Width.FOUR),
    LONG("long", Width.FOUR),
    UNSIGNED_LONG("unsigned long", Width.FOUR),
    LONG_LONG("long long", Width.EIGHT),
    UNSIGNED_LONG_LONG("unsigned long long", Width.EIGHT),
    FLOAT("float", Width.FOUR),
    DOUBLE("double", Width.DOUBLE),
    CHAR("char", Width.ONE),
    UNSIGNED_CHAR("unsigned char", Width.ONE),
    BYTE("byte", Width.ONE),
    BOOL("bool", Width.ONE),
    WORD("word", Width.INT),
    SIZE_T("size_t", Width.POINTER);

    private enum Width {
        ONE, TWO, FOUR, EIGHT, INT, POINTER, DOUBLE
    }

    private static final Map<String, ScalarType> BY_KEYWORD = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(ScalarType::keyword, Function.identity()));

    private final String keyword;
    private final Width width;

    ScalarType(String keyword, Width width) {
        this.keyword = keyword;
        this.width = width;
    }

    public String keyword() {
        return keyword;
    }

    public int widthOn(BoardMemoryProfile profile) {
        return switch (width) {
            case ONE -> 1;
            case TWO -> 2;
            case FOUR -> 4;
            case EIGHT -> 8;
            case INT -> profile.intWidthBytes();
            case POINTER -> profile.pointerWidthBytes();
            case DOUBLE -> profile.doubleWidthBytes();
        };
    }

    /**
     * Longest keyword first, so "unsigned long long" is tried before "long".
     */
    public static List<ScalarType> mostSpecificFirst() {
        return Arrays.stream(values())
                .sorted(Comparator.comparingInt((ScalarType t) -> t.keyword.length()).reversed())
                .toList();
    }

    public static Optional<ScalarType> fromKeyword(String keyword) {
        return Optional.ofNullable(BY_KEYWORD.get(keyword));
    }

    public static boolean isKeyword(String token) {
        return BY_KEYWORD.containsKey(token);
    }
}
