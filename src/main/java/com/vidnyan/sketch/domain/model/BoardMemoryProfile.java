package com.vidnyan.sketch.domain.model;

/**
 * Memory model parameters for one board, keyed by its display name.
 */
public record BoardMemoryProfile(
    String boardName,
    int baseOverheadBytes,
    int intWidthBytes,
    int pointerWidthBytes,
    boolean is32Bit
) {

    public static BoardMemoryProfile avr(String boardName, int baseOverheadBytes) {
        return new BoardMemoryProfile(boardName, baseOverheadBytes, 2, 2, false);
    }

    public static BoardMemoryProfile wide(String boardName, int baseOverheadBytes) {
        return new BoardMemoryProfile(boardName, baseOverheadBytes, 4, 4, true);
    }

    public int doubleWidthBytes() {
        return is32Bit ? 8 : 4;
    }
}
