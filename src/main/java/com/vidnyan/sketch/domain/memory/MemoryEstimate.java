package com.vidnyan.sketch.domain.memory;

/**
 * RAM and flash estimates for one sketch on one board.
 */
public record MemoryEstimate(
    String boardName,
    String resolvedProfile,
    int ramBytes,
    int flashBytes
) {
}
