package com.vidnyan.sketch.domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SourceTextTest {

    @Test
    void of_ShouldKeepTrailingEmptyLineAndStripCarriageReturns() {
        SourceText text = SourceText.of("a\r\nb\n");

        assertEquals(3, text.lineCount());
        assertEquals("a", text.line(1));
        assertEquals("", text.line(3));
        assertEquals("a\nb\n", text.text());
    }

    @Test
    void of_ShouldTreatNullAsSingleEmptyLine() {
        assertEquals(1, SourceText.of(null).lineCount());
    }
}
