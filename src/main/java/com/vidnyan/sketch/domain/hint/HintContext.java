package com.vidnyan.sketch.domain.hint;

import com.vidnyan.sketch.domain.model.SourceText;
import com.vidnyan.sketch.domain.scan.BraceScanner;
import com.vidnyan.sketch.domain.scan.LexicalScrubber;
import com.vidnyan.sketch.domain.scan.ScopeMap;

/**
 * Context provided to hint detectors.
 * <p>
 * {@code clean} is the sketch without comments; {@code structural} additionally has
 * string and character literal contents blanked, so a pattern inside
 * {@code Serial.println("...")} is not mistaken for code. All three texts share line
 * numbers and column offsets.
 * </p>
 */
public record HintContext(
    SourceText source,
    SourceText clean,
    SourceText structural,
    ScopeMap scope,
    EditorState editorState
) {

    /**
     * Create context.
     */
    public static HintContext of(String code, EditorState editorState) {
        LexicalScrubber scrubber = new LexicalScrubber();
        String scrubbed = scrubber.scrub(code);
        SourceText structural = SourceText.of(scrubber.mask(scrubbed));
        return new HintContext(
                SourceText.of(code),
                SourceText.of(scrubbed),
                structural,
                new BraceScanner().scan(structural.lines()),
                editorState == null ? EditorState.defaults() : editorState);
    }

    public String rawText() {
        return source.text();
    }

    public String structuralText() {
        return structural.text();
    }
}
