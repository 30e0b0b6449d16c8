package com.vidnyan.sketch.domain.hint;

import java.util.List;

/**
 * Interface for hint detectors.
 * Each detector looks for one pattern and reports zero or more hints; detectors do not
 * see each other's output.
 */
public interface HintDetector {

    /**
     * Scan the sketch; never returns null.
     */
    List<Hint> detect(HintContext context);

    /**
     * Get the detector name for logging.
     */
    default String getName() {
        return getClass().getSimpleName();
    }
}
