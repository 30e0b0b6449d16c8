package com.vidnyan.sketch.domain.hint;

import java.util.Locale;

/**
 * Hint severity levels, most urgent first.
 */
public enum HintSeverity {
    WARNING,  // Likely a mistake
    INFO,     // Worth knowing
    TIP;      // Style or robustness suggestion

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
