package com.vidnyan.sketch.adapter.out.hint;

import java.util.regex.Pattern;

final class DetectorSupport {

    private static final Pattern CONSTANT_DEFINITION = Pattern.compile("\\bconst\\b|#\\s*define\\b");

    private DetectorSupport() {
    }

    /** Lines that already give a value a name. */
    static boolean isConstantDefinition(String line) {
        return CONSTANT_DEFINITION.matcher(line).find();
    }
}
