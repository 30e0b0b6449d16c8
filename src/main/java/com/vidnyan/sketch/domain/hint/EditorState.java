package com.vidnyan.sketch.domain.hint;

import java.util.Map;

/**
 * Editor facts the detectors may take into account.
 */
public record EditorState(boolean serialMonitorOpen) {

    public static final String SERIAL_MONITOR_OPEN = "serial_monitor_open";

    public static EditorState defaults() {
        return new EditorState(true);
    }

    /**
     * Read the loosely typed state map sent by the editor; missing keys keep their defaults.
     */
    public static EditorState fromMap(Map<String, ?> state) {
        if (state == null || !state.containsKey(SERIAL_MONITOR_OPEN)) {
            return defaults();
        }
        Object open = state.get(SERIAL_MONITOR_OPEN);
        if (open instanceof Boolean flag) {
            return new EditorState(flag);
        }
        return new EditorState(!"false".equalsIgnoreCase(String.valueOf(open)));
    }
}
