package com.vidnyan.sketch.domain.model;

/**
 * Function signature recovered by pattern match from a definition head.
 */
public record FunctionSignature(
    String returnType,
    String name,
    String parameters
) {

    /**
     * Render as a forward declaration, e.g. {@code int readSensor(int pin);}.
     */
    public String toPrototype() {
        return returnType + " " + name + "(" + parameters + ");";
    }
}
