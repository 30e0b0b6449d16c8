package com.vidnyan.sketch.domain.scan;

/**
 * Per-line brace depth and function membership computed by {@link BraceScanner}.
 * Indexes are 0-based line indexes.
 */
public final class ScopeMap {

    private final int[] depthBefore;
    private final int[] depthAfter;
    private final boolean[] inFunction;
    private final boolean[] inLoop;

    ScopeMap(int[] depthBefore, int[] depthAfter, boolean[] inFunction, boolean[] inLoop) {
        this.depthBefore = depthBefore;
        this.depthAfter = depthAfter;
        this.inFunction = inFunction;
        this.inLoop = inLoop;
    }

    public int lineCount() {
        return depthBefore.length;
    }

    public int depthBefore(int index) {
        return depthBefore[index];
    }

    public int depthAfter(int index) {
        return depthAfter[index];
    }

    /**
     * Line is a function head or lies inside a function body.
     */
    public boolean inFunction(int index) {
        return inFunction[index];
    }

    /**
     * Line is the {@code loop()} head or lies inside its body.
     */
    public boolean inLoop(int index) {
        return inLoop[index];
    }

    /**
     * Line starts at file scope and is not part of any function.
     */
    public boolean isGlobal(int index) {
        return depthBefore[index] == 0 && !inFunction[index];
    }
}
