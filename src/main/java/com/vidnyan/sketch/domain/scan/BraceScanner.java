package com.vidnyan.sketch.domain.scan;

import java.util.List;

/**
 * Single-pass, line-granular scope tracker.
 * <p>
 * A function starts on a line that matches a definition head at file scope, either with
 * its opening brace on the same line or on the next non-blank line. Depth then follows the
 * {@code {}} counts of each line; the function ends when depth returns to zero. Signatures
 * split over several lines are not recognised.
 * </p>
 * Input lines must already be comment-free with literal contents masked.
 */
public class BraceScanner {

    public ScopeMap scan(List<String> lines) {
        int size = lines.size();
        int[] depthBefore = new int[size];
        int[] depthAfter = new int[size];
        boolean[] inFunction = new boolean[size];
        boolean[] inLoop = new boolean[size];

        int depth = 0;
        boolean function = false;
        boolean loop = false;
        boolean pendingHead = false;
        boolean pendingLoop = false;

        for (int i = 0; i < size; i++) {
            String line = lines.get(i);
            int delta = SourcePatterns.count(line, '{') - SourcePatterns.count(line, '}');
            depthBefore[i] = depth;

            if (depth == 0 && SourcePatterns.FUNCTION_HEAD_WITH_BRACE.matcher(line).find()) {
                function = true;
                loop = SourcePatterns.LOOP_HEAD.matcher(line).find();
            } else if (depth == 0 && pendingHead && line.strip().startsWith("{")) {
                function = true;
                loop = pendingLoop;
            }
            depth = Math.max(0, depth + delta);

            inFunction[i] = function;
            inLoop[i] = loop;
            depthAfter[i] = depth;

            if (depth == 0 && !function && SourcePatterns.FUNCTION_HEAD_OPEN.matcher(line).find()) {
                pendingHead = true;
                pendingLoop = SourcePatterns.LOOP_HEAD.matcher(line).find();
            } else if (!line.isBlank()) {
                pendingHead = false;
                pendingLoop = false;
            }

            if (depth == 0) {
                function = false;
                loop = false;
            }
        }

        return new ScopeMap(depthBefore, depthAfter, inFunction, inLoop);
    }
}
