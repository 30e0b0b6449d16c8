package com.vidnyan.sketch.domain.scan;

/**
 * Removes comments from sketch text while keeping every newline in place,
 * so line numbers computed on the scrubbed text match the original.
 * <p>
 * String and character literals are copied verbatim (escapes included) so that
 * comment markers inside them are not mistaken for comments. {@link #mask(String)}
 * additionally blanks literal contents for structural scans that count braces,
 * parentheses and semicolons.
 * </p>
 * Never throws; an unterminated block comment swallows the rest of the input
 * except for its newlines.
 */
public class LexicalScrubber {

    private enum State {
        NORMAL,
        IN_BLOCK_COMMENT,
        IN_LINE_COMMENT,
        IN_STRING,
        IN_CHAR_LITERAL
    }

    public String scrub(String source) {
        if (source == null || source.isEmpty()) {
            return "";
        }
        StringBuilder out = new StringBuilder(source.length());
        walk(source, out, null);
        return out.toString();
    }

    /**
     * Text of all comments in the source, without their delimiters, one comment per line.
     */
    public String comments(String source) {
        if (source == null || source.isEmpty()) {
            return "";
        }
        StringBuilder comments = new StringBuilder();
        walk(source, new StringBuilder(source.length()), comments);
        return comments.toString();
    }

    private void walk(String source, StringBuilder out, StringBuilder comments) {
        State state = State.NORMAL;
        int length = source.length();
        int i = 0;

        while (i < length) {
            char c = source.charAt(i);
            char next = i + 1 < length ? source.charAt(i + 1) : '\0';

            switch (state) {
                case NORMAL -> {
                    if (c == '/' && (next == '*' || next == '/')) {
                        state = next == '*' ? State.IN_BLOCK_COMMENT : State.IN_LINE_COMMENT;
                        if (comments != null && comments.length() > 0) {
                            comments.append('\n');
                        }
                        i += 2;
                    } else {
                        if (c == '"') {
                            state = State.IN_STRING;
                        } else if (c == '\'') {
                            state = State.IN_CHAR_LITERAL;
                        }
                        out.append(c);
                        i++;
                    }
                }
                case IN_BLOCK_COMMENT -> {
                    if (c == '*' && next == '/') {
                        state = State.NORMAL;
                        i += 2;
                    } else {
                        if (c == '\n') {
                            out.append('\n');
                        }
                        if (comments != null) {
                            comments.append(c);
                        }
                        i++;
                    }
                }
                case IN_LINE_COMMENT -> {
                    if (c == '\n') {
                        out.append('\n');
                        state = State.NORMAL;
                    } else if (comments != null) {
                        comments.append(c);
                    }
                    i++;
                }
                case IN_STRING, IN_CHAR_LITERAL -> {
                    char quote = state == State.IN_STRING ? '"' : '\'';
                    if (c == '\\' && i + 1 < length && next != '\n') {
                        out.append(c).append(next);
                        i += 2;
                        continue;
                    }
                    out.append(c);
                    // literals never span lines; a stray quote ends at the newline
                    if (c == quote || c == '\n') {
                        state = State.NORMAL;
                    }
                    i++;
                }
            }
        }
    }

    /**
     * Replace the contents of string and character literals with spaces, keeping
     * the quotes and the text length. Expects comment-free input.
     */
    public String mask(String scrubbed) {
        if (scrubbed == null || scrubbed.isEmpty()) {
            return "";
        }

        StringBuilder out = new StringBuilder(scrubbed.length());
        char quote = 0;
        int length = scrubbed.length();

        for (int i = 0; i < length; i++) {
            char c = scrubbed.charAt(i);
            if (quote == 0) {
                if (c == '"' || c == '\'') {
                    quote = c;
                }
                out.append(c);
            } else if (c == '\n') {
                quote = 0;
                out.append(c);
            } else if (c == '\\' && i + 1 < length && scrubbed.charAt(i + 1) != '\n') {
                out.append("  ");
                i++;
            } else if (c == quote) {
                quote = 0;
                out.append(c);
            } else {
                out.append(' ');
            }
        }

        return out.toString();
    }

    /**
     * Comment-free text with literal contents blanked, ready for brace counting.
     */
    public String structural(String source) {
        return mask(scrub(source));
    }
}
