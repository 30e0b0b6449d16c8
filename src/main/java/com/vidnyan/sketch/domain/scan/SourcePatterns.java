package com.vidnyan.sketch.domain.scan;

import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regular expressions shared by the structural passes.
 * All patterns are applied to single lines.
 */
public final class SourcePatterns {

    private SourcePatterns() {
    }

    /** Function definition head with its opening brace on the same line. */
    public static final Pattern FUNCTION_HEAD_WITH_BRACE = Pattern.compile(
            "^\\s*(?:inline\\s+|static\\s+)?[a-zA-Z_][\\w\\s*&:<>,]*\\s+[a-zA-Z_]\\w*\\s*\\([^)]*\\)\\s*\\{");

    /** Function definition head whose opening brace is expected on a following line. */
    public static final Pattern FUNCTION_HEAD_OPEN = Pattern.compile(
            "^\\s*(?:inline\\s+|static\\s+)?[a-zA-Z_][\\w\\s*&:<>,]*\\s+[a-zA-Z_]\\w*\\s*\\([^)]*\\)\\s*$");

    /** Function definition captured as return type, name and raw parameter list. */
    public static final Pattern FUNCTION_DEFINITION = Pattern.compile(
            "^\\s*(?:inline\\s+|static\\s+)?([a-zA-Z_][\\w\\s*&:<>,]*?)\\s+([a-zA-Z_]\\w*)\\s*\\((.*?)\\)\\s*(?:\\{|$)");

    /** Hand-written prototype, i.e. a signature terminated by a semicolon. */
    public static final Pattern PROTOTYPE_DECLARATION = Pattern.compile(
            "^\\s*(?:inline\\s+|static\\s+|extern\\s+)?(?:const\\s+)?([a-zA-Z_][\\w\\s*&:<>,]*?)\\s+([a-zA-Z_]\\w*)\\s*\\((.*?)\\)\\s*;\\s*$");

    /** Head of a struct, class or enum; group 1 is the keyword, group 2 the name. */
    public static final Pattern TYPE_HEAD = Pattern.compile(
            "^\\s*(?:typedef\\s+)?(struct|class|enum)(?:\\s+(?:class|struct))?\\s+([a-zA-Z_]\\w*)");

    /** {@code typedef <anything> Alias;} on a single line. */
    public static final Pattern TYPEDEF_ALIAS = Pattern.compile(
            "^\\s*typedef\\s+.*?\\s+([a-zA-Z_]\\w*)\\s*;");

    /** Closing line of a typedef'd body, e.g. {@code } Point;}. */
    public static final Pattern TYPEDEF_CLOSING_ALIAS = Pattern.compile(
            "}\\s*([a-zA-Z_]\\w*)\\s*;");

    public static final Pattern LOOP_HEAD = Pattern.compile("void\\s+loop\\s*\\(");

    public static final Pattern IDENTIFIER = Pattern.compile("[a-zA-Z_]\\w*");

    /** Words that can never name a function or appear in a plain return type. */
    public static final Set<String> CONTROL_KEYWORDS = Set.of(
            "class", "struct", "enum", "typedef", "namespace",
            "if", "else", "while", "for", "switch", "do", "case",
            "return", "sizeof", "new", "delete", "goto");

    /**
     * True when any identifier token in {@code text} is a member of {@code names}.
     */
    public static boolean mentionsAny(String text, Set<String> names) {
        if (text == null || names.isEmpty()) {
            return false;
        }
        Matcher matcher = IDENTIFIER.matcher(text);
        while (matcher.find()) {
            if (names.contains(matcher.group())) {
                return true;
            }
        }
        return false;
    }

    public static int count(String line, char c) {
        int total = 0;
        for (int i = 0; i < line.length(); i++) {
            if (line.charAt(i) == c) {
                total++;
            }
        }
        return total;
    }

    /**
     * Parentheses in the line open and close the same number of times and never dip below zero.
     */
    public static boolean parensBalanced(String line) {
        int depth = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth < 0) {
                    return false;
                }
            }
        }
        return depth == 0;
    }
}
