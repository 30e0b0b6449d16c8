package com.vidnyan.sketch.domain.synthesis;

import com.vidnyan.sketch.domain.model.TypeDefinition;
import com.vidnyan.sketch.domain.scan.SourcePatterns;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;

/**
 * Derives the set of user-defined type names for one synthesis pass.
 */
public final class CustomTypeNames {

    private CustomTypeNames() {
    }

    /**
     * Names of the extracted definitions plus every {@code typedef} alias, both the
     * one-line form and the {@code typedef struct { ... } Alias;} form.
     */
    public static Set<String> derive(Collection<TypeDefinition> definitions, String scrubbedSource) {
        Set<String> names = new LinkedHashSet<>();

        for (TypeDefinition definition : definitions) {
            names.add(definition.name());
            collectTypedefAliases(definition.rawLines(), names);
        }
        if (scrubbedSource != null) {
            collectTypedefAliases(List.of(scrubbedSource.split("\n", -1)), names);
        }

        return names;
    }

    private static void collectTypedefAliases(List<String> lines, Set<String> names) {
        int i = 0;
        while (i < lines.size()) {
            String line = lines.get(i);
            if (!line.strip().startsWith("typedef")) {
                i++;
                continue;
            }
            if (!line.contains("{")) {
                Matcher alias = SourcePatterns.TYPEDEF_ALIAS.matcher(line);
                if (alias.find()) {
                    names.add(alias.group(1));
                }
                i++;
                continue;
            }

            int balance = 0;
            while (i < lines.size()) {
                String body = lines.get(i);
                balance += SourcePatterns.count(body, '{') - SourcePatterns.count(body, '}');
                i++;
                if (balance <= 0) {
                    Matcher closing = SourcePatterns.TYPEDEF_CLOSING_ALIAS.matcher(body);
                    if (closing.find()) {
                        names.add(closing.group(1));
                    }
                    break;
                }
            }
        }
    }
}
