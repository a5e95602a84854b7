package io.procmon.utils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Splitting console input into tokens and joining tokens back into a monitor name.
 */
public final class CommandLines {
    private CommandLines() {
    }

    /**
     * Whitespace separated tokens; runs of whitespace never produce empty tokens.
     */
    public static List<String> tokenize(String line) {
        if (line == null || line.isBlank()) {
            return Collections.emptyList();
        }
        List<String> tokens = new ArrayList<>();
        for (String t : line.trim().split("\\s+")) {
            tokens.add(t);
        }
        return Collections.unmodifiableList(tokens);
    }

    public static String join(List<String> tokens) {
        return String.join(" ", tokens);
    }
}
