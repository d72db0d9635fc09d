package com.ortformat.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits rows and collection bodies on top-level commas.
 *
 * <p>Parentheses and square brackets are counted independently; a comma splits only
 * when both counts are zero. A backslash escapes exactly the next character, which then
 * never affects depth or splitting. Escapes are kept in the parts for the value parser
 * to resolve.
 */
public final class ValueSplitter {

    private ValueSplitter() {
    }

    /**
     * Returns every part, including empty ones; a body with {@code n} top-level commas
     * always yields {@code n + 1} parts.
     */
    public static List<String> split(String body) {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean escaped = false;
        int parenDepth = 0;
        int bracketDepth = 0;

        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);

            if (escaped) {
                current.append(c);
                escaped = false;
                continue;
            }

            switch (c) {
                case '\\' -> {
                    escaped = true;
                    current.append(c);
                }
                case '(' -> {
                    parenDepth++;
                    current.append(c);
                }
                case ')' -> {
                    parenDepth--;
                    current.append(c);
                }
                case '[' -> {
                    bracketDepth++;
                    current.append(c);
                }
                case ']' -> {
                    bracketDepth--;
                    current.append(c);
                }
                case ',' -> {
                    if (parenDepth == 0 && bracketDepth == 0) {
                        parts.add(current.toString());
                        current.setLength(0);
                    } else {
                        current.append(c);
                    }
                }
                default -> current.append(c);
            }
        }

        parts.add(current.toString());
        return parts;
    }

    /**
     * Index of the first colon outside any escape, or -1.
     */
    public static int indexOfKeySeparator(String pair) {
        boolean escaped = false;
        for (int i = 0; i < pair.length(); i++) {
            char c = pair.charAt(i);
            if (escaped) {
                escaped = false;
            } else if (c == '\\') {
                escaped = true;
            } else if (c == ':') {
                return i;
            }
        }
        return -1;
    }
}
