package com.ortformat.util;

import lombok.experimental.UtilityClass;

/**
 * Backslash escape alphabet shared by the parser and the generator.
 *
 * <p>The generator prefixes the structural characters {@code ( ) [ ] ,} and the
 * backslash itself, and writes newline, tab and carriage return as {@code \n},
 * {@code \t} and {@code \r}. The parser maps those three letters back to their
 * control characters and takes any other escaped character literally.
 */
@UtilityClass
public class OrtEscapes {

    public static final char ESCAPE = '\\';

    public static String escape(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 8);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '(', ')', '[', ']', ',', '\\' -> sb.append(ESCAPE).append(c);
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                case '\r' -> sb.append("\\r");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * Escapes an inline object key; on top of {@link #escape}, the key separator {@code :}
     * is escaped too.
     */
    public static String escapeKey(String key) {
        String escaped = escape(key);
        if (escaped.indexOf(':') < 0) {
            return escaped;
        }
        return escaped.replace(":", "\\:");
    }

    public static String unescape(String s) {
        if (s.indexOf(ESCAPE) < 0) {
            return s;
        }
        StringBuilder sb = new StringBuilder(s.length());
        boolean escaped = false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (escaped) {
                switch (c) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case 'r' -> sb.append('\r');
                    default -> sb.append(c);
                }
                escaped = false;
            } else if (c == ESCAPE) {
                escaped = true;
            } else {
                sb.append(c);
            }
        }
        // a dangling backslash has nothing to escape and is dropped
        return sb.toString();
    }
}
