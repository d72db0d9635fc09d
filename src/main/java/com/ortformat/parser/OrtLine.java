package com.ortformat.parser;

import lombok.Value;

/**
 * A significant source line: neither blank nor a comment.
 */
@Value
public class OrtLine {
    /** 1-based. */
    int number;
    /** The line as written, without its terminator. */
    String raw;
    /** The line with surrounding whitespace removed. */
    String content;
    /** Offset of {@link #content} within {@link #raw}. */
    int indent;

    public boolean isHeader() {
        return isHeader(content);
    }

    /**
     * A line is a header iff it starts with a colon or its last colon-delimited segment
     * is empty, i.e. it ends with a colon.
     */
    public static boolean isHeader(String content) {
        return content.startsWith(":") || content.endsWith(":");
    }
}
