package com.ortformat.parser;

import lombok.Getter;

/**
 * A fatal error in an ORT document. Parsing stops at the first one and no partial
 * result is produced.
 */
@Getter
public class OrtParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public enum Kind {
        /** A header line without any colon. */
        MALFORMED_HEADER,
        /** A row or nested tuple whose value count differs from its field count. */
        ARITY_MISMATCH,
        /** An unmatched parenthesis in a field list. */
        UNBALANCED_GROUPING
    }

    private final Kind kind;
    private final int lineNumber;
    private final String line;
    private final String reason;

    public OrtParseException(Kind kind, int lineNumber, String line, String reason) {
        super("Line " + lineNumber + ": " + reason + System.lineSeparator() + "  " + line);
        this.kind = kind;
        this.lineNumber = lineNumber;
        this.line = line;
        this.reason = reason;
    }

    public OrtParseException(Kind kind, OrtLine line, String reason) {
        this(kind, line.getNumber(), line.getRaw(), reason);
    }

    public static OrtParseException arity(OrtLine line, int expected, int actual, boolean nested) {
        return new OrtParseException(Kind.ARITY_MISMATCH, line,
                "Expected " + expected + (nested ? " nested" : "") + " values but got " + actual);
    }
}
