package com.ortformat.generator;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.ortformat.model.OrtValue;
import com.ortformat.util.OrtEscapes;

/**
 * Renders values in literal form: bare scalars, {@code [a,b]} and {@code (k:v,...)}.
 */
public final class LiteralWriter {

    /** Integral values below this magnitude print without a fraction or exponent. */
    private static final double PLAIN_INTEGER_LIMIT = 1e15;

    private LiteralWriter() {
    }

    public static String write(OrtValue value) {
        return switch (value.getType()) {
            case NULL -> "";
            case BOOL -> value.asBool().orElseThrow() ? "true" : "false";
            case NUMBER -> formatNumber(value.asNumber().orElseThrow());
            case STRING -> OrtEscapes.escape(value.asString().orElseThrow());
            case ARRAY -> writeArray(value.asArray().orElseThrow());
            case OBJECT -> writeObject(value.asObject().orElseThrow());
        };
    }

    public static String formatNumber(double d) {
        if (Double.isNaN(d)) {
            return "NaN";
        }
        if (Double.isInfinite(d)) {
            return d > 0 ? "Infinity" : "-Infinity";
        }
        if (d == 0.0 && Double.doubleToRawLongBits(d) != 0L) {
            return "-0";
        }
        if (d == Math.rint(d) && Math.abs(d) < PLAIN_INTEGER_LIMIT) {
            return Long.toString((long) d);
        }
        return Double.toString(d);
    }

    private static String writeArray(List<OrtValue> items) {
        if (items.isEmpty()) {
            return "[]";
        }
        return items.stream()
                .map(LiteralWriter::write)
                .collect(Collectors.joining(",", "[", "]"));
    }

    private static String writeObject(Map<String, OrtValue> entries) {
        if (entries.isEmpty()) {
            return "()";
        }
        return entries.entrySet().stream()
                .map(e -> OrtEscapes.escapeKey(e.getKey()) + ":" + write(e.getValue()))
                .collect(Collectors.joining(",", "(", ")"));
    }
}
