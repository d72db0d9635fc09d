package com.ortformat.parser;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import com.ortformat.model.Field;
import com.ortformat.model.OrtValue;
import com.ortformat.util.OrtEscapes;

/**
 * Turns an isolated value string into an {@link OrtValue}.
 *
 * <p>Rules, in priority order: empty is null, {@code []} and {@code ()} are the empty
 * array and object, {@code [...]} is an array, {@code (...)} is a positional tuple when a
 * nested field is in context and a {@code key:value} object otherwise. Anything else is
 * unescaped and read as a number, then {@code true}/{@code false}, then a string.
 */
public class ValueParser {

    private static final Pattern NUMBER_PATTERN = Pattern.compile(
            "[+-]?(?:\\d+(?:\\.\\d*)?|\\.\\d+)(?:[eE][+-]?\\d+)?|[+-]?Infinity");

    public OrtValue parseValue(String s, OrtLine line) {
        String trimmed = s.strip();

        if (trimmed.isEmpty()) {
            return OrtValue.ofNull();
        }
        if (trimmed.equals("[]")) {
            return OrtValue.emptyArray();
        }
        if (trimmed.equals("()")) {
            return OrtValue.emptyObject();
        }
        if (trimmed.startsWith("[") && trimmed.endsWith("]")) {
            return parseArray(inner(trimmed), line);
        }
        if (trimmed.startsWith("(") && trimmed.endsWith(")")) {
            return parseInlineObject(inner(trimmed), line);
        }
        return parseScalar(trimmed);
    }

    /**
     * Parses a column value. A nested field expects a parenthesized tuple of exactly its
     * arity; empty, {@code ()}, bracketed and unparenthesized text fall back to the
     * generic rules.
     */
    public OrtValue parseField(Field field, String s, OrtLine line) {
        if (!field.isNested()) {
            return parseValue(s, line);
        }

        String trimmed = s.strip();
        if (!trimmed.startsWith("(") || !trimmed.endsWith(")") || trimmed.equals("()")) {
            return parseValue(trimmed, line);
        }

        List<String> parts = ValueSplitter.split(inner(trimmed));
        if (parts.size() != field.arity()) {
            throw OrtParseException.arity(line, field.arity(), parts.size(), true);
        }
        return record(field.getChildren(), parts, line);
    }

    /**
     * Zips fields with already split parts into an object, in field order.
     */
    public OrtValue record(List<Field> fields, List<String> parts, OrtLine line) {
        Map<String, OrtValue> entries = new LinkedHashMap<>();
        for (int i = 0; i < fields.size(); i++) {
            Field field = fields.get(i);
            entries.put(field.getName(), parseField(field, parts.get(i), line));
        }
        return OrtValue.of(entries);
    }

    private OrtValue parseArray(String body, OrtLine line) {
        if (body.isBlank()) {
            return OrtValue.emptyArray();
        }
        List<OrtValue> items = new ArrayList<>();
        for (String part : ValueSplitter.split(body)) {
            items.add(parseValue(part, line));
        }
        return OrtValue.of(items);
    }

    private OrtValue parseInlineObject(String body, OrtLine line) {
        Map<String, OrtValue> entries = new LinkedHashMap<>();
        for (String pair : ValueSplitter.split(body)) {
            int colon = ValueSplitter.indexOfKeySeparator(pair);
            if (colon < 0) {
                // pairs without a key are not representable and are skipped
                continue;
            }
            String key = OrtEscapes.unescape(pair.substring(0, colon).strip());
            entries.put(key, parseValue(pair.substring(colon + 1), line));
        }
        return OrtValue.of(entries);
    }

    static OrtValue parseScalar(String text) {
        String unescaped = OrtEscapes.unescape(text);

        if (NUMBER_PATTERN.matcher(unescaped).matches()) {
            return OrtValue.of(Double.parseDouble(unescaped));
        }
        if (unescaped.equals("true")) {
            return OrtValue.of(true);
        }
        if (unescaped.equals("false")) {
            return OrtValue.of(false);
        }
        return OrtValue.of(unescaped);
    }

    private static String inner(String s) {
        return s.substring(1, s.length() - 1);
    }
}
