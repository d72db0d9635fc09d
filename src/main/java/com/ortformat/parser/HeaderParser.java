package com.ortformat.parser;

import java.util.ArrayList;
import java.util.List;

import com.ortformat.model.Field;
import com.ortformat.parser.OrtParseException.Kind;

/**
 * Parses the three header dialects: {@code :fields:}, {@code key:fields:} and {@code key:}.
 */
public class HeaderParser {

    public OrtHeader parse(OrtLine line) {
        String content = line.getContent();

        if (content.startsWith(":")) {
            String body = content.substring(1);
            if (body.endsWith(":")) {
                body = body.substring(0, body.length() - 1);
            } else if (body.strip().startsWith("[")) {
                return new OrtHeader(null, List.of(), body.strip(), line);
            }
            return new OrtHeader(null, parseFieldList(body, 1, line), null, line);
        }

        int colon = content.indexOf(':');
        if (colon < 0) {
            throw new OrtParseException(Kind.MALFORMED_HEADER, line,
                    "Invalid header format: expected 'key:', 'key:fields:' or ':fields:'");
        }

        String key = content.substring(0, colon).strip();
        String fields = content.substring(colon + 1);
        if (fields.endsWith(":")) {
            fields = fields.substring(0, fields.length() - 1);
        }
        return new OrtHeader(key, parseFieldList(fields, colon + 1, line), null, line);
    }

    private List<Field> parseFieldList(String fields, int offset, OrtLine line) {
        if (fields.isBlank()) {
            return List.of();
        }
        return parseFields(fields, line.getIndent() + offset, line);
    }

    /**
     * @param base offset of {@code s} within the raw line, for column numbers
     */
    private List<Field> parseFields(String s, int base, OrtLine line) {
        List<Field> result = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int i = 0;

        while (i < s.length()) {
            char c = s.charAt(i);

            if (c == '(') {
                String name = current.toString().strip();
                current.setLength(0);
                int open = i;
                int depth = 1;
                i++;
                int start = i;
                while (i < s.length() && depth > 0) {
                    char n = s.charAt(i);
                    if (n == '(') {
                        depth++;
                    } else if (n == ')') {
                        depth--;
                    }
                    i++;
                }
                if (depth > 0) {
                    throw new OrtParseException(Kind.UNBALANCED_GROUPING, line,
                            "Unclosed parenthesis at column " + (base + open + 1));
                }
                List<Field> nested = parseFields(s.substring(start, i - 1), base + start, line);
                result.add(Field.nested(name, nested));
                continue;
            }

            if (c == ')') {
                throw new OrtParseException(Kind.UNBALANCED_GROUPING, line,
                        "Unmatched closing parenthesis at column " + (base + i + 1));
            }

            if (c == ',') {
                addLeaf(result, current);
            } else {
                current.append(c);
            }
            i++;
        }

        addLeaf(result, current);
        return result;
    }

    private static void addLeaf(List<Field> result, StringBuilder current) {
        String name = current.toString().strip();
        if (!name.isEmpty()) {
            result.add(Field.leaf(name));
        }
        current.setLength(0);
    }
}
