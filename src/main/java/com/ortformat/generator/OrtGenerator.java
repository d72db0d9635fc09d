package com.ortformat.generator;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ortformat.model.OrtValue;

/**
 * Generates canonical ORT text.
 *
 * <p>An object with exactly one key becomes a single named section; any other object
 * becomes one section per key, separated by blank lines. A bare array uses the anonymous
 * {@code :} header and a bare scalar is written as its literal. Arrays of objects sharing
 * one key set are written as tables, every other array as a bracket literal.
 *
 * <p>Stateless and safe to share between threads.
 */
public class OrtGenerator {
    private static final Logger log = LoggerFactory.getLogger(OrtGenerator.class);

    public String generate(OrtValue value) {
        if (value.isObject()) {
            Map<String, OrtValue> entries = value.asObject().orElseThrow();
            if (entries.size() == 1) {
                Map.Entry<String, OrtValue> only = entries.entrySet().iterator().next();
                return section(only.getKey(), only.getValue());
            }
            return document(entries);
        }
        if (value.isArray()) {
            List<OrtValue> items = value.asArray().orElseThrow();
            if (HeaderLayout.isUniformObjectArray(items)) {
                log.debug("Writing top-level array of {} records as a table", items.size());
                return table("", items);
            }
            return ":" + LiteralWriter.write(value);
        }
        return LiteralWriter.write(value);
    }

    private String document(Map<String, OrtValue> entries) {
        if (entries.isEmpty()) {
            return "";
        }
        List<String> sections = new ArrayList<>(entries.size());
        entries.forEach((key, value) -> sections.add(section(key, value)));
        return String.join("\n\n", sections) + "\n";
    }

    private String section(String key, OrtValue value) {
        if (value.isArray()) {
            List<OrtValue> items = value.asArray().orElseThrow();
            if (HeaderLayout.isUniformObjectArray(items)) {
                log.debug("Writing '{}' as a table of {} records", key, items.size());
                return table(key, items);
            }
        }
        return key + ":\n" + LiteralWriter.write(value);
    }

    private String table(String key, List<OrtValue> records) {
        HeaderLayout layout = HeaderLayout.fromRecords(records);
        StringBuilder sb = new StringBuilder();
        sb.append(key).append(':').append(layout.header()).append(':');
        for (OrtValue record : records) {
            sb.append('\n').append(layout.row(record));
        }
        return sb.toString();
    }
}
