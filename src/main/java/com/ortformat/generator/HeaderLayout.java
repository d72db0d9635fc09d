package com.ortformat.generator;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.StringJoiner;

import com.ortformat.model.Field;
import com.ortformat.model.OrtValue;

/**
 * The column layout of a tabular section.
 *
 * <p>Columns follow the first record's key order; a column whose values are all objects
 * with one key set becomes a nested group named by those keys, recursively. Rows are
 * then rendered by looking every column up by name, so the key order inside later
 * records does not matter.
 */
public final class HeaderLayout {

    private final List<Field> fields;

    private HeaderLayout(List<Field> fields) {
        this.fields = fields;
    }

    /**
     * True iff the array is non-empty and all elements are objects with the same key set.
     * Objects without keys have no columns to lay out and are left to the literal form.
     */
    public static boolean isUniformObjectArray(List<OrtValue> items) {
        if (items.isEmpty() || !items.get(0).isObject()) {
            return false;
        }
        Set<String> keys = items.get(0).asObject().orElseThrow().keySet();
        if (keys.isEmpty()) {
            return false;
        }
        for (OrtValue item : items) {
            if (!item.isObject() || !item.asObject().orElseThrow().keySet().equals(keys)) {
                return false;
            }
        }
        return true;
    }

    public static HeaderLayout fromRecords(List<OrtValue> records) {
        return new HeaderLayout(fieldsOf(records));
    }

    /**
     * Columns of a group of objects sharing the first object's key order. A column nests
     * only when every value in it is null, {@code ()} or a non-empty object with one common
     * key set; otherwise it stays a leaf and objects in it are written inline.
     */
    private static List<Field> fieldsOf(List<OrtValue> objects) {
        List<Field> result = new ArrayList<>();
        for (String key : objects.get(0).asObject().orElseThrow().keySet()) {
            List<OrtValue> nested = nestedValues(objects, key);
            if (nested.isEmpty()) {
                result.add(Field.leaf(key));
            } else {
                result.add(Field.nested(key, fieldsOf(nested)));
            }
        }
        return result;
    }

    /**
     * The non-empty objects found under {@code key}, or an empty list when the column
     * cannot be laid out as a group.
     */
    private static List<OrtValue> nestedValues(List<OrtValue> objects, String key) {
        OrtValue first = objects.get(0).getOrDefault(key, null);
        if (!first.isObject() || first.size() == 0) {
            return List.of();
        }
        Set<String> keys = first.asObject().orElseThrow().keySet();
        List<OrtValue> nested = new ArrayList<>(objects.size());
        for (OrtValue object : objects) {
            OrtValue value = object.getOrDefault(key, null);
            if (value.isNull() || (value.isObject() && value.size() == 0)) {
                continue;
            }
            if (!value.isObject() || !value.asObject().orElseThrow().keySet().equals(keys)) {
                return List.of();
            }
            nested.add(value);
        }
        return nested;
    }

    public List<Field> getFields() {
        return fields;
    }

    /**
     * The field list part of a header, e.g. {@code name,addr(street,city)}.
     */
    public String header() {
        return Field.toHeader(fields);
    }

    public String row(OrtValue record) {
        return row(fields, record);
    }

    private static String row(List<Field> columns, OrtValue record) {
        StringJoiner joiner = new StringJoiner(",");
        for (Field column : columns) {
            joiner.add(cell(column, record.getOrDefault(column.getName(), null)));
        }
        return joiner.toString();
    }

    private static String cell(Field column, OrtValue value) {
        if (value.isNull()) {
            return "";
        }
        if (column.isNested() && value.isObject() && value.size() > 0) {
            return "(" + row(column.getChildren(), value) + ")";
        }
        return LiteralWriter.write(value);
    }
}
