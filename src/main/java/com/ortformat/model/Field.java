package com.ortformat.model;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import lombok.Value;

/**
 * A column of a section header. A field without children holds a plain value; a field
 * with children holds a fixed-arity tuple whose positions are named by the children,
 * e.g. {@code addr(street,city)}.
 */
@Value
public class Field {
    String name;
    List<Field> children;

    public Field(String name, List<Field> children) {
        this.name = Objects.requireNonNull(name, "name");
        this.children = List.copyOf(children);
    }

    public static Field leaf(String name) {
        return new Field(name, List.of());
    }

    public static Field nested(String name, List<Field> children) {
        return new Field(name, children);
    }

    public boolean isNested() {
        return !children.isEmpty();
    }

    public int arity() {
        return children.size();
    }

    /**
     * Renders this field the way it appears in a header line.
     */
    public String toHeader() {
        if (!isNested()) {
            return name;
        }
        return name + "(" + toHeader(children) + ")";
    }

    public static String toHeader(List<Field> fields) {
        return fields.stream().map(Field::toHeader).collect(Collectors.joining(","));
    }
}
