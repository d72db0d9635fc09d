package com.ortformat.parser;

import java.util.List;

import com.ortformat.model.Field;

import lombok.Value;

/**
 * A parsed header line.
 */
@Value
public class OrtHeader {
    /** Section key, or {@code null} for the anonymous {@code :fields:} form. */
    String key;
    List<Field> fields;
    /** Body of a {@code :[...]} header, which carries its value inline; otherwise {@code null}. */
    String literal;
    OrtLine line;

    public boolean isAnonymous() {
        return key == null;
    }

    public boolean hasFields() {
        return !fields.isEmpty();
    }

    public boolean hasLiteral() {
        return literal != null;
    }
}
