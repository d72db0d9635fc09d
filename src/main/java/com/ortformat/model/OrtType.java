package com.ortformat.model;

/**
 * The closed set of ORT value kinds.
 */
public enum OrtType {
    NULL,
    BOOL,
    NUMBER,
    STRING,
    ARRAY,
    OBJECT;

    public boolean isContainer() {
        return this == ARRAY || this == OBJECT;
    }
}
