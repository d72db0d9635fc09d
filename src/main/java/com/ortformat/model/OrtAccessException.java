package com.ortformat.model;

import lombok.Getter;

/**
 * Raised by indexed access on an {@link OrtValue} whose type or bounds do not allow it.
 * Recoverable: nothing else in the value tree is affected.
 */
@Getter
public class OrtAccessException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public enum Kind {
        NOT_AN_OBJECT,
        NOT_AN_ARRAY,
        KEY_NOT_FOUND,
        INDEX_OUT_OF_BOUNDS,
        NOT_A_CONTAINER
    }

    private final Kind kind;

    public OrtAccessException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    static OrtAccessException notAnObject(OrtType actual, String key) {
        return new OrtAccessException(Kind.NOT_AN_OBJECT,
                "Cannot use key '" + key + "' on " + actual + ": not an object");
    }

    static OrtAccessException notAnArray(OrtType actual, int index) {
        return new OrtAccessException(Kind.NOT_AN_ARRAY,
                "Cannot use index " + index + " on " + actual + ": not an array");
    }

    static OrtAccessException keyNotFound(String key) {
        return new OrtAccessException(Kind.KEY_NOT_FOUND, "Key not found: " + key);
    }

    static OrtAccessException indexOutOfBounds(int index, int size) {
        return new OrtAccessException(Kind.INDEX_OUT_OF_BOUNDS,
                "Index out of bounds: " + index + " (size " + size + ")");
    }

    static OrtAccessException notAContainer(OrtType actual) {
        return new OrtAccessException(Kind.NOT_A_CONTAINER, actual + " has no length");
    }
}
