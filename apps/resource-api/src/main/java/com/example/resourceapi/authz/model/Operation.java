package com.example.resourceapi.authz.model;

import java.util.Locale;

/**
 * Operations a caller can perform against a resource collection.
 */
public enum Operation {
    CREATE,
    READ,
    UPDATE;

    public static Operation fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Operation must not be null");
        }
        return Operation.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
