package com.example.resourceapi.scroll;

import com.example.resourceapi.common.exception.ValidationException;
import com.example.resourceapi.common.util.StringSanitizer;

import java.util.Locale;

public enum SortOrder {
    ASC,
    DESC;

    /**
     * Parses {@code asc} / {@code desc} case-insensitively.
     *
     * @throws ValidationException for anything else
     */
    public static SortOrder parse(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "asc" -> ASC;
            case "desc" -> DESC;
            default -> throw new ValidationException(
                    "Invalid order '" + StringSanitizer.forLog(value) + "'. Must be 'asc' or 'desc'");
        };
    }
}
