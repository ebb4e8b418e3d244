package com.example.resourceapi.scroll;

/**
 * Validated list parameters. {@code cursorId} is the decoded {@code after_id}, or null for the first page.
 */
public record ScrollParameters(
        String name,
        String cursorId,
        int limit,
        String sortField,
        SortOrder order
) {
}
