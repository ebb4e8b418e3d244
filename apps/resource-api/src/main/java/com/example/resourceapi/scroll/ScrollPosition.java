package com.example.resourceapi.scroll;

/**
 * The {@code (sort value, id)} pair a continuation page starts strictly after.
 * {@code sortValue} is null when the cursor document has no value for the sort field.
 */
public record ScrollPosition(Object sortValue, String id) {
}
