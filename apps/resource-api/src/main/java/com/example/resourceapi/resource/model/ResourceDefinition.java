package com.example.resourceapi.resource.model;

import com.example.resourceapi.config.AppProperties;

import java.util.List;
import java.util.Locale;

/**
 * A configured resource: its URL name, backing collection, sort allow-list and which write
 * operations it accepts.
 */
public record ResourceDefinition(
        String name,
        String collection,
        List<String> sortFields,
        boolean supportsCreate,
        boolean supportsUpdate
) {
    public ResourceDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Resource name is required");
        }
        if (sortFields == null || sortFields.isEmpty()) {
            throw new IllegalArgumentException("Resource '" + name + "' needs at least one sort field");
        }
        collection = collection == null || collection.isBlank() ? name : collection;
        sortFields = List.copyOf(sortFields);
    }

    public ResourceDefinition(String name, String collection, List<String> sortFields, boolean supportsUpdate) {
        this(name, collection, sortFields, true, supportsUpdate);
    }

    public static ResourceDefinition from(AppProperties.Resource resource) {
        return new ResourceDefinition(
                resource.getName(),
                resource.getCollection(),
                resource.getSortFields(),
                resource.isSupportsCreate(),
                resource.isSupportsUpdate());
    }

    /**
     * Capitalized name for messages, e.g. {@code Grade}.
     */
    public String displayName() {
        return name.substring(0, 1).toUpperCase(Locale.ROOT) + name.substring(1);
    }
}
