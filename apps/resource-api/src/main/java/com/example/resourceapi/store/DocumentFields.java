package com.example.resourceapi.store;

import java.util.Map;

/**
 * Reserved field names and dotted-path access for schemaless documents.
 */
public final class DocumentFields {

    public static final String ID = "_id";
    public static final String CREATED = "created";
    public static final String NAME = "name";

    private DocumentFields() {}

    /**
     * Resolves a dotted path such as {@code created.at_time}. Returns null when any segment is
     * missing or not a nested document.
     */
    public static Object resolve(Map<String, Object> document, String path) {
        Object current = document;
        for (String segment : path.split("\\.")) {
            if (!(current instanceof Map<?, ?> map)) {
                return null;
            }
            current = map.get(segment);
        }
        return current;
    }

    /**
     * True for {@code _id}, {@code created} and any dotted path into them. These fields are owned by
     * the service and are never written from client input.
     */
    public static boolean isReserved(String path) {
        return isSameOrNested(path, ID) || isSameOrNested(path, CREATED);
    }

    private static boolean isSameOrNested(String path, String field) {
        return path.equals(field) || path.startsWith(field + ".");
    }

    public static String idOf(Map<String, Object> document) {
        Object id = document.get(ID);
        return id == null ? null : id.toString();
    }
}
