package com.example.resourceapi.store.mongo;

import org.bson.Document;
import org.bson.types.ObjectId;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts between BSON documents and the plain maps the rest of the service works with.
 * Outbound, {@link ObjectId} becomes its hex string and {@link Date} becomes {@link Instant};
 * inbound, {@link Instant} is stored as a BSON date.
 */
final class DocumentMapper {

    private DocumentMapper() {}

    static Map<String, Object> fromBson(Map<String, Object> bson) {
        Map<String, Object> result = new LinkedHashMap<>();
        bson.forEach((key, value) -> result.put(key, fromBsonValue(value)));
        return result;
    }

    static Document toBson(Map<String, Object> map) {
        Document document = new Document();
        map.forEach((key, value) -> document.put(key, toBsonValue(value)));
        return document;
    }

    @SuppressWarnings("unchecked")
    static Object toBsonValue(Object value) {
        if (value instanceof Instant instant) {
            return Date.from(instant);
        }
        if (value instanceof Map<?, ?> map) {
            return toBson((Map<String, Object>) map);
        }
        if (value instanceof List<?> list) {
            List<Object> converted = new ArrayList<>(list.size());
            list.forEach(item -> converted.add(toBsonValue(item)));
            return converted;
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    private static Object fromBsonValue(Object value) {
        if (value instanceof ObjectId objectId) {
            return objectId.toHexString();
        }
        if (value instanceof Date date) {
            return date.toInstant();
        }
        if (value instanceof Map<?, ?> map) {
            return fromBson((Map<String, Object>) map);
        }
        if (value instanceof List<?> list) {
            List<Object> converted = new ArrayList<>(list.size());
            list.forEach(item -> converted.add(fromBsonValue(item)));
            return converted;
        }
        return value;
    }
}
