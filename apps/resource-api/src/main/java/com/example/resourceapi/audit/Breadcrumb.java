package com.example.resourceapi.audit;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable per-request audit record, stored verbatim as the {@code created} field of new documents.
 */
public record Breadcrumb(
        Instant atTime,
        String byUser,
        String fromIp,
        String correlationId
) {
    public static final String AT_TIME = "at_time";
    public static final String BY_USER = "by_user";
    public static final String FROM_IP = "from_ip";
    public static final String CORRELATION_ID = "correlation_id";

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(AT_TIME, atTime);
        map.put(BY_USER, byUser);
        map.put(FROM_IP, fromIp);
        map.put(CORRELATION_ID, correlationId);
        return map;
    }
}
