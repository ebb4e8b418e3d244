package com.example.resourceapi.resource.service;

import com.example.resourceapi.common.exception.NotFoundException;
import com.example.resourceapi.common.util.StringSanitizer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Lookup of the {@link ResourceService} serving each configured resource name.
 */
public class ResourceRegistry {

    private final Map<String, ResourceService> services;

    public ResourceRegistry(List<ResourceService> services) {
        Map<String, ResourceService> byName = new LinkedHashMap<>();
        for (ResourceService service : services) {
            String name = service.getDefinition().name();
            if (byName.putIfAbsent(name, service) != null) {
                throw new IllegalStateException("Duplicate resource name: " + name);
            }
        }
        this.services = Collections.unmodifiableMap(byName);
    }

    public Optional<ResourceService> find(String name) {
        return Optional.ofNullable(name == null ? null : services.get(name));
    }

    /**
     * @throws NotFoundException when no resource with that name is configured
     */
    public ResourceService require(String name) {
        return find(name).orElseThrow(() ->
                new NotFoundException("Unknown resource '" + StringSanitizer.forLog(name, 64) + "'"));
    }
}
