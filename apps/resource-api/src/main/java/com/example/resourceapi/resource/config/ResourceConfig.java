package com.example.resourceapi.resource.config;

import com.example.resourceapi.authz.policy.PermissionPolicy;
import com.example.resourceapi.config.AppProperties;
import com.example.resourceapi.resource.model.ResourceDefinition;
import com.example.resourceapi.resource.service.ResourceRegistry;
import com.example.resourceapi.resource.service.ResourceService;
import com.example.resourceapi.scroll.InfiniteScrollQuery;
import com.example.resourceapi.scroll.ScrollQueryBuilder;
import com.example.resourceapi.store.DocumentStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Builds one {@link ResourceService} per entry of {@code app.resources}.
 */
@Slf4j
@Configuration
public class ResourceConfig {

    @Bean
    public ResourceRegistry resourceRegistry(
            AppProperties properties,
            DocumentStore store,
            PermissionPolicy permissionPolicy,
            ScrollQueryBuilder queryBuilder,
            InfiniteScrollQuery scrollQuery) {

        List<ResourceService> services = properties.getResources().stream()
                .map(ResourceDefinition::from)
                .map(definition -> new ResourceService(
                        definition, store, permissionPolicy, queryBuilder, scrollQuery))
                .toList();

        services.forEach(service -> log.info("Registered resource {}: collection={}, sortFields={}, update={}",
                service.getDefinition().name(),
                service.getDefinition().collection(),
                service.getDefinition().sortFields(),
                service.getDefinition().supportsUpdate()));

        return new ResourceRegistry(services);
    }
}
