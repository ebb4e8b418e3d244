package com.example.resourceapi.resource.controller;

import com.example.resourceapi.audit.Breadcrumb;
import com.example.resourceapi.audit.BreadcrumbFactory;
import com.example.resourceapi.resource.service.ResourceRegistry;
import com.example.resourceapi.resource.service.ResourceService;
import com.example.resourceapi.scroll.ScrollPage;
import com.example.resourceapi.security.annotation.ResolvedToken;
import com.example.resourceapi.security.context.Token;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * REST surface shared by every configured resource.
 */
@Slf4j
@RestController
@RequestMapping("/api/{resource}")
@RequiredArgsConstructor
public class ResourceController {

    private final ResourceRegistry registry;
    private final BreadcrumbFactory breadcrumbFactory;

    /**
     * Create a document and return it as stored. Resources configured with {@code supports-create: false}
     * answer 405.
     */
    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<Map<String, Object>> create(
            @PathVariable String resource,
            @RequestBody(required = false) Map<String, Object> body,
            @ResolvedToken Token token,
            ServerWebExchange exchange) {
        return Mono.defer(() -> {
            ResourceService service = registry.require(resource);
            if (!service.getDefinition().supportsCreate()) {
                log.debug("Rejected create on read-only resource {}", resource);
                return Mono.error(new ResponseStatusException(HttpStatus.METHOD_NOT_ALLOWED,
                        "Creation is not supported for " + resource));
            }
            Breadcrumb breadcrumb = breadcrumbFactory.create(token, exchange);
            return service.create(body, token, breadcrumb)
                    .flatMap(id -> service.get(id, token, breadcrumb));
        });
    }

    /**
     * One page of the infinite scroll listing.
     */
    @GetMapping
    public Mono<ScrollPage> list(
            @PathVariable String resource,
            @RequestParam(required = false) String name,
            @RequestParam(name = "after_id", required = false) String afterId,
            @RequestParam(defaultValue = "10") String limit,
            @RequestParam(name = "sort_by", defaultValue = "name") String sortBy,
            @RequestParam(defaultValue = "asc") String order,
            @ResolvedToken Token token,
            ServerWebExchange exchange) {
        return Mono.defer(() -> registry.require(resource)
                .list(name, afterId, limit, sortBy, order, token, breadcrumbFactory.create(token, exchange)));
    }

    @GetMapping("/{id}")
    public Mono<Map<String, Object>> get(
            @PathVariable String resource,
            @PathVariable String id,
            @ResolvedToken Token token,
            ServerWebExchange exchange) {
        return Mono.defer(() -> registry.require(resource)
                .get(id, token, breadcrumbFactory.create(token, exchange)));
    }

    /**
     * Partial update. Only resources configured with {@code supports-update} accept it.
     */
    @PatchMapping("/{id}")
    public Mono<Map<String, Object>> update(
            @PathVariable String resource,
            @PathVariable String id,
            @RequestBody(required = false) Map<String, Object> body,
            @ResolvedToken Token token,
            ServerWebExchange exchange) {
        return Mono.defer(() -> {
            ResourceService service = registry.require(resource);
            if (!service.getDefinition().supportsUpdate()) {
                log.debug("Rejected update on read-only resource {}", resource);
                return Mono.error(new ResponseStatusException(HttpStatus.METHOD_NOT_ALLOWED,
                        "Updates are not supported for " + resource));
            }
            return service.update(id, body, token, breadcrumbFactory.create(token, exchange));
        });
    }
}
