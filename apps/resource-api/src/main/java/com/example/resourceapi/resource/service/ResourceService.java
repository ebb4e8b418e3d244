package com.example.resourceapi.resource.service;

import com.example.resourceapi.audit.Breadcrumb;
import com.example.resourceapi.authz.model.Operation;
import com.example.resourceapi.authz.model.PolicyDecision;
import com.example.resourceapi.authz.policy.PermissionPolicy;
import com.example.resourceapi.common.exception.ForbiddenException;
import com.example.resourceapi.common.exception.InternalErrorException;
import com.example.resourceapi.common.exception.NotFoundException;
import com.example.resourceapi.common.exception.ResourceException;
import com.example.resourceapi.common.exception.ValidationException;
import com.example.resourceapi.common.util.StringSanitizer;
import com.example.resourceapi.resource.model.ResourceDefinition;
import com.example.resourceapi.scroll.InfiniteScrollQuery;
import com.example.resourceapi.scroll.ScrollPage;
import com.example.resourceapi.scroll.ScrollParameters;
import com.example.resourceapi.scroll.ScrollQueryBuilder;
import com.example.resourceapi.security.context.Token;
import com.example.resourceapi.store.DocumentFields;
import com.example.resourceapi.store.DocumentStore;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * Create, read, list and update for one configured resource.
 *
 * <p>Every operation checks the permission policy first. Validation, forbidden and not-found errors
 * propagate unchanged; anything else is logged here and surfaced as an {@link InternalErrorException}
 * with a generic message.
 */
@Slf4j
public class ResourceService {

    private final ResourceDefinition definition;
    private final DocumentStore store;
    private final PermissionPolicy permissionPolicy;
    private final ScrollQueryBuilder queryBuilder;
    private final InfiniteScrollQuery scrollQuery;

    public ResourceService(
            ResourceDefinition definition,
            DocumentStore store,
            PermissionPolicy permissionPolicy,
            ScrollQueryBuilder queryBuilder,
            InfiniteScrollQuery scrollQuery) {
        this.definition = definition;
        this.store = store;
        this.permissionPolicy = permissionPolicy;
        this.queryBuilder = queryBuilder;
        this.scrollQuery = scrollQuery;
    }

    public ResourceDefinition getDefinition() {
        return definition;
    }

    /**
     * Stores a new document stamped with {@code created = breadcrumb}. Client supplied {@code _id} and
     * {@code created}, including dotted paths into them, are ignored.
     *
     * @return the new document's id
     */
    public Mono<String> create(Map<String, Object> data, Token token, Breadcrumb breadcrumb) {
        return checkPermission(token, Operation.CREATE)
                .then(Mono.defer(() -> {
                    Map<String, Object> document = writableFields(data);
                    document.put(DocumentFields.CREATED, breadcrumb.toMap());
                    return store.create(definition.collection(), document);
                }))
                .doOnNext(id -> log.info("Created {} {} for user={}, correlationId={}",
                        definition.name(), id, breadcrumb.byUser(), breadcrumb.correlationId()))
                .onErrorMap(internalError("create", null, breadcrumb));
    }

    public Mono<Map<String, Object>> get(String id, Token token, Breadcrumb breadcrumb) {
        return checkPermission(token, Operation.READ)
                .then(Mono.defer(() -> store.get(definition.collection(), id)))
                .switchIfEmpty(Mono.error(() -> notFound(id)))
                .onErrorMap(internalError("retrieve", id, breadcrumb));
    }

    /**
     * Returns one page of the listing. Parameters are passed as received from the caller.
     */
    public Mono<ScrollPage> list(
            String name,
            String afterId,
            String limit,
            String sortBy,
            String order,
            Token token,
            Breadcrumb breadcrumb) {
        return checkPermission(token, Operation.READ)
                .then(Mono.defer(() -> {
                    ScrollParameters parameters = queryBuilder.build(
                            name, afterId, limit, sortBy, order, definition.sortFields());
                    return scrollQuery.execute(definition.collection(), parameters);
                }))
                .doOnNext(page -> log.debug("Listed {} {} items, hasMore={}, correlationId={}",
                        page.items().size(), definition.name(), page.hasMore(), breadcrumb.correlationId()))
                .onErrorMap(internalError("retrieve", null, breadcrumb));
    }

    /**
     * Sets the given fields in one atomic write. {@code _id} and {@code created} are never modified,
     * not even through a dotted path; an update with nothing left to set returns the current document.
     */
    public Mono<Map<String, Object>> update(String id, Map<String, Object> data, Token token, Breadcrumb breadcrumb) {
        return checkPermission(token, Operation.UPDATE)
                .then(Mono.defer(() -> store.update(definition.collection(), id, writableFields(data))))
                .switchIfEmpty(Mono.error(() -> notFound(id)))
                .doOnNext(doc -> log.info("Updated {} {} for user={}, correlationId={}",
                        definition.name(), id, breadcrumb.byUser(), breadcrumb.correlationId()))
                .onErrorMap(internalError("update", id, breadcrumb));
    }

    private Mono<Void> checkPermission(Token token, Operation operation) {
        return Mono.defer(() -> {
            PolicyDecision decision = permissionPolicy.evaluate(token, operation, definition.name());
            if (decision.isDenied()) {
                log.warn("Permission denied: user={}, operation={}, resource={}, policy={}, reason={}",
                        StringSanitizer.forLog(token.userId()), operation, definition.name(),
                        decision.policyId(), decision.reason());
                return Mono.error(new ForbiddenException(
                        "Not permitted to " + operation.name().toLowerCase(Locale.ROOT) + " " + definition.name()));
            }
            return Mono.empty();
        });
    }

    private NotFoundException notFound(String id) {
        return new NotFoundException(definition.displayName() + " " + StringSanitizer.forLog(id, 64) + " not found");
    }

    private Function<Throwable, Throwable> internalError(String action, String id, Breadcrumb breadcrumb) {
        return error -> {
            if (error instanceof ResourceException) {
                return error;
            }
            log.error("Failed to {} {}: id={}, correlationId={}",
                    action, definition.name(), StringSanitizer.forLog(id, 64), breadcrumb.correlationId(), error);
            return new InternalErrorException("Failed to " + action + " " + definition.name(), error);
        };
    }

    /**
     * Copies the client fields, dropping {@code _id}, {@code created} and dotted paths into either.
     *
     * @throws ValidationException for an empty field name or one containing {@code $}
     */
    private static Map<String, Object> writableFields(Map<String, Object> data) {
        Map<String, Object> fields = new LinkedHashMap<>();
        if (data == null) {
            return fields;
        }
        data.forEach((field, value) -> {
            if (field == null || field.isBlank() || field.contains("$")) {
                throw new ValidationException("Invalid field name '" + StringSanitizer.forLog(field, 64) + "'");
            }
            if (!DocumentFields.isReserved(field)) {
                fields.put(field, value);
            }
        });
        return fields;
    }
}
