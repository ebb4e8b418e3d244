package com.example.resourceapi.store;

import com.example.resourceapi.scroll.QueryPlan;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Generic access to named document collections.
 *
 * <p>Documents are exchanged as plain field maps. The identifier is always exposed under
 * {@link DocumentFields#ID} as its canonical string form, and timestamps as {@link java.time.Instant}.
 * Implementations must be safe for concurrent use; each single-document write is atomic.
 */
public interface DocumentStore {

    /**
     * Persist a new document and return the identifier the store assigned to it.
     */
    Mono<String> create(String collection, Map<String, Object> document);

    /**
     * Fetch a document by identifier. Completes empty when the identifier is unknown or malformed.
     */
    Mono<Map<String, Object>> get(String collection, String id);

    /**
     * Set the given top-level fields on one document and return the document as stored afterwards.
     * Completes empty when the document does not exist.
     */
    Mono<Map<String, Object>> update(String collection, String id, Map<String, Object> fields);

    /**
     * Run a pagination query: name filter, continuation predicate, {@code (sort field, _id)} ordering
     * and {@link QueryPlan#fetchLimit()}.
     */
    Flux<Map<String, Object>> query(String collection, QueryPlan plan);
}
