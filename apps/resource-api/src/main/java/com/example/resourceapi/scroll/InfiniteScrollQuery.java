package com.example.resourceapi.scroll;

import com.example.resourceapi.common.exception.ValidationException;
import com.example.resourceapi.store.DocumentFields;
import com.example.resourceapi.store.DocumentStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Runs one page of an infinite scroll listing against a {@link DocumentStore}.
 *
 * <p>The cursor only carries an identifier, so a continuation page first reads the cursor document to
 * recover its current sort value. A cursor whose document has since been removed fails the request.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InfiniteScrollQuery {

    private final DocumentStore store;

    public Mono<ScrollPage> execute(String collection, ScrollParameters parameters) {
        return plan(collection, parameters)
                .flatMap(plan -> store.query(collection, plan)
                        .collectList()
                        .map(fetched -> ScrollPage.fromFetched(fetched, plan.limit())));
    }

    Mono<QueryPlan> plan(String collection, ScrollParameters parameters) {
        if (parameters.cursorId() == null) {
            return Mono.just(QueryPlan.of(parameters, null));
        }

        String cursorId = parameters.cursorId();
        return store.get(collection, cursorId)
                .switchIfEmpty(Mono.defer(() -> {
                    log.debug("Cursor document {} no longer exists in {}", cursorId, collection);
                    return Mono.<Map<String, Object>>error(new ValidationException(
                            "Cursor after_id '" + cursorId + "' no longer refers to an existing item"));
                }))
                .map(cursorDoc -> QueryPlan.of(parameters, new ScrollPosition(
                        DocumentFields.resolve(cursorDoc, parameters.sortField()),
                        cursorId)));
    }
}
