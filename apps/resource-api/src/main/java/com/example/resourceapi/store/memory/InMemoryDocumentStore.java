package com.example.resourceapi.store.memory;

import com.example.resourceapi.scroll.QueryPlan;
import com.example.resourceapi.scroll.ScrollPosition;
import com.example.resourceapi.scroll.SortOrder;
import com.example.resourceapi.store.DocumentFields;
import com.example.resourceapi.store.DocumentStore;
import com.example.resourceapi.store.SortValueComparator;
import lombok.extern.slf4j.Slf4j;
import org.bson.types.ObjectId;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * In-memory {@link DocumentStore} for local development and tests.
 *
 * <p>Documents live in one {@link ConcurrentHashMap} per collection. Reads and writes hand out copies so
 * callers can never mutate stored state. Updates go through {@link ConcurrentHashMap#computeIfPresent},
 * which makes each single-document write atomic.
 */
@Slf4j
public class InMemoryDocumentStore implements DocumentStore {

    private final Map<String, Map<String, Map<String, Object>>> collections = new ConcurrentHashMap<>();

    @Override
    public Mono<String> create(String collection, Map<String, Object> document) {
        return Mono.fromCallable(() -> {
            String id = new ObjectId().toHexString();
            Map<String, Object> stored = new LinkedHashMap<>();
            stored.put(DocumentFields.ID, id);
            document.forEach((key, value) -> {
                if (!DocumentFields.ID.equals(key)) {
                    stored.put(key, deepCopy(value));
                }
            });
            collection(collection).put(id, stored);
            log.debug("Stored document {} in {}", id, collection);
            return id;
        });
    }

    @Override
    public Mono<Map<String, Object>> get(String collection, String id) {
        return Mono.fromCallable(() -> {
            Map<String, Object> stored = id == null ? null : collection(collection).get(canonical(id));
            return stored == null ? null : copy(stored);
        });
    }

    @Override
    public Mono<Map<String, Object>> update(String collection, String id, Map<String, Object> fields) {
        return Mono.fromCallable(() -> {
            if (id == null) {
                return null;
            }
            Map<String, Object> updated = collection(collection).computeIfPresent(canonical(id), (key, current) -> {
                Map<String, Object> next = new LinkedHashMap<>(current);
                fields.forEach((field, value) -> next.put(field, deepCopy(value)));
                next.put(DocumentFields.ID, key);
                return next;
            });
            return updated == null ? null : copy(updated);
        });
    }

    @Override
    public Flux<Map<String, Object>> query(String collection, QueryPlan plan) {
        Comparator<Map<String, Object>> ordering = ordering(plan.sortField());
        if (plan.order() == SortOrder.DESC) {
            ordering = ordering.reversed();
        }

        Predicate<Map<String, Object>> filter = nameFilter(plan).and(continuation(plan));

        List<Map<String, Object>> page = collection(collection).values().stream()
                .filter(filter)
                .sorted(ordering)
                .limit(plan.fetchLimit())
                .map(InMemoryDocumentStore::copy)
                .toList();
        return Flux.fromIterable(page);
    }

    private Map<String, Map<String, Object>> collection(String name) {
        return collections.computeIfAbsent(name, key -> new ConcurrentHashMap<>());
    }

    private static Comparator<Map<String, Object>> ordering(String sortField) {
        Comparator<Map<String, Object>> bySortValue =
                (a, b) -> SortValueComparator.INSTANCE.compare(
                        DocumentFields.resolve(a, sortField), DocumentFields.resolve(b, sortField));
        return bySortValue.thenComparing(DocumentFields::idOf);
    }

    private static Predicate<Map<String, Object>> nameFilter(QueryPlan plan) {
        if (!plan.hasNameFilter()) {
            return doc -> true;
        }
        String needle = plan.nameFilter().toLowerCase(Locale.ROOT);
        return doc -> doc.get(DocumentFields.NAME) instanceof String name
                && name.toLowerCase(Locale.ROOT).contains(needle);
    }

    private static Predicate<Map<String, Object>> continuation(QueryPlan plan) {
        ScrollPosition after = plan.after();
        if (after == null) {
            return doc -> true;
        }
        return doc -> {
            int cmp = SortValueComparator.INSTANCE.compare(
                    DocumentFields.resolve(doc, plan.sortField()), after.sortValue());
            if (cmp == 0) {
                cmp = DocumentFields.idOf(doc).compareTo(after.id());
            }
            return plan.order() == SortOrder.ASC ? cmp > 0 : cmp < 0;
        };
    }

    private static String canonical(String id) {
        return id.toLowerCase(Locale.ROOT);
    }

    private static Map<String, Object> copy(Map<String, Object> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> copy.put(key, deepCopy(value)));
        return copy;
    }

    @SuppressWarnings("unchecked")
    private static Object deepCopy(Object value) {
        if (value instanceof Map<?, ?> map) {
            return copy((Map<String, Object>) map);
        }
        if (value instanceof List<?> list) {
            return list.stream().map(InMemoryDocumentStore::deepCopy).toList();
        }
        return value;
    }
}
