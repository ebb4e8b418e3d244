package com.example.resourceapi.store.mongo;

import com.example.resourceapi.config.AppProperties;
import com.example.resourceapi.store.DocumentFields;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import reactor.core.publisher.Flux;

/**
 * Ensures a compound {@code (sort field, _id)} index for every allow-listed sort field, which is what
 * keeps each page an index range scan.
 */
@Slf4j
@RequiredArgsConstructor
public class MongoIndexInitializer {

    private final ReactiveMongoTemplate mongoTemplate;
    private final AppProperties properties;

    @EventListener(ApplicationReadyEvent.class)
    public void ensureIndexes() {
        ensureAll()
                .subscribe(
                        name -> log.info("Ensured index {}", name),
                        error -> log.error("Failed to ensure pagination indexes", error));
    }

    Flux<String> ensureAll() {
        return Flux.fromIterable(properties.getResources())
                .flatMap(resource -> Flux.fromIterable(resource.getSortFields())
                        .filter(field -> !DocumentFields.ID.equals(field))
                        .flatMap(field -> mongoTemplate.indexOps(collectionOf(resource))
                                .ensureIndex(new Index()
                                        .on(field, Sort.Direction.ASC)
                                        .on(DocumentFields.ID, Sort.Direction.ASC))));
    }

    private static String collectionOf(AppProperties.Resource resource) {
        return resource.getCollection() == null || resource.getCollection().isBlank()
                ? resource.getName()
                : resource.getCollection();
    }
}
