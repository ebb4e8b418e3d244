package com.example.resourceapi.store.mongo;

import com.example.resourceapi.common.util.StringSanitizer;
import com.example.resourceapi.scroll.QueryPlan;
import com.example.resourceapi.store.DocumentFields;
import com.example.resourceapi.store.DocumentStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * {@link DocumentStore} backed by {@link ReactiveMongoTemplate}, working on raw {@link Document}s so
 * collections stay schemaless.
 */
@Slf4j
@RequiredArgsConstructor
public class MongoDocumentStore implements DocumentStore {

    private final ReactiveMongoTemplate mongoTemplate;

    @Override
    public Mono<String> create(String collection, Map<String, Object> document) {
        Document bson = DocumentMapper.toBson(document);
        bson.remove(DocumentFields.ID);
        return mongoTemplate.insert(bson, collection)
                .map(saved -> String.valueOf(saved.get(DocumentFields.ID)));
    }

    @Override
    public Mono<Map<String, Object>> get(String collection, String id) {
        if (!ObjectId.isValid(id)) {
            return Mono.empty();
        }
        return mongoTemplate.findById(new ObjectId(id), Document.class, collection)
                .map(DocumentMapper::fromBson);
    }

    @Override
    public Mono<Map<String, Object>> update(String collection, String id, Map<String, Object> fields) {
        if (!ObjectId.isValid(id)) {
            return Mono.empty();
        }
        Update update = new Update();
        fields.forEach((field, value) -> {
            if (DocumentFields.isReserved(field)) {
                log.warn("Ignoring update of reserved field {} in {}", StringSanitizer.forLog(field, 64), collection);
                return;
            }
            update.set(field, DocumentMapper.toBsonValue(value));
        });
        if (update.getUpdateObject().isEmpty()) {
            return get(collection, id);
        }

        Query byId = Query.query(Criteria.where(DocumentFields.ID).is(new ObjectId(id)));
        return mongoTemplate.findAndModify(byId, update, FindAndModifyOptions.options().returnNew(true),
                        Document.class, collection)
                .map(DocumentMapper::fromBson);
    }

    @Override
    public Flux<Map<String, Object>> query(String collection, QueryPlan plan) {
        Query query = MongoQueryTranslator.toQuery(plan);
        log.debug("Querying {}: {}", collection, query);
        return mongoTemplate.find(query, Document.class, collection)
                .map(DocumentMapper::fromBson);
    }
}
