package com.example.resourceapi.store.mongo;

import com.example.resourceapi.scroll.QueryPlan;
import com.example.resourceapi.scroll.SortOrder;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.Date;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("MongoDocumentStore")
class MongoDocumentStoreTest {

    private static final String COLLECTION = "Grade";
    private static final ObjectId OID = new ObjectId("65a1b2c3d4e5f60718293a4b");

    @Mock
    private ReactiveMongoTemplate mongoTemplate;

    private MongoDocumentStore store;

    @BeforeEach
    void setUp() {
        store = new MongoDocumentStore(mongoTemplate);
    }

    @Test
    @DisplayName("should insert without _id, store instants as dates and return the generated hex id")
    void shouldCreate() {
        Instant at = Instant.parse("2024-05-01T12:00:00Z");
        ArgumentCaptor<Document> inserted = ArgumentCaptor.forClass(Document.class);
        when(mongoTemplate.insert(inserted.capture(), eq(COLLECTION)))
                .thenAnswer(invocation -> {
                    Document doc = invocation.getArgument(0);
                    doc.put("_id", OID);
                    return Mono.just(doc);
                });

        StepVerifier.create(store.create(COLLECTION, Map.of("name", "Math", "created", Map.of("at_time", at))))
                .expectNext(OID.toHexString())
                .verifyComplete();

        Document doc = inserted.getValue();
        assertThat(((Document) doc.get("created")).get("at_time")).isEqualTo(Date.from(at));
    }

    @Test
    @DisplayName("should expose _id as hex string and dates as instants")
    void shouldMapOnGet() {
        Date at = Date.from(Instant.parse("2024-05-01T12:00:00Z"));
        when(mongoTemplate.findById(OID, Document.class, COLLECTION)).thenReturn(Mono.just(
                new Document("_id", OID).append("name", "Math").append("created", new Document("at_time", at))));

        StepVerifier.create(store.get(COLLECTION, OID.toHexString()))
                .assertNext(doc -> {
                    assertThat(doc.get("_id")).isEqualTo(OID.toHexString());
                    assertThat(((Map<?, ?>) doc.get("created")).get("at_time")).isEqualTo(at.toInstant());
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("should complete empty for a malformed id without querying")
    void shouldSkipMalformedId() {
        StepVerifier.create(store.get(COLLECTION, "nope")).verifyComplete();
        StepVerifier.create(store.update(COLLECTION, "nope", Map.of("a", 1))).verifyComplete();

        verifyNoInteractions(mongoTemplate);
    }

    @Test
    @DisplayName("should update with $set and ask for the new document")
    void shouldUpdateAtomically() {
        ArgumentCaptor<Update> update = ArgumentCaptor.forClass(Update.class);
        ArgumentCaptor<FindAndModifyOptions> options = ArgumentCaptor.forClass(FindAndModifyOptions.class);
        when(mongoTemplate.findAndModify(any(Query.class), update.capture(), options.capture(),
                eq(Document.class), eq(COLLECTION)))
                .thenReturn(Mono.just(new Document("_id", OID).append("status", "done")));

        StepVerifier.create(store.update(COLLECTION, OID.toHexString(), Map.of("status", "done")))
                .assertNext(doc -> assertThat(doc).containsEntry("status", "done"))
                .verifyComplete();

        assertThat(update.getValue().getUpdateObject())
                .isEqualTo(new Document("$set", new Document("status", "done")));
        assertThat(options.getValue().isReturnNew()).isTrue();
    }

    @Test
    @DisplayName("should never $set created, _id or paths into them")
    void shouldSkipReservedPaths() {
        ArgumentCaptor<Update> update = ArgumentCaptor.forClass(Update.class);
        when(mongoTemplate.findAndModify(any(Query.class), update.capture(), any(FindAndModifyOptions.class),
                eq(Document.class), eq(COLLECTION)))
                .thenReturn(Mono.just(new Document("_id", OID).append("status", "done")));

        StepVerifier.create(store.update(COLLECTION, OID.toHexString(),
                        Map.of("created.by_user", "mallory", "created", "x", "_id", "y", "status", "done")))
                .expectNextCount(1)
                .verifyComplete();

        assertThat(update.getValue().getUpdateObject())
                .isEqualTo(new Document("$set", new Document("status", "done")));
    }

    @Test
    @DisplayName("should read the current document when only reserved fields were given")
    void shouldGetWhenOnlyReservedFields() {
        when(mongoTemplate.findById(OID, Document.class, COLLECTION))
                .thenReturn(Mono.just(new Document("_id", OID)));

        StepVerifier.create(store.update(COLLECTION, OID.toHexString(), Map.of("created.at_time", "now")))
                .expectNextCount(1)
                .verifyComplete();

        verify(mongoTemplate, never()).findAndModify(any(Query.class), any(Update.class),
                any(FindAndModifyOptions.class), eq(Document.class), eq(COLLECTION));
    }

    @Test
    @DisplayName("should read the current document when there is nothing to set")
    void shouldGetOnEmptyUpdate() {
        when(mongoTemplate.findById(OID, Document.class, COLLECTION))
                .thenReturn(Mono.just(new Document("_id", OID)));

        StepVerifier.create(store.update(COLLECTION, OID.toHexString(), Map.of()))
                .expectNextCount(1)
                .verifyComplete();
    }

    @Test
    @DisplayName("should run the translated query")
    void shouldQuery() {
        when(mongoTemplate.find(any(Query.class), eq(Document.class), eq(COLLECTION)))
                .thenReturn(Flux.just(new Document("_id", OID).append("name", "a")));

        StepVerifier.create(store.query(COLLECTION, new QueryPlan(null, "name", SortOrder.ASC, 2, null)))
                .assertNext(doc -> assertThat(doc.get("_id")).isEqualTo(OID.toHexString()))
                .verifyComplete();

        ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
        verify(mongoTemplate).find(query.capture(), eq(Document.class), eq(COLLECTION));
        assertThat(query.getValue().getLimit()).isEqualTo(3);
    }
}
