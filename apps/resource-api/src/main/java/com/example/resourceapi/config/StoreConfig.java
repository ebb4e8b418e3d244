package com.example.resourceapi.config;

import com.example.resourceapi.store.DocumentStore;
import com.example.resourceapi.store.memory.InMemoryDocumentStore;
import com.example.resourceapi.store.mongo.MongoDocumentStore;
import com.example.resourceapi.store.mongo.MongoIndexInitializer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;

/**
 * Selects the document store by {@code app.store.type}.
 */
@Slf4j
@Configuration
public class StoreConfig {

    @Configuration
    @ConditionalOnProperty(name = "app.store.type", havingValue = "mongo", matchIfMissing = true)
    static class MongoStoreConfig {

        @Bean
        public DocumentStore mongoDocumentStore(ReactiveMongoTemplate mongoTemplate) {
            log.info("Using MongoDB document store");
            return new MongoDocumentStore(mongoTemplate);
        }

        @Bean
        @ConditionalOnProperty(name = "app.store.create-indexes", havingValue = "true", matchIfMissing = true)
        public MongoIndexInitializer mongoIndexInitializer(ReactiveMongoTemplate mongoTemplate,
                                                           AppProperties properties) {
            return new MongoIndexInitializer(mongoTemplate, properties);
        }
    }

    @Bean
    @ConditionalOnProperty(name = "app.store.type", havingValue = "in-memory")
    public DocumentStore inMemoryDocumentStore() {
        log.info("Using in-memory document store");
        return new InMemoryDocumentStore();
    }
}
