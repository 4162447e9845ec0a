package com.planit.gamification.config;

import com.planit.gamification.store.DocumentStore;
import com.planit.gamification.store.mongo.MongoDocumentStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.SimpleAsyncTaskExecutor;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.messaging.DefaultMessageListenerContainer;
import org.springframework.data.mongodb.core.messaging.MessageListenerContainer;

import java.util.concurrent.Executor;

/**
 * MongoDB-backed ledger store. Requires a replica set for change streams.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "gamification.store", name = "type", havingValue = "mongo")
public class MongoStoreConfiguration {

    /**
     * Change-stream container for ledger and leaderboard subscriptions. The container does
     * not auto-start, and requests registered on a stopped container are never scheduled.
     */
    @Bean(destroyMethod = "stop")
    public MessageListenerContainer ledgerChangeStreamContainer(MongoTemplate mongoTemplate) {
        return startedContainer(mongoTemplate, new SimpleAsyncTaskExecutor("ledger-change-stream-"));
    }

    @Bean
    public DocumentStore mongoDocumentStore(MongoTemplate mongoTemplate, MessageListenerContainer ledgerChangeStreamContainer) {
        log.info("Using MongoDB document store: database={}", mongoTemplate.getDb().getName());
        return new MongoDocumentStore(mongoTemplate, ledgerChangeStreamContainer);
    }

    static MessageListenerContainer startedContainer(MongoTemplate mongoTemplate, Executor taskExecutor) {
        DefaultMessageListenerContainer container = new DefaultMessageListenerContainer(mongoTemplate, taskExecutor);
        container.start();
        log.info("Change stream container started");
        return container;
    }
}
