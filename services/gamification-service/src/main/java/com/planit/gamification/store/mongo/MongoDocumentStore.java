package com.planit.gamification.store.mongo;

import com.planit.gamification.store.DocumentListener;
import com.planit.gamification.store.DocumentNotFoundException;
import com.planit.gamification.store.DocumentPath;
import com.planit.gamification.store.DocumentStore;
import com.planit.gamification.store.Filter;
import com.planit.gamification.store.QueryListener;
import com.planit.gamification.store.QuerySpec;
import com.planit.gamification.store.StoreUnavailableException;
import com.planit.gamification.store.StoredDocument;
import com.planit.gamification.store.SubscriptionHandle;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.FindAndReplaceOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.messaging.ChangeStreamRequest;
import org.springframework.data.mongodb.core.messaging.MessageListenerContainer;
import org.springframework.data.mongodb.core.messaging.Subscription;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * {@link DocumentStore} on MongoDB. One collection per path collection, the path id as
 * {@code _id}, and the document version kept in {@code _version}.
 *
 * <p>Conditional writes are {@code findAndModify} calls filtered on {@code _version}.
 * Change notification uses change streams, so the deployment must be a replica set.
 */
@Slf4j
@RequiredArgsConstructor
public class MongoDocumentStore implements DocumentStore {

    static final String ID = "_id";
    static final String VERSION = "_version";
    private static final int MAX_OVERWRITE_ATTEMPTS = 5;

    private final MongoTemplate mongoTemplate;
    private final MessageListenerContainer listenerContainer;

    @Override
    public Optional<StoredDocument> get(DocumentPath path) {
        return execute("get", path, () ->
                Optional.ofNullable(mongoTemplate.findById(path.id(), Document.class, path.collection()))
                        .map(document -> toStored(path, document)));
    }

    @Override
    public StoredDocument set(DocumentPath path, Map<String, Object> fields) {
        return execute("set", path, () -> {
            for (int attempt = 0; attempt < MAX_OVERWRITE_ATTEMPTS; attempt++) {
                long current = get(path).map(StoredDocument::getVersion).orElse(0L);
                Document replacement = toBson(fields);
                replacement.put(ID, path.id());
                replacement.put(VERSION, current + 1);
                if (current == 0) {
                    try {
                        mongoTemplate.insert(replacement, path.collection());
                        return toStored(path, replacement);
                    } catch (DuplicateKeyException e) {
                        log.debug("Concurrent create while overwriting {}, retrying", path);
                        continue;
                    }
                }
                Document replaced = mongoTemplate.findAndReplace(
                        versionQuery(path, current), replacement,
                        FindAndReplaceOptions.options().returnNew(), path.collection());
                if (replaced != null) {
                    return toStored(path, replaced);
                }
            }
            throw new StoreUnavailableException("Overwrite of " + path + " kept losing to concurrent writers");
        });
    }

    @Override
    public StoredDocument updateFields(DocumentPath path, Map<String, Object> fields) {
        return execute("updateFields", path, () -> {
            Document updated = mongoTemplate.findAndModify(
                    Query.query(Criteria.where(ID).is(path.id())),
                    setAll(fields).inc(VERSION, 1),
                    FindAndModifyOptions.options().returnNew(true),
                    Document.class, path.collection());
            if (updated == null) {
                throw new DocumentNotFoundException(path);
            }
            return toStored(path, updated);
        });
    }

    @Override
    public StoredDocument appendToArrayField(DocumentPath path, String field, Object value) {
        return execute("appendToArrayField", path, () -> {
            Document updated = mongoTemplate.findAndModify(
                    Query.query(Criteria.where(ID).is(path.id())),
                    new Update().addToSet(field, toBsonValue(value)).inc(VERSION, 1),
                    FindAndModifyOptions.options().returnNew(true).upsert(true),
                    Document.class, path.collection());
            return toStored(path, updated);
        });
    }

    @Override
    public Optional<StoredDocument> compareAndSet(DocumentPath path, Map<String, Object> fields, long expectedVersion) {
        return execute("compareAndSet", path, () -> {
            if (expectedVersion == 0) {
                Document created = toBson(fields);
                created.put(ID, path.id());
                created.put(VERSION, 1L);
                try {
                    mongoTemplate.insert(created, path.collection());
                    return Optional.of(toStored(path, created));
                } catch (DuplicateKeyException e) {
                    return Optional.empty();
                }
            }
            Document updated = mongoTemplate.findAndModify(
                    versionQuery(path, expectedVersion),
                    setAll(fields).inc(VERSION, 1),
                    FindAndModifyOptions.options().returnNew(true),
                    Document.class, path.collection());
            return Optional.ofNullable(updated).map(document -> toStored(path, document));
        });
    }

    @Override
    public List<StoredDocument> query(QuerySpec spec) {
        return execute("query", DocumentPath.of(spec.getCollection(), "*"), () -> {
            Query query = toQuery(spec);
            return mongoTemplate.find(query, Document.class, spec.getCollection()).stream()
                    .map(document -> toStored(DocumentPath.of(spec.getCollection(), document.get(ID).toString()), document))
                    .toList();
        });
    }

    @Override
    public SubscriptionHandle subscribe(DocumentPath path, DocumentListener listener) {
        ChangeStreamRequest<Document> request = ChangeStreamRequest.<Document>builder()
                .collection(path.collection())
                .filter(Aggregation.newAggregation(
                        Aggregation.match(Criteria.where("documentKey._id").is(path.id()))))
                .publishTo(message -> listener.onChange(get(path)))
                .build();
        Subscription subscription = listenerContainer.register(request, Document.class, listener::onError);
        listener.onChange(get(path));
        return new ChangeStreamHandle(subscription);
    }

    @Override
    public SubscriptionHandle subscribeQuery(QuerySpec spec, QueryListener listener) {
        ChangeStreamRequest<Document> request = ChangeStreamRequest.<Document>builder()
                .collection(spec.getCollection())
                .publishTo(message -> listener.onResults(query(spec)))
                .build();
        Subscription subscription = listenerContainer.register(request, Document.class, listener::onError);
        listener.onResults(query(spec));
        return new ChangeStreamHandle(subscription);
    }

    private <T> T execute(String operation, DocumentPath path, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessResourceFailureException | TransientDataAccessException e) {
            log.warn("Mongo {} failed for {}: {}", operation, path, e.getMessage());
            throw new StoreUnavailableException("Mongo " + operation + " failed for " + path, e);
        }
    }

    private static Query versionQuery(DocumentPath path, long version) {
        return Query.query(Criteria.where(ID).is(path.id()).and(VERSION).is(version));
    }

    static Query toQuery(QuerySpec spec) {
        Query query = new Query();
        for (Filter filter : spec.getFilters()) {
            String field = Filter.DOCUMENT_ID.equals(filter.getField()) ? ID : filter.getField();
            Criteria criteria = Criteria.where(field);
            switch (filter.getOperator()) {
                case EQUAL_TO -> criteria.is(toBsonValue(filter.getValue()));
                case IN -> criteria.in(filter.values());
                case GREATER_THAN_OR_EQUAL -> criteria.gte(toBsonValue(filter.getValue()));
                case LESS_THAN -> criteria.lt(toBsonValue(filter.getValue()));
            }
            query.addCriteria(criteria);
        }
        if (spec.getOrderBy() != null) {
            query.with(Sort.by(spec.isDescending() ? Sort.Direction.DESC : Sort.Direction.ASC, spec.getOrderBy()));
        }
        if (spec.hasLimit()) {
            query.limit(spec.getLimit());
        }
        return query;
    }

    private static Update setAll(Map<String, Object> fields) {
        Update update = new Update();
        fields.forEach((field, value) -> {
            if (value == null) {
                update.unset(field);
            } else {
                update.set(field, toBsonValue(value));
            }
        });
        return update;
    }

    private static Document toBson(Map<String, Object> fields) {
        Document document = new Document();
        fields.forEach((field, value) -> {
            if (value != null) {
                document.put(field, toBsonValue(value));
            }
        });
        return document;
    }

    @SuppressWarnings("unchecked")
    static Object toBsonValue(Object value) {
        if (value instanceof Instant instant) {
            return Date.from(instant);
        }
        if (value instanceof Map<?, ?> map) {
            Document nested = new Document();
            ((Map<String, Object>) map).forEach((key, item) -> nested.put(key, toBsonValue(item)));
            return nested;
        }
        if (value instanceof List<?> list) {
            List<Object> converted = new ArrayList<>(list.size());
            list.forEach(item -> converted.add(toBsonValue(item)));
            return converted;
        }
        return value;
    }

    private static StoredDocument toStored(DocumentPath path, Document document) {
        Map<String, Object> fields = new LinkedHashMap<>(document);
        fields.remove(ID);
        Object version = fields.remove(VERSION);
        long parsedVersion = version instanceof Number number ? number.longValue() : 1L;
        return new StoredDocument(path, fields, parsedVersion);
    }

    private final class ChangeStreamHandle implements SubscriptionHandle {

        private final Subscription subscription;

        private ChangeStreamHandle(Subscription subscription) {
            this.subscription = subscription;
        }

        @Override
        public void cancel() {
            listenerContainer.remove(subscription);
        }

        @Override
        public boolean isActive() {
            return subscription.isActive();
        }
    }
}
