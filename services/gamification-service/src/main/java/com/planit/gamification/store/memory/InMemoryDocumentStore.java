package com.planit.gamification.store.memory;

import com.planit.gamification.store.DocumentListener;
import com.planit.gamification.store.DocumentNotFoundException;
import com.planit.gamification.store.DocumentPath;
import com.planit.gamification.store.DocumentStore;
import com.planit.gamification.store.Filter;
import com.planit.gamification.store.QueryListener;
import com.planit.gamification.store.QuerySpec;
import com.planit.gamification.store.StoredDocument;
import com.planit.gamification.store.SubscriptionHandle;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-local {@link DocumentStore} with the same write, version and notification
 * semantics as the remote store.
 *
 * <p>Listeners receive a snapshot after every write that touches what they watch, on the
 * writing thread and after the write lock is released. Deliveries to one subscription never
 * go backwards: a snapshot older than the last one delivered is dropped.
 */
@Slf4j
public class InMemoryDocumentStore implements DocumentStore {

    private final Map<DocumentPath, StoredDocument> documents = new HashMap<>();
    private final List<DocumentSubscription> documentSubscriptions = new CopyOnWriteArrayList<>();
    private final List<QuerySubscription> querySubscriptions = new CopyOnWriteArrayList<>();
    private final ReentrantLock dispatchLock = new ReentrantLock();
    private final AtomicLong writeSequence = new AtomicLong();

    @Override
    public Optional<StoredDocument> get(DocumentPath path) {
        synchronized (documents) {
            return Optional.ofNullable(documents.get(path));
        }
    }

    @Override
    public StoredDocument set(DocumentPath path, Map<String, Object> fields) {
        StoredDocument written;
        synchronized (documents) {
            StoredDocument current = documents.get(path);
            written = write(path, new LinkedHashMap<>(fields), current == null ? 0 : current.getVersion());
        }
        dispatch(written);
        return written;
    }

    @Override
    public StoredDocument updateFields(DocumentPath path, Map<String, Object> fields) {
        StoredDocument written;
        synchronized (documents) {
            StoredDocument current = documents.get(path);
            if (current == null) {
                throw new DocumentNotFoundException(path);
            }
            written = write(path, merge(current.getFields(), fields), current.getVersion());
        }
        dispatch(written);
        return written;
    }

    @Override
    public StoredDocument appendToArrayField(DocumentPath path, String field, Object value) {
        StoredDocument written;
        synchronized (documents) {
            StoredDocument current = documents.get(path);
            Map<String, Object> merged = current == null ? new LinkedHashMap<>() : new LinkedHashMap<>(current.getFields());
            List<Object> array = new ArrayList<>();
            if (merged.get(field) instanceof Collection<?> existing) {
                array.addAll(existing);
            }
            if (!array.contains(value)) {
                array.add(value);
            }
            merged.put(field, array);
            written = write(path, merged, current == null ? 0 : current.getVersion());
        }
        dispatch(written);
        return written;
    }

    @Override
    public Optional<StoredDocument> compareAndSet(DocumentPath path, Map<String, Object> fields, long expectedVersion) {
        StoredDocument written;
        synchronized (documents) {
            StoredDocument current = documents.get(path);
            long currentVersion = current == null ? 0 : current.getVersion();
            if (currentVersion != expectedVersion) {
                log.debug("Conditional write rejected: path={}, expected={}, actual={}", path, expectedVersion, currentVersion);
                return Optional.empty();
            }
            Map<String, Object> merged = current == null ? new LinkedHashMap<>(fields) : merge(current.getFields(), fields);
            written = write(path, merged, currentVersion);
        }
        dispatch(written);
        return Optional.of(written);
    }

    @Override
    public List<StoredDocument> query(QuerySpec query) {
        synchronized (documents) {
            return evaluate(query);
        }
    }

    @Override
    public SubscriptionHandle subscribe(DocumentPath path, DocumentListener listener) {
        DocumentSubscription subscription = new DocumentSubscription(path, listener);
        documentSubscriptions.add(subscription);
        Optional<StoredDocument> current = get(path);
        dispatchLock.lock();
        try {
            subscription.deliver(current);
        } finally {
            dispatchLock.unlock();
        }
        return subscription;
    }

    @Override
    public SubscriptionHandle subscribeQuery(QuerySpec query, QueryListener listener) {
        QuerySubscription subscription = new QuerySubscription(query, listener);
        querySubscriptions.add(subscription);
        List<StoredDocument> results;
        long sequence;
        synchronized (documents) {
            results = evaluate(query);
            sequence = writeSequence.get();
        }
        dispatchLock.lock();
        try {
            subscription.deliver(results, sequence);
        } finally {
            dispatchLock.unlock();
        }
        return subscription;
    }

    public int size() {
        synchronized (documents) {
            return documents.size();
        }
    }

    public int activeSubscriptionCount() {
        return documentSubscriptions.size() + querySubscriptions.size();
    }

    private StoredDocument write(DocumentPath path, Map<String, Object> fields, long previousVersion) {
        StoredDocument written = new StoredDocument(path, Map.copyOf(withoutNulls(fields)), previousVersion + 1);
        documents.put(path, written);
        writeSequence.incrementAndGet();
        return written;
    }

    private void dispatch(StoredDocument written) {
        List<Runnable> deliveries = new ArrayList<>();
        synchronized (documents) {
            long sequence = writeSequence.get();
            for (DocumentSubscription subscription : documentSubscriptions) {
                if (subscription.path.equals(written.getPath())) {
                    Optional<StoredDocument> latest = Optional.ofNullable(documents.get(written.getPath()));
                    deliveries.add(() -> subscription.deliver(latest));
                }
            }
            for (QuerySubscription subscription : querySubscriptions) {
                if (subscription.query.getCollection().equals(written.getPath().collection())) {
                    List<StoredDocument> results = evaluate(subscription.query);
                    deliveries.add(() -> subscription.deliver(results, sequence));
                }
            }
        }
        if (deliveries.isEmpty()) {
            return;
        }
        dispatchLock.lock();
        try {
            deliveries.forEach(Runnable::run);
        } finally {
            dispatchLock.unlock();
        }
    }

    private List<StoredDocument> evaluate(QuerySpec query) {
        List<StoredDocument> matches = new ArrayList<>();
        for (StoredDocument document : documents.values()) {
            if (document.getPath().collection().equals(query.getCollection())
                    && query.getFilters().stream().allMatch(filter -> matches(document, filter))) {
                matches.add(document);
            }
        }
        if (query.getOrderBy() != null) {
            Comparator<StoredDocument> order = Comparator.comparing(
                    document -> document.get(query.getOrderBy()), InMemoryDocumentStore::compareValues);
            matches.sort(query.isDescending() ? order.reversed() : order);
        }
        if (query.hasLimit() && matches.size() > query.getLimit()) {
            return List.copyOf(matches.subList(0, query.getLimit()));
        }
        return List.copyOf(matches);
    }

    private static boolean matches(StoredDocument document, Filter filter) {
        Object actual = Filter.DOCUMENT_ID.equals(filter.getField())
                ? document.getId()
                : document.get(filter.getField());
        return switch (filter.getOperator()) {
            case EQUAL_TO -> valuesEqual(actual, filter.getValue());
            case IN -> filter.values().stream().anyMatch(candidate -> valuesEqual(actual, candidate));
            case GREATER_THAN_OR_EQUAL -> actual != null && compareValues(actual, filter.getValue()) >= 0;
            case LESS_THAN -> actual != null && compareValues(actual, filter.getValue()) < 0;
        };
    }

    private static boolean valuesEqual(Object left, Object right) {
        if (left instanceof Number a && right instanceof Number b) {
            return Double.compare(a.doubleValue(), b.doubleValue()) == 0;
        }
        return Objects.equals(left, right);
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static int compareValues(Object left, Object right) {
        if (left == null || right == null) {
            // nulls sort first ascending, last descending
            return left == null ? (right == null ? 0 : -1) : 1;
        }
        if (left instanceof Number a && right instanceof Number b) {
            return Double.compare(a.doubleValue(), b.doubleValue());
        }
        if (left instanceof Comparable comparable && left.getClass().isInstance(right)) {
            return comparable.compareTo(right);
        }
        return left.toString().compareTo(right.toString());
    }

    private static Map<String, Object> merge(Map<String, Object> base, Map<String, Object> changes) {
        Map<String, Object> merged = new LinkedHashMap<>(base);
        merged.putAll(changes);
        return merged;
    }

    private static Map<String, Object> withoutNulls(Map<String, Object> fields) {
        Map<String, Object> copy = new LinkedHashMap<>();
        fields.forEach((key, value) -> {
            if (value != null) {
                copy.put(key, value);
            }
        });
        return copy;
    }

    private final class DocumentSubscription implements SubscriptionHandle {

        private final DocumentPath path;
        private final DocumentListener listener;
        private final AtomicBoolean active = new AtomicBoolean(true);
        private long lastDeliveredVersion = -1;

        private DocumentSubscription(DocumentPath path, DocumentListener listener) {
            this.path = path;
            this.listener = listener;
        }

        private void deliver(Optional<StoredDocument> snapshot) {
            long version = snapshot.map(StoredDocument::getVersion).orElse(0L);
            if (!active.get() || version < lastDeliveredVersion) {
                return;
            }
            lastDeliveredVersion = version;
            try {
                listener.onChange(snapshot);
            } catch (RuntimeException e) {
                log.warn("Document listener failed: path={}, version={}", path, version, e);
                listener.onError(e);
            }
        }

        @Override
        public void cancel() {
            if (active.compareAndSet(true, false)) {
                documentSubscriptions.remove(this);
            }
        }

        @Override
        public boolean isActive() {
            return active.get();
        }
    }

    private final class QuerySubscription implements SubscriptionHandle {

        private final QuerySpec query;
        private final QueryListener listener;
        private final AtomicBoolean active = new AtomicBoolean(true);
        private long lastDeliveredSequence = -1;

        private QuerySubscription(QuerySpec query, QueryListener listener) {
            this.query = query;
            this.listener = listener;
        }

        private void deliver(List<StoredDocument> results, long sequence) {
            if (!active.get() || sequence < lastDeliveredSequence) {
                return;
            }
            lastDeliveredSequence = sequence;
            try {
                listener.onResults(results);
            } catch (RuntimeException e) {
                log.warn("Query listener failed: collection={}", query.getCollection(), e);
                listener.onError(e);
            }
        }

        @Override
        public void cancel() {
            if (active.compareAndSet(true, false)) {
                querySubscriptions.remove(this);
            }
        }

        @Override
        public boolean isActive() {
            return active.get();
        }
    }
}
