package com.planit.gamification.store;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Remote document store consumed by the ledger.
 *
 * <p>Writes are atomic per document. Every successful write bumps the document version by
 * one. All methods block on I/O and throw {@link StoreUnavailableException} when the store
 * cannot be reached.
 */
public interface DocumentStore {

    Optional<StoredDocument> get(DocumentPath path);

    /**
     * Full overwrite, creating the document if needed.
     */
    StoredDocument set(DocumentPath path, Map<String, Object> fields);

    /**
     * Merges the given fields into an existing document.
     *
     * @throws DocumentNotFoundException if the document does not exist
     */
    StoredDocument updateFields(DocumentPath path, Map<String, Object> fields);

    /**
     * Adds {@code value} to an array field unless an equal element is already present.
     */
    StoredDocument appendToArrayField(DocumentPath path, String field, Object value);

    /**
     * Merges {@code fields} into the document only if its current version equals
     * {@code expectedVersion}. An expected version of {@code 0} means "create, must not exist".
     *
     * @return the new document, or empty if the version did not match
     */
    Optional<StoredDocument> compareAndSet(DocumentPath path, Map<String, Object> fields, long expectedVersion);

    List<StoredDocument> query(QuerySpec query);

    SubscriptionHandle subscribe(DocumentPath path, DocumentListener listener);

    SubscriptionHandle subscribeQuery(QuerySpec query, QueryListener listener);
}
