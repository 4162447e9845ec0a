package com.planit.gamification.store;

import java.util.Objects;

/**
 * Two-segment document address, {@code collection/id}.
 */
public final class DocumentPath {

    public static final String USERS = "users";
    public static final String LEADERBOARD = "leaderboard";

    private final String collection;
    private final String id;

    private DocumentPath(String collection, String id) {
        this.collection = collection;
        this.id = id;
    }

    public static DocumentPath of(String collection, String id) {
        if (collection == null || collection.isBlank() || id == null || id.isBlank()) {
            throw new IllegalArgumentException("Document path needs a collection and an id");
        }
        return new DocumentPath(collection, id);
    }

    public static DocumentPath parse(String path) {
        int slash = path.indexOf('/');
        if (slash <= 0 || slash != path.lastIndexOf('/')) {
            throw new IllegalArgumentException("Not a collection/id path: " + path);
        }
        return of(path.substring(0, slash), path.substring(slash + 1));
    }

    public static DocumentPath user(String userId) {
        return of(USERS, userId);
    }

    public static DocumentPath leaderboard(String documentId) {
        return of(LEADERBOARD, documentId);
    }

    public String collection() {
        return collection;
    }

    public String id() {
        return id;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DocumentPath that)) return false;
        return collection.equals(that.collection) && id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(collection, id);
    }

    @Override
    public String toString() {
        return collection + "/" + id;
    }
}
