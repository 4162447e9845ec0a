package com.planit.gamification.store;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.util.List;

/**
 * Collection query: conjunction of filters, optional single-field ordering and limit.
 */
@Getter
@Builder
@ToString
public final class QuerySpec {

    private final String collection;

    @Singular
    private final List<Filter> filters;

    private final String orderBy;

    private final boolean descending;

    /** Zero or negative means unbounded. */
    private final int limit;

    public boolean hasLimit() {
        return limit > 0;
    }
}
