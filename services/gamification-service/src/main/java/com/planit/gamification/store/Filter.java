package com.planit.gamification.store;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.Collection;
import java.util.List;

/**
 * One query predicate. {@link #DOCUMENT_ID} addresses the document id instead of a field.
 */
@Getter
@AllArgsConstructor
@ToString
public final class Filter {

    public static final String DOCUMENT_ID = "__id__";

    public enum Operator {
        EQUAL_TO,
        IN,
        GREATER_THAN_OR_EQUAL,
        LESS_THAN
    }

    private final String field;
    private final Operator operator;
    private final Object value;

    public static Filter equalTo(String field, Object value) {
        return new Filter(field, Operator.EQUAL_TO, value);
    }

    public static Filter in(String field, Collection<?> values) {
        return new Filter(field, Operator.IN, List.copyOf(values));
    }

    public static Filter documentIdIn(Collection<String> ids) {
        return in(DOCUMENT_ID, ids);
    }

    public static Filter greaterThanOrEqual(String field, Object value) {
        return new Filter(field, Operator.GREATER_THAN_OR_EQUAL, value);
    }

    public static Filter lessThan(String field, Object value) {
        return new Filter(field, Operator.LESS_THAN, value);
    }

    public Collection<?> values() {
        return (Collection<?>) value;
    }
}
