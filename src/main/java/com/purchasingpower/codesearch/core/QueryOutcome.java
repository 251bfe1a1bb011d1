package com.purchasingpower.codesearch.core;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Typed result of a query: a status, the value when the status is {@link QueryStatus#OK},
 * and a human readable message otherwise.
 *
 * @param <T> payload type
 * @since 1.0.0
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class QueryOutcome<T> {

    QueryStatus status;
    T value;
    String message;

    public static <T> QueryOutcome<T> ok(T value) {
        return new QueryOutcome<>(QueryStatus.OK, value, null);
    }

    public static <T> QueryOutcome<T> notFound(String message) {
        return new QueryOutcome<>(QueryStatus.NOT_FOUND, null, message);
    }

    public static <T> QueryOutcome<T> indexNotBuilt() {
        return new QueryOutcome<>(QueryStatus.INDEX_NOT_BUILT, null,
            "Index not built. Call index first.");
    }

    public boolean isOk() {
        return status == QueryStatus.OK;
    }
}
