package com.verdictrag.dto.response;

import java.util.Objects;

/**
 * Either a {@link QueryResult} or a {@link QueryFailure}, never both.
 */
public final class QueryOutcome {

    private final QueryResult result;
    private final QueryFailure failure;

    private QueryOutcome(QueryResult result, QueryFailure failure) {
        this.result = result;
        this.failure = failure;
    }

    public static QueryOutcome success(QueryResult result) {
        return new QueryOutcome(Objects.requireNonNull(result), null);
    }

    public static QueryOutcome failure(QueryFailure failure) {
        return new QueryOutcome(null, Objects.requireNonNull(failure));
    }

    public boolean isSuccess() {
        return result != null;
    }

    public QueryResult getResult() {
        if (result == null) {
            throw new IllegalStateException("Query failed: " + failure.getMessage());
        }
        return result;
    }

    public QueryFailure getFailure() {
        if (failure == null) {
            throw new IllegalStateException("Query succeeded");
        }
        return failure;
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "QueryOutcome[success, unsupported=" + result.isUnsupported() + "]"
                : "QueryOutcome[failure=" + failure.getType() + "]";
    }
}
