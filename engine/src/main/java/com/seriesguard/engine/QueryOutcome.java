package com.seriesguard.engine;

import com.seriesguard.detector.PatternResult;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of {@link PatternEngine#queryPattern}.
 */
public final class QueryOutcome {

    public enum Status {
        FOUND,
        RATE_LIMITED,
        /** The series has no window, or its detection could not be computed. */
        NOT_FOUND
    }

    private static final QueryOutcome RATE_LIMITED = new QueryOutcome(Status.RATE_LIMITED, null);
    private static final QueryOutcome NOT_FOUND = new QueryOutcome(Status.NOT_FOUND, null);

    private final Status status;
    private final PatternResult result;

    private QueryOutcome(Status status, PatternResult result) {
        this.status = status;
        this.result = result;
    }

    public static QueryOutcome found(PatternResult result) {
        return new QueryOutcome(Status.FOUND, Objects.requireNonNull(result, "result"));
    }

    public static QueryOutcome rateLimited() {
        return RATE_LIMITED;
    }

    public static QueryOutcome notFound() {
        return NOT_FOUND;
    }

    public Status getStatus() {
        return status;
    }

    /**
     * The detection result of a {@link Status#FOUND} outcome, empty otherwise.
     */
    public Optional<PatternResult> getResult() {
        return Optional.ofNullable(result);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        QueryOutcome that = (QueryOutcome) o;
        return status == that.status && Objects.equals(result, that.result);
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, result);
    }

    @Override
    public String toString() {
        return result == null ? status.name() : status + "(" + result + ")";
    }
}
