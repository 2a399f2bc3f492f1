package com.seriesguard.engine;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of {@link PatternEngine#ingestObservation}. Never thrown; every call ends in one of the
 * three statuses.
 */
public final class IngestOutcome {

    public enum Status {
        ACCEPTED,
        REJECTED,
        /** Admission was denied; retrying later may succeed. */
        RATE_LIMITED
    }

    public enum RejectReason {
        /** The timestamp precedes the last accepted timestamp of the series. */
        OUT_OF_ORDER,
        INVALID_SERIES_KEY,
        INVALID_CLIENT,
        /** The value is NaN or infinite. */
        INVALID_VALUE
    }

    private static final IngestOutcome ACCEPTED = new IngestOutcome(Status.ACCEPTED, null);
    private static final IngestOutcome RATE_LIMITED = new IngestOutcome(Status.RATE_LIMITED, null);

    private final Status status;
    private final RejectReason reason;

    private IngestOutcome(Status status, RejectReason reason) {
        this.status = status;
        this.reason = reason;
    }

    public static IngestOutcome accepted() {
        return ACCEPTED;
    }

    public static IngestOutcome rateLimited() {
        return RATE_LIMITED;
    }

    public static IngestOutcome rejected(RejectReason reason) {
        return new IngestOutcome(Status.REJECTED, Objects.requireNonNull(reason, "reason"));
    }

    public Status getStatus() {
        return status;
    }

    public boolean isAccepted() {
        return status == Status.ACCEPTED;
    }

    /**
     * The reason of a {@link Status#REJECTED} outcome, empty otherwise.
     */
    public Optional<RejectReason> getReason() {
        return Optional.ofNullable(reason);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        IngestOutcome that = (IngestOutcome) o;
        return status == that.status && reason == that.reason;
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, reason);
    }

    @Override
    public String toString() {
        return reason == null ? status.name() : status + "(" + reason + ")";
    }
}
