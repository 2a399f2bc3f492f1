package com.seriesguard.throttler;

import javax.annotation.Nonnull;

/**
 * A contract for admission control. Each call either consumes one unit of the subject's budget
 * for the given kind of operation or is rejected.
 */
public interface AdmissionController {

    /**
     * Determines whether an operation of the subject may proceed.
     *
     * <p>This is a non-blocking call that returns immediately. A rejected operation consumes
     * nothing; the caller decides whether to retry later or fail fast.
     *
     * @param subject the client or series the budget belongs to
     * @param kind the kind of operation
     * @return {@code true} if the operation is admitted
     */
    boolean allow(@Nonnull String subject, @Nonnull OperationKind kind);

    /**
     * Drops the state of subjects that have been idle long enough to be back at full budget.
     *
     * @return the number of subjects dropped
     */
    int reapIdle();
}
