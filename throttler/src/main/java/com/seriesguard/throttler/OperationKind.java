package com.seriesguard.throttler;

/**
 * Kinds of operations that are rate limited independently of each other.
 */
public enum OperationKind {
    INGEST,
    QUERY
}
