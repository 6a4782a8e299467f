package org.dataapi.collections.bulk;

import java.time.Duration;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class BulkWriteOptions {
    public static final int DEFAULT_CONCURRENCY = 8;

    /** Run operations one at a time in input order, stopping at the first failure. */
    boolean ordered;

    /** Operations in flight at once when unordered. */
    @Builder.Default
    int concurrency = DEFAULT_CONCURRENCY;

    /** Per-command timeout, null for the executor's default. */
    Duration timeout;
}
