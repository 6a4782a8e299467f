package org.dataapi.collections;

import java.time.Duration;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class InsertManyOptions {
    public static final int DEFAULT_CHUNK_SIZE = 20;
    public static final int DEFAULT_CONCURRENCY = 8;

    boolean ordered;

    @Builder.Default
    int concurrency = DEFAULT_CONCURRENCY;

    /** Documents per insertMany command. The service accepts at most 20. */
    @Builder.Default
    int chunkSize = DEFAULT_CHUNK_SIZE;

    Duration timeout;
}
