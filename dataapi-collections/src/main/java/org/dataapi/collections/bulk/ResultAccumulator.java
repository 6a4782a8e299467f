package org.dataapi.collections.bulk;

import org.dataapi.transport.CommandResponse;

/**
 * Mutable aggregate that a run of commands folds its responses into. Implementations must tolerate
 * concurrent calls to {@link #merge}.
 */
public interface ResultAccumulator {
    /**
     * @param index    position of the operation in the caller's input, never a chunk-local position
     * @param response a successful response, or the response of a rejected command that may report a
     *                 partial effect
     */
    void merge(int index, CommandResponse response);
}
