package org.dataapi.collections.bulk;

import java.util.List;

import lombok.Getter;

/**
 * Raised by a bulk write in which at least one operation was rejected. {@link #getPartialResult()} holds
 * every effect that was merged before the exception was raised.
 */
@Getter
public class BulkWriteException extends CumulativeOperationException {
    private final BulkWriteResult partialResult;

    public BulkWriteException(List<CommandFailure> failures, BulkWriteResult partialResult) {
        super("bulkWrite", failures);
        this.partialResult = partialResult;
    }
}
