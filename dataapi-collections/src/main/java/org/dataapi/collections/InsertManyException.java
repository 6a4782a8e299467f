package org.dataapi.collections;

import java.util.List;

import org.dataapi.collections.bulk.CommandFailure;
import org.dataapi.collections.bulk.CumulativeOperationException;

import lombok.Getter;

/**
 * At least one chunk of an insertMany was rejected. Failure indexes are chunk positions.
 */
@Getter
public class InsertManyException extends CumulativeOperationException {
    private final InsertManyResult partialResult;

    public InsertManyException(List<CommandFailure> failures, InsertManyResult partialResult) {
        super("insertMany", failures);
        this.partialResult = partialResult;
    }
}
