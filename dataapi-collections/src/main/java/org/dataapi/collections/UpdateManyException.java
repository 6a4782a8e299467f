package org.dataapi.collections;

import java.util.List;

import org.dataapi.collections.bulk.CommandFailure;
import org.dataapi.collections.bulk.CumulativeOperationException;

import lombok.Getter;

/**
 * A page of an updateMany was rejected. The partial result counts every earlier page plus whatever the
 * rejected page reported.
 */
@Getter
public class UpdateManyException extends CumulativeOperationException {
    private final UpdateResult partialResult;

    public UpdateManyException(CommandFailure failure, UpdateResult partialResult) {
        super("updateMany", List.of(failure));
        this.partialResult = partialResult;
    }
}
