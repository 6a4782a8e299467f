package org.dataapi.collections;

import java.util.List;

import org.dataapi.collections.bulk.CommandFailure;
import org.dataapi.collections.bulk.CumulativeOperationException;

import lombok.Getter;

@Getter
public class DeleteManyException extends CumulativeOperationException {
    private final DeleteResult partialResult;

    public DeleteManyException(CommandFailure failure, DeleteResult partialResult) {
        super("deleteMany", List.of(failure));
        this.partialResult = partialResult;
    }
}
