package org.dataapi.collections.bulk;

import java.util.List;

import org.dataapi.transport.DataApiResponseException;

import lombok.Getter;

/**
 * A multi-command operation failed part way. Subclasses expose the result accumulated up to (and
 * including any partial effect of) the failures, so callers can retry only what failed.
 */
@Getter
public abstract class CumulativeOperationException extends DataApiResponseException {
    private final List<CommandFailure> failures;

    protected CumulativeOperationException(String operation, List<CommandFailure> failures) {
        super(messageFor(operation, failures), CommandFailure.describe(failures));
        this.failures = List.copyOf(failures);
    }

    private static String messageFor(String operation, List<CommandFailure> failures) {
        var first = failures.get(0);
        var cause = first.cause() != null ? first.cause().getMessage() : "unknown error";
        return failures.size() == 1
            ? operation + " failed at operation " + first.index() + ": " + cause
            : operation + " failed for " + failures.size() + " operations, first at operation "
                + first.index() + ": " + cause;
    }
}
