package org.dataapi.collections;

import org.dataapi.transport.DataApiException;

import lombok.Getter;

/**
 * More documents matched than countDocuments was allowed to count.
 */
@Getter
public class TooManyDocumentsToCountException extends DataApiException {
    private final long limit;
    private final boolean serverLimit;

    public TooManyDocumentsToCountException(long limit, boolean serverLimit) {
        super(serverLimit
            ? "Too many documents to count: the server stops counting at " + limit
            : "Too many documents to count: more than the upper bound of " + limit);
        this.limit = limit;
        this.serverLimit = serverLimit;
    }
}
