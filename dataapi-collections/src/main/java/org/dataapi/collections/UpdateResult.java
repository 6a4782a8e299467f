package org.dataapi.collections;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Outcome of an update or replace. {@code upsertedId} is null unless a document was inserted.
 */
public record UpdateResult(long matchedCount, long modifiedCount, JsonNode upsertedId) {
    public long upsertedCount() {
        return upsertedId != null ? 1 : 0;
    }
}
