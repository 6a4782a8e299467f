package org.dataapi.collections.bulk;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.dataapi.transport.CommandResponse;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.ToString;

/**
 * Totals of a bulk write. Raw responses are kept in the order they were merged, which is completion order
 * for unordered runs.
 */
@ToString
public class BulkWriteResult implements ResultAccumulator {
    private long insertedCount;
    private long matchedCount;
    private long modifiedCount;
    private long deletedCount;
    private long upsertedCount;
    private final Map<Integer, JsonNode> upsertedIds = new TreeMap<>();
    @ToString.Exclude
    private final List<CommandResponse> rawResponses = new ArrayList<>();

    @Override
    public synchronized void merge(int index, CommandResponse response) {
        insertedCount += response.insertedIds().size();
        matchedCount += response.matchedCount();
        modifiedCount += response.modifiedCount();
        deletedCount += response.deletedCount();

        var upsertedId = response.upsertedId();
        if (upsertedId != null) {
            upsertedCount++;
            upsertedIds.put(index, upsertedId);
        }
        rawResponses.add(response);
    }

    public synchronized long getInsertedCount() {
        return insertedCount;
    }

    public synchronized long getMatchedCount() {
        return matchedCount;
    }

    public synchronized long getModifiedCount() {
        return modifiedCount;
    }

    public synchronized long getDeletedCount() {
        return deletedCount;
    }

    public synchronized long getUpsertedCount() {
        return upsertedCount;
    }

    /** Upserted ids keyed by the index of the operation that produced them. */
    public synchronized Map<Integer, JsonNode> getUpsertedIds() {
        return Collections.unmodifiableMap(new TreeMap<>(upsertedIds));
    }

    public synchronized JsonNode getUpsertedIdAt(int index) {
        return upsertedIds.get(index);
    }

    public synchronized List<CommandResponse> getRawResponses() {
        return List.copyOf(rawResponses);
    }
}
