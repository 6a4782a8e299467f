package org.dataapi.collections;

import java.util.ArrayList;
import java.util.List;

import org.dataapi.collections.bulk.ResultAccumulator;
import org.dataapi.transport.CommandResponse;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.ToString;

/**
 * Ids of the inserted documents, in the order their chunks completed.
 */
@ToString
public class InsertManyResult implements ResultAccumulator {
    private final List<JsonNode> insertedIds = new ArrayList<>();

    @Override
    public synchronized void merge(int index, CommandResponse response) {
        insertedIds.addAll(response.insertedIds());
    }

    public synchronized List<JsonNode> getInsertedIds() {
        return List.copyOf(insertedIds);
    }

    public synchronized int getInsertedCount() {
        return insertedIds.size();
    }
}
