package org.dataapi.transport;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * A decoded Data API response. Either section may be absent; the accessors treat absent counters as zero
 * and absent values as null.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record CommandResponse(
    ObjectNode status,
    ObjectNode data,
    List<ErrorDescriptor> errors
) {
    public static CommandResponse ofStatus(ObjectNode status) {
        return new CommandResponse(status, null, null);
    }

    public static CommandResponse ofData(ObjectNode data) {
        return new CommandResponse(null, data, null);
    }

    public boolean hasErrors() {
        return errors != null && !errors.isEmpty();
    }

    public List<JsonNode> insertedIds() {
        var ids = new ArrayList<JsonNode>();
        var node = statusField("insertedIds");
        if (node != null && node.isArray()) {
            node.forEach(ids::add);
        }
        return ids;
    }

    public long matchedCount() {
        return statusLong("matchedCount");
    }

    public long modifiedCount() {
        return statusLong("modifiedCount");
    }

    public long deletedCount() {
        return statusLong("deletedCount");
    }

    public long count() {
        return statusLong("count");
    }

    public boolean moreData() {
        var node = statusField("moreData");
        return node != null && node.asBoolean();
    }

    public JsonNode upsertedId() {
        return statusField("upsertedId");
    }

    /**
     * Continuation token for the next page. Find-style commands report it under {@code data}, paged
     * mutations under {@code status}.
     */
    public JsonNode nextPageState() {
        var node = present(data != null ? data.get("nextPageState") : null);
        return node != null ? node : statusField("nextPageState");
    }

    public ObjectNode document() {
        var node = present(data != null ? data.get("document") : null);
        return node instanceof ObjectNode ? (ObjectNode) node : null;
    }

    public List<ObjectNode> documents() {
        var docs = new ArrayList<ObjectNode>();
        var node = data != null ? data.get("documents") : null;
        if (node != null && node.isArray()) {
            for (JsonNode doc : node) {
                if (doc instanceof ObjectNode) {
                    docs.add((ObjectNode) doc);
                }
            }
        }
        return docs;
    }

    private long statusLong(String field) {
        var node = statusField(field);
        return node != null ? node.asLong() : 0L;
    }

    private JsonNode statusField(String field) {
        return present(status != null ? status.get(field) : null);
    }

    private static JsonNode present(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode() ? null : node;
    }
}
