package org.dataapi.collections.bulk;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * One mutation of a bulk write. Each kind validates its required fields when built and renders the single
 * command that performs it.
 */
public interface BulkWriteOperation {
    ObjectNode toCommand();

    static BulkWriteOperation insertOne(ObjectNode document) {
        return new InsertOne(document);
    }

    static BulkWriteOperation updateOne(ObjectNode filter, ObjectNode update, boolean upsert) {
        return new UpdateOne(filter, update, upsert);
    }

    static BulkWriteOperation updateMany(ObjectNode filter, ObjectNode update, boolean upsert) {
        return new UpdateMany(filter, update, upsert);
    }

    static BulkWriteOperation replaceOne(ObjectNode filter, ObjectNode replacement, boolean upsert) {
        return new ReplaceOne(filter, replacement, upsert);
    }

    static BulkWriteOperation deleteOne(ObjectNode filter) {
        return new DeleteOne(filter);
    }

    static BulkWriteOperation deleteMany(ObjectNode filter) {
        return new DeleteMany(filter);
    }

    record InsertOne(ObjectNode document) implements BulkWriteOperation {
        public InsertOne {
            document = required("insertOne", "document", document);
        }

        @Override
        public ObjectNode toCommand() {
            var body = JsonNodeFactory.instance.objectNode();
            body.set("document", document.deepCopy());
            return wrap("insertOne", body);
        }
    }

    record UpdateOne(ObjectNode filter, ObjectNode update, boolean upsert) implements BulkWriteOperation {
        public UpdateOne {
            filter = required("updateOne", "filter", filter);
            update = required("updateOne", "update", update);
        }

        @Override
        public ObjectNode toCommand() {
            return wrap("updateOne", updateBody(filter, "update", update, upsert));
        }
    }

    /** Sent as a single command; the server may stop short of every match, which is reported as is. */
    record UpdateMany(ObjectNode filter, ObjectNode update, boolean upsert) implements BulkWriteOperation {
        public UpdateMany {
            filter = required("updateMany", "filter", filter);
            update = required("updateMany", "update", update);
        }

        @Override
        public ObjectNode toCommand() {
            return wrap("updateMany", updateBody(filter, "update", update, upsert));
        }
    }

    record ReplaceOne(ObjectNode filter, ObjectNode replacement, boolean upsert) implements BulkWriteOperation {
        public ReplaceOne {
            filter = required("replaceOne", "filter", filter);
            replacement = required("replaceOne", "replacement", replacement);
        }

        @Override
        public ObjectNode toCommand() {
            return wrap("findOneAndReplace", updateBody(filter, "replacement", replacement, upsert));
        }
    }

    record DeleteOne(ObjectNode filter) implements BulkWriteOperation {
        public DeleteOne {
            filter = required("deleteOne", "filter", filter);
        }

        @Override
        public ObjectNode toCommand() {
            var body = JsonNodeFactory.instance.objectNode();
            body.set("filter", filter.deepCopy());
            return wrap("deleteOne", body);
        }
    }

    record DeleteMany(ObjectNode filter) implements BulkWriteOperation {
        public DeleteMany {
            filter = required("deleteMany", "filter", filter);
            if (filter.isEmpty()) {
                throw new IllegalArgumentException(
                    "deleteMany requires a non-empty filter; use deleteAll to remove every document");
            }
        }

        @Override
        public ObjectNode toCommand() {
            var body = JsonNodeFactory.instance.objectNode();
            body.set("filter", filter.deepCopy());
            return wrap("deleteMany", body);
        }
    }

    private static ObjectNode required(String operation, String field, ObjectNode value) {
        if (value == null) {
            throw new IllegalArgumentException(operation + " requires a " + field);
        }
        return value.deepCopy();
    }

    private static ObjectNode updateBody(ObjectNode filter, String field, JsonNode value, boolean upsert) {
        var body = JsonNodeFactory.instance.objectNode();
        body.set("filter", filter.deepCopy());
        body.set(field, value.deepCopy());
        body.putObject("options").put("upsert", upsert);
        return body;
    }

    private static ObjectNode wrap(String commandName, ObjectNode body) {
        var command = JsonNodeFactory.instance.objectNode();
        command.set(commandName, body);
        return command;
    }
}
