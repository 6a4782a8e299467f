package org.dataapi.collections;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import org.dataapi.collections.bulk.BulkWriteException;
import org.dataapi.collections.bulk.BulkWriteOperation;
import org.dataapi.collections.bulk.BulkWriteOptions;
import org.dataapi.collections.bulk.BulkWriteResult;
import org.dataapi.collections.bulk.CommandFailure;
import org.dataapi.collections.bulk.MutationOrchestrator;
import org.dataapi.collections.cursor.FindCursor;
import org.dataapi.collections.cursor.FindOptions;
import org.dataapi.collections.paths.DistinctPathExtractor;
import org.dataapi.transport.CommandExecutor;
import org.dataapi.transport.CommandOptions;
import org.dataapi.transport.CommandResponse;
import org.dataapi.transport.DataApiResponseException;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * A collection of JSON documents in one namespace. Blocking methods wait for their async counterparts;
 * every call addresses the service through the given {@link CommandExecutor}.
 */
@Slf4j
public class Collection {
    @Getter
    private final String namespace;
    @Getter
    private final String name;
    private final CommandExecutor executor;
    private final CommandOptions commandOptions;
    private final MutationOrchestrator orchestrator;

    public Collection(CommandExecutor executor, String namespace, String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Collection name cannot be empty");
        }
        this.executor = executor;
        this.namespace = namespace;
        this.name = name;
        this.commandOptions = CommandOptions.forCollection(namespace, name);
        this.orchestrator = new MutationOrchestrator(executor);
    }

    private Collection(CommandExecutor executor, CommandOptions commandOptions, String namespace, String name) {
        this.executor = executor;
        this.namespace = namespace;
        this.name = name;
        this.commandOptions = commandOptions;
        this.orchestrator = new MutationOrchestrator(executor);
    }

    public InsertOneResult insertOne(ObjectNode document) {
        var body = JsonNodeFactory.instance.objectNode();
        body.set("document", requireDocument(document, "document"));
        var response = run(command("insertOne", body));
        var ids = response.insertedIds();
        return new InsertOneResult(ids.isEmpty() ? null : ids.get(0));
    }

    public InsertManyResult insertMany(List<ObjectNode> documents) {
        return insertMany(documents, InsertManyOptions.builder().build());
    }

    public InsertManyResult insertMany(List<ObjectNode> documents, InsertManyOptions options) {
        return insertManyAsync(documents, options).block();
    }

    /**
     * Inserts {@code documents} in chunks of {@link InsertManyOptions#getChunkSize()}, one command per chunk.
     */
    public Mono<InsertManyResult> insertManyAsync(List<ObjectNode> documents, InsertManyOptions options) {
        if (options.getChunkSize() < 1) {
            return Mono.error(new IllegalArgumentException("chunkSize must be at least 1, was " + options.getChunkSize()));
        }
        var commands = new ArrayList<ObjectNode>();
        for (int start = 0; start < documents.size(); start += options.getChunkSize()) {
            var chunk = documents.subList(start, Math.min(start + options.getChunkSize(), documents.size()));
            var body = JsonNodeFactory.instance.objectNode();
            var array = body.putArray("documents");
            chunk.forEach(doc -> array.add(requireDocument(doc, "document")));
            body.putObject("options").put("ordered", options.isOrdered());
            commands.add(command("insertMany", body));
        }
        log.info("Inserting {} documents into {} in {} chunks, ordered: {}",
            documents.size(), name, commands.size(), options.isOrdered());

        var callOptions = commandOptions.withTimeout(options.getTimeout());
        return options.isOrdered()
            ? orchestrator.executeOrdered(commands, new InsertManyResult(), callOptions, InsertManyException::new)
            : orchestrator.executeUnordered(commands, new InsertManyResult(), options.getConcurrency(),
                callOptions, InsertManyException::new);
    }

    public UpdateResult updateOne(ObjectNode filter, ObjectNode update, boolean upsert) {
        var response = run(command("updateOne", updateBody(filter, "update", update, upsert)));
        return toUpdateResult(response);
    }

    /**
     * Replaces the first match, preserving its id.
     */
    public UpdateResult replaceOne(ObjectNode filter, ObjectNode replacement, boolean upsert) {
        var body = updateBody(filter, "replacement", replacement, upsert);
        ((ObjectNode) body.get("options")).put("returnDocument", ReturnDocument.BEFORE.wireValue());
        return toUpdateResult(run(command("findOneAndReplace", body)));
    }

    /**
     * Updates every match. The service updates a bounded number of documents per command, so the command is
     * repeated with the returned page state until none is returned.
     */
    public UpdateResult updateMany(ObjectNode filter, ObjectNode update, boolean upsert) {
        var body = updateBody(filter, "update", update, upsert);
        var pageOptions = (ObjectNode) body.get("options");
        var command = command("updateMany", body);

        long matched = 0;
        long modified = 0;
        JsonNode upsertedId = null;
        JsonNode nextPageState;
        do {
            CommandResponse response;
            try {
                response = run(command);
            } catch (DataApiResponseException e) {
                var failure = CommandFailure.rejected(0, command.deepCopy(), e);
                var raw = failure.rawResponse();
                if (raw != null) {
                    matched += raw.matchedCount();
                    modified += raw.modifiedCount();
                }
                throw new UpdateManyException(failure, new UpdateResult(matched, modified, upsertedId));
            }
            matched += response.matchedCount();
            modified += response.modifiedCount();
            if (response.upsertedId() != null) {
                upsertedId = response.upsertedId();
            }
            nextPageState = response.nextPageState();
            if (nextPageState != null) {
                pageOptions.set("pagingState", nextPageState);
            }
        } while (nextPageState != null);
        return new UpdateResult(matched, modified, upsertedId);
    }

    public DeleteResult deleteOne(ObjectNode filter) {
        var body = JsonNodeFactory.instance.objectNode();
        body.set("filter", requireDocument(filter, "filter"));
        return new DeleteResult(run(command("deleteOne", body)).deletedCount());
    }

    /**
     * Deletes every match, repeating the command while the service reports more matching documents.
     *
     * @throws IllegalArgumentException for an empty filter; use {@link #deleteAll()} to clear the collection
     */
    public DeleteResult deleteMany(ObjectNode filter) {
        if (filter == null || filter.isEmpty()) {
            throw new IllegalArgumentException(
                "deleteMany requires a non-empty filter; use deleteAll to remove every document");
        }
        var body = JsonNodeFactory.instance.objectNode();
        body.set("filter", filter.deepCopy());
        var command = command("deleteMany", body);

        long deleted = 0;
        boolean moreData;
        do {
            CommandResponse response;
            try {
                response = run(command);
            } catch (DataApiResponseException e) {
                var failure = CommandFailure.rejected(0, command, e);
                if (failure.rawResponse() != null) {
                    deleted += failure.rawResponse().deletedCount();
                }
                throw new DeleteManyException(failure, new DeleteResult(deleted));
            }
            deleted += response.deletedCount();
            moreData = response.moreData();
        } while (moreData);
        return new DeleteResult(deleted);
    }

    /**
     * Removes every document with a single command.
     */
    public void deleteAll() {
        var body = JsonNodeFactory.instance.objectNode();
        body.putObject("filter");
        run(command("deleteMany", body));
    }

    public FindCursor<ObjectNode> find(ObjectNode filter) {
        return find(filter, FindOptions.DEFAULTS);
    }

    public FindCursor<ObjectNode> find(ObjectNode filter, FindOptions options) {
        return new FindCursor<>(executor, commandOptions, filter, options);
    }

    public Optional<ObjectNode> findOne(ObjectNode filter) {
        return findOne(filter, FindOptions.DEFAULTS);
    }

    public Optional<ObjectNode> findOne(ObjectNode filter, FindOptions options) {
        var body = JsonNodeFactory.instance.objectNode();
        body.set("filter", filter != null ? filter.deepCopy() : JsonNodeFactory.instance.objectNode());
        if (options.getSort() != null) {
            body.set("sort", options.getSort().deepCopy());
        }
        if (options.getProjection() != null) {
            body.set("projection", options.getProjection().deepCopy());
        }
        if (options.isIncludeSimilarity()) {
            body.putObject("options").put("includeSimilarity", true);
        }
        return Optional.ofNullable(run(command("findOne", body)).document());
    }

    public Optional<ObjectNode> findOneAndUpdate(
        ObjectNode filter,
        ObjectNode update,
        ReturnDocument returnDocument,
        boolean upsert
    ) {
        var body = updateBody(filter, "update", update, upsert);
        ((ObjectNode) body.get("options")).put("returnDocument", returnDocument.wireValue());
        return Optional.ofNullable(run(command("findOneAndUpdate", body)).document());
    }

    public Optional<ObjectNode> findOneAndReplace(
        ObjectNode filter,
        ObjectNode replacement,
        ReturnDocument returnDocument,
        boolean upsert
    ) {
        var body = updateBody(filter, "replacement", replacement, upsert);
        ((ObjectNode) body.get("options")).put("returnDocument", returnDocument.wireValue());
        return Optional.ofNullable(run(command("findOneAndReplace", body)).document());
    }

    public Optional<ObjectNode> findOneAndDelete(ObjectNode filter) {
        var body = JsonNodeFactory.instance.objectNode();
        body.set("filter", requireDocument(filter, "filter"));
        return Optional.ofNullable(run(command("findOneAndDelete", body)).document());
    }

    /**
     * Distinct values reached by {@code path} across the matching documents, in first-seen order. Objects
     * and arrays are compared structurally.
     *
     * @throws IllegalArgumentException if the path is empty or has an empty segment
     */
    public List<JsonNode> distinct(String path, ObjectNode filter) {
        var extractor = DistinctPathExtractor.forPath(path);
        var projection = JsonNodeFactory.instance.objectNode();
        projection.put("_id", 0);
        projection.put(extractor.projectionPath(), 1);

        var values = new LinkedHashSet<JsonNode>();
        try (var cursor = find(filter, FindOptions.builder().projection(projection).build())) {
            cursor.forEach(document -> values.addAll(extractor.extract(document)));
        }
        return new ArrayList<>(values);
    }

    /**
     * Counts the matching documents, failing rather than returning a count above {@code upperBound}.
     *
     * @throws TooManyDocumentsToCountException if more than {@code upperBound} documents match, or more than
     *                                          the service is willing to count
     */
    public long countDocuments(ObjectNode filter, int upperBound) {
        if (upperBound <= 0) {
            throw new IllegalArgumentException("upperBound must be positive, was " + upperBound);
        }
        var body = JsonNodeFactory.instance.objectNode();
        body.set("filter", filter != null ? filter.deepCopy() : JsonNodeFactory.instance.objectNode());
        var response = run(command("countDocuments", body));
        if (response.moreData()) {
            throw new TooManyDocumentsToCountException(response.count(), true);
        }
        if (response.count() > upperBound) {
            throw new TooManyDocumentsToCountException(upperBound, false);
        }
        return response.count();
    }

    public BulkWriteResult bulkWrite(List<BulkWriteOperation> operations) {
        return bulkWrite(operations, BulkWriteOptions.builder().build());
    }

    public BulkWriteResult bulkWrite(List<BulkWriteOperation> operations, BulkWriteOptions options) {
        return bulkWriteAsync(operations, options).block();
    }

    /**
     * Runs each operation as its own command. Upserted ids are reported under the index of the operation
     * that produced them.
     *
     * @see MutationOrchestrator
     */
    public Mono<BulkWriteResult> bulkWriteAsync(List<BulkWriteOperation> operations, BulkWriteOptions options) {
        var commands = operations.stream()
            .map(BulkWriteOperation::toCommand)
            .collect(Collectors.toList());
        log.info("Starting bulk write of {} operations on {}, ordered: {}, concurrency: {}",
            commands.size(), name, options.isOrdered(), options.getConcurrency());

        var callOptions = commandOptions.withTimeout(options.getTimeout());
        return options.isOrdered()
            ? orchestrator.executeOrdered(commands, new BulkWriteResult(), callOptions, BulkWriteException::new)
            : orchestrator.executeUnordered(commands, new BulkWriteResult(), options.getConcurrency(),
                callOptions, BulkWriteException::new);
    }

    /** Waits at most {@code timeout} for each command of subsequent calls on the returned collection. */
    public Collection withTimeout(Duration timeout) {
        return new Collection(executor, commandOptions.withTimeout(timeout), namespace, name);
    }

    private CommandResponse run(ObjectNode command) {
        log.atDebug().setMessage("Sending {} to {}")
            .addArgument(() -> CommandExecutor.commandName(command))
            .addArgument(name)
            .log();
        return executor.execute(command, commandOptions).block();
    }

    private static UpdateResult toUpdateResult(CommandResponse response) {
        return new UpdateResult(response.matchedCount(), response.modifiedCount(), response.upsertedId());
    }

    private static ObjectNode updateBody(ObjectNode filter, String field, ObjectNode value, boolean upsert) {
        var body = JsonNodeFactory.instance.objectNode();
        body.set("filter", requireDocument(filter, "filter"));
        body.set(field, requireDocument(value, field));
        body.putObject("options").put("upsert", upsert);
        return body;
    }

    private static ObjectNode requireDocument(ObjectNode value, String field) {
        if (value == null) {
            throw new IllegalArgumentException(field + " cannot be null");
        }
        return value.deepCopy();
    }

    private static ObjectNode command(String commandName, ObjectNode body) {
        var command = JsonNodeFactory.instance.objectNode();
        command.set(commandName, body);
        return command;
    }
}
