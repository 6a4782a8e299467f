package org.dataapi.collections.cursor;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import org.dataapi.transport.CommandExecutor;
import org.dataapi.transport.CommandOptions;
import org.dataapi.transport.CommandResponse;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Lazily iterates the documents matching a query, one server page at a time.
 *
 * Nothing is sent until the first document is requested. The query (filter, sort, projection, limit, skip,
 * mapping) can only be changed while the cursor is {@link CursorState#UNINITIALIZED}; {@link #rewind()} and
 * {@link #clone()} produce a cursor in that state again. Once {@link CursorState#CLOSED} a cursor never
 * fetches again, but documents already buffered can still be drained with
 * {@link #readBufferedDocuments(int)}.
 *
 * Iteration closes the cursor when the documents run out. Leaving a for-each loop early does not, so a
 * later loop over the same cursor resumes where the first stopped; iterate inside try-with-resources, or
 * through {@link #stream()}, when an early exit must close it.
 *
 * Instances are not thread safe.
 *
 * @param <T> type of the documents after mapping; {@link ObjectNode} when no mapping is set
 */
@Slf4j
public class FindCursor<T> implements Iterable<T>, AutoCloseable {
    private final CommandExecutor executor;
    private final CommandOptions commandOptions;

    private ObjectNode filter;
    @Getter
    private FindOptions options;
    private Function<ObjectNode, ?> mapping;

    @Getter
    private CursorState state = CursorState.UNINITIALIZED;
    private final Deque<ObjectNode> buffer = new ArrayDeque<>();
    private JsonNode pageState;
    private int consumed;

    public FindCursor(CommandExecutor executor, CommandOptions commandOptions, ObjectNode filter, FindOptions options) {
        this.executor = executor;
        this.commandOptions = commandOptions;
        this.filter = filter != null ? filter.deepCopy() : JsonNodeFactory.instance.objectNode();
        this.options = validate(options != null ? options.copy() : FindOptions.DEFAULTS);
    }

    public String getNamespace() {
        return commandOptions.namespace();
    }

    public ObjectNode getFilter() {
        return filter.deepCopy();
    }

    public boolean isClosed() {
        return state == CursorState.CLOSED;
    }

    public int bufferedCount() {
        return buffer.size();
    }

    public FindCursor<T> filter(ObjectNode filter) {
        assertUninitialized("filter");
        this.filter = filter != null ? filter.deepCopy() : JsonNodeFactory.instance.objectNode();
        return this;
    }

    public FindCursor<T> sort(ObjectNode sort) {
        assertUninitialized("sort");
        options = options.toBuilder().sort(sort != null ? sort.deepCopy() : null).build();
        return this;
    }

    public FindCursor<T> project(ObjectNode projection) {
        assertUninitialized("project");
        options = options.toBuilder().projection(projection != null ? projection.deepCopy() : null).build();
        return this;
    }

    public FindCursor<T> limit(int limit) {
        assertUninitialized("limit");
        options = validate(options.toBuilder().limit(limit).build());
        return this;
    }

    public FindCursor<T> skip(int skip) {
        assertUninitialized("skip");
        options = validate(options.toBuilder().skip(skip).build());
        return this;
    }

    public FindCursor<T> includeSimilarity(boolean includeSimilarity) {
        assertUninitialized("includeSimilarity");
        options = options.toBuilder().includeSimilarity(includeSimilarity).build();
        return this;
    }

    /**
     * Applies {@code next} to every document after any mapping already set. Returns this cursor, re-typed.
     */
    @SuppressWarnings("unchecked")
    public <R> FindCursor<R> map(Function<? super T, ? extends R> next) {
        assertUninitialized("map");
        if (mapping == null) {
            mapping = (Function<ObjectNode, ?>) (Function<?, ?>) next;
        } else {
            mapping = ((Function<ObjectNode, T>) mapping).andThen(next);
        }
        return (FindCursor<R>) (FindCursor<?>) this;
    }

    /**
     * True if another document is available, fetching pages as needed. Never fetches once closed.
     */
    public boolean hasNext() {
        if (state == CursorState.CLOSED) {
            return false;
        }
        while (buffer.isEmpty() && hasMorePages()) {
            fetchNextPage();
        }
        return !buffer.isEmpty();
    }

    /**
     * The next document, or null once the query is exhausted, at which point the cursor closes.
     */
    public T next() {
        if (!hasNext()) {
            close();
            return null;
        }
        return pop();
    }

    /**
     * Drains every remaining document and closes the cursor. A second call returns an empty list.
     */
    public List<T> toArray() {
        var documents = new ArrayList<T>();
        try {
            while (hasNext()) {
                documents.add(pop());
            }
        } finally {
            close();
        }
        return documents;
    }

    @Override
    public void forEach(Consumer<? super T> action) {
        forEachWhile(document -> {
            action.accept(document);
            return true;
        });
    }

    /**
     * Feeds documents to {@code action} until it returns false or the query is exhausted, then closes.
     * Documents buffered but not handed out remain readable through {@link #readBufferedDocuments(int)}.
     */
    public void forEachWhile(Predicate<? super T> action) {
        try {
            while (hasNext()) {
                if (!action.test(pop())) {
                    break;
                }
            }
        } finally {
            close();
        }
    }

    @Override
    public Iterator<T> iterator() {
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                var more = FindCursor.this.hasNext();
                if (!more) {
                    close();
                }
                return more;
            }

            @Override
            public T next() {
                if (!FindCursor.this.hasNext()) {
                    close();
                    throw new NoSuchElementException("Cursor is exhausted");
                }
                return pop();
            }
        };
    }

    public Stream<T> stream() {
        return StreamSupport.stream(spliterator(), false).onClose(this::close);
    }

    /**
     * Removes and returns up to {@code max} buffered documents as the server sent them, without fetching and
     * without the mapping. Works in any state, including closed. Documents read this way count toward the
     * limit.
     */
    public List<ObjectNode> readBufferedDocuments(int max) {
        var documents = new ArrayList<ObjectNode>(Math.min(Math.max(max, 0), buffer.size()));
        while (documents.size() < max && !buffer.isEmpty()) {
            documents.add(buffer.poll());
            consumed++;
        }
        return documents;
    }

    public List<ObjectNode> readBufferedDocuments() {
        return readBufferedDocuments(buffer.size());
    }

    /**
     * Discards the buffer and fetch position so the same query runs again from the start.
     */
    public void rewind() {
        state = CursorState.UNINITIALIZED;
        buffer.clear();
        pageState = null;
        consumed = 0;
    }

    /**
     * An independent, unstarted cursor over the same query and mapping.
     */
    @Override
    public FindCursor<T> clone() {
        var copy = new FindCursor<T>(executor, commandOptions, filter, options);
        copy.mapping = mapping;
        return copy;
    }

    @Override
    public void close() {
        state = CursorState.CLOSED;
    }

    private boolean hasMorePages() {
        return state == CursorState.UNINITIALIZED || pageState != null;
    }

    @SuppressWarnings("unchecked")
    private T pop() {
        var document = buffer.poll();
        consumed++;
        if (mapping == null) {
            return (T) document;
        }
        try {
            return (T) mapping.apply(document);
        } catch (RuntimeException e) {
            close();
            throw e;
        }
    }

    private void fetchNextPage() {
        var command = buildFindCommand();
        state = CursorState.INITIALIZED;

        CommandResponse response;
        try {
            response = executor.execute(command, commandOptions).block();
        } catch (RuntimeException e) {
            close();
            throw e;
        }
        if (response == null) {
            pageState = null;
            return;
        }

        var documents = response.documents();
        pageState = response.nextPageState();
        if (options.getLimit() > 0) {
            var remaining = Math.max(options.getLimit() - consumed - buffer.size(), 0);
            if (documents.size() >= remaining) {
                documents = documents.subList(0, remaining);
                pageState = null;
            }
        }
        buffer.addAll(documents);

        log.atDebug().setMessage("Fetched page of {} documents from {}, more pages: {}")
            .addArgument(documents.size())
            .addArgument(commandOptions.collection())
            .addArgument(pageState != null)
            .log();
    }

    private ObjectNode buildFindCommand() {
        var body = JsonNodeFactory.instance.objectNode();
        body.set("filter", filter);
        if (options.getSort() != null) {
            body.set("sort", options.getSort());
        }
        if (options.getProjection() != null && !options.getProjection().isEmpty()) {
            body.set("projection", options.getProjection());
        }
        var findOptions = body.putObject("options");
        if (options.getSkip() != null) {
            findOptions.put("skip", options.getSkip());
        }
        if (options.isIncludeSimilarity()) {
            findOptions.put("includeSimilarity", true);
        }
        if (pageState != null) {
            findOptions.set("pagingState", pageState);
        }

        var command = JsonNodeFactory.instance.objectNode();
        command.set("find", body);
        return command;
    }

    private void assertUninitialized(String operation) {
        if (state != CursorState.UNINITIALIZED) {
            throw new CursorAlreadyInitializedException(operation);
        }
    }

    private static FindOptions validate(FindOptions options) {
        if (options.getLimit() < 0) {
            throw new IllegalArgumentException("limit cannot be negative, was " + options.getLimit());
        }
        if (options.getSkip() != null && options.getSkip() < 0) {
            throw new IllegalArgumentException("skip cannot be negative, was " + options.getSkip());
        }
        return options;
    }
}
