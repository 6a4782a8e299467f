package org.dataapi.collections.cursor;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.stream.Collectors;

import org.dataapi.collections.InMemoryCommandExecutor;
import org.dataapi.transport.CommandOptions;
import org.dataapi.transport.CommandResponse;
import org.dataapi.transport.DataApiHttpException;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import static org.dataapi.collections.TestDocuments.json;
import static org.dataapi.collections.TestDocuments.numbered;
import static org.junit.jupiter.api.Assertions.*;

class FindCursorTest {
    private static final CommandOptions TARGET = CommandOptions.forCollection("ks", "docs");

    private InMemoryCommandExecutor executor;

    @BeforeEach
    void setUp() {
        executor = new InMemoryCommandExecutor();
    }

    private FindCursor<ObjectNode> cursor(int documentCount) {
        return cursor(documentCount, FindOptions.DEFAULTS);
    }

    private FindCursor<ObjectNode> cursor(int documentCount, FindOptions options) {
        executor.seed(numbered(documentCount));
        return new FindCursor<>(executor, TARGET, json("{}"), options);
    }

    private static List<Integer> ids(List<ObjectNode> documents) {
        return documents.stream().map(doc -> doc.get("_id").asInt()).collect(Collectors.toList());
    }

    @Test
    void sendsNothingUntilFirstDocumentIsRequested() {
        var cursor = cursor(5);

        assertEquals(CursorState.UNINITIALIZED, cursor.getState());
        assertEquals("ks", cursor.getNamespace());
        assertEquals(0, cursor.bufferedCount());
        assertTrue(executor.getReceivedCommands().isEmpty());

        assertEquals(0, cursor.next().get("_id").asInt());
        assertEquals(CursorState.INITIALIZED, cursor.getState());
        assertEquals(4, cursor.bufferedCount());
        assertEquals(List.of("find"), executor.receivedCommandNames());
    }

    @Test
    void fetchesOnePageAtATime() {
        var cursor = cursor(45);

        cursor.next();
        assertEquals(19, cursor.bufferedCount());
        assertEquals(1, executor.getReceivedCommands().size());

        var rest = cursor.toArray();
        assertEquals(44, rest.size());
        assertEquals(3, executor.getReceivedCommands().size());

        var secondPage = executor.getReceivedCommands().get(1);
        assertEquals("20", secondPage.at("/find/options/pagingState").asText());
        assertTrue(executor.getReceivedCommands().get(0).at("/find/options/pagingState").isMissingNode());
    }

    @Test
    void nextReturnsNullOnceExhaustedAndCloses() {
        var cursor = cursor(3);

        assertNotNull(cursor.next());
        assertNotNull(cursor.next());
        assertNotNull(cursor.next());
        assertNull(cursor.next());
        assertTrue(cursor.isClosed());
        assertFalse(cursor.hasNext());
        assertNull(cursor.next());
        assertEquals(1, executor.getReceivedCommands().size());
    }

    @Test
    void emptyResultClosesAfterOneFetch() {
        var cursor = cursor(0);

        assertFalse(cursor.hasNext());
        assertNull(cursor.next());
        assertTrue(cursor.isClosed());
        assertEquals(1, executor.getReceivedCommands().size());
    }

    @Test
    void toArrayTwiceYieldsNothingTheSecondTimeUntilRewound() {
        var cursor = cursor(25);

        assertEquals(25, cursor.toArray().size());
        assertTrue(cursor.isClosed());
        assertEquals(0, cursor.bufferedCount());
        assertEquals(List.of(), cursor.toArray());

        cursor.rewind();
        assertEquals(CursorState.UNINITIALIZED, cursor.getState());
        assertEquals(ids(numbered(25)), ids(cursor.toArray()));
    }

    @Test
    void limitIsEnforcedAcrossPagesWithoutBeingSent() {
        var cursor = cursor(100, FindOptions.builder().limit(50).build());

        var documents = cursor.toArray();

        assertEquals(50, documents.size());
        assertEquals(49, documents.get(49).get("_id").asInt());
        assertEquals(3, executor.getReceivedCommands().size());
        executor.getReceivedCommands().forEach(command -> assertFalse(command.at("/find/options").has("limit")));
    }

    @Test
    void limitOnPageBoundaryStopsFetching() {
        var cursor = cursor(100).limit(20);

        assertEquals(20, cursor.toArray().size());
        assertEquals(1, executor.getReceivedCommands().size());
    }

    @Test
    void zeroLimitMeansUnlimited() {
        assertEquals(100, cursor(100, FindOptions.builder().limit(0).build()).toArray().size());
    }

    @Test
    void skipIsSentAndHonored() {
        var cursor = cursor(30).skip(5);

        var documents = cursor.toArray();

        assertEquals(25, documents.size());
        assertEquals(5, documents.get(0).get("_id").asInt());
        assertEquals(5, executor.getReceivedCommands().get(0).at("/find/options/skip").asInt());
    }

    @Test
    void sortAndProjectionAreSent() {
        var cursor = cursor(30)
            .sort(json("{'n':-1}"))
            .project(json("{'n':0}"));

        var first = cursor.next();

        assertEquals(29, first.get("_id").asInt());
        assertFalse(first.has("n"));
        var sent = executor.getReceivedCommands().get(0);
        assertEquals(json("{'n':-1}"), sent.at("/find/sort"));
        assertEquals(json("{'n':0}"), sent.at("/find/projection"));
    }

    @Test
    void includeSimilarityIsSentOnlyWhenSet() {
        cursor(1).includeSimilarity(true).toArray();
        new FindCursor<>(executor, TARGET, json("{}"), FindOptions.DEFAULTS).toArray();

        assertTrue(executor.getReceivedCommands().get(0).at("/find/options/includeSimilarity").asBoolean());
        assertTrue(executor.getReceivedCommands().get(1).at("/find/options/includeSimilarity").isMissingNode());
    }

    @Test
    void filterIsApplied() {
        executor.seed(List.of(json("{'_id':'a','kind':'x'}"), json("{'_id':'b','kind':'y'}")));
        var cursor = new FindCursor<ObjectNode>(executor, TARGET, json("{}"), FindOptions.DEFAULTS)
            .filter(json("{'kind':'y'}"));

        assertEquals(List.of("b"), cursor.toArray().stream().map(d -> d.get("_id").asText()).collect(Collectors.toList()));
    }

    @Test
    void queryCannotChangeOnceStarted() {
        var cursor = cursor(5);
        cursor.next();

        assertThrows(CursorAlreadyInitializedException.class, () -> cursor.filter(json("{}")));
        assertThrows(CursorAlreadyInitializedException.class, () -> cursor.sort(json("{'n':1}")));
        assertThrows(CursorAlreadyInitializedException.class, () -> cursor.project(json("{'n':1}")));
        assertThrows(CursorAlreadyInitializedException.class, () -> cursor.limit(1));
        assertThrows(CursorAlreadyInitializedException.class, () -> cursor.skip(1));
        assertThrows(CursorAlreadyInitializedException.class, () -> cursor.map(doc -> doc));

        cursor.close();
        assertThrows(CursorAlreadyInitializedException.class, () -> cursor.limit(1));

        cursor.rewind();
        assertDoesNotThrow(() -> cursor.limit(1));
    }

    @Test
    void negativeLimitOrSkipIsRejected() {
        var cursor = cursor(1);

        assertThrows(IllegalArgumentException.class, () -> cursor.limit(-1));
        assertThrows(IllegalArgumentException.class, () -> cursor.skip(-1));
    }

    @Test
    void cloneIsIndependentAndUnstarted() {
        var original = cursor(30).map(doc -> doc.get("n").asInt());
        assertEquals(0, original.next());
        assertEquals(1, original.next());

        var copy = original.clone();

        assertEquals(CursorState.UNINITIALIZED, copy.getState());
        assertEquals(0, copy.bufferedCount());
        assertEquals(CursorState.INITIALIZED, original.getState());

        copy.filter(json("{'n':7}"));
        assertEquals(json("{}"), original.getFilter());

        assertEquals(List.of(7), copy.toArray());
        assertEquals(28, original.toArray().size());
    }

    @Test
    void mappingsCompose() {
        var doubled = cursor(3)
            .map(doc -> doc.get("n").asInt())
            .map(n -> n * 2)
            .toArray();

        assertEquals(List.of(0, 2, 4), doubled);
    }

    @Test
    void mappingFailureClosesCursor() {
        var cursor = cursor(5).map(doc -> {
            if (doc.get("n").asInt() == 2) {
                throw new IllegalStateException("bad document");
            }
            return doc;
        });

        cursor.next();
        cursor.next();
        var thrown = assertThrows(IllegalStateException.class, cursor::next);

        assertEquals("bad document", thrown.getMessage());
        assertTrue(cursor.isClosed());
        assertEquals(2, cursor.bufferedCount());
    }

    @Test
    void fetchFailureClosesCursorAndPropagates() {
        executor.failWhen(command -> command.has("find"), () -> new DataApiHttpException(503, "Service Unavailable", ""));
        var cursor = cursor(5);

        assertThrows(DataApiHttpException.class, cursor::hasNext);
        assertTrue(cursor.isClosed());
        assertFalse(cursor.hasNext());
        assertEquals(1, executor.getReceivedCommands().size());
    }

    @Test
    void forEachWhileStopsEarlyAndKeepsTheBuffer() {
        var cursor = cursor(5);
        var seen = new ArrayList<Integer>();

        cursor.forEachWhile(doc -> {
            seen.add(doc.get("_id").asInt());
            return seen.size() < 3;
        });

        assertEquals(List.of(0, 1, 2), seen);
        assertTrue(cursor.isClosed());
        assertEquals(2, cursor.bufferedCount());
        assertEquals(List.of(3, 4), ids(cursor.readBufferedDocuments()));
        assertEquals(0, cursor.bufferedCount());
    }

    @Test
    void forEachDrainsAndCloses() {
        var cursor = cursor(25);
        var count = new int[1];

        cursor.forEach(doc -> count[0]++);

        assertEquals(25, count[0]);
        assertTrue(cursor.isClosed());
    }

    @Test
    void readBufferedDocumentsNeverFetches() {
        var cursor = cursor(30);
        assertTrue(cursor.readBufferedDocuments(5).isEmpty());
        assertTrue(executor.getReceivedCommands().isEmpty());

        cursor.next();
        assertEquals(List.of(1, 2, 3, 4, 5), ids(cursor.readBufferedDocuments(5)));
        assertEquals(14, cursor.bufferedCount());
        assertEquals(1, executor.getReceivedCommands().size());
    }

    @Test
    void readBufferedDocumentsCountTowardsLimit() {
        var cursor = cursor(30).limit(22);
        cursor.next();

        assertEquals(19, cursor.readBufferedDocuments().size());
        assertEquals(List.of(20, 21), ids(cursor.toArray()));
    }

    @Test
    void iteratesWithForLoopAndClosesAtTheEnd() {
        var ids = new ArrayList<Integer>();
        try (var cursor = cursor(25)) {
            for (var doc : cursor) {
                ids.add(doc.get("_id").asInt());
            }
            assertTrue(cursor.isClosed());
        }
        assertEquals(25, ids.size());
    }

    @Test
    void iteratorThrowsPastTheEnd() {
        var iterator = cursor(1).iterator();

        iterator.next();
        assertFalse(iterator.hasNext());
        assertThrows(NoSuchElementException.class, iterator::next);
    }

    @Test
    void closingAStreamClosesTheCursor() {
        var cursor = cursor(10);
        try (var stream = cursor.stream()) {
            assertEquals(3, stream.limit(3).count());
        }
        assertTrue(cursor.isClosed());
    }

    @Test
    void filterAccessorReturnsACopy() {
        var cursor = cursor(1).filter(json("{'kind':'x'}"));

        cursor.getFilter().put("kind", "changed");

        assertEquals(json("{'kind':'x'}"), cursor.getFilter());
    }

    @Test
    void readBufferedDocumentsSkipsTheMapping() {
        var cursor = cursor(3).map(doc -> "mapped-" + doc.get("_id").asInt());
        assertTrue(cursor.hasNext());

        List<ObjectNode> raw = cursor.readBufferedDocuments();

        assertEquals(List.of(0, 1, 2), ids(raw));
        assertEquals(CursorState.INITIALIZED, cursor.getState());
        assertNull(cursor.next());
        assertTrue(cursor.isClosed());
    }

    @Test
    void readBufferedDocumentsIgnoresAFailingMapping() {
        var cursor = cursor(3).map(doc -> {
            throw new IllegalStateException("boom");
        });
        assertTrue(cursor.hasNext());

        assertEquals(List.of(0, 1), ids(cursor.readBufferedDocuments(2)));
        assertEquals(CursorState.INITIALIZED, cursor.getState());
        assertEquals(1, cursor.bufferedCount());
    }

    @Test
    void leavingAForLoopEarlyDoesNotCloseButTryWithResourcesDoes() {
        var cursor = cursor(3);
        for (var doc : cursor) {
            break;
        }
        assertFalse(cursor.isClosed());

        var seen = new ArrayList<Integer>();
        try (cursor) {
            for (var doc : cursor) {
                seen.add(doc.get("_id").asInt());
                break;
            }
        }
        assertEquals(List.of(1), seen);
        assertTrue(cursor.isClosed());
        for (var doc : cursor) {
            fail("closed cursor yielded " + doc);
        }
    }

    @Test
    void emptyPagesWithAPageStateAreSkipped() {
        var pages = new ArrayList<CommandResponse>(List.of(
            CommandResponse.ofData(json("{'documents':[],'nextPageState':'p1'}")),
            CommandResponse.ofData(json("{'documents':[{'_id':7}]}"))));
        var calls = new int[1];
        var cursor = new FindCursor<ObjectNode>((command, options) -> {
            calls[0]++;
            return Mono.just(pages.remove(0));
        }, TARGET, json("{}"), FindOptions.DEFAULTS);

        assertTrue(cursor.hasNext());
        assertEquals(2, calls[0]);
        assertEquals(7, cursor.next().get("_id").asInt());
        assertNull(cursor.next());
        assertEquals(2, calls[0]);
    }
}
