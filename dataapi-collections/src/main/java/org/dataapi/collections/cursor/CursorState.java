package org.dataapi.collections.cursor;

public enum CursorState {
    /** No page fetched yet; the query may still be changed. */
    UNINITIALIZED,
    /** At least one page fetched; the query is frozen. */
    INITIALIZED,
    /** Exhausted or closed by the caller; never fetches again. */
    CLOSED
}
