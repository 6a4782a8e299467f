package org.dataapi.collections.cursor;

/**
 * The query of a cursor was changed after it started fetching.
 */
public class CursorAlreadyInitializedException extends IllegalStateException {
    public CursorAlreadyInitializedException(String operation) {
        super("Cannot call " + operation + "() on a cursor that has already started fetching; rewind() or clone() it first");
    }
}
