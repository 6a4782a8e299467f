package org.dataapi.collections;

/** Which version of the document a find-and-modify returns. */
public enum ReturnDocument {
    BEFORE("before"),
    AFTER("after");

    private final String wireValue;

    ReturnDocument(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }
}
