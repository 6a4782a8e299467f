package org.dataapi.collections;

public record DeleteResult(long deletedCount) {}
