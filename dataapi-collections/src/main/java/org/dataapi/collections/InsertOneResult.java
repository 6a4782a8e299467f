package org.dataapi.collections;

import com.fasterxml.jackson.databind.JsonNode;

public record InsertOneResult(JsonNode insertedId) {}
