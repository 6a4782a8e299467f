package org.dataapi.collections.cursor;

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class FindOptions {
    public static final FindOptions DEFAULTS = FindOptions.builder().build();

    /** Maximum number of documents returned; 0 means unlimited. Enforced by the cursor, not sent. */
    int limit;
    /** Number of matches to skip, null when not sent. */
    Integer skip;
    ObjectNode sort;
    ObjectNode projection;
    boolean includeSimilarity;

    FindOptions copy() {
        return toBuilder()
            .sort(sort != null ? sort.deepCopy() : null)
            .projection(projection != null ? projection.deepCopy() : null)
            .build();
    }
}
