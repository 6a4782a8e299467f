package org.dataapi.collections.paths;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Collects every value a dotted path reaches in a document.
 *
 * Walking a segment into an object reads the field of that name. Into an array, a numeric segment selects
 * that element and any other segment is applied to every element. A value reached at the end of the path is
 * returned as is, except an array, whose elements are returned instead (one level only). Null or missing
 * values contribute nothing. Duplicates are returned; deduplicating is up to the caller.
 */
public final class DistinctPathExtractor {
    // Longer indexes cannot address a real array.
    private static final int MAX_INDEX_DIGITS = 9;

    private final String path;
    private final List<String> segments;

    private DistinctPathExtractor(String path, List<String> segments) {
        this.path = path;
        this.segments = segments;
    }

    public static DistinctPathExtractor forPath(String path) {
        if (path == null || path.isEmpty()) {
            throw new IllegalArgumentException("Path cannot be empty");
        }
        var segments = Arrays.asList(path.split("\\.", -1));
        if (segments.stream().anyMatch(String::isEmpty)) {
            throw new IllegalArgumentException("Path cannot contain empty segments: '" + path + "'");
        }
        return new DistinctPathExtractor(path, List.copyOf(segments));
    }

    public String getPath() {
        return path;
    }

    /**
     * The leading segments up to the first numeric one. Projecting this fetches everything the full path can
     * reach, since a projection cannot address array positions.
     */
    public String projectionPath() {
        var prefix = segments.stream()
            .takeWhile(segment -> !isIndex(segment))
            .collect(Collectors.toList());
        return prefix.isEmpty() ? segments.get(0) : String.join(".", prefix);
    }

    public List<JsonNode> extract(JsonNode document) {
        var values = new ArrayList<JsonNode>();
        collect(document, 0, values);
        return values;
    }

    private void collect(JsonNode value, int depth, List<JsonNode> values) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return;
        }
        if (depth == segments.size()) {
            if (value.isArray()) {
                value.forEach(values::add);
            } else {
                values.add(value);
            }
            return;
        }

        var segment = segments.get(depth);
        if (value.isArray()) {
            if (isIndex(segment)) {
                if (segment.length() <= MAX_INDEX_DIGITS) {
                    collect(value.get(Integer.parseInt(segment)), depth + 1, values);
                }
            } else {
                for (JsonNode element : value) {
                    collect(element, depth, values);
                }
            }
        } else if (value.isObject()) {
            collect(value.get(segment), depth + 1, values);
        }
    }

    private static boolean isIndex(String segment) {
        return segment.chars().allMatch(c -> c >= '0' && c <= '9');
    }
}
