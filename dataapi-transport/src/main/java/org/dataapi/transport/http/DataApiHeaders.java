package org.dataapi.transport.http;

import java.util.List;
import java.util.Map;

/**
 * Header names and values sent to the Data API.
 */
public final class DataApiHeaders {
    public static final String TOKEN = "Token";
    public static final String USER_AGENT = "User-Agent";
    public static final String CONTENT_TYPE = "Content-Type";
    public static final String HOST = "Host";
    public static final String ACCEPT_ENCODING = "Accept-Encoding";

    static final String USER_AGENT_VALUE = "dataapi-java-client/1.0";
    static final String JSON_CONTENT_TYPE = "application/json";
    private static final String GZIP = "gzip";

    private DataApiHeaders() {}

    /** The authentication header for {@code token}, or no headers for an anonymous connection. */
    public static Map<String, List<String>> authentication(String token) {
        return token != null ? Map.of(TOKEN, List.of(token)) : Map.of();
    }

    public static void acceptGzip(Map<String, List<String>> headers) {
        headers.put(ACCEPT_ENCODING, List.of(GZIP));
    }

    public static boolean acceptsGzip(Map<String, List<String>> headers) {
        return headers.getOrDefault(ACCEPT_ENCODING, List.of()).contains(GZIP);
    }
}
