package org.dataapi.transport.http;

import java.util.Map;

/**
 * Raw HTTP exchange result, before any Data API interpretation.
 */
public record HttpResponse(
    int statusCode,
    String statusText,
    Map<String, String> headers,
    String body
) {
    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }
}
