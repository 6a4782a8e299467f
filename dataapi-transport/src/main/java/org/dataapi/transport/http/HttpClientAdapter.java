package org.dataapi.transport.http;

import java.util.List;
import java.util.Map;

import reactor.core.publisher.Mono;

/**
 * The HTTP stack beneath {@link AbstractRestClient}.
 */
public interface HttpClientAdapter {
    /**
     * @param path relative to the connection's base URI, without a leading slash
     * @param body null to send no body
     * @return the response whatever its status; fails only when no response was received
     */
    Mono<HttpResponse> request(String method, String path, String body, Map<String, List<String>> headers);

    /** Whether responses may be requested gzip-encoded. */
    boolean supportsGzipCompression();
}
