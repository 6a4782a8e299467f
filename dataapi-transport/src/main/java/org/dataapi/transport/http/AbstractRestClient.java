package org.dataapi.transport.http;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import lombok.Getter;
import reactor.core.publisher.Mono;

/**
 * Sends JSON bodies to paths under the connection's base URI. Subclasses choose the HTTP stack by supplying
 * the {@link HttpClientAdapter}; this class owns the headers every request carries.
 */
public abstract class AbstractRestClient {
    @Getter
    protected final ConnectionContext connectionContext;
    protected final HttpClientAdapter httpClientAdapter;

    protected AbstractRestClient(ConnectionContext connectionContext, HttpClientAdapter httpClientAdapter) {
        this.connectionContext = connectionContext;
        this.httpClientAdapter = httpClientAdapter;
    }

    /**
     * The Host header for {@code connectionContext}: the bare host on the protocol's default port, host:port
     * otherwise.
     */
    public static String getHostHeaderValue(ConnectionContext connectionContext) {
        var uri = connectionContext.getUri();
        var port = uri.getPort();
        return port == -1 || port == connectionContext.getProtocol().getDefaultPort()
            ? uri.getHost()
            : uri.getHost() + ":" + port;
    }

    public Mono<HttpResponse> postAsync(String path, String body, Map<String, List<String>> additionalHeaders) {
        return httpClientAdapter.request("POST", path, body, prepareHeaders(body, additionalHeaders));
    }

    public boolean supportsGzipCompression() {
        return httpClientAdapter.supportsGzipCompression();
    }

    /**
     * Common headers first, then {@code additionalHeaders}, which win on a name clash.
     */
    protected Map<String, List<String>> prepareHeaders(String body, Map<String, List<String>> additionalHeaders) {
        Map<String, List<String>> headers = new HashMap<>();
        headers.put(DataApiHeaders.USER_AGENT, List.of(DataApiHeaders.USER_AGENT_VALUE));
        headers.put(DataApiHeaders.HOST, List.of(getHostHeaderValue(connectionContext)));
        if (body != null) {
            headers.put(DataApiHeaders.CONTENT_TYPE, List.of(DataApiHeaders.JSON_CONTENT_TYPE));
        }
        if (supportsGzipCompression()) {
            DataApiHeaders.acceptGzip(headers);
        }
        if (additionalHeaders != null) {
            headers.putAll(additionalHeaders);
        }
        return headers;
    }
}
