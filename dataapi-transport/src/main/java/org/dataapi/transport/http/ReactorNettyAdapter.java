package org.dataapi.transport.http;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import io.netty.buffer.Unpooled;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpMethod;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

/**
 * Sends requests through a Reactor Netty {@link HttpClient} whose base URL is already set.
 */
@Slf4j
public class ReactorNettyAdapter implements HttpClientAdapter {
    private final HttpClient client;
    private final ConnectionContext connectionContext;

    public ReactorNettyAdapter(ConnectionContext connectionContext, HttpClient client) {
        this.connectionContext = connectionContext;
        this.client = client;
    }

    @Override
    public Mono<HttpResponse> request(String method, String path, String body, Map<String, List<String>> headers) {
        return client
            .headers(h -> headers.forEach(h::add))
            .compress(DataApiHeaders.acceptsGzip(headers))
            .request(HttpMethod.valueOf(method))
            .uri("/" + path)
            .send(Mono.justOrEmpty(body).map(b -> Unpooled.wrappedBuffer(b.getBytes(StandardCharsets.UTF_8))))
            .responseSingle((response, content) -> content.asString(StandardCharsets.UTF_8)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .map(text -> new HttpResponse(
                    response.status().code(),
                    response.status().reasonPhrase(),
                    flatten(response.responseHeaders()),
                    text.orElse(null))))
            .doOnError(t -> log.atError().setMessage("{} /{} failed").addArgument(method).addArgument(path)
                .setCause(t).log());
    }

    @Override
    public boolean supportsGzipCompression() {
        return connectionContext.isCompressionSupported();
    }

    // Repeated headers are joined with commas.
    private static Map<String, String> flatten(HttpHeaders headers) {
        return headers.entries().stream()
            .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue, (first, second) -> first + "," + second));
    }
}
