package org.dataapi.transport.http;

import java.net.URI;
import java.net.URISyntaxException;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Where and how to reach a Data API endpoint.
 */
@Getter
@ToString(exclude = "token")
public class ConnectionContext {
    public static final String DEFAULT_NAMESPACE = "default_keyspace";

    public enum Protocol {
        HTTP(80),
        HTTPS(443);

        private final int defaultPort;

        Protocol(int defaultPort) {
            this.defaultPort = defaultPort;
        }

        public int getDefaultPort() {
            return defaultPort;
        }
    }

    private final URI uri;
    private final Protocol protocol;
    private final String token;
    private final String defaultNamespace;
    private final boolean insecure;
    private final boolean compressionSupported;

    @Builder
    private ConnectionContext(String uri, String token, String defaultNamespace, boolean insecure,
                              boolean compressionSupported) {
        if (uri == null) {
            throw new IllegalArgumentException("URI must be provided");
        }
        try {
            this.uri = new URI(uri.endsWith("/") ? uri.substring(0, uri.length() - 1) : uri);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid URI: " + uri, e);
        }

        String scheme = this.uri.getScheme();
        if ("http".equals(scheme)) {
            this.protocol = Protocol.HTTP;
        } else if ("https".equals(scheme)) {
            this.protocol = Protocol.HTTPS;
        } else {
            throw new IllegalArgumentException("Invalid protocol, expected http or https: " + uri);
        }

        this.token = token;
        this.defaultNamespace = defaultNamespace != null ? defaultNamespace : DEFAULT_NAMESPACE;
        this.insecure = insecure;
        this.compressionSupported = compressionSupported;
    }
}
