package org.dataapi.transport.http;

import javax.net.ssl.SSLEngine;
import javax.net.ssl.SSLException;
import javax.net.ssl.SSLParameters;

import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.util.InsecureTrustManagerFactory;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;
import reactor.netty.tcp.SslProvider;

/**
 * Keep-alive Reactor Netty client for one Data API endpoint. With {@code insecure} set, HTTPS connections
 * accept any certificate and skip host name verification.
 */
public class ReactorNettyRestClient extends AbstractRestClient {
    private static final String POOL_NAME = "dataapi";

    public ReactorNettyRestClient(ConnectionContext connectionContext) {
        this(connectionContext, 0);
    }

    /**
     * @param maxConnections caps the connection pool when positive
     */
    public ReactorNettyRestClient(ConnectionContext connectionContext, int maxConnections) {
        super(connectionContext, new ReactorNettyAdapter(connectionContext, httpClient(connectionContext, maxConnections)));
    }

    static HttpClient httpClient(ConnectionContext connectionContext, int maxConnections) {
        var client = maxConnections > 0
            ? HttpClient.create(ConnectionProvider.create(POOL_NAME, maxConnections))
            : HttpClient.create();
        if (connectionContext.getProtocol() == ConnectionContext.Protocol.HTTPS) {
            client = client.secure(connectionContext.isInsecure() ? trustAllProvider() : SslProvider.defaultClientProvider());
        }
        // One retry, and only for a connection reset before the request went out.
        return client
            .baseUrl(connectionContext.getUri().toString())
            .disableRetry(false)
            .keepAlive(true);
    }

    private static SslProvider trustAllProvider() {
        try {
            SslContext context = SslContextBuilder.forClient()
                .trustManager(InsecureTrustManagerFactory.INSTANCE)
                .build();

            return SslProvider.builder()
                .sslContext(context)
                .handlerConfigurator(handler -> {
                    SSLEngine engine = handler.engine();
                    SSLParameters parameters = engine.getSSLParameters();
                    parameters.setEndpointIdentificationAlgorithm(null);
                    engine.setSSLParameters(parameters);
                })
                .build();
        } catch (SSLException e) {
            throw new IllegalStateException("Unable to build a trust-all TLS context", e);
        }
    }
}
