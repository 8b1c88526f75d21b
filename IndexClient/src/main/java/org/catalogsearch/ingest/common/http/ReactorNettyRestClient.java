package org.catalogsearch.ingest.common.http;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import javax.net.ssl.SSLException;
import javax.net.ssl.SSLParameters;

import io.netty.buffer.Unpooled;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.util.InsecureTrustManagerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.netty.http.client.HttpClientResponse;
import reactor.netty.resources.ConnectionProvider;
import reactor.netty.tcp.SslProvider;

/**
 * Rest client on a Reactor Netty {@link HttpClient}. Every request carries the headers of the
 * connection's {@link RequestAuthenticator}.
 */
public class ReactorNettyRestClient extends AbstractRestClient {
    private static final String CONNECTION_POOL_NAME = "catalog-ingest";

    private final HttpClient httpClient;

    public ReactorNettyRestClient(ConnectionContext connectionContext) {
        this(connectionContext, 0);
    }

    /**
     * @param maxConnections size of the connection pool; Reactor's default pool is used when not positive
     */
    public ReactorNettyRestClient(ConnectionContext connectionContext, int maxConnections) {
        super(connectionContext);
        this.httpClient = buildHttpClient(connectionContext, maxConnections);
    }

    private static HttpClient buildHttpClient(ConnectionContext connectionContext, int maxConnections) {
        var client = maxConnections > 0
            ? HttpClient.create(ConnectionProvider.create(CONNECTION_POOL_NAME, maxConnections))
            : HttpClient.create();
        if (connectionContext.getProtocol() == ConnectionContext.Protocol.HTTPS) {
            client = connectionContext.isInsecure()
                ? client.secure(trustAllCertificates())
                : client.secure();
        }
        return client
            .baseUrl(connectionContext.getUri().toString())
            .compress(true)
            .disableRetry(false) // one retry on connection reset with no delay
            .keepAlive(true);
    }

    /** Accepts any certificate and host name, for clusters with self-signed certificates. */
    private static SslProvider trustAllCertificates() {
        try {
            var sslContext = SslContextBuilder.forClient()
                .trustManager(InsecureTrustManagerFactory.INSTANCE)
                .build();
            return SslProvider.builder()
                .sslContext(sslContext)
                .handlerConfigurator(sslHandler -> {
                    var engine = sslHandler.engine();
                    SSLParameters parameters = engine.getSSLParameters();
                    parameters.setEndpointIdentificationAlgorithm(null);
                    engine.setSSLParameters(parameters);
                })
                .build();
        } catch (SSLException e) {
            throw new IllegalStateException("Unable to build an insecure SSL context", e);
        }
    }

    @Override
    protected Mono<HttpResponse> execute(String method, String path, String body, Map<String, List<String>> headers) {
        var requestHeaders = connectionContext.getAuthenticator().authenticate(headers);
        var payload = Mono.justOrEmpty(body).map(b -> Unpooled.wrappedBuffer(b.getBytes(StandardCharsets.UTF_8)));
        return httpClient
            .headers(h -> requestHeaders.forEach(h::add))
            .request(HttpMethod.valueOf(method))
            .uri("/" + path)
            .send(payload)
            .responseSingle((response, content) -> content.asString(StandardCharsets.UTF_8)
                .singleOptional()
                .map(text -> toHttpResponse(response, text.orElse(null))));
    }

    private static HttpResponse toHttpResponse(HttpClientResponse response, String body) {
        return new HttpResponse(
            response.status().code(),
            response.status().reasonPhrase(),
            flattenHeaders(response.responseHeaders()),
            body
        );
    }

    private static Map<String, String> flattenHeaders(HttpHeaders headers) {
        return headers.entries().stream()
            .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue, (first, second) -> first + "," + second));
    }
}
