package org.catalogsearch.ingest.common.http;

import java.net.URI;
import java.net.URISyntaxException;

import com.beust.jcommander.Parameter;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Stores the connection context for an Elasticsearch/OpenSearch cluster
 */
@Getter
@EqualsAndHashCode(exclude = { "authenticator" })
@ToString(exclude = { "authenticator" })
public class ConnectionContext {
    public static final String DEFAULT_URL = "http://127.0.0.1:9200";

    public enum Protocol {
        HTTP,
        HTTPS
    }

    private final URI uri;
    private final Protocol protocol;
    private final boolean insecure;
    private final RequestAuthenticator authenticator;

    private ConnectionContext(IParams params) {
        if (params.getUrl() == null || params.getUrl().isBlank()) {
            throw new IllegalArgumentException("No cluster url was given");
        }

        this.insecure = params.isInsecure();

        try {
            uri = new URI(params.getUrl());
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid URL format", e);
        }

        if ("http".equals(uri.getScheme())) {
            protocol = Protocol.HTTP;
        } else if ("https".equals(uri.getScheme())) {
            protocol = Protocol.HTTPS;
        } else {
            throw new IllegalArgumentException("Invalid protocol in " + params.getUrl());
        }

        if (params.getUsername() != null ^ params.getPassword() != null) {
            throw new IllegalArgumentException("Both username and password must be provided, or neither");
        }

        if (params.getUsername() != null) {
            authenticator = new BasicAuthenticator(params.getUsername(), params.getPassword());
        } else {
            authenticator = RequestAuthenticator.NONE;
        }
    }

    public interface IParams {
        String getUrl();

        String getUsername();

        String getPassword();

        boolean isInsecure();

        default ConnectionContext toConnectionContext() {
            return new ConnectionContext(this);
        }
    }

    @Getter
    public static class ClusterArgs implements IParams {
        @Parameter(
            names = { "--url", "-u" },
            description = "URL of the Elasticsearch/OpenSearch cluster")
        public String url = DEFAULT_URL;

        @Parameter(
            names = { "--username" },
            description = "Optional. Username for basic authentication; if not provided, will assume no auth")
        public String username = null;

        @Parameter(
            names = { "--password" },
            description = "Optional. Password for basic authentication")
        public String password = null;

        @Parameter(
            names = { "--insecure" },
            description = "Allow untrusted SSL certificates for the cluster")
        public boolean insecure = false;

        @Parameter(
            names = { "--max-connections" },
            description = "Optional. The maximum number of connections to the cluster, 0 means the client default")
        public int maxConnections = 0;
    }
}
