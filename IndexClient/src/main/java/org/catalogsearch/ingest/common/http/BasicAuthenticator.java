package org.catalogsearch.ingest.common.http;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** HTTP basic authentication with a fixed username and password. */
public class BasicAuthenticator implements RequestAuthenticator {
    public static final String AUTHORIZATION_HEADER = "Authorization";

    private final List<String> authorization;

    public BasicAuthenticator(String username, String password) {
        var credentials = (username + ":" + password).getBytes(StandardCharsets.UTF_8);
        this.authorization = List.of("Basic " + Base64.getEncoder().encodeToString(credentials));
    }

    @Override
    public Map<String, List<String>> authenticate(Map<String, List<String>> headers) {
        var withCredentials = new HashMap<>(headers);
        withCredentials.put(AUTHORIZATION_HEADER, authorization);
        return withCredentials;
    }
}
