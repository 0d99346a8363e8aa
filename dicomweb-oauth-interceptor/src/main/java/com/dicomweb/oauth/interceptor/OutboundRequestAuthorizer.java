package com.dicomweb.oauth.interceptor;

import com.dicomweb.oauth.TokenManager;
import com.dicomweb.oauth.config.ServerConfig;
import com.dicomweb.oauth.config.ServerRegistry;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Optional;

/**
 * Adds the bearer token of the matching server to outbound DICOMweb requests.
 * Requests to URLs no server claims pass through untouched.
 */
@Slf4j
public class OutboundRequestAuthorizer {

    public static final String DEFAULT_HEADER = "Authorization";

    private final TokenManager tokenManager;
    private final ServerRegistry registry;
    private final String headerName;

    public OutboundRequestAuthorizer(TokenManager tokenManager, ServerRegistry registry) {
        this(tokenManager, registry, DEFAULT_HEADER);
    }

    public OutboundRequestAuthorizer(TokenManager tokenManager, ServerRegistry registry, String headerName) {
        this.tokenManager = tokenManager;
        this.registry = registry;
        this.headerName = (headerName == null || headerName.isBlank()) ? DEFAULT_HEADER : headerName;
    }

    public Optional<String> serverFor(URI uri) {
        return registry.findServerForUrl(uri.toString()).map(ServerConfig::getName);
    }

    /**
     * Sets the bearer header on {@code builder} when {@code uri} belongs to a configured server.
     *
     * @throws com.dicomweb.oauth.error.DicomWebOAuthException when no token can be obtained
     */
    public HttpRequest.Builder authorize(URI uri, HttpRequest.Builder builder) {
        Optional<String> server = serverFor(uri);
        if (server.isEmpty()) {
            return builder;
        }
        log.debug("Injecting token for server '{}'", server.get());
        return builder.setHeader(headerName, "Bearer " + tokenManager.getToken(server.get()));
    }

    /**
     * Reacts to the remote answer. A 401 from a configured server means the token was
     * revoked or rotated early; the cached one is dropped.
     *
     * @return {@code true} when the token was invalidated and a retry may succeed
     */
    public boolean onResponse(URI uri, int statusCode) {
        if (statusCode != 401) {
            return false;
        }
        Optional<String> server = serverFor(uri);
        server.ifPresent(name -> {
            log.warn("Server '{}' rejected the token, invalidating it", name);
            tokenManager.invalidateToken(name);
        });
        return server.isPresent();
    }

    /**
     * Sends {@code request} with a token and retries once with a fresh token after a 401.
     */
    public <T> HttpResponse<T> send(HttpClient client, HttpRequest request, HttpResponse.BodyHandler<T> handler)
        throws IOException, InterruptedException {
        HttpResponse<T> response = client.send(withToken(request), handler);
        if (onResponse(request.uri(), response.statusCode())) {
            response = client.send(withToken(request), handler);
        }
        return response;
    }

    private HttpRequest withToken(HttpRequest request) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(request, (name, value) -> !name.equalsIgnoreCase(headerName));
        return authorize(request.uri(), builder).build();
    }
}
