package com.dicomweb.oauth.provider;

import com.dicomweb.oauth.config.ProviderType;
import com.dicomweb.oauth.config.ServerConfig;
import com.dicomweb.oauth.error.ErrorCode;
import com.dicomweb.oauth.error.TokenAcquisitionException;
import com.dicomweb.oauth.security.SecretRedactor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * One-shot HTTP exchanges with a token endpoint or platform identity endpoint.
 * Turns every failure into a {@link TokenAcquisitionException} whose message quotes at most
 * a scrubbed, truncated response body.
 */
@Slf4j
class TokenEndpointClient {

    static final long DEFAULT_EXPIRES_IN_SECONDS = 3600;

    private final String serverName;
    private final ProviderType providerType;
    private final HttpClient http;
    private final Duration timeout;
    private final ObjectMapper mapper;
    private final Clock clock;

    TokenEndpointClient(ServerConfig config, ProviderType providerType, ProviderContext context) {
        this(config, providerType, context, HttpClients.create(config));
    }

    TokenEndpointClient(ServerConfig config, ProviderType providerType, ProviderContext context, HttpClient http) {
        this.serverName = config.getName();
        this.providerType = providerType;
        this.http = http;
        this.timeout = config.getRequestTimeout();
        this.mapper = context.getMapper();
        this.clock = context.getClock();
    }

    TokenResponse postForm(URI uri, Map<String, String> form, Map<String, String> headers, String... secrets) {
        HttpRequest.Builder request = newRequest(uri, headers)
            .header("Content-Type", "application/x-www-form-urlencoded")
            .POST(HttpRequest.BodyPublishers.ofString(encode(form)));
        return parseToken(send(request.build(), secrets), secrets);
    }

    TokenResponse getToken(URI uri, Map<String, String> headers, String... secrets) {
        return parseToken(send(newRequest(uri, headers).GET().build(), secrets), secrets);
    }

    HttpRequest.Builder newRequest(URI uri, Map<String, String> headers) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
            .timeout(timeout)
            .header("Accept", "application/json");
        headers.forEach(builder::header);
        return builder;
    }

    /**
     * Sends the request and returns the body of a 2xx answer.
     */
    String send(HttpRequest request, String... secrets) {
        HttpResponse<String> response;
        try {
            response = http.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw failure(ErrorCode.NETWORK_TIMEOUT,
                request.method() + " " + endpoint(request) + " timed out after " + timeout.toSeconds() + "s", e);
        } catch (ConnectException e) {
            throw failure(ErrorCode.NETWORK_CONNECTION_ERROR, "cannot connect to " + endpoint(request), e);
        } catch (IOException e) {
            throw failure(ErrorCode.TOKEN_ACQUISITION_FAILED,
                request.method() + " " + endpoint(request) + " failed: " + e.getClass().getSimpleName(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw failure(ErrorCode.TOKEN_ACQUISITION_FAILED, "interrupted while calling " + endpoint(request), e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            String body = SecretRedactor.scrub(response.body(), secrets);
            log.error("Token request for server '{}' answered HTTP {} ({} chars)", serverName, status,
                response.body() == null ? 0 : response.body().length());
            throw failure(ErrorCode.TOKEN_ACQUISITION_FAILED,
                "HTTP " + status + " from " + endpoint(request) + ": " + body, null);
        }
        return response.body();
    }

    TokenResponse parseToken(String body, String... secrets) {
        JsonNode json = readJson(body, secrets);
        JsonNode accessToken = json.get("access_token");
        if (accessToken == null || !accessToken.isTextual() || accessToken.asText().isEmpty()) {
            throw failure(ErrorCode.TOKEN_INVALID_RESPONSE, "response has no access_token", null);
        }

        long expiresIn;
        if (json.hasNonNull("expires_in")) {
            expiresIn = json.get("expires_in").asLong(-1);
        } else if (json.hasNonNull("expires_on")) {
            expiresIn = json.get("expires_on").asLong() - clock.instant().getEpochSecond();
        } else {
            expiresIn = DEFAULT_EXPIRES_IN_SECONDS;
        }
        if (expiresIn <= 0) {
            throw failure(ErrorCode.TOKEN_INVALID_RESPONSE, "response has no usable expires_in", null);
        }
        if (expiresIn > TokenResponse.MAX_EXPIRES_IN_SECONDS) {
            throw failure(ErrorCode.TOKEN_INVALID_RESPONSE, "expires_in " + expiresIn + " is out of range", null);
        }

        JsonNode tokenType = json.get("token_type");
        return new TokenResponse(accessToken.asText(), expiresIn, tokenType == null ? null : tokenType.asText());
    }

    JsonNode readJson(String body, String... secrets) {
        try {
            JsonNode json = mapper.readTree(body == null ? "" : body);
            if (json == null || !json.isObject()) {
                throw failure(ErrorCode.TOKEN_INVALID_RESPONSE, "response is not a JSON object", null);
            }
            return json;
        } catch (JsonProcessingException e) {
            throw failure(ErrorCode.TOKEN_INVALID_RESPONSE,
                "response is not JSON: " + SecretRedactor.scrub(body, secrets), e);
        }
    }

    TokenAcquisitionException failure(ErrorCode code, String message, Throwable cause) {
        return new TokenAcquisitionException(code, serverName, providerType, message, cause);
    }

    static String encode(Map<String, String> form) {
        return form.entrySet().stream()
            .map(e -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8) + "="
                + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
            .collect(Collectors.joining("&"));
    }

    private static String endpoint(HttpRequest request) {
        URI uri = request.uri();
        return uri.getScheme() + "://" + uri.getAuthority() + uri.getPath();
    }
}
