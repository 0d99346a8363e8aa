package com.dicomweb.oauth.interceptor;

import com.dicomweb.oauth.error.DicomWebOAuthException;
import com.dicomweb.oauth.error.ErrorCode;
import com.dicomweb.oauth.security.SecretRedactor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

/**
 * Maps engine failures to HTTP answers: 502 when no token could be acquired, 401 when
 * the acquired token failed validation, 500 for configuration problems and 429 for
 * rate-limited admin calls. Bodies are JSON and pass through {@link SecretRedactor}.
 */
@Slf4j
public class FailureResponses {

    static final int INTERNAL_ERROR = 500;

    private final ObjectMapper mapper;

    public FailureResponses() {
        this(new ObjectMapper());
    }

    public FailureResponses(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public FailureResponse toResponse(Throwable error) {
        if (error instanceof DicomWebOAuthException) {
            DicomWebOAuthException failure = (DicomWebOAuthException) error;
            ErrorCode code = failure.getErrorCode();
            ObjectNode body = body(code);
            body.put("message", SecretRedactor.scrub(failure.getMessage()));
            if (failure.getServerName() != null) {
                body.put("server", failure.getServerName());
            }
            body.put("retryable", failure.isRetryable());
            return new FailureResponse(code.getHttpStatus(), write(body));
        }
        log.error("Unexpected failure while handling request", error);
        ObjectNode body = mapper.createObjectNode();
        body.put("error", "internal_error");
        body.put("message", "Internal error");
        return new FailureResponse(INTERNAL_ERROR, write(body));
    }

    public FailureResponse rateLimited(long retryAfterSeconds) {
        ObjectNode body = body(ErrorCode.RATE_LIMITED);
        body.put("retryAfterSeconds", retryAfterSeconds);
        return new FailureResponse(ErrorCode.RATE_LIMITED.getHttpStatus(), write(body));
    }

    private ObjectNode body(ErrorCode code) {
        ObjectNode body = mapper.createObjectNode();
        body.put("error", code.getCode());
        body.put("description", code.getDescription());
        return body;
    }

    private String write(ObjectNode body) {
        try {
            return mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize error body", e);
        }
    }
}
