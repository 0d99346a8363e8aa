package com.dicomweb.oauth.interceptor;

public record FailureResponse(int status, String body) {
}
