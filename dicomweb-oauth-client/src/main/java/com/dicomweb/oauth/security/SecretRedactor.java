package com.dicomweb.oauth.security;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns tokens, secrets and provider responses into something safe to log.
 */
public final class SecretRedactor {

    public static final String REDACTED = "***REDACTED***";
    public static final int MAX_BODY_CHARS = 512;

    private static final List<Pattern> PATTERNS = List.of(
        Pattern.compile("(?i)(\"?(?:client_secret|access_token|refresh_token|id_token|assertion|client_assertion|password|api_key|secretaccesskey|token)\"?\\s*[:=]\\s*\"?)([^\"&,\\s}]+)"),
        Pattern.compile("(?i)(bearer\\s+)([\\w\\-.~+/]+=*)")
    );

    private SecretRedactor() {}

    /**
     * Keeps the first and last four characters of a token and its length.
     */
    public static String maskToken(String token) {
        if (token == null) {
            return "null";
        }
        if (token.length() <= 12) {
            return "***(len=" + token.length() + ")";
        }
        return token.substring(0, 4) + "..." + token.substring(token.length() - 4) + " (len=" + token.length() + ")";
    }

    public static String maskSecret(String secret) {
        return secret == null ? "null" : "***(len=" + secret.length() + ")";
    }

    /**
     * Scrubs well-known credential fields and the given literal secrets from {@code text},
     * then truncates it to {@link #MAX_BODY_CHARS}.
     */
    public static String scrub(String text, String... knownSecrets) {
        if (text == null) {
            return "";
        }
        String result = text;
        for (String secret : knownSecrets) {
            if (secret != null && secret.length() >= 4) {
                result = result.replace(secret, REDACTED);
            }
        }
        for (Pattern pattern : PATTERNS) {
            result = pattern.matcher(result).replaceAll(m -> Matcher.quoteReplacement(m.group(1) + REDACTED));
        }
        if (result.length() > MAX_BODY_CHARS) {
            result = result.substring(0, MAX_BODY_CHARS) + "...(truncated " + (result.length() - MAX_BODY_CHARS) + " chars)";
        }
        return result;
    }
}
