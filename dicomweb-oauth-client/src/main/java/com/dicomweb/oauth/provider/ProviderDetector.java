package com.dicomweb.oauth.provider;

import com.dicomweb.oauth.config.ProviderType;
import com.dicomweb.oauth.config.ServerConfig;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;

/**
 * Resolves {@link ProviderType#AUTO} from the token endpoint. Rules are tried in order and
 * the first match wins; anything unmatched is treated as a generic OAuth2 server.
 * Platform identities (managed identity, AWS) have no token endpoint to look at and are
 * never detected.
 */
@Slf4j
public class ProviderDetector {

    public record Rule(String description, ProviderType type, Predicate<URI> matches) {
    }

    public static final List<Rule> DEFAULT_RULES = List.of(
        new Rule("host login.microsoftonline.com", ProviderType.AZURE,
            uri -> hostEndsWith(uri, "login.microsoftonline.com")),
        new Rule("host oauth2.googleapis.com", ProviderType.GOOGLE,
            uri -> hostEndsWith(uri, "oauth2.googleapis.com")),
        new Rule("host accounts.google.com", ProviderType.GOOGLE,
            uri -> hostEndsWith(uri, "accounts.google.com")),
        new Rule("path contains /realms/", ProviderType.KEYCLOAK,
            uri -> uri.getPath() != null && uri.getPath().contains("/realms/"))
    );

    private final List<Rule> rules;

    public ProviderDetector() {
        this(List.of());
    }

    /**
     * @param overrides rules tried before the defaults
     */
    public ProviderDetector(List<Rule> overrides) {
        List<Rule> all = new ArrayList<>(overrides);
        all.addAll(DEFAULT_RULES);
        this.rules = Collections.unmodifiableList(all);
    }

    public List<Rule> rules() {
        return rules;
    }

    public ProviderType detect(ServerConfig config) {
        String endpoint = config.getTokenEndpoint();
        if (endpoint == null || endpoint.isBlank()) {
            log.debug("Server '{}' has no token endpoint, assuming generic provider", config.getName());
            return ProviderType.GENERIC;
        }
        URI uri;
        try {
            uri = new URI(endpoint.trim());
        } catch (URISyntaxException e) {
            log.warn("Server '{}' has a malformed token endpoint, assuming generic provider", config.getName());
            return ProviderType.GENERIC;
        }
        for (Rule rule : rules) {
            if (rule.matches().test(uri)) {
                log.info("Detected {} provider for server '{}' ({})",
                    rule.type().getConfigName(), config.getName(), rule.description());
                return rule.type();
            }
        }
        log.info("No provider rule matched server '{}', using generic OAuth2", config.getName());
        return ProviderType.GENERIC;
    }

    private static boolean hostEndsWith(URI uri, String suffix) {
        String host = uri.getHost();
        if (host == null) {
            return false;
        }
        host = host.toLowerCase(Locale.ROOT);
        return host.equals(suffix) || host.endsWith("." + suffix);
    }
}
