package com.dicomweb.oauth.config;

import com.dicomweb.oauth.error.ConfigurationException;
import com.dicomweb.oauth.error.ErrorCode;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The validated set of configured servers. Checks what the loader cannot: well-formed
 * URLs, unique names, unambiguous base URLs and the fields each provider needs.
 */
public final class ServerRegistry {

    private final Map<String, ServerConfig> servers;
    private final Map<String, BaseUrl> baseUrls;

    private ServerRegistry(Map<String, ServerConfig> servers, Map<String, BaseUrl> baseUrls) {
        this.servers = Collections.unmodifiableMap(servers);
        this.baseUrls = Collections.unmodifiableMap(baseUrls);
    }

    public static ServerRegistry of(Collection<ServerConfig> configs) {
        Map<String, ServerConfig> servers = new LinkedHashMap<>();
        Map<String, BaseUrl> baseUrls = new LinkedHashMap<>();
        Map<BaseUrl, String> owners = new HashMap<>();

        for (ServerConfig config : configs) {
            String name = config.getName();
            if (name == null || name.isBlank()) {
                throw new ConfigurationException(ErrorCode.CONFIG_MISSING_KEY, null, "server without a name");
            }
            if (servers.containsKey(name)) {
                throw new ConfigurationException(ErrorCode.CONFIG_INVALID_VALUE, name, "duplicate server name");
            }
            validate(config);

            BaseUrl baseUrl = BaseUrl.parse(name, config.getBaseUrl());
            String other = owners.putIfAbsent(baseUrl, name);
            if (other != null) {
                throw new ConfigurationException(ErrorCode.CONFIG_INVALID_VALUE, name,
                    "base URL " + config.getBaseUrl() + " is ambiguous with server '" + other + "'");
            }
            servers.put(name, config);
            baseUrls.put(name, baseUrl);
        }
        return new ServerRegistry(servers, baseUrls);
    }

    public ServerConfig get(String name) {
        ServerConfig config = name == null ? null : servers.get(name);
        if (config == null) {
            throw ConfigurationException.unknownServer(name);
        }
        return config;
    }

    public Optional<ServerConfig> find(String name) {
        return Optional.ofNullable(servers.get(name));
    }

    public Set<String> names() {
        return servers.keySet();
    }

    public Collection<ServerConfig> all() {
        return servers.values();
    }

    public int size() {
        return servers.size();
    }

    /**
     * Finds the server whose base URL is the longest prefix of {@code url}, matching
     * on whole path segments only ({@code /dicom} matches {@code /dicom/studies}
     * but not {@code /dicomweb}).
     */
    public Optional<ServerConfig> findServerForUrl(String url) {
        BaseUrl target;
        try {
            target = BaseUrl.of(new URI(url));
        } catch (URISyntaxException | IllegalArgumentException e) {
            return Optional.empty();
        }
        if (target == null) {
            return Optional.empty();
        }

        String best = null;
        int bestLength = -1;
        for (Map.Entry<String, BaseUrl> entry : baseUrls.entrySet()) {
            BaseUrl base = entry.getValue();
            if (base.contains(target) && base.path().length() > bestLength) {
                best = entry.getKey();
                bestLength = base.path().length();
            }
        }
        return Optional.ofNullable(best).map(servers::get);
    }

    private static void validate(ServerConfig config) {
        String name = config.getName();
        if (config.getBaseUrl() == null || config.getBaseUrl().isBlank()) {
            throw ConfigurationException.missing(name, "Url");
        }
        if (config.getRefreshBufferSeconds() < 0) {
            throw new ConfigurationException(ErrorCode.CONFIG_INVALID_VALUE, name, "refresh buffer must not be negative");
        }
        if (config.getRequestTimeout() == null || config.getRequestTimeout().isNegative()
            || config.getRequestTimeout().isZero()) {
            throw new ConfigurationException(ErrorCode.CONFIG_INVALID_VALUE, name, "request timeout must be positive");
        }

        ProviderType type = config.effectiveProviderType();
        if (config.getTokenEndpoint() != null && !config.getTokenEndpoint().isBlank()) {
            BaseUrl.parse(name, config.getTokenEndpoint());
        } else if (type == ProviderType.GENERIC || type == ProviderType.KEYCLOAK || type == ProviderType.AUTO) {
            throw ConfigurationException.missing(name, "TokenEndpoint");
        }

        boolean needsCredentials = !type.usesPlatformIdentity()
            && !(type == ProviderType.GOOGLE && config.getServiceAccountKeyFile() != null);
        if (needsCredentials) {
            if (config.getClientId() == null || config.getClientId().isBlank()) {
                throw ConfigurationException.missing(name, "ClientId");
            }
            if (!config.hasClientSecret()) {
                throw ConfigurationException.missing(name, "ClientSecret");
            }
        }

        JwtSettings jwt = config.getJwt();
        if (jwt != null && jwt.isEnabled()) {
            for (String alg : jwt.effectiveAlgorithms()) {
                String upper = alg.toUpperCase(Locale.ROOT);
                if (upper.equals("NONE") || upper.startsWith("HS")) {
                    throw new ConfigurationException(ErrorCode.CONFIG_INVALID_VALUE, name,
                        "algorithm " + alg + " cannot be verified with a public key");
                }
            }
        }
    }

    private record BaseUrl(String scheme, String host, int port, String path) {

        static BaseUrl parse(String serverName, String value) {
            try {
                BaseUrl url = of(new URI(value.trim()));
                if (url == null) {
                    throw new ConfigurationException(ErrorCode.CONFIG_INVALID_VALUE, serverName,
                        "URL must be absolute http(s): " + value);
                }
                return url;
            } catch (URISyntaxException e) {
                throw new ConfigurationException(ErrorCode.CONFIG_INVALID_VALUE, serverName,
                    "malformed URL: " + value, e);
            }
        }

        static BaseUrl of(URI uri) {
            String scheme = uri.getScheme();
            if (scheme == null || uri.getHost() == null) {
                return null;
            }
            scheme = scheme.toLowerCase(Locale.ROOT);
            if (!scheme.equals("http") && !scheme.equals("https")) {
                return null;
            }
            int port = uri.getPort() != -1 ? uri.getPort() : (scheme.equals("https") ? 443 : 80);
            String path = uri.getRawPath() == null ? "" : uri.getRawPath();
            while (path.endsWith("/")) {
                path = path.substring(0, path.length() - 1);
            }
            return new BaseUrl(scheme, uri.getHost().toLowerCase(Locale.ROOT), port, path);
        }

        boolean contains(BaseUrl other) {
            return scheme.equals(other.scheme)
                && host.equals(other.host)
                && port == other.port
                && (other.path.equals(path) || other.path.startsWith(path + "/"));
        }
    }
}
