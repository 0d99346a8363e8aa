package com.dicomweb.oauth;

import com.dicomweb.oauth.config.ServerConfig;
import com.dicomweb.oauth.config.ServerRegistry;
import com.dicomweb.oauth.error.ConfigurationException;
import com.dicomweb.oauth.error.DicomWebOAuthException;
import com.dicomweb.oauth.error.ErrorCode;
import com.dicomweb.oauth.error.TokenAcquisitionException;
import com.dicomweb.oauth.error.TokenValidationException;
import com.dicomweb.oauth.jwt.JwtValidator;
import com.dicomweb.oauth.metrics.TokenMetrics;
import com.dicomweb.oauth.provider.DefaultTokenProviderFactory;
import com.dicomweb.oauth.provider.ProviderContext;
import com.dicomweb.oauth.provider.TokenProvider;
import com.dicomweb.oauth.provider.TokenProviderFactory;
import com.dicomweb.oauth.provider.TokenResponse;
import com.dicomweb.oauth.security.SecretRedactor;
import com.dicomweb.oauth.security.SecretVault;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Hands out a currently valid access token per configured server.
 * <p>
 * A cached token is returned without I/O while {@code now < expiresAt - refreshBuffer}.
 * Otherwise one acquisition runs per server at a time: the first caller starts it and
 * every concurrent caller for that server waits for the same result, success or error.
 * Servers never wait on each other. A failed acquisition leaves the cache as it was and is
 * not retried here; retry policy belongs to the caller.
 * <p>
 * Tokens are sealed in a {@link SecretVault} while cached and the manager keeps no client
 * secrets of its own; those live sealed inside the providers.
 */
@Slf4j
public class TokenManager implements AutoCloseable {

    private final Map<String, ServerEntry> servers;
    private final SecretVault vault;
    private final boolean ownsVault;
    private final Clock clock;
    private final ExecutorService executor;
    private final boolean ownsExecutor;
    private final TokenMetrics metrics;
    private volatile boolean closed;

    public TokenManager(ServerRegistry registry) {
        this(registry, new SecretVault(), true, null, Clock.systemUTC(), null, new TokenMetrics());
    }

    /**
     * @param factory  creates the provider of each server
     * @param executor runs acquisitions; {@code null} for an internal pool closed with the manager
     */
    public TokenManager(ServerRegistry registry, SecretVault vault, TokenProviderFactory factory,
                        Clock clock, ExecutorService executor) {
        this(registry, vault, factory, clock, executor, new TokenMetrics());
    }

    public TokenManager(ServerRegistry registry, SecretVault vault, TokenProviderFactory factory,
                        Clock clock, ExecutorService executor, TokenMetrics metrics) {
        this(registry, vault, false, factory, clock, executor, metrics);
    }

    private TokenManager(ServerRegistry registry, SecretVault vault, boolean ownsVault,
                         TokenProviderFactory factory, Clock clock, ExecutorService executor,
                         TokenMetrics metrics) {
        this.vault = vault;
        this.metrics = metrics;
        this.ownsVault = ownsVault;
        this.clock = clock;
        this.ownsExecutor = executor == null;
        this.executor = executor != null ? executor : Executors.newCachedThreadPool(daemonThreads());

        TokenProviderFactory providers = factory != null
            ? factory
            : new DefaultTokenProviderFactory(ProviderContext.builder().vault(vault).clock(clock).build());
        Map<String, ServerEntry> entries = new LinkedHashMap<>();
        for (ServerConfig config : registry.all()) {
            TokenProvider provider = providers.create(config);
            JwtValidator validator = config.jwtValidationEnabled() ? new JwtValidator(config.getJwt(), clock) : null;
            entries.put(config.getName(), new ServerEntry(config.withoutSecret(), provider, validator));
            log.info("Registered server '{}' with {} provider{}", config.getName(), provider.type().getConfigName(),
                validator != null ? " and JWT validation" : "");
        }
        this.servers = Collections.unmodifiableMap(entries);
    }

    public TokenMetrics getMetrics() {
        return metrics;
    }

    public Set<String> serverNames() {
        return servers.keySet();
    }

    public String getToken(String serverName) {
        return getToken(serverName, false);
    }

    /**
     * Blocks until a token is available. An interrupted caller gives up its wait with a
     * {@link TokenAcquisitionException}; the acquisition itself carries on and still fills the cache.
     *
     * @throws ConfigurationException    when the server is not configured
     * @throws TokenAcquisitionException when the provider fails
     * @throws TokenValidationException  when the acquired token is rejected
     */
    public String getToken(String serverName, boolean forceRefresh) {
        ServerEntry entry = entry(serverName);
        if (!forceRefresh) {
            CachedToken cached = entry.cached.get();
            if (cached != null && cached.isUsableAt(clock.instant(), entry.config.getRefreshBufferSeconds())) {
                metrics.recordCacheHit(serverName);
                return vault.open(cached.accessToken());
            }
        }
        metrics.recordCacheMiss(serverName);
        try {
            return vault.open(refresh(entry, forceRefresh).get().accessToken());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TokenAcquisitionException(ErrorCode.TOKEN_ACQUISITION_FAILED, serverName,
                entry.provider.type(), "interrupted while waiting for token", e);
        } catch (ExecutionException e) {
            throw propagate(entry, e.getCause());
        }
    }

    /**
     * Non-blocking variant. Cancelling the returned future abandons only this caller's wait.
     */
    public CompletableFuture<String> getTokenAsync(String serverName, boolean forceRefresh) {
        ServerEntry entry = entry(serverName);
        if (!forceRefresh) {
            CachedToken cached = entry.cached.get();
            if (cached != null && cached.isUsableAt(clock.instant(), entry.config.getRefreshBufferSeconds())) {
                metrics.recordCacheHit(serverName);
                return CompletableFuture.completedFuture(vault.open(cached.accessToken()));
            }
        }
        metrics.recordCacheMiss(serverName);
        CompletableFuture<String> result = new CompletableFuture<>();
        refresh(entry, forceRefresh).whenComplete((token, error) -> {
            if (error != null) {
                result.completeExceptionally(propagate(entry, error));
                return;
            }
            try {
                result.complete(vault.open(token.accessToken()));
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        });
        return result;
    }

    /**
     * Drops the cached token so the next request acquires a new one. A running acquisition
     * is not affected.
     */
    public void invalidateToken(String serverName) {
        ServerEntry entry = entry(serverName);
        if (entry.cached.getAndSet(null) != null) {
            log.info("Invalidated cached token for server '{}'", serverName);
        }
    }

    public TokenStatus status(String serverName) {
        return status(entry(serverName));
    }

    public List<TokenStatus> statuses() {
        List<TokenStatus> result = new ArrayList<>(servers.size());
        servers.values().forEach(entry -> result.add(status(entry)));
        return result;
    }

    /**
     * Starts an acquisition for every cached token inside its refresh buffer. Servers that
     * never acquired a token are left alone. Failures are logged, not thrown.
     *
     * @return number of servers for which a refresh was started or joined
     */
    public int refreshExpiring() {
        ensureOpen();
        Instant now = clock.instant();
        int started = 0;
        for (ServerEntry entry : servers.values()) {
            CachedToken cached = entry.cached.get();
            if (cached == null || cached.isUsableAt(now, entry.config.getRefreshBufferSeconds())) {
                continue;
            }
            started++;
            refresh(entry, false).whenComplete((token, error) -> {
                if (error != null) {
                    log.warn("Proactive refresh for server '{}' failed: {}", entry.config.getName(),
                        unwrap(error).getMessage());
                }
            });
        }
        return started;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (ownsExecutor) {
            executor.shutdownNow();
        }
        servers.values().forEach(entry -> entry.cached.set(null));
        if (ownsVault) {
            vault.close();
        }
        log.info("Token manager closed");
    }

    private CompletableFuture<CachedToken> refresh(ServerEntry entry, boolean force) {
        while (true) {
            CompletableFuture<CachedToken> running = entry.inFlight.get();
            if (running != null) {
                log.debug("Joining running acquisition for server '{}'", entry.config.getName());
                return running;
            }
            CompletableFuture<CachedToken> mine = new CompletableFuture<>();
            if (entry.inFlight.compareAndSet(null, mine)) {
                try {
                    executor.execute(() -> runAcquisition(entry, force, mine));
                } catch (RejectedExecutionException e) {
                    entry.inFlight.compareAndSet(mine, null);
                    mine.completeExceptionally(new TokenAcquisitionException(ErrorCode.TOKEN_ACQUISITION_FAILED,
                        entry.config.getName(), entry.provider.type(), "token manager is closed", e));
                }
                return mine;
            }
        }
    }

    private void runAcquisition(ServerEntry entry, boolean force, CompletableFuture<CachedToken> result) {
        CachedToken token;
        try {
            CachedToken current = entry.cached.get();
            // another acquisition may have completed between the cache check and winning the slot
            if (!force && current != null
                && current.isUsableAt(clock.instant(), entry.config.getRefreshBufferSeconds())) {
                token = current;
            } else {
                token = acquire(entry);
            }
        } catch (Throwable e) {
            entry.inFlight.compareAndSet(result, null);
            result.completeExceptionally(e);
            if (e instanceof Error) {
                throw (Error) e;
            }
            return;
        }
        entry.inFlight.compareAndSet(result, null);
        result.complete(token);
    }

    private CachedToken acquire(ServerEntry entry) {
        String name = entry.config.getName();
        Timer.Sample sample = metrics.startTimer();
        try {
            CachedToken token = fetch(entry);
            metrics.recordAcquisition(sample, name, true);
            return token;
        } catch (DicomWebOAuthException e) {
            metrics.recordAcquisition(sample, name, false);
            metrics.recordError(name, e.getErrorCode());
            throw e;
        }
    }

    private CachedToken fetch(ServerEntry entry) {
        String name = entry.config.getName();
        Instant requestedAt = clock.instant();
        log.debug("Acquiring token for server '{}'", name);

        TokenResponse response;
        try {
            response = entry.provider.acquire();
        } catch (DicomWebOAuthException e) {
            log.error("Token acquisition for server '{}' failed: {}", name, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("Token acquisition for server '{}' failed unexpectedly", name, e);
            throw new TokenAcquisitionException(ErrorCode.TOKEN_ACQUISITION_FAILED, name, entry.provider.type(),
                "unexpected " + e.getClass().getSimpleName(), e);
        }

        Instant expiresAt = expiresAt(entry, requestedAt, response.expiresInSeconds());

        if (entry.validator != null) {
            try {
                entry.validator.validate(response.accessToken());
            } catch (TokenValidationException e) {
                log.warn("Token for server '{}' rejected: {}", name, e.getFailure());
                throw e.forServer(name);
            }
        }

        // a slow acquisition can outlive a short lifetime
        if (!clock.instant().isBefore(expiresAt)) {
            log.error("Token for server '{}' expired at {} before it could be cached", name, expiresAt);
            throw new TokenAcquisitionException(ErrorCode.TOKEN_INVALID_RESPONSE, name, entry.provider.type(),
                "token expired at " + expiresAt + " before acquisition completed");
        }

        CachedToken token = new CachedToken(vault.seal(response.accessToken()), expiresAt, requestedAt,
            response.tokenType());
        entry.cached.set(token);
        log.info("Acquired token for server '{}' ({}), expires at {}", name,
            SecretRedactor.maskToken(response.accessToken()), token.expiresAt());
        return token;
    }

    private static Instant expiresAt(ServerEntry entry, Instant requestedAt, long expiresInSeconds) {
        if (expiresInSeconds <= 0 || expiresInSeconds > TokenResponse.MAX_EXPIRES_IN_SECONDS) {
            throw new TokenAcquisitionException(ErrorCode.TOKEN_INVALID_RESPONSE, entry.config.getName(),
                entry.provider.type(), "expires_in " + expiresInSeconds + " is out of range");
        }
        try {
            return requestedAt.plusSeconds(expiresInSeconds);
        } catch (DateTimeException | ArithmeticException e) {
            throw new TokenAcquisitionException(ErrorCode.TOKEN_INVALID_RESPONSE, entry.config.getName(),
                entry.provider.type(), "expires_in " + expiresInSeconds + " is out of range", e);
        }
    }

    private TokenStatus status(ServerEntry entry) {
        Instant now = clock.instant();
        CachedToken cached = entry.cached.get();
        return new TokenStatus(
            entry.config.getName(),
            entry.provider.type(),
            cached != null,
            cached == null ? null : cached.acquiredAt(),
            cached == null ? null : cached.expiresAt(),
            cached == null ? null : cached.tokenType(),
            cached != null && !cached.isExpiredAt(now),
            cached == null || !cached.isUsableAt(now, entry.config.getRefreshBufferSeconds()),
            entry.inFlight.get() != null);
    }

    private ServerEntry entry(String serverName) {
        ensureOpen();
        ServerEntry entry = serverName == null ? null : servers.get(serverName);
        if (entry == null) {
            throw ConfigurationException.unknownServer(serverName);
        }
        return entry;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Token manager is closed");
        }
    }

    private static RuntimeException propagate(ServerEntry entry, Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof RuntimeException) {
            return (RuntimeException) cause;
        }
        return new TokenAcquisitionException(ErrorCode.TOKEN_ACQUISITION_FAILED, entry.config.getName(),
            entry.provider.type(), "acquisition failed: " + cause, cause);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "dicomweb-oauth-acquire-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static final class ServerEntry {
        private final ServerConfig config;
        private final TokenProvider provider;
        private final JwtValidator validator;
        private final AtomicReference<CachedToken> cached = new AtomicReference<>();
        private final AtomicReference<CompletableFuture<CachedToken>> inFlight = new AtomicReference<>();

        private ServerEntry(ServerConfig config, TokenProvider provider, JwtValidator validator) {
            this.config = config;
            this.provider = provider;
            this.validator = validator;
        }
    }
}
