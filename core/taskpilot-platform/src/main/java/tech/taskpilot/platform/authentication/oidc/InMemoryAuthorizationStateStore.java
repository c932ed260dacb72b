package tech.taskpilot.platform.authentication.oidc;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import tech.taskpilot.platform.authentication.AuthConfig;

import java.time.Duration;
import java.util.Optional;

/**
 * In-memory state store using Caffeine.
 *
 * <p>Fast, single-node. Not shared across multiple instances and lost on
 * restart. Entries expire after {@code taskpilot.auth.state.ttl} so abandoned
 * flows do not accumulate.
 */
@Singleton
public class InMemoryAuthorizationStateStore implements AuthorizationStateStore {

    private final Cache<String, PendingAuthorization> pending;

    @Inject
    public InMemoryAuthorizationStateStore(AuthConfig config) {
        this(config.state().ttl(), config.state().maxEntries());
    }

    public InMemoryAuthorizationStateStore(Duration ttl, long maxEntries) {
        this.pending = Caffeine.newBuilder()
            .expireAfterWrite(ttl)
            .maximumSize(maxEntries)
            .build();
    }

    @Override
    public void put(String state, PendingAuthorization authorization) {
        pending.put(state, authorization);
    }

    @Override
    public Optional<PendingAuthorization> consume(String state) {
        if (state == null || state.isEmpty()) {
            return Optional.empty();
        }
        // ConcurrentMap.remove is atomic: only one caller gets the value
        return Optional.ofNullable(pending.asMap().remove(state));
    }

    @Override
    public boolean isPending(String state) {
        return state != null && pending.getIfPresent(state) != null;
    }
}
