package com.identityguardian.mitigation.store;

import com.identityguardian.common.model.MitigationAction;
import com.identityguardian.common.model.NotificationStatus;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-local store ({@code mitigation.store=memory}). Token transitions use
 * {@link ConcurrentHashMap#compute}; the pending-per-principal index is maintained under the
 * same principal key so insert and resolve cannot interleave.
 */
public class InMemoryMitigationActionStore implements MitigationActionStore {

    private final Map<String, MitigationAction> byToken = new ConcurrentHashMap<>();
    private final Map<String, String> pendingTokenByPrincipal = new ConcurrentHashMap<>();

    @Override
    public Mono<MitigationAction> save(MitigationAction action) {
        return Mono.fromSupplier(() -> {
            byToken.put(action.correlationToken(), action);
            return action;
        });
    }

    @Override
    public Mono<MitigationAction> findByToken(String correlationToken) {
        return Mono.fromSupplier(() -> byToken.get(correlationToken));
    }

    @Override
    public Mono<MitigationAction> findPendingByPrincipal(String principalId) {
        return Mono.fromSupplier(() -> {
            String token = pendingTokenByPrincipal.get(principalId);
            return token == null ? null : byToken.get(token);
        });
    }

    @Override
    public Mono<MitigationAction> insertPending(MitigationAction candidate) {
        return Mono.fromSupplier(() -> {
            String token = pendingTokenByPrincipal.compute(candidate.principalId(), (principal, existing) -> {
                MitigationAction current = existing == null ? null : byToken.get(existing);
                if (current != null && current.isPending()) {
                    return existing;
                }
                byToken.put(candidate.correlationToken(), candidate);
                return candidate.correlationToken();
            });
            return byToken.get(token);
        });
    }

    @Override
    public Mono<MitigationAction> resolveIfPending(String correlationToken, String outcome, Instant resolvedAt) {
        return Mono.fromSupplier(() -> {
            AtomicReference<MitigationAction> resolved = new AtomicReference<>();
            byToken.computeIfPresent(correlationToken, (token, action) -> {
                if (!action.isPending()) {
                    return action;
                }
                MitigationAction next = action.resolve(outcome, resolvedAt);
                resolved.set(next);
                return next;
            });
            MitigationAction action = resolved.get();
            if (action != null) {
                pendingTokenByPrincipal.remove(action.principalId(), correlationToken);
            }
            return action;
        });
    }

    @Override
    public Mono<MitigationAction> updateResolutionOutcome(String correlationToken, String outcome) {
        return Mono.fromSupplier(() -> {
            MitigationAction updated = byToken.computeIfPresent(correlationToken, (token, action) ->
                action.isPending() ? action : action.withResolutionOutcome(outcome));
            return updated == null || updated.isPending() ? null : updated;
        });
    }

    @Override
    public Mono<MitigationAction> updateNotificationStatus(String correlationToken, NotificationStatus status) {
        return Mono.fromSupplier(() ->
            byToken.computeIfPresent(correlationToken, (token, action) -> action.withNotificationStatus(status)));
    }

    public int pendingCount() {
        return pendingTokenByPrincipal.size();
    }
}
