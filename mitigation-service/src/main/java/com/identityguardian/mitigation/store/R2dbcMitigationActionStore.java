package com.identityguardian.mitigation.store;

import com.identityguardian.common.model.MitigationAction;
import com.identityguardian.common.model.MitigationKind;
import com.identityguardian.common.model.MitigationState;
import com.identityguardian.common.model.NotificationStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Durable store ({@code mitigation.store=r2dbc}) backed by the {@code mitigation_action} table.
 *
 * <p>Resolution is a conditional {@code UPDATE ... WHERE state = 'PENDING_REVIEW'}. The
 * pending-per-principal check and insert are serialized per principal within this process.
 */
public class R2dbcMitigationActionStore implements MitigationActionStore {

    private static final Logger log = LoggerFactory.getLogger(R2dbcMitigationActionStore.class);

    private final MitigationActionRepository repository;
    private final Map<String, Mono<MitigationAction>> pendingInserts = new ConcurrentHashMap<>();

    public R2dbcMitigationActionStore(MitigationActionRepository repository) {
        this.repository = repository;
    }

    @Override
    public Mono<MitigationAction> save(MitigationAction action) {
        return repository.save(toEntity(action)).map(R2dbcMitigationActionStore::toDomain);
    }

    @Override
    public Mono<MitigationAction> findByToken(String correlationToken) {
        return repository.findByCorrelationToken(correlationToken).map(R2dbcMitigationActionStore::toDomain);
    }

    @Override
    public Mono<MitigationAction> findPendingByPrincipal(String principalId) {
        return repository.findPendingByPrincipal(principalId).map(R2dbcMitigationActionStore::toDomain);
    }

    @Override
    public Mono<MitigationAction> insertPending(MitigationAction candidate) {
        String principalId = candidate.principalId();
        return Mono.defer(() -> {
            AtomicReference<Mono<MitigationAction>> self = new AtomicReference<>();
            Mono<MitigationAction> insert = findPendingByPrincipal(principalId)
                .switchIfEmpty(Mono.defer(() -> save(candidate)))
                .doFinally(s -> pendingInserts.remove(principalId, self.get()))
                .cache();
            self.set(insert);
            Mono<MitigationAction> running = pendingInserts.putIfAbsent(principalId, insert);
            return running != null ? running : insert;
        });
    }

    @Override
    public Mono<MitigationAction> resolveIfPending(String correlationToken, String outcome, Instant resolvedAt) {
        return repository.resolveIfPending(correlationToken, outcome, toUtc(resolvedAt))
            .flatMap(updated -> {
                if (updated == 0) {
                    log.info("Resolution skipped, action not pending. token={}", correlationToken);
                    return Mono.empty();
                }
                return findByToken(correlationToken);
            });
    }

    @Override
    public Mono<MitigationAction> updateResolutionOutcome(String correlationToken, String outcome) {
        return repository.updateResolutionOutcome(correlationToken, outcome)
            .flatMap(updated -> updated == 0 ? Mono.<MitigationAction>empty() : findByToken(correlationToken));
    }

    @Override
    public Mono<MitigationAction> updateNotificationStatus(String correlationToken, NotificationStatus status) {
        return repository.updateNotificationStatus(correlationToken, status.name())
            .then(findByToken(correlationToken));
    }

    // ── mapping ───────────────────────────────────────────────────────────────

    static MitigationActionEntity toEntity(MitigationAction action) {
        MitigationActionEntity entity = new MitigationActionEntity();
        entity.setCorrelationToken(action.correlationToken());
        entity.setPrincipalId(action.principalId());
        entity.setKind(action.kind().name());
        entity.setState(action.state().name());
        entity.setReason(action.reason());
        entity.setCompositeScore(action.compositeScore());
        entity.setDirectorySucceeded(action.directorySucceeded());
        entity.setDirectoryMessage(action.directoryMessage());
        entity.setNotificationStatus(action.notificationStatus().name());
        entity.setCreatedAt(toUtc(action.createdAt()));
        entity.setResolvedAt(toUtc(action.resolvedAt()));
        entity.setResolutionOutcome(action.resolutionOutcome());
        return entity;
    }

    static MitigationAction toDomain(MitigationActionEntity entity) {
        return new MitigationAction(
            entity.getCorrelationToken(),
            entity.getPrincipalId(),
            MitigationKind.valueOf(entity.getKind()),
            MitigationState.valueOf(entity.getState()),
            entity.getReason(),
            entity.getCompositeScore(),
            entity.isDirectorySucceeded(),
            entity.getDirectoryMessage(),
            NotificationStatus.valueOf(entity.getNotificationStatus()),
            toInstant(entity.getCreatedAt()),
            toInstant(entity.getResolvedAt()),
            entity.getResolutionOutcome());
    }

    private static LocalDateTime toUtc(Instant instant) {
        return instant == null ? null : LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    private static Instant toInstant(LocalDateTime value) {
        return value == null ? null : value.toInstant(ZoneOffset.UTC);
    }
}
