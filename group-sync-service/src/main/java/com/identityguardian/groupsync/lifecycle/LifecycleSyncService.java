package com.identityguardian.groupsync.lifecycle;

import com.identityguardian.common.directory.DirectoryService;
import com.identityguardian.common.exception.PrincipalNotFoundException;
import com.identityguardian.common.model.Principal;
import com.identityguardian.groupsync.config.GroupSyncProperties;
import com.identityguardian.groupsync.reconciler.GroupReconciler;
import com.identityguardian.groupsync.reconciler.PurgeResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Drives {@link GroupReconciler} from joiner / mover / leaver events and approved access grants.
 *
 * <pre>
 *   JOINER → get-or-create each role-mapped group, add member
 *   MOVER  → get-or-create new role group, add member; remove from old role group (best-effort)
 *   LEAVER → purge from every group
 * </pre>
 *
 * Roles and resources without a mapping in {@code groups.role-group-map} are skipped.
 */
@Service
public class LifecycleSyncService {

    private static final Logger log = LoggerFactory.getLogger(LifecycleSyncService.class);

    private final GroupReconciler reconciler;
    private final DirectoryService directory;
    private final GroupSyncProperties properties;

    public LifecycleSyncService(GroupReconciler reconciler, DirectoryService directory,
                                GroupSyncProperties properties) {
        this.reconciler = reconciler;
        this.directory  = directory;
        this.properties = properties;
    }

    public Mono<LifecycleResult> joiner(JoinerEvent event) {
        return requirePrincipal(event.principalId())
            .flatMapMany(principal -> Flux.fromIterable(event.roles()))
            .concatMap(role -> Mono.justOrEmpty(properties.groupFor(role)))
            .distinct()
            .concatMap(group -> joinGroup(event.principalId(), group))
            .collectList()
            .map(joined -> {
                log.info("Joiner processed. principalId={} roles={} groupsJoined={}",
                    event.principalId(), event.roles(), joined);
                return result(LifecycleEventType.JOINER, event.principalId(), joined, List.of(), List.of());
            });
    }

    public Mono<LifecycleResult> mover(MoverEvent event) {
        Optional<String> newGroup = properties.groupFor(event.newRole());
        Optional<String> oldGroup = properties.groupFor(event.previousRole())
            .filter(group -> newGroup.isEmpty() || !newGroup.get().equals(group));

        return requirePrincipal(event.principalId())
            .then(Mono.justOrEmpty(newGroup)
                .flatMap(group -> joinGroup(event.principalId(), group))
                .map(List::of)
                .defaultIfEmpty(List.of()))
            .flatMap(joined -> leaveGroup(event.principalId(), oldGroup)
                .map(outcome -> {
                    log.info("Mover processed. principalId={} previousRole={} newRole={} joined={} left={} warnings={}",
                        event.principalId(), event.previousRole(), event.newRole(),
                        joined, outcome.left(), outcome.warnings());
                    return result(LifecycleEventType.MOVER, event.principalId(), joined,
                        outcome.left(), outcome.warnings());
                }));
    }

    public Mono<LifecycleResult> leaver(LeaverEvent event) {
        return Mono.defer(() -> {
            requireField(event.principalId(), "principalId");
            return reconciler.purgePrincipal(event.principalId());
        })
            .map(purge -> {
                log.info("Leaver processed. principalId={} reason={} removedCount={} complete={}",
                    event.principalId(), event.reason(), purge.removedCount(), purge.complete());
                return result(LifecycleEventType.LEAVER, event.principalId(), List.of(),
                    purge.removedFrom(), purgeWarnings(purge));
            });
    }

    /** Mirrors an approved grant into its mapped group. Sync failures are reported, never raised. */
    public Mono<AccessGrantSync> accessGrant(AccessGrantEvent event) {
        return Mono.defer(() -> {
            requireField(event.principalId(), "principalId");
            requireField(event.resourceId(), "resourceId");
            return syncGrant(event);
        });
    }

    // ── private ───────────────────────────────────────────────────────────────

    private Mono<AccessGrantSync> syncGrant(AccessGrantEvent event) {
        Optional<String> mapped = properties.groupFor(event.resourceId());
        if (mapped.isEmpty()) {
            log.info("Access grant has no mapped group. principalId={} resourceId={}",
                event.principalId(), event.resourceId());
            return Mono.just(new AccessGrantSync(null, null, AccessGrantSync.UNMAPPED, null));
        }
        String displayName = reconciler.normalize(mapped.get());
        return reconciler.getOrCreateGroup(displayName)
            .flatMap(groupId -> reconciler.addMembers(groupId, Set.of(event.principalId()))
                .thenReturn(new AccessGrantSync(displayName, groupId, AccessGrantSync.MEMBER_ADDED, null)))
            .onErrorResume(e -> {
                log.error("Access grant group sync failed. principalId={} resourceId={} group={} error={}",
                    event.principalId(), event.resourceId(), displayName, e.getMessage());
                return Mono.just(new AccessGrantSync(displayName, null, AccessGrantSync.ERROR, e.getMessage()));
            });
    }

    private record LeaveOutcome(List<String> left, List<String> warnings) {}

    private Mono<Principal> requirePrincipal(String principalId) {
        return Mono.defer(() -> {
            requireField(principalId, "principalId");
            return directory.getPrincipal(principalId)
                .switchIfEmpty(Mono.error(() -> new PrincipalNotFoundException(principalId)));
        });
    }

    private Mono<String> joinGroup(String principalId, String group) {
        return reconciler.getOrCreateGroup(group)
            .flatMap(groupId -> reconciler.addMembers(groupId, Set.of(principalId)).thenReturn(groupId));
    }

    /** Removal from the previous role group never fails the move. */
    private Mono<LeaveOutcome> leaveGroup(String principalId, Optional<String> group) {
        if (group.isEmpty()) {
            return Mono.just(new LeaveOutcome(List.of(), List.of()));
        }
        return reconciler.findGroup(group.get())
            .flatMap(groupId -> reconciler.removeMembers(groupId, Set.of(principalId))
                .map(removed -> new LeaveOutcome(removed.isEmpty() ? List.of() : List.of(groupId), List.of())))
            .defaultIfEmpty(new LeaveOutcome(List.of(), List.of()))
            .onErrorResume(e -> {
                log.warn("Removal from previous role group failed. principalId={} group={} error={}",
                    principalId, group.get(), e.getMessage());
                return Mono.just(new LeaveOutcome(List.of(),
                    List.of("Could not remove from " + reconciler.normalize(group.get()) + ": " + e.getMessage())));
            });
    }

    private static List<String> purgeWarnings(PurgeResult purge) {
        List<String> warnings = new ArrayList<>();
        purge.failed().forEach(groupId -> warnings.add("Could not remove from group " + groupId));
        if (purge.listingError() != null) {
            warnings.add("Group enumeration incomplete: " + purge.listingError());
        }
        return warnings;
    }

    private static LifecycleResult result(LifecycleEventType type, String principalId, List<String> joined,
                                          List<String> left, List<String> warnings) {
        return new LifecycleResult("LC-" + UUID.randomUUID(), type, principalId,
            warnings.isEmpty() ? LifecycleResult.COMPLETED : LifecycleResult.PARTIAL,
            joined, left, warnings, Instant.now());
    }

    private static void requireField(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new InvalidLifecycleEventException(field + " is required");
        }
    }
}
