package com.identityguardian.groupsync.reconciler;

import com.identityguardian.common.directory.DirectoryException;
import com.identityguardian.common.directory.DirectoryService;
import com.identityguardian.common.directory.GroupConflictException;
import com.identityguardian.common.model.GroupRecord;
import com.identityguardian.groupsync.config.GroupSyncProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.function.Tuple2;
import reactor.util.function.Tuples;

import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Idempotent group maintenance against the directory.
 *
 * <p>Every operation is safe to repeat: membership calls only send the difference between the
 * requested and the current member set, and {@link #getOrCreateGroup} looks up before it
 * creates. Concurrent creators of one name share a single in-flight lookup-or-create; a create
 * conflict from another process is answered by looking the group up again.
 */
@Service
public class GroupReconciler {

    private static final Logger log = LoggerFactory.getLogger(GroupReconciler.class);

    private static final Comparator<GroupRecord> BY_GROUP_ID = Comparator.comparing(GroupRecord::groupId);

    private final DirectoryService directory;
    private final String prefix;
    private final int purgeConcurrency;

    private final Map<String, Mono<String>> creating = new ConcurrentHashMap<>();

    public GroupReconciler(DirectoryService directory, GroupSyncProperties properties) {
        this.directory        = directory;
        this.prefix           = properties.prefix();
        this.purgeConcurrency = properties.purgeConcurrency();
    }

    /** Applies the configured prefix once; already-prefixed names are left alone. */
    public String normalize(String displayName) {
        String name = displayName.trim();
        return name.startsWith(prefix) ? name : prefix + name;
    }

    /** Id of the group named {@code prefix + displayName}, creating the group when none exists. */
    public Mono<String> getOrCreateGroup(String displayName) {
        if (displayName == null || displayName.isBlank()) {
            return Mono.error(new IllegalArgumentException("Group display name must not be blank"));
        }
        String name = normalize(displayName);
        return Mono.defer(() -> {
            AtomicReference<Mono<String>> self = new AtomicReference<>();
            Mono<String> pipeline = findGroup(name)
                .switchIfEmpty(Mono.defer(() -> create(name)))
                .doFinally(signal -> creating.remove(name, self.get()))
                .cache();
            self.set(pipeline);
            Mono<String> running = creating.putIfAbsent(name, pipeline);
            return running != null ? running : pipeline;
        });
    }

    /** Id of an existing group by normalized name; empty when there is none. Never creates. */
    public Mono<String> findGroup(String displayName) {
        String name = normalize(displayName);
        return directory.listGroupsByDisplayName(name)
            .sort(BY_GROUP_ID)
            .next()
            .map(GroupRecord::groupId);
    }

    /** Adds the principals not yet in the group. Emits the ids actually added (possibly none). */
    public Mono<Set<String>> addMembers(String groupId, Set<String> principalIds) {
        return requireGroup(groupId).flatMap(group -> {
            Set<String> missing = new HashSet<>(principalIds);
            missing.removeAll(group.members());
            if (missing.isEmpty()) {
                log.debug("Add members is a no-op. groupId={} requested={}", groupId, principalIds.size());
                return Mono.just(Set.<String>of());
            }
            return directory.addGroupMembers(groupId, missing)
                .doOnSuccess(v -> log.info("Group members added. groupId={} added={}", groupId, missing))
                .thenReturn(Set.copyOf(missing));
        });
    }

    /** Removes the principals currently in the group. Emits the ids actually removed (possibly none). */
    public Mono<Set<String>> removeMembers(String groupId, Set<String> principalIds) {
        return requireGroup(groupId).flatMap(group -> {
            Set<String> present = new HashSet<>(principalIds);
            present.retainAll(group.members());
            if (present.isEmpty()) {
                log.debug("Remove members is a no-op. groupId={} requested={}", groupId, principalIds.size());
                return Mono.just(Set.<String>of());
            }
            return directory.removeGroupMembers(groupId, present)
                .doOnSuccess(v -> log.info("Group members removed. groupId={} removed={}", groupId, present))
                .thenReturn(Set.copyOf(present));
        });
    }

    /**
     * Removes the principal from every group that lists it. A failing group is recorded and
     * skipped; the remaining groups are still processed.
     */
    public Mono<PurgeResult> purgePrincipal(String principalId) {
        AtomicReference<String> listingError = new AtomicReference<>();
        return directory.listGroups()
            .onErrorResume(e -> {
                log.error("Group enumeration failed during purge. principalId={} error={}", principalId, e.getMessage());
                listingError.set(e.getMessage());
                return Flux.empty();
            })
            .filter(group -> group.hasMember(principalId))
            .flatMap(group -> removeFrom(group, principalId), purgeConcurrency)
            .collectList()
            .map(outcomes -> {
                List<String> removed = outcomes.stream().filter(Tuple2::getT2).map(Tuple2::getT1).sorted().toList();
                List<String> failed = outcomes.stream().filter(o -> !o.getT2()).map(Tuple2::getT1).sorted().toList();
                PurgeResult result = new PurgeResult(principalId, removed, failed, listingError.get());
                log.info("Principal purged from groups. principalId={} removed={} failed={} listingError={}",
                    principalId, result.removedCount(), failed.size(), result.listingError());
                return result;
            });
    }

    // ── private ───────────────────────────────────────────────────────────────

    /**
     * Creates the group, then re-reads by name: directories that accept duplicate display names
     * report no conflict, so another writer's group may exist alongside ours. The lowest id wins.
     */
    private Mono<String> create(String name) {
        return directory.createGroup(name)
            .doOnNext(group -> log.info("Group created. groupId={} displayName={}", group.groupId(), name))
            .map(GroupRecord::groupId)
            .flatMap(createdId -> findGroup(name)
                .defaultIfEmpty(createdId)
                .doOnNext(winner -> {
                    if (!winner.equals(createdId)) {
                        log.warn("Duplicate group created concurrently; using lowest id. displayName={} created={} using={}",
                            name, createdId, winner);
                    }
                }))
            .onErrorResume(GroupConflictException.class, conflict -> {
                log.info("Group created concurrently elsewhere, re-querying. displayName={}", name);
                return findGroup(name).switchIfEmpty(Mono.error(() -> new DirectoryException(
                    "Group " + name + " reported as existing but could not be found")));
            });
    }

    private Mono<GroupRecord> requireGroup(String groupId) {
        return directory.getGroup(groupId)
            .switchIfEmpty(Mono.error(() -> new DirectoryException("Group not found: " + groupId)));
    }

    private Mono<Tuple2<String, Boolean>> removeFrom(GroupRecord group, String principalId) {
        return directory.removeGroupMembers(group.groupId(), Set.of(principalId))
            .thenReturn(Tuples.of(group.groupId(), true))
            .onErrorResume(e -> {
                log.warn("Purge skipped group. principalId={} groupId={} displayName={} error={}",
                    principalId, group.groupId(), group.displayName(), e.getMessage());
                return Mono.just(Tuples.of(group.groupId(), false));
            });
    }
}
