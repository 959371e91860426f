package com.identityguardian.common.directory;

import com.identityguardian.common.model.AccessGrant;
import com.identityguardian.common.model.GroupRecord;
import com.identityguardian.common.model.Principal;
import com.identityguardian.common.model.PrincipalFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Process-local directory used for local runs ({@code directory.provider=memory}) and tests.
 *
 * <p>Thread-safe via {@link ConcurrentHashMap}; group membership updates are applied with
 * {@code compute} so concurrent adds and removes never lose an update. Display names are
 * unique, matching the conflict behaviour of a real tenant.
 */
public class InMemoryDirectoryService implements DirectoryService {

    private static final Logger log = LoggerFactory.getLogger(InMemoryDirectoryService.class);

    private final Map<String, Principal> principals = new ConcurrentHashMap<>();
    private final Map<String, List<AccessGrant>> grants = new ConcurrentHashMap<>();
    private final Map<String, GroupRecord> groups = new ConcurrentHashMap<>();
    private final Map<String, String> conditionalAccessBlocks = new ConcurrentHashMap<>();
    private final Map<String, String> privilegedRequests = new ConcurrentHashMap<>();

    /** A directory holding the sample tenant, for local runs. */
    public static InMemoryDirectoryService withSampleTenant() {
        InMemoryDirectoryService directory = new InMemoryDirectoryService();
        directory.seedSampleTenant();
        return directory;
    }

    // ── seeding ───────────────────────────────────────────────────────────────

    /** Three principals in Engineering, Finance and Security, with two resource grants. */
    public void seedSampleTenant() {
        putPrincipal(new Principal("user001", "john.doe@company.com", "John Doe",
            "Engineering", true, List.of("Developer", "Team Lead")));
        putPrincipal(new Principal("user002", "jane.smith@company.com", "Jane Smith",
            "Finance", true, List.of("Financial Analyst")));
        putPrincipal(new Principal("user003", "bob.wilson@company.com", "Bob Wilson",
            "Security", true, List.of("Security Analyst", "SIEM Admin")));
        putGrant(new AccessGrant("user002", "financial_records", "read"));
        putGrant(new AccessGrant("user003", "siem_console", "admin"));
    }

    public void putPrincipal(Principal principal) {
        principals.put(principal.id(), principal);
    }

    public void putGrant(AccessGrant grant) {
        grants.compute(grant.principalId(), (principalId, existing) -> {
            List<AccessGrant> next = existing == null ? new ArrayList<>() : new ArrayList<>(existing);
            next.add(grant);
            return List.copyOf(next);
        });
    }

    public GroupRecord putGroup(String groupId, String displayName, Set<String> members) {
        GroupRecord group = new GroupRecord(groupId, displayName, members);
        groups.put(groupId, group);
        return group;
    }

    public void putPrivilegedRequest(String requestId) {
        privilegedRequests.put(requestId, "PendingApproval");
    }

    // ── inspection ────────────────────────────────────────────────────────────

    public boolean isBlocked(String principalId) {
        return conditionalAccessBlocks.containsKey(principalId);
    }

    public boolean isEnabled(String principalId) {
        Principal principal = principals.get(principalId);
        return principal != null && principal.enabled();
    }

    public String privilegedRequestStatus(String requestId) {
        return privilegedRequests.get(requestId);
    }

    public int groupCount() {
        return groups.size();
    }

    // ── DirectoryService ──────────────────────────────────────────────────────

    @Override
    public Mono<Principal> getPrincipal(String principalId) {
        return Mono.justOrEmpty(principals.get(principalId));
    }

    @Override
    public Flux<Principal> listPrincipals(PrincipalFilter filter) {
        return Flux.defer(() -> Flux.fromIterable(new ArrayList<>(principals.values())))
            .filter(filter::matches);
    }

    @Override
    public Flux<AccessGrant> listAccessGrants(String principalId) {
        return Flux.defer(() -> Flux.fromIterable(grants.getOrDefault(principalId, List.of())));
    }

    @Override
    public Mono<String> disablePrincipal(String principalId, String reason) {
        return Mono.fromCallable(() -> {
            Principal updated = principals.computeIfPresent(principalId, (id, p) -> p.withEnabled(false));
            if (updated == null) {
                throw new DirectoryException("Cannot disable unknown principal " + principalId);
            }
            log.info("Principal disabled. principalId={} reason={}", principalId, reason);
            return "User " + principalId + " disabled. Reason: " + reason;
        });
    }

    @Override
    public Mono<String> enablePrincipal(String principalId) {
        return Mono.fromCallable(() -> {
            Principal updated = principals.computeIfPresent(principalId, (id, p) -> p.withEnabled(true));
            if (updated == null) {
                throw new DirectoryException("Cannot enable unknown principal " + principalId);
            }
            return "User " + principalId + " re-enabled.";
        });
    }

    @Override
    public Mono<String> conditionalAccessBlock(String principalId, String reason) {
        return Mono.fromCallable(() -> {
            if (!principals.containsKey(principalId)) {
                throw new DirectoryException("Cannot block unknown principal " + principalId);
            }
            String policyId = conditionalAccessBlocks.computeIfAbsent(principalId, id -> "mock-ca-" + id);
            log.info("Conditional access block applied. principalId={} policyId={}", principalId, policyId);
            return "Conditional Access block applied. Policy ID: " + policyId;
        });
    }

    @Override
    public Mono<String> removeConditionalAccessBlock(String principalId) {
        return Mono.fromCallable(() -> {
            int removed = conditionalAccessBlocks.remove(principalId) != null ? 1 : 0;
            return "Conditional Access block removed for " + principalId + ". Policies deleted: " + removed;
        });
    }

    @Override
    public Flux<GroupRecord> listGroups() {
        return Flux.defer(() -> Flux.fromIterable(new ArrayList<>(groups.values())));
    }

    @Override
    public Flux<GroupRecord> listGroupsByDisplayName(String displayName) {
        return listGroups().filter(g -> g.displayName().equals(displayName));
    }

    @Override
    public Mono<GroupRecord> getGroup(String groupId) {
        return Mono.fromSupplier(() -> groups.get(groupId));
    }

    @Override
    public Mono<GroupRecord> createGroup(String displayName) {
        return Mono.fromCallable(() -> {
            synchronized (groups) {
                boolean exists = groups.values().stream().anyMatch(g -> g.displayName().equals(displayName));
                if (exists) {
                    throw new GroupConflictException(displayName);
                }
                return putGroup("group-" + UUID.randomUUID(), displayName, Set.of());
            }
        });
    }

    @Override
    public Mono<Void> addGroupMembers(String groupId, Set<String> principalIds) {
        return Mono.fromRunnable(() -> updateMembers(groupId, members -> members.addAll(principalIds)));
    }

    @Override
    public Mono<Void> removeGroupMembers(String groupId, Set<String> principalIds) {
        return Mono.fromRunnable(() -> updateMembers(groupId, members -> members.removeAll(principalIds)));
    }

    @Override
    public Mono<String> approvePrivilegedRequest(String requestId) {
        return transitionRequest(requestId, "Provisioned");
    }

    @Override
    public Mono<String> rejectPrivilegedRequest(String requestId, String justification) {
        return transitionRequest(requestId, "Denied");
    }

    // ── private ───────────────────────────────────────────────────────────────

    private void updateMembers(String groupId, Consumer<Set<String>> mutation) {
        GroupRecord updated = groups.computeIfPresent(groupId, (id, g) -> {
            Set<String> members = new HashSet<>(g.members());
            mutation.accept(members);
            return new GroupRecord(id, g.displayName(), members);
        });
        if (updated == null) {
            throw new DirectoryException("Group not found: " + groupId);
        }
    }

    private Mono<String> transitionRequest(String requestId, String status) {
        return Mono.fromCallable(() -> {
            String previous = privilegedRequests.computeIfPresent(requestId, (id, s) -> status);
            if (previous == null) {
                throw new DirectoryException("Privileged request not found: " + requestId);
            }
            return "Request " + requestId + " " + status;
        });
    }
}
