package com.identityguardian.common.directory;

import com.identityguardian.common.model.AccessGrant;
import com.identityguardian.common.model.GroupRecord;
import com.identityguardian.common.model.Principal;
import com.identityguardian.common.model.PrincipalFilter;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Set;

/**
 * Directory capability shared by the mitigation engine, the approval callback handler and
 * the group reconciler.
 *
 * <p>The concrete strategy ({@link InMemoryDirectoryService} or
 * {@link GraphDirectoryService}) is selected once at startup by
 * {@link DirectoryConfiguration} and injected everywhere as this interface.
 *
 * <p>All methods are non-blocking. Failures are signalled as {@link DirectoryException};
 * {@code String} results are human-readable outcome messages.
 */
public interface DirectoryService {

    /** Empty when the principal does not exist. */
    Mono<Principal> getPrincipal(String principalId);

    Flux<Principal> listPrincipals(PrincipalFilter filter);

    Flux<AccessGrant> listAccessGrants(String principalId);

    Mono<String> disablePrincipal(String principalId, String reason);

    Mono<String> enablePrincipal(String principalId);

    /**
     * Applies a per-principal conditional access policy that denies authentication.
     * Strategies without conditional access support keep this default.
     */
    default Mono<String> conditionalAccessBlock(String principalId, String reason) {
        return Mono.error(new DirectoryException("Conditional access is not supported by this directory"));
    }

    default Mono<String> removeConditionalAccessBlock(String principalId) {
        return Mono.error(new DirectoryException("Conditional access is not supported by this directory"));
    }

    /** Every group, with its member set. */
    Flux<GroupRecord> listGroups();

    /** Groups whose display name equals {@code displayName} exactly. */
    Flux<GroupRecord> listGroupsByDisplayName(String displayName);

    /** Empty when the group does not exist. */
    Mono<GroupRecord> getGroup(String groupId);

    /**
     * Creates a group. Signals {@link GroupConflictException} when the directory rejects a
     * duplicate display name.
     */
    Mono<GroupRecord> createGroup(String displayName);

    Mono<Void> addGroupMembers(String groupId, Set<String> principalIds);

    Mono<Void> removeGroupMembers(String groupId, Set<String> principalIds);

    Mono<String> approvePrivilegedRequest(String requestId);

    Mono<String> rejectPrivilegedRequest(String requestId, String justification);
}
