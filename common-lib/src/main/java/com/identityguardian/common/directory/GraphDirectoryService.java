package com.identityguardian.common.directory;

import com.fasterxml.jackson.databind.JsonNode;
import com.identityguardian.common.azure.GraphApiClient;
import com.identityguardian.common.azure.GraphApiException;
import com.identityguardian.common.model.AccessGrant;
import com.identityguardian.common.model.GroupRecord;
import com.identityguardian.common.model.Principal;
import com.identityguardian.common.model.PrincipalFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Microsoft Graph backed {@link DirectoryService} ({@code directory.provider=graph}).
 *
 * <p>Conditional access blocks are per-principal policies named
 * {@code <policyPrefix>Block-<principalId>}, so removal finds them by display name without any
 * local state. When a policy template id is configured, the template's grant and session
 * controls are copied onto the block policy instead of the built-in {@code block} control.
 */
public class GraphDirectoryService implements DirectoryService {

    private static final Logger log = LoggerFactory.getLogger(GraphDirectoryService.class);

    private static final String USER_SELECT  = "id,userPrincipalName,displayName,department,accountEnabled,jobTitle";
    private static final String GROUP_SELECT = "id,displayName";
    private static final String DIRECTORY_OBJECT_REF = "https://graph.microsoft.com/v1.0/directoryObjects/";
    private static final int GROUP_MEMBER_CONCURRENCY = 4;

    private final GraphApiClient graph;
    private final String policyPrefix;
    private final String policyTemplateId;

    public GraphDirectoryService(GraphApiClient graph, String policyPrefix, String policyTemplateId) {
        this.graph            = graph;
        this.policyPrefix     = policyPrefix == null ? "" : policyPrefix;
        this.policyTemplateId = policyTemplateId == null ? "" : policyTemplateId;
    }

    // ── principals ────────────────────────────────────────────────────────────

    @Override
    public Mono<Principal> getPrincipal(String principalId) {
        return graph.get(b -> b.path("/users/{id}").queryParam("$select", USER_SELECT).build(principalId))
            .map(this::toPrincipal);
    }

    @Override
    public Flux<Principal> listPrincipals(PrincipalFilter filter) {
        String odata = toODataFilter(filter);
        return graph.getCollection(b -> {
                b.path("/users").queryParam("$select", USER_SELECT);
                if (!odata.isEmpty()) {
                    b.queryParam("$filter", "{filter}");
                }
                return odata.isEmpty() ? b.build() : b.build(odata);
            })
            .map(this::toPrincipal);
    }

    @Override
    public Flux<AccessGrant> listAccessGrants(String principalId) {
        return graph.getCollection(b -> b.path("/users/{id}/appRoleAssignments").build(principalId))
            .map(node -> new AccessGrant(principalId,
                node.path("resourceDisplayName").asText(""),
                node.path("appRoleId").asText("")));
    }

    @Override
    public Mono<String> disablePrincipal(String principalId, String reason) {
        return graph.patch(b -> b.path("/users/{id}").build(principalId), Map.of("accountEnabled", false))
            .then(Mono.fromSupplier(() -> {
                log.info("Principal disabled via Graph. principalId={} reason={}", principalId, reason);
                return "User " + principalId + " disabled. Reason: " + reason;
            }));
    }

    @Override
    public Mono<String> enablePrincipal(String principalId) {
        return graph.patch(b -> b.path("/users/{id}").build(principalId), Map.of("accountEnabled", true))
            .thenReturn("User " + principalId + " re-enabled.");
    }

    // ── conditional access ────────────────────────────────────────────────────

    @Override
    public Mono<String> conditionalAccessBlock(String principalId, String reason) {
        return resolveControls()
            .map(controls -> blockPolicy(principalId, controls))
            .flatMap(policy -> graph.post(b -> b.path("/identity/conditionalAccess/policies").build(), policy))
            .map(created -> {
                String policyId = created.path("id").asText("unknown");
                log.info("Conditional access block created. principalId={} policyId={} reason={}",
                    principalId, policyId, reason);
                return "Conditional Access block applied. Policy ID: " + policyId;
            })
            .switchIfEmpty(Mono.error(new DirectoryException("Conditional access policy creation returned no body")));
    }

    @Override
    public Mono<String> removeConditionalAccessBlock(String principalId) {
        String name = blockPolicyName(principalId);
        return graph.getCollection(b -> b.path("/identity/conditionalAccess/policies")
                .queryParam("$filter", "{filter}")
                .build("displayName eq '" + escape(name) + "'"))
            .map(policy -> policy.path("id").asText())
            .concatMap(id -> graph.delete(b -> b.path("/identity/conditionalAccess/policies/{id}").build(id))
                .thenReturn(id))
            .count()
            .map(deleted -> "Conditional Access block removed for " + principalId + ". Policies deleted: " + deleted);
    }

    // ── groups ────────────────────────────────────────────────────────────────

    @Override
    public Flux<GroupRecord> listGroups() {
        return graph.getCollection(b -> b.path("/groups").queryParam("$select", GROUP_SELECT).build())
            .flatMapSequential(this::withMembers, GROUP_MEMBER_CONCURRENCY);
    }

    @Override
    public Flux<GroupRecord> listGroupsByDisplayName(String displayName) {
        return graph.getCollection(b -> b.path("/groups")
                .queryParam("$select", GROUP_SELECT)
                .queryParam("$filter", "{filter}")
                .build("displayName eq '" + escape(displayName) + "'"))
            .flatMapSequential(this::withMembers, GROUP_MEMBER_CONCURRENCY);
    }

    @Override
    public Mono<GroupRecord> getGroup(String groupId) {
        return graph.get(b -> b.path("/groups/{id}").queryParam("$select", GROUP_SELECT).build(groupId))
            .flatMap(this::withMembers);
    }

    @Override
    public Mono<GroupRecord> createGroup(String displayName) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("displayName", displayName);
        body.put("mailEnabled", false);
        body.put("mailNickname", mailNickname(displayName));
        body.put("securityEnabled", true);
        return graph.post(b -> b.path("/groups").build(), body)
            .map(created -> new GroupRecord(created.path("id").asText(), displayName, Set.of()))
            .onErrorMap(e -> e instanceof GraphApiException gae && gae.isConflict(),
                e -> new GroupConflictException(displayName));
    }

    @Override
    public Mono<Void> addGroupMembers(String groupId, Set<String> principalIds) {
        return Flux.fromIterable(principalIds)
            .concatMap(id -> graph.post(b -> b.path("/groups/{gid}/members/$ref").build(groupId),
                    Map.of("@odata.id", DIRECTORY_OBJECT_REF + id))
                .onErrorResume(e -> e instanceof GraphApiException gae
                        && gae.getResponseBody().contains("already exist"),
                    e -> Mono.empty()))
            .then();
    }

    @Override
    public Mono<Void> removeGroupMembers(String groupId, Set<String> principalIds) {
        return Flux.fromIterable(principalIds)
            .concatMap(id -> graph.delete(b -> b.path("/groups/{gid}/members/{uid}/$ref").build(groupId, id)))
            .then();
    }

    // ── privileged access approvals ───────────────────────────────────────────

    @Override
    public Mono<String> approvePrivilegedRequest(String requestId) {
        return reviewApprovalStep(requestId, "Approve", "Approved via approval channel")
            .thenReturn("Request " + requestId + " approved");
    }

    @Override
    public Mono<String> rejectPrivilegedRequest(String requestId, String justification) {
        return reviewApprovalStep(requestId, "Deny", justification)
            .thenReturn("Request " + requestId + " rejected");
    }

    // ── private ───────────────────────────────────────────────────────────────

    private Mono<JsonNode> reviewApprovalStep(String approvalId, String reviewResult, String justification) {
        return graph.get(b -> b.path("/roleManagement/directory/roleAssignmentApprovals/{id}")
                .queryParam("$expand", "steps").build(approvalId))
            .switchIfEmpty(Mono.error(new DirectoryException("Privileged request not found: " + approvalId)))
            .flatMap(approval -> {
                String stepId = null;
                for (JsonNode step : approval.path("steps")) {
                    if ("InProgress".equalsIgnoreCase(step.path("status").asText())) {
                        stepId = step.path("id").asText();
                        break;
                    }
                }
                if (stepId == null) {
                    return Mono.error(new DirectoryException("No pending approval step for request " + approvalId));
                }
                String step = stepId;
                return graph.patch(b -> b.path("/roleManagement/directory/roleAssignmentApprovals/{id}/steps/{step}")
                        .build(approvalId, step),
                    Map.of("reviewResult", reviewResult, "justification", justification))
                    .defaultIfEmpty(approval);
            });
    }

    private Mono<Map<String, Object>> resolveControls() {
        Map<String, Object> builtIn = Map.of("grantControls",
            Map.of("operator", "OR", "builtInControls", List.of("block")));
        if (policyTemplateId.isBlank()) {
            return Mono.just(builtIn);
        }
        return graph.get(b -> b.path("/identity/conditionalAccess/templates/{id}").build(policyTemplateId))
            .map(template -> {
                Map<String, Object> controls = new LinkedHashMap<>();
                JsonNode details = template.path("details");
                if (details.hasNonNull("grantControls")) {
                    controls.put("grantControls", details.get("grantControls"));
                }
                if (details.hasNonNull("sessionControls")) {
                    controls.put("sessionControls", details.get("sessionControls"));
                }
                return controls.isEmpty() ? builtIn : controls;
            })
            .defaultIfEmpty(builtIn);
    }

    private Map<String, Object> blockPolicy(String principalId, Map<String, Object> controls) {
        Map<String, Object> policy = new LinkedHashMap<>();
        policy.put("displayName", blockPolicyName(principalId));
        policy.put("state", "enabled");
        policy.put("conditions", Map.of(
            "users", Map.of("includeUsers", List.of(principalId)),
            "applications", Map.of("includeApplications", List.of("All")),
            "clientAppTypes", List.of("all")));
        policy.putAll(controls);
        return policy;
    }

    private String blockPolicyName(String principalId) {
        return policyPrefix + "Block-" + principalId;
    }

    private Mono<GroupRecord> withMembers(JsonNode group) {
        String groupId = group.path("id").asText();
        return graph.getCollection(b -> b.path("/groups/{id}/members")
                .queryParam("$select", "id").build(groupId))
            .map(member -> member.path("id").asText())
            .collect(Collectors.toSet())
            .map(members -> new GroupRecord(groupId, group.path("displayName").asText(""), members));
    }

    private Principal toPrincipal(JsonNode node) {
        List<String> roles = new ArrayList<>();
        String jobTitle = node.path("jobTitle").asText("");
        if (!jobTitle.isBlank()) {
            roles.add(jobTitle);
        }
        return new Principal(
            node.path("id").asText(),
            node.path("userPrincipalName").asText(""),
            node.path("displayName").asText(""),
            node.path("department").asText(""),
            node.path("accountEnabled").asBoolean(true),
            roles);
    }

    private static String toODataFilter(PrincipalFilter filter) {
        List<String> clauses = new ArrayList<>();
        if (filter.enabled() != null) {
            clauses.add("accountEnabled eq " + filter.enabled());
        }
        if (filter.department() != null) {
            clauses.add("department eq '" + escape(filter.department()) + "'");
        }
        return String.join(" and ", clauses);
    }

    private static String mailNickname(String displayName) {
        String nickname = displayName.replaceAll("[^A-Za-z0-9-]", "");
        return nickname.isEmpty() ? "group" : nickname;
    }

    private static String escape(String value) {
        return value.replace("'", "''");
    }
}
