package com.identityguardian.mitigation.signal.provider;

import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Built-in governance rules evaluated per access grant.
 *
 * <ul>
 *   <li>{@code POL002} Privileged Access Review: admin access level or a privileged resource.</li>
 *   <li>{@code POL003} Data Access Classification: PII, financial or health data.</li>
 * </ul>
 *
 * A violation is compensated when {@code policyId@resourceId} is listed in
 * {@code compliance.compensated-controls}, e.g. an approved exception on record.
 */
public class RulePolicyComplianceProvider implements PolicyComplianceProvider {

    static final String PRIVILEGED_ACCESS_REVIEW = "POL002";
    static final String DATA_ACCESS_CLASSIFICATION = "POL003";

    private static final List<String> SENSITIVE_MARKERS = List.of("pii", "financial", "health");

    private final Set<String> compensatedControls;

    public RulePolicyComplianceProvider(Set<String> compensatedControls) {
        this.compensatedControls = Set.copyOf(compensatedControls);
    }

    @Override
    public Mono<List<PolicyViolation>> check(String principalId, String resourceId, String accessLevel) {
        return Mono.fromSupplier(() -> {
            String resource = resourceId == null ? "" : resourceId.toLowerCase(Locale.ROOT);
            String level = accessLevel == null ? "" : accessLevel.toLowerCase(Locale.ROOT);
            List<PolicyViolation> violations = new ArrayList<>();

            if (level.contains("admin") || resource.contains("privileged")) {
                violations.add(violation(PRIVILEGED_ACCESS_REVIEW, resourceId,
                    "Privileged access requires additional review", "medium"));
            }
            if (SENSITIVE_MARKERS.stream().anyMatch(resource::contains)) {
                violations.add(violation(DATA_ACCESS_CLASSIFICATION, resourceId,
                    "Sensitive data access requires DPO approval", "high"));
            }
            return violations;
        });
    }

    private PolicyViolation violation(String policyId, String resourceId, String description, String severity) {
        boolean compensated = compensatedControls.contains(policyId + "@" + resourceId);
        return new PolicyViolation(policyId, resourceId, description, severity, compensated);
    }
}
