package com.identityguardian.mitigation.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * Segregation-of-duties policies ({@code compliance.sod.*}). A principal violates a policy when
 * it holds every role of one of the policy's conflicting role sets.
 *
 * <pre>
 * compliance:
 *   sod:
 *     policies:
 *       - policy-id: POL001
 *         name: Segregation of Duties - Finance
 *         conflicting-roles:
 *           - [Finance_Approver, Finance_Payment_Processor]
 * </pre>
 */
@ConfigurationProperties(prefix = "compliance.sod")
public record SegregationOfDutiesProperties(List<Policy> policies) {

    public SegregationOfDutiesProperties {
        policies = policies == null ? List.of() : List.copyOf(policies);
    }

    public record Policy(String policyId, String name, List<List<String>> conflictingRoles) {
        public Policy {
            conflictingRoles = conflictingRoles == null ? List.of()
                : conflictingRoles.stream().map(List::copyOf).toList();
        }
    }
}
