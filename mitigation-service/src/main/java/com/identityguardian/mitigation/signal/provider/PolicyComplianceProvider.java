package com.identityguardian.mitigation.signal.provider;

import reactor.core.publisher.Mono;

import java.util.List;

/** Policy compliance check for one (principal, resource, access level) grant. */
public interface PolicyComplianceProvider {

    Mono<List<PolicyViolation>> check(String principalId, String resourceId, String accessLevel);
}
