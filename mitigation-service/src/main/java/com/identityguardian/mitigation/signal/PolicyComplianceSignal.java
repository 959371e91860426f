package com.identityguardian.mitigation.signal;

import com.identityguardian.common.directory.DirectoryService;
import com.identityguardian.common.model.Principal;
import com.identityguardian.mitigation.signal.provider.PolicyComplianceProvider;
import com.identityguardian.mitigation.signal.provider.PolicyViolation;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Checks every access grant of the principal. 15 points per distinct uncompensated violation
 * (distinct by policy id and resource), capped at 45.
 */
@Component
@Order(4)
public class PolicyComplianceSignal implements SignalSource {

    public static final String NAME = "policy_compliance";

    static final int POINTS_PER_VIOLATION = 15;
    static final int MAX_POINTS           = 45;

    private final DirectoryService directory;
    private final PolicyComplianceProvider provider;

    public PolicyComplianceSignal(DirectoryService directory, PolicyComplianceProvider provider) {
        this.directory = directory;
        this.provider  = provider;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Mono<SignalReading> read(Principal principal) {
        return directory.listAccessGrants(principal.id())
            .concatMap(grant -> provider.check(principal.id(), grant.resourceId(), grant.accessLevel()))
            .collectList()
            .map(PolicyComplianceSignal::toReading);
    }

    private static SignalReading toReading(List<List<PolicyViolation>> perGrant) {
        Map<String, PolicyViolation> distinct = new LinkedHashMap<>();
        perGrant.stream()
            .flatMap(List::stream)
            .filter(v -> !v.compensated())
            .forEach(v -> distinct.putIfAbsent(v.key(), v));

        if (distinct.isEmpty()) {
            return SignalReading.ok(0, "No uncompensated policy violations", 0);
        }
        int points = Math.min(distinct.size() * POINTS_PER_VIOLATION, MAX_POINTS);
        return SignalReading.ok(points,
            distinct.size() + " uncompensated policy violations: " + String.join(", ", distinct.keySet()),
            distinct.size());
    }
}
