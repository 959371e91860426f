package com.identityguardian.mitigation.signal.provider;

import com.identityguardian.common.model.Principal;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Detection counts and behaviour baselines held in process ({@code analytics.provider=memory}).
 * The look-back window is not applied; seeded counts are returned as-is. Principals without a
 * seeded sign-in count have signed in once.
 */
public class InMemorySecurityAnalyticsProvider implements SecurityAnalyticsProvider, BehaviorBaselineProvider {

    private static final double DEFAULT_BASELINE = 0.2;
    private static final long DEFAULT_SIGN_INS = 1L;

    private final Map<String, Long> riskySignIns = new ConcurrentHashMap<>();
    private final Map<String, Long> escalations = new ConcurrentHashMap<>();
    private final Map<String, Double> baselines = new ConcurrentHashMap<>();
    private final Map<String, Long> signIns = new ConcurrentHashMap<>();

    public void setRiskySignIns(String principalId, long count) {
        riskySignIns.put(principalId, count);
    }

    public void setPrivilegeEscalations(String principalId, long count) {
        escalations.put(principalId, count);
    }

    public void setSignIns(String principalId, long count) {
        signIns.put(principalId, count);
    }

    public void setBaseline(String principalId, double score) {
        baselines.put(principalId, score);
    }

    @Override
    public Mono<Long> countRiskySignIns(Principal principal, Duration window) {
        return Mono.just(riskySignIns.getOrDefault(principal.id(), 0L));
    }

    @Override
    public Mono<Long> countPrivilegeEscalations(Principal principal, Duration window) {
        return Mono.just(escalations.getOrDefault(principal.id(), 0L));
    }

    @Override
    public Mono<Long> countSignIns(Principal principal, Duration window) {
        return Mono.just(signIns.getOrDefault(principal.id(), DEFAULT_SIGN_INS));
    }

    @Override
    public Mono<Double> baselineRiskScore(Principal principal) {
        return Mono.just(baselines.getOrDefault(principal.id(), DEFAULT_BASELINE));
    }
}
