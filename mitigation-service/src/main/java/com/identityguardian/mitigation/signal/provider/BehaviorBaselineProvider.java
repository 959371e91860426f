package com.identityguardian.mitigation.signal.provider;

import com.identityguardian.common.model.Principal;
import reactor.core.publisher.Mono;

public interface BehaviorBaselineProvider {

    /** Baseline behavioural risk in [0, 1]. Values above 0.5 are considered elevated. */
    Mono<Double> baselineRiskScore(Principal principal);
}
