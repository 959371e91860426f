package com.identityguardian.mitigation.signal;

import com.identityguardian.common.model.Principal;
import com.identityguardian.mitigation.signal.provider.BehaviorBaselineProvider;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

@Component
@Order(3)
public class BehaviorBaselineSignal implements SignalSource {

    public static final String NAME = "behavior_baseline";

    static final double ELEVATED_ABOVE = 0.5;
    static final int    ELEVATED_POINTS = 20;

    private final BehaviorBaselineProvider provider;

    public BehaviorBaselineSignal(BehaviorBaselineProvider provider) {
        this.provider = provider;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Mono<SignalReading> read(Principal principal) {
        return provider.baselineRiskScore(principal)
            .defaultIfEmpty(0.0)
            .map(baseline -> baseline > ELEVATED_ABOVE
                ? SignalReading.ok(ELEVATED_POINTS,
                    String.format("Elevated baseline behavioral risk (%.2f)", baseline), 1)
                : SignalReading.ok(0,
                    String.format("Baseline behavioral risk within normal range (%.2f)", baseline), 0));
    }
}
