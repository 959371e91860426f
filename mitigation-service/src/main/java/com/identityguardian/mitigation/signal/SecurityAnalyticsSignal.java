package com.identityguardian.mitigation.signal;

import com.identityguardian.common.model.Principal;
import com.identityguardian.mitigation.signal.provider.SecurityAnalyticsProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * {@code min(riskySignIns * 30 + privilegeEscalations * 50, 100)} over the analytics window.
 * Both queries run concurrently; if either fails the whole source is unavailable.
 */
@Component
@Order(2)
public class SecurityAnalyticsSignal implements SignalSource {

    public static final String NAME = "security_analytics";

    static final int POINTS_PER_RISKY_SIGN_IN = 30;
    static final int POINTS_PER_ESCALATION    = 50;
    static final int MAX_POINTS               = 100;

    private final SecurityAnalyticsProvider provider;
    private final Duration window;

    public SecurityAnalyticsSignal(SecurityAnalyticsProvider provider,
                                   @Value("${risk.analytics-window:24h}") Duration window) {
        this.provider = provider;
        this.window   = window;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Mono<SignalReading> read(Principal principal) {
        return Mono.zip(
                provider.countRiskySignIns(principal, window).defaultIfEmpty(0L),
                provider.countPrivilegeEscalations(principal, window).defaultIfEmpty(0L))
            .map(counts -> {
                long signIns = counts.getT1();
                long escalations = counts.getT2();
                int points = score(signIns, escalations);
                return SignalReading.ok(points,
                    signIns + " risky sign-ins and " + escalations + " privilege escalations in the last "
                        + window.toHours() + "h",
                    (int) (signIns + escalations));
            });
    }

    static int score(long riskySignIns, long escalations) {
        long raw = riskySignIns * POINTS_PER_RISKY_SIGN_IN + escalations * POINTS_PER_ESCALATION;
        return (int) Math.min(raw, MAX_POINTS);
    }
}
