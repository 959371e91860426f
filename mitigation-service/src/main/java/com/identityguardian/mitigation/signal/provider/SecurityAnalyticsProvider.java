package com.identityguardian.mitigation.signal.provider;

import com.identityguardian.common.model.Principal;
import reactor.core.publisher.Mono;

import java.time.Duration;

/** Correlated detections from a security analytics workspace, scoped by a look-back window. */
public interface SecurityAnalyticsProvider {

    Mono<Long> countRiskySignIns(Principal principal, Duration window);

    Mono<Long> countPrivilegeEscalations(Principal principal, Duration window);

    /** Every sign-in in the window, risky or not. Zero means the account was not used. */
    Mono<Long> countSignIns(Principal principal, Duration window);
}
