package com.identityguardian.mitigation.signal.provider;

import com.identityguardian.common.model.Principal;
import reactor.core.publisher.Mono;

public interface IdentityProtectionProvider {

    /**
     * Textual risk level as reported by the provider, e.g.
     * {@code "Identity Protection Risk: high"}. Empty when the principal has no risk record.
     */
    Mono<String> riskLevel(Principal principal);
}
