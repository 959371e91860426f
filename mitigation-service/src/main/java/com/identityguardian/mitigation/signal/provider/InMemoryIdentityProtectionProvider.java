package com.identityguardian.mitigation.signal.provider;

import com.identityguardian.common.model.Principal;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** Identity protection levels held in process, for local runs and tests. */
public class InMemoryIdentityProtectionProvider implements IdentityProtectionProvider {

    private final Map<String, String> levels = new ConcurrentHashMap<>();

    public static InMemoryIdentityProtectionProvider withSampleLevels() {
        InMemoryIdentityProtectionProvider provider = new InMemoryIdentityProtectionProvider();
        provider.setLevel("user001", "Identity Protection Risk: low");
        provider.setLevel("user003", "Identity Protection Risk: high");
        return provider;
    }

    public void setLevel(String principalId, String level) {
        levels.put(principalId, level);
    }

    @Override
    public Mono<String> riskLevel(Principal principal) {
        return Mono.justOrEmpty(levels.get(principal.id()));
    }
}
