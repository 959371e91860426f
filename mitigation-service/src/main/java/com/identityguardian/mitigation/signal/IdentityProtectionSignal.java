package com.identityguardian.mitigation.signal;

import com.identityguardian.common.model.Principal;
import com.identityguardian.mitigation.signal.provider.IdentityProtectionProvider;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.Locale;

/**
 * Maps the identity protection level to points.
 *
 * <pre>
 *   critical → 90
 *   high     → 80
 *   medium   → 50
 *   low      → 20
 *   none / unknown / no record → 0
 * </pre>
 *
 * Provider text such as {@code "Identity Protection Risk: high (confirmed)"} is reduced to the
 * level word: the part after the last colon, without any parenthesised suffix.
 */
@Component
@Order(1)
public class IdentityProtectionSignal implements SignalSource {

    public static final String NAME = "identity_protection";

    private final IdentityProtectionProvider provider;

    public IdentityProtectionSignal(IdentityProtectionProvider provider) {
        this.provider = provider;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Mono<SignalReading> read(Principal principal) {
        return provider.riskLevel(principal)
            .map(IdentityProtectionSignal::normalize)
            .defaultIfEmpty("none")
            .map(level -> SignalReading.ok(points(level), "Identity protection level: " + level,
                points(level) > 0 ? 1 : 0));
    }

    static String normalize(String providerText) {
        if (providerText == null) return "none";
        String level = providerText;
        int colon = level.lastIndexOf(':');
        if (colon >= 0) {
            level = level.substring(colon + 1);
        }
        int paren = level.indexOf('(');
        if (paren >= 0) {
            level = level.substring(0, paren);
        }
        level = level.trim().toLowerCase(Locale.ROOT);
        return level.isEmpty() ? "none" : level;
    }

    static int points(String level) {
        return switch (level) {
            case "critical" -> 90;
            case "high"     -> 80;
            case "medium"   -> 50;
            case "low"      -> 20;
            default         -> 0;
        };
    }
}
