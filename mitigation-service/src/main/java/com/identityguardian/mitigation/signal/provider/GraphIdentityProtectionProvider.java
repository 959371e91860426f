package com.identityguardian.mitigation.signal.provider;

import com.identityguardian.common.azure.GraphApiClient;
import com.identityguardian.common.model.Principal;
import reactor.core.publisher.Mono;

/**
 * Reads the Entra ID Identity Protection risk level from {@code /identityProtection/riskyUsers}.
 * Users never flagged by Identity Protection answer 404, which maps to an empty result.
 */
public class GraphIdentityProtectionProvider implements IdentityProtectionProvider {

    private final GraphApiClient graph;

    public GraphIdentityProtectionProvider(GraphApiClient graph) {
        this.graph = graph;
    }

    @Override
    public Mono<String> riskLevel(Principal principal) {
        return graph.get(b -> b.path("/identityProtection/riskyUsers/{id}")
                .queryParam("$select", "id,riskLevel,riskState")
                .build(principal.id()))
            .map(node -> {
                String state = node.path("riskState").asText("");
                if ("remediated".equalsIgnoreCase(state) || "dismissed".equalsIgnoreCase(state)) {
                    return "Identity Protection Risk: none (" + state + ")";
                }
                return "Identity Protection Risk: " + node.path("riskLevel").asText("none");
            });
    }
}
