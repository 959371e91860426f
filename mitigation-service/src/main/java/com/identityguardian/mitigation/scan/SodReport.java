package com.identityguardian.mitigation.scan;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

public record SodReport(
    @JsonProperty("reportId") String reportId,
    @JsonProperty("generatedAt") Instant generatedAt,
    @JsonProperty("totalPrincipalsScanned") int totalPrincipalsScanned,
    @JsonProperty("violations") List<SodViolation> violations
) {
    @JsonProperty("violationsFound")
    public int violationsFound() {
        return violations.size();
    }
}
