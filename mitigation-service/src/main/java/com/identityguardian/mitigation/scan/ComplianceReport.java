package com.identityguardian.mitigation.scan;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.identityguardian.common.model.RiskLevel;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Tenant-wide risk summary. {@code complianceRate} is the percentage of assessed principals
 * that are not high risk (below {@link RiskLevel#HIGH}), rounded to one decimal place.
 */
public record ComplianceReport(
    @JsonProperty("reportId") String reportId,
    @JsonProperty("generatedAt") Instant generatedAt,
    @JsonProperty("totalPrincipals") int totalPrincipals,
    @JsonProperty("assessedPrincipals") int assessedPrincipals,
    @JsonProperty("failedPrincipals") List<String> failedPrincipals,
    @JsonProperty("byRiskLevel") Map<RiskLevel, Integer> byRiskLevel,
    @JsonProperty("highRiskPrincipals") List<String> highRiskPrincipals,
    @JsonProperty("principalsWithViolations") int principalsWithViolations,
    @JsonProperty("totalViolations") int totalViolations,
    @JsonProperty("complianceRate") double complianceRate
) {}
