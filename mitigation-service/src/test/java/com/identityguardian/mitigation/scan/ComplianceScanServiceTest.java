package com.identityguardian.mitigation.scan;

import com.identityguardian.common.model.Principal;
import com.identityguardian.common.model.RiskAssessment;
import com.identityguardian.common.model.RiskLevel;
import com.identityguardian.mitigation.risk.RiskAggregator;
import com.identityguardian.mitigation.signal.IdentityProtectionSignal;
import com.identityguardian.mitigation.signal.PolicyComplianceSignal;
import com.identityguardian.mitigation.signal.provider.InMemoryIdentityProtectionProvider;
import com.identityguardian.mitigation.signal.provider.RulePolicyComplianceProvider;
import com.identityguardian.mitigation.support.FaultyDirectoryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ComplianceScanServiceTest {

    private FaultyDirectoryService directory;
    private RiskAggregator aggregator;

    @BeforeEach
    void setUp() {
        directory = FaultyDirectoryService.sampleTenant();
        aggregator = new RiskAggregator(directory, List.of(
            new IdentityProtectionSignal(InMemoryIdentityProtectionProvider.withSampleLevels()),
            new PolicyComplianceSignal(directory, new RulePolicyComplianceProvider(Set.of()))),
            Duration.ofSeconds(2));
    }

    @Test
    @DisplayName("sample tenant → one critical principal, two with violations")
    void sampleTenant() {
        ComplianceReport report = new ComplianceScanService(directory, aggregator, 2).scan().block();

        assertNotNull(report);
        assertEquals(3, report.totalPrincipals());
        assertEquals(3, report.assessedPrincipals());
        assertEquals(List.of("user003"), report.highRiskPrincipals());
        assertEquals(1, report.byRiskLevel().get(RiskLevel.CRITICAL));
        assertEquals(2, report.byRiskLevel().get(RiskLevel.LOW));
        assertEquals(2, report.principalsWithViolations());
        assertEquals(2, report.totalViolations());
        assertEquals(66.7, report.complianceRate());
    }

    @Test
    @DisplayName("compliance rate counts high-risk principals, not principals with violations")
    void rateFromHighRisk() {
        RiskAggregator policyOnly = new RiskAggregator(directory, List.of(
            new PolicyComplianceSignal(directory, new RulePolicyComplianceProvider(Set.of()))),
            Duration.ofSeconds(2));

        ComplianceReport report = new ComplianceScanService(directory, policyOnly, 2).scan().block();

        assertNotNull(report);
        assertEquals(2, report.principalsWithViolations());
        assertTrue(report.highRiskPrincipals().isEmpty());
        assertEquals(100.0, report.complianceRate());
    }

    @Test
    @DisplayName("disabled principals are not scanned")
    void activeOnly() {
        directory.putPrincipal(new Principal("user009", "gone@company.com", "Gone", "Finance", false, List.of()));

        ComplianceReport report = new ComplianceScanService(directory, aggregator, 4).scan().block();

        assertNotNull(report);
        assertEquals(3, report.totalPrincipals());
    }

    @Test
    @DisplayName("a failing assessment is listed, the scan still completes")
    void failedPrincipal() {
        RiskAggregator failing = new RiskAggregator(directory, List.of(), Duration.ofSeconds(1)) {
            @Override
            public Mono<RiskAssessment> assess(Principal principal) {
                return "user002".equals(principal.id())
                    ? Mono.error(new IllegalStateException("boom"))
                    : super.assess(principal);
            }
        };

        ComplianceReport report = new ComplianceScanService(directory, failing, 4).scan().block();

        assertNotNull(report);
        assertEquals(List.of("user002"), report.failedPrincipals());
        assertEquals(2, report.assessedPrincipals());
        assertEquals(3, report.totalPrincipals());
    }
}
