package com.identityguardian.mitigation.scan;

import com.identityguardian.common.model.Principal;
import com.identityguardian.mitigation.config.SegregationOfDutiesProperties;
import com.identityguardian.mitigation.config.SegregationOfDutiesProperties.Policy;
import com.identityguardian.mitigation.support.FaultyDirectoryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SegregationOfDutiesScanServiceTest {

    private static final Policy FINANCE = new Policy("POL001", "Segregation of Duties - Finance",
        List.of(List.of("Finance_Approver", "Finance_Payment_Processor")));

    private FaultyDirectoryService directory;
    private SegregationOfDutiesScanService service;

    @BeforeEach
    void setUp() {
        directory = FaultyDirectoryService.sampleTenant();
        service   = new SegregationOfDutiesScanService(directory, new SegregationOfDutiesProperties(List.of(FINANCE)));
    }

    @Test
    @DisplayName("sample tenant holds no conflicting role set")
    void sampleTenantClean() {
        SodReport report = service.scan().block();

        assertNotNull(report);
        assertEquals(3, report.totalPrincipalsScanned());
        assertEquals(0, report.violationsFound());
    }

    @Test
    @DisplayName("holding every role of a conflicting set is a violation")
    void fullSetViolates() {
        directory.putPrincipal(new Principal("user010", "pay@company.com", "Pay Clerk", "Finance", true,
            List.of("Finance_Approver", "finance_payment_processor", "Reader")));

        SodReport report = service.scan().block();

        assertNotNull(report);
        assertEquals(1, report.violationsFound());
        SodViolation violation = report.violations().get(0);
        assertEquals("user010", violation.principalId());
        assertEquals("POL001", violation.policyId());
        assertEquals("Segregation of Duties - Finance", violation.policyName());
        assertEquals(List.of("Finance_Approver", "Finance_Payment_Processor"), violation.conflictingRoles());
        assertEquals("high", violation.severity());
    }

    @Test
    @DisplayName("a partial set, a disabled principal or an empty set is not a violation")
    void nonViolations() {
        directory.putPrincipal(new Principal("user011", "appr@company.com", "Approver", "Finance", true,
            List.of("Finance_Approver")));
        directory.putPrincipal(new Principal("user012", "old@company.com", "Old", "Finance", false,
            List.of("Finance_Approver", "Finance_Payment_Processor")));
        SegregationOfDutiesScanService withEmptySet = new SegregationOfDutiesScanService(directory,
            new SegregationOfDutiesProperties(List.of(FINANCE, new Policy("POL009", "Empty", List.of(List.of())))));

        SodReport report = withEmptySet.scan().block();

        assertNotNull(report);
        assertEquals(4, report.totalPrincipalsScanned());
        assertEquals(0, report.violationsFound());
    }
}
