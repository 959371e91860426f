package com.identityguardian.mitigation.signal;

import com.identityguardian.common.directory.InMemoryDirectoryService;
import com.identityguardian.common.model.AccessGrant;
import com.identityguardian.common.model.Principal;
import com.identityguardian.mitigation.signal.provider.InMemoryIdentityProtectionProvider;
import com.identityguardian.mitigation.signal.provider.InMemorySecurityAnalyticsProvider;
import com.identityguardian.mitigation.signal.provider.RulePolicyComplianceProvider;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SignalSourcesTest {

    private static final Principal ALICE =
        new Principal("alice", "alice@company.com", "Alice", "Finance", true, List.of());

    // ── identity protection ─────────────────────────────────────────────────

    @Nested
    @DisplayName("IdentityProtectionSignal")
    class IdentityProtection {

        @ParameterizedTest(name = "\"{0}\" → {1}")
        @CsvSource({
            "'Identity Protection Risk: critical', 90",
            "'Identity Protection Risk: high',     80",
            "'Identity Protection Risk: medium',   50",
            "'Identity Protection Risk: low',      20",
            "'Identity Protection Risk: none',     0",
            "'HIGH (confirmed compromised)',       80",
            "'Identity Protection Risk: hidden',   0"
        })
        void mapsLevelToPoints(String providerText, int expected) {
            assertEquals(expected, IdentityProtectionSignal.points(IdentityProtectionSignal.normalize(providerText)));
        }

        @Test
        @DisplayName("no risk record → available zero reading")
        void noRecord() {
            IdentityProtectionSignal signal = new IdentityProtectionSignal(new InMemoryIdentityProtectionProvider());

            SignalReading reading = signal.read(ALICE).block();

            assertNotNull(reading);
            assertTrue(reading.available());
            assertEquals(0, reading.points());
            assertEquals("Identity protection level: none", reading.evidence());
        }
    }

    // ── security analytics ──────────────────────────────────────────────────

    @Nested
    @DisplayName("SecurityAnalyticsSignal")
    class SecurityAnalytics {

        @Test
        @DisplayName("30 per risky sign-in plus 50 per escalation")
        void weightedSum() {
            assertEquals(0, SecurityAnalyticsSignal.score(0, 0));
            assertEquals(30, SecurityAnalyticsSignal.score(1, 0));
            assertEquals(80, SecurityAnalyticsSignal.score(1, 1));
        }

        @Test
        @DisplayName("capped at 100")
        void capped() {
            assertEquals(100, SecurityAnalyticsSignal.score(2, 1));
            assertEquals(100, SecurityAnalyticsSignal.score(10, 10));
        }

        @Test
        @DisplayName("reading carries both counts as findings")
        void readingFromProvider() {
            InMemorySecurityAnalyticsProvider provider = new InMemorySecurityAnalyticsProvider();
            provider.setRiskySignIns("alice", 1);
            provider.setPrivilegeEscalations("alice", 1);
            SecurityAnalyticsSignal signal = new SecurityAnalyticsSignal(provider, Duration.ofHours(24));

            SignalReading reading = signal.read(ALICE).block();

            assertNotNull(reading);
            assertEquals(80, reading.points());
            assertEquals(2, reading.findings());
            assertTrue(reading.evidence().contains("last 24h"));
        }
    }

    // ── behaviour baseline ──────────────────────────────────────────────────

    @Nested
    @DisplayName("BehaviorBaselineSignal")
    class BehaviorBaseline {

        @Test
        @DisplayName("baseline above 0.5 → 20")
        void elevated() {
            InMemorySecurityAnalyticsProvider provider = new InMemorySecurityAnalyticsProvider();
            provider.setBaseline("alice", 0.72);

            SignalReading reading = new BehaviorBaselineSignal(provider).read(ALICE).block();

            assertNotNull(reading);
            assertEquals(20, reading.points());
        }

        @Test
        @DisplayName("baseline exactly 0.5 is not elevated")
        void boundary() {
            InMemorySecurityAnalyticsProvider provider = new InMemorySecurityAnalyticsProvider();
            provider.setBaseline("alice", 0.5);

            SignalReading reading = new BehaviorBaselineSignal(provider).read(ALICE).block();

            assertNotNull(reading);
            assertEquals(0, reading.points());
        }
    }

    // ── policy compliance ───────────────────────────────────────────────────

    @Nested
    @DisplayName("PolicyComplianceSignal")
    class PolicyCompliance {

        private SignalReading readWith(Set<String> compensated, AccessGrant... grants) {
            InMemoryDirectoryService directory = new InMemoryDirectoryService();
            directory.putPrincipal(ALICE);
            for (AccessGrant grant : grants) {
                directory.putGrant(grant);
            }
            PolicyComplianceSignal signal =
                new PolicyComplianceSignal(directory, new RulePolicyComplianceProvider(compensated));
            return signal.read(ALICE).block();
        }

        @Test
        @DisplayName("no grants → 0")
        void noGrants() {
            SignalReading reading = readWith(Set.of());

            assertNotNull(reading);
            assertEquals(0, reading.points());
            assertEquals(0, reading.findings());
        }

        @Test
        @DisplayName("admin grant on financial data → two violations, 30 points")
        void twoViolationsOnOneGrant() {
            SignalReading reading = readWith(Set.of(), new AccessGrant("alice", "financial_records", "admin"));

            assertNotNull(reading);
            assertEquals(30, reading.points());
            assertEquals(2, reading.findings());
        }

        @Test
        @DisplayName("the same violation on the same resource counts once")
        void distinctByPolicyAndResource() {
            SignalReading reading = readWith(Set.of(),
                new AccessGrant("alice", "customer_pii", "read"),
                new AccessGrant("alice", "customer_pii", "write"));

            assertNotNull(reading);
            assertEquals(15, reading.points());
        }

        @Test
        @DisplayName("capped at 45")
        void capped() {
            SignalReading reading = readWith(Set.of(),
                new AccessGrant("alice", "customer_pii", "admin"),
                new AccessGrant("alice", "health_data", "admin"),
                new AccessGrant("alice", "privileged_vault", "read"));

            assertNotNull(reading);
            assertEquals(45, reading.points());
            assertEquals(5, reading.findings());
        }

        @Test
        @DisplayName("compensated violations do not count")
        void compensated() {
            SignalReading reading = readWith(Set.of("POL003@financial_records"),
                new AccessGrant("alice", "financial_records", "read"));

            assertNotNull(reading);
            assertEquals(0, reading.points());
        }
    }
}
