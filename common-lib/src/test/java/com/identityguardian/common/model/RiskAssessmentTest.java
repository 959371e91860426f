package com.identityguardian.common.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RiskAssessmentTest {

    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

    private static SubScore points(String source, int points) {
        return new SubScore(source, points, "test", true, 0);
    }

    @Nested
    @DisplayName("RiskLevel.fromScore(): band boundaries")
    class LevelBands {

        @Test
        @DisplayName("29 → LOW, 30 → MEDIUM")
        void lowMediumBoundary() {
            assertEquals(RiskLevel.LOW, RiskLevel.fromScore(29));
            assertEquals(RiskLevel.MEDIUM, RiskLevel.fromScore(30));
        }

        @Test
        @DisplayName("49 → MEDIUM, 50 → HIGH")
        void mediumHighBoundary() {
            assertEquals(RiskLevel.MEDIUM, RiskLevel.fromScore(49));
            assertEquals(RiskLevel.HIGH, RiskLevel.fromScore(50));
        }

        @Test
        @DisplayName("74 → HIGH, 75 → CRITICAL")
        void highCriticalBoundary() {
            assertEquals(RiskLevel.HIGH, RiskLevel.fromScore(74));
            assertEquals(RiskLevel.CRITICAL, RiskLevel.fromScore(75));
        }

        @Test
        @DisplayName("only HIGH and CRITICAL are elevated")
        void elevatedBands() {
            assertFalse(RiskLevel.LOW.isElevated());
            assertFalse(RiskLevel.MEDIUM.isElevated());
            assertTrue(RiskLevel.HIGH.isElevated());
            assertTrue(RiskLevel.CRITICAL.isElevated());
        }
    }

    @Nested
    @DisplayName("assemble(): composite score")
    class Assemble {

        @Test
        @DisplayName("sums sub-scores and keeps their order")
        void sumsInOrder() {
            RiskAssessment assessment = RiskAssessment.assemble("user-1",
                List.of(points("identity_protection", 20), points("security_analytics", 30)), List.of(), NOW);

            assertEquals(50, assessment.compositeScore());
            assertEquals(RiskLevel.HIGH, assessment.riskLevel());
            assertEquals("identity_protection", assessment.subScores().get(0).source());
            assertEquals("security_analytics", assessment.subScores().get(1).source());
        }

        @Test
        @DisplayName("total above 100 is clamped to 100")
        void clampsToMax() {
            RiskAssessment assessment = RiskAssessment.assemble("user-1",
                List.of(points("identity_protection", 90), points("security_analytics", 100),
                    points("policy_compliance", 45)), List.of(), NOW);

            assertEquals(100, assessment.compositeScore());
            assertEquals(RiskLevel.CRITICAL, assessment.riskLevel());
        }

        @Test
        @DisplayName("no sub-scores → 0 / LOW")
        void emptyIsZero() {
            RiskAssessment assessment = RiskAssessment.assemble("user-1", List.of(), null, NOW);

            assertEquals(0, assessment.compositeScore());
            assertEquals(RiskLevel.LOW, assessment.riskLevel());
            assertTrue(assessment.remediationSteps().isEmpty());
        }

        @Test
        @DisplayName("fractional score is composite / 100")
        void fractionalIsDerived() {
            RiskAssessment assessment = RiskAssessment.assemble("user-1",
                List.of(points("identity_protection", 80)), List.of(), NOW);

            assertEquals(0.8, assessment.fractionalScore(), 1e-9);
        }

        @Test
        @DisplayName("subScore() looks up by source name")
        void lookupBySource() {
            RiskAssessment assessment = RiskAssessment.assemble("user-1",
                List.of(points("identity_protection", 50)), List.of(), NOW);

            assertEquals(50, assessment.subScore("identity_protection").orElseThrow().points());
            assertTrue(assessment.subScore("behavior_baseline").isEmpty());
        }
    }

    @Nested
    @DisplayName("MitigationAction transitions")
    class ActionTransitions {

        @Test
        @DisplayName("monitor actions are terminal at creation")
        void monitorIsApplied() {
            MitigationAction action = MitigationAction.monitor("user-1", 40, "below threshold", NOW);

            assertEquals(MitigationKind.MONITOR, action.kind());
            assertEquals(MitigationState.APPLIED, action.state());
            assertFalse(action.isPending());
            assertEquals(NotificationStatus.NOT_REQUIRED, action.notificationStatus());
        }

        @Test
        @DisplayName("resolve() keeps the token and records the outcome")
        void resolveKeepsToken() {
            MitigationAction pending = MitigationAction.pendingReview("user-1",
                MitigationKind.CONDITIONAL_ACCESS_BLOCK, 95, "critical", true, "ok", NOW);
            MitigationAction resolved = pending.resolve("restored", NOW.plusSeconds(60));

            assertTrue(pending.isPending());
            assertEquals(pending.correlationToken(), resolved.correlationToken());
            assertEquals(MitigationState.RESOLVED, resolved.state());
            assertEquals("restored", resolved.resolutionOutcome());
            assertEquals(NOW.plusSeconds(60), resolved.resolvedAt());
        }

        @Test
        @DisplayName("each pending action gets a distinct token")
        void tokensAreUnique() {
            MitigationAction a = MitigationAction.pendingReview("user-1", MitigationKind.DISABLE, 95, "r", true, "ok", NOW);
            MitigationAction b = MitigationAction.pendingReview("user-1", MitigationKind.DISABLE, 95, "r", true, "ok", NOW);

            assertNotEquals(a.correlationToken(), b.correlationToken());
        }
    }

    @Nested
    @DisplayName("ApprovalDecisionKind.fromWire()")
    class DecisionWire {

        @Test
        @DisplayName("known actions map case-insensitively")
        void knownActions() {
            assertEquals(ApprovalDecisionKind.RE_ENABLE, ApprovalDecisionKind.fromWire("re_enable").orElseThrow());
            assertEquals(ApprovalDecisionKind.KEEP_BLOCKED, ApprovalDecisionKind.fromWire("KEEP_BLOCKED").orElseThrow());
            assertEquals(ApprovalDecisionKind.REJECT, ApprovalDecisionKind.fromWire(" reject ").orElseThrow());
        }

        @Test
        @DisplayName("unknown or absent action → empty")
        void unknownActions() {
            assertTrue(ApprovalDecisionKind.fromWire("escalate").isEmpty());
            assertTrue(ApprovalDecisionKind.fromWire(null).isEmpty());
        }
    }
}
