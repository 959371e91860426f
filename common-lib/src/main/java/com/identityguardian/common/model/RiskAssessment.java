package com.identityguardian.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Immutable result of one risk evaluation. Created fresh on every call and consumed
 * immediately; never mutated or cached.
 */
public record RiskAssessment(
    @JsonProperty("principalId") String principalId,
    @JsonProperty("subScores") List<SubScore> subScores,
    @JsonProperty("compositeScore") int compositeScore,
    @JsonProperty("riskLevel") RiskLevel riskLevel,
    @JsonProperty("remediationSteps") List<String> remediationSteps,
    @JsonProperty("assessedAt") Instant assessedAt
) {
    public static final int MAX_SCORE = 100;

    public RiskAssessment {
        subScores = List.copyOf(subScores);
        remediationSteps = remediationSteps == null ? List.of() : List.copyOf(remediationSteps);
    }

    /**
     * Sums the sub-scores, clamps the total to [0, 100] and derives the risk level.
     */
    public static RiskAssessment assemble(String principalId, List<SubScore> subScores,
                                          List<String> remediationSteps, Instant assessedAt) {
        int sum = subScores.stream().mapToInt(SubScore::points).sum();
        int composite = Math.max(0, Math.min(MAX_SCORE, sum));
        return new RiskAssessment(principalId, subScores, composite,
            RiskLevel.fromScore(composite), remediationSteps, assessedAt);
    }

    /** Display-only 0–1 rendering of the composite score. */
    @JsonProperty("fractionalScore")
    public double fractionalScore() {
        return compositeScore / (double) MAX_SCORE;
    }

    @JsonIgnore
    public Optional<SubScore> subScore(String source) {
        return subScores.stream().filter(s -> s.source().equals(source)).findFirst();
    }
}
