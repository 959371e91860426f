package com.identityguardian.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Contribution of a single signal source to a {@link RiskAssessment}.
 *
 * <p>{@code available=false} distinguishes "source was unreachable" from "source said zero";
 * both carry {@code points=0}. {@code findings} counts the discrete indicators behind the
 * points (sign-ins, escalations, violations).
 */
public record SubScore(
    @JsonProperty("source") String source,
    @JsonProperty("points") int points,
    @JsonProperty("evidence") String evidence,
    @JsonProperty("available") boolean available,
    @JsonProperty("findings") int findings
) {}
