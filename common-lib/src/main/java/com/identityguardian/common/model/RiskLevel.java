package com.identityguardian.common.model;

/**
 * Discrete risk band derived from the canonical 0–100 composite score.
 *
 * <pre>
 *   score &lt; 30  → LOW
 *   score &lt; 50  → MEDIUM
 *   score &lt; 75  → HIGH
 *   otherwise   → CRITICAL
 * </pre>
 */
public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    private static final int MEDIUM_FLOOR   = 30;
    private static final int HIGH_FLOOR     = 50;
    private static final int CRITICAL_FLOOR = 75;

    public static RiskLevel fromScore(int compositeScore) {
        if (compositeScore < MEDIUM_FLOOR)   return LOW;
        if (compositeScore < HIGH_FLOOR)     return MEDIUM;
        if (compositeScore < CRITICAL_FLOOR) return HIGH;
        return CRITICAL;
    }

    public boolean isElevated() {
        return this == HIGH || this == CRITICAL;
    }
}
