package com.identityguardian.common.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Decisions a reviewer can send back through the approval channel. {@code RE_ENABLE} and
 * {@code KEEP_BLOCKED} resolve mitigation actions by correlation token; {@code APPROVE} and
 * {@code REJECT} act on privileged elevation requests by request id.
 */
public enum ApprovalDecisionKind {
    RE_ENABLE("re_enable"),
    KEEP_BLOCKED("keep_blocked"),
    APPROVE("approve"),
    REJECT("reject");

    private final String wireValue;

    ApprovalDecisionKind(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    public boolean resolvesMitigation() {
        return this == RE_ENABLE || this == KEEP_BLOCKED;
    }

    public static Optional<ApprovalDecisionKind> fromWire(String value) {
        if (value == null) return Optional.empty();
        return Arrays.stream(values())
            .filter(k -> k.wireValue.equalsIgnoreCase(value.trim()))
            .findFirst();
    }
}
