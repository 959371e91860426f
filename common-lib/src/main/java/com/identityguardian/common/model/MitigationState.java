package com.identityguardian.common.model;

/**
 * {@code APPLIED} is terminal for monitor actions. Block and disable actions start in
 * {@code PENDING_REVIEW} and move to {@code RESOLVED} exactly once.
 */
public enum MitigationState {
    APPLIED,
    PENDING_REVIEW,
    RESOLVED
}
