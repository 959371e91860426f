package com.identityguardian.common.model;

public enum MitigationKind {
    MONITOR,
    CONDITIONAL_ACCESS_BLOCK,
    DISABLE
}
