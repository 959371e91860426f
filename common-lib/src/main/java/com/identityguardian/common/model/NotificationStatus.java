package com.identityguardian.common.model;

public enum NotificationStatus {
    NOT_REQUIRED,
    PENDING,
    SENT,
    FAILED
}
