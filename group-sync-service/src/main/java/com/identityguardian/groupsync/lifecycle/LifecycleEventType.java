package com.identityguardian.groupsync.lifecycle;

public enum LifecycleEventType {
    JOINER,
    MOVER,
    LEAVER
}
