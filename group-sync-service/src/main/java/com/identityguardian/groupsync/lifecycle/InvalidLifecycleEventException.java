package com.identityguardian.groupsync.lifecycle;

import com.identityguardian.common.exception.IdentityGuardianException;

/** A lifecycle or access-grant event is missing a required field. Mapped to 400. */
public class InvalidLifecycleEventException extends IdentityGuardianException {

    public InvalidLifecycleEventException(String message) {
        super("lifecycle", message);
    }
}
