package com.identityguardian.mitigation.approval;

import com.identityguardian.common.exception.IdentityGuardianException;

/** The shared-secret header was missing or did not match. Mapped to 403. */
public class CallbackAuthException extends IdentityGuardianException {

    public CallbackAuthException(String message) {
        super("approval-webhook", message);
    }
}
