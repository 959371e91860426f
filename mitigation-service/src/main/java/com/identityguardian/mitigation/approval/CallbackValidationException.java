package com.identityguardian.mitigation.approval;

import com.identityguardian.common.exception.IdentityGuardianException;

/** The callback body could not be read into the expected shape. Mapped to 400. */
public class CallbackValidationException extends IdentityGuardianException {

    public CallbackValidationException(String message) {
        super("approval-webhook", message);
    }

    public CallbackValidationException(String message, Throwable cause) {
        super("approval-webhook", message, cause);
    }
}
