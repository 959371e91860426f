package com.identityguardian.common.exception;

/**
 * Raised when a principal id cannot be resolved in the directory. Terminal for an
 * assessment or mitigation: nothing is scored and no directory mutation is attempted.
 */
public class PrincipalNotFoundException extends IdentityGuardianException {
    private final String principalId;

    public PrincipalNotFoundException(String principalId) {
        super("directory", "Principal not found: " + principalId);
        this.principalId = principalId;
    }

    public String getPrincipalId() {
        return principalId;
    }
}
