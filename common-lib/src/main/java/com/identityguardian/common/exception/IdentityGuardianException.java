package com.identityguardian.common.exception;

/**
 * Base runtime exception for every component of the platform. The component name is
 * prefixed to the message so a log line alone identifies where the failure originated.
 */
public class IdentityGuardianException extends RuntimeException {
    private final String component;

    public IdentityGuardianException(String component, String message) {
        super("[" + component + "] " + message);
        this.component = component;
    }

    public IdentityGuardianException(String component, String message, Throwable cause) {
        super("[" + component + "] " + message, cause);
        this.component = component;
    }

    public String getComponent() {
        return component;
    }
}
