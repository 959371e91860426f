package com.identityguardian.common.directory;

import com.identityguardian.common.exception.IdentityGuardianException;

/**
 * A directory call failed, was rejected, or the capability is not supported by the
 * configured directory strategy.
 */
public class DirectoryException extends IdentityGuardianException {

    public DirectoryException(String message) {
        super("directory", message);
    }

    public DirectoryException(String message, Throwable cause) {
        super("directory", message, cause);
    }
}
