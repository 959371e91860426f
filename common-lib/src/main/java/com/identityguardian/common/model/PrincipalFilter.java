package com.identityguardian.common.model;

/**
 * Typed filter for principal enumeration. {@code null} fields do not constrain the result.
 */
public record PrincipalFilter(Boolean enabled, String department) {

    public static PrincipalFilter all() {
        return new PrincipalFilter(null, null);
    }

    public static PrincipalFilter activeOnly() {
        return new PrincipalFilter(Boolean.TRUE, null);
    }

    public boolean matches(Principal principal) {
        if (enabled != null && principal.enabled() != enabled) return false;
        return department == null || department.equalsIgnoreCase(principal.department());
    }
}
