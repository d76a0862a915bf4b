package com.salesanalytics.security;

import java.util.Objects;

/**
 * A verified caller: who they are and what role they hold.
 *
 * Only produced by an {@link IdentityVerifier}; never mutated after admission.
 *
 * @param subject token subject (username)
 * @param role role from the token's {@code role} claim
 */
public record Identity(String subject, Role role) {

    public Identity {
        Objects.requireNonNull(subject, "subject");
        Objects.requireNonNull(role, "role");
    }
}
