package com.orbital.authentication;

/**
 * Taxonomy of authentication failures. The first three all mean "not authenticated" and
 * are recovered locally by redirecting. {@link #AUTHORITY_UNREACHABLE} is governed by an
 * explicit {@link UnreachablePolicy}.
 */
public enum AuthFailure {

    TOKEN_ABSENT,
    TOKEN_MALFORMED,
    VALIDATION_FAILED,
    AUTHORITY_UNREACHABLE,
    EXCHANGE_FAILED,
    VERIFICATION_FAILED,
    PROVIDER_DENIED,
    INVALIDATION_TIMEOUT;

    /**
     * Whether the failure simply means the caller is not authenticated
     * @return true for absent, malformed, and rejected tokens
     */
    public boolean isUnauthenticated() {
        return this == TOKEN_ABSENT || this == TOKEN_MALFORMED || this == VALIDATION_FAILED;
    }

}
