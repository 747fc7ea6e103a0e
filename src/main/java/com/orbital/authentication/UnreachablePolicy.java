package com.orbital.authentication;

/**
 * What the session validator does with a protected path when the identity authority can't
 * be reached or doesn't answer in time
 */
public enum UnreachablePolicy {

    /** Deny: redirect to login. The default. */
    FAIL_CLOSED,
    /** Allow the request through without a confirmed identity */
    FAIL_OPEN

}
