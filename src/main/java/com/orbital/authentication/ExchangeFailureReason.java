package com.orbital.authentication;

import lombok.Getter;

/**
 * Machine readable reason an OAuth exchange failed. The code is what appears as the
 * <code>error</code> parameter on the redirect to the login page, so the page can tell a
 * cancelled sign-in from one worth retrying.
 */
@Getter
public enum ExchangeFailureReason {

    NO_CODE("no_code", AuthFailure.EXCHANGE_FAILED),
    PROVIDER_DENIED("provider_denied", AuthFailure.PROVIDER_DENIED),
    EXCHANGE_FAILED("exchange_failed", AuthFailure.EXCHANGE_FAILED),
    VERIFICATION_FAILED("verification_failed", AuthFailure.VERIFICATION_FAILED);

    private final String code;
    private final AuthFailure failure;

    ExchangeFailureReason(String code, AuthFailure failure) {
        this.code = code;
        this.failure = failure;
    }

}
