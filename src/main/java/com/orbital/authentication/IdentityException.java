package com.orbital.authentication;

import lombok.Getter;

/**
 * General exception used to represent issues with identity processing. Always carries
 * the {@link AuthFailure} that callers branch on.
 */
@Getter
public class IdentityException extends Exception {

    private final AuthFailure failure;

    public IdentityException(AuthFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
    }
    public IdentityException(AuthFailure failure, String message) {
        super(message);
        this.failure = failure;
    }

}
