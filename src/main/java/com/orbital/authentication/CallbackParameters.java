package com.orbital.authentication;

import lombok.Getter;

import java.util.Map;
import java.util.Objects;

/**
 * Query parameters the identity provider sends to the OAuth callback
 */
@Getter
public class CallbackParameters {

    public static final String CODE = "code";
    public static final String STATE = "state";
    public static final String ERROR = "error";
    public static final String ERROR_DESCRIPTION = "error_description";

    private final String code;
    private final String state;
    private final String error;
    private final String errorDescription;

    public CallbackParameters(String code, String state, String error, String errorDescription) {
        this.code = blankToNull(code);
        this.state = blankToNull(state);
        this.error = blankToNull(error);
        this.errorDescription = blankToNull(errorDescription);
    }

    /**
     * Reads callback parameters from a map of query parameters
     * @param query Query parameters
     * @return CallbackParameters
     */
    public static CallbackParameters fromQuery(Map<String, String> query) {
        Objects.requireNonNull(query, "Must provide query parameters");
        return new CallbackParameters(query.get(CODE), query.get(STATE), query.get(ERROR), query.get(ERROR_DESCRIPTION));
    }

    private static String blankToNull(String value) { return value == null || value.isBlank() ? null : value; }

}
