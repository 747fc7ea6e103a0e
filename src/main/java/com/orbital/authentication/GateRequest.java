package com.orbital.authentication;

import lombok.Getter;

import java.util.Objects;

/**
 * What the session validator needs from an inbound request: the requested path and the
 * value of the session cookie, if the caller sent one
 */
@Getter
public class GateRequest {

    private final String path;
    private final String sessionValue;

    /**
     * Construct a new GateRequest
     * @param path Requested path
     * @param sessionValue Value of the session cookie (may be null)
     */
    public GateRequest(String path, String sessionValue) {
        Objects.requireNonNull(path, "Must provide the requested path");
        this.path = path;
        this.sessionValue = sessionValue;
    }

    @Override
    public String toString() { return "GateRequest[" + this.path + (this.sessionValue == null ? "" : ", with session") + "]"; }

}
