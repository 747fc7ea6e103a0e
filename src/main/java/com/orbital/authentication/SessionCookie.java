package com.orbital.authentication;

import lombok.Getter;

import java.time.Duration;
import java.util.Objects;

/**
 * A session cookie to set on an outgoing response. An empty value with a zero max age clears
 * the cookie in the browser.
 */
@Getter
public class SessionCookie {

    private final String name;
    private final String value;
    private final Duration maxAge;
    private final String path;
    private final boolean httpOnly;
    private final boolean secure;
    private final String sameSite;

    public SessionCookie(String name, String value, Duration maxAge, String path, boolean httpOnly, boolean secure, String sameSite) {
        Objects.requireNonNull(name, "Must provide a cookie name");
        Objects.requireNonNull(value, "Must provide a cookie value");
        Objects.requireNonNull(maxAge, "Must provide a cookie max age");
        Objects.requireNonNull(path, "Must provide a cookie path");
        this.name = name;
        this.value = value;
        this.maxAge = maxAge;
        this.path = path;
        this.httpOnly = httpOnly;
        this.secure = secure;
        this.sameSite = sameSite;
    }

    public boolean isClearing() { return this.value.isEmpty() && this.maxAge.isZero(); }

    /**
     * Renders the cookie as the value of a Set-Cookie header
     * @return Set-Cookie header value
     */
    public String toHeaderValue() {
        StringBuilder header = new StringBuilder(this.name).append('=').append(this.value);
        header.append("; Path=").append(this.path);
        header.append("; Max-Age=").append(this.maxAge.getSeconds());
        if (this.httpOnly) { header.append("; HttpOnly"); }
        if (this.secure) { header.append("; Secure"); }
        if (this.sameSite != null) { header.append("; SameSite=").append(this.sameSite); }
        return header.toString();
    }

    @Override
    public String toString() { return "SessionCookie[" + this.name + (isClearing() ? ", cleared]" : "]"); }

}
