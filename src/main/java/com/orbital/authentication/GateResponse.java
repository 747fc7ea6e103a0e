package com.orbital.authentication;

import lombok.Getter;

import java.util.*;

/**
 * The one response object handed back to the caller by the {@link SessionValidator} or the
 * {@link OAuthExchangeHandler}. Cookies are attached to this object and to no other, so a
 * refreshed or newly issued session always travels with the decision that is returned.
 */
@Getter
public class GateResponse {

    private GateDecision decision;
    private String location;
    private Identity identity;
    private final Map<String, String> headers;
    private final List<SessionCookie> cookies;

    public GateResponse() {
        this.decision = GateDecision.ALLOW;
        this.headers = new LinkedHashMap<>();
        this.cookies = new ArrayList<>();
    }

    /**
     * Turns this response into a redirect
     * @param decision Redirect decision
     * @param location Location to redirect to
     * @return this GateResponse
     */
    public GateResponse redirect(GateDecision decision, String location) {
        Objects.requireNonNull(decision, "Must provide a redirect decision");
        Objects.requireNonNull(location, "Must provide a redirect location");
        if (!decision.isRedirect()) { throw new IllegalArgumentException("Decision " + decision + " is not a redirect"); }
        this.decision = decision;
        this.location = location;
        return this;
    }

    /**
     * Attaches a session cookie, replacing any session cookie of the same name already attached
     * @param cookie Session cookie
     * @return this GateResponse
     */
    public GateResponse attachSession(SessionCookie cookie) {
        Objects.requireNonNull(cookie, "Must provide a session cookie to attach");
        this.cookies.removeIf(existing -> existing.getName().equals(cookie.getName()));
        this.cookies.add(cookie);
        return this;
    }

    public GateResponse clearSession(SessionCookie clearingCookie) {
        Objects.requireNonNull(clearingCookie, "Must provide a clearing cookie");
        if (!clearingCookie.isClearing()) { throw new IllegalArgumentException("Cookie " + clearingCookie.getName() + " does not clear the session"); }
        return attachSession(clearingCookie);
    }

    public GateResponse setHeader(String name, String value) {
        Objects.requireNonNull(name, "Must provide a header name");
        Objects.requireNonNull(value, "Must provide a header value");
        this.headers.put(name, value);
        return this;
    }

    GateResponse setIdentity(Identity identity) {
        this.identity = identity;
        return this;
    }

    /**
     * Gets the session cookie attached under <code>name</code>
     * @param name Cookie name
     * @return SessionCookie or null
     */
    public SessionCookie getCookie(String name) {
        for (SessionCookie cookie : this.cookies) {
            if (cookie.getName().equals(name)) { return cookie; }
        }
        return null;
    }

    public Map<String, String> getHeaders() { return Collections.unmodifiableMap(this.headers); }

    public List<SessionCookie> getCookies() { return Collections.unmodifiableList(this.cookies); }

    @Override
    public String toString() { return "GateResponse[" + this.decision + (this.location == null ? "" : " -> " + this.location) + ", cookies=" + this.cookies + "]"; }

}
