package com.orbital.authentication;

import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Read-only configuration shared by the {@link SessionValidator} and the
 * {@link OAuthExchangeHandler}. Must use {@link Builder} for construction; load from YAML
 * with {@link GateConfigurationLoader}.
 */
@Getter
public class GateConfiguration {

    public static final String DEFAULT_COOKIE_NAME = "orbital-session";

    private final String cookieName;
    private final String cookiePath;
    private final boolean cookieSecure;
    private final String cookieSameSite;
    private final Duration cookieMaxAge;
    private final String loginPath;
    private final String homePath;
    private final String callbackPath;
    private final String signInPath;
    private final String redirectParameter;
    private final PathPolicy pathPolicy;
    private final UnreachablePolicy unreachablePolicy;
    private final Duration validationTimeout;
    private final Duration refreshSkew;
    private final Duration pkceRecordTtl;

    private GateConfiguration(Builder builder) {
        this.cookieName = builder.cookieName;
        this.cookiePath = builder.cookiePath;
        this.cookieSecure = builder.cookieSecure;
        this.cookieSameSite = builder.cookieSameSite;
        this.cookieMaxAge = builder.cookieMaxAge;
        this.loginPath = builder.loginPath;
        this.homePath = builder.homePath;
        this.callbackPath = builder.callbackPath;
        this.signInPath = builder.signInPath;
        this.redirectParameter = builder.redirectParameter;
        this.pathPolicy = builder.pathPolicy;
        this.unreachablePolicy = builder.unreachablePolicy;
        this.validationTimeout = builder.validationTimeout;
        this.refreshSkew = builder.refreshSkew;
        this.pkceRecordTtl = builder.pkceRecordTtl;
    }

    /**
     * Cookie carrying <code>value</code> with the configured attributes
     * @param value Encoded session
     * @return SessionCookie
     */
    public SessionCookie sessionCookie(String value) {
        return new SessionCookie(this.cookieName, value, this.cookieMaxAge, this.cookiePath, true, this.cookieSecure, this.cookieSameSite);
    }

    /**
     * Cookie that clears the session cookie in the browser
     * @return SessionCookie
     */
    public SessionCookie clearingCookie() {
        return new SessionCookie(this.cookieName, "", Duration.ZERO, this.cookiePath, true, this.cookieSecure, this.cookieSameSite);
    }

    /**
     * Builder for {@link GateConfiguration}. Defaults protect <code>/dashboard</code>,
     * <code>/settings</code>, <code>/purchases</code> and <code>/videos</code>, treat
     * <code>/login</code> and <code>/signup</code> as auth entry paths, and fail closed.
     */
    @NoArgsConstructor @Getter
    public static class Builder {

        private String cookieName = DEFAULT_COOKIE_NAME;
        private String cookiePath = "/";
        private boolean cookieSecure = true;
        private String cookieSameSite = "Lax";
        private Duration cookieMaxAge = Duration.ofDays(30);
        private String loginPath = "/login";
        private String homePath = "/dashboard";
        private String callbackPath = "/auth/callback";
        private String signInPath = "/auth/signin";
        private String redirectParameter = "redirect";
        private PathPolicy pathPolicy = PathPolicy.ofPrefixes(List.of("/dashboard", "/settings", "/purchases", "/videos"), List.of("/login", "/signup"));
        private UnreachablePolicy unreachablePolicy = UnreachablePolicy.FAIL_CLOSED;
        private Duration validationTimeout = Duration.ofSeconds(3);
        private Duration refreshSkew = Duration.ofMinutes(1);
        private Duration pkceRecordTtl = Duration.ofMinutes(10);

        public Builder setCookie(String name, String path, boolean secure, String sameSite, Duration maxAge) {
            Objects.requireNonNull(name, "Must provide a session cookie name");
            Objects.requireNonNull(path, "Must provide a session cookie path");
            Objects.requireNonNull(maxAge, "Must provide a session cookie max age");
            if (name.isBlank()) { throw new IllegalArgumentException("Session cookie name must not be blank"); }
            this.cookieName = name;
            this.cookiePath = path;
            this.cookieSecure = secure;
            this.cookieSameSite = sameSite;
            this.cookieMaxAge = maxAge;
            return this;
        }

        public Builder setLoginPath(String loginPath) {
            Objects.requireNonNull(loginPath, "Must provide a login path");
            this.loginPath = PathPolicy.normalize(loginPath);
            return this;
        }

        public Builder setHomePath(String homePath) {
            Objects.requireNonNull(homePath, "Must provide a home path");
            this.homePath = PathPolicy.normalize(homePath);
            return this;
        }

        public Builder setCallbackPath(String callbackPath) {
            Objects.requireNonNull(callbackPath, "Must provide a callback path");
            this.callbackPath = PathPolicy.normalize(callbackPath);
            return this;
        }

        public Builder setSignInPath(String signInPath) {
            Objects.requireNonNull(signInPath, "Must provide a sign in path");
            this.signInPath = PathPolicy.normalize(signInPath);
            return this;
        }

        public Builder setRedirectParameter(String redirectParameter) {
            Objects.requireNonNull(redirectParameter, "Must provide a redirect parameter name");
            this.redirectParameter = redirectParameter;
            return this;
        }

        public Builder setPathPolicy(PathPolicy pathPolicy) {
            Objects.requireNonNull(pathPolicy, "Must provide a path policy");
            this.pathPolicy = pathPolicy;
            return this;
        }

        public Builder setUnreachablePolicy(UnreachablePolicy unreachablePolicy) {
            Objects.requireNonNull(unreachablePolicy, "Must provide an unreachable policy");
            this.unreachablePolicy = unreachablePolicy;
            return this;
        }

        public Builder setValidationTimeout(Duration validationTimeout) {
            this.validationTimeout = positive(validationTimeout, "validation timeout");
            return this;
        }

        public Builder setRefreshSkew(Duration refreshSkew) {
            Objects.requireNonNull(refreshSkew, "Must provide a refresh skew");
            if (refreshSkew.isNegative()) { throw new IllegalArgumentException("Refresh skew must not be negative"); }
            this.refreshSkew = refreshSkew;
            return this;
        }

        public Builder setPkceRecordTtl(Duration pkceRecordTtl) {
            this.pkceRecordTtl = positive(pkceRecordTtl, "PKCE record TTL");
            return this;
        }

        public GateConfiguration build() { return new GateConfiguration(this); }

        private static Duration positive(Duration duration, String name) {
            Objects.requireNonNull(duration, "Must provide a " + name);
            if (duration.isNegative() || duration.isZero()) { throw new IllegalArgumentException("The " + name + " must be positive"); }
            return duration;
        }

    }

}
