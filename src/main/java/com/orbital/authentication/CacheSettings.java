package com.orbital.authentication;

import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.Objects;
import java.util.Set;

/**
 * Timeouts and return markers of a {@link ClientAuthCache}. Must use {@link Builder} for
 * construction.
 */
@Getter
public class CacheSettings {

    private final Duration resolutionTimeout;
    private final Duration profileTimeout;
    private final Duration signInTimeout;
    private final Duration signOutTimeout;
    private final Duration refreshSkew;
    private final Set<String> returnMarkers;

    private CacheSettings(Builder builder) {
        this.resolutionTimeout = builder.resolutionTimeout;
        this.profileTimeout = builder.profileTimeout;
        this.signInTimeout = builder.signInTimeout;
        this.signOutTimeout = builder.signOutTimeout;
        this.refreshSkew = builder.refreshSkew;
        this.returnMarkers = Set.copyOf(builder.returnMarkers);
    }

    public static CacheSettings defaults() { return new Builder().build(); }

    /**
     * Builder for {@link CacheSettings}. Resolution gives up after five seconds. The return
     * markers are the query parameters that show the browser came back from the identity
     * provider or a payment provider.
     */
    @NoArgsConstructor @Getter
    public static class Builder {

        private Duration resolutionTimeout = Duration.ofSeconds(5);
        private Duration profileTimeout = Duration.ofSeconds(10);
        private Duration signInTimeout = Duration.ofSeconds(10);
        private Duration signOutTimeout = Duration.ofSeconds(5);
        private Duration refreshSkew = Duration.ofMinutes(1);
        private Set<String> returnMarkers = Set.of("success", "canceled", "code", "error");

        public Builder setResolutionTimeout(Duration resolutionTimeout) {
            this.resolutionTimeout = positive(resolutionTimeout, "resolution timeout");
            return this;
        }

        public Builder setProfileTimeout(Duration profileTimeout) {
            this.profileTimeout = positive(profileTimeout, "profile timeout");
            return this;
        }

        public Builder setSignInTimeout(Duration signInTimeout) {
            this.signInTimeout = positive(signInTimeout, "sign in timeout");
            return this;
        }

        public Builder setSignOutTimeout(Duration signOutTimeout) {
            this.signOutTimeout = positive(signOutTimeout, "sign out timeout");
            return this;
        }

        public Builder setRefreshSkew(Duration refreshSkew) {
            Objects.requireNonNull(refreshSkew, "Must provide a refresh skew");
            this.refreshSkew = refreshSkew;
            return this;
        }

        public Builder setReturnMarkers(Set<String> returnMarkers) {
            Objects.requireNonNull(returnMarkers, "Must provide return markers");
            this.returnMarkers = returnMarkers;
            return this;
        }

        public CacheSettings build() { return new CacheSettings(this); }

        private static Duration positive(Duration duration, String name) {
            Objects.requireNonNull(duration, "Must provide a " + name);
            if (duration.isNegative() || duration.isZero()) { throw new IllegalArgumentException("The " + name + " must be positive"); }
            return duration;
        }

    }

}
