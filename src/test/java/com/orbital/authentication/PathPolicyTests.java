package com.orbital.authentication;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PathPolicyTests {

    private final PathPolicy policy = new PathPolicy(List.of("/dashboard", "/videos/"), List.of("/account"),
                                                     List.of("/login"), List.of("signup"));

    @Test
    @DisplayName("Match protected prefixes on segment boundaries")
    void matchPrefixes() {
        assertTrue(policy.isProtected("/dashboard"));
        assertTrue(policy.isProtected("/dashboard/"));
        assertTrue(policy.isProtected("/videos/42"));
        assertTrue(policy.isProtected("/videos"));
        assertFalse(policy.isProtected("/videostore"));
        assertFalse(policy.isProtected("/"));
    }

    @Test
    @DisplayName("Match exact entries only on the path itself")
    void matchExact() {
        assertTrue(policy.isProtected("/account"));
        assertFalse(policy.isProtected("/account/delete"));
        assertTrue(policy.isAuthEntry("/signup"));
        assertFalse(policy.isAuthEntry("/signup/confirm"));
        assertTrue(policy.isAuthEntry("/login/magic-link"));
    }

    @Test
    @DisplayName("Never match a missing path")
    void matchNull() {
        assertFalse(policy.isProtected(null));
        assertFalse(policy.isAuthEntry(null));
    }

    @Test
    @DisplayName("Protect everything with a root prefix")
    void matchRoot() {
        PathPolicy everything = PathPolicy.ofPrefixes(List.of("/"), List.of());
        assertTrue(everything.isProtected("/"));
        assertTrue(everything.isProtected("/anything/at/all"));
    }

    @Test
    @DisplayName("Fail to construct a policy with a blank entry")
    void failBlankEntry() {
        assertThrows(IllegalArgumentException.class, () -> PathPolicy.ofPrefixes(List.of("/dashboard", " "), Set.of()));
    }

}
