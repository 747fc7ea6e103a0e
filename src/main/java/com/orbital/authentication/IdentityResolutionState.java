package com.orbital.authentication;

import lombok.Getter;

import java.util.Objects;

/**
 * Who the {@link ClientAuthCache} says is signed in. The subject identifier is only present
 * in the {@link ResolutionPhase#AUTHENTICATED} phase.
 */
@Getter
public class IdentityResolutionState {

    private static final IdentityResolutionState UNKNOWN = new IdentityResolutionState(ResolutionPhase.UNKNOWN, null);
    private static final IdentityResolutionState RESOLVING = new IdentityResolutionState(ResolutionPhase.RESOLVING, null);
    private static final IdentityResolutionState UNAUTHENTICATED = new IdentityResolutionState(ResolutionPhase.UNAUTHENTICATED, null);

    private final ResolutionPhase phase;
    private final String subjectId;

    private IdentityResolutionState(ResolutionPhase phase, String subjectId) {
        this.phase = phase;
        this.subjectId = subjectId;
    }

    public static IdentityResolutionState unknown() { return UNKNOWN; }

    public static IdentityResolutionState resolving() { return RESOLVING; }

    public static IdentityResolutionState unauthenticated() { return UNAUTHENTICATED; }

    public static IdentityResolutionState authenticated(String subjectId) {
        Objects.requireNonNull(subjectId, "Must provide the subject identifier of an authenticated state");
        return new IdentityResolutionState(ResolutionPhase.AUTHENTICATED, subjectId);
    }

    public boolean isAuthenticated() { return this.phase == ResolutionPhase.AUTHENTICATED; }

    @Override
    public boolean equals(Object o) {
        if (this == o) { return true; }
        if (o == null || getClass() != o.getClass()) { return false; }
        IdentityResolutionState that = (IdentityResolutionState) o;
        return this.phase == that.phase && Objects.equals(this.subjectId, that.subjectId);
    }

    @Override
    public int hashCode() { return Objects.hash(this.phase, this.subjectId); }

    @Override
    public String toString() { return this.subjectId == null ? this.phase.toString() : this.phase + "(" + this.subjectId + ")"; }

}
