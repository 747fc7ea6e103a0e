package com.orbital.authentication;

import lombok.Getter;

import java.io.Serializable;
import java.util.Objects;

/**
 * Identity as reported by the identity authority's validation endpoint
 */
@Getter
public class Identity implements Serializable {

    private final String subjectId;
    private final String email;

    public Identity(String subjectId, String email) {
        Objects.requireNonNull(subjectId, "Must provide a subject identifier for an identity");
        this.subjectId = subjectId;
        this.email = email;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) { return true; }
        if (o == null || getClass() != o.getClass()) { return false; }
        Identity identity = (Identity) o;
        return this.subjectId.equals(identity.subjectId) && Objects.equals(this.email, identity.email);
    }

    @Override
    public int hashCode() { return Objects.hash(this.subjectId, this.email); }

    @Override
    public String toString() { return "Identity[" + this.subjectId + "]"; }

}
