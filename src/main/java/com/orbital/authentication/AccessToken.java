package com.orbital.authentication;

import lombok.Getter;

import java.io.Serializable;
import java.util.Objects;

/**
 * Short-lived access credential issued by the identity authority. Opaque to this library.
 */
@Getter
public class AccessToken implements Serializable {

    protected final String value;

    /**
     * Construct a new AccessToken
     * @param value Value of the token itself
     */
    public AccessToken(String value) {
        Objects.requireNonNull(value, "Must provide an access token value");
        if (value.isBlank()) { throw new IllegalArgumentException("Access token value must not be blank"); }
        this.value = value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) { return true; }
        if (o == null || getClass() != o.getClass()) { return false; }
        return this.value.equals(((AccessToken) o).value);
    }

    @Override
    public int hashCode() { return this.value.hashCode(); }

    @Override
    public String toString() { return "AccessToken[redacted]"; }

}
