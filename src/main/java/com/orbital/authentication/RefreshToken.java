package com.orbital.authentication;

import lombok.Getter;

import java.io.Serializable;
import java.util.Objects;

/**
 * Longer-lived renewal credential paired with an {@link AccessToken}.
 */
@Getter
public class RefreshToken implements Serializable {

    protected final String value;

    /**
     * Construct a new RefreshToken
     * @param value Value of the token itself
     */
    public RefreshToken(String value) {
        Objects.requireNonNull(value, "Must provide a refresh token value");
        if (value.isBlank()) { throw new IllegalArgumentException("Refresh token value must not be blank"); }
        this.value = value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) { return true; }
        if (o == null || getClass() != o.getClass()) { return false; }
        return this.value.equals(((RefreshToken) o).value);
    }

    @Override
    public int hashCode() { return this.value.hashCode(); }

    @Override
    public String toString() { return "RefreshToken[redacted]"; }

}
