package com.orbital.authentication;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Profile attributes of a subject. Opaque to this library apart from the subject identifier.
 */
@Getter
public class Profile {

    private final String subjectId;
    private final Map<String, Object> attributes;

    public Profile(String subjectId, Map<String, Object> attributes) {
        Objects.requireNonNull(subjectId, "Must provide the subject identifier of a profile");
        Objects.requireNonNull(attributes, "Must provide profile attributes");
        this.subjectId = subjectId;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public Object getAttribute(String name) { return this.attributes.get(name); }

    @Override
    public String toString() { return "Profile[" + this.subjectId + "]"; }

}
