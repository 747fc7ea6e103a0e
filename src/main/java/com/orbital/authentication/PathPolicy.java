package com.orbital.authentication;

import lombok.Getter;

import java.util.*;

/**
 * Which request paths require an authenticated caller, and which are auth entry paths (sign-in,
 * sign-up) that an authenticated caller is sent away from. A prefix entry matches the path itself
 * and every path below it on a segment boundary, so <code>/videos</code> matches
 * <code>/videos/42</code> but not <code>/videostore</code>. An exact entry matches only itself.
 */
@Getter
public class PathPolicy {

    private final Set<String> protectedPrefixes;
    private final Set<String> protectedExact;
    private final Set<String> authEntryPrefixes;
    private final Set<String> authEntryExact;

    public PathPolicy(Collection<String> protectedPrefixes, Collection<String> protectedExact,
                      Collection<String> authEntryPrefixes, Collection<String> authEntryExact) {
        Objects.requireNonNull(protectedPrefixes, "Must provide protected path prefixes");
        Objects.requireNonNull(protectedExact, "Must provide exact protected paths");
        Objects.requireNonNull(authEntryPrefixes, "Must provide auth entry path prefixes");
        Objects.requireNonNull(authEntryExact, "Must provide exact auth entry paths");
        this.protectedPrefixes = normalizeAll(protectedPrefixes);
        this.protectedExact = normalizeAll(protectedExact);
        this.authEntryPrefixes = normalizeAll(authEntryPrefixes);
        this.authEntryExact = normalizeAll(authEntryExact);
    }

    /**
     * Path policy of prefix entries only
     * @param protectedPaths Protected path prefixes
     * @param authEntryPaths Auth entry path prefixes
     * @return PathPolicy
     */
    public static PathPolicy ofPrefixes(Collection<String> protectedPaths, Collection<String> authEntryPaths) {
        return new PathPolicy(protectedPaths, Set.of(), authEntryPaths, Set.of());
    }

    public boolean isProtected(String path) { return matches(path, this.protectedPrefixes, this.protectedExact); }

    public boolean isAuthEntry(String path) { return matches(path, this.authEntryPrefixes, this.authEntryExact); }

    private static boolean matches(String path, Set<String> prefixes, Set<String> exact) {
        if (path == null) { return false; }
        String normalized = normalize(path);
        if (exact.contains(normalized)) { return true; }
        for (String prefix : prefixes) {
            if (prefix.equals("/") || normalized.equals(prefix) || normalized.startsWith(prefix + "/")) { return true; }
        }
        return false;
    }

    static String normalize(String path) {
        String trimmed = path.trim();
        if (!trimmed.startsWith("/")) { trimmed = "/" + trimmed; }
        while (trimmed.length() > 1 && trimmed.endsWith("/")) { trimmed = trimmed.substring(0, trimmed.length() - 1); }
        return trimmed;
    }

    private static Set<String> normalizeAll(Collection<String> paths) {
        Set<String> normalized = new LinkedHashSet<>();
        for (String path : paths) {
            if (path == null || path.isBlank()) { throw new IllegalArgumentException("Path entries must not be blank"); }
            normalized.add(normalize(path));
        }
        return Collections.unmodifiableSet(normalized);
    }

}
