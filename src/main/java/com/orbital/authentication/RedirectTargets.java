package com.orbital.authentication;

/**
 * Restricts post sign-in redirect targets to paths on this site
 */
public class RedirectTargets {

    private RedirectTargets() { }

    /**
     * Returns <code>target</code> when it is a local absolute path, otherwise <code>fallback</code>.
     * Protocol relative (<code>//host</code>) and backslash forms are not local.
     * @param target Requested redirect target (may be null)
     * @param fallback Path to use instead
     * @return A local path
     */
    public static String local(String target, String fallback) {
        if (target == null || target.isBlank()) { return fallback; }
        String trimmed = target.trim();
        if (!trimmed.startsWith("/") || trimmed.startsWith("//") || trimmed.contains("\\")) { return fallback; }
        for (int i = 0; i < trimmed.length(); i++) {
            if (Character.isISOControl(trimmed.charAt(i))) { return fallback; }
        }
        return trimmed;
    }

}
