package com.orbital.authentication;

import java.util.regex.Pattern;

/**
 * Makes error detail from the identity authority or provider safe to show a user: control
 * characters are stripped, anything resembling a credential is redacted, and the result is
 * truncated.
 */
public class ErrorDetails {

    static final int MAX_LENGTH = 200;
    static final String REDACTED = "[redacted]";

    private static final Pattern CONTROL = Pattern.compile("[\\p{Cntrl}]+");
    private static final Pattern CREDENTIAL = Pattern.compile("[A-Za-z0-9_\\-+/=.]{32,}");
    private static final Pattern WHITESPACE = Pattern.compile("\\s{2,}");

    private ErrorDetails() { }

    /**
     * Sanitize <code>detail</code> for display
     * @param detail Raw error detail (may be null)
     * @return Sanitized detail, or null when there is nothing to show
     */
    public static String sanitize(String detail) {
        if (detail == null) { return null; }
        String cleaned = CONTROL.matcher(detail).replaceAll(" ");
        cleaned = CREDENTIAL.matcher(cleaned).replaceAll(REDACTED);
        cleaned = WHITESPACE.matcher(cleaned).replaceAll(" ").trim();
        if (cleaned.isEmpty()) { return null; }
        if (cleaned.length() > MAX_LENGTH) { cleaned = cleaned.substring(0, MAX_LENGTH - 3) + "..."; }
        return cleaned;
    }

}
