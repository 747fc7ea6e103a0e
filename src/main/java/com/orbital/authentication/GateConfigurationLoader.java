package com.orbital.authentication;

import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.*;

/**
 * Loads a {@link GateConfiguration} from a YAML document. Everything lives under a
 * <code>session-gate</code> section; anything left out keeps the builder's default.
 * <pre>
 * session-gate:
 *   cookie: { name: orbital-session, path: /, secure: true, same-site: Lax, max-age: 30d }
 *   paths: { login: /login, home: /dashboard, callback: /auth/callback, sign-in: /auth/signin }
 *   protected: { prefix: [/dashboard, /videos], exact: [/account] }
 *   auth-entry: { prefix: [/login, /signup] }
 *   unreachable-policy: fail-closed
 *   validation-timeout: 3s
 *   refresh-skew: 1m
 *   pkce-record-ttl: 10m
 * </pre>
 * Durations are written as a number with a unit (<code>ms</code>, <code>s</code>,
 * <code>m</code>, <code>h</code>, <code>d</code>) or in ISO-8601 form.
 */
public final class GateConfigurationLoader {

    static final String ROOT = "session-gate";

    private GateConfigurationLoader() { }

    /**
     * Loads configuration from the YAML file at <code>path</code>
     * @param path location of the YAML configuration
     * @return GateConfiguration
     * @throws IOException when the file cannot be read
     * @throws IllegalArgumentException when the YAML structure is invalid
     */
    public static GateConfiguration load(Path path) throws IOException {
        Objects.requireNonNull(path, "Must provide a path to load gate configuration from");
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return load(reader, path.toString());
        }
    }

    /**
     * Loads configuration from a YAML resource on the classpath
     * @param resourceName name of the classpath resource
     * @return GateConfiguration
     * @throws IOException when the resource doesn't exist or cannot be read
     */
    public static GateConfiguration loadResource(String resourceName) throws IOException {
        Objects.requireNonNull(resourceName, "Must provide a resource name to load gate configuration from");
        InputStream stream = GateConfigurationLoader.class.getClassLoader().getResourceAsStream(resourceName);
        if (stream == null) { throw new IOException("Gate configuration resource " + resourceName + " was not found on the classpath"); }
        try (Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
            return load(reader, resourceName);
        }
    }

    static GateConfiguration load(Reader reader, String source) {
        Object document;
        try {
            document = new Yaml().load(reader);
        } catch (YAMLException ex) {
            throw new IllegalArgumentException("Failed to parse YAML gate configuration at " + source, ex);
        }
        GateConfiguration.Builder builder = new GateConfiguration.Builder();
        if (document == null) { return builder.build(); }
        Map<String, Object> root = asMap(document, "root");
        if (root.get(ROOT) == null) { return builder.build(); }
        Map<String, Object> gate = asMap(root.get(ROOT), ROOT);

        if (gate.get("cookie") != null) {
            Map<String, Object> cookie = asMap(gate.get("cookie"), "cookie");
            builder.setCookie(string(cookie, "name", builder.getCookieName()),
                              string(cookie, "path", builder.getCookiePath()),
                              Boolean.parseBoolean(string(cookie, "secure", String.valueOf(builder.isCookieSecure()))),
                              string(cookie, "same-site", builder.getCookieSameSite()),
                              duration(cookie, "max-age", builder.getCookieMaxAge()));
        }
        if (gate.get("paths") != null) {
            Map<String, Object> paths = asMap(gate.get("paths"), "paths");
            builder.setLoginPath(string(paths, "login", builder.getLoginPath()))
                   .setHomePath(string(paths, "home", builder.getHomePath()))
                   .setCallbackPath(string(paths, "callback", builder.getCallbackPath()))
                   .setSignInPath(string(paths, "sign-in", builder.getSignInPath()))
                   .setRedirectParameter(string(paths, "redirect-parameter", builder.getRedirectParameter()));
        }
        if (gate.get("protected") != null || gate.get("auth-entry") != null) {
            PathPolicy defaults = builder.getPathPolicy();
            List<String> protectedPrefixes = new ArrayList<>(defaults.getProtectedPrefixes());
            List<String> protectedExact = new ArrayList<>(defaults.getProtectedExact());
            List<String> authEntryPrefixes = new ArrayList<>(defaults.getAuthEntryPrefixes());
            List<String> authEntryExact = new ArrayList<>(defaults.getAuthEntryExact());
            if (gate.get("protected") != null) {
                Map<String, Object> section = asMap(gate.get("protected"), "protected");
                protectedPrefixes = strings(section, "prefix", "protected");
                protectedExact = strings(section, "exact", "protected");
            }
            if (gate.get("auth-entry") != null) {
                Map<String, Object> section = asMap(gate.get("auth-entry"), "auth-entry");
                authEntryPrefixes = strings(section, "prefix", "auth-entry");
                authEntryExact = strings(section, "exact", "auth-entry");
            }
            builder.setPathPolicy(new PathPolicy(protectedPrefixes, protectedExact, authEntryPrefixes, authEntryExact));
        }
        if (gate.get("unreachable-policy") != null) {
            builder.setUnreachablePolicy(unreachablePolicy(gate.get("unreachable-policy").toString()));
        }
        builder.setValidationTimeout(duration(gate, "validation-timeout", builder.getValidationTimeout()))
               .setRefreshSkew(duration(gate, "refresh-skew", builder.getRefreshSkew()))
               .setPkceRecordTtl(duration(gate, "pkce-record-ttl", builder.getPkceRecordTtl()));
        return builder.build();
    }

    static UnreachablePolicy unreachablePolicy(String value) {
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return UnreachablePolicy.valueOf(normalized);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown unreachable policy " + value + ", expected fail-closed or fail-open", ex);
        }
    }

    static Duration parseDuration(String value) {
        String trimmed = value.trim().toLowerCase(Locale.ROOT);
        if (trimmed.startsWith("p")) {
            try {
                return Duration.parse(trimmed.toUpperCase(Locale.ROOT));
            } catch (DateTimeParseException ex) {
                throw new IllegalArgumentException("Invalid duration " + value, ex);
            }
        }
        int split = 0;
        while (split < trimmed.length() && Character.isDigit(trimmed.charAt(split))) { split++; }
        if (split == 0) { throw new IllegalArgumentException("Invalid duration " + value); }
        long amount = Long.parseLong(trimmed.substring(0, split));
        switch (trimmed.substring(split).trim()) {
            case "ms": return Duration.ofMillis(amount);
            case "":
            case "s": return Duration.ofSeconds(amount);
            case "m": return Duration.ofMinutes(amount);
            case "h": return Duration.ofHours(amount);
            case "d": return Duration.ofDays(amount);
            default: throw new IllegalArgumentException("Invalid duration unit in " + value);
        }
    }

    private static Map<String, Object> asMap(Object node, String context) {
        if (!(node instanceof Map)) { throw new IllegalArgumentException(context + " section must be a mapping"); }
        Map<String, Object> map = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) node).entrySet()) {
            if (!(entry.getKey() instanceof String)) { throw new IllegalArgumentException(context + " section contains non-string key"); }
            map.put((String) entry.getKey(), entry.getValue());
        }
        return map;
    }

    private static String string(Map<String, Object> section, String key, String defaultValue) {
        Object value = section.get(key);
        return value == null ? defaultValue : value.toString();
    }

    private static Duration duration(Map<String, Object> section, String key, Duration defaultValue) {
        Object value = section.get(key);
        return value == null ? defaultValue : parseDuration(value.toString());
    }

    private static List<String> strings(Map<String, Object> section, String key, String context) {
        Object value = section.get(key);
        if (value == null) { return List.of(); }
        if (!(value instanceof List)) { throw new IllegalArgumentException(context + "." + key + " must be a list of paths"); }
        List<String> paths = new ArrayList<>();
        for (Object path : (List<?>) value) { paths.add(String.valueOf(path)); }
        return paths;
    }

}
