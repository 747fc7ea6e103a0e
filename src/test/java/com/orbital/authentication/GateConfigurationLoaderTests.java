package com.orbital.authentication;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class GateConfigurationLoaderTests {

    @Test
    @DisplayName("Load the packaged defaults")
    void loadDefaults() throws IOException {
        GateConfiguration configuration = GateConfigurationLoader.loadResource("session-gate.yaml");
        assertEquals(GateConfiguration.DEFAULT_COOKIE_NAME, configuration.getCookieName());
        assertEquals(Duration.ofDays(30), configuration.getCookieMaxAge());
        assertEquals(UnreachablePolicy.FAIL_CLOSED, configuration.getUnreachablePolicy());
        assertTrue(configuration.getPathPolicy().isProtected("/videos/42"));
        assertTrue(configuration.getPathPolicy().isAuthEntry("/signup"));
        assertEquals(Duration.ofSeconds(3), configuration.getValidationTimeout());
        assertEquals(Duration.ofMinutes(10), configuration.getPkceRecordTtl());
    }

    @Test
    @DisplayName("Load configuration from a resource, keeping defaults for what is left out")
    void loadResource() throws IOException {
        GateConfiguration configuration = GateConfigurationLoader.loadResource("session-gate-test.yaml");
        assertEquals("orbital-test-session", configuration.getCookieName());
        assertEquals("/app", configuration.getCookiePath());
        assertFalse(configuration.isCookieSecure());
        assertEquals("Strict", configuration.getCookieSameSite());
        assertEquals(Duration.ofDays(7), configuration.getCookieMaxAge());
        assertEquals("/app/login", configuration.getLoginPath());
        assertEquals("/app/home", configuration.getHomePath());
        assertEquals("/auth/callback", configuration.getCallbackPath());
        assertEquals(UnreachablePolicy.FAIL_OPEN, configuration.getUnreachablePolicy());
        assertEquals(Duration.ofMillis(1500), configuration.getValidationTimeout());
        assertEquals(Duration.ofSeconds(30), configuration.getRefreshSkew());
        assertEquals(Duration.ofMinutes(10), configuration.getPkceRecordTtl());

        PathPolicy policy = configuration.getPathPolicy();
        assertTrue(policy.isProtected("/app/library/42"));
        assertTrue(policy.isProtected("/app/account"));
        assertFalse(policy.isProtected("/app/account/delete"));
        assertFalse(policy.isProtected("/dashboard"));
        // Auth entry paths weren't configured so they keep their defaults
        assertTrue(policy.isAuthEntry("/login"));
    }

    @Test
    @DisplayName("Load configuration from a file")
    void loadFile(@TempDir Path directory) throws IOException {
        Path file = directory.resolve("gate.yaml");
        Files.write(file, "session-gate:\n  paths:\n    login: signin\n".getBytes(StandardCharsets.UTF_8));
        assertEquals("/signin", GateConfigurationLoader.load(file).getLoginPath());
    }

    @Test
    @DisplayName("Use defaults for an empty document or one without the gate section")
    void loadEmpty() {
        assertEquals(GateConfiguration.DEFAULT_COOKIE_NAME, GateConfigurationLoader.load(new StringReader(""), "empty").getCookieName());
        assertEquals("/login", GateConfigurationLoader.load(new StringReader("other: {}\n"), "other").getLoginPath());
    }

    @Test
    @DisplayName("Fail to load a missing resource")
    void failMissingResource() {
        assertThrows(IOException.class, () -> GateConfigurationLoader.loadResource("missing-gate.yaml"));
    }

    @Test
    @DisplayName("Fail to load invalid configuration")
    void failInvalid() {
        assertThrows(IllegalArgumentException.class, () -> GateConfigurationLoader.load(new StringReader("session-gate: [1, 2]\n"), "list"));
        assertThrows(IllegalArgumentException.class, () -> GateConfigurationLoader.load(new StringReader("session-gate:\n  protected:\n    prefix: /dashboard\n"), "scalar"));
        assertThrows(IllegalArgumentException.class, () -> GateConfigurationLoader.load(new StringReader("session-gate:\n  unreachable-policy: sometimes\n"), "policy"));
        assertThrows(IllegalArgumentException.class, () -> GateConfigurationLoader.load(new StringReader("session-gate:\n  validation-timeout: soon\n"), "duration"));
        assertThrows(IllegalArgumentException.class, () -> GateConfigurationLoader.load(new StringReader("session-gate: {\n"), "syntax"));
    }

    @Test
    @DisplayName("Parse durations with units or in ISO-8601 form")
    void parseDurations() {
        assertEquals(Duration.ofMillis(250), GateConfigurationLoader.parseDuration("250ms"));
        assertEquals(Duration.ofSeconds(3), GateConfigurationLoader.parseDuration("3s"));
        assertEquals(Duration.ofSeconds(3), GateConfigurationLoader.parseDuration("3"));
        assertEquals(Duration.ofMinutes(2), GateConfigurationLoader.parseDuration(" 2m "));
        assertEquals(Duration.ofHours(1), GateConfigurationLoader.parseDuration("1h"));
        assertEquals(Duration.ofDays(30), GateConfigurationLoader.parseDuration("30d"));
        assertEquals(Duration.ofMinutes(5), GateConfigurationLoader.parseDuration("PT5M"));
        assertThrows(IllegalArgumentException.class, () -> GateConfigurationLoader.parseDuration("5 weeks"));
    }

    @Test
    @DisplayName("Read unreachable policies in either spelling")
    void readUnreachablePolicy() {
        assertEquals(UnreachablePolicy.FAIL_OPEN, GateConfigurationLoader.unreachablePolicy("fail-open"));
        assertEquals(UnreachablePolicy.FAIL_CLOSED, GateConfigurationLoader.unreachablePolicy("FAIL_CLOSED"));
    }

}
