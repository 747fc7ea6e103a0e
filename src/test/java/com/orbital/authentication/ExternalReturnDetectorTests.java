package com.orbital.authentication;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExternalReturnDetectorTests {

    private final ExternalReturnDetector detector = new ExternalReturnDetector(CacheSettings.defaults().getReturnMarkers());

    @Test
    @DisplayName("Recognise a return carrying a return marker")
    void recogniseMarkers() {
        assertTrue(detector.isExternalReturn(URI.create("https://orbital.example/purchases?success=true"), false));
        assertTrue(detector.isExternalReturn(URI.create("https://orbital.example/purchases?plan=creator&canceled"), false));
        assertTrue(detector.isExternalReturn(URI.create("https://orbital.example/login?error=provider_denied"), false));
    }

    @Test
    @DisplayName("Recognise a page restored from the back/forward cache")
    void recogniseRestored() {
        assertTrue(detector.isExternalReturn(URI.create("https://orbital.example/dashboard"), true));
        assertTrue(detector.isExternalReturn(null, true));
    }

    @Test
    @DisplayName("Ignore ordinary navigation")
    void ignoreOrdinary() {
        assertFalse(detector.isExternalReturn(URI.create("https://orbital.example/dashboard"), false));
        assertFalse(detector.isExternalReturn(URI.create("https://orbital.example/videos?successful=1"), false));
        assertFalse(detector.isExternalReturn(null, false));
    }

}
