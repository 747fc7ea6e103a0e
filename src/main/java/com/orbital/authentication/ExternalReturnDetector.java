package com.orbital.authentication;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Set;

/**
 * Recognises a page load that is a return from an external domain: restored from the
 * back/forward cache, or carrying one of the configured return markers in its query
 */
public class ExternalReturnDetector {

    private final Set<String> returnMarkers;

    public ExternalReturnDetector(Set<String> returnMarkers) {
        Objects.requireNonNull(returnMarkers, "Must provide return markers");
        this.returnMarkers = Set.copyOf(returnMarkers);
    }

    /**
     * Whether the page shown at <code>location</code> is a return from an external domain
     * @param location Location of the page (may be null)
     * @param restoredFromCache Whether the page was restored from the back/forward cache
     * @return true when identity state must be resolved again
     */
    public boolean isExternalReturn(URI location, boolean restoredFromCache) {
        if (restoredFromCache) { return true; }
        if (location == null || location.getRawQuery() == null) { return false; }
        for (String pair : location.getRawQuery().split("&")) {
            int split = pair.indexOf('=');
            String name = URLDecoder.decode(split < 0 ? pair : pair.substring(0, split), StandardCharsets.UTF_8);
            if (this.returnMarkers.contains(name)) { return true; }
        }
        return false;
    }

}
