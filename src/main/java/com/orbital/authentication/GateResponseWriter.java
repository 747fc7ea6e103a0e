package com.orbital.authentication;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import java.io.IOException;
import java.util.Objects;

/**
 * Copies a {@link GateResponse} onto the servlet response that is actually sent, in the order
 * headers, cookies, redirect. Cookies are written as raw Set-Cookie headers so SameSite is kept.
 */
public class GateResponseWriter {

    static final String SET_COOKIE = "Set-Cookie";

    private GateResponseWriter() { }

    /**
     * Writes <code>gateResponse</code> onto <code>response</code>
     * @param gateResponse Decision, headers and cookies to write
     * @param response Servlet response returned to the browser
     * @throws IOException if the redirect can't be sent
     */
    public static void write(GateResponse gateResponse, HttpServletResponse response) throws IOException {
        Objects.requireNonNull(gateResponse, "Must provide a gate response to write");
        Objects.requireNonNull(response, "Must provide a servlet response to write to");
        gateResponse.getHeaders().forEach(response::setHeader);
        for (SessionCookie cookie : gateResponse.getCookies()) { response.addHeader(SET_COOKIE, cookie.toHeaderValue()); }
        if (gateResponse.getDecision().isRedirect()) { response.sendRedirect(gateResponse.getLocation()); }
    }

    /**
     * Gets the value of the cookie named <code>name</code> from a servlet request
     * @param request Servlet request
     * @param name Cookie name
     * @return Cookie value or null
     */
    public static String getCookieValue(HttpServletRequest request, String name) {
        Objects.requireNonNull(request, "Must provide a servlet request to read cookies from");
        Cookie[] cookies = request.getCookies();
        if (cookies == null) { return null; }
        for (Cookie cookie : cookies) {
            if (name.equals(cookie.getName())) { return cookie.getValue(); }
        }
        return null;
    }

    /**
     * Gets the requested path of a servlet request, without the context path
     * @param request Servlet request
     * @return Requested path
     */
    public static String getRequestPath(HttpServletRequest request) {
        Objects.requireNonNull(request, "Must provide a servlet request to get the path of");
        String uri = request.getRequestURI();
        String contextPath = request.getContextPath();
        if (contextPath != null && !contextPath.isEmpty() && uri.startsWith(contextPath)) { uri = uri.substring(contextPath.length()); }
        return uri.isEmpty() ? "/" : uri;
    }

}
