package com.orbital.authentication;

import jakarta.servlet.*;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.Objects;

/**
 * Runs the {@link SessionValidator} ahead of any page content. The validator's response is
 * written onto the servlet response this filter was handed, and the request continues down
 * the chain only when it is allowed. The validated {@link Identity}, when there is one, is
 * available to the rest of the chain as the {@link #IDENTITY_ATTRIBUTE} request attribute.
 */
@Slf4j
public class SessionValidationFilter implements Filter {

    public static final String IDENTITY_ATTRIBUTE = "com.orbital.authentication.identity";

    private final SessionValidator validator;

    public SessionValidationFilter(SessionValidator validator) {
        Objects.requireNonNull(validator, "Must provide a session validator for the filter");
        this.validator = validator;
    }

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain) throws IOException, ServletException {
        if (!(request instanceof HttpServletRequest) || !(response instanceof HttpServletResponse)) {
            chain.doFilter(request, response);
            return;
        }
        HttpServletRequest httpRequest = (HttpServletRequest) request;
        HttpServletResponse httpResponse = (HttpServletResponse) response;
        String cookieName = this.validator.getConfiguration().getCookieName();
        GateRequest gateRequest = new GateRequest(GateResponseWriter.getRequestPath(httpRequest), GateResponseWriter.getCookieValue(httpRequest, cookieName));
        GateResponse gateResponse = this.validator.validate(gateRequest);
        GateResponseWriter.write(gateResponse, httpResponse);
        if (gateResponse.getDecision().isRedirect()) {
            log.debug("Redirecting " + gateRequest.getPath() + " to " + gateResponse.getLocation());
            return;
        }
        if (gateResponse.getIdentity() != null) { httpRequest.setAttribute(IDENTITY_ATTRIBUTE, gateResponse.getIdentity()); }
        chain.doFilter(request, response);
    }

}
