package com.orbital.authentication;

import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.Objects;

/**
 * Serves the two ends of a sign-in via the identity provider: the sign-in path starts the flow
 * and redirects to the provider, the callback path finishes it. Map it to both paths configured
 * in {@link GateConfiguration}.
 */
@Slf4j
public class OAuthExchangeServlet extends HttpServlet {

    private final transient OAuthExchangeHandler handler;

    public OAuthExchangeServlet(OAuthExchangeHandler handler) {
        Objects.requireNonNull(handler, "Must provide an exchange handler for the servlet");
        this.handler = handler;
    }

    @Override
    protected void doGet(HttpServletRequest request, HttpServletResponse response) throws IOException {
        GateConfiguration configuration = this.handler.getConfiguration();
        String path = GateResponseWriter.getRequestPath(request);
        if (path.equals(configuration.getSignInPath())) {
            AuthorizationRedirect redirect = this.handler.begin(request.getParameter(configuration.getRedirectParameter()));
            response.setHeader(OAuthExchangeHandler.CACHE_CONTROL, "no-store");
            response.sendRedirect(redirect.getAuthorizationUrl().toString());
        } else if (path.equals(configuration.getCallbackPath())) {
            CallbackParameters parameters = new CallbackParameters(request.getParameter(CallbackParameters.CODE),
                                                                   request.getParameter(CallbackParameters.STATE),
                                                                   request.getParameter(CallbackParameters.ERROR),
                                                                   request.getParameter(CallbackParameters.ERROR_DESCRIPTION));
            ExchangeOutcome outcome = this.handler.handleCallback(parameters);
            GateResponseWriter.write(outcome.getResponse(), response);
        } else {
            log.debug("No OAuth exchange endpoint at " + path);
            response.sendError(HttpServletResponse.SC_NOT_FOUND);
        }
    }

}
