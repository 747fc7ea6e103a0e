package com.orbital.authentication;

import lombok.Getter;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Terminal result of an OAuth callback. Either {@link ExchangeState#EXCHANGED} with a verified
 * session, or {@link ExchangeState#FAILED} with a reason. In both cases {@link #getResponse()}
 * is the response to send back to the browser.
 */
@Getter
public class ExchangeOutcome {

    private final ExchangeState state;
    private final ExchangeFailureReason reason;
    private final String detail;
    private final VerifiedSession verifiedSession;
    private final List<ExchangeState> trail;
    private final GateResponse response;

    private ExchangeOutcome(ExchangeState state, ExchangeFailureReason reason, String detail, VerifiedSession verifiedSession,
                            List<ExchangeState> trail, GateResponse response) {
        Objects.requireNonNull(trail, "Must provide the trail of exchange states");
        Objects.requireNonNull(response, "Must provide the response of the exchange");
        this.state = state;
        this.reason = reason;
        this.detail = detail;
        this.verifiedSession = verifiedSession;
        this.trail = Collections.unmodifiableList(trail);
        this.response = response;
    }

    static ExchangeOutcome exchanged(VerifiedSession verifiedSession, List<ExchangeState> trail, GateResponse response) {
        Objects.requireNonNull(verifiedSession, "Must provide the verified session of a successful exchange");
        return new ExchangeOutcome(ExchangeState.EXCHANGED, null, null, verifiedSession, trail, response);
    }

    static ExchangeOutcome failed(ExchangeFailureReason reason, String detail, List<ExchangeState> trail, GateResponse response) {
        Objects.requireNonNull(reason, "Must provide the reason of a failed exchange");
        return new ExchangeOutcome(ExchangeState.FAILED, reason, detail, null, trail, response);
    }

    public boolean isExchanged() { return this.state == ExchangeState.EXCHANGED; }

    @Override
    public String toString() { return "ExchangeOutcome[" + this.state + (this.reason == null ? "" : ", " + this.reason.getCode()) + "]"; }

}
