package tech.tollgate.provider.oauth;

import tech.tollgate.provider.common.errors.OAuthDenial;

import java.util.Objects;

/**
 * Result of running a grant: the terminal state it reached, the response to
 * send, and the denial when it was refused.
 *
 * @param denial null unless the state is REJECTED or STORE_FAILURE
 */
public record GrantOutcome(GrantState state, GrantResponse response, OAuthDenial denial) {

    public GrantOutcome {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(response, "response");
        if (!state.isTerminal()) {
            throw new IllegalArgumentException("Grant outcome must be terminal, was " + state);
        }
    }

    public static GrantOutcome responded(GrantResponse response) {
        return new GrantOutcome(GrantState.RESPONDED, response, null);
    }

    public static GrantOutcome awaitingConsent(GrantResponse response) {
        return new GrantOutcome(GrantState.AWAITING_CONSENT, response, null);
    }

    public static GrantOutcome rejected(GrantResponse response, OAuthDenial denial) {
        return new GrantOutcome(GrantState.REJECTED, response, denial);
    }

    public static GrantOutcome storeFailure(GrantResponse response, OAuthDenial denial) {
        return new GrantOutcome(GrantState.STORE_FAILURE, response, denial);
    }

    public boolean isSuccess() {
        return state == GrantState.RESPONDED;
    }
}
