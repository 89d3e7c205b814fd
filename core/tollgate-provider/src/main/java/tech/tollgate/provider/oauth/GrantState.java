package tech.tollgate.provider.oauth;

/**
 * States a single grant attempt passes through.
 *
 * <pre>
 * START -> VALIDATED | REJECTED
 * VALIDATED -> ISSUED | STORE_FAILURE | AWAITING_CONSENT | REJECTED
 * ISSUED -> RESPONDED
 * </pre>
 *
 * A VALIDATED attempt can still be REJECTED when the resource owner denies
 * consent or a concurrent request wins the race for the same code or
 * refresh token.
 */
public enum GrantState {
    START,
    VALIDATED,
    REJECTED,
    AWAITING_CONSENT,
    ISSUED,
    STORE_FAILURE,
    RESPONDED;

    public boolean isTerminal() {
        return this == REJECTED || this == AWAITING_CONSENT || this == STORE_FAILURE || this == RESPONDED;
    }
}
