package dao.fhe.mystery.exception;

/**
 * Caller-visible failure codes. None of them is retryable as-is: the caller has to fix the
 * precondition first (wait out a cooldown, pick another batch, re-derive state).
 */
public enum ProtocolError {

    NOT_OWNER(403),
    NOT_PROVIDER(403),
    PAUSED(423),
    RATE_LIMITED(429),
    BATCH_CLOSED(409),
    BATCH_FULL(409),
    INVALID_BATCH(404),
    /** Dedup violation, or the disclosed values no longer match their commitment. */
    INVALID_STATE(409),
    STALE_VERSION(409),
    ALREADY_PROCESSED(409),
    UNKNOWN_REQUEST(404),
    INVALID_PROOF(422),
    MALFORMED_CLEARTEXT(422);

    private final int httpStatus;

    ProtocolError(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int httpStatus() {
        return httpStatus;
    }
}
