package dao.fhe.mystery.model;

public enum ContextStatus {
    PENDING,
    SETTLED,
    /** Issued under an older protocol version; can never be settled. */
    STALE
}
