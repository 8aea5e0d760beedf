package dao.fhe.mystery.model;

/**
 * Rate-limit categories. Each has its own cooldown window per identity.
 */
public enum ActionCategory {
    /** Contributions and accusations. */
    SUBMISSION,
    /** Solution disclosure requests. */
    REQUEST
}
