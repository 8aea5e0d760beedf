package dao.fhe.mystery.model;

/**
 * Tracked fields of a round, in disclosure order.
 */
public enum Field {
    WEAPON,
    ROOM,
    SUSPECT
}
