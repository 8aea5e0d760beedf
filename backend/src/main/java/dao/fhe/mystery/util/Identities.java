package dao.fhe.mystery.util;

import java.util.Locale;

/**
 * Participant identities are hex addresses; they are compared case-insensitively.
 */
public final class Identities {
    private Identities() {}

    public static String normalize(String identity) {
        if (identity == null || identity.isBlank()) {
            throw new IllegalArgumentException("Identity must not be blank");
        }
        return identity.trim().toLowerCase(Locale.ROOT);
    }
}
