package dao.fhe.mystery.model;

import org.web3j.utils.Numeric;

import java.util.Locale;
import java.util.Objects;

/**
 * Reference to an opaque value held by the cipher backend. The plaintext is never reachable
 * through the handle itself; only backend operations and disclosure can act on it.
 *
 * @param hex  32-byte handle, lower-case, 0x-prefixed
 * @param type what the opaque value encodes
 */
public record CipherHandle(String hex, CipherType type) {

    public CipherHandle {
        Objects.requireNonNull(hex, "hex");
        Objects.requireNonNull(type, "type");
        String clean = Numeric.cleanHexPrefix(hex.trim()).toLowerCase(Locale.ROOT);
        if (clean.length() != 64 || !clean.matches("[0-9a-f]+")) {
            throw new IllegalArgumentException("Handle must be 32 bytes of hex: " + hex);
        }
        hex = "0x" + clean;
    }

    public static CipherHandle of(byte[] bytes, CipherType type) {
        return new CipherHandle(Numeric.toHexString(bytes), type);
    }

    public static CipherHandle uint(String hex) {
        return new CipherHandle(hex, CipherType.UINT);
    }

    public byte[] bytes() {
        return Numeric.hexStringToByteArray(hex);
    }
}
