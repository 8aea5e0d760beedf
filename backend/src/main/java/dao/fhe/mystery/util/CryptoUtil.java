package dao.fhe.mystery.util;

import org.bouncycastle.jcajce.provider.digest.Keccak;

import java.math.BigInteger;
import java.security.SecureRandom;

/**
 * Cryptographic utilities.
 *
 * IMPORTANT:
 * - Use SecureRandom for handles intended to be unpredictable.
 * - All digests are Keccak-256 (not SHA3-256), matching the ledger side.
 */
public final class CryptoUtil {
    private CryptoUtil() {}

    private static final SecureRandom RNG = new SecureRandom();

    public static byte[] randomBytes32() {
        byte[] salt = new byte[32];
        RNG.nextBytes(salt);
        return salt;
    }

    public static String toHex0x(byte[] bytes) {
        StringBuilder sb = new StringBuilder("0x");
        for (byte b : bytes) sb.append(String.format("%02x", b));
        return sb.toString();
    }

    public static byte[] keccak256(byte[] data) {
        Keccak.Digest256 digest = new Keccak.Digest256();
        digest.update(data, 0, data.length);
        return digest.digest();
    }

    public static byte[] concat(byte[] a, byte[] b) {
        byte[] out = new byte[a.length + b.length];
        System.arraycopy(a, 0, out, 0, a.length);
        System.arraycopy(b, 0, out, a.length, b.length);
        return out;
    }

    /**
     * Left-pad an unsigned value to a 32-byte big-endian word (uint256).
     */
    public static byte[] uint256ToBytes(BigInteger value) {
        if (value.signum() < 0) {
            throw new IllegalArgumentException("uint256 cannot be negative: " + value);
        }
        byte[] raw = value.toByteArray();
        if (raw.length > 33 || (raw.length == 33 && raw[0] != 0)) {
            throw new IllegalArgumentException("Value does not fit in uint256: " + value);
        }
        byte[] out = new byte[32];
        int copy = Math.min(raw.length, 32);
        System.arraycopy(raw, raw.length - copy, out, 32 - copy, copy);
        return out;
    }
}
