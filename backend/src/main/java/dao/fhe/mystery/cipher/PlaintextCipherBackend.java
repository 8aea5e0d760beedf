package dao.fhe.mystery.cipher;

import dao.fhe.mystery.model.CipherHandle;
import dao.fhe.mystery.model.CipherType;
import dao.fhe.mystery.util.CryptoUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Cipher backend that keeps plaintexts in memory behind handles. For local runs and tests only.
 * <p>
 * Handles of computed values are derived as keccak256(op || operand handles), so evaluating the
 * same expression over the same operands always yields the same handle. Sealed inputs get a
 * random handle.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "cipher", name = "backend", havingValue = "plaintext", matchIfMissing = true)
public class PlaintextCipherBackend implements CipherBackend {

    private static final BigInteger MODULUS = BigInteger.ONE.shiftLeft(256);

    private final Map<CipherHandle, BigInteger> values = new ConcurrentHashMap<>();

    public PlaintextCipherBackend() {
        log.warn("PlaintextCipherBackend active: sealed values are NOT confidential.");
    }

    public CipherHandle seal(BigInteger value) {
        return register(CryptoUtil.randomBytes32(), CipherType.UINT, value.mod(MODULUS));
    }

    public CipherHandle seal(long value) {
        return seal(BigInteger.valueOf(value));
    }

    public BigInteger reveal(CipherHandle handle) {
        BigInteger v = values.get(handle);
        if (v == null) {
            throw new IllegalArgumentException("Unknown handle: " + handle.hex());
        }
        return v;
    }

    @Override
    public CipherHandle combine(CipherHandle a, CipherHandle b) {
        requireType(a, CipherType.UINT);
        requireType(b, CipherType.UINT);
        BigInteger sum = reveal(a).add(reveal(b)).mod(MODULUS);
        return register(derive("add", a, b), CipherType.UINT, sum);
    }

    @Override
    public CipherHandle compareEqual(CipherHandle a, CipherHandle b) {
        requireType(a, CipherType.UINT);
        requireType(b, CipherType.UINT);
        boolean eq = reveal(a).equals(reveal(b));
        return register(derive("eq", a, b), CipherType.BOOL, eq ? BigInteger.ONE : BigInteger.ZERO);
    }

    @Override
    public CipherHandle logicalAnd(CipherHandle x, CipherHandle y) {
        requireType(x, CipherType.BOOL);
        requireType(y, CipherType.BOOL);
        boolean both = reveal(x).signum() != 0 && reveal(y).signum() != 0;
        return register(derive("and", x, y), CipherType.BOOL, both ? BigInteger.ONE : BigInteger.ZERO);
    }

    @Override
    public CipherHandle additiveIdentity() {
        return register(derive("zero"), CipherType.UINT, BigInteger.ZERO);
    }

    @Override
    public CipherHandle constantBool(boolean value) {
        return register(derive(value ? "true" : "false"), CipherType.BOOL, value ? BigInteger.ONE : BigInteger.ZERO);
    }

    private CipherHandle register(byte[] handleBytes, CipherType type, BigInteger value) {
        CipherHandle handle = CipherHandle.of(handleBytes, type);
        values.putIfAbsent(handle, value);
        return handle;
    }

    private static byte[] derive(String op, CipherHandle... operands) {
        byte[] packed = op.getBytes(StandardCharsets.UTF_8);
        for (CipherHandle h : operands) {
            packed = CryptoUtil.concat(packed, h.bytes());
        }
        return CryptoUtil.keccak256(packed);
    }

    private static void requireType(CipherHandle handle, CipherType expected) {
        if (handle.type() != expected) {
            throw new IllegalArgumentException("Expected " + expected + " handle, got " + handle.type() + ": " + handle.hex());
        }
    }
}
