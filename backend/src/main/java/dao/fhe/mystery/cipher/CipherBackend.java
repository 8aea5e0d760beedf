package dao.fhe.mystery.cipher;

import dao.fhe.mystery.model.CipherHandle;

/**
 * Homomorphic operations on opaque values. Implementations never expose plaintext.
 * {@link #combine} must be associative and commutative over the values it produces.
 */
public interface CipherBackend {

    CipherHandle combine(CipherHandle a, CipherHandle b);

    CipherHandle compareEqual(CipherHandle a, CipherHandle b);

    CipherHandle logicalAnd(CipherHandle x, CipherHandle y);

    CipherHandle additiveIdentity();

    CipherHandle constantBool(boolean value);
}
