package dao.fhe.mystery.oracle;

/**
 * Checks that a cleartext really is the oracle's answer to a request.
 * Implementations throw {@link dao.fhe.mystery.exception.ProtocolException} with
 * {@code INVALID_PROOF} when it is not.
 */
public interface ProofVerifier {

    void verify(long requestId, byte[] cleartext, byte[] proof);
}
