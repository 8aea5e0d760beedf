package dao.fhe.mystery.oracle;

import dao.fhe.mystery.util.CryptoUtil;
import org.web3j.crypto.ECKeyPair;
import org.web3j.crypto.Sign;

import java.math.BigInteger;

/**
 * Proof format shared by the oracle and the verifier:
 * hash = keccak256(uint256(requestId) || cleartext);
 * signature = sign(toEthSignedMessageHash(hash)) as r || s || v.
 */
public final class OracleProofs {
    private OracleProofs() {}

    public static byte[] digest(long requestId, byte[] cleartext) {
        byte[] id32 = CryptoUtil.uint256ToBytes(BigInteger.valueOf(requestId));
        return CryptoUtil.keccak256(CryptoUtil.concat(id32, cleartext));
    }

    public static byte[] sign(long requestId, byte[] cleartext, ECKeyPair keyPair) {
        Sign.SignatureData sig = Sign.signPrefixedMessage(digest(requestId, cleartext), keyPair);

        byte[] out = new byte[65];
        System.arraycopy(sig.getR(), 0, out, 0, 32);
        System.arraycopy(sig.getS(), 0, out, 32, 32);
        out[64] = sig.getV()[0];
        return out;
    }
}
