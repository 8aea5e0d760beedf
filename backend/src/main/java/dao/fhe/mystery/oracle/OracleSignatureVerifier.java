package dao.fhe.mystery.oracle;

import dao.fhe.mystery.config.OracleProperties;
import dao.fhe.mystery.exception.ProtocolError;
import dao.fhe.mystery.exception.ProtocolException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.security.SignatureException;
import java.util.Arrays;
import java.util.Locale;

@Slf4j
@Component
public class OracleSignatureVerifier implements ProofVerifier {

    private final String trustedSigner; // 40 hex chars, lower-case, no prefix

    public OracleSignatureVerifier(OracleProperties props) {
        String configured = props.getSignerAddress();
        if (configured == null || configured.isBlank()) {
            log.warn("OracleSignatureVerifier: oracle.signer-address is not configured. Every disclosure proof will be rejected.");
            this.trustedSigner = null;
        } else {
            this.trustedSigner = Numeric.cleanHexPrefix(configured.trim()).toLowerCase(Locale.ROOT);
        }
        log.info("OracleSignatureVerifier initialized: trustedSigner={}", trustedSigner);
    }

    @Override
    public void verify(long requestId, byte[] cleartext, byte[] proof) {
        if (trustedSigner == null) {
            throw new ProtocolException(ProtocolError.INVALID_PROOF, "No trusted oracle signer configured");
        }
        if (cleartext == null || proof == null || proof.length != 65) {
            throw new ProtocolException(ProtocolError.INVALID_PROOF,
                    "Proof must be a 65-byte signature for request " + requestId);
        }

        Sign.SignatureData sig = new Sign.SignatureData(
                proof[64],
                Arrays.copyOfRange(proof, 0, 32),
                Arrays.copyOfRange(proof, 32, 64));

        String recovered;
        try {
            BigInteger publicKey = Sign.signedPrefixedMessageToKey(OracleProofs.digest(requestId, cleartext), sig);
            recovered = Keys.getAddress(publicKey).toLowerCase(Locale.ROOT);
        } catch (SignatureException | IllegalArgumentException e) {
            throw new ProtocolException(ProtocolError.INVALID_PROOF,
                    "Unrecoverable proof for request " + requestId + ": " + e.getMessage(), e);
        }

        if (!trustedSigner.equals(recovered)) {
            throw new ProtocolException(ProtocolError.INVALID_PROOF,
                    "Proof for request " + requestId + " signed by 0x" + recovered + ", expected 0x" + trustedSigner);
        }
    }
}
