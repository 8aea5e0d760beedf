package dao.fhe.mystery.oracle;

import dao.fhe.mystery.cipher.PlaintextCipherBackend;
import dao.fhe.mystery.config.OracleProperties;
import dao.fhe.mystery.model.CipherHandle;
import dao.fhe.mystery.model.CipherType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.web3j.crypto.ECKeyPair;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Stand-in for the external decryption oracle, backed by the plaintext cipher backend.
 * Requests are queued on the {@link DisclosureChannel}; {@link #answer} turns one into a signed
 * reply, which is what the real oracle would eventually post back.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "cipher", name = "backend", havingValue = "plaintext", matchIfMissing = true)
public class LocalDisclosureOracle implements DisclosureOracle {

    private final PlaintextCipherBackend backend;
    private final DisclosureChannel channel;
    private final Clock clock;
    private final ECKeyPair keyPair;
    private final AtomicLong requestIdSeq = new AtomicLong(1);

    public LocalDisclosureOracle(PlaintextCipherBackend backend,
                                 DisclosureChannel channel,
                                 OracleProperties oracleProps,
                                 Clock clock) {
        this.backend = backend;
        this.channel = channel;
        this.clock = clock;

        String privateKey = oracleProps.getSignerPrivateKey();
        if (privateKey == null || privateKey.isBlank()) {
            log.warn("LocalDisclosureOracle: oracle.signer-private-key is not configured. Replies cannot be signed.");
            this.keyPair = null;
        } else {
            this.keyPair = ECKeyPair.create(new BigInteger(Numeric.cleanHexPrefix(privateKey.trim()), 16));
        }
    }

    @Override
    public long nextRequestId() {
        return requestIdSeq.getAndIncrement();
    }

    @Override
    public void requestDisclosure(long requestId, List<CipherHandle> values) {
        channel.publishRequest(new DisclosureRequestMessage(requestId, values, clock.instant().getEpochSecond()));
        log.debug("Oracle request {} queued: {} value(s)", requestId, values.size());
    }

    public DisclosureReplyMessage answer(DisclosureRequestMessage request) {
        if (keyPair == null) {
            throw new IllegalStateException("Local oracle signer not configured");
        }
        List<BigInteger> plain = new ArrayList<>(request.values().size());
        List<CipherType> types = new ArrayList<>(request.values().size());
        for (CipherHandle handle : request.values()) {
            plain.add(backend.reveal(handle));
            types.add(handle.type());
        }
        byte[] cleartext = CleartextCodec.encode(plain, types);
        byte[] proof = OracleProofs.sign(request.requestId(), cleartext, keyPair);
        return new DisclosureReplyMessage(request.requestId(), cleartext, proof);
    }
}
