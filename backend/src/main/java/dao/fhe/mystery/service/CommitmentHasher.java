package dao.fhe.mystery.service;

import dao.fhe.mystery.config.ProtocolProperties;
import dao.fhe.mystery.model.CipherHandle;
import dao.fhe.mystery.util.CryptoUtil;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.List;

@Service
public class CommitmentHasher {

    private final byte[] domainTag;

    public CommitmentHasher(ProtocolProperties props) {
        this.domainTag = CryptoUtil.keccak256(props.getIdentity().getBytes(StandardCharsets.UTF_8));
    }

    /**
     * commitment = keccak256(handle_0 || handle_1 || ... || keccak256(identity)).
     * Order matters: the same handles in another order give another commitment.
     */
    public String commitment(List<CipherHandle> handles) {
        if (handles == null || handles.isEmpty()) {
            throw new IllegalArgumentException("No handles to commit to");
        }
        byte[] packed = new byte[0];
        for (CipherHandle h : handles) {
            packed = CryptoUtil.concat(packed, h.bytes());
        }
        packed = CryptoUtil.concat(packed, domainTag);
        return CryptoUtil.toHex0x(CryptoUtil.keccak256(packed));
    }
}
