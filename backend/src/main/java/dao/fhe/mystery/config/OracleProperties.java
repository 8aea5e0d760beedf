package dao.fhe.mystery.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "oracle")
@Data
public class OracleProperties {

    /**
     * Address whose signatures are accepted as disclosure proofs (hex, 0x prefix optional).
     */
    private String signerAddress;

    /**
     * Private key used by the local oracle to sign replies (hex, 64 characters).
     * Only read when the plaintext cipher backend is active.
     */
    private String signerPrivateKey;
}
