package dao.fhe.mystery.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "protocol")
@Data
public class ProtocolProperties {

    /**
     * Owner identity (hex address). Only the owner may open/close batches and use the admin surface.
     * Example: 0xf39fd6e51aad88f6f4ce6ab8827279cfffb92266
     */
    private String owner;

    /**
     * Initial provider identities allowed to submit contributions.
     * Accepts a real list or a single comma-separated string (e.g. from env).
     */
    private List<String> providers = new ArrayList<>();

    /**
     * Maximum number of contributions per batch.
     */
    private int maxBatchSize = 10;

    /**
     * Cooldown between two actions of the same category by the same identity, in seconds.
     * Shared by the submission and request categories.
     */
    private long cooldownSeconds = 0;

    /**
     * Domain tag hashed into every disclosure commitment.
     */
    private String identity = "sealed-mystery";

    /**
     * How accusations are deduplicated against contributions of the same batch.
     */
    private AccusationDedupMode accusationDedup = AccusationDedupMode.SEPARATE;

    public enum AccusationDedupMode {
        /** Accusations check and join the contributors set; contributing and accusing are exclusive. */
        SHARED,
        /** Accusations have their own set; a contributor may still accuse once. */
        SEPARATE
    }
}
