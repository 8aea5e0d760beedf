package dao.fhe.mystery.model;

import lombok.Data;

@Data
public class DecryptionContext {

    private long requestId;
    private long batchId;
    private DisclosureKind kind;
    private String requester;
    /** Protocol version at request time. */
    private long bindingVersion;
    /** Keccak-256 over the disclosed handles and the protocol identity (0x hex). */
    private String commitmentHash;
    private boolean processed;
    private long requestedAt; // unix seconds
    private long settledAt;   // unix seconds, 0 until processed

    public ContextStatus status(long currentVersion) {
        if (processed) return ContextStatus.SETTLED;
        return bindingVersion == currentVersion ? ContextStatus.PENDING : ContextStatus.STALE;
    }
}
