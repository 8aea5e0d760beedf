package dao.fhe.mystery.oracle;

/**
 * Oracle answer to a {@link DisclosureRequestMessage}.
 *
 * @param cleartext ABI-encoded words, one per disclosed value
 * @param proof     65-byte signature (r || s || v)
 */
public record DisclosureReplyMessage(
        long requestId,
        byte[] cleartext,
        byte[] proof
) {}
