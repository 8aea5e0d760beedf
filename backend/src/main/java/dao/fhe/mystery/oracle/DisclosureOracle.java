package dao.fhe.mystery.oracle;

import dao.fhe.mystery.model.CipherHandle;

import java.util.List;

/**
 * Request side of the external decryption oracle. A request only registers the values and
 * returns its id; the cleartext arrives later as a {@link DisclosureReplyMessage}.
 * <p>
 * Ids are reserved with {@link #nextRequestId()} before anything is sent, so a caller can
 * reject an id without leaving an orphan request behind.
 */
public interface DisclosureOracle {

    long nextRequestId();

    void requestDisclosure(long requestId, List<CipherHandle> values);

    default long requestDisclosure(List<CipherHandle> values) {
        long requestId = nextRequestId();
        requestDisclosure(requestId, values);
        return requestId;
    }
}
