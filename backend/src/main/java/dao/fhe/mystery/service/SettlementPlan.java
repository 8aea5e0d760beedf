package dao.fhe.mystery.service;

import dao.fhe.mystery.model.CipherHandle;
import dao.fhe.mystery.model.DecryptionContext;

import java.util.List;

/**
 * What a workflow contributes to settling one of its disclosure requests.
 *
 * @param <T> decoded result, published as the settlement event
 */
public interface SettlementPlan<T> {

    /**
     * Recomputes the handles the request disclosed, from live batch state.
     */
    List<CipherHandle> rebuild(DecryptionContext context);

    T decode(DecryptionContext context, byte[] cleartext);
}
