package dao.fhe.mystery.repository;

import dao.fhe.mystery.model.DecryptionContext;

import java.util.List;
import java.util.Optional;

/**
 * Contexts are append-only: there is no delete, stale contexts stay for audit.
 */
public interface DecryptionContextRepository {

    void save(DecryptionContext context);

    List<DecryptionContext> findAll();

    Optional<DecryptionContext> findByRequestId(long requestId);
}
