package dao.fhe.mystery.service;

import dao.fhe.mystery.config.ProtocolProperties;
import dao.fhe.mystery.config.ProtocolProperties.AccusationDedupMode;
import dao.fhe.mystery.exception.ProtocolError;
import dao.fhe.mystery.exception.ProtocolException;
import dao.fhe.mystery.model.Batch;
import dao.fhe.mystery.model.Role;
import dao.fhe.mystery.model.SealedTriple;
import dao.fhe.mystery.repository.BatchRepository;
import dao.fhe.mystery.state.ProtocolState;
import dao.fhe.mystery.util.Identities;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Batch lifecycle and membership bookkeeping. Batches are never deleted.
 * <p>
 * Each {@code record*} method has a non-mutating {@code check*} twin so that multi-step
 * operations can validate everything before the first write.
 */
@Slf4j
@Service
public class BatchStore {

    private final AccessGuard accessGuard;
    private final BatchRepository batchRepository;
    private final ProtocolState state;
    private final ProtocolProperties props;
    private final Clock clock;

    public BatchStore(AccessGuard accessGuard,
                      BatchRepository batchRepository,
                      ProtocolState state,
                      ProtocolProperties props,
                      Clock clock) {
        this.accessGuard = accessGuard;
        this.batchRepository = batchRepository;
        this.state = state;
        this.props = props;
        this.clock = clock;
    }

    public long openBatch(String caller) {
        synchronized (state.mutex()) {
            accessGuard.authorize(Identities.normalize(caller), Role.OWNER);

            Batch batch = new Batch();
            batch.setId(state.allocateBatchId());
            batch.setOpen(true);
            batch.setOpenedAt(clock.instant().getEpochSecond());
            batchRepository.save(batch);

            log.info("Batch {} opened", batch.getId());
            return batch.getId();
        }
    }

    public void closeBatch(String caller, long id) {
        synchronized (state.mutex()) {
            accessGuard.authorize(Identities.normalize(caller), Role.OWNER);
            Batch batch = get(id);
            if (!batch.isOpen()) {
                throw new ProtocolException(ProtocolError.BATCH_CLOSED, "Batch " + id + " is already closed");
            }
            batch.setOpen(false);
            batch.setClosedAt(clock.instant().getEpochSecond());
            log.info("Batch {} closed: submissions={}", id, batch.getSubmissionCount());
        }
    }

    /**
     * The live batch. Only for callers already holding the protocol mutex; readers outside it
     * use {@link #snapshot(long)}.
     */
    public Batch get(long id) {
        return batchRepository.findById(id)
                .orElseThrow(() -> new ProtocolException(ProtocolError.INVALID_BATCH, "Batch not found: " + id));
    }

    public Batch snapshot(long id) {
        synchronized (state.mutex()) {
            return get(id).copy();
        }
    }

    public List<Batch> snapshotAll() {
        synchronized (state.mutex()) {
            List<Batch> out = new ArrayList<>();
            for (Batch batch : batchRepository.findAll()) {
                out.add(batch.copy());
            }
            return out;
        }
    }

    public int maxBatchSize() {
        return props.getMaxBatchSize();
    }

    public void checkSubmission(Batch batch, String identity) {
        if (!batch.isOpen()) {
            throw new ProtocolException(ProtocolError.BATCH_CLOSED, "Batch " + batch.getId() + " is closed");
        }
        if (batch.getSubmissionCount() >= props.getMaxBatchSize()) {
            throw new ProtocolException(ProtocolError.BATCH_FULL,
                    "Batch " + batch.getId() + " is full (" + props.getMaxBatchSize() + ")");
        }
        // an address that already accused may not contribute afterwards, whatever the dedup mode
        if (batch.getSubmittedAddresses().contains(identity) || batch.getAccusedAddresses().contains(identity)) {
            throw new ProtocolException(ProtocolError.INVALID_STATE,
                    identity + " already submitted to batch " + batch.getId());
        }
    }

    public void recordSubmission(long id, String identity) {
        synchronized (state.mutex()) {
            Batch batch = get(id);
            checkSubmission(batch, identity);
            batch.setSubmissionCount(batch.getSubmissionCount() + 1);
            batch.getSubmittedAddresses().add(identity);
        }
    }

    public void checkDisclosureRequest(Batch batch, String identity) {
        if (batch.getSubmissionCount() == 0) {
            throw new ProtocolException(ProtocolError.INVALID_BATCH, "Batch " + batch.getId() + " has no submissions");
        }
        if (batch.getRequestedAddresses().contains(identity)) {
            throw new ProtocolException(ProtocolError.INVALID_STATE,
                    identity + " already requested disclosure of batch " + batch.getId());
        }
    }

    public void recordDisclosureRequest(long id, String identity) {
        synchronized (state.mutex()) {
            Batch batch = get(id);
            checkDisclosureRequest(batch, identity);
            batch.getRequestedAddresses().add(identity);
        }
    }

    public void checkAccusation(Batch batch, String identity) {
        if (!batch.isOpen()) {
            throw new ProtocolException(ProtocolError.BATCH_CLOSED, "Batch " + batch.getId() + " is closed");
        }
        boolean seen = props.getAccusationDedup() == AccusationDedupMode.SHARED
                ? batch.getSubmittedAddresses().contains(identity)
                : batch.getAccusedAddresses().contains(identity);
        if (seen) {
            throw new ProtocolException(ProtocolError.INVALID_STATE,
                    identity + " already submitted to batch " + batch.getId());
        }
    }

    public void recordAccusation(long id, String identity, SealedTriple guess) {
        synchronized (state.mutex()) {
            Batch batch = get(id);
            checkAccusation(batch, identity);
            if (props.getAccusationDedup() == AccusationDedupMode.SHARED) {
                batch.getSubmittedAddresses().add(identity);
            }
            batch.getAccusedAddresses().add(identity);
            batch.getGuesses().put(identity, guess);
        }
    }
}
