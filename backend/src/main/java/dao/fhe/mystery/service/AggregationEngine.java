package dao.fhe.mystery.service;

import dao.fhe.mystery.cipher.CipherBackend;
import dao.fhe.mystery.exception.ProtocolError;
import dao.fhe.mystery.exception.ProtocolException;
import dao.fhe.mystery.model.Batch;
import dao.fhe.mystery.model.CipherHandle;
import dao.fhe.mystery.model.Field;
import dao.fhe.mystery.model.SealedTriple;
import dao.fhe.mystery.state.ProtocolState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Running per-batch opaque sums. An uninitialized field starts from the backend's additive
 * identity, so the first contribution simply becomes the seed of the sum.
 */
@Slf4j
@Service
public class AggregationEngine {

    private final CipherBackend backend;
    private final BatchStore batchStore;
    private final ProtocolState state;

    public AggregationEngine(CipherBackend backend, BatchStore batchStore, ProtocolState state) {
        this.backend = backend;
        this.batchStore = batchStore;
        this.state = state;
    }

    public void combineIfNeeded(long batchId, Field field, CipherHandle contribution) {
        synchronized (state.mutex()) {
            Batch batch = batchStore.get(batchId);
            requireOpen(batch);
            batch.getAggregates().put(field, combined(batch, field, contribution));
        }
    }

    /**
     * Computes the post-combination aggregate of every field without storing anything.
     */
    public Map<Field, CipherHandle> preview(Batch batch, SealedTriple contribution) {
        Map<Field, CipherHandle> next = new EnumMap<>(Field.class);
        for (Field field : Field.values()) {
            next.put(field, combined(batch, field, contribution.get(field)));
        }
        return next;
    }

    public void commit(long batchId, Map<Field, CipherHandle> aggregates) {
        synchronized (state.mutex()) {
            Batch batch = batchStore.get(batchId);
            requireOpen(batch);
            batch.getAggregates().putAll(aggregates);
            log.debug("Batch {} aggregates updated: {}", batchId, aggregates);
        }
    }

    /**
     * Stored aggregate, or the additive identity for an uninitialized field. Never writes.
     */
    public CipherHandle currentAggregate(Batch batch, Field field) {
        CipherHandle current = batch.getAggregates().get(field);
        return current != null ? current : backend.additiveIdentity();
    }

    /**
     * All aggregates in disclosure order (weapon, room, suspect).
     */
    public List<CipherHandle> aggregates(Batch batch) {
        List<CipherHandle> out = new ArrayList<>(Field.values().length);
        for (Field field : Field.values()) {
            out.add(currentAggregate(batch, field));
        }
        return out;
    }

    private CipherHandle combined(Batch batch, Field field, CipherHandle contribution) {
        return backend.combine(currentAggregate(batch, field), contribution);
    }

    private static void requireOpen(Batch batch) {
        if (!batch.isOpen()) {
            throw new ProtocolException(ProtocolError.BATCH_CLOSED, "Batch " + batch.getId() + " is closed");
        }
    }
}
