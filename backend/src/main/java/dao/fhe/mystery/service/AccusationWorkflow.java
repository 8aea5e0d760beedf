package dao.fhe.mystery.service;

import dao.fhe.mystery.cipher.CipherBackend;
import dao.fhe.mystery.event.AccusationSettledEvent;
import dao.fhe.mystery.exception.ProtocolError;
import dao.fhe.mystery.exception.ProtocolException;
import dao.fhe.mystery.model.ActionCategory;
import dao.fhe.mystery.model.Batch;
import dao.fhe.mystery.model.CipherHandle;
import dao.fhe.mystery.model.DecryptionContext;
import dao.fhe.mystery.model.DisclosureKind;
import dao.fhe.mystery.model.Field;
import dao.fhe.mystery.model.SealedTriple;
import dao.fhe.mystery.oracle.CleartextCodec;
import dao.fhe.mystery.state.ProtocolState;
import dao.fhe.mystery.util.Identities;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * "Does my sealed guess equal the batch aggregate?" The comparison runs on opaque values;
 * only the single AND-ed boolean is ever disclosed.
 */
@Slf4j
@Service
public class AccusationWorkflow {

    private final AccessGuard accessGuard;
    private final BatchStore batchStore;
    private final AggregationEngine aggregationEngine;
    private final DisclosureCoordinator coordinator;
    private final CipherBackend backend;
    private final ProtocolState state;
    private final Clock clock;

    private final SettlementPlan<AccusationSettledEvent> plan = new SettlementPlan<>() {
        @Override
        public List<CipherHandle> rebuild(DecryptionContext context) {
            requireKind(context);
            Batch batch = batchStore.get(context.getBatchId());
            SealedTriple guess = batch.getGuesses().get(context.getRequester());
            if (guess == null) {
                throw new ProtocolException(ProtocolError.INVALID_STATE,
                        "No stored guess for " + context.getRequester() + " in batch " + context.getBatchId());
            }
            return List.of(verdict(batch, guess));
        }

        @Override
        public AccusationSettledEvent decode(DecryptionContext context, byte[] cleartext) {
            return new AccusationSettledEvent(
                    context.getRequestId(),
                    context.getBatchId(),
                    context.getRequester(),
                    CleartextCodec.decodeBool(cleartext));
        }
    };

    public AccusationWorkflow(AccessGuard accessGuard,
                              BatchStore batchStore,
                              AggregationEngine aggregationEngine,
                              DisclosureCoordinator coordinator,
                              CipherBackend backend,
                              ProtocolState state,
                              Clock clock) {
        this.accessGuard = accessGuard;
        this.batchStore = batchStore;
        this.aggregationEngine = aggregationEngine;
        this.coordinator = coordinator;
        this.backend = backend;
        this.state = state;
        this.clock = clock;
    }

    public long submitAccusation(String caller, long batchId, SealedTriple guess) {
        String player = Identities.normalize(caller);
        long now = clock.instant().getEpochSecond();

        synchronized (state.mutex()) {
            accessGuard.requireUnpaused();
            Batch batch = batchStore.get(batchId);
            batchStore.checkAccusation(batch, player);
            accessGuard.checkCooldown(player, ActionCategory.SUBMISSION, now);
            CipherHandle verdict = verdict(batch, guess);

            long requestId = coordinator.requestDisclosure(DisclosureKind.ACCUSATION, batchId, player, List.of(verdict));
            accessGuard.checkAndUpdateCooldown(player, ActionCategory.SUBMISSION, now);
            batchStore.recordAccusation(batchId, player, guess);

            log.info("Accusation submitted: batchId={}, player={}, requestId={}", batchId, player, requestId);
            return requestId;
        }
    }

    public AccusationSettledEvent settle(long requestId, byte[] cleartext, byte[] proof) {
        return coordinator.settle(requestId, cleartext, proof, plan);
    }

    /**
     * AND over the three field-wise equalities between the current aggregate and the guess.
     */
    private CipherHandle verdict(Batch batch, SealedTriple guess) {
        CipherHandle verdict = backend.constantBool(true);
        for (Field field : Field.values()) {
            CipherHandle eq = backend.compareEqual(aggregationEngine.currentAggregate(batch, field), guess.get(field));
            verdict = backend.logicalAnd(verdict, eq);
        }
        return verdict;
    }

    private static void requireKind(DecryptionContext context) {
        if (context.getKind() != DisclosureKind.ACCUSATION) {
            throw new ProtocolException(ProtocolError.INVALID_STATE,
                    "Request " + context.getRequestId() + " is a " + context.getKind() + " disclosure");
        }
    }
}
