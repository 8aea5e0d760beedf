package dao.fhe.mystery.service;

import dao.fhe.mystery.event.SolutionSettledEvent;
import dao.fhe.mystery.exception.ProtocolError;
import dao.fhe.mystery.exception.ProtocolException;
import dao.fhe.mystery.model.ActionCategory;
import dao.fhe.mystery.model.Batch;
import dao.fhe.mystery.model.CipherHandle;
import dao.fhe.mystery.model.DecryptionContext;
import dao.fhe.mystery.model.DisclosureKind;
import dao.fhe.mystery.model.Field;
import dao.fhe.mystery.oracle.CleartextCodec;
import dao.fhe.mystery.state.ProtocolState;
import dao.fhe.mystery.util.Identities;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;
import java.util.List;

@Slf4j
@Service
public class SolutionWorkflow {

    private final AccessGuard accessGuard;
    private final BatchStore batchStore;
    private final AggregationEngine aggregationEngine;
    private final DisclosureCoordinator coordinator;
    private final ProtocolState state;
    private final Clock clock;

    private final SettlementPlan<SolutionSettledEvent> plan = new SettlementPlan<>() {
        @Override
        public List<CipherHandle> rebuild(DecryptionContext context) {
            if (context.getKind() != DisclosureKind.SOLUTION) {
                throw new ProtocolException(ProtocolError.INVALID_STATE,
                        "Request " + context.getRequestId() + " is a " + context.getKind() + " disclosure");
            }
            return aggregationEngine.aggregates(batchStore.get(context.getBatchId()));
        }

        @Override
        public SolutionSettledEvent decode(DecryptionContext context, byte[] cleartext) {
            List<BigInteger> values = CleartextCodec.decodeUints(cleartext, Field.values().length);
            return new SolutionSettledEvent(
                    context.getRequestId(),
                    context.getBatchId(),
                    values.get(Field.WEAPON.ordinal()),
                    values.get(Field.ROOM.ordinal()),
                    values.get(Field.SUSPECT.ordinal()));
        }
    };

    public SolutionWorkflow(AccessGuard accessGuard,
                            BatchStore batchStore,
                            AggregationEngine aggregationEngine,
                            DisclosureCoordinator coordinator,
                            ProtocolState state,
                            Clock clock) {
        this.accessGuard = accessGuard;
        this.batchStore = batchStore;
        this.aggregationEngine = aggregationEngine;
        this.coordinator = coordinator;
        this.state = state;
        this.clock = clock;
    }

    /**
     * Requests disclosure of the batch's raw aggregates. Allowed on open and closed batches.
     */
    public long requestSolution(String caller, long batchId) {
        String requester = Identities.normalize(caller);
        long now = clock.instant().getEpochSecond();

        synchronized (state.mutex()) {
            accessGuard.requireUnpaused();
            Batch batch = batchStore.get(batchId);
            batchStore.checkDisclosureRequest(batch, requester);
            accessGuard.checkCooldown(requester, ActionCategory.REQUEST, now);

            long requestId = coordinator.requestDisclosure(
                    DisclosureKind.SOLUTION, batchId, requester, aggregationEngine.aggregates(batch));
            accessGuard.checkAndUpdateCooldown(requester, ActionCategory.REQUEST, now);
            batchStore.recordDisclosureRequest(batchId, requester);

            log.info("Solution requested: batchId={}, requester={}, requestId={}", batchId, requester, requestId);
            return requestId;
        }
    }

    public SolutionSettledEvent settle(long requestId, byte[] cleartext, byte[] proof) {
        return coordinator.settle(requestId, cleartext, proof, plan);
    }
}
