package dao.fhe.mystery.service;

import dao.fhe.mystery.model.ActionCategory;
import dao.fhe.mystery.model.Batch;
import dao.fhe.mystery.model.CipherHandle;
import dao.fhe.mystery.model.Field;
import dao.fhe.mystery.model.Role;
import dao.fhe.mystery.model.SealedTriple;
import dao.fhe.mystery.state.ProtocolState;
import dao.fhe.mystery.util.Identities;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;

@Slf4j
@Service
public class ContributionWorkflow {

    private final AccessGuard accessGuard;
    private final BatchStore batchStore;
    private final AggregationEngine aggregationEngine;
    private final ProtocolState state;
    private final Clock clock;

    public ContributionWorkflow(AccessGuard accessGuard,
                                BatchStore batchStore,
                                AggregationEngine aggregationEngine,
                                ProtocolState state,
                                Clock clock) {
        this.accessGuard = accessGuard;
        this.batchStore = batchStore;
        this.aggregationEngine = aggregationEngine;
        this.state = state;
        this.clock = clock;
    }

    /**
     * Combines a provider's sealed values into the batch aggregates.
     * Every check (including computing the new aggregates) runs before the first write.
     */
    public void submitContribution(String caller, long batchId, SealedTriple contribution) {
        String identity = Identities.normalize(caller);
        long now = clock.instant().getEpochSecond();

        synchronized (state.mutex()) {
            accessGuard.authorize(identity, Role.PROVIDER);
            accessGuard.requireUnpaused();

            Batch batch = batchStore.get(batchId);
            batchStore.checkSubmission(batch, identity);
            accessGuard.checkCooldown(identity, ActionCategory.SUBMISSION, now);
            Map<Field, CipherHandle> next = aggregationEngine.preview(batch, contribution);

            accessGuard.checkAndUpdateCooldown(identity, ActionCategory.SUBMISSION, now);
            batchStore.recordSubmission(batchId, identity);
            aggregationEngine.commit(batchId, next);

            log.info("Contribution accepted: batchId={}, provider={}, submissions={}/{}",
                    batchId, identity, batch.getSubmissionCount(), batchStore.maxBatchSize());
        }
    }
}
