package dao.fhe.mystery.service;

import dao.fhe.mystery.event.DisclosureRequestedEvent;
import dao.fhe.mystery.exception.ProtocolError;
import dao.fhe.mystery.exception.ProtocolException;
import dao.fhe.mystery.model.CipherHandle;
import dao.fhe.mystery.model.DecryptionContext;
import dao.fhe.mystery.model.DisclosureKind;
import dao.fhe.mystery.oracle.DisclosureOracle;
import dao.fhe.mystery.oracle.ProofVerifier;
import dao.fhe.mystery.repository.DecryptionContextRepository;
import dao.fhe.mystery.state.ProtocolState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Issues hash-bound disclosure requests and settles their replies exactly once.
 * <p>
 * Between request and reply anything may happen to the batch. Two guards decide whether a
 * reply may still be trusted:
 * <ul>
 *   <li>the binding version must equal the current protocol version (epoch invalidation);</li>
 *   <li>the commitment over the freshly rebuilt handles must equal the one taken at request
 *       time (data drift).</li>
 * </ul>
 * Stale or drifted contexts are never deleted; they simply stay unsettled.
 */
@Slf4j
@Service
public class DisclosureCoordinator {

    private final ProtocolState state;
    private final DisclosureOracle oracle;
    private final ProofVerifier proofVerifier;
    private final CommitmentHasher hasher;
    private final DecryptionContextRepository contextRepository;
    private final ApplicationEventPublisher events;
    private final Clock clock;

    public DisclosureCoordinator(ProtocolState state,
                                 DisclosureOracle oracle,
                                 ProofVerifier proofVerifier,
                                 CommitmentHasher hasher,
                                 DecryptionContextRepository contextRepository,
                                 ApplicationEventPublisher events,
                                 Clock clock) {
        this.state = state;
        this.oracle = oracle;
        this.proofVerifier = proofVerifier;
        this.hasher = hasher;
        this.contextRepository = contextRepository;
        this.events = events;
        this.clock = clock;
    }

    public long requestDisclosure(DisclosureKind kind, long batchId, String requester, List<CipherHandle> values) {
        synchronized (state.mutex()) {
            String commitmentHash = hasher.commitment(values);
            long requestId = oracle.nextRequestId();
            if (contextRepository.findByRequestId(requestId).isPresent()) {
                throw new IllegalStateException("Oracle reused request id " + requestId);
            }

            DecryptionContext context = new DecryptionContext();
            context.setRequestId(requestId);
            context.setBatchId(batchId);
            context.setKind(kind);
            context.setRequester(requester);
            context.setBindingVersion(state.getCurrentVersion());
            context.setCommitmentHash(commitmentHash);
            context.setProcessed(false);
            context.setRequestedAt(clock.instant().getEpochSecond());

            oracle.requestDisclosure(requestId, values);
            contextRepository.save(context);

            log.info("Disclosure requested: requestId={}, batchId={}, kind={}, version={}, commitment={}",
                    requestId, batchId, kind, context.getBindingVersion(), commitmentHash);
            events.publishEvent(new DisclosureRequestedEvent(
                    requestId, batchId, commitmentHash, kind, requester, context.getRequestedAt()));
            return requestId;
        }
    }

    public <T> T settle(long requestId, byte[] cleartext, byte[] proof, SettlementPlan<T> plan) {
        synchronized (state.mutex()) {
            DecryptionContext context = contextRepository.findByRequestId(requestId)
                    .orElseThrow(() -> new ProtocolException(ProtocolError.UNKNOWN_REQUEST,
                            "Unknown disclosure request: " + requestId));

            if (context.isProcessed()) {
                throw new ProtocolException(ProtocolError.ALREADY_PROCESSED,
                        "Disclosure request " + requestId + " was already settled");
            }
            if (context.getBindingVersion() != state.getCurrentVersion()) {
                throw new ProtocolException(ProtocolError.STALE_VERSION,
                        "Disclosure request " + requestId + " bound to version " + context.getBindingVersion()
                                + ", current is " + state.getCurrentVersion());
            }

            String currentHash = hasher.commitment(plan.rebuild(context));
            if (!currentHash.equals(context.getCommitmentHash())) {
                throw new ProtocolException(ProtocolError.INVALID_STATE,
                        "Commitment mismatch for request " + requestId + ": batch " + context.getBatchId()
                                + " changed since the request was issued");
            }

            proofVerifier.verify(requestId, cleartext, proof);
            T result = plan.decode(context, cleartext);

            context.setProcessed(true);
            context.setSettledAt(clock.instant().getEpochSecond());
            log.info("Disclosure settled: requestId={}, batchId={}, kind={}, result={}",
                    requestId, context.getBatchId(), context.getKind(), result);
            events.publishEvent(result);
            return result;
        }
    }

    public Optional<DecryptionContext> find(long requestId) {
        return contextRepository.findByRequestId(requestId);
    }

    public List<DecryptionContext> findAll() {
        return contextRepository.findAll();
    }

    public long currentVersion() {
        return state.getCurrentVersion();
    }
}
