package dao.fhe.mystery.service;

import dao.fhe.mystery.cipher.PlaintextCipherBackend;
import dao.fhe.mystery.config.OracleProperties;
import dao.fhe.mystery.config.ProtocolProperties;
import dao.fhe.mystery.event.AccusationSettledEvent;
import dao.fhe.mystery.event.DisclosureRequestedEvent;
import dao.fhe.mystery.event.ProtocolVersionBumpedEvent;
import dao.fhe.mystery.event.SolutionSettledEvent;
import dao.fhe.mystery.model.SealedTriple;
import dao.fhe.mystery.oracle.DisclosureChannel;
import dao.fhe.mystery.oracle.DisclosureReplyMessage;
import dao.fhe.mystery.oracle.DisclosureRequestMessage;
import dao.fhe.mystery.oracle.LocalDisclosureOracle;
import dao.fhe.mystery.oracle.OracleSignatureVerifier;
import dao.fhe.mystery.repository.InMemoryBatchRepository;
import dao.fhe.mystery.repository.InMemoryDecryptionContextRepository;
import dao.fhe.mystery.state.ProtocolState;
import org.web3j.crypto.ECKeyPair;
import org.web3j.crypto.Keys;

import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;

/**
 * Wires the protocol by hand, the way the Spring context would, around a controllable clock,
 * the plaintext backend and a locally keyed oracle.
 */
public final class ProtocolFixture {

    public static final String OWNER = "0x00000000000000000000000000000000000000aa";
    public static final String A = "0x000000000000000000000000000000000000000a";
    public static final String B = "0x000000000000000000000000000000000000000b";
    public static final String C = "0x000000000000000000000000000000000000000c";
    public static final String D = "0x000000000000000000000000000000000000000d";

    public static final String ORACLE_KEY = "ac0974bec39a17e36ba4a6b4d238ff944bacb478cbed5efcae784d7bf4f2ff80";

    public final MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
    public final ProtocolProperties props = new ProtocolProperties();
    public final OracleProperties oracleProps = new OracleProperties();
    public final List<Object> events = Collections.synchronizedList(new ArrayList<>());

    public final ProtocolState state;
    public final AccessGuard guard;
    public final BatchStore batchStore;
    public final PlaintextCipherBackend backend;
    public final AggregationEngine engine;
    public final DisclosureChannel channel;
    public final LocalDisclosureOracle oracle;
    public final OracleSignatureVerifier verifier;
    public final CommitmentHasher hasher;
    public final InMemoryDecryptionContextRepository contexts;
    public final OutcomeLedger ledger;
    public final DisclosureCoordinator coordinator;
    public final ContributionWorkflow contributions;
    public final AccusationWorkflow accusations;
    public final SolutionWorkflow solutions;
    public final AdminService admin;
    public final SettlementDispatcher dispatcher;

    public ProtocolFixture() {
        this(p -> {});
    }

    public ProtocolFixture(Consumer<ProtocolProperties> customizer) {
        props.setOwner(OWNER);
        props.setProviders(new ArrayList<>(List.of(A + "," + B, C)));
        props.setMaxBatchSize(3);
        props.setIdentity("sealed-mystery/test");
        customizer.accept(props);

        oracleProps.setSignerPrivateKey(ORACLE_KEY);
        oracleProps.setSignerAddress("0x" + Keys.getAddress(ECKeyPair.create(new BigInteger(ORACLE_KEY, 16))));

        state = new ProtocolState(props);
        guard = new AccessGuard(state);
        batchStore = new BatchStore(guard, new InMemoryBatchRepository(), state, props, clock);
        backend = new PlaintextCipherBackend();
        engine = new AggregationEngine(backend, batchStore, state);
        channel = new DisclosureChannel();
        oracle = new LocalDisclosureOracle(backend, channel, oracleProps, clock);
        verifier = new OracleSignatureVerifier(oracleProps);
        hasher = new CommitmentHasher(props);
        contexts = new InMemoryDecryptionContextRepository();
        ledger = new OutcomeLedger();
        coordinator = new DisclosureCoordinator(state, oracle, verifier, hasher, contexts, this::publish, clock);
        contributions = new ContributionWorkflow(guard, batchStore, engine, state, clock);
        accusations = new AccusationWorkflow(guard, batchStore, engine, coordinator, backend, state, clock);
        solutions = new SolutionWorkflow(guard, batchStore, engine, coordinator, state, clock);
        admin = new AdminService(guard, state, this::publish);
        dispatcher = new SettlementDispatcher(coordinator, accusations, solutions);
    }

    private void publish(Object event) {
        events.add(event);
        if (event instanceof DisclosureRequestedEvent requested) {
            ledger.onRequested(requested);
        } else if (event instanceof AccusationSettledEvent settled) {
            ledger.onAccusationSettled(settled);
        } else if (event instanceof SolutionSettledEvent settled) {
            ledger.onSolutionSettled(settled);
        } else if (event instanceof ProtocolVersionBumpedEvent bumped) {
            ledger.onVersionBumped(bumped);
        }
    }

    public SealedTriple seal(long weapon, long room, long suspect) {
        return new SealedTriple(backend.seal(weapon), backend.seal(room), backend.seal(suspect));
    }

    /**
     * Lets the local oracle answer the oldest queued request.
     */
    public DisclosureReplyMessage answerNext() {
        List<DisclosureRequestMessage> next = channel.drainRequests(1);
        if (next.isEmpty()) {
            throw new IllegalStateException("No queued oracle request");
        }
        return oracle.answer(next.get(0));
    }

    public <T> List<T> eventsOf(Class<T> type) {
        List<T> out = new ArrayList<>();
        for (Object e : events) {
            if (type.isInstance(e)) out.add(type.cast(e));
        }
        return out;
    }
}
