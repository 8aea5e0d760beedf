package dao.fhe.mystery.service;

import dao.fhe.mystery.controller.BatchController;
import dao.fhe.mystery.exception.ProtocolError;
import dao.fhe.mystery.exception.ProtocolException;
import dao.fhe.mystery.model.Batch;
import dao.fhe.mystery.model.Field;
import dao.fhe.mystery.model.SealedTriple;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static dao.fhe.mystery.service.ProtocolFixture.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Contributions racing each other and readers racing contributions.
 */
class ConcurrentSubmissionTest {

    private static String provider(int i) {
        return String.format("0x%040x", 0x1000 + i);
    }

    @Test
    @DisplayName("More concurrent providers than the batch holds: exactly max-batch-size are accepted")
    void concurrentSubmissionsRespectBatchSize() throws Exception {
        ProtocolFixture fx = new ProtocolFixture();
        long batchId = fx.batchStore.openBatch(OWNER);
        int providers = 16;
        List<SealedTriple> triples = new ArrayList<>();
        for (int i = 0; i < providers; i++) {
            fx.admin.addProvider(OWNER, provider(i));
            triples.add(fx.seal(1, 2, 3));
        }

        ExecutorService pool = Executors.newFixedThreadPool(providers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<ProtocolError>> results = new ArrayList<>();
        try {
            for (int i = 0; i < providers; i++) {
                final int n = i;
                results.add(pool.submit(() -> {
                    start.await();
                    try {
                        fx.contributions.submitContribution(provider(n), batchId, triples.get(n));
                        return null;
                    } catch (ProtocolException e) {
                        return e.getError();
                    }
                }));
            }
            start.countDown();

            int accepted = 0;
            for (Future<ProtocolError> result : results) {
                ProtocolError error = result.get(10, TimeUnit.SECONDS);
                if (error == null) {
                    accepted++;
                } else {
                    assertEquals(ProtocolError.BATCH_FULL, error);
                }
            }
            assertEquals(3, accepted);
        } finally {
            pool.shutdownNow();
        }

        Batch batch = fx.batchStore.snapshot(batchId);
        assertEquals(3, batch.getSubmissionCount());
        assertEquals(batch.getSubmissionCount(), batch.getSubmittedAddresses().size());
        assertEquals(BigInteger.valueOf(3), fx.backend.reveal(batch.getAggregates().get(Field.WEAPON)));
        assertEquals(BigInteger.valueOf(6), fx.backend.reveal(batch.getAggregates().get(Field.ROOM)));
        assertEquals(BigInteger.valueOf(9), fx.backend.reveal(batch.getAggregates().get(Field.SUSPECT)));
    }

    @Test
    @DisplayName("Batch views read while contributions land are always consistent")
    void readsDuringSubmissionsSeeWholeStates() throws Exception {
        int total = 2_000;
        ProtocolFixture fx = new ProtocolFixture(p -> p.setMaxBatchSize(total));
        long batchId = fx.batchStore.openBatch(OWNER);
        List<SealedTriple> triples = new ArrayList<>();
        for (int i = 0; i < total; i++) {
            fx.admin.addProvider(OWNER, provider(i));
            triples.add(fx.seal(1, 1, 1));
        }
        BatchController controller = new BatchController(fx.batchStore, fx.contributions, fx.accusations, fx.solutions);

        AtomicBoolean done = new AtomicBoolean();
        Thread writer = new Thread(() -> {
            try {
                for (int i = 0; i < total; i++) {
                    fx.contributions.submitContribution(provider(i), batchId, triples.get(i));
                }
            } finally {
                done.set(true);
            }
        });
        writer.start();

        int reads = 0;
        while (!done.get() || reads == 0) {
            ResponseEntity<Map<String, Object>> response = controller.getBatch(batchId);
            Map<String, Object> body = response.getBody();
            assertNotNull(body);
            int count = (Integer) body.get("submissionCount");
            assertEquals(count, ((List<?>) body.get("submittedAddresses")).size());

            Batch snapshot = fx.batchStore.snapshot(batchId);
            assertEquals(snapshot.getSubmissionCount(), snapshot.getSubmittedAddresses().size());
            reads++;
        }
        writer.join(TimeUnit.SECONDS.toMillis(30));

        assertEquals(total, fx.batchStore.snapshot(batchId).getSubmissionCount());
        assertEquals(1, fx.batchStore.snapshotAll().size());
    }
}
