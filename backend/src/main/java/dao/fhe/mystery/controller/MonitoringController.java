package dao.fhe.mystery.controller;

import dao.fhe.mystery.config.SchedulerProperties;
import dao.fhe.mystery.event.SolutionSettledEvent;
import dao.fhe.mystery.model.Batch;
import dao.fhe.mystery.model.ContextStatus;
import dao.fhe.mystery.model.DecryptionContext;
import dao.fhe.mystery.oracle.DisclosureChannel;
import dao.fhe.mystery.service.BatchStore;
import dao.fhe.mystery.service.DisclosureCoordinator;
import dao.fhe.mystery.service.OutcomeLedger;
import dao.fhe.mystery.state.ProtocolState;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only view over batches, disclosure contexts and settled outcomes.
 */
@RestController
@RequestMapping("/api/monitor")
public class MonitoringController {

    private final BatchStore batchStore;
    private final DisclosureCoordinator coordinator;
    private final DisclosureChannel channel;
    private final OutcomeLedger outcomeLedger;
    private final ProtocolState state;
    private final SchedulerProperties schedulerProps;

    public MonitoringController(BatchStore batchStore,
                                DisclosureCoordinator coordinator,
                                DisclosureChannel channel,
                                OutcomeLedger outcomeLedger,
                                ProtocolState state,
                                SchedulerProperties schedulerProps) {
        this.batchStore = batchStore;
        this.coordinator = coordinator;
        this.channel = channel;
        this.outcomeLedger = outcomeLedger;
        this.state = state;
        this.schedulerProps = schedulerProps;
    }

    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> getStats() {
        List<Batch> batches = batchStore.snapshotAll();
        List<DecryptionContext> contexts = coordinator.findAll();
        long version = state.getCurrentVersion();

        Map<String, Object> contextCounts = new LinkedHashMap<>();
        for (ContextStatus status : ContextStatus.values()) {
            contextCounts.put(status.name().toLowerCase(),
                    contexts.stream().filter(c -> c.status(version) == status).count());
        }

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "SUCCESS");
        response.put("protocol", Map.of(
                "currentVersion", version,
                "paused", state.isPaused(),
                "cooldownSeconds", state.getCooldownSeconds(),
                "providers", state.getProviders().size()
        ));
        response.put("schedulers", Map.of(
                "relay", Map.of("enabled", schedulerProps.getRelay().isEnabled()),
                "settlement", Map.of("enabled", schedulerProps.getSettlement().isEnabled())
        ));
        response.put("statistics", Map.of(
                "totalBatches", batches.size(),
                "openBatches", batches.stream().filter(Batch::isOpen).count(),
                "totalSubmissions", batches.stream().mapToInt(Batch::getSubmissionCount).sum(),
                "contexts", contextCounts,
                "queuedRequests", channel.pendingRequests(),
                "queuedReplies", channel.pendingReplies()
        ));
        response.put("accusations", Map.of(
                "correct", outcomeLedger.correctCount(),
                "incorrect", outcomeLedger.incorrectCount(),
                "pending", outcomeLedger.pendingCount(),
                "stale", outcomeLedger.staleCount()
        ));
        return ResponseEntity.ok(response);
    }

    @GetMapping("/accusations")
    public ResponseEntity<Map<String, Object>> getAccusations() {
        List<OutcomeLedger.AccusationEntry> entries = outcomeLedger.accusations();
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "SUCCESS");
        response.put("totalAccusations", entries.size());
        response.put("accusations", entries);
        return ResponseEntity.ok(response);
    }

    @GetMapping("/solutions/{batchId}")
    public ResponseEntity<Map<String, Object>> getSolution(@PathVariable long batchId) {
        Map<String, Object> response = new LinkedHashMap<>();
        SolutionSettledEvent solution = outcomeLedger.solution(batchId).orElse(null);
        if (solution == null) {
            response.put("status", "NOT_FOUND");
            response.put("error", "No disclosed solution for batch " + batchId);
            return ResponseEntity.status(404).body(response);
        }
        response.put("status", "SUCCESS");
        response.put("batchId", batchId);
        response.put("requestId", solution.requestId());
        response.put("weapon", solution.weapon());
        response.put("room", solution.room());
        response.put("suspect", solution.suspect());
        return ResponseEntity.ok(response);
    }
}
