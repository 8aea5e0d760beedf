package dao.fhe.mystery.controller;

import dao.fhe.mystery.model.Batch;
import dao.fhe.mystery.model.Field;
import dao.fhe.mystery.model.SealedTripleRequest;
import dao.fhe.mystery.service.AccusationWorkflow;
import dao.fhe.mystery.service.BatchStore;
import dao.fhe.mystery.service.ContributionWorkflow;
import dao.fhe.mystery.service.SolutionWorkflow;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/batches")
public class BatchController {

    static final String CALLER_HEADER = "X-Caller";

    private final BatchStore batchStore;
    private final ContributionWorkflow contributionWorkflow;
    private final AccusationWorkflow accusationWorkflow;
    private final SolutionWorkflow solutionWorkflow;

    public BatchController(BatchStore batchStore,
                           ContributionWorkflow contributionWorkflow,
                           AccusationWorkflow accusationWorkflow,
                           SolutionWorkflow solutionWorkflow) {
        this.batchStore = batchStore;
        this.contributionWorkflow = contributionWorkflow;
        this.accusationWorkflow = accusationWorkflow;
        this.solutionWorkflow = solutionWorkflow;
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> openBatch(@RequestHeader(CALLER_HEADER) String caller) {
        long id = batchStore.openBatch(caller);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "SUCCESS");
        response.put("batchId", id);
        return ResponseEntity.ok(response);
    }

    @PostMapping("/{batchId}/close")
    public ResponseEntity<Map<String, Object>> closeBatch(@RequestHeader(CALLER_HEADER) String caller,
                                                          @PathVariable long batchId) {
        batchStore.closeBatch(caller, batchId);
        return ResponseEntity.ok(buildBatchInfo(batchStore.snapshot(batchId)));
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> getAllBatches() {
        List<Map<String, Object>> batches = new ArrayList<>();
        for (Batch batch : batchStore.snapshotAll()) {
            batches.add(buildBatchInfo(batch));
        }
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "SUCCESS");
        response.put("totalBatches", batches.size());
        response.put("batches", batches);
        return ResponseEntity.ok(response);
    }

    @GetMapping("/{batchId}")
    public ResponseEntity<Map<String, Object>> getBatch(@PathVariable long batchId) {
        return ResponseEntity.ok(buildBatchInfo(batchStore.snapshot(batchId)));
    }

    @PostMapping("/{batchId}/contributions")
    public ResponseEntity<Void> submitContribution(@RequestHeader(CALLER_HEADER) String caller,
                                                   @PathVariable long batchId,
                                                   @Valid @RequestBody SealedTripleRequest req) {
        contributionWorkflow.submitContribution(caller, batchId, req.toTriple());
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/{batchId}/accusations")
    public ResponseEntity<Map<String, Object>> submitAccusation(@RequestHeader(CALLER_HEADER) String caller,
                                                                @PathVariable long batchId,
                                                                @Valid @RequestBody SealedTripleRequest req) {
        long requestId = accusationWorkflow.submitAccusation(caller, batchId, req.toTriple());
        return ResponseEntity.accepted().body(Map.of("requestId", requestId, "batchId", batchId));
    }

    @PostMapping("/{batchId}/solution-requests")
    public ResponseEntity<Map<String, Object>> requestSolution(@RequestHeader(CALLER_HEADER) String caller,
                                                               @PathVariable long batchId) {
        long requestId = solutionWorkflow.requestSolution(caller, batchId);
        return ResponseEntity.accepted().body(Map.of("requestId", requestId, "batchId", batchId));
    }

    private Map<String, Object> buildBatchInfo(Batch batch) {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("batchId", batch.getId());
        info.put("open", batch.isOpen());
        info.put("submissionCount", batch.getSubmissionCount());
        info.put("maxBatchSize", batchStore.maxBatchSize());
        info.put("openedAt", batch.getOpenedAt());
        info.put("closedAt", batch.getClosedAt());

        Map<String, Object> aggregates = new LinkedHashMap<>();
        for (Field field : Field.values()) {
            aggregates.put(field.name().toLowerCase(), batch.getAggregates().containsKey(field)
                    ? batch.getAggregates().get(field).hex()
                    : null);
        }
        info.put("aggregates", aggregates);
        info.put("submittedAddresses", List.copyOf(batch.getSubmittedAddresses()));
        info.put("accusedAddresses", List.copyOf(batch.getAccusedAddresses()));
        info.put("requestedAddresses", List.copyOf(batch.getRequestedAddresses()));
        return info;
    }
}
