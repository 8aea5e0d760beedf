package dao.fhe.mystery.controller;

import dao.fhe.mystery.exception.ProtocolError;
import dao.fhe.mystery.exception.ProtocolException;
import dao.fhe.mystery.model.DecryptionContext;
import dao.fhe.mystery.model.DisclosureReplyRequest;
import dao.fhe.mystery.oracle.DisclosureChannel;
import dao.fhe.mystery.oracle.DisclosureReplyMessage;
import dao.fhe.mystery.service.DisclosureCoordinator;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.web3j.utils.Numeric;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/disclosures")
public class DisclosureController {

    private final DisclosureCoordinator coordinator;
    private final DisclosureChannel channel;

    public DisclosureController(DisclosureCoordinator coordinator, DisclosureChannel channel) {
        this.coordinator = coordinator;
        this.channel = channel;
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> getAllContexts() {
        long version = coordinator.currentVersion();
        List<Map<String, Object>> contexts = new ArrayList<>();
        for (DecryptionContext context : coordinator.findAll()) {
            contexts.add(buildContextInfo(context, version));
        }
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "SUCCESS");
        response.put("currentVersion", version);
        response.put("contexts", contexts);
        return ResponseEntity.ok(response);
    }

    @GetMapping("/{requestId}")
    public ResponseEntity<Map<String, Object>> getContext(@PathVariable long requestId) {
        DecryptionContext context = coordinator.find(requestId)
                .orElseThrow(() -> new ProtocolException(ProtocolError.UNKNOWN_REQUEST,
                        "Unknown disclosure request: " + requestId));
        return ResponseEntity.ok(buildContextInfo(context, coordinator.currentVersion()));
    }

    /**
     * Callback target for the external oracle. The reply is queued; settlement happens asynchronously.
     */
    @PostMapping("/{requestId}/reply")
    public ResponseEntity<Void> postReply(@PathVariable long requestId,
                                          @Valid @RequestBody DisclosureReplyRequest req) {
        channel.publishReply(new DisclosureReplyMessage(
                requestId,
                Numeric.hexStringToByteArray(req.getCleartext()),
                Numeric.hexStringToByteArray(req.getProof())));
        log.info("Oracle reply queued for request {}", requestId);
        return ResponseEntity.accepted().build();
    }

    private Map<String, Object> buildContextInfo(DecryptionContext context, long currentVersion) {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("requestId", context.getRequestId());
        info.put("batchId", context.getBatchId());
        info.put("kind", context.getKind().name());
        info.put("requester", context.getRequester());
        info.put("bindingVersion", context.getBindingVersion());
        info.put("commitmentHash", context.getCommitmentHash());
        info.put("status", context.status(currentVersion).name());
        info.put("requestedAt", context.getRequestedAt());
        info.put("settledAt", context.getSettledAt());
        return info;
    }
}
