package dao.fhe.mystery.service;

import dao.fhe.mystery.event.AccusationSettledEvent;
import dao.fhe.mystery.event.DisclosureRequestedEvent;
import dao.fhe.mystery.event.ProtocolVersionBumpedEvent;
import dao.fhe.mystery.event.SolutionSettledEvent;
import dao.fhe.mystery.model.DisclosureKind;
import lombok.Data;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Public record of accusations (pending until their disclosure settles) and of disclosed solutions.
 */
@Component
public class OutcomeLedger {

    // key: request id
    private final Map<Long, AccusationEntry> accusations = new ConcurrentHashMap<>();

    // key: batch id -> latest disclosed solution
    private final Map<Long, SolutionSettledEvent> solutions = new ConcurrentHashMap<>();

    @Data
    public static class AccusationEntry {
        private long requestId;
        private long batchId;
        private String player;
        private long requestedAt;
        /** null while the disclosure is pending or stale */
        private Boolean correct;
        /** Set when a version bump voided the request before it settled; it will never settle. */
        private boolean stale;
    }

    @EventListener
    public void onRequested(DisclosureRequestedEvent event) {
        if (event.kind() != DisclosureKind.ACCUSATION) return;
        AccusationEntry entry = new AccusationEntry();
        entry.setRequestId(event.requestId());
        entry.setBatchId(event.batchId());
        entry.setPlayer(event.requester());
        entry.setRequestedAt(event.requestedAt());
        accusations.put(event.requestId(), entry);
    }

    @EventListener
    public void onAccusationSettled(AccusationSettledEvent event) {
        AccusationEntry entry = accusations.get(event.requestId());
        if (entry != null) {
            entry.setCorrect(event.correct());
        }
    }

    @EventListener
    public void onVersionBumped(ProtocolVersionBumpedEvent event) {
        for (AccusationEntry entry : accusations.values()) {
            if (entry.getCorrect() == null) {
                entry.setStale(true);
            }
        }
    }

    @EventListener
    public void onSolutionSettled(SolutionSettledEvent event) {
        solutions.put(event.batchId(), event);
    }

    public List<AccusationEntry> accusations() {
        List<AccusationEntry> all = new ArrayList<>(accusations.values());
        all.sort((a, b) -> Long.compare(a.getRequestId(), b.getRequestId()));
        return all;
    }

    public Optional<SolutionSettledEvent> solution(long batchId) {
        return Optional.ofNullable(solutions.get(batchId));
    }

    public long correctCount() {
        return accusations.values().stream().filter(a -> Boolean.TRUE.equals(a.getCorrect())).count();
    }

    public long incorrectCount() {
        return accusations.values().stream().filter(a -> Boolean.FALSE.equals(a.getCorrect())).count();
    }

    public long pendingCount() {
        return accusations.values().stream().filter(a -> a.getCorrect() == null && !a.isStale()).count();
    }

    public long staleCount() {
        return accusations.values().stream().filter(AccusationEntry::isStale).count();
    }
}
