package dao.fhe.mystery.scheduler;

import dao.fhe.mystery.config.SchedulerProperties;
import dao.fhe.mystery.oracle.DisclosureChannel;
import dao.fhe.mystery.oracle.DisclosureRequestMessage;
import dao.fhe.mystery.oracle.LocalDisclosureOracle;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Plays the oracle's side locally: answers queued request messages with signed replies.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "cipher", name = "backend", havingValue = "plaintext", matchIfMissing = true)
public class OracleRelayScheduler {

    private static final int MAX_PER_TICK = 100;

    private final DisclosureChannel channel;
    private final LocalDisclosureOracle oracle;
    private final SchedulerProperties schedulerProps;

    public OracleRelayScheduler(DisclosureChannel channel,
                                LocalDisclosureOracle oracle,
                                SchedulerProperties schedulerProps) {
        this.channel = channel;
        this.oracle = oracle;
        this.schedulerProps = schedulerProps;
    }

    @Scheduled(fixedDelayString = "${scheduler.relay.check-interval-ms:2000}")
    public void relayPendingRequests() {
        if (!schedulerProps.getRelay().isEnabled()) {
            return;
        }
        List<DisclosureRequestMessage> requests = channel.drainRequests(MAX_PER_TICK);
        if (requests.isEmpty()) return;

        int answered = 0;
        for (DisclosureRequestMessage request : requests) {
            try {
                channel.publishReply(oracle.answer(request));
                answered++;
            } catch (Exception e) {
                log.error("Local oracle failed to answer request {}: {}", request.requestId(), e.getMessage());
            }
        }
        log.info("Oracle relay: answered {}/{} request(s)", answered, requests.size());
    }
}
