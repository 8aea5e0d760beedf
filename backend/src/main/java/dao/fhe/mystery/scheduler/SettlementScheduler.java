package dao.fhe.mystery.scheduler;

import dao.fhe.mystery.config.SchedulerProperties;
import dao.fhe.mystery.exception.ProtocolException;
import dao.fhe.mystery.oracle.DisclosureChannel;
import dao.fhe.mystery.oracle.DisclosureReplyMessage;
import dao.fhe.mystery.service.SettlementDispatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Drains oracle replies and settles them. A rejected reply is logged and dropped; its context
 * keeps its current status (pending or stale) for audit.
 */
@Slf4j
@Component
public class SettlementScheduler {

    private final DisclosureChannel channel;
    private final SettlementDispatcher dispatcher;
    private final SchedulerProperties schedulerProps;

    public SettlementScheduler(DisclosureChannel channel,
                               SettlementDispatcher dispatcher,
                               SchedulerProperties schedulerProps) {
        this.channel = channel;
        this.dispatcher = dispatcher;
        this.schedulerProps = schedulerProps;
    }

    @Scheduled(fixedDelayString = "${scheduler.settlement.check-interval-ms:1000}")
    public void settlePendingReplies() {
        if (!schedulerProps.getSettlement().isEnabled()) {
            return;
        }
        int max = Math.max(1, schedulerProps.getSettlement().getMaxPerTick());
        List<DisclosureReplyMessage> replies = channel.drainReplies(max);

        for (DisclosureReplyMessage reply : replies) {
            try {
                Object result = dispatcher.dispatch(reply);
                log.debug("Reply {} settled: {}", reply.requestId(), result);
            } catch (ProtocolException e) {
                log.warn("Reply {} rejected: error={}, reason={}", reply.requestId(), e.getError(), e.getMessage());
            } catch (Exception e) {
                log.error("Reply {} settlement failed", reply.requestId(), e);
            }
        }
    }
}
