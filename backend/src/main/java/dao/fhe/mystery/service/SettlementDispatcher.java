package dao.fhe.mystery.service;

import dao.fhe.mystery.exception.ProtocolError;
import dao.fhe.mystery.exception.ProtocolException;
import dao.fhe.mystery.model.DecryptionContext;
import dao.fhe.mystery.oracle.DisclosureReplyMessage;
import org.springframework.stereotype.Service;

/**
 * Routes an oracle reply to the workflow that issued the request.
 */
@Service
public class SettlementDispatcher {

    private final DisclosureCoordinator coordinator;
    private final AccusationWorkflow accusationWorkflow;
    private final SolutionWorkflow solutionWorkflow;

    public SettlementDispatcher(DisclosureCoordinator coordinator,
                                AccusationWorkflow accusationWorkflow,
                                SolutionWorkflow solutionWorkflow) {
        this.coordinator = coordinator;
        this.accusationWorkflow = accusationWorkflow;
        this.solutionWorkflow = solutionWorkflow;
    }

    public Object dispatch(DisclosureReplyMessage reply) {
        DecryptionContext context = coordinator.find(reply.requestId())
                .orElseThrow(() -> new ProtocolException(ProtocolError.UNKNOWN_REQUEST,
                        "Unknown disclosure request: " + reply.requestId()));

        return switch (context.getKind()) {
            case ACCUSATION -> accusationWorkflow.settle(reply.requestId(), reply.cleartext(), reply.proof());
            case SOLUTION -> solutionWorkflow.settle(reply.requestId(), reply.cleartext(), reply.proof());
        };
    }
}
