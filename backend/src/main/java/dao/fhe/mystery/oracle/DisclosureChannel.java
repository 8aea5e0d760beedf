package dao.fhe.mystery.oracle;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Two one-way queues between the protocol and the oracle: requests out, replies in.
 * Nothing waits on a reply; settlement happens whenever a reply is drained.
 */
@Component
public class DisclosureChannel {

    private final BlockingQueue<DisclosureRequestMessage> requests = new LinkedBlockingQueue<>();
    private final BlockingQueue<DisclosureReplyMessage> replies = new LinkedBlockingQueue<>();

    public void publishRequest(DisclosureRequestMessage message) {
        requests.add(message);
    }

    public void publishReply(DisclosureReplyMessage message) {
        replies.add(message);
    }

    public List<DisclosureRequestMessage> drainRequests(int max) {
        List<DisclosureRequestMessage> out = new ArrayList<>();
        requests.drainTo(out, max);
        return out;
    }

    public List<DisclosureReplyMessage> drainReplies(int max) {
        List<DisclosureReplyMessage> out = new ArrayList<>();
        replies.drainTo(out, max);
        return out;
    }

    public int pendingRequests() {
        return requests.size();
    }

    public int pendingReplies() {
        return replies.size();
    }
}
