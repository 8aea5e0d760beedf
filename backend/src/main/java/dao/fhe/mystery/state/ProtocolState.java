package dao.fhe.mystery.state;

import dao.fhe.mystery.config.ProtocolProperties;
import dao.fhe.mystery.util.Identities;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-wide protocol state: roles, pause flag, cooldown, protocol version and the batch id
 * sequence. Every state-mutating operation runs while holding {@link #mutex()}.
 */
@Slf4j
@Component
public class ProtocolState {

    private final Object mutex = new Object();

    private volatile String owner;
    private final Set<String> providers = Collections.synchronizedSet(new LinkedHashSet<>());
    private volatile boolean paused;
    private volatile long cooldownSeconds;
    private final AtomicLong currentVersion = new AtomicLong(1);
    private final AtomicLong batchIdSeq = new AtomicLong(1);

    public ProtocolState(ProtocolProperties props) {
        if (props.getOwner() == null || props.getOwner().isBlank()) {
            log.warn("ProtocolState: protocol.owner is not configured. Owner-only operations will be rejected.");
            this.owner = null;
        } else {
            this.owner = Identities.normalize(props.getOwner());
        }
        this.providers.addAll(flatten(props.getProviders()));
        this.cooldownSeconds = Math.max(0, props.getCooldownSeconds());

        log.info("ProtocolState initialized: owner={}, providers={}, cooldownSeconds={}, maxBatchSize={}",
                owner, providers.size(), cooldownSeconds, props.getMaxBatchSize());
    }

    public Object mutex() {
        return mutex;
    }

    public String getOwner() {
        return owner;
    }

    public boolean isProvider(String identity) {
        return providers.contains(identity);
    }

    public List<String> getProviders() {
        synchronized (providers) {
            return new ArrayList<>(providers);
        }
    }

    public boolean addProvider(String identity) {
        return providers.add(identity);
    }

    public boolean removeProvider(String identity) {
        return providers.remove(identity);
    }

    public boolean isPaused() {
        return paused;
    }

    public void setPaused(boolean paused) {
        this.paused = paused;
    }

    public long getCooldownSeconds() {
        return cooldownSeconds;
    }

    public void setCooldownSeconds(long cooldownSeconds) {
        this.cooldownSeconds = cooldownSeconds;
    }

    public long getCurrentVersion() {
        return currentVersion.get();
    }

    public long bumpVersion() {
        return currentVersion.incrementAndGet();
    }

    public long allocateBatchId() {
        return batchIdSeq.getAndIncrement();
    }

    /**
     * Spring may bind `protocol.providers` as a real list or as a single comma-separated string
     * (e.g. from env), sometimes with spaces. Normalize by flattening + trimming + dropping empties.
     */
    private static List<String> flatten(List<String> configured) {
        List<String> out = new ArrayList<>();
        if (configured == null) return out;
        for (String entry : configured) {
            if (entry == null) continue;
            for (String part : entry.split(",")) {
                String p = part.trim();
                if (!p.isEmpty()) out.add(Identities.normalize(p));
            }
        }
        return out;
    }
}
