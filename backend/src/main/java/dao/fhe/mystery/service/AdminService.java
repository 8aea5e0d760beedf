package dao.fhe.mystery.service;

import dao.fhe.mystery.event.ProtocolVersionBumpedEvent;
import dao.fhe.mystery.model.Role;
import dao.fhe.mystery.state.ProtocolState;
import dao.fhe.mystery.util.Identities;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Owner-only operator surface.
 */
@Slf4j
@Service
public class AdminService {

    private final AccessGuard accessGuard;
    private final ProtocolState state;
    private final ApplicationEventPublisher events;

    public AdminService(AccessGuard accessGuard, ProtocolState state, ApplicationEventPublisher events) {
        this.accessGuard = accessGuard;
        this.state = state;
        this.events = events;
    }

    public boolean addProvider(String caller, String provider) {
        synchronized (state.mutex()) {
            accessGuard.authorize(Identities.normalize(caller), Role.OWNER);
            boolean added = state.addProvider(Identities.normalize(provider));
            log.info("Provider {} {}", provider, added ? "added" : "already present");
            return added;
        }
    }

    public boolean removeProvider(String caller, String provider) {
        synchronized (state.mutex()) {
            accessGuard.authorize(Identities.normalize(caller), Role.OWNER);
            boolean removed = state.removeProvider(Identities.normalize(provider));
            log.info("Provider {} {}", provider, removed ? "removed" : "was not registered");
            return removed;
        }
    }

    public void pause(String caller) {
        setPaused(caller, true);
    }

    public void unpause(String caller) {
        setPaused(caller, false);
    }

    public void setCooldown(String caller, long cooldownSeconds) {
        if (cooldownSeconds < 0) {
            throw new IllegalArgumentException("cooldownSeconds must be >= 0");
        }
        synchronized (state.mutex()) {
            accessGuard.authorize(Identities.normalize(caller), Role.OWNER);
            state.setCooldownSeconds(cooldownSeconds);
            log.info("Cooldown set to {}s", cooldownSeconds);
        }
    }

    /**
     * Voids every outstanding disclosure request at once: contexts bound to an older version
     * can no longer be settled.
     */
    public long bumpVersion(String caller) {
        synchronized (state.mutex()) {
            accessGuard.authorize(Identities.normalize(caller), Role.OWNER);
            long version = state.bumpVersion();
            log.info("Protocol version bumped to {}", version);
            events.publishEvent(new ProtocolVersionBumpedEvent(version - 1, version));
            return version;
        }
    }

    private void setPaused(String caller, boolean paused) {
        synchronized (state.mutex()) {
            accessGuard.authorize(Identities.normalize(caller), Role.OWNER);
            state.setPaused(paused);
            log.info("Protocol {}", paused ? "paused" : "unpaused");
        }
    }
}
