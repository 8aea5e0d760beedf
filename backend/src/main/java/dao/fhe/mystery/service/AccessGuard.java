package dao.fhe.mystery.service;

import dao.fhe.mystery.exception.ProtocolError;
import dao.fhe.mystery.exception.ProtocolException;
import dao.fhe.mystery.model.ActionCategory;
import dao.fhe.mystery.model.Role;
import dao.fhe.mystery.state.ProtocolState;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Role, pause and per-identity cooldown checks. Identities are expected normalized.
 */
@Service
public class AccessGuard {

    private final ProtocolState state;

    // key: (identity, category) -> last successful action, unix seconds
    private final Map<LedgerKey, Long> lastAction = new ConcurrentHashMap<>();

    private record LedgerKey(String identity, ActionCategory category) {}

    public AccessGuard(ProtocolState state) {
        this.state = state;
    }

    public void authorize(String caller, Role requiredRole) {
        switch (requiredRole) {
            case OWNER -> {
                if (state.getOwner() == null || !state.getOwner().equals(caller)) {
                    throw new ProtocolException(ProtocolError.NOT_OWNER, "Caller is not the owner: " + caller);
                }
            }
            case PROVIDER -> {
                if (!state.isProvider(caller)) {
                    throw new ProtocolException(ProtocolError.NOT_PROVIDER, "Caller is not a provider: " + caller);
                }
            }
        }
    }

    public void requireUnpaused() {
        if (state.isPaused()) {
            throw new ProtocolException(ProtocolError.PAUSED, "Protocol is paused");
        }
    }

    /**
     * Fails with RATE_LIMITED while the identity is inside its cooldown window. Records nothing.
     */
    public void checkCooldown(String identity, ActionCategory category, long now) {
        Long last = lastAction.get(new LedgerKey(identity, category));
        if (last == null) return;
        long readyAt = last + state.getCooldownSeconds();
        if (now < readyAt) {
            throw new ProtocolException(ProtocolError.RATE_LIMITED,
                    category + " cooldown active for " + identity + " until " + readyAt);
        }
    }

    /**
     * Same check, then records {@code now} as the last action. A rejected call leaves the ledger untouched.
     */
    public void checkAndUpdateCooldown(String identity, ActionCategory category, long now) {
        // check and record atomically
        lastAction.compute(new LedgerKey(identity, category), (key, last) -> {
            if (last != null && now < last + state.getCooldownSeconds()) {
                throw new ProtocolException(ProtocolError.RATE_LIMITED,
                        category + " cooldown active for " + identity + " until " + (last + state.getCooldownSeconds()));
            }
            return now;
        });
    }

    public OptionalLong lastActionAt(String identity, ActionCategory category) {
        Long last = lastAction.get(new LedgerKey(identity, category));
        return last == null ? OptionalLong.empty() : OptionalLong.of(last);
    }
}
