package fun.fengwk.mph.core.service.browser.session;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Sticky block flag of one fetch session.
 *
 * <p>The state only moves forward: once blocked, a session stays blocked until it is closed.
 *
 * @author fengwk
 */
public class SessionBlockState {

    private final AtomicReference<String> blockReason = new AtomicReference<>();

    public boolean isBlocked() {
        return blockReason.get() != null;
    }

    /**
     * Record the block. Only the first reason is kept.
     *
     * @return true if this call moved the session into the blocked state
     */
    public boolean markBlocked(String reason) {
        return blockReason.compareAndSet(null, reason == null ? "blocked" : reason);
    }

    public String getBlockReason() {
        return blockReason.get();
    }

}
