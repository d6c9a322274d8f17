package fun.fengwk.mph.core.service.browser.session;

import java.util.Random;

/**
 * Computes randomized delays of base plus uniform jitter.
 *
 * @author fengwk
 */
public class RequestPacer {

    public static final RequestPacer NONE = new RequestPacer(0, 0);

    private final long baseDelayMs;
    private final long jitterMs;
    private final Random random;

    public RequestPacer(long baseDelayMs, long jitterMs) {
        this(baseDelayMs, jitterMs, new Random());
    }

    public RequestPacer(long baseDelayMs, long jitterMs, Random random) {
        this.baseDelayMs = Math.max(0, baseDelayMs);
        this.jitterMs = Math.max(0, jitterMs);
        this.random = random;
    }

    public long nextDelayMs() {
        if (jitterMs == 0) {
            return baseDelayMs;
        }
        return baseDelayMs + (long) (random.nextDouble() * jitterMs);
    }

    /**
     * Pause the session for the next delay, no-op when the delay is zero.
     */
    public void pace(FetchSession session) {
        long delayMs = nextDelayMs();
        if (delayMs > 0) {
            session.pause(delayMs);
        }
    }

}
