package fun.fengwk.mph.core.service.browser.session;

import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class RequestPacerTest {

    @Test
    public void testDelayStaysWithinJitterRange() {
        RequestPacer pacer = new RequestPacer(2000, 1000, new Random(42));
        for (int i = 0; i < 100; i++) {
            assertThat(pacer.nextDelayMs()).isBetween(2000L, 3000L);
        }
    }

    @Test
    public void testNoneNeverPauses() {
        FakeFetchSession session = new FakeFetchSession();

        RequestPacer.NONE.pace(session);

        assertThat(session.getPauses()).isEmpty();
    }

    @Test
    public void testPacePausesSession() {
        FakeFetchSession session = new FakeFetchSession();

        new RequestPacer(500, 0).pace(session);

        assertThat(session.getPauses()).containsExactly(500L);
    }

    @Test
    public void testBlockStateIsSticky() {
        SessionBlockState state = new SessionBlockState();

        assertThat(state.markBlocked("captcha")).isTrue();
        assertThat(state.markBlocked("other")).isFalse();
        assertThat(state.isBlocked()).isTrue();
        assertThat(state.getBlockReason()).isEqualTo("captcha");
    }

}
