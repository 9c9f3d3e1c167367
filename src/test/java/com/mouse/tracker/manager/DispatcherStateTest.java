package com.mouse.tracker.manager;

import com.mouse.tracker.enums.FiringPhase;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class DispatcherStateTest {

    private final DispatcherState state = new DispatcherState();
    private final Instant now = Instant.parse("2024-05-01T10:00:00Z");

    @Test
    void claimMovesThroughPhasesAndReleases() {
        assertThat(state.phaseOf("s1")).isEqualTo(FiringPhase.IDLE);
        assertThat(state.tryClaim("s1", now)).isTrue();
        assertThat(state.phaseOf("s1")).isEqualTo(FiringPhase.CLAIMED);
        state.markFiring("s1");
        assertThat(state.phaseOf("s1")).isEqualTo(FiringPhase.FIRING);
        assertThat(state.claimedIds()).containsExactly("s1");

        state.release("s1");
        assertThat(state.phaseOf("s1")).isEqualTo(FiringPhase.IDLE);
        assertThat(state.tryClaim("s1", now)).isTrue();
    }

    @Test
    void secondClaimIsRejected() {
        assertThat(state.tryClaim("s1", now)).isTrue();
        assertThat(state.tryClaim("s1", now)).isFalse();
        assertThat(state.tryClaim("s2", now)).isTrue();
    }

    @Test
    void markFiringOnUnclaimedScheduleDoesNothing() {
        state.markFiring("ghost");
        assertThat(state.phaseOf("ghost")).isEqualTo(FiringPhase.IDLE);
    }

    @Test
    void onlyOneConcurrentClaimWins() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger wins = new AtomicInteger();
        for (int i = 0; i < 32; i++) {
            pool.execute(() -> {
                try {
                    start.await();
                    if (state.tryClaim("contended", now)) {
                        wins.incrementAndGet();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
        }
        start.countDown();
        pool.shutdown();
        assertThat(pool.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        assertThat(wins.get()).isEqualTo(1);
    }
}
