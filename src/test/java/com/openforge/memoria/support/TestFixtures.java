package com.openforge.memoria.support;

import com.openforge.memoria.domain.SdkSession;
import com.openforge.memoria.worker.RecoveryProperties;
import com.openforge.memoria.worker.WorkerProperties;

import java.time.Duration;
import java.util.List;
import java.util.function.BooleanSupplier;

public final class TestFixtures {

    private TestFixtures() {
    }

    public static WorkerProperties workerProperties() {
        return new WorkerProperties("claude", 3, Duration.ofMillis(20), Duration.ofMillis(200),
                Duration.ofSeconds(2), List.of("TodoWrite", "Skill"));
    }

    public static RecoveryProperties recoveryProperties() {
        return new RecoveryProperties(Duration.ofMinutes(5), Duration.ofHours(6), Duration.ofMinutes(5),
                50, Duration.ZERO);
    }

    /** Detached session row with an id, for tests that never touch the database. */
    public static SdkSession sessionRow(Long id, String contentSessionId) {
        SdkSession session = SdkSession.builder()
                .contentSessionId(contentSessionId)
                .project("memoria")
                .promptCounter(1)
                .startedAtEpoch(0L)
                .build();
        session.setId(id);
        return session;
    }

    /** Poll until {@code condition} holds; fails the test after {@code timeout}. */
    public static void await(Duration timeout, BooleanSupplier condition) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("Condition not met within " + timeout);
            }
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new AssertionError("Interrupted while waiting", e);
            }
        }
    }
}
