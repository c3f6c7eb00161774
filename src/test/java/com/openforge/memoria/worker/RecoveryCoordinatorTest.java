package com.openforge.memoria.worker;

import com.openforge.memoria.process.ProcessRegistry;
import com.openforge.memoria.queue.PendingMessageStore;
import com.openforge.memoria.session.SessionContext;
import com.openforge.memoria.session.SessionRegistry;
import com.openforge.memoria.session.SessionStore;
import com.openforge.memoria.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RecoveryCoordinatorTest {

    private PendingMessageStore messageStore;
    private SessionStore sessionStore;
    private SessionRegistry registry;
    private SessionProcessor processor;
    private ProcessRegistry processRegistry;
    private ProcessingStatusService statusService;

    private RecoveryCoordinator coordinator;

    @BeforeEach
    void setUp() {
        messageStore    = mock(PendingMessageStore.class);
        sessionStore    = mock(SessionStore.class);
        registry        = mock(SessionRegistry.class);
        processor       = mock(SessionProcessor.class);
        processRegistry = mock(ProcessRegistry.class);
        statusService   = mock(ProcessingStatusService.class);
        coordinator = coordinator(TestFixtures.recoveryProperties());

        when(registry.sessionsWithRunningConsumer()).thenReturn(Set.of());
        when(registry.liveSessionIds()).thenReturn(Set.of());
        when(sessionStore.failStaleSessions(any(), any())).thenReturn(List.of());
        when(messageStore.sessionsWithPendingWork()).thenReturn(List.of());
    }

    @Test
    void coldStartResetReclaimsEverything() {
        when(messageStore.resetStaleProcessing(0)).thenReturn(4);

        assertThat(coordinator.resetAllInFlight()).isEqualTo(4);
        verify(messageStore).resetStaleProcessing(0);
    }

    @Test
    void periodicPassOnlyReclaimsClaimsOlderThanTheThreshold() {
        when(messageStore.resetStaleProcessing(Duration.ofMinutes(5).toMillis())).thenReturn(2);

        RecoveryResult result = coordinator.runPass();

        assertThat(result.resetMessages()).isEqualTo(2);
        verify(messageStore, never()).resetStaleProcessing(0);
    }

    @Test
    void staleSessionsAreFailedExceptThoseWithARunningConsumer() {
        when(registry.sessionsWithRunningConsumer()).thenReturn(Set.of(3L));
        when(sessionStore.failStaleSessions(Duration.ofHours(6), Set.of(3L))).thenReturn(List.of(1L, 2L));
        when(messageStore.failPendingForSessions(List.of(1L, 2L))).thenReturn(5);

        RecoveryResult result = coordinator.runPass();

        assertThat(result.failedSessions()).isEqualTo(2);
        assertThat(result.failedMessages()).isEqualTo(5);
        verify(registry).remove(1L);
        verify(registry).remove(2L);
        verify(registry, never()).remove(3L);
    }

    @Test
    void orphansAreReapedAgainstLiveSessions() {
        when(registry.liveSessionIds()).thenReturn(Set.of(8L));
        when(processRegistry.reapOrphans(Set.of(8L))).thenReturn(2);

        assertThat(coordinator.runPass().reapedProcesses()).isEqualTo(2);
    }

    @Test
    void stepsRunInOrder() {
        when(sessionStore.failStaleSessions(any(), any())).thenReturn(List.of(1L));

        coordinator.runPass();

        InOrder order = inOrder(messageStore, sessionStore, registry, processRegistry, statusService);
        order.verify(messageStore).resetStaleProcessing(anyLong());
        order.verify(sessionStore).failStaleSessions(any(), any());
        order.verify(registry).remove(1L);
        order.verify(processRegistry).reapOrphans(any());
        order.verify(messageStore).sessionsWithPendingWork();
        order.verify(statusService).broadcast();
    }

    @Test
    void undrainedSessionsAreStartedUpToTheCap() {
        coordinator = coordinator(new RecoveryProperties(Duration.ofMinutes(5), Duration.ofHours(6),
                Duration.ofMinutes(5), 2, Duration.ZERO));
        when(messageStore.sessionsWithPendingWork()).thenReturn(List.of(1L, 2L, 3L));
        SessionContext first  = context(1L);
        SessionContext second = context(2L);
        when(registry.initializeSession(1L)).thenReturn(first);
        when(registry.initializeSession(2L)).thenReturn(second);
        when(processor.start(any(), eq("recovery"))).thenReturn(true);

        RecoveryResult result = coordinator.runPass();

        assertThat(result.startedSessions()).isEqualTo(2);
        assertThat(result.skippedSessions()).isEqualTo(1);
        verify(registry, never()).initializeSession(3L);
    }

    @Test
    void sessionsWithARunningConsumerAreSkipped() {
        SessionContext running = context(1L);
        running.setConsumer(new CompletableFuture<Void>());
        when(messageStore.sessionsWithPendingWork()).thenReturn(List.of(1L));
        when(registry.initializeSession(1L)).thenReturn(running);

        RecoveryResult result = coordinator.runPass();

        assertThat(result.startedSessions()).isZero();
        assertThat(result.skippedSessions()).isEqualTo(1);
        verify(processor, never()).start(any(), any());
    }

    @Test
    void unknownSessionWithPendingWorkIsIgnored() {
        when(messageStore.sessionsWithPendingWork()).thenReturn(List.of(404L, 1L));
        when(registry.initializeSession(404L)).thenThrow(new IllegalArgumentException("No session row"));
        when(registry.initializeSession(1L)).thenReturn(context(1L));
        when(processor.start(any(), any())).thenReturn(true);

        RecoveryResult result = coordinator.runPass();

        assertThat(result.startedSessions()).isEqualTo(1);
    }

    @Test
    void scheduledPassIsSkippedWhileNotAccepting() {
        when(processor.isAccepting()).thenReturn(false);

        coordinator.scheduledPass();

        verify(messageStore, never()).resetStaleProcessing(anyLong());
    }

    @Test
    void scheduledPassSurvivesAFailingStep() {
        when(processor.isAccepting()).thenReturn(true);
        when(messageStore.resetStaleProcessing(anyLong())).thenThrow(new IllegalStateException("db down"));

        coordinator.scheduledPass();

        verify(processor, times(0)).start(any(), any());
    }

    private RecoveryCoordinator coordinator(RecoveryProperties properties) {
        return new RecoveryCoordinator(messageStore, sessionStore, registry, processor, processRegistry,
                statusService, properties);
    }

    private static SessionContext context(Long id) {
        return new SessionContext(TestFixtures.sessionRow(id, "content-" + id), 0L);
    }
}
