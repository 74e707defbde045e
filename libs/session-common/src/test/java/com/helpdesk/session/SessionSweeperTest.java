package com.helpdesk.session;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SessionSweeper")
class SessionSweeperTest {

    private SessionRegistry registry;
    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> future;
    private SessionSweeper sweeper;

    @BeforeEach
    void setUp() {
        registry = mock(SessionRegistry.class);
        scheduler = mock(ScheduledExecutorService.class);
        future = mock(ScheduledFuture.class);
        doReturn(future).when(scheduler)
                .scheduleAtFixedRate(any(Runnable.class), anyLong(), anyLong(), any(TimeUnit.class));
        sweeper = new SessionSweeper(registry, scheduler, Duration.ofMinutes(5));
    }

    @Test
    @DisplayName("start schedules once at the configured interval")
    void startSchedulesOnce() {
        sweeper.start();
        sweeper.start();

        verify(scheduler, times(1)).scheduleAtFixedRate(
                any(Runnable.class), eq(300_000L), eq(300_000L), eq(TimeUnit.MILLISECONDS));
        assertTrue(sweeper.isRunning());
    }

    @Test
    @DisplayName("stop cancels the scheduled task")
    void stopCancels() {
        sweeper.start();
        sweeper.stop();

        verify(future).cancel(false);
        assertFalse(sweeper.isRunning());
    }

    @Test
    @DisplayName("a failing sweep does not propagate")
    void sweepFailureIsContained() {
        when(registry.sweepExpired()).thenThrow(new IllegalStateException("boom"));

        sweeper.sweepOnce();

        verify(registry).sweepExpired();
    }

    @Test
    @DisplayName("rejects a non-positive interval")
    void rejectsZeroInterval() {
        assertThrows(IllegalArgumentException.class,
                () -> new SessionSweeper(registry, scheduler, Duration.ZERO));
    }
}
