package edu.eci.arsw.spatial.service;

import edu.eci.arsw.spatial.domain.LegKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ChannelReadinessAwaiterTest {

    private TaskScheduler scheduler;
    private ScheduledFuture<?> poll;
    private ChannelReadinessAwaiter awaiter;

    @BeforeEach
    void setUp() {
        scheduler = mock(TaskScheduler.class);
        poll = mock(ScheduledFuture.class);
        doReturn(poll).when(scheduler).scheduleWithFixedDelay(any(Runnable.class), any(Instant.class), any(Duration.class));
        Clock clock = Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC);
        awaiter = new ChannelReadinessAwaiter(scheduler, clock, 100, 5000);
    }

    private Runnable capturedPoll() {
        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        verify(scheduler).scheduleWithFixedDelay(task.capture(), any(Instant.class), eq(Duration.ofMillis(100)));
        return task.getValue();
    }

    @Test
    void maxAttempts_deberiaSerCincuentaConValoresPorDefecto() {
        assertEquals(50, awaiter.maxAttempts());
    }

    @Test
    void await_deberiaCompletarSinSondear_cuandoYaEstaListo() {
        CompletableFuture<Void> f = awaiter.await(LegKind.VIEW_VIDEO, () -> true);

        assertTrue(f.isDone());
        assertFalse(f.isCompletedExceptionally());
        verifyNoInteractions(scheduler);
    }

    @Test
    void await_deberiaCompletarAlAbrirse_casoFeliz1() {
        AtomicBoolean open = new AtomicBoolean(false);
        CompletableFuture<Void> f = awaiter.await(LegKind.SEND_VIDEO, open::get);
        Runnable task = capturedPoll();

        task.run();
        task.run();
        assertFalse(f.isDone());

        open.set(true);
        task.run();

        assertTrue(f.isDone());
        assertFalse(f.isCompletedExceptionally());
        verify(poll).cancel(false);
    }

    @Test
    void await_deberiaFallarConTimeout_trasMaxAttempts() {
        CompletableFuture<Void> f = awaiter.await(LegKind.VIEW_VIDEO, () -> false);
        Runnable task = capturedPoll();

        for (int i = 0; i < 49; i++) {
            task.run();
        }
        assertFalse(f.isDone());
        task.run();

        ExecutionException ex = assertThrows(ExecutionException.class, f::get);
        assertInstanceOf(ChannelOpenTimeoutException.class, ex.getCause());
        assertEquals(LegKind.VIEW_VIDEO, ((ChannelOpenTimeoutException) ex.getCause()).getLeg());
        verify(poll).cancel(false);
    }

    @Test
    void await_deberiaDetenerSondeo_cuandoSeCancela() {
        CompletableFuture<Void> f = awaiter.await(LegKind.VIEW_VIDEO, () -> false);
        Runnable task = capturedPoll();

        f.cancel(false);
        task.run();

        assertTrue(f.isCancelled());
        verify(poll).cancel(false);
    }
}
