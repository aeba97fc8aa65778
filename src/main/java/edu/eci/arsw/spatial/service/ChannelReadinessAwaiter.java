package edu.eci.arsw.spatial.service;

import edu.eci.arsw.spatial.domain.LegKind;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;
import java.util.function.BooleanSupplier;

/**
 * Espera acotada y cancelable a que un canal quede listo, sondeando a intervalos fijos.
 */
public class ChannelReadinessAwaiter {

    private final TaskScheduler scheduler;
    private final Clock clock;
    private final long pollIntervalMs;
    private final long timeoutMs;

    public ChannelReadinessAwaiter(TaskScheduler scheduler, Clock clock, long pollIntervalMs, long timeoutMs) {
        this.scheduler = scheduler;
        this.clock = clock;
        this.pollIntervalMs = pollIntervalMs;
        this.timeoutMs = timeoutMs;
    }

    /**
     * Número máximo de sondeos antes de declarar el tiempo agotado.
     */
    public int maxAttempts() {
        return (int) Math.max(1, (timeoutMs + pollIntervalMs - 1) / pollIntervalMs);
    }

    /**
     * Completa cuando {@code ready} sea verdadero, o falla con
     * {@link ChannelOpenTimeoutException} tras {@link #maxAttempts()} sondeos.
     * Cancelar el futuro devuelto detiene el sondeo.
     *
     * @param leg   Pata que espera, para el mensaje de error.
     * @param ready Condición de listo.
     * @return Futuro de la espera.
     */
    public CompletableFuture<Void> await(LegKind leg, BooleanSupplier ready) {
        CompletableFuture<Void> result = new CompletableFuture<>();
        if (ready.getAsBoolean()) {
            result.complete(null);
            return result;
        }
        int max = maxAttempts();
        int[] attempts = {0};
        Duration interval = Duration.ofMillis(pollIntervalMs);
        ScheduledFuture<?> poll = scheduler.scheduleWithFixedDelay(() -> {
            if (result.isDone()) {
                return;
            }
            attempts[0]++;
            if (ready.getAsBoolean()) {
                result.complete(null);
            } else if (attempts[0] >= max) {
                result.completeExceptionally(new ChannelOpenTimeoutException(leg, timeoutMs));
            }
        }, clock.instant().plus(interval), interval);
        result.whenComplete((ignored, error) -> poll.cancel(false));
        return result;
    }
}
