package edu.eci.arsw.spatial.service;

import edu.eci.arsw.spatial.domain.LegKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Métricas de cuadros y de arranque de patas.
 */
public class FrameStatsService {

    private final MeterRegistry registry;

    private final Counter sentCounter;
    private final Counter acceptedCounter;
    private final Counter evictedCounter;

    private final AtomicLong sent = new AtomicLong();
    private final AtomicLong accepted = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicLong evicted = new AtomicLong();
    private final AtomicLong legFailures = new AtomicLong();

    private final Map<String, Counter> dropCounters = new ConcurrentHashMap<>();

    public FrameStatsService(MeterRegistry registry) {
        this.registry = registry;
        this.sentCounter = Counter.builder("rtc.frames.sent").register(registry);
        this.acceptedCounter = Counter.builder("rtc.frames.accepted").register(registry);
        this.evictedCounter = Counter.builder("rtc.frames.evicted").register(registry);
    }

    public void recordFrameSent() {
        sent.incrementAndGet();
        sentCounter.increment();
    }

    public void recordFrameAccepted() {
        accepted.incrementAndGet();
        acceptedCounter.increment();
    }

    /**
     * Registra un cuadro descartado.
     *
     * @param reason Motivo (error de decodificación o rechazo de validación).
     */
    public void recordFrameDropped(String reason) {
        dropped.incrementAndGet();
        dropCounters.computeIfAbsent(reason,
                r -> Counter.builder("rtc.frames.dropped").tag("reason", r).register(registry)).increment();
    }

    public void recordEvicted(int count) {
        if (count <= 0) {
            return;
        }
        evicted.addAndGet(count);
        evictedCounter.increment(count);
    }

    /**
     * Registra el tiempo que tardó una pata en quedar activa.
     *
     * @param leg     Pata arrancada.
     * @param setupMs Tiempo de arranque en milisegundos.
     */
    public void recordLegStarted(LegKind leg, long setupMs) {
        Timer.builder("rtc.leg.start.ms")
                .tag("leg", leg.name())
                .publishPercentiles(0.95, 0.99)
                .serviceLevelObjectives(Duration.ofMillis(500), Duration.ofSeconds(1), Duration.ofSeconds(5))
                .register(registry)
                .record(setupMs, TimeUnit.MILLISECONDS);
    }

    public void recordLegFailed(LegKind leg) {
        legFailures.incrementAndGet();
        Counter.builder("rtc.leg.start.fail").tag("leg", leg.name()).register(registry).increment();
    }

    public Snapshot snapshot() {
        return new Snapshot(sent.get(), accepted.get(), dropped.get(), evicted.get(), legFailures.get());
    }

    /*
     * Instantánea de los contadores acumulados.
     */
    public record Snapshot(long framesSent, long framesAccepted, long framesDropped, long framesEvicted,
                           long legFailures) {
    }
}
