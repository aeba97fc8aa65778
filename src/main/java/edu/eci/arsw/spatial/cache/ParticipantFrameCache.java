package edu.eci.arsw.spatial.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Caché del último cuadro válido por participante, con expulsión por edad.
 */
public class ParticipantFrameCache {
    private static final Logger log = LoggerFactory.getLogger(ParticipantFrameCache.class);

    private static final double NANOS_PER_MILLI = 1_000_000.0;

    private final long evictionAgeMs;
    private final Map<String, CachedFrame> frames = new ConcurrentHashMap<>();

    /**
     * @param evictionAgeMs Edad máxima de una entrada antes de ser expulsada.
     */
    public ParticipantFrameCache(long evictionAgeMs) {
        this.evictionAgeMs = evictionAgeMs;
    }

    /**
     * Inserta o reemplaza el cuadro de un participante. El recurso anterior se
     * libera antes del reemplazo.
     *
     * @param participantId  Participante emisor.
     * @param handle         Recurso del nuevo cuadro.
     * @param sequenceNumber Secuencia del cuadro.
     * @param nowNanos       Momento de recepción.
     * @return Si el participante es nuevo y la entrada guardada.
     */
    public UpsertResult upsert(String participantId, FrameHandle handle, long sequenceNumber, long nowNanos) {
        CachedFrame entry = new CachedFrame(handle, nowNanos, sequenceNumber);
        CachedFrame previous = frames.get(participantId);
        if (previous != null && previous.handle() != handle) {
            previous.handle().release();
        }
        frames.put(participantId, entry);
        return new UpsertResult(previous == null, entry);
    }

    /**
     * Expulsa las entradas cuya recepción supera la edad configurada.
     *
     * @param nowNanos Hora actual en nanosegundos.
     * @return Participantes expulsados.
     */
    public List<String> sweep(long nowNanos) {
        List<String> evicted = new ArrayList<>();
        for (var e : frames.entrySet()) {
            double ageMs = (nowNanos - e.getValue().receivedAtNanos()) / NANOS_PER_MILLI;
            if (ageMs > evictionAgeMs && frames.remove(e.getKey(), e.getValue())) {
                e.getValue().handle().release();
                evicted.add(e.getKey());
                log.debug("Evicted stale frame participant={} ageMs={}", e.getKey(), ageMs);
            }
        }
        return evicted;
    }

    /**
     * Elimina explícitamente la entrada de un participante.
     *
     * @param participantId Participante a eliminar.
     * @return true si existía una entrada.
     */
    public boolean remove(String participantId) {
        CachedFrame removed = frames.remove(participantId);
        if (removed == null) {
            return false;
        }
        removed.handle().release();
        return true;
    }

    /**
     * Libera todos los recursos y vacía la caché.
     *
     * @return Participantes que tenían entrada.
     */
    public List<String> clear() {
        List<String> cleared = new ArrayList<>();
        for (String id : List.copyOf(frames.keySet())) {
            if (remove(id)) {
                cleared.add(id);
            }
        }
        return cleared;
    }

    public Optional<CachedFrame> get(String participantId) {
        return Optional.ofNullable(frames.get(participantId));
    }

    public int size() {
        return frames.size();
    }
}
