package edu.eci.arsw.spatial.cache;

/**
 * Último cuadro bueno conocido de un participante.
 *
 * @param handle          Recurso de presentación.
 * @param receivedAtNanos Momento de recepción en nanosegundos.
 * @param sequenceNumber  Secuencia declarada por el emisor.
 */
public record CachedFrame(FrameHandle handle, long receivedAtNanos, long sequenceNumber) {
}
