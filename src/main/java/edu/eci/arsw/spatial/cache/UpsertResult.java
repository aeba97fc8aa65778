package edu.eci.arsw.spatial.cache;

/**
 * @param newParticipant true si el participante no tenía cuadro en la caché.
 * @param frame          Entrada resultante.
 */
public record UpsertResult(boolean newParticipant, CachedFrame frame) {
}
