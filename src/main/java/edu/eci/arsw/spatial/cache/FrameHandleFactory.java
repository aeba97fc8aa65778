package edu.eci.arsw.spatial.cache;

/**
 * Crea el recurso de presentación para un cuadro aceptado.
 */
@FunctionalInterface
public interface FrameHandleFactory {

    FrameHandle create(String participantId, byte[] payload);
}
