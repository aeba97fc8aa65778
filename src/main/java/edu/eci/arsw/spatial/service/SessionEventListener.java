package edu.eci.arsw.spatial.service;

import edu.eci.arsw.spatial.cache.FrameHandle;
import edu.eci.arsw.spatial.domain.LegKind;

/**
 * Observador de la sesión. Todos los métodos son opcionales.
 */
public interface SessionEventListener {

    default void onConnect() {
    }

    default void onDisconnect() {
    }

    default void onSourceAdded(String participantId, FrameHandle frame) {
    }

    default void onSourceRemoved(String participantId) {
    }

    default void onFrameUpdated(String participantId, FrameHandle frame) {
    }

    default void onLegStateChanged(LegKind leg, boolean active) {
    }

    default void onError(String message, Throwable cause) {
    }
}
