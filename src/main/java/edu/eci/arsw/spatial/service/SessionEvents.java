package edu.eci.arsw.spatial.service;

import edu.eci.arsw.spatial.cache.FrameHandle;
import edu.eci.arsw.spatial.domain.LegKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Lista de suscriptores de la sesión. Un suscriptor que falla no impide la entrega a los demás.
 */
public class SessionEvents {
    private static final Logger log = LoggerFactory.getLogger(SessionEvents.class);

    private final List<SessionEventListener> listeners = new CopyOnWriteArrayList<>();

    public void subscribe(SessionEventListener listener) {
        listeners.add(listener);
    }

    public void unsubscribe(SessionEventListener listener) {
        listeners.remove(listener);
    }

    public void connected() {
        fanout("connect", SessionEventListener::onConnect);
    }

    public void disconnected() {
        fanout("disconnect", SessionEventListener::onDisconnect);
    }

    public void sourceAdded(String participantId, FrameHandle frame) {
        fanout("source-added", l -> l.onSourceAdded(participantId, frame));
    }

    public void sourceRemoved(String participantId) {
        fanout("source-removed", l -> l.onSourceRemoved(participantId));
    }

    public void frameUpdated(String participantId, FrameHandle frame) {
        fanout("frame-updated", l -> l.onFrameUpdated(participantId, frame));
    }

    public void legStateChanged(LegKind leg, boolean active) {
        fanout("leg-state-changed", l -> l.onLegStateChanged(leg, active));
    }

    public void error(String message, Throwable cause) {
        log.error("Session error: {}", message, cause);
        fanout("error", l -> l.onError(message, cause));
    }

    private void fanout(String event, Consumer<SessionEventListener> delivery) {
        for (var l : listeners) {
            try {
                delivery.accept(l);
            } catch (Exception e) {
                log.error("Listener failed handling '{}': {}", event, e.getMessage());
            }
        }
    }
}
