package edu.eci.arsw.spatial.signaling;

/**
 * Receptor de mensajes de un socket de señalización. Puede invocarse desde hilos del transporte.
 */
public interface SignalingListener {

    void onMessage(SignalingMessage message);

    void onClosed();
}
