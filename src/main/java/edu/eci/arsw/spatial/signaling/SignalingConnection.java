package edu.eci.arsw.spatial.signaling;

import java.io.IOException;

/**
 * Socket de señalización abierto para una familia de canal.
 */
public interface SignalingConnection {

    boolean isOpen();

    void send(SignalingMessage message) throws IOException;

    void close();
}
