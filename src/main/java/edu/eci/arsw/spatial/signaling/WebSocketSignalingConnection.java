package edu.eci.arsw.spatial.signaling;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;

/**
 * {@link SignalingConnection} sobre una sesión WebSocket de Spring.
 */
public class WebSocketSignalingConnection implements SignalingConnection {
    private static final Logger log = LoggerFactory.getLogger(WebSocketSignalingConnection.class);

    private final WebSocketSession session;
    private final SignalingCodec codec;

    public WebSocketSignalingConnection(WebSocketSession session, SignalingCodec codec) {
        this.session = session;
        this.codec = codec;
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public synchronized void send(SignalingMessage message) throws IOException {
        if (!session.isOpen()) {
            throw new IOException("Signaling socket " + session.getId() + " is closed");
        }
        session.sendMessage(new TextMessage(codec.write(message)));
    }

    @Override
    public void close() {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(CloseStatus.NORMAL);
        } catch (IOException e) {
            log.warn("Could not close signaling socket {}: {}", session.getId(), e.toString());
        }
    }
}
