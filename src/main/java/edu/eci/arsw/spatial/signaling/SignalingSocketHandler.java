package edu.eci.arsw.spatial.signaling;

import edu.eci.arsw.spatial.domain.ChannelFamily;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * Manejador del lado cliente para un socket de señalización de una familia.
 */
public class SignalingSocketHandler extends TextWebSocketHandler {
    private static final Logger log = LoggerFactory.getLogger(SignalingSocketHandler.class);

    private final ChannelFamily family;
    private final SignalingListener listener;
    private final SignalingCodec codec;

    public SignalingSocketHandler(ChannelFamily family, SignalingListener listener, SignalingCodec codec) {
        this.family = family;
        this.listener = listener;
        this.codec = codec;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        log.info("Signaling socket open family={} session={}", family, session.getId());
    }

    /**
     * Decodifica el mensaje y lo entrega al receptor. Los mensajes ilegibles se descartan.
     *
     * @param session Sesión WebSocket.
     * @param message Mensaje de texto recibido.
     */
    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        MDC.put("family", family.name());
        try {
            String payload = message.getPayload();
            if (payload.isBlank()) {
                log.debug("Empty signaling message on {}", family);
                return;
            }
            SignalingMessage msg = codec.read(payload);
            listener.onMessage(msg);
        } catch (Exception ex) {
            log.warn("Signaling message dropped on {}: {}", family, ex.getMessage());
        } finally {
            MDC.clear();
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("Signaling transport error family={}", family, exception);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        log.info("Signaling socket closed family={} status={}", family, status);
        listener.onClosed();
    }
}
