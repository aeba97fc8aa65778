package edu.eci.arsw.spatial.signaling;

import edu.eci.arsw.spatial.domain.ChannelFamily;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.client.WebSocketClient;

import java.util.concurrent.CompletableFuture;

/**
 * Transporte de señalización sobre WebSocket: {@code <serverUrl>/webrtc-audio} y {@code <serverUrl>/webrtc-video}.
 */
public class WebSocketSignalingTransport implements SignalingTransport {
    private static final Logger log = LoggerFactory.getLogger(WebSocketSignalingTransport.class);

    private final WebSocketClient client;
    private final String serverUrl;
    private final SignalingCodec codec;

    public WebSocketSignalingTransport(WebSocketClient client, String serverUrl, SignalingCodec codec) {
        this.client = client;
        this.serverUrl = serverUrl.endsWith("/") ? serverUrl.substring(0, serverUrl.length() - 1) : serverUrl;
        this.codec = codec;
    }

    /**
     * Abre el socket de la familia indicada.
     *
     * @param family   Familia de canal.
     * @param listener Receptor de mensajes entrantes.
     * @return Futuro con la conexión abierta.
     */
    @Override
    public CompletableFuture<SignalingConnection> connect(ChannelFamily family, SignalingListener listener) {
        String url = endpoint(family);
        log.info("Opening signaling socket {}", url);
        SignalingSocketHandler handler = new SignalingSocketHandler(family, listener, codec);
        return client.execute(handler, url)
                .thenApply(session -> new WebSocketSignalingConnection(session, codec));
    }

    public String endpoint(ChannelFamily family) {
        return serverUrl + family.path();
    }
}
