package edu.eci.arsw.spatial.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import edu.eci.arsw.spatial.signaling.SignalingCodec;
import edu.eci.arsw.spatial.signaling.SignalingTransport;
import edu.eci.arsw.spatial.signaling.WebSocketSignalingTransport;
import jakarta.websocket.ContainerProvider;
import jakarta.websocket.WebSocketContainer;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;

/**
 * Configuración del cliente WebSocket usado para los sockets de señalización.
 */
@AutoConfiguration
public class WebSocketClientConfig {

    @Value("${spatial.rtc.ws.max-message-size:65536}")
    private int maxMessageSize;
    @Value("${spatial.rtc.ws.idle-timeout-seconds:30}")
    private long idleTimeout;
    @Value("${spatial.rtc.server-url:ws://localhost:9090}")
    private String serverUrl;

    /**
     * Configura el contenedor de WebSocket con tamaños de mensajes y tiempos de
     * espera.
     *
     * @return Contenedor JSR-356 configurado.
     */
    @Bean
    @ConditionalOnMissingBean
    public WebSocketContainer rtcWebSocketContainer() {
        WebSocketContainer c = ContainerProvider.getWebSocketContainer();
        c.setDefaultMaxTextMessageBufferSize(maxMessageSize);
        c.setDefaultMaxBinaryMessageBufferSize(maxMessageSize);
        c.setDefaultMaxSessionIdleTimeout(idleTimeout * 1000L);
        return c;
    }

    @Bean
    @ConditionalOnMissingBean
    public WebSocketClient rtcWebSocketClient(WebSocketContainer container) {
        return new StandardWebSocketClient(container);
    }

    @Bean
    @ConditionalOnMissingBean
    public SignalingCodec signalingCodec(ObjectProvider<ObjectMapper> mapper) {
        return new SignalingCodec(mapper.getIfAvailable(ObjectMapper::new));
    }

    /**
     * Transporte de señalización hacia {@code spatial.rtc.server-url}.
     *
     * @param client Cliente WebSocket.
     * @param codec  Codificador de mensajes.
     * @return Transporte de señalización.
     */
    @Bean
    @ConditionalOnMissingBean
    public SignalingTransport signalingTransport(WebSocketClient client, SignalingCodec codec) {
        return new WebSocketSignalingTransport(client, serverUrl, codec);
    }
}
