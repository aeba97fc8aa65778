package edu.eci.arsw.spatial.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import edu.eci.arsw.spatial.domain.ChannelFamily;
import edu.eci.arsw.spatial.signaling.SignalingCodec;
import edu.eci.arsw.spatial.signaling.SignalingTransport;
import edu.eci.arsw.spatial.signaling.WebSocketSignalingTransport;
import jakarta.websocket.WebSocketContainer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.support.StaticListableBeanFactory;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Pruebas de WebSocketClientConfig.
 */
class WebSocketClientConfigTest {

    private WebSocketClientConfig config;

    @BeforeEach
    void setUp() {
        config = new WebSocketClientConfig();

        ReflectionTestUtils.setField(config, "maxMessageSize", 1024);
        ReflectionTestUtils.setField(config, "idleTimeout", 60L);
        ReflectionTestUtils.setField(config, "serverUrl", "ws://signal:9090");
    }

    @Test
    void rtcWebSocketContainer_deberiaConfigurarTamanosYTimeout() {
        WebSocketContainer c = config.rtcWebSocketContainer();

        assertEquals(1024, c.getDefaultMaxTextMessageBufferSize());
        assertEquals(1024, c.getDefaultMaxBinaryMessageBufferSize());
        assertEquals(60_000L, c.getDefaultMaxSessionIdleTimeout());
    }

    @Test
    void rtcWebSocketClient_deberiaUsarElContenedor() {
        WebSocketContainer container = mock(WebSocketContainer.class);

        WebSocketClient client = config.rtcWebSocketClient(container);

        assertInstanceOf(StandardWebSocketClient.class, client);
    }

    @Test
    void signalingCodec_deberiaUsarObjectMapperDisponible() {
        StaticListableBeanFactory beans = new StaticListableBeanFactory();
        beans.addBean("objectMapper", new ObjectMapper());

        assertNotNull(config.signalingCodec(beans.getBeanProvider(ObjectMapper.class)));
        assertNotNull(config.signalingCodec(new StaticListableBeanFactory().getBeanProvider(ObjectMapper.class)));
    }

    @Test
    void signalingTransport_deberiaApuntarAlServidorConfigurado() {
        SignalingTransport transport = config.signalingTransport(mock(WebSocketClient.class), new SignalingCodec());

        WebSocketSignalingTransport ws = assertInstanceOf(WebSocketSignalingTransport.class, transport);
        assertEquals("ws://signal:9090/webrtc-video", ws.endpoint(ChannelFamily.VIDEO));
    }
}
