package edu.eci.arsw.spatial.signaling;

import edu.eci.arsw.spatial.domain.ChannelFamily;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class WebSocketSignalingTransportTest {

    @Test
    void endpoint_deberiaConcatenarRutaDeFamilia_sinDobleBarra() {
        WebSocketSignalingTransport transport =
                new WebSocketSignalingTransport(mock(WebSocketClient.class), "ws://host:9090/", new SignalingCodec());

        assertEquals("ws://host:9090/webrtc-audio", transport.endpoint(ChannelFamily.AUDIO));
        assertEquals("ws://host:9090/webrtc-video", transport.endpoint(ChannelFamily.VIDEO));
    }

    @Test
    void connect_deberiaAbrirSocketYEnviarMensajes_casoFeliz1() throws Exception {
        WebSocketClient client = mock(WebSocketClient.class);
        WebSocketSession session = mock(WebSocketSession.class);
        when(session.isOpen()).thenReturn(true);
        when(client.execute(any(WebSocketHandler.class), eq("ws://host/webrtc-video")))
                .thenReturn(CompletableFuture.completedFuture(session));
        WebSocketSignalingTransport transport =
                new WebSocketSignalingTransport(client, "ws://host", new SignalingCodec());

        SignalingConnection connection = transport.connect(ChannelFamily.VIDEO, mock(SignalingListener.class)).get();
        connection.send(SignalingMessage.offer("c1", "v=0"));

        assertTrue(connection.isOpen());
        ArgumentCaptor<TextMessage> sent = ArgumentCaptor.forClass(TextMessage.class);
        verify(session).sendMessage(sent.capture());
        assertTrue(sent.getValue().getPayload().contains("\"type\":\"offer\""));
    }

    @Test
    void connect_deberiaEntregarMensajesEntrantesAlListener() throws Exception {
        WebSocketClient client = mock(WebSocketClient.class);
        when(client.execute(any(WebSocketHandler.class), eq("ws://host/webrtc-audio")))
                .thenReturn(CompletableFuture.completedFuture(mock(WebSocketSession.class)));
        SignalingListener listener = mock(SignalingListener.class);
        WebSocketSignalingTransport transport =
                new WebSocketSignalingTransport(client, "ws://host", new SignalingCodec());

        transport.connect(ChannelFamily.AUDIO, listener).get();

        ArgumentCaptor<WebSocketHandler> handler = ArgumentCaptor.forClass(WebSocketHandler.class);
        verify(client).execute(handler.capture(), eq("ws://host/webrtc-audio"));
        handler.getValue().handleMessage(mock(WebSocketSession.class), new TextMessage("{\"type\":\"answer\"}"));
        verify(listener).onMessage(any(SignalingMessage.class));
    }

    @Test
    void send_deberiaFallar_cuandoSocketCerrado() {
        WebSocketSession session = mock(WebSocketSession.class);
        when(session.isOpen()).thenReturn(false);
        when(session.getId()).thenReturn("WS9");
        WebSocketSignalingConnection connection = new WebSocketSignalingConnection(session, new SignalingCodec());

        assertThrows(IOException.class, () -> connection.send(SignalingMessage.stopSending("c1")));
    }

    @Test
    void close_deberiaCerrarConStatusNormal() throws Exception {
        WebSocketSession session = mock(WebSocketSession.class);
        when(session.isOpen()).thenReturn(true);
        WebSocketSignalingConnection connection = new WebSocketSignalingConnection(session, new SignalingCodec());

        connection.close();

        verify(session).close(CloseStatus.NORMAL);
    }

    @Test
    void close_noDeberiaPropagarIOException() throws Exception {
        WebSocketSession session = mock(WebSocketSession.class);
        when(session.isOpen()).thenReturn(true);
        when(session.getId()).thenReturn("WS2");
        doThrow(new IOException("broken pipe")).when(session).close(CloseStatus.NORMAL);
        WebSocketSignalingConnection connection = new WebSocketSignalingConnection(session, new SignalingCodec());

        assertDoesNotThrow(connection::close);
    }
}
