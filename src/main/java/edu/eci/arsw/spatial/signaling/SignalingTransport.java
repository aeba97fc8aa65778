package edu.eci.arsw.spatial.signaling;

import edu.eci.arsw.spatial.domain.ChannelFamily;

import java.util.concurrent.CompletableFuture;

/**
 * Abre sockets de señalización, uno por familia de canal.
 */
public interface SignalingTransport {

    CompletableFuture<SignalingConnection> connect(ChannelFamily family, SignalingListener listener);
}
