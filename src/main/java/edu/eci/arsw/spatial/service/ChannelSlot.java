package edu.eci.arsw.spatial.service;

import edu.eci.arsw.spatial.capability.DataChannel;
import edu.eci.arsw.spatial.capability.PeerLink;
import edu.eci.arsw.spatial.domain.ChannelFamily;
import edu.eci.arsw.spatial.signaling.SignalingConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * Recursos de una familia de canal: socket de señalización, enlace y canal de datos.
 * Cada cierre avanza la generación, lo que invalida cualquier reconstrucción en curso.
 */
class ChannelSlot {
    private static final Logger log = LoggerFactory.getLogger(ChannelSlot.class);

    private final ChannelFamily family;
    private long generation;
    private SignalingConnection signaling;
    private PeerLink peerLink;
    private DataChannel dataChannel;
    private CompletableFuture<Void> rebuild = CompletableFuture.completedFuture(null);

    ChannelSlot(ChannelFamily family) {
        this.family = family;
    }

    ChannelFamily family() {
        return family;
    }

    long generation() {
        return generation;
    }

    boolean isGeneration(long expected) {
        return generation == expected;
    }

    SignalingConnection signaling() {
        return signaling;
    }

    void signaling(SignalingConnection signaling) {
        this.signaling = signaling;
    }

    PeerLink peerLink() {
        return peerLink;
    }

    void peerLink(PeerLink peerLink) {
        this.peerLink = peerLink;
    }

    DataChannel dataChannel() {
        return dataChannel;
    }

    void dataChannel(DataChannel dataChannel) {
        this.dataChannel = dataChannel;
    }

    CompletableFuture<Void> rebuild() {
        return rebuild;
    }

    void rebuild(CompletableFuture<Void> rebuild) {
        this.rebuild = rebuild;
    }

    boolean isSignalingOpen() {
        return signaling != null && signaling.isOpen();
    }

    boolean isDataChannelOpen() {
        return dataChannel != null && dataChannel.isOpen();
    }

    boolean isEmpty() {
        return signaling == null && peerLink == null && dataChannel == null;
    }

    /**
     * Cierra y suelta todos los recursos y avanza la generación.
     */
    void close() {
        generation++;
        if (dataChannel != null) {
            closeQuietly("data channel", dataChannel::close);
            dataChannel = null;
        }
        if (peerLink != null) {
            closeQuietly("peer link", peerLink::close);
            peerLink = null;
        }
        if (signaling != null) {
            closeQuietly("signaling socket", signaling::close);
            signaling = null;
        }
    }

    private void closeQuietly(String what, Runnable close) {
        try {
            close.run();
            log.info("Closed {} {}", family, what);
        } catch (RuntimeException e) {
            log.warn("Closing {} {} failed: {}", family, what, e.toString());
        }
    }
}
