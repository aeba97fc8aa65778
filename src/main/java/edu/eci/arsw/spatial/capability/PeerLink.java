package edu.eci.arsw.spatial.capability;

import java.util.concurrent.CompletableFuture;

/**
 * Enlace WebRTC de una familia de canal. La negociación ICE/SDP queda del lado de la implementación.
 */
public interface PeerLink {

    void addLocalMedia(LocalMedia media);

    void removeLocalMedia(LocalMedia media);

    /**
     * Crea la oferta y la fija como descripción local.
     *
     * @param receiveAudio Si la oferta pide recibir audio.
     * @return SDP de la oferta.
     */
    CompletableFuture<String> createOffer(boolean receiveAudio);

    CompletableFuture<Void> applyAnswer(String sdp);

    CompletableFuture<Void> addRemoteCandidate(String candidateJson);

    boolean hasRemoteDescription();

    /**
     * Crea un canal de datos; debe llamarse antes de la oferta para que quede incluido.
     *
     * @param label          Etiqueta del canal.
     * @param ordered        Entrega ordenada.
     * @param maxRetransmits Reintentos máximos, 0 para tiempo real.
     * @param listener       Receptor de eventos del canal.
     * @return El canal, todavía sin abrir.
     */
    DataChannel createDataChannel(String label, boolean ordered, int maxRetransmits, DataChannelListener listener);

    void close();
}
