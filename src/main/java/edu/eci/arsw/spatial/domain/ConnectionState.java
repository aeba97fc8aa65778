package edu.eci.arsw.spatial.domain;

/**
 * Instantánea del estado de conexión expuesta a la capa de presentación.
 */
public record ConnectionState(boolean connected,
                              boolean sendingAudio,
                              boolean listeningAudio,
                              boolean sendingVideo,
                              boolean viewingVideo,
                              String clientId) {
}
