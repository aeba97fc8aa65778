package edu.eci.arsw.spatial.capability;

/**
 * Eventos del enlace WebRTC. Pueden llegar desde cualquier hilo.
 */
public interface PeerLinkListener {

    /**
     * @param candidateJson Candidato ICE local serializado.
     */
    void onLocalCandidate(String candidateJson);

    void onRemoteAudioTrack(RemoteAudioTrack track);

    void onConnectionFailed(Throwable cause);
}
