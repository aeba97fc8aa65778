package edu.eci.arsw.spatial.capability;

/**
 * Pista de audio mezclado recibida del servidor.
 */
public interface RemoteAudioTrack {

    String id();
}
