package edu.eci.arsw.spatial.capability;

/**
 * Salida de audio enlazada por la capa de presentación.
 */
public interface AudioOutput {

    void play(RemoteAudioTrack track, double volume);

    void stop();
}
