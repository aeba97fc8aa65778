package edu.eci.arsw.spatial.capability;

/**
 * Canal de datos del enlace de video.
 */
public interface DataChannel {

    boolean isOpen();

    void send(byte[] data);

    void send(String text);

    void close();
}
