package edu.eci.arsw.spatial.capability;

/**
 * Eventos del canal de datos. Pueden llegar desde cualquier hilo del transporte.
 */
public interface DataChannelListener {

    void onOpen();

    void onClose();

    void onBinary(byte[] data);

    void onText(String text);
}
