package edu.eci.arsw.spatial.cache;

/**
 * Implementación por defecto: conserva los bytes JPEG en memoria.
 */
public class ByteArrayFrameHandle implements FrameHandle {

    private final String participantId;
    private volatile byte[] data;

    public ByteArrayFrameHandle(String participantId, byte[] data) {
        this.participantId = participantId;
        this.data = data;
    }

    public String getParticipantId() {
        return participantId;
    }

    @Override
    public byte[] bytes() {
        byte[] current = data;
        if (current == null) {
            throw new IllegalStateException("Frame handle for " + participantId + " already released");
        }
        return current.clone();
    }

    @Override
    public void release() {
        data = null;
    }

    @Override
    public boolean isReleased() {
        return data == null;
    }
}
