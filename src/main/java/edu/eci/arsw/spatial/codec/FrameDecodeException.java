package edu.eci.arsw.spatial.codec;

/**
 * Indica que los bytes recibidos no forman un sobre de cuadro válido.
 */
public class FrameDecodeException extends Exception {

    private final DecodeError error;

    public FrameDecodeException(DecodeError error, String message) {
        super(message);
        this.error = error;
    }

    public DecodeError getError() {
        return error;
    }
}
