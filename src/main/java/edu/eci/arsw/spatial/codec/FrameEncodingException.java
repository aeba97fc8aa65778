package edu.eci.arsw.spatial.codec;

/**
 * Error de programación en el camino de envío: la identidad no cabe en la cabecera.
 */
public class FrameEncodingException extends IllegalArgumentException {

    public FrameEncodingException(String message) {
        super(message);
    }
}
