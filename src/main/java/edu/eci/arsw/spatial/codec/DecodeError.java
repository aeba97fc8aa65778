package edu.eci.arsw.spatial.codec;

/**
 * Motivos por los que un mensaje binario no es un cuadro válido.
 */
public enum DecodeError {
    TRUNCATED,
    INVALID_IDENTITY_LENGTH,
    EMPTY_IDENTITY,
    EMPTY_PAYLOAD
}
