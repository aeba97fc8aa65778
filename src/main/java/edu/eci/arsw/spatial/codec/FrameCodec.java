package edu.eci.arsw.spatial.codec;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * Serializa cuadros de video al sobre binario big-endian:
 * {@code u32 idLen | id | u64 timestamp | u32 seq | payload}.
 */
public final class FrameCodec {

    public static final int MAX_IDENTITY_BYTES = 1000;
    public static final int MIN_FRAME_BYTES = 20;

    private static final int LENGTH_BYTES = 4;
    private static final int TIMESTAMP_BYTES = 8;
    private static final int SEQUENCE_BYTES = 4;
    private static final int FIXED_HEADER_BYTES = LENGTH_BYTES + TIMESTAMP_BYTES + SEQUENCE_BYTES;

    private FrameCodec() {
    }

    /**
     * Codifica un cuadro.
     *
     * @param participantId         Identidad del emisor.
     * @param captureTimestampNanos Momento de captura en nanosegundos.
     * @param sequenceNumber        Secuencia; se escriben sus 32 bits bajos.
     * @param payload               Bytes del contenedor de imagen.
     * @return Mensaje listo para el canal de datos.
     * @throws FrameEncodingException Si la identidad supera {@value #MAX_IDENTITY_BYTES} bytes.
     */
    public static byte[] encode(String participantId, long captureTimestampNanos, long sequenceNumber, byte[] payload) {
        byte[] id = identityBytes(participantId);
        ByteBuffer buffer = ByteBuffer.allocate(FIXED_HEADER_BYTES + id.length + payload.length);
        buffer.putInt(id.length);
        buffer.put(id);
        buffer.putLong(captureTimestampNanos);
        buffer.putInt((int) sequenceNumber);
        buffer.put(payload);
        return buffer.array();
    }

    /**
     * Decodifica un mensaje binario recibido.
     *
     * @param message Bytes del canal de datos.
     * @return El sobre reconstruido.
     * @throws FrameDecodeException Si el mensaje está truncado o mal formado.
     */
    public static VideoFrameEnvelope decode(byte[] message) throws FrameDecodeException {
        if (message == null || message.length < MIN_FRAME_BYTES) {
            throw new FrameDecodeException(DecodeError.TRUNCATED, "Frame message shorter than "
                    + MIN_FRAME_BYTES + " bytes");
        }
        ByteBuffer buffer = ByteBuffer.wrap(message);
        long idLength = Integer.toUnsignedLong(buffer.getInt());
        if (idLength == 0 || idLength > MAX_IDENTITY_BYTES || FIXED_HEADER_BYTES + idLength > message.length) {
            throw new FrameDecodeException(DecodeError.INVALID_IDENTITY_LENGTH,
                    "Invalid identity length " + idLength + " for message of " + message.length + " bytes");
        }
        byte[] id = new byte[(int) idLength];
        buffer.get(id);
        String participantId = new String(id, StandardCharsets.UTF_8);
        if (participantId.isBlank()) {
            throw new FrameDecodeException(DecodeError.EMPTY_IDENTITY, "Blank participant identity");
        }
        long timestamp = buffer.getLong();
        long sequence = Integer.toUnsignedLong(buffer.getInt());
        if (!buffer.hasRemaining()) {
            throw new FrameDecodeException(DecodeError.EMPTY_PAYLOAD, "Frame without payload from " + participantId);
        }
        byte[] payload = new byte[buffer.remaining()];
        buffer.get(payload);
        return new VideoFrameEnvelope(participantId, timestamp, sequence, payload);
    }

    /**
     * Verifica que una identidad pueda viajar en la cabecera.
     *
     * @param participantId Identidad a validar.
     * @throws FrameEncodingException Si es vacía o demasiado larga.
     */
    public static void requireEncodableIdentity(String participantId) {
        if (participantId == null || participantId.isBlank()) {
            throw new FrameEncodingException("Participant identity is required");
        }
        identityBytes(participantId);
    }

    private static byte[] identityBytes(String participantId) {
        byte[] id = participantId.getBytes(StandardCharsets.UTF_8);
        if (id.length > MAX_IDENTITY_BYTES) {
            throw new FrameEncodingException("Participant identity is " + id.length
                    + " bytes, max " + MAX_IDENTITY_BYTES);
        }
        return id;
    }
}
