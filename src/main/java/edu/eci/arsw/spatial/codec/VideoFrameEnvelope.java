package edu.eci.arsw.spatial.codec;

import java.util.Arrays;
import java.util.Objects;

/**
 * Un cuadro de video con su cabecera de identidad, marca de tiempo y secuencia.
 *
 * @param participantId         Identidad del emisor.
 * @param captureTimestampNanos Momento de captura en nanosegundos desde epoch.
 * @param sequenceNumber        Número de secuencia sin signo de 32 bits.
 * @param payload               Bytes del contenedor de imagen.
 */
public record VideoFrameEnvelope(String participantId,
                                 long captureTimestampNanos,
                                 long sequenceNumber,
                                 byte[] payload) {

    public VideoFrameEnvelope {
        Objects.requireNonNull(participantId, "participantId");
        Objects.requireNonNull(payload, "payload");
        if (sequenceNumber < 0 || sequenceNumber > 0xFFFFFFFFL) {
            throw new IllegalArgumentException("sequenceNumber out of u32 range: " + sequenceNumber);
        }
        payload = payload.clone();
    }

    @Override
    public byte[] payload() {
        return payload.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof VideoFrameEnvelope other)) {
            return false;
        }
        return captureTimestampNanos == other.captureTimestampNanos
                && sequenceNumber == other.sequenceNumber
                && participantId.equals(other.participantId)
                && Arrays.equals(payload, other.payload);
    }

    @Override
    public int hashCode() {
        int h = Objects.hash(participantId, captureTimestampNanos, sequenceNumber);
        return 31 * h + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "VideoFrameEnvelope{participantId=" + participantId
                + ", captureTimestampNanos=" + captureTimestampNanos
                + ", sequenceNumber=" + sequenceNumber
                + ", payloadBytes=" + payload.length + "}";
    }
}
