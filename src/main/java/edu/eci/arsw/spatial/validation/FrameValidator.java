package edu.eci.arsw.spatial.validation;

import edu.eci.arsw.spatial.codec.VideoFrameEnvelope;
import edu.eci.arsw.spatial.domain.SessionConfig;

import java.util.Optional;

/**
 * Validación semántica de cuadros recibidos. El primer chequeo que falla gana;
 * un rechazo solo significa "descartar y conservar el último cuadro bueno".
 */
public final class FrameValidator {

    private static final double NANOS_PER_MILLI = 1_000_000.0;

    private FrameValidator() {
    }

    /**
     * Valida frescura, firma del contenedor y dimensiones declaradas.
     *
     * @param frame     Cuadro ya decodificado.
     * @param config    Configuración de la sesión.
     * @param nowNanos  Hora actual en nanosegundos desde epoch.
     * @return Aceptado o el motivo del rechazo.
     */
    public static ValidationResult validate(VideoFrameEnvelope frame, SessionConfig config, long nowNanos) {
        // la marca viaja como u64: una marca posterior a ahora no está vencida
        long captured = frame.captureTimestampNanos();
        if (Long.compareUnsigned(captured, nowNanos) < 0) {
            double ageMs = (nowNanos - captured) / NANOS_PER_MILLI;
            if (ageMs > config.getStaleFrameThresholdMs()) {
                return ValidationResult.reject(RejectReason.STALE);
            }
        }
        byte[] payload = frame.payload();
        if (!JpegDimensionParser.hasJpegMagic(payload)) {
            return ValidationResult.reject(RejectReason.NOT_AN_IMAGE);
        }
        Optional<JpegDimensionParser.Dimensions> dims = JpegDimensionParser.parse(payload);
        if (dims.isEmpty()) {
            return ValidationResult.reject(RejectReason.UNPARSEABLE_CONTAINER);
        }
        if (dims.get().width() != config.getVideoWidth() || dims.get().height() != config.getVideoHeight()) {
            return ValidationResult.reject(RejectReason.DIMENSION_MISMATCH);
        }
        return ValidationResult.ok();
    }
}
