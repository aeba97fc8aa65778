package edu.eci.arsw.spatial.validation;

import java.util.Optional;

/**
 * Lee ancho y alto de un JPEG recorriendo sus segmentos hasta el primer
 * marcador SOF, sin decodificar la imagen.
 */
public final class JpegDimensionParser {

    /** Marcador SOI que abre todo JPEG. */
    public static final int SOI_FIRST = 0xFF;
    public static final int SOI_SECOND = 0xD8;

    private JpegDimensionParser() {
    }

    /**
     * Dimensiones declaradas en la cabecera del cuadro.
     *
     * @param width  Ancho en píxeles.
     * @param height Alto en píxeles.
     */
    public record Dimensions(int width, int height) {
    }

    public static boolean hasJpegMagic(byte[] data) {
        return data.length >= 2 && (data[0] & 0xFF) == SOI_FIRST && (data[1] & 0xFF) == SOI_SECOND;
    }

    /**
     * Busca el primer segmento SOF y lee sus campos de alto y ancho.
     *
     * @param data Bytes del contenedor, empezando por SOI.
     * @return Las dimensiones, o vacío si no se encontró un SOF completo.
     */
    public static Optional<Dimensions> parse(byte[] data) {
        int offset = 2;
        while (offset < data.length - 1) {
            if ((data[offset] & 0xFF) != 0xFF || (data[offset + 1] & 0xFF) == 0x00) {
                offset++;
                continue;
            }
            int marker = data[offset + 1] & 0xFF;
            if (isStartOfFrame(marker)) {
                if (offset + 8 < data.length) {
                    int height = ((data[offset + 5] & 0xFF) << 8) | (data[offset + 6] & 0xFF);
                    int width = ((data[offset + 7] & 0xFF) << 8) | (data[offset + 8] & 0xFF);
                    return Optional.of(new Dimensions(width, height));
                }
                return Optional.empty();
            }
            if (isStandalone(marker)) {
                offset += 2;
                continue;
            }
            if (offset + 3 >= data.length) {
                break;
            }
            int length = ((data[offset + 2] & 0xFF) << 8) | (data[offset + 3] & 0xFF);
            offset += 2 + length;
        }
        return Optional.empty();
    }

    // SOF0..SOF15 salvo DHT (C4), JPG (C8) y DAC (CC)
    private static boolean isStartOfFrame(int marker) {
        return marker >= 0xC0 && marker <= 0xCF && marker != 0xC4 && marker != 0xC8 && marker != 0xCC;
    }

    private static boolean isStandalone(int marker) {
        return marker == 0x01 || marker == 0xFF || (marker >= 0xD0 && marker <= 0xD9);
    }
}
