package edu.eci.arsw.spatial.capability;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.Optional;

/**
 * Comprime un cuadro capturado a un contenedor de imagen.
 */
public interface ImageEncoder {

    /**
     * @param image   Cuadro capturado.
     * @param width   Ancho de salida.
     * @param height  Alto de salida.
     * @param quality Calidad en (0, 1].
     * @return Bytes del contenedor, o vacío si el codificador no produjo salida.
     * @throws IOException Si la escritura falla.
     */
    Optional<byte[]> encode(BufferedImage image, int width, int height, double quality) throws IOException;
}
