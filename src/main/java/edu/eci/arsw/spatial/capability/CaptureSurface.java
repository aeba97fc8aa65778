package edu.eci.arsw.spatial.capability;

import java.awt.image.BufferedImage;
import java.util.Optional;

/**
 * Cámara enlazada de la que se toma un cuadro por cada tick del bucle de envío.
 */
public interface CaptureSurface extends LocalMedia {

    /**
     * Captura el cuadro actual.
     *
     * @return La imagen, o vacío si la fuente aún no tiene dimensiones válidas.
     */
    Optional<BufferedImage> capture();
}
