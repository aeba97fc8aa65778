package edu.eci.arsw.spatial.cache;

/**
 * Recurso opaco que representa un cuadro listo para mostrar. La caché lo
 * libera cuando el cuadro es reemplazado, expulsado o eliminado.
 */
public interface FrameHandle {

    /**
     * Bytes del contenedor de imagen.
     *
     * @throws IllegalStateException Si el recurso ya fue liberado.
     */
    byte[] bytes();

    void release();

    boolean isReleased();
}
