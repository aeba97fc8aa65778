package edu.eci.arsw.spatial.capability;

/**
 * Medio local adquirido (micrófono o cámara). Quien lo adquiere es dueño de liberarlo.
 */
public interface LocalMedia {

    void release();
}
