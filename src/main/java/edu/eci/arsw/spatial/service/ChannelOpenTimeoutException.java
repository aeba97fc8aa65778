package edu.eci.arsw.spatial.service;

import edu.eci.arsw.spatial.domain.LegKind;

/**
 * El canal de datos no abrió dentro de la espera acotada.
 */
public class ChannelOpenTimeoutException extends RuntimeException {

    private final LegKind leg;

    public ChannelOpenTimeoutException(LegKind leg, long timeoutMs) {
        super("Video data channel failed to open within " + timeoutMs + " ms (" + leg + ")");
        this.leg = leg;
    }

    public LegKind getLeg() {
        return leg;
    }
}
