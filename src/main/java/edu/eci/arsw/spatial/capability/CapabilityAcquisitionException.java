package edu.eci.arsw.spatial.capability;

import edu.eci.arsw.spatial.domain.LegKind;

/**
 * Falla al adquirir medios, enlace o señalización durante el arranque de una pata.
 */
public class CapabilityAcquisitionException extends RuntimeException {

    private final LegKind leg;

    public CapabilityAcquisitionException(LegKind leg, Throwable cause) {
        super("Failed to start " + leg + ": " + (cause == null || cause.getMessage() == null
                ? "no message" : cause.getMessage()), cause);
        this.leg = leg;
    }

    public LegKind getLeg() {
        return leg;
    }
}
