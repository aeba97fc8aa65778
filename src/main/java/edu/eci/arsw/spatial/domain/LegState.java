package edu.eci.arsw.spatial.domain;

public enum LegState {
    IDLE,
    STARTING,
    ACTIVE,
    STOPPING;

    /**
     * Una pata "pedida" es la que está arrancando o ya activa.
     */
    public boolean isRequested() {
        return this == STARTING || this == ACTIVE;
    }
}
