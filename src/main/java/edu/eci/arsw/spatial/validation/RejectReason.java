package edu.eci.arsw.spatial.validation;

public enum RejectReason {
    STALE,
    NOT_AN_IMAGE,
    DIMENSION_MISMATCH,
    UNPARSEABLE_CONTAINER
}
