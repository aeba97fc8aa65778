package edu.eci.arsw.spatial.validation;

/**
 * Resultado de validar un cuadro recibido.
 *
 * @param accepted Indica si el cuadro puede entrar a la caché.
 * @param reason   Motivo del rechazo, null si fue aceptado.
 */
public record ValidationResult(boolean accepted, RejectReason reason) {

    private static final ValidationResult OK = new ValidationResult(true, null);

    public static ValidationResult ok() {
        return OK;
    }

    public static ValidationResult reject(RejectReason reason) {
        return new ValidationResult(false, reason);
    }
}
