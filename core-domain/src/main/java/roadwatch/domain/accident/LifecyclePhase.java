package roadwatch.domain.accident;

import java.util.EnumSet;
import java.util.Set;

/**
 * Fases del ciclo de vida de un episodio por entidad.
 * <p>
 * Orden de un registro: NORMAL → SUSPECTED → CONFIRMED → CLEARING → CLEARED → NORMAL.
 * Además, una sospecha puede descartarse (SUSPECTED → NORMAL) antes de abrir registro,
 * y un despeje puede abortarse si la anomalía vuelve (CLEARING → CONFIRMED).
 */
public enum LifecyclePhase {
    NORMAL,
    SUSPECTED,
    CONFIRMED,
    CLEARING,
    CLEARED;

    public Set<LifecyclePhase> allowedNext() {
        return switch (this) {
            case NORMAL -> EnumSet.of(SUSPECTED);
            case SUSPECTED -> EnumSet.of(NORMAL, CONFIRMED);
            case CONFIRMED -> EnumSet.of(CLEARING);
            case CLEARING -> EnumSet.of(CONFIRMED, CLEARED);
            case CLEARED -> EnumSet.of(NORMAL);
        };
    }

    public boolean canTransitionTo(LifecyclePhase next) {
        return allowedNext().contains(next);
    }

    /**
     * Fases en las que la entidad tiene un registro ACTIVE abierto.
     */
    public boolean hasActiveRecord() {
        return this == CONFIRMED || this == CLEARING;
    }
}
