package roadwatch.domain.dto.control;

import roadwatch.domain.accident.AccidentRecord;

import java.time.Duration;

public record InjectionResult(
        Status status,
        String entityId,
        AccidentRecord record,
        Duration duration
) {

    public static InjectionResult injected(AccidentRecord record, Duration duration) {
        return new InjectionResult(Status.INJECTED, record.entityId(), record, duration);
    }

    public static InjectionResult alreadyActive(AccidentRecord existing) {
        return new InjectionResult(Status.ALREADY_ACTIVE, existing.entityId(), existing, null);
    }

    public static InjectionResult unknownEntity(String entityId) {
        return new InjectionResult(Status.UNKNOWN_ENTITY, entityId, null, null);
    }

    public static InjectionResult noEntityAvailable() {
        return new InjectionResult(Status.NO_ENTITY_AVAILABLE, null, null, null);
    }

    public enum Status {
        INJECTED,
        /**
         * La entidad ya tenía un registro activo: se devuelve sin cambios.
         */
        ALREADY_ACTIVE,
        /**
         * Se nombró una entidad que el motor todavía no ha visto.
         */
        UNKNOWN_ENTITY,
        NO_ENTITY_AVAILABLE
    }
}
