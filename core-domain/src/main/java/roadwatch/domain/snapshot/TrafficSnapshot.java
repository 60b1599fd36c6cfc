package roadwatch.domain.snapshot;

import roadwatch.domain.accident.AccidentRecord;

import java.time.Instant;
import java.util.List;

/**
 * Mensaje agregado de un tick: estado de todas las entidades conocidas y accidentes activos.
 * Es una copia: no contiene referencias al estado vivo del motor.
 */
public record TrafficSnapshot(
        Instant timestamp,
        List<EntitySnapshot> entities,
        List<AccidentRecord> activeAccidents
) {

    public TrafficSnapshot {
        entities = List.copyOf(entities);
        activeAccidents = List.copyOf(activeAccidents);
    }
}
