package roadwatch.detection.engine;

import roadwatch.domain.accident.PhaseTransition;
import roadwatch.domain.event.AccidentEvent;
import roadwatch.domain.snapshot.TrafficSnapshot;

import java.util.List;

/**
 * Salida de un tick: la instantánea se publica primero y después los eventos, en orden.
 *
 * @param snapshot        Estado de todas las entidades tras el tick.
 * @param events          Eventos de ciclo de vida (incluidos los de órdenes drenadas en este tick).
 * @param transitions     Transiciones de fase del tick.
 * @param rejectedSamples Muestras descartadas por mal formadas.
 */
public record TickResult(
        TrafficSnapshot snapshot,
        List<AccidentEvent> events,
        List<PhaseTransition> transitions,
        int rejectedSamples
) {

    public TickResult {
        events = List.copyOf(events);
        transitions = List.copyOf(transitions);
    }
}
