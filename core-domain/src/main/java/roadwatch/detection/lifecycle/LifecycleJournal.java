package roadwatch.detection.lifecycle;

import roadwatch.domain.accident.PhaseTransition;
import roadwatch.domain.event.AccidentEvent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Bitácora de un tick: transiciones de fase y eventos en el orden en que ocurrieron.
 * El motor crea una por tick y la publica tras la instantánea.
 */
public class LifecycleJournal {

    private final List<PhaseTransition> transitions = new ArrayList<>();
    private final List<AccidentEvent> events = new ArrayList<>();

    void record(PhaseTransition transition) {
        transitions.add(transition);
    }

    void emit(AccidentEvent event) {
        events.add(event);
    }

    public List<PhaseTransition> getTransitions() {
        return Collections.unmodifiableList(transitions);
    }

    public List<AccidentEvent> getEvents() {
        return Collections.unmodifiableList(events);
    }

    public boolean isEmpty() {
        return transitions.isEmpty() && events.isEmpty();
    }
}
