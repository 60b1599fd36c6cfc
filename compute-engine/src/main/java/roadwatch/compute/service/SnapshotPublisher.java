package roadwatch.compute.service;

import roadwatch.domain.dto.control.StreamStatusDTO;
import roadwatch.domain.event.AccidentEvent;
import roadwatch.domain.snapshot.TrafficSnapshot;

import java.util.List;

/**
 * Canal de salida del flujo. Las implementaciones no deben bloquear al llamante.
 */
public interface SnapshotPublisher {

    /**
     * Publica la instantánea de un tick y, después, sus eventos en orden.
     */
    void publishTick(TrafficSnapshot snapshot, List<AccidentEvent> events);

    /**
     * Eventos producidos por órdenes aplicadas con el flujo detenido.
     */
    void publishEvents(List<AccidentEvent> events);

    void publishStatus(StreamStatusDTO status);
}
