package roadwatch.detection.lifecycle;

import roadwatch.domain.traffic.GeoPoint;

/**
 * Vista que el ciclo de vida necesita de una entidad monitorizada.
 */
public interface TrackedEntity {

    String getEntityId();

    AccidentLifecycle getLifecycle();

    /**
     * Última posición conocida, o {@code null} si la fuente no informa posiciones.
     */
    GeoPoint getLastLocation();

    /**
     * Reinicia los acumuladores de todos los detectores de la entidad.
     */
    void resetAccumulators();
}
