package roadwatch.domain.traffic;

import java.time.Instant;

/**
 * Observación de velocidad de una entidad (vehículo) en un instante.
 *
 * @param entityId  Identificador de la entidad monitorizada.
 * @param timestamp Instante de la observación.
 * @param speed     Velocidad observada. Debe ser finita y no negativa.
 * @param location  Posición opcional (puede ser {@code null}).
 */
public record SpeedSample(
        String entityId,
        Instant timestamp,
        double speed,
        GeoPoint location
) {

    public SpeedSample(String entityId, Instant timestamp, double speed) {
        this(entityId, timestamp, speed, null);
    }

    /**
     * Una muestra válida puede entrar en el estado de los detectores.
     * NaN, infinitos, velocidades negativas o campos obligatorios ausentes se descartan.
     */
    public boolean isValid() {
        return entityId != null && !entityId.isBlank()
                && timestamp != null
                && Double.isFinite(speed)
                && speed >= 0.0;
    }
}
