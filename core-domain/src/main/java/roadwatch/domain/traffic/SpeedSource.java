package roadwatch.domain.traffic;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Colaborador que produce una muestra por entidad y tick.
 * <p>
 * Los ganchos de inyección y liberación permiten que las órdenes manuales
 * afecten también a la velocidad simulada. Una fuente real puede ignorarlos.
 */
public interface SpeedSource {

    /**
     * Devuelve las muestras de este tick. Puede contener muestras mal formadas:
     * el motor las filtra.
     */
    List<SpeedSample> nextSamples(Instant now);

    default void forceAccident(String entityId, Instant now, Duration duration) {
        // Fuente pasiva: nada que forzar
    }

    default void releaseAccident(String entityId) {
        // Fuente pasiva: nada que liberar
    }

    default void releaseAll() {
        // Fuente pasiva: nada que liberar
    }

    /**
     * Fuente fija que entrega siempre las mismas muestras, útil para reproducir secuencias.
     */
    static SpeedSource of(List<SpeedSample> samples) {
        List<SpeedSample> copy = List.copyOf(samples);
        return now -> copy;
    }
}
