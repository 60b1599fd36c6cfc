package roadwatch.detection.detector;

import roadwatch.config.DetectionConfig;
import roadwatch.domain.detection.Vote;

/**
 * Test secuencial de cambio de régimen con estado propio por entidad.
 * <p>
 * Cada entidad recibe su propia instancia: el estado nunca se comparte entre entidades.
 * Los parámetros se leen de la configuración en cada llamada, de modo que una
 * reconfiguración entra en vigor en el siguiente tick sin recrear detectores.
 */
public interface ChangePointDetector {

    /**
     * Nombre con el que el detector aparece en los votos y en los métodos de detección.
     */
    String getName();

    /**
     * Incorpora una observación válida y emite el voto del tick.
     */
    Vote update(DetectorInput input, DetectionConfig config);

    /**
     * Estadístico informado en el último voto (0 tras un reinicio).
     */
    double getStatistic();

    /**
     * Vuelve al estado inicial. Se invoca cuando se despeja el registro de la entidad.
     */
    void reset();
}
