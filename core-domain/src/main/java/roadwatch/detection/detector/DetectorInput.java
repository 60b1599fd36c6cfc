package roadwatch.detection.detector;

/**
 * Entrada común de los detectores en un tick.
 *
 * @param observed  Velocidad observada (ya validada).
 * @param predicted Predicción a un paso hecha antes de incorporar la observación.
 * @param baseline  Velocidad de referencia de flujo libre para esta entidad.
 */
public record DetectorInput(
        double observed,
        double predicted,
        double baseline
) {}
