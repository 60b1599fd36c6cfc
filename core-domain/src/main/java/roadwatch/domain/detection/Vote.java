package roadwatch.domain.detection;

/**
 * Voto de un detector en un tick.
 *
 * @param detectorName Nombre del detector que vota.
 * @param anomalous    {@code true} si el detector considera el tick anómalo.
 * @param statistic    Estadístico continuo del detector en este tick.
 */
public record Vote(
        String detectorName,
        boolean anomalous,
        double statistic
) {}
