package roadwatch.domain.detection;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Resultado de la votación de un tick.
 *
 * @param anomalous          {@code true} si los votos anómalos alcanzan el quórum.
 * @param anomalousVotes     Número de votos anómalos.
 * @param totalVoters        Número de detectores que votaron.
 * @param confidence         anomalousVotes / totalVoters (0 sin votantes).
 * @param anomalousDetectors Nombres de los detectores que votaron anómalo.
 */
public record VotingDecision(
        boolean anomalous,
        int anomalousVotes,
        int totalVoters,
        double confidence,
        Set<String> anomalousDetectors
) {

    public VotingDecision {
        anomalousDetectors = anomalousDetectors == null
                ? Collections.emptySet()
                : Collections.unmodifiableSet(new TreeSet<>(anomalousDetectors));
    }
}
