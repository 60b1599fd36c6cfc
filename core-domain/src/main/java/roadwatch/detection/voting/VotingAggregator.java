package roadwatch.detection.voting;

import roadwatch.domain.detection.Vote;
import roadwatch.domain.detection.VotingDecision;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Agregador por quórum. Función pura: no guarda estado entre ticks ni aplica histéresis;
 * la estabilidad la aporta el ciclo de vida.
 */
public class VotingAggregator {

    /**
     * @param votes  Votos del tick, uno por detector.
     * @param quorum Votos anómalos necesarios.
     */
    public VotingDecision aggregate(List<Vote> votes, int quorum) {
        if (quorum < 1) {
            throw new IllegalArgumentException("El quórum debe ser al menos 1: " + quorum);
        }
        Set<String> anomalousDetectors = new TreeSet<>();
        int anomalous = 0;
        for (Vote vote : votes) {
            if (vote.anomalous()) {
                anomalous++;
                anomalousDetectors.add(vote.detectorName());
            }
        }
        int total = votes.size();
        double confidence = total == 0 ? 0.0 : (double) anomalous / total;

        return new VotingDecision(anomalous >= quorum, anomalous, total, confidence, anomalousDetectors);
    }
}
