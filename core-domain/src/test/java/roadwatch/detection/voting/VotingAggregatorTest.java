package roadwatch.detection.voting;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import roadwatch.domain.detection.Vote;
import roadwatch.domain.detection.VotingDecision;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class VotingAggregatorTest {

    private final VotingAggregator aggregator = new VotingAggregator();

    @Test
    @DisplayName("Dos de tres votos anómalos alcanzan el quórum por defecto")
    void aggregate_shouldReachQuorum() {
        VotingDecision decision = aggregator.aggregate(List.of(
                new Vote("CUSUM", true, 12.0),
                new Vote("SPRT", false, -1.0),
                new Vote("Page-Hinkley", true, 9.0)), 2);

        assertTrue(decision.anomalous());
        assertEquals(2, decision.anomalousVotes());
        assertEquals(3, decision.totalVoters());
        assertEquals(2.0 / 3.0, decision.confidence(), 1e-9);
        assertEquals(Set.of("CUSUM", "Page-Hinkley"), decision.anomalousDetectors());
    }

    @Test
    void aggregate_shouldNotFlagBelowQuorum() {
        VotingDecision decision = aggregator.aggregate(List.of(
                new Vote("CUSUM", true, 12.0),
                new Vote("SPRT", false, -1.0),
                new Vote("Page-Hinkley", false, 0.0)), 2);

        assertFalse(decision.anomalous());
        assertEquals(1.0 / 3.0, decision.confidence(), 1e-9);
    }

    @Test
    @DisplayName("Sin votantes la confianza es 0 y el tick no es anómalo")
    void aggregate_shouldHandleNoVoters() {
        VotingDecision decision = aggregator.aggregate(List.of(), 1);

        assertFalse(decision.anomalous());
        assertEquals(0.0, decision.confidence());
        assertTrue(decision.anomalousDetectors().isEmpty());
    }

    @Test
    void aggregate_shouldRejectNonPositiveQuorum() {
        assertThrows(IllegalArgumentException.class, () -> aggregator.aggregate(List.of(), 0));
    }
}
