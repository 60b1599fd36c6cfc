package roadwatch.detection.detector;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import roadwatch.config.DetectionConfig;
import roadwatch.domain.detection.Vote;

import static org.junit.jupiter.api.Assertions.*;

class SprtDetectorTest {

    // H0 = N(60, 10), H1 = N(15, 5), fronteras +5 / -5
    private final DetectionConfig config = DetectionConfig.defaults();
    private final SprtDetector detector = new SprtDetector();

    @Test
    @DisplayName("El log-ratio en forma cerrada coincide con el cálculo a mano")
    void logLikelihoodRatio_shouldMatchClosedForm() {
        // ln 2 - 0 + 45²/200
        assertEquals(Math.log(2) + 10.125, SprtDetector.logLikelihoodRatio(15.0, config), 1e-9);
        // ln 2 - 45²/50 + 0
        assertEquals(Math.log(2) - 40.5, SprtDetector.logLikelihoodRatio(60.0, config), 1e-9);
    }

    @Test
    @DisplayName("Valores extremos no producen infinitos ni NaN (cálculo en espacio logarítmico)")
    void logLikelihoodRatio_shouldStayFiniteForExtremeValues() {
        assertTrue(Double.isFinite(SprtDetector.logLikelihoodRatio(0.0, config)));
        assertTrue(Double.isFinite(SprtDetector.logLikelihoodRatio(120.0, config)));
    }

    @Test
    @DisplayName("Al cruzar la frontera superior vota anómalo, informa el ratio alcanzado y reinicia el test")
    void update_shouldDecideAndRestartAtUpperBound() {
        Vote vote = detector.update(new DetectorInput(15.0, 60.0, 60.0), config);

        assertTrue(vote.anomalous());
        assertEquals(Math.log(2) + 10.125, vote.statistic(), 1e-9);
        assertEquals(0.0, detector.getRunningRatio());
    }

    @Test
    @DisplayName("En la zona de indiferencia se mantiene la decisión anterior")
    void update_shouldCarryPreviousDecisionInIndifferenceZone() {
        // 30 km/h aporta ln 2 - 4.5 + 4.5 = ln 2: no cruza ninguna frontera
        Vote initial = detector.update(new DetectorInput(30.0, 60.0, 60.0), config);
        assertFalse(initial.anomalous());

        detector.update(new DetectorInput(15.0, 60.0, 60.0), config);
        Vote carried = detector.update(new DetectorInput(30.0, 60.0, 60.0), config);
        assertTrue(carried.anomalous());
        assertEquals(Math.log(2), carried.statistic(), 1e-9);

        Vote normal = detector.update(new DetectorInput(60.0, 60.0, 60.0), config);
        assertFalse(normal.anomalous());
        assertEquals(0.0, detector.getRunningRatio());
    }

    @Test
    void reset_shouldClearStateAndDecision() {
        detector.update(new DetectorInput(15.0, 60.0, 60.0), config);
        detector.reset();

        assertEquals(0.0, detector.getStatistic());
        Vote next = detector.update(new DetectorInput(30.0, 60.0, 60.0), config);
        assertFalse(next.anomalous());
    }
}
