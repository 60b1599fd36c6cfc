package roadwatch.detection.detector;

import roadwatch.config.DetectionConfig;
import roadwatch.domain.detection.Vote;

/**
 * Test de Page-Hinkley orientado a caídas de velocidad.
 * <p>
 * m_t = m_{t-1} + (base - observada - delta), M_t = min(M_{t-1}, m_t).
 * Alarma cuando m_t - M_t supera el umbral. El estadístico se acota con un techo
 * subiendo M_t, para que la recuperación se note en un número acotado de ticks.
 */
public class PageHinkleyDetector implements ChangePointDetector {

    public static final String NAME = "Page-Hinkley";

    private double cumulativeSum;
    private double runningMinimum;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Vote update(DetectorInput input, DetectionConfig config) {
        cumulativeSum += input.baseline() - input.observed() - config.pageHinkleyDelta();
        runningMinimum = Math.min(runningMinimum, cumulativeSum);

        double statistic = cumulativeSum - runningMinimum;
        boolean anomalous = statistic > config.pageHinkleyThreshold();

        double cap = config.pageHinkleyStatisticCap();
        if (statistic > cap) {
            runningMinimum = cumulativeSum - cap;
            statistic = cap;
        }
        return new Vote(NAME, anomalous, statistic);
    }

    @Override
    public double getStatistic() {
        return cumulativeSum - runningMinimum;
    }

    public double getCumulativeSum() {
        return cumulativeSum;
    }

    public double getRunningMinimum() {
        return runningMinimum;
    }

    @Override
    public void reset() {
        cumulativeSum = 0.0;
        runningMinimum = 0.0;
    }
}
