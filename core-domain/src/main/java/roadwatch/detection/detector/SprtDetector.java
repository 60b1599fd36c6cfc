package roadwatch.detection.detector;

import roadwatch.config.DetectionConfig;
import roadwatch.domain.detection.Vote;

/**
 * Test secuencial de razón de probabilidades (Wald) entre dos normales:
 * H0 tráfico fluido y H1 tráfico colapsado por un accidente.
 * <p>
 * El log-ratio se calcula en forma cerrada para no evaluar densidades que se anulan:
 * <pre>
 *   log(f1(x)/f0(x)) = log(s0/s1) - (x-m1)^2 / (2 s1^2) + (x-m0)^2 / (2 s0^2)
 * </pre>
 * Al cruzar una frontera se emite la decisión y el test vuelve a empezar. Entre fronteras
 * se mantiene la última decisión.
 */
public class SprtDetector implements ChangePointDetector {

    public static final String NAME = "SPRT";

    private double logRatio;
    private double reportedRatio;
    private boolean lastDecision;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Vote update(DetectorInput input, DetectionConfig config) {
        logRatio += logLikelihoodRatio(input.observed(), config);
        reportedRatio = logRatio;

        if (logRatio >= config.sprtUpperBound()) {
            lastDecision = true;
            logRatio = 0.0;
        } else if (logRatio <= config.sprtLowerBound()) {
            lastDecision = false;
            logRatio = 0.0;
        }
        return new Vote(NAME, lastDecision, reportedRatio);
    }

    static double logLikelihoodRatio(double x, DetectionConfig config) {
        double m0 = config.sprtNormalMean();
        double s0 = config.sprtNormalStd();
        double m1 = config.sprtAnomalousMean();
        double s1 = config.sprtAnomalousStd();

        double z1 = (x - m1) / s1;
        double z0 = (x - m0) / s0;
        return Math.log(s0 / s1) - 0.5 * z1 * z1 + 0.5 * z0 * z0;
    }

    /**
     * Log-ratio alcanzado en el último tick, antes de un posible reinicio del test.
     */
    @Override
    public double getStatistic() {
        return reportedRatio;
    }

    /**
     * Log-ratio en curso (tras el reinicio, si lo hubo).
     */
    public double getRunningRatio() {
        return logRatio;
    }

    @Override
    public void reset() {
        logRatio = 0.0;
        reportedRatio = 0.0;
        lastDecision = false;
    }
}
