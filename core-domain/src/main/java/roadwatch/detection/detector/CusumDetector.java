package roadwatch.detection.detector;

import roadwatch.config.DetectionConfig;
import roadwatch.domain.detection.Vote;

/**
 * CUSUM unilateral sobre el residuo de predicción.
 * <p>
 * S_t = max(0, S_{t-1} + (predicha - observada - deriva)). Acumula caídas sostenidas
 * de velocidad respecto a lo esperado. No se reinicia al bajar del umbral: sólo cuando
 * el registro de la entidad se despeja.
 */
public class CusumDetector implements ChangePointDetector {

    public static final String NAME = "CUSUM";

    private double cumulativeSum;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Vote update(DetectorInput input, DetectionConfig config) {
        double deviation = input.predicted() - input.observed() - config.cusumDrift();
        cumulativeSum = Math.max(0.0, cumulativeSum + deviation);
        return new Vote(NAME, cumulativeSum > config.cusumThreshold(), cumulativeSum);
    }

    @Override
    public double getStatistic() {
        return cumulativeSum;
    }

    @Override
    public void reset() {
        cumulativeSum = 0.0;
    }
}
