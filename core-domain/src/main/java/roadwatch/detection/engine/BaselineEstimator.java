package roadwatch.detection.engine;

/**
 * Media incremental (Welford) de la velocidad de flujo libre de una entidad.
 * Se siembra con la velocidad nominal, que cuenta como una observación.
 */
public class BaselineEstimator {

    private long count;
    private double mean;

    public BaselineEstimator(double seed) {
        this.count = 1;
        this.mean = seed;
    }

    public void update(double value) {
        count++;
        mean += (value - mean) / count;
    }

    public double getMean() {
        return mean;
    }

    public long getCount() {
        return count;
    }
}
