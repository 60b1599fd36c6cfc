package roadwatch.detection.predictor;

/**
 * Predicción a un paso.
 *
 * @param value    Velocidad prevista (nunca negativa).
 * @param fallback {@code true} si se usó la predicción ingenua por persistencia.
 */
public record Forecast(double value, boolean fallback) {

    public static Forecast persistence(double lastObserved) {
        return new Forecast(Math.max(0.0, lastObserved), true);
    }

    public static Forecast model(double value) {
        return new Forecast(Math.max(0.0, value), false);
    }
}
