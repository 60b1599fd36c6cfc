package roadwatch.detection.predictor;

import lombok.extern.slf4j.Slf4j;

/**
 * Predictor ARMA(1,0,1) reajustado en cada tick sobre la ventana de la entidad.
 * <p>
 * El ajuste sigue el método de dos etapas de Hannan-Rissanen:
 * <ol>
 *     <li>Un AR largo por mínimos cuadrados estima las innovaciones.</li>
 *     <li>Se regresa y_t sobre y_{t-1} y la innovación e_{t-1} para obtener (phi, theta).</li>
 * </ol>
 * Si no hay puntos suficientes, el sistema es singular, el modelo no es estacionario
 * (|phi| ≥ 1) o no es invertible (|theta| ≥ 1), se degrada a la persistencia:
 * la predicción es la última velocidad observada.
 */
@Slf4j
public class ArmaSpeedPredictor implements SpeedPredictor {

    private static final int MAX_LONG_AR_ORDER = 4;

    @Override
    public Forecast forecast(double[] history, int minSamples) {
        if (history == null || history.length == 0) {
            throw new IllegalArgumentException("La historia de velocidades no puede estar vacía.");
        }
        int n = history.length;
        double last = history[n - 1];

        if (n < Math.max(3, minSamples)) {
            return Forecast.persistence(last);
        }

        double mean = 0.0;
        for (double v : history) {
            mean += v;
        }
        mean /= n;

        double[] y = new double[n];
        for (int i = 0; i < n; i++) {
            y[i] = history[i] - mean;
        }

        // 1. AR largo: innovaciones aproximadas
        int longOrder = Math.max(1, Math.min(MAX_LONG_AR_ORDER, n / 4));
        double[] innovations = longAutoregressionResiduals(y, longOrder);
        if (innovations == null) {
            return fallback(last, "singular long AR fit");
        }

        // 2. Regresión ARMA(1,1) sobre (y_{t-1}, e_{t-1})
        int rows = n - longOrder - 1;
        if (rows < 2) {
            return fallback(last, "not enough rows for second stage");
        }
        double[][] x = new double[rows][2];
        double[] target = new double[rows];
        for (int t = longOrder + 1, r = 0; t < n; t++, r++) {
            x[r][0] = y[t - 1];
            x[r][1] = innovations[t - 1];
            target[r] = y[t];
        }
        double[] coefficients = LeastSquares.solve(x, target);
        if (coefficients == null) {
            return fallback(last, "singular ARMA fit");
        }

        double phi = coefficients[0];
        double theta = coefficients[1];
        if (!(Math.abs(phi) < 1.0)) {
            return fallback(last, "non-stationary AR coefficient " + phi);
        }
        if (!(Math.abs(theta) < 1.0)) {
            return fallback(last, "non-invertible MA coefficient " + theta);
        }

        // Innovaciones filtradas con el modelo final
        double innovation = 0.0;
        for (int t = 1; t < n; t++) {
            innovation = y[t] - phi * y[t - 1] - theta * innovation;
        }

        double prediction = mean + phi * y[n - 1] + theta * innovation;
        if (!Double.isFinite(prediction)) {
            return fallback(last, "non-finite forecast");
        }
        return Forecast.model(prediction);
    }

    private double[] longAutoregressionResiduals(double[] y, int order) {
        int n = y.length;
        int rows = n - order;
        double[][] x = new double[rows][order];
        double[] target = new double[rows];
        for (int t = order, r = 0; t < n; t++, r++) {
            for (int lag = 1; lag <= order; lag++) {
                x[r][lag - 1] = y[t - lag];
            }
            target[r] = y[t];
        }

        double[] a = LeastSquares.solve(x, target);
        if (a == null) {
            return null;
        }

        double[] residuals = new double[n];
        for (int t = order; t < n; t++) {
            double fitted = 0.0;
            for (int lag = 1; lag <= order; lag++) {
                fitted += a[lag - 1] * y[t - lag];
            }
            residuals[t] = y[t] - fitted;
        }
        return residuals;
    }

    private Forecast fallback(double last, String reason) {
        log.debug("ARMA(1,1) fallback to persistence: {}", reason);
        return Forecast.persistence(last);
    }
}
