package roadwatch.detection.predictor;

/**
 * Predictor de la siguiente velocidad a partir de la historia reciente de una entidad.
 * <p>
 * Las implementaciones no lanzan excepciones por un ajuste fallido: degradan a la
 * predicción por persistencia y lo indican en {@link Forecast#fallback()}.
 */
public interface SpeedPredictor {

    /**
     * @param history    Velocidades de la más antigua a la más reciente. No vacía.
     * @param minSamples Puntos mínimos para intentar el ajuste del modelo.
     */
    Forecast forecast(double[] history, int minSamples);
}
