package roadwatch.detection.predictor;

import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
class ArmaSpeedPredictorTest {

    private final ArmaSpeedPredictor predictor = new ArmaSpeedPredictor();

    @Test
    @DisplayName("Con menos puntos que el mínimo se usa la última velocidad observada")
    void forecast_shouldFallBackBelowMinimumSamples() {
        Forecast forecast = predictor.forecast(new double[]{50, 55, 58}, 10);

        assertTrue(forecast.fallback());
        assertEquals(58.0, forecast.value());
    }

    @Test
    @DisplayName("Una serie constante produce un sistema singular y degrada a persistencia sin lanzar")
    void forecast_shouldFallBackOnSingularFit() {
        double[] constant = new double[30];
        Arrays.fill(constant, 60.0);

        Forecast forecast = predictor.forecast(constant, 10);

        assertTrue(forecast.fallback());
        assertEquals(60.0, forecast.value());
    }

    @Test
    @DisplayName("Una serie autorregresiva estacionaria se ajusta con el modelo ARMA(1,1)")
    void forecast_shouldFitStationarySeries() {
        // ARRANGE: x_t = 60 + 0.6 (x_{t-1} - 60) + ruido
        Random random = new Random(7);
        double[] series = new double[60];
        double previous = 60.0;
        for (int i = 0; i < series.length; i++) {
            previous = 60.0 + 0.6 * (previous - 60.0) + 3.0 * random.nextGaussian();
            series[i] = previous;
        }

        // ACT
        Forecast forecast = predictor.forecast(series, 10);
        log.info("Última observación {}, predicción {}", series[series.length - 1], forecast.value());

        // ASSERT
        assertFalse(forecast.fallback(), "El ajuste no debería degradar con una serie estacionaria");
        assertTrue(Double.isFinite(forecast.value()));
        assertTrue(forecast.value() > 45.0 && forecast.value() < 75.0,
                "La predicción debe quedar cerca del nivel de la serie");
    }

    @Test
    void forecast_shouldRejectEmptyHistory() {
        assertThrows(IllegalArgumentException.class, () -> predictor.forecast(new double[0], 10));
    }

    @Test
    @DisplayName("La predicción nunca es negativa")
    void forecastValues_shouldBeClampedAtZero() {
        assertEquals(0.0, Forecast.model(-3.5).value());
        assertEquals(0.0, Forecast.persistence(-1.0).value());
        assertFalse(Forecast.model(12.0).fallback());
    }
}
