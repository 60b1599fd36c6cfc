package roadwatch.compute.simulation;

import lombok.Builder;
import lombok.With;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Parámetros del simulador de tráfico.
 *
 * @param vehicleCount          Número de vehículos simulados ("Car1".."CarN").
 * @param seed                  Semilla del generador aleatorio; {@code null} para no fijarla.
 * @param normalSpeedMean       Velocidad media en flujo libre.
 * @param normalSpeedStd        Desviación típica en flujo libre.
 * @param noiseLevel            Desviación típica del ruido GPS añadido en flujo libre.
 * @param accidentSpeedMean     Velocidad media durante un accidente.
 * @param accidentSpeedStd      Desviación típica durante un accidente.
 * @param maxSpeed              Techo de velocidad (el suelo es 0).
 * @param accidentProbability   Probabilidad por vehículo y tick de que empiece un accidente espontáneo.
 * @param accidentDurationMean  Duración media de un accidente espontáneo.
 * @param accidentDurationStd   Desviación típica de esa duración.
 * @param minAccidentDuration   Duración mínima de un accidente espontáneo.
 * @param originLat             Latitud de referencia.
 * @param originLon             Longitud de referencia.
 * @param positionSpread        Desviación típica del desplazamiento fijo de cada vehículo.
 * @param positionJitter        Desviación típica del temblor de posición por tick.
 * @param zoneId                Zona horaria para el factor por franja horaria.
 */
@Builder(toBuilder = true)
@With
public record SimulatorSettings(
        int vehicleCount,
        Long seed,
        double normalSpeedMean,
        double normalSpeedStd,
        double noiseLevel,
        double accidentSpeedMean,
        double accidentSpeedStd,
        double maxSpeed,
        double accidentProbability,
        Duration accidentDurationMean,
        Duration accidentDurationStd,
        Duration minAccidentDuration,
        double originLat,
        double originLon,
        double positionSpread,
        double positionJitter,
        ZoneId zoneId
) {

    public static SimulatorSettings defaults() {
        return SimulatorSettings.builder()
                .vehicleCount(5)
                .normalSpeedMean(60.0)
                .normalSpeedStd(10.0)
                .noiseLevel(5.0)
                .accidentSpeedMean(15.0)
                .accidentSpeedStd(5.0)
                .maxSpeed(120.0)
                .accidentProbability(0.015)
                .accidentDurationMean(Duration.ofSeconds(120))
                .accidentDurationStd(Duration.ofSeconds(30))
                .minAccidentDuration(Duration.ofSeconds(30))
                .originLat(37.7749)
                .originLon(-122.4194)
                .positionSpread(0.005)
                .positionJitter(0.0002)
                .zoneId(ZoneId.systemDefault())
                .build();
    }
}
