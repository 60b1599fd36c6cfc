package roadwatch.compute.simulation;

import lombok.extern.slf4j.Slf4j;
import roadwatch.domain.traffic.GeoPoint;
import roadwatch.domain.traffic.SpeedSample;
import roadwatch.domain.traffic.SpeedSource;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Genera velocidades GPS sintéticas para una flota de vehículos, una muestra por
 * vehículo y tick.
 * <ul>
 *     <li>Flujo libre: Normal(media x factor horario, sd) más ruido GPS Normal(0, ruido).</li>
 *     <li>Accidente: Normal(media accidente, sd accidente).</li>
 *     <li>Velocidad acotada a [0, velocidad máxima].</li>
 * </ul>
 * Los accidentes espontáneos empiezan con una probabilidad fija por vehículo y tick. Las
 * inyecciones manuales fuerzan la velocidad de accidente durante la duración pedida.
 * Sólo lo usa el hilo del tick.
 */
@Slf4j
public class TrafficSimulator implements SpeedSource {

    private final SimulatorSettings settings;
    private final Random random;
    private final Map<String, SimulatedVehicle> vehicles = new LinkedHashMap<>();

    public TrafficSimulator(SimulatorSettings settings) {
        this(settings, settings.seed() == null ? new Random() : new Random(settings.seed()));
    }

    public TrafficSimulator(SimulatorSettings settings, Random random) {
        if (settings.vehicleCount() <= 0) {
            throw new IllegalArgumentException("El simulador necesita al menos un vehículo.");
        }
        this.settings = settings;
        this.random = random;
        for (int i = 1; i <= settings.vehicleCount(); i++) {
            String id = "Car" + i;
            vehicles.put(id, new SimulatedVehicle(id,
                    gaussian(0.0, settings.positionSpread()),
                    gaussian(0.0, settings.positionSpread())));
        }
        log.info("Traffic simulator ready with {} vehicle(s)", vehicles.size());
    }

    @Override
    public List<SpeedSample> nextSamples(Instant now) {
        double freeFlowMean = settings.normalSpeedMean() * timeOfDayFactor(now);
        List<SpeedSample> samples = new ArrayList<>(vehicles.size());

        for (SimulatedVehicle vehicle : vehicles.values()) {
            boolean inAccident = vehicle.isInAccident(now) || maybeStartAccident(vehicle, now);

            double speed;
            if (inAccident) {
                speed = gaussian(settings.accidentSpeedMean(), settings.accidentSpeedStd());
            } else {
                speed = gaussian(freeFlowMean, settings.normalSpeedStd())
                        + gaussian(0.0, settings.noiseLevel());
            }
            speed = Math.max(0.0, Math.min(speed, settings.maxSpeed()));

            GeoPoint location = new GeoPoint(
                    settings.originLat() + vehicle.getLatOffset() + gaussian(0.0, settings.positionJitter()),
                    settings.originLon() + vehicle.getLonOffset() + gaussian(0.0, settings.positionJitter()));

            samples.add(new SpeedSample(vehicle.getId(), now, round2(speed), location));
        }
        return samples;
    }

    /**
     * Multiplicador de la velocidad media según la franja horaria local.
     */
    double timeOfDayFactor(Instant now) {
        int hour = now.atZone(settings.zoneId()).getHour();
        if (hour >= 7 && hour < 9) return 0.7;
        if (hour >= 17 && hour < 19) return 0.65;
        if (hour >= 23 || hour < 5) return 1.2;
        return 1.0;
    }

    private boolean maybeStartAccident(SimulatedVehicle vehicle, Instant now) {
        if (random.nextDouble() >= settings.accidentProbability()) {
            return false;
        }
        double seconds = Math.max(
                settings.minAccidentDuration().toMillis() / 1000.0,
                gaussian(settings.accidentDurationMean().toMillis() / 1000.0,
                        settings.accidentDurationStd().toMillis() / 1000.0));
        Duration duration = Duration.ofMillis(Math.round(seconds * 1000));
        vehicle.startAccident(now.plus(duration));
        log.debug("Spontaneous accident on {} for {} s", vehicle.getId(), duration.toSeconds());
        return true;
    }

    @Override
    public void forceAccident(String entityId, Instant now, Duration duration) {
        SimulatedVehicle vehicle = vehicles.get(entityId);
        if (vehicle == null) {
            log.warn("Cannot force accident on unknown vehicle {}", entityId);
            return;
        }
        vehicle.startAccident(now.plus(duration));
    }

    @Override
    public void releaseAccident(String entityId) {
        SimulatedVehicle vehicle = vehicles.get(entityId);
        if (vehicle != null) {
            vehicle.clearAccident();
        }
    }

    @Override
    public void releaseAll() {
        vehicles.values().forEach(SimulatedVehicle::clearAccident);
    }

    /**
     * Vehículos con un accidente simulado en curso en el instante dado.
     */
    public List<String> vehiclesInAccident(Instant now) {
        List<String> ids = new ArrayList<>();
        for (SimulatedVehicle vehicle : vehicles.values()) {
            if (vehicle.isInAccident(now)) {
                ids.add(vehicle.getId());
            }
        }
        return Collections.unmodifiableList(ids);
    }

    public List<String> vehicleIds() {
        return List.copyOf(vehicles.keySet());
    }

    private double gaussian(double mean, double std) {
        return mean + std * random.nextGaussian();
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
