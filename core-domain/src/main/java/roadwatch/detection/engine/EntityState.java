package roadwatch.detection.engine;

import lombok.Getter;
import roadwatch.detection.detector.ChangePointDetector;
import roadwatch.detection.lifecycle.AccidentLifecycle;
import roadwatch.detection.lifecycle.TrackedEntity;
import roadwatch.detection.predictor.Forecast;
import roadwatch.detection.predictor.RollingWindow;
import roadwatch.domain.detection.Vote;
import roadwatch.domain.detection.VotingDecision;
import roadwatch.domain.traffic.GeoPoint;
import roadwatch.domain.traffic.SpeedSample;

import java.util.List;

/**
 * Estado completo de una entidad monitorizada. Se crea con la primera muestra válida y
 * vive mientras el motor exista. Sólo lo toca el hilo del tick.
 */
@Getter
public class EntityState implements TrackedEntity {

    private final String entityId;
    private final RollingWindow window;
    private final List<ChangePointDetector> detectors;
    private final BaselineEstimator baseline;
    private final AccidentLifecycle lifecycle;

    private long validSamples;
    private double lastSpeed;
    private Forecast lastForecast;
    private GeoPoint lastLocation;
    private VotingDecision lastDecision;
    private List<Vote> lastVotes = List.of();

    public EntityState(String entityId, int windowSize, List<ChangePointDetector> detectors, double nominalSpeed) {
        this.entityId = entityId;
        this.window = new RollingWindow(windowSize);
        this.detectors = List.copyOf(detectors);
        this.baseline = new BaselineEstimator(nominalSpeed);
        this.lifecycle = new AccidentLifecycle(entityId);
    }

    void recordObservation(SpeedSample sample, Forecast forecast) {
        window.add(sample.speed());
        validSamples++;
        lastSpeed = sample.speed();
        lastForecast = forecast;
        if (sample.location() != null) {
            lastLocation = sample.location();
        }
    }

    void recordDecision(List<Vote> votes, VotingDecision decision) {
        this.lastVotes = List.copyOf(votes);
        this.lastDecision = decision;
    }

    /**
     * Estadístico actual del detector con ese nombre, o 0 si no está registrado.
     */
    public double statisticOf(String detectorName) {
        for (ChangePointDetector detector : detectors) {
            if (detector.getName().equals(detectorName)) {
                return detector.getStatistic();
            }
        }
        return 0.0;
    }

    public double lastPredictedSpeed() {
        return lastForecast == null ? lastSpeed : lastForecast.value();
    }

    @Override
    public void resetAccumulators() {
        detectors.forEach(ChangePointDetector::reset);
    }
}
