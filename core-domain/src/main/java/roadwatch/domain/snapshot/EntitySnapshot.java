package roadwatch.domain.snapshot;

import roadwatch.domain.accident.LifecyclePhase;
import roadwatch.domain.traffic.GeoPoint;

public record EntitySnapshot(
        String entityId,
        double speed,
        double predictedSpeed,
        double cusumStat,
        double sprtRatio,
        double pageHinkleyStat,
        boolean accidentActive,
        double confidence,
        LifecyclePhase phase,
        GeoPoint location
) {}
