package roadwatch.detection.engine;

import roadwatch.detection.lifecycle.LifecycleJournal;
import roadwatch.domain.dto.control.InjectionResult;
import roadwatch.domain.traffic.SpeedSource;

import java.time.Duration;
import java.time.Instant;

class InjectCommand extends EngineCommand<InjectionResult> {

    private final String entityId;
    private final Duration duration;

    InjectCommand(String entityId, Duration duration) {
        this.entityId = entityId;
        this.duration = duration;
    }

    @Override
    String describe() {
        return "inject(" + (entityId == null ? "<random>" : entityId) + ", " + duration.toSeconds() + "s)";
    }

    @Override
    protected InjectionResult apply(DetectionEngine engine, Instant now, SpeedSource source, LifecycleJournal journal) {
        return engine.applyInjection(entityId, duration, now, source, journal);
    }
}
