package roadwatch.detection.engine;

import roadwatch.detection.lifecycle.LifecycleJournal;
import roadwatch.domain.dto.control.ClearResult;
import roadwatch.domain.traffic.SpeedSource;

import java.time.Instant;

class ClearCommand extends EngineCommand<ClearResult> {

    private final String entityId;

    ClearCommand(String entityId) {
        this.entityId = entityId;
    }

    @Override
    String describe() {
        return "clear(" + (entityId == null ? "<all>" : entityId) + ")";
    }

    @Override
    protected ClearResult apply(DetectionEngine engine, Instant now, SpeedSource source, LifecycleJournal journal) {
        return engine.applyClear(entityId, now, source, journal);
    }
}
