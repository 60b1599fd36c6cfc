package roadwatch.detection.engine;

import roadwatch.config.DetectionConfig;
import roadwatch.config.DetectionOptions;
import roadwatch.detection.lifecycle.LifecycleJournal;
import roadwatch.domain.traffic.SpeedSource;

import java.time.Instant;

class ReconfigureCommand extends EngineCommand<DetectionConfig> {

    private final DetectionOptions options;

    ReconfigureCommand(DetectionOptions options) {
        this.options = options;
    }

    @Override
    String describe() {
        return "reconfigure(" + options + ")";
    }

    @Override
    protected DetectionConfig apply(DetectionEngine engine, Instant now, SpeedSource source, LifecycleJournal journal) {
        return engine.applyReconfiguration(options);
    }
}
