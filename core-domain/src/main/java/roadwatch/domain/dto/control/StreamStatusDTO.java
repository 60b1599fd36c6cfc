package roadwatch.domain.dto.control;

import roadwatch.config.DetectionConfig;

import java.time.Instant;

public record StreamStatusDTO(
        boolean running,
        long tickCount,
        Instant lastTickAt,
        int entityCount,
        int activeAccidents,
        int pendingCommands,
        DetectionConfig config
) {}
