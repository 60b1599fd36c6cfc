package roadwatch.domain.accident;

import java.time.Instant;

public record PhaseTransition(
        String entityId,
        LifecyclePhase from,
        LifecyclePhase to,
        Instant at
) {}
