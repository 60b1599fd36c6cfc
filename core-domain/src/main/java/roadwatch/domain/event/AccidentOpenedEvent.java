package roadwatch.domain.event;

import roadwatch.domain.accident.AccidentRecord;

import java.time.Instant;
import java.util.List;

public record AccidentOpenedEvent(
        String id,
        String entityId,
        Instant openedAt,
        double confidence,
        List<String> detectionMethods,
        boolean forced
) implements AccidentEvent {

    public static AccidentOpenedEvent of(AccidentRecord record) {
        return new AccidentOpenedEvent(
                record.id(),
                record.entityId(),
                record.openedAt(),
                record.confidence(),
                List.copyOf(record.detectionMethods()),
                record.forced());
    }
}
