package roadwatch.domain.event;

import roadwatch.domain.accident.AccidentRecord;

import java.time.Instant;

public record AccidentClearedEvent(
        String id,
        String entityId,
        Instant closedAt
) implements AccidentEvent {

    public static AccidentClearedEvent of(AccidentRecord record) {
        return new AccidentClearedEvent(record.id(), record.entityId(), record.closedAt());
    }
}
