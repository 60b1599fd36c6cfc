package roadwatch.detection.lifecycle;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import roadwatch.config.DetectionConfig;
import roadwatch.domain.accident.AccidentRecord;
import roadwatch.domain.accident.AccidentStatus;
import roadwatch.domain.detection.VotingDecision;
import roadwatch.domain.dto.control.InjectionResult;
import roadwatch.domain.event.AccidentClearedEvent;
import roadwatch.domain.event.AccidentOpenedEvent;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

import static roadwatch.domain.accident.LifecyclePhase.CLEARED;
import static roadwatch.domain.accident.LifecyclePhase.CLEARING;
import static roadwatch.domain.accident.LifecyclePhase.CONFIRMED;
import static roadwatch.domain.accident.LifecyclePhase.NORMAL;
import static roadwatch.domain.accident.LifecyclePhase.SUSPECTED;

/**
 * Convierte las decisiones de la votación en registros de accidente estables.
 * <p>
 * Reglas por tick (una decisión por entidad):
 * <ul>
 *     <li>NORMAL: el primer tick anómalo abre una sospecha (sin evento).</li>
 *     <li>SUSPECTED: la racha anómala confirma al alcanzar {@code confirmationRunLength};
 *     un tick normal descarta la sospecha.</li>
 *     <li>CONFIRMED: el primer tick normal inicia el despeje.</li>
 *     <li>CLEARING: una anomalía devuelve el mismo registro a CONFIRMED; la racha normal
 *     lo despeja al alcanzar {@code hysteresisRunLength}, y la entidad vuelve a NORMAL.</li>
 * </ul>
 * Mientras dura una retención forzada (inyección manual) la fase no cambia.
 */
@Slf4j
public class AccidentLifecycleManager {

    public static final String MANUAL_METHOD = "MANUAL";

    @Getter
    private final AccidentLedger ledger;
    private final Supplier<String> idGenerator;

    public AccidentLifecycleManager(AccidentLedger ledger) {
        this(ledger, () -> UUID.randomUUID().toString());
    }

    public AccidentLifecycleManager(AccidentLedger ledger, Supplier<String> idGenerator) {
        this.ledger = ledger;
        this.idGenerator = idGenerator;
    }

    /**
     * Avanza la máquina de estados de una entidad con la decisión de este tick.
     */
    public void advance(TrackedEntity entity, VotingDecision decision, Instant now,
                        DetectionConfig config, LifecycleJournal journal) {
        AccidentLifecycle lifecycle = entity.getLifecycle();

        if (lifecycle.consumeHoldTick()) {
            if (decision.anomalous()) {
                ledger.reinforce(entity.getEntityId(), decision.confidence(), decision.anomalousDetectors());
            }
            return;
        }

        switch (lifecycle.getPhase()) {
            case NORMAL -> {
                if (decision.anomalous()) {
                    lifecycle.transitionTo(SUSPECTED, now, journal);
                    lifecycle.incrementAnomalousRun();
                    confirmIfPersistent(entity, decision, now, config, journal);
                }
            }
            case SUSPECTED -> {
                if (decision.anomalous()) {
                    lifecycle.incrementAnomalousRun();
                    confirmIfPersistent(entity, decision, now, config, journal);
                } else {
                    log.debug("Suspicion dismissed for entity {} after {} anomalous tick(s)",
                            entity.getEntityId(), lifecycle.getAnomalousRun());
                    lifecycle.transitionTo(NORMAL, now, journal);
                    lifecycle.resetCounters();
                }
            }
            case CONFIRMED -> {
                if (decision.anomalous()) {
                    lifecycle.incrementAnomalousRun();
                    ledger.reinforce(entity.getEntityId(), decision.confidence(), decision.anomalousDetectors());
                } else {
                    lifecycle.transitionTo(CLEARING, now, journal);
                    if (lifecycle.incrementNormalRun() >= config.hysteresisRunLength()) {
                        close(entity, now, journal);
                    }
                }
            }
            case CLEARING -> {
                if (decision.anomalous()) {
                    log.info("Accident on entity {} resumed during clearance", entity.getEntityId());
                    lifecycle.transitionTo(CONFIRMED, now, journal);
                    lifecycle.incrementAnomalousRun();
                    ledger.reinforce(entity.getEntityId(), decision.confidence(), decision.anomalousDetectors());
                } else if (lifecycle.incrementNormalRun() >= config.hysteresisRunLength()) {
                    close(entity, now, journal);
                }
            }
            case CLEARED -> {
                // CLEARED nunca sobrevive a un tick
                lifecycle.transitionTo(NORMAL, now, journal);
                lifecycle.resetCounters();
            }
        }
    }

    /**
     * Tick sin muestra válida para la entidad: no hay voto ni cambian las rachas,
     * pero la retención forzada sigue descontando tiempo.
     */
    public void idle(TrackedEntity entity) {
        entity.getLifecycle().consumeHoldTick();
    }

    /**
     * Inyección manual: abre un registro forzado y lo retiene en CONFIRMED durante
     * los ticks que cubre {@code duration}.
     */
    public InjectionResult inject(TrackedEntity entity, Instant now, Duration duration,
                                  DetectionConfig config, LifecycleJournal journal) {
        Optional<AccidentRecord> existing = ledger.activeFor(entity.getEntityId());
        if (existing.isPresent()) {
            log.info("Injection ignored: entity {} already has active accident {}",
                    entity.getEntityId(), existing.get().id());
            return InjectionResult.alreadyActive(existing.get());
        }

        // Todo lo que puede fallar va antes de tocar la fase o el libro
        int holdTicks = config.ticksFor(duration);
        AccidentRecord candidate = AccidentRecord.builder()
                .id(idGenerator.get())
                .entityId(entity.getEntityId())
                .status(AccidentStatus.ACTIVE)
                .openedAt(now)
                .confidence(1.0)
                .detectionMethods(Set.of(MANUAL_METHOD))
                .forced(true)
                .location(entity.getLastLocation())
                .build();

        AccidentLifecycle lifecycle = entity.getLifecycle();
        if (lifecycle.getPhase() == NORMAL) {
            lifecycle.transitionTo(SUSPECTED, now, journal);
        }
        lifecycle.transitionTo(CONFIRMED, now, journal);

        AccidentRecord record = ledger.open(candidate);
        lifecycle.resetCounters();
        lifecycle.holdFor(holdTicks);
        journal.emit(AccidentOpenedEvent.of(record));

        log.info("Accident {} injected on entity {} for {} s ({} ticks)",
                record.id(), entity.getEntityId(), duration.toSeconds(), holdTicks);
        return InjectionResult.injected(record, duration);
    }

    /**
     * Despeje manual sin histéresis. Sin registro activo no hace nada.
     */
    public Optional<AccidentRecord> forceClear(TrackedEntity entity, Instant now, LifecycleJournal journal) {
        AccidentLifecycle lifecycle = entity.getLifecycle();
        if (!lifecycle.getPhase().hasActiveRecord()) {
            return Optional.empty();
        }
        if (lifecycle.getPhase() == CONFIRMED) {
            lifecycle.transitionTo(CLEARING, now, journal);
        }
        log.info("Manual clearance requested for entity {}", entity.getEntityId());
        return close(entity, now, journal);
    }

    private void confirmIfPersistent(TrackedEntity entity, VotingDecision decision, Instant now,
                                     DetectionConfig config, LifecycleJournal journal) {
        AccidentLifecycle lifecycle = entity.getLifecycle();
        if (lifecycle.getAnomalousRun() < config.confirmationRunLength()) {
            return;
        }
        lifecycle.transitionTo(CONFIRMED, now, journal);

        AccidentRecord record = ledger.open(AccidentRecord.builder()
                .id(idGenerator.get())
                .entityId(entity.getEntityId())
                .status(AccidentStatus.ACTIVE)
                .openedAt(now)
                .confidence(decision.confidence())
                .detectionMethods(decision.anomalousDetectors())
                .forced(false)
                .location(entity.getLastLocation())
                .build());
        journal.emit(AccidentOpenedEvent.of(record));

        log.info("Accident {} confirmed on entity {} (confidence {}, methods {})",
                record.id(), entity.getEntityId(), String.format("%.2f", record.confidence()),
                record.detectionMethods());
    }

    private Optional<AccidentRecord> close(TrackedEntity entity, Instant now, LifecycleJournal journal) {
        AccidentLifecycle lifecycle = entity.getLifecycle();
        lifecycle.transitionTo(CLEARED, now, journal);

        Optional<AccidentRecord> closed = ledger.close(entity.getEntityId(), now);
        closed.ifPresent(record -> {
            journal.emit(AccidentClearedEvent.of(record));
            log.info("Accident {} cleared on entity {}", record.id(), entity.getEntityId());
        });

        entity.resetAccumulators();
        lifecycle.resetCounters();
        lifecycle.transitionTo(NORMAL, now, journal);
        return closed;
    }
}
