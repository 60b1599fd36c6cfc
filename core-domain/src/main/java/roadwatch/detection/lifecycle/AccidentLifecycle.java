package roadwatch.detection.lifecycle;

import lombok.Getter;
import roadwatch.domain.accident.LifecyclePhase;
import roadwatch.domain.accident.PhaseTransition;

import java.time.Instant;

/**
 * Máquina de estados de una entidad: fase actual, rachas consecutivas y ticks de
 * retención forzada que quedan tras una inyección manual.
 * <p>
 * Sólo el gestor del ciclo de vida la modifica. Toda transición se valida contra
 * {@link LifecyclePhase#allowedNext()}.
 */
@Getter
public class AccidentLifecycle {

    private final String entityId;
    private LifecyclePhase phase = LifecyclePhase.NORMAL;
    private int anomalousRun;
    private int normalRun;
    private int forcedHoldTicks;

    public AccidentLifecycle(String entityId) {
        this.entityId = entityId;
    }

    void transitionTo(LifecyclePhase next, Instant at, LifecycleJournal journal) {
        if (!phase.canTransitionTo(next)) {
            throw new IllegalStateException(String.format(
                    "Transición ilegal para %s: %s -> %s", entityId, phase, next));
        }
        journal.record(new PhaseTransition(entityId, phase, next, at));
        phase = next;
    }

    int incrementAnomalousRun() {
        normalRun = 0;
        return ++anomalousRun;
    }

    int incrementNormalRun() {
        anomalousRun = 0;
        return ++normalRun;
    }

    void holdFor(int ticks) {
        forcedHoldTicks = Math.max(forcedHoldTicks, ticks);
    }

    /**
     * Consume un tick de retención.
     *
     * @return {@code true} si la entidad seguía retenida en este tick.
     */
    boolean consumeHoldTick() {
        if (forcedHoldTicks <= 0) {
            return false;
        }
        forcedHoldTicks--;
        return true;
    }

    void resetCounters() {
        anomalousRun = 0;
        normalRun = 0;
        forcedHoldTicks = 0;
    }

    public boolean isHeld() {
        return forcedHoldTicks > 0;
    }
}
