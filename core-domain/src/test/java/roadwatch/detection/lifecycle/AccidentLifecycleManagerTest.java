package roadwatch.detection.lifecycle;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import roadwatch.config.DetectionConfig;
import roadwatch.domain.accident.AccidentRecord;
import roadwatch.domain.accident.AccidentStatus;
import roadwatch.domain.accident.LifecyclePhase;
import roadwatch.domain.accident.PhaseTransition;
import roadwatch.domain.detection.VotingDecision;
import roadwatch.domain.dto.control.InjectionResult;
import roadwatch.domain.event.AccidentClearedEvent;
import roadwatch.domain.event.AccidentEvent;
import roadwatch.domain.event.AccidentOpenedEvent;
import roadwatch.domain.traffic.GeoPoint;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class AccidentLifecycleManagerTest {

    private static final Instant T0 = Instant.parse("2026-03-02T10:00:00Z");

    private static final VotingDecision ANOMALOUS = new VotingDecision(
            true, 2, 3, 2.0 / 3.0, Set.of("CUSUM", "SPRT"));
    private static final VotingDecision STRONGLY_ANOMALOUS = new VotingDecision(
            true, 3, 3, 1.0, Set.of("CUSUM", "SPRT", "Page-Hinkley"));
    private static final VotingDecision NORMAL = new VotingDecision(
            false, 0, 3, 0.0, Set.of());

    private final DetectionConfig config = DetectionConfig.defaults(); // confirmación 3, histéresis 5
    private AccidentLifecycleManager manager;
    private StubEntity entity;

    private final List<AccidentEvent> events = new ArrayList<>();
    private final List<PhaseTransition> transitions = new ArrayList<>();
    private int tick;

    @BeforeEach
    void setUp() {
        AtomicInteger ids = new AtomicInteger();
        manager = new AccidentLifecycleManager(new AccidentLedger(10), () -> "acc-" + ids.incrementAndGet());
        entity = new StubEntity("Car1");
    }

    private void step(VotingDecision decision) {
        LifecycleJournal journal = new LifecycleJournal();
        manager.advance(entity, decision, T0.plusSeconds(2L * tick++), config, journal);
        events.addAll(journal.getEvents());
        transitions.addAll(journal.getTransitions());
    }

    private LifecyclePhase phase() {
        return entity.getLifecycle().getPhase();
    }

    @Test
    @DisplayName("Un pico aislado se descarta sin abrir registro")
    void spike_shouldBeDismissed() {
        step(ANOMALOUS);
        assertEquals(LifecyclePhase.SUSPECTED, phase());

        step(NORMAL);
        assertEquals(LifecyclePhase.NORMAL, phase());
        assertTrue(events.isEmpty());
        assertTrue(manager.getLedger().activeRecords().isEmpty());
    }

    @Test
    @DisplayName("La anomalía sostenida confirma en el tercer tick y emite un único evento de apertura")
    void sustainedAnomaly_shouldConfirmOnce() {
        step(ANOMALOUS);
        step(ANOMALOUS);
        assertEquals(LifecyclePhase.SUSPECTED, phase());
        assertTrue(events.isEmpty());

        step(ANOMALOUS);
        assertEquals(LifecyclePhase.CONFIRMED, phase());
        assertEquals(1, events.size());

        AccidentOpenedEvent opened = (AccidentOpenedEvent) events.get(0);
        assertEquals("acc-1", opened.id());
        assertEquals(2.0 / 3.0, opened.confidence(), 1e-9);
        assertEquals(List.of("CUSUM", "SPRT"), opened.detectionMethods());
        assertFalse(opened.forced());

        step(ANOMALOUS);
        assertEquals(1, events.size(), "Seguir anómalo no emite más eventos");
    }

    @Test
    @DisplayName("Con confirmación 1 se pasa por SUSPECTED y CONFIRMED en el mismo tick")
    void confirmationRunLengthOne_shouldConfirmImmediately() {
        LifecycleJournal journal = new LifecycleJournal();
        manager.advance(entity, ANOMALOUS, T0, config.withConfirmationRunLength(1), journal);

        assertEquals(LifecyclePhase.CONFIRMED, phase());
        assertEquals(List.of(LifecyclePhase.SUSPECTED, LifecyclePhase.CONFIRMED),
                journal.getTransitions().stream().map(PhaseTransition::to).toList());
        assertEquals(1, journal.getEvents().size());
    }

    @Test
    @DisplayName("Si la anomalía vuelve durante el despeje se reanuda el mismo registro")
    void clearing_shouldResumeSameRecord() {
        step(ANOMALOUS);
        step(ANOMALOUS);
        step(ANOMALOUS);
        step(NORMAL);
        step(NORMAL);
        assertEquals(LifecyclePhase.CLEARING, phase());

        step(STRONGLY_ANOMALOUS);
        assertEquals(LifecyclePhase.CONFIRMED, phase());
        assertEquals(1, events.size(), "La reanudación no emite evento");

        AccidentRecord record = manager.getLedger().activeFor("Car1").orElseThrow();
        assertEquals("acc-1", record.id());
        assertEquals(1.0, record.confidence(), 1e-9, "La confianza es el máximo observado");
        assertEquals(Set.of("CUSUM", "SPRT", "Page-Hinkley"), record.detectionMethods());

        // La racha normal vuelve a empezar: hacen falta 5 ticks completos
        for (int i = 0; i < 4; i++) {
            step(NORMAL);
        }
        assertEquals(LifecyclePhase.CLEARING, phase());
        step(NORMAL);
        assertEquals(LifecyclePhase.NORMAL, phase());
    }

    @Test
    @DisplayName("Tras la histéresis se despeja una vez, se reinician acumuladores y se vuelve a NORMAL")
    void hysteresis_shouldClearExactlyOnce() {
        step(ANOMALOUS);
        step(ANOMALOUS);
        step(ANOMALOUS);
        for (int i = 0; i < 5; i++) {
            step(NORMAL);
        }

        assertEquals(LifecyclePhase.NORMAL, phase());
        assertEquals(2, events.size());
        AccidentClearedEvent cleared = (AccidentClearedEvent) events.get(1);
        assertEquals(events.get(0).id(), cleared.id());
        assertEquals(1, entity.resets);
        assertTrue(manager.getLedger().activeRecords().isEmpty());

        AccidentRecord closed = manager.getLedger().history(1).get(0);
        assertEquals(AccidentStatus.CLEARED, closed.status());
        assertEquals(cleared.closedAt(), closed.closedAt());

        for (int i = 0; i < 10; i++) {
            step(NORMAL);
        }
        assertEquals(2, events.size());
    }

    @Test
    @DisplayName("Toda transición registrada es una transición permitida")
    void transitions_shouldAllBeLegal() {
        step(ANOMALOUS);
        step(NORMAL);
        step(ANOMALOUS);
        step(ANOMALOUS);
        step(ANOMALOUS);
        step(NORMAL);
        step(ANOMALOUS);
        for (int i = 0; i < 5; i++) {
            step(NORMAL);
        }

        assertFalse(transitions.isEmpty());
        for (PhaseTransition transition : transitions) {
            assertTrue(transition.from().canTransitionTo(transition.to()),
                    "Transición ilegal: " + transition);
        }
    }

    @Test
    @DisplayName("La inyección fuerza CONFIRMED y retiene la fase durante los ticks pedidos")
    void inject_shouldHoldConfirmed() {
        LifecycleJournal journal = new LifecycleJournal();
        InjectionResult result = manager.inject(entity, T0, Duration.ofSeconds(6), config, journal);

        assertEquals(InjectionResult.Status.INJECTED, result.status());
        assertTrue(result.record().forced());
        assertEquals(1.0, result.record().confidence());
        assertEquals(Set.of(AccidentLifecycleManager.MANUAL_METHOD), result.record().detectionMethods());
        assertEquals(entity.getLastLocation(), result.record().location());
        assertEquals(List.of(LifecyclePhase.SUSPECTED, LifecyclePhase.CONFIRMED),
                journal.getTransitions().stream().map(PhaseTransition::to).toList());
        assertEquals(3, entity.getLifecycle().getForcedHoldTicks());

        // 6 s a 2 s por tick: tres ticks retenidos aunque los votos sean normales
        step(NORMAL);
        step(NORMAL);
        step(NORMAL);
        assertEquals(LifecyclePhase.CONFIRMED, phase());

        step(NORMAL);
        assertEquals(LifecyclePhase.CLEARING, phase());
    }

    @Test
    @DisplayName("Una duración desmesurada satura la retención y el registro se anuncia igualmente")
    void inject_shouldSaturateHoldForHugeDuration() {
        LifecycleJournal journal = new LifecycleJournal();
        InjectionResult result = manager.inject(entity, T0, Duration.ofSeconds(Long.MAX_VALUE), config, journal);

        assertEquals(InjectionResult.Status.INJECTED, result.status());
        assertEquals(LifecyclePhase.CONFIRMED, phase());
        assertEquals(Integer.MAX_VALUE, entity.getLifecycle().getForcedHoldTicks());
        assertEquals(1, manager.getLedger().activeCount());
        assertEquals(1, journal.getEvents().size());
        assertInstanceOf(AccidentOpenedEvent.class, journal.getEvents().get(0));
    }

    @Test
    @DisplayName("Inyectar sobre un registro activo devuelve el registro existente sin cambios")
    void inject_shouldBeIdempotentOnActiveRecord() {
        LifecycleJournal journal = new LifecycleJournal();
        InjectionResult first = manager.inject(entity, T0, Duration.ofSeconds(10), config, journal);
        InjectionResult second = manager.inject(entity, T0.plusSeconds(2), Duration.ofSeconds(10), config, journal);

        assertEquals(InjectionResult.Status.ALREADY_ACTIVE, second.status());
        assertEquals(first.record(), second.record());
        assertEquals(1, journal.getEvents().size());
    }

    @Test
    @DisplayName("El despeje manual salta la histéresis y no hace nada sin registro activo")
    void forceClear_shouldBypassHysteresis() {
        assertEquals(Optional.empty(), manager.forceClear(entity, T0, new LifecycleJournal()));

        manager.inject(entity, T0, Duration.ofSeconds(120), config, new LifecycleJournal());
        LifecycleJournal journal = new LifecycleJournal();
        Optional<AccidentRecord> cleared = manager.forceClear(entity, T0.plusSeconds(2), journal);

        assertTrue(cleared.isPresent());
        assertEquals(LifecyclePhase.NORMAL, phase());
        assertEquals(0, entity.getLifecycle().getForcedHoldTicks());
        assertEquals(List.of(LifecyclePhase.CLEARING, LifecyclePhase.CLEARED, LifecyclePhase.NORMAL),
                journal.getTransitions().stream().map(PhaseTransition::to).toList());
        assertEquals(1, journal.getEvents().size());
        assertInstanceOf(AccidentClearedEvent.class, journal.getEvents().get(0));
        assertEquals(1, entity.resets);
    }

    @Test
    void illegalTransition_shouldThrow() {
        AccidentLifecycle lifecycle = new AccidentLifecycle("Car9");
        assertThrows(IllegalStateException.class,
                () -> lifecycle.transitionTo(LifecyclePhase.CLEARED, T0, new LifecycleJournal()));
    }

    private static final class StubEntity implements TrackedEntity {

        private final String id;
        private final AccidentLifecycle lifecycle;
        private int resets;

        StubEntity(String id) {
            this.id = id;
            this.lifecycle = new AccidentLifecycle(id);
        }

        @Override
        public String getEntityId() {
            return id;
        }

        @Override
        public AccidentLifecycle getLifecycle() {
            return lifecycle;
        }

        @Override
        public GeoPoint getLastLocation() {
            return new GeoPoint(37.7749, -122.4194);
        }

        @Override
        public void resetAccumulators() {
            resets++;
        }
    }
}
