package roadwatch.detection.engine;

import lombok.extern.slf4j.Slf4j;
import roadwatch.config.DetectionConfig;
import roadwatch.config.DetectionOptions;
import roadwatch.detection.detector.ChangePointDetector;
import roadwatch.detection.detector.CusumDetector;
import roadwatch.detection.detector.DetectorInput;
import roadwatch.detection.detector.DetectorSuite;
import roadwatch.detection.detector.PageHinkleyDetector;
import roadwatch.detection.detector.SprtDetector;
import roadwatch.detection.lifecycle.AccidentLedger;
import roadwatch.detection.lifecycle.AccidentLifecycleManager;
import roadwatch.detection.lifecycle.LifecycleJournal;
import roadwatch.detection.predictor.ArmaSpeedPredictor;
import roadwatch.detection.predictor.Forecast;
import roadwatch.detection.predictor.SpeedPredictor;
import roadwatch.detection.voting.VotingAggregator;
import roadwatch.domain.accident.AccidentRecord;
import roadwatch.domain.accident.LifecyclePhase;
import roadwatch.domain.detection.Vote;
import roadwatch.domain.detection.VotingDecision;
import roadwatch.domain.dto.control.ClearResult;
import roadwatch.domain.dto.control.InjectionResult;
import roadwatch.domain.event.AccidentEvent;
import roadwatch.domain.snapshot.EntitySnapshot;
import roadwatch.domain.snapshot.TrafficSnapshot;
import roadwatch.domain.traffic.SpeedSample;
import roadwatch.domain.traffic.SpeedSource;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.Random;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.function.Supplier;

/**
 * Motor de detección secuencial: contexto explícito con todo el estado por entidad,
 * el libro de accidentes y la bandeja de órdenes.
 * <p>
 * Modelo de hilos:
 * <ul>
 *     <li>{@link #tick} y {@link #drainCommands} deben llamarse siempre desde el mismo hilo
 *     (el bucle de ticks). Es el único escritor del estado.</li>
 *     <li>Los {@code submit*} pueden llamarse desde cualquier hilo: encolan la orden y
 *     devuelven un futuro que se completa al aplicarse, al principio del siguiente tick.</li>
 *     <li>Las vistas de lectura ({@link #getLatestSnapshot()}, {@link #getActiveAccidents()},
 *     {@link #getHistory(int)}) son copias inmutables publicadas al final de cada tick.</li>
 * </ul>
 */
@Slf4j
public class DetectionEngine {

    /**
     * Duración máxima de una inyección manual.
     */
    public static final Duration MAX_INJECTION_DURATION = Duration.ofDays(1);

    private final DetectorSuite detectorSuite;
    private final SpeedPredictor predictor;
    private final VotingAggregator aggregator;
    private final AccidentLifecycleManager lifecycleManager;
    private final Random random;

    private final Map<String, EntityState> entities = new LinkedHashMap<>();
    private final Queue<EngineCommand<?>> inbox = new ConcurrentLinkedQueue<>();

    private volatile DetectionConfig config;

    // Vistas publicadas para lectores de otros hilos
    private volatile TrafficSnapshot latestSnapshot;
    private volatile List<AccidentRecord> activeView = List.of();
    private volatile List<AccidentRecord> historyView = List.of();
    private volatile Set<String> knownEntitiesView = Set.of();

    public DetectionEngine(DetectionConfig config) {
        this(config, DetectorSuite.standard(), new ArmaSpeedPredictor(), new VotingAggregator(),
                new Random(), () -> UUID.randomUUID().toString());
    }

    public DetectionEngine(DetectionConfig config,
                           DetectorSuite detectorSuite,
                           SpeedPredictor predictor,
                           VotingAggregator aggregator,
                           Random random,
                           Supplier<String> idGenerator) {
        this.config = Objects.requireNonNull(config, "config").validate(detectorSuite.size());
        this.detectorSuite = detectorSuite;
        this.predictor = predictor;
        this.aggregator = aggregator;
        this.random = random;
        this.lifecycleManager = new AccidentLifecycleManager(new AccidentLedger(config.historyCapacity()), idGenerator);
    }

    // =========================================================================
    // PLANO DE CONTROL (cualquier hilo)
    // =========================================================================

    /**
     * Encola una inyección manual.
     *
     * @param entityId Entidad objetivo, o {@code null} para elegir una al azar.
     * @param duration Tiempo que el registro se retiene confirmado, hasta {@link #MAX_INJECTION_DURATION}.
     */
    public CompletableFuture<InjectionResult> submitInjection(String entityId, Duration duration) {
        if (duration == null || duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException("La duración de la inyección debe ser positiva.");
        }
        if (duration.compareTo(MAX_INJECTION_DURATION) > 0) {
            throw new IllegalArgumentException("La duración de la inyección no puede superar "
                    + MAX_INJECTION_DURATION.toHours() + " h.");
        }
        return enqueue(new InjectCommand(blankToNull(entityId), duration));
    }

    /**
     * Encola un despeje manual.
     *
     * @param entityId Entidad a despejar, o {@code null} para despejar todas.
     */
    public CompletableFuture<ClearResult> submitClear(String entityId) {
        return enqueue(new ClearCommand(blankToNull(entityId)));
    }

    /**
     * Valida y encola una reconfiguración.
     *
     * @throws roadwatch.domain.exception.InvalidConfigurationException si el resultado de
     *         fusionar las opciones con la configuración vigente no es válido. La
     *         configuración vigente no cambia.
     */
    public CompletableFuture<DetectionConfig> submitReconfigure(DetectionOptions options) {
        Objects.requireNonNull(options, "options");
        options.applyTo(config).validate(detectorSuite.size());
        return enqueue(new ReconfigureCommand(options));
    }

    public boolean hasPendingCommands() {
        return !inbox.isEmpty();
    }

    public int pendingCommandCount() {
        return inbox.size();
    }

    private <T> CompletableFuture<T> enqueue(EngineCommand<T> command) {
        inbox.add(command);
        log.debug("Command queued: {}", command.describe());
        return command.getFuture();
    }

    // =========================================================================
    // BUCLE DE TICKS (hilo único)
    // =========================================================================

    /**
     * Aplica las órdenes pendientes fuera de un tick (flujo detenido).
     *
     * @return eventos producidos por las órdenes.
     */
    public List<AccidentEvent> drainCommands(Instant now, SpeedSource source) {
        LifecycleJournal journal = new LifecycleJournal();
        drain(now, source, journal);
        publishViews();
        return journal.getEvents();
    }

    public TickResult tick(Instant now, List<SpeedSample> samples) {
        return tick(now, SpeedSource.of(samples));
    }

    /**
     * Un tick completo: órdenes pendientes, muestras de la fuente, predicción, detectores,
     * votación y ciclo de vida, en ese orden.
     */
    public TickResult tick(Instant now, SpeedSource source) {
        LifecycleJournal journal = new LifecycleJournal();
        drain(now, source, journal);

        DetectionConfig current = config;
        List<SpeedSample> samples = source.nextSamples(now);
        Set<String> observed = new HashSet<>();
        int rejected = 0;

        for (SpeedSample sample : samples) {
            if (sample == null || !sample.isValid()) {
                rejected++;
                continue;
            }
            if (!observed.add(sample.entityId())) {
                // Una sola muestra por entidad y tick: la primera manda
                rejected++;
                continue;
            }
            EntityState state = entities.computeIfAbsent(sample.entityId(),
                    id -> new EntityState(id, current.windowSize(), detectorSuite.create(), current.nominalSpeed()));
            process(state, sample, now, current, journal);
        }

        for (EntityState state : entities.values()) {
            if (!observed.contains(state.getEntityId())) {
                lifecycleManager.idle(state);
            }
        }

        if (rejected > 0) {
            log.warn("Dropped {} malformed or duplicate sample(s) on tick {}", rejected, now);
        }

        TrafficSnapshot snapshot = buildSnapshot(now);
        latestSnapshot = snapshot;
        publishViews();
        return new TickResult(snapshot, journal.getEvents(), journal.getTransitions(), rejected);
    }

    private void process(EntityState state, SpeedSample sample, Instant now,
                         DetectionConfig current, LifecycleJournal journal) {
        double observedSpeed = sample.speed();

        // La predicción del tick t se hace con la ventana anterior a la muestra t
        Forecast forecast = state.getWindow().isEmpty()
                ? Forecast.persistence(observedSpeed)
                : predictor.forecast(state.getWindow().toArray(), current.predictorMinSamples());
        double baseline = current.baselineMode() == DetectionConfig.BaselineMode.NOMINAL
                ? current.nominalSpeed()
                : state.getBaseline().getMean();

        state.recordObservation(sample, forecast);
        LifecyclePhase phase = state.getLifecycle().getPhase();

        if (state.getValidSamples() <= current.warmupSamples()) {
            if (phase == LifecyclePhase.NORMAL) {
                state.getBaseline().update(observedSpeed);
            }
            lifecycleManager.idle(state);
            return;
        }

        DetectorInput input = new DetectorInput(observedSpeed, forecast.value(), baseline);
        List<Vote> votes = new ArrayList<>(state.getDetectors().size());
        for (ChangePointDetector detector : state.getDetectors()) {
            votes.add(detector.update(input, current));
        }
        VotingDecision decision = aggregator.aggregate(votes, current.quorum());
        state.recordDecision(votes, decision);

        if (phase == LifecyclePhase.NORMAL && !decision.anomalous()) {
            state.getBaseline().update(observedSpeed);
        }

        lifecycleManager.advance(state, decision, now, current, journal);
    }

    private void drain(Instant now, SpeedSource source, LifecycleJournal journal) {
        EngineCommand<?> command;
        while ((command = inbox.poll()) != null) {
            command.execute(this, now, source, journal);
        }
    }

    // =========================================================================
    // APLICACIÓN DE ÓRDENES (llamadas desde el drenaje)
    // =========================================================================

    InjectionResult applyInjection(String entityId, Duration duration, Instant now,
                                   SpeedSource source, LifecycleJournal journal) {
        EntityState target;
        if (entityId != null) {
            target = entities.get(entityId);
            if (target == null) {
                log.info("Injection skipped: entity {} is unknown", entityId);
                return InjectionResult.unknownEntity(entityId);
            }
        } else {
            target = pickAvailableEntity().orElse(null);
            if (target == null) {
                log.info("Injection skipped: no entity available");
                return InjectionResult.noEntityAvailable();
            }
        }

        InjectionResult result = lifecycleManager.inject(target, now, duration, config, journal);
        if (result.status() == InjectionResult.Status.INJECTED) {
            // El registro ya está abierto y anunciado: un fallo de la fuente no lo deshace
            try {
                source.forceAccident(target.getEntityId(), now, duration);
            } catch (RuntimeException e) {
                log.warn("Source could not force accident on {}: {}", target.getEntityId(), e.getMessage());
            }
        }
        return result;
    }

    ClearResult applyClear(String entityId, Instant now, SpeedSource source, LifecycleJournal journal) {
        List<String> clearedIds = new ArrayList<>();

        if (entityId != null) {
            EntityState state = entities.get(entityId);
            if (state != null) {
                lifecycleManager.forceClear(state, now, journal).ifPresent(r -> clearedIds.add(r.id()));
            }
            source.releaseAccident(entityId);
        } else {
            for (AccidentRecord active : lifecycleManager.getLedger().activeRecords()) {
                EntityState state = entities.get(active.entityId());
                if (state != null) {
                    lifecycleManager.forceClear(state, now, journal).ifPresent(r -> clearedIds.add(r.id()));
                }
            }
            source.releaseAll();
        }

        log.info("Manual clear of {} cleared {} accident(s)",
                entityId == null ? "all entities" : entityId, clearedIds.size());
        return new ClearResult(clearedIds.size(), clearedIds);
    }

    DetectionConfig applyReconfiguration(DetectionOptions options) {
        DetectionConfig next = options.applyTo(config).validate(detectorSuite.size());
        if (next.windowSize() != config.windowSize()) {
            entities.values().forEach(state -> state.getWindow().resize(next.windowSize()));
        }
        lifecycleManager.getLedger().setCapacity(next.historyCapacity());
        config = next;
        log.info("Detection configuration updated: {}", next);
        return next;
    }

    private Optional<EntityState> pickAvailableEntity() {
        List<EntityState> candidates = new ArrayList<>();
        for (EntityState state : entities.values()) {
            if (lifecycleManager.getLedger().activeFor(state.getEntityId()).isEmpty()) {
                candidates.add(state);
            }
        }
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(candidates.get(random.nextInt(candidates.size())));
    }

    // =========================================================================
    // INSTANTÁNEAS Y VISTAS
    // =========================================================================

    private TrafficSnapshot buildSnapshot(Instant now) {
        List<EntitySnapshot> rows = new ArrayList<>(entities.size());
        for (EntityState state : entities.values()) {
            Optional<AccidentRecord> active = lifecycleManager.getLedger().activeFor(state.getEntityId());
            double confidence = active.map(AccidentRecord::confidence)
                    .orElseGet(() -> state.getLastDecision() == null ? 0.0 : state.getLastDecision().confidence());

            rows.add(new EntitySnapshot(
                    state.getEntityId(),
                    state.getLastSpeed(),
                    state.lastPredictedSpeed(),
                    state.statisticOf(CusumDetector.NAME),
                    state.statisticOf(SprtDetector.NAME),
                    state.statisticOf(PageHinkleyDetector.NAME),
                    active.isPresent(),
                    confidence,
                    state.getLifecycle().getPhase(),
                    state.getLastLocation()));
        }
        return new TrafficSnapshot(now, rows, lifecycleManager.getLedger().activeRecords());
    }

    private void publishViews() {
        AccidentLedger ledger = lifecycleManager.getLedger();
        activeView = ledger.activeRecords();
        historyView = ledger.history(config.historyCapacity());
        knownEntitiesView = Set.copyOf(entities.keySet());
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    public DetectionConfig getConfig() {
        return config;
    }

    public int getVoterCount() {
        return detectorSuite.size();
    }

    public TrafficSnapshot getLatestSnapshot() {
        return latestSnapshot;
    }

    public List<AccidentRecord> getActiveAccidents() {
        return activeView;
    }

    /**
     * Últimos registros del histórico, más reciente primero.
     */
    public List<AccidentRecord> getHistory(int limit) {
        List<AccidentRecord> history = historyView;
        if (limit <= 0) {
            return List.of();
        }
        return history.subList(0, Math.min(limit, history.size()));
    }

    public Set<String> knownEntities() {
        return knownEntitiesView;
    }

    /**
     * Estado vivo de una entidad. Sólo para el hilo del tick y para pruebas.
     */
    EntityState entityState(String entityId) {
        return entities.get(entityId);
    }
}
