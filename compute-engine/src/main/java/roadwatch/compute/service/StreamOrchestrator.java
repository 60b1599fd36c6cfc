package roadwatch.compute.service;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Service;
import roadwatch.compute.config.EngineConfig;
import roadwatch.compute.config.RoadWatchProperties;
import roadwatch.config.DetectionConfig;
import roadwatch.config.DetectionOptions;
import roadwatch.detection.engine.DetectionEngine;
import roadwatch.detection.engine.TickResult;
import roadwatch.domain.accident.AccidentRecord;
import roadwatch.domain.dto.control.ClearResult;
import roadwatch.domain.dto.control.InjectionResult;
import roadwatch.domain.dto.control.StreamStatusDTO;
import roadwatch.domain.event.AccidentEvent;
import roadwatch.domain.traffic.SpeedSource;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Conduce el bucle de ticks y hace de fachada del plano de control.
 * <p>
 * Todo lo que toca el estado del motor corre en el hilo {@code tick-loop}:
 * los ticks programados y, con el flujo detenido, el drenaje de órdenes pendientes.
 * La publicación se delega al {@link SnapshotPublisher}, que no bloquea.
 */
@Slf4j
@Service
public class StreamOrchestrator {

    private final DetectionEngine engine;
    private final SpeedSource source;
    private final ThreadPoolTaskScheduler scheduler;
    private final SnapshotPublisher publisher;
    private final Clock clock;
    private final RoadWatchProperties properties;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong tickCount = new AtomicLong();
    private volatile Instant lastTickAt;
    private ScheduledFuture<?> tickHandle;

    public StreamOrchestrator(DetectionEngine engine,
                              SpeedSource source,
                              @Qualifier(EngineConfig.TICK_SCHEDULER) ThreadPoolTaskScheduler scheduler,
                              SnapshotPublisher publisher,
                              Clock clock,
                              RoadWatchProperties properties) {
        this.engine = engine;
        this.source = source;
        this.scheduler = scheduler;
        this.publisher = publisher;
        this.clock = clock;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void autoStart() {
        if (properties.getStream().isAutoStart()) {
            start();
        }
    }

    @PreDestroy
    public void shutdown() {
        stop();
    }

    // =========================================================================
    // CICLO DE VIDA DEL FLUJO
    // =========================================================================

    public synchronized StreamStatusDTO start() {
        if (running.compareAndSet(false, true)) {
            Duration interval = engine.getConfig().tickInterval();
            tickHandle = scheduler.scheduleAtFixedRate(this::runTick, interval);
            log.info(">>> Stream started (tick every {} ms)", interval.toMillis());
            publisher.publishStatus(status());
        } else {
            log.debug("Start requested but the stream is already running");
        }
        return status();
    }

    public synchronized StreamStatusDTO stop() {
        if (running.compareAndSet(true, false)) {
            if (tickHandle != null) {
                tickHandle.cancel(false);
                tickHandle = null;
            }
            log.info(">>> Stream stopped after {} tick(s)", tickCount.get());
            drainWhenIdle();
            publisher.publishStatus(status());
        }
        return status();
    }

    public boolean isRunning() {
        return running.get();
    }

    void runTick() {
        if (!running.get()) {
            return;
        }
        try {
            tick();
        } catch (RuntimeException e) {
            log.error("Tick failed; the loop continues with the next tick", e);
        }
    }

    /**
     * Un tick del motor seguido de la publicación de su resultado.
     */
    TickResult tick() {
        Instant now = clock.instant();
        TickResult result = engine.tick(now, source);
        tickCount.incrementAndGet();
        lastTickAt = now;

        publisher.publishTick(result.snapshot(), result.events());
        if (!result.events().isEmpty()) {
            log.debug("Tick {} produced {} event(s)", now, result.events().size());
        }
        return result;
    }

    // =========================================================================
    // PLANO DE CONTROL
    // =========================================================================

    public CompletableFuture<InjectionResult> inject(String entityId, Duration duration) {
        Duration effective = duration != null ? duration : properties.getStream().getDefaultInjectionDuration();
        CompletableFuture<InjectionResult> future = engine.submitInjection(entityId, effective);
        drainWhenIdle();
        return future;
    }

    public CompletableFuture<ClearResult> clear(String entityId) {
        CompletableFuture<ClearResult> future = engine.submitClear(entityId);
        drainWhenIdle();
        return future;
    }

    public CompletableFuture<DetectionConfig> reconfigure(DetectionOptions options) {
        CompletableFuture<DetectionConfig> future = engine.submitReconfigure(options);
        drainWhenIdle();
        return future;
    }

    /**
     * Con el flujo detenido nadie drenaría la bandeja: se encarga un drenaje al hilo del tick.
     */
    private void drainWhenIdle() {
        if (!running.get() && engine.hasPendingCommands()) {
            scheduler.execute(this::drainPending);
        }
    }

    void drainPending() {
        try {
            List<AccidentEvent> events = engine.drainCommands(clock.instant(), source);
            publisher.publishEvents(events);
        } catch (RuntimeException e) {
            log.error("Failed to apply pending commands", e);
        }
    }

    // =========================================================================
    // LECTURA
    // =========================================================================

    public StreamStatusDTO status() {
        return new StreamStatusDTO(
                running.get(),
                tickCount.get(),
                lastTickAt,
                engine.knownEntities().size(),
                engine.getActiveAccidents().size(),
                engine.pendingCommandCount(),
                engine.getConfig());
    }

    public DetectionConfig currentConfig() {
        return engine.getConfig();
    }

    public List<AccidentRecord> activeAccidents() {
        return engine.getActiveAccidents();
    }

    public List<AccidentRecord> history(Integer limit) {
        int effective = limit == null ? properties.getStream().getHistoryLimit() : limit;
        if (effective <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        return engine.getHistory(effective);
    }
}
