package roadwatch.detection.engine;

import lombok.extern.slf4j.Slf4j;
import roadwatch.detection.lifecycle.LifecycleJournal;
import roadwatch.domain.traffic.SpeedSource;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Orden del plano de control encolada para el siguiente límite de tick.
 * El futuro se completa cuando el hilo del tick la aplica.
 *
 * @param <T> Resultado de la orden.
 */
@Slf4j
abstract class EngineCommand<T> {

    private final CompletableFuture<T> future = new CompletableFuture<>();

    CompletableFuture<T> getFuture() {
        return future;
    }

    abstract String describe();

    protected abstract T apply(DetectionEngine engine, Instant now, SpeedSource source, LifecycleJournal journal);

    final void execute(DetectionEngine engine, Instant now, SpeedSource source, LifecycleJournal journal) {
        try {
            future.complete(apply(engine, now, source, journal));
        } catch (RuntimeException e) {
            log.warn("Command {} failed: {}", describe(), e.getMessage());
            future.completeExceptionally(e);
        }
    }
}
