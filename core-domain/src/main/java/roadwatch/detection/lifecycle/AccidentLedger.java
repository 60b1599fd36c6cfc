package roadwatch.detection.lifecycle;

import lombok.extern.slf4j.Slf4j;
import roadwatch.domain.accident.AccidentRecord;
import roadwatch.domain.accident.AccidentStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Libro de registros de accidentes en memoria.
 * <ul>
 *     <li>Activos: como máximo uno por entidad, indexados por entidad.</li>
 *     <li>Histórico: todos los registros abiertos, en orden de apertura y con su última
 *     versión, acotado a {@code capacity} (se expulsa el despejado más antiguo).</li>
 * </ul>
 * No es thread-safe: sólo el hilo del tick lo modifica.
 */
@Slf4j
public class AccidentLedger {

    private final Map<String, AccidentRecord> activeByEntity = new LinkedHashMap<>();
    private final LinkedHashMap<String, AccidentRecord> historyById = new LinkedHashMap<>();
    private int capacity;

    public AccidentLedger(int capacity) {
        setCapacity(capacity);
    }

    public void setCapacity(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("La capacidad del histórico debe ser positiva.");
        }
        this.capacity = capacity;
        trimHistory();
    }

    /**
     * Registra un accidente nuevo. Si la entidad ya tiene uno activo, el candidato se
     * fusiona con el existente en lugar de abrir un segundo registro.
     *
     * @return el registro activo resultante.
     */
    public AccidentRecord open(AccidentRecord candidate) {
        AccidentRecord existing = activeByEntity.get(candidate.entityId());
        if (existing != null) {
            log.warn("Entity {} already has active accident {}; coalescing instead of opening a second record",
                    candidate.entityId(), existing.id());
            return reinforce(candidate.entityId(), candidate.confidence(), candidate.detectionMethods())
                    .orElse(existing);
        }
        AccidentRecord opened = candidate.withStatus(AccidentStatus.ACTIVE).withClosedAt(null);
        store(opened);
        return opened;
    }

    /**
     * Refuerza el registro activo: confianza como máximo acumulado y unión de métodos.
     */
    public Optional<AccidentRecord> reinforce(String entityId, double confidence, Set<String> methods) {
        AccidentRecord current = activeByEntity.get(entityId);
        if (current == null) {
            return Optional.empty();
        }
        Set<String> merged = new TreeSet<>(current.detectionMethods());
        merged.addAll(methods);
        double maxConfidence = Math.max(current.confidence(), confidence);

        if (merged.equals(current.detectionMethods()) && maxConfidence == current.confidence()) {
            return Optional.of(current);
        }
        AccidentRecord updated = current.withConfidence(maxConfidence).withDetectionMethods(merged);
        store(updated);
        return Optional.of(updated);
    }

    /**
     * Cierra el registro activo de la entidad, si lo hay.
     */
    public Optional<AccidentRecord> close(String entityId, Instant closedAt) {
        AccidentRecord current = activeByEntity.remove(entityId);
        if (current == null) {
            return Optional.empty();
        }
        AccidentRecord closed = current.withStatus(AccidentStatus.CLEARED).withClosedAt(closedAt);
        historyById.put(closed.id(), closed);
        trimHistory();
        return Optional.of(closed);
    }

    public Optional<AccidentRecord> activeFor(String entityId) {
        return Optional.ofNullable(activeByEntity.get(entityId));
    }

    public List<AccidentRecord> activeRecords() {
        return List.copyOf(activeByEntity.values());
    }

    public int activeCount() {
        return activeByEntity.size();
    }

    /**
     * Últimos registros (más reciente primero), activos o despejados.
     */
    public List<AccidentRecord> history(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        List<AccidentRecord> newestFirst = new ArrayList<>(historyById.values());
        Collections.reverse(newestFirst);
        return List.copyOf(newestFirst.subList(0, Math.min(limit, newestFirst.size())));
    }

    private void store(AccidentRecord record) {
        activeByEntity.put(record.entityId(), record);
        historyById.put(record.id(), record);
        trimHistory();
    }

    /**
     * Expulsa los despejados más antiguos. Un registro activo nunca se expulsa, de modo que
     * su versión despejada siempre llega al histórico; con más activos que capacidad el
     * histórico la supera temporalmente.
     */
    private void trimHistory() {
        var iterator = historyById.values().iterator();
        while (historyById.size() > capacity && iterator.hasNext()) {
            if (!iterator.next().isActive()) {
                iterator.remove();
            }
        }
    }
}
