package roadwatch.domain.accident;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.With;
import roadwatch.domain.traffic.GeoPoint;

import java.time.Instant;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Registro inmutable de un accidente. Cualquier cambio (confianza, métodos, cierre)
 * produce una nueva instancia que sustituye a la anterior en el libro de registros.
 *
 * @param id               Identificador único (UUID).
 * @param entityId         Entidad afectada.
 * @param status           ACTIVE mientras el episodio sigue abierto.
 * @param openedAt         Instante de confirmación.
 * @param closedAt         Instante de despeje; {@code null} mientras esté activo.
 * @param confidence       Confianza en [0, 1] (máximo observado mientras está activo).
 * @param detectionMethods Detectores que han votado anómalo durante el episodio.
 * @param forced           {@code true} si lo abrió una inyección manual.
 * @param location         Última posición conocida de la entidad al abrirlo (opcional).
 */
@Builder
@With
public record AccidentRecord(
        String id,
        String entityId,
        AccidentStatus status,
        Instant openedAt,
        Instant closedAt,
        double confidence,
        Set<String> detectionMethods,
        boolean forced,
        GeoPoint location
) {

    public AccidentRecord {
        detectionMethods = detectionMethods == null
                ? Collections.emptySet()
                : Collections.unmodifiableSet(new TreeSet<>(detectionMethods));
        confidence = Math.max(0.0, Math.min(1.0, confidence));
    }

    @JsonIgnore
    public boolean isActive() {
        return status == AccidentStatus.ACTIVE;
    }
}
