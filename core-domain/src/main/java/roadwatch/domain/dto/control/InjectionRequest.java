package roadwatch.domain.dto.control;

/**
 * Petición de inyección manual.
 *
 * @param entityId        Entidad objetivo; si es nula se elige una al azar.
 * @param durationSeconds Duración del accidente simulado; si es nula se usa la duración por defecto.
 */
public record InjectionRequest(
        String entityId,
        Long durationSeconds
) {}
