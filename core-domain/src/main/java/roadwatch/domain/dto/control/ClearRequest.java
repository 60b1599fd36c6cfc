package roadwatch.domain.dto.control;

/**
 * Petición de despeje manual. Sin entidad se despejan todos los accidentes activos.
 */
public record ClearRequest(String entityId) {}
