package roadwatch.domain.dto.control;

import java.util.List;

/**
 * Resultado de un despeje manual. Despejar algo inexistente no es un error: {@code clearedCount} es 0.
 */
public record ClearResult(
        int clearedCount,
        List<String> clearedAccidentIds
) {

    public ClearResult {
        clearedAccidentIds = List.copyOf(clearedAccidentIds);
    }
}
