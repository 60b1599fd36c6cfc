package roadwatch.domain.exception;

import lombok.Getter;

import java.util.List;

/**
 * Configuración de detección mal formada. Se lanza antes de aplicar nada:
 * la configuración vigente sigue en vigor.
 */
@Getter
public class InvalidConfigurationException extends RuntimeException {

    private final List<String> violations;

    public InvalidConfigurationException(List<String> violations) {
        super("Invalid detection configuration: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }
}
