package roadwatch.compute.api;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import roadwatch.domain.exception.InvalidConfigurationException;

import java.time.Instant;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * Reconfiguración rechazada. La configuración vigente sigue en vigor.
     * Log: WARN (error del cliente, no del sistema).
     */
    @ExceptionHandler(InvalidConfigurationException.class)
    public ResponseEntity<Object> handleInvalidConfiguration(InvalidConfigurationException ex) {
        log.warn("Rejected configuration: {}", ex.getViolations());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of(
                "timestamp", Instant.now(),
                "status", 400,
                "error", "Invalid Configuration",
                "message", ex.getMessage(),
                "violations", ex.getViolations()
        ));
    }

    /**
     * Parámetros de petición fuera de rango o cuerpo ilegible.
     */
    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<Object> handleBadRequest(Exception ex) {
        log.warn("Bad request: {}", ex.getMessage());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of(
                "timestamp", Instant.now(),
                "status", 400,
                "error", "Bad Request",
                "message", String.valueOf(ex.getMessage())
        ));
    }

    /**
     * Maneja todo lo demás.
     * Log: ERROR (incluye la traza completa).
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Object> handleGeneralErrors(Exception ex) {
        log.error("Unexpected System Error occurred", ex);

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of(
                "timestamp", Instant.now(),
                "status", 500,
                "error", "Internal Server Error",
                "message", "An unexpected error occurred. Please contact support referencing this timestamp."
        ));
    }
}
