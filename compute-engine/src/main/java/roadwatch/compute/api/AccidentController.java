package roadwatch.compute.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import roadwatch.compute.service.StreamOrchestrator;
import roadwatch.config.ApiRoutes;
import roadwatch.detection.engine.DetectionEngine;
import roadwatch.domain.accident.AccidentRecord;
import roadwatch.domain.dto.control.ClearRequest;
import roadwatch.domain.dto.control.InjectionRequest;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@RestController
@RequestMapping(ApiRoutes.ACCIDENTS)
@Tag(name = "Accidentes", description = "Accidentes activos, histórico y órdenes manuales")
public class AccidentController {

    private final StreamOrchestrator orchestrator;
    private final Duration commandTimeout;

    public AccidentController(StreamOrchestrator orchestrator,
                              @Value("${roadwatch.stream.command-timeout:5s}") Duration commandTimeout) {
        this.orchestrator = orchestrator;
        this.commandTimeout = commandTimeout;
    }

    @GetMapping("/active")
    @Operation(summary = "Accidentes activos")
    public List<AccidentRecord> active() {
        return orchestrator.activeAccidents();
    }

    @GetMapping("/history")
    @Operation(summary = "Últimos accidentes registrados, más reciente primero")
    public List<AccidentRecord> history(@RequestParam(required = false) Integer limit) {
        return orchestrator.history(limit);
    }

    @PostMapping("/inject")
    @Operation(summary = "Inyectar un accidente manual (entidad al azar si no se indica)")
    public ResponseEntity<Object> inject(@RequestBody(required = false) InjectionRequest request) {
        String entityId = request == null ? null : request.entityId();
        Long seconds = request == null ? null : request.durationSeconds();
        if (seconds != null && seconds <= 0) {
            throw new IllegalArgumentException("duration_seconds must be positive");
        }
        if (seconds != null && seconds > DetectionEngine.MAX_INJECTION_DURATION.toSeconds()) {
            throw new IllegalArgumentException("duration_seconds must not exceed "
                    + DetectionEngine.MAX_INJECTION_DURATION.toSeconds());
        }
        Duration duration = seconds == null ? null : Duration.ofSeconds(seconds);

        log.info(">>> API: injection requested (entity: {}, duration: {})", entityId, duration);
        return respond(CommandAwaiter.await(orchestrator.inject(entityId, duration), commandTimeout));
    }

    @PostMapping("/clear")
    @Operation(summary = "Despejar manualmente un accidente (todos si no se indica entidad)")
    public ResponseEntity<Object> clear(@RequestBody(required = false) ClearRequest request) {
        String entityId = request == null ? null : request.entityId();

        log.info(">>> API: clear requested (entity: {})", entityId == null ? "ALL" : entityId);
        return respond(CommandAwaiter.await(orchestrator.clear(entityId), commandTimeout));
    }

    private static ResponseEntity<Object> respond(Optional<?> result) {
        return result.<ResponseEntity<Object>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("status", "QUEUED")));
    }
}
