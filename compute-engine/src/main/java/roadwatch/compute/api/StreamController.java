package roadwatch.compute.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import roadwatch.compute.service.StreamOrchestrator;
import roadwatch.config.ApiRoutes;
import roadwatch.config.DetectionConfig;
import roadwatch.config.DetectionOptions;
import roadwatch.domain.dto.control.StreamStatusDTO;

import java.time.Duration;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping(ApiRoutes.STREAM)
@Tag(name = "Flujo", description = "Arranque, parada, estado y configuración del motor de detección")
public class StreamController {

    private final StreamOrchestrator orchestrator;
    private final Duration commandTimeout;

    public StreamController(StreamOrchestrator orchestrator,
                            @Value("${roadwatch.stream.command-timeout:5s}") Duration commandTimeout) {
        this.orchestrator = orchestrator;
        this.commandTimeout = commandTimeout;
    }

    @PostMapping("/start")
    @Operation(summary = "Arrancar el bucle de ticks")
    public StreamStatusDTO start() {
        log.info(">>> API: stream start requested");
        return orchestrator.start();
    }

    @PostMapping("/stop")
    @Operation(summary = "Detener el bucle de ticks")
    public StreamStatusDTO stop() {
        log.info(">>> API: stream stop requested");
        return orchestrator.stop();
    }

    @GetMapping("/status")
    @Operation(summary = "Estado del flujo y del motor")
    public StreamStatusDTO status() {
        return orchestrator.status();
    }

    @GetMapping("/config")
    @Operation(summary = "Configuración de detección vigente")
    public DetectionConfig config() {
        return orchestrator.currentConfig();
    }

    /**
     * Se valida al recibirla (400 si no es válida) y se aplica en el siguiente límite de tick.
     */
    @PutMapping("/config")
    @Operation(summary = "Reconfigurar umbrales, quórum y rachas en caliente")
    public ResponseEntity<Object> reconfigure(@RequestBody DetectionOptions options) {
        log.info(">>> API: reconfiguration requested: {}", options);
        return CommandAwaiter.await(orchestrator.reconfigure(options), commandTimeout)
                .<ResponseEntity<Object>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("status", "QUEUED")));
    }
}
