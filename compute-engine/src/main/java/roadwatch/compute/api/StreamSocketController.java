package roadwatch.compute.api;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.stereotype.Controller;
import roadwatch.compute.service.StreamOrchestrator;

/**
 * Órdenes de arranque y parada enviadas por clientes STOMP
 * (/app/stream/start, /app/stream/stop). El nuevo estado se difunde en /topic/stream/status.
 */
@Controller
@Slf4j
@RequiredArgsConstructor
public class StreamSocketController {

    private final StreamOrchestrator orchestrator;

    @MessageMapping("/stream/start")
    public void startStream() {
        log.info("Client requested stream start");
        orchestrator.start();
    }

    @MessageMapping("/stream/stop")
    public void stopStream() {
        log.info("Client requested stream stop");
        orchestrator.stop();
    }
}
