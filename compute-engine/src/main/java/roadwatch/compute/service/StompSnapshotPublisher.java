package roadwatch.compute.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;
import roadwatch.compute.config.EngineConfig;
import roadwatch.config.ApiRoutes;
import roadwatch.domain.dto.control.StreamStatusDTO;
import roadwatch.domain.event.AccidentClearedEvent;
import roadwatch.domain.event.AccidentEvent;
import roadwatch.domain.event.AccidentOpenedEvent;
import roadwatch.domain.snapshot.TrafficSnapshot;

import java.util.List;

/**
 * Difunde instantáneas y eventos por STOMP desde el hilo del publicador.
 * Un fallo de envío se registra y no afecta al bucle de ticks.
 */
@Slf4j
@Component
public class StompSnapshotPublisher implements SnapshotPublisher {

    private final SimpMessagingTemplate messagingTemplate;
    private final ThreadPoolTaskExecutor executor;

    public StompSnapshotPublisher(SimpMessagingTemplate messagingTemplate,
                                  @Qualifier(EngineConfig.PUBLISHER_EXECUTOR) ThreadPoolTaskExecutor executor) {
        this.messagingTemplate = messagingTemplate;
        this.executor = executor;
    }

    @Override
    public void publishTick(TrafficSnapshot snapshot, List<AccidentEvent> events) {
        executor.execute(() -> {
            send(ApiRoutes.TOPIC_TRAFFIC, snapshot);
            events.forEach(this::sendEvent);
        });
    }

    @Override
    public void publishEvents(List<AccidentEvent> events) {
        if (events.isEmpty()) {
            return;
        }
        executor.execute(() -> events.forEach(this::sendEvent));
    }

    @Override
    public void publishStatus(StreamStatusDTO status) {
        executor.execute(() -> send(ApiRoutes.TOPIC_STREAM_STATUS, status));
    }

    private void sendEvent(AccidentEvent event) {
        if (event instanceof AccidentOpenedEvent) {
            send(ApiRoutes.TOPIC_ACCIDENT_OPENED, event);
        } else if (event instanceof AccidentClearedEvent) {
            send(ApiRoutes.TOPIC_ACCIDENT_CLEARED, event);
        } else {
            log.warn("Unknown accident event type {}", event.getClass().getSimpleName());
        }
    }

    private void send(String destination, Object payload) {
        try {
            messagingTemplate.convertAndSend(destination, payload);
            log.debug("Sent update to {}", destination);
        } catch (RuntimeException e) {
            log.warn("Failed to publish to {}: {}", destination, e.getMessage());
        }
    }
}
