package roadwatch.compute.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import roadwatch.compute.simulation.TrafficSimulator;
import roadwatch.detection.engine.DetectionEngine;

import java.time.Clock;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Cableado del motor: un único contexto de detección, la fuente simulada y los dos
 * hilos del servicio (bucle de ticks y publicador).
 */
@Slf4j
@Configuration
public class EngineConfig {

    public static final String TICK_SCHEDULER = "tickScheduler";
    public static final String PUBLISHER_EXECUTOR = "publisherExecutor";

    @Bean
    public DetectionEngine detectionEngine(RoadWatchProperties properties) {
        DetectionEngine engine = new DetectionEngine(
                properties.getDetection().toDetectionConfig(properties.getStream().getTickInterval()));
        log.info("Detection engine ready: {} voters, config {}", engine.getVoterCount(), engine.getConfig());
        return engine;
    }

    @Bean
    public TrafficSimulator trafficSimulator(RoadWatchProperties properties) {
        return new TrafficSimulator(properties.getSimulator().toSettings());
    }

    /**
     * Hilo único del bucle de ticks: es el único que modifica el estado del motor.
     */
    @Bean(name = TICK_SCHEDULER)
    public ThreadPoolTaskScheduler tickScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("tick-loop-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }

    /**
     * Publicación fire-and-forget. Con la cola llena se descarta lo más antiguo
     * para que un suscriptor lento nunca frene el siguiente tick.
     */
    @Bean(name = PUBLISHER_EXECUTOR)
    public ThreadPoolTaskExecutor publisherExecutor(RoadWatchProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(properties.getStream().getPublisherQueueCapacity());
        executor.setThreadNamePrefix("publisher-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.DiscardOldestPolicy());
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
