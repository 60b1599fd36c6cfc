package roadwatch.compute;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Punto de entrada del servicio de detección de accidentes.
 * <p>
 * Arranca el contexto de Spring Boot (Web, WebSocket) y, si
 * {@code roadwatch.stream.auto-start} está activo, el bucle de ticks.
 */
@SpringBootApplication(scanBasePackages = "roadwatch")
@ConfigurationPropertiesScan("roadwatch")
public class RoadWatchApplication {

    public static void main(String[] args) {
        // El puerto se puede configurar vía args: --server.port=9090
        SpringApplication.run(RoadWatchApplication.class, args);
    }
}
