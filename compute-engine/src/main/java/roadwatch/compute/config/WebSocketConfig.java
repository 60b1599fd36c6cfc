package roadwatch.compute.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;
import roadwatch.config.ApiRoutes;

@Configuration
@EnableWebSocketMessageBroker
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {

    @Override
    public void configureMessageBroker(MessageBrokerRegistry config) {
        // Broker en memoria: instantáneas, eventos de accidente y estado del flujo
        config.enableSimpleBroker("/topic");
        // Prefijo de las órdenes que envían los clientes (/app/stream/start, /app/stream/stop)
        config.setApplicationDestinationPrefixes("/app");
    }

    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        registry.addEndpoint(ApiRoutes.WS_ENDPOINT)
                .setAllowedOriginPatterns("*") // Be careful in production
                .withSockJS();
    }
}
