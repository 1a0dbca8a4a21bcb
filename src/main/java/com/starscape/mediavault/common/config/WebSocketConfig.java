package com.starscape.mediavault.common.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;

/**
 * WebSocket configuration for live job progress.
 * Uses STOMP over WebSocket with SockJS fallback; clients subscribe to
 * /topic/jobs/import and /topic/jobs/regeneration.
 */
@Configuration
@EnableWebSocketMessageBroker
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {
    
    private final String[] allowedOrigins;
    
    /**
     * @param allowedOriginsConfig Comma-separated list of allowed origin patterns.
     *                             "*" falls back to the localhost patterns.
     */
    public WebSocketConfig(
            @Value("${app.websocket.allowed-origins:http://localhost:*,http://127.0.0.1:*}") String allowedOriginsConfig) {
        if (allowedOriginsConfig != null && !allowedOriginsConfig.isBlank() && !allowedOriginsConfig.equals("*")) {
            this.allowedOrigins = allowedOriginsConfig.split(",");
        } else {
            this.allowedOrigins = new String[]{"http://localhost:*", "http://127.0.0.1:*"};
        }
    }
    
    @Override
    public void configureMessageBroker(MessageBrokerRegistry registry) {
        registry.enableSimpleBroker("/topic");
        registry.setApplicationDestinationPrefixes("/app");
    }
    
    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        registry.addEndpoint("/ws")
                .setAllowedOriginPatterns(allowedOrigins)
                .withSockJS();
    }
}
