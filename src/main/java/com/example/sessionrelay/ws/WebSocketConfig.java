package com.example.sessionrelay.ws;

import com.example.sessionrelay.config.GatewayProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;
import org.springframework.web.socket.config.annotation.*;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final RelayWebSocketHandler relayWebSocketHandler;
    private final GatewayProperties properties;

    public WebSocketConfig(RelayWebSocketHandler relayWebSocketHandler, GatewayProperties properties) {
        this.relayWebSocketHandler = relayWebSocketHandler;
        this.properties = properties;
    }

    /**
     * Feed and profile responses relayed by the browser easily exceed the container's ~8KB default.
     */
    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(properties.getMaxTextMessageBytes());
        container.setMaxBinaryMessageBufferSize(properties.getMaxTextMessageBytes());
        return container;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(relayWebSocketHandler, "/ws/relay")
                .setAllowedOriginPatterns(properties.getAllowedOrigins().toArray(new String[0]));
    }
}
