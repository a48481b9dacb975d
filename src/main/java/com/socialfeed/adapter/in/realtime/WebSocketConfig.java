package com.socialfeed.adapter.in.realtime;

import com.socialfeed.infrastructure.config.AppProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final WebSocketConnectionRegistry connectionRegistry;
    private final AppProperties appProperties;

    public WebSocketConfig(WebSocketConnectionRegistry connectionRegistry, AppProperties appProperties) {
        this.connectionRegistry = connectionRegistry;
        this.appProperties = appProperties;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(connectionRegistry, appProperties.getRealtime().getEndpoint())
            .addInterceptors(new UserIdHandshakeInterceptor())
            .setAllowedOriginPatterns(appProperties.getRealtime().getAllowedOrigins());
    }
}
