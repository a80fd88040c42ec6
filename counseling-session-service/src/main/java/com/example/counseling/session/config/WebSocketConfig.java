package com.example.counseling.session.config;

import com.example.counseling.session.websocket.ConnectionGateway;
import com.example.counseling.shared.config.AppProperties;
import com.example.counseling.shared.config.CorrelationIdFilter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.HandlerMapping;
import org.springframework.web.reactive.handler.SimpleUrlHandlerMapping;
import org.springframework.web.reactive.socket.server.support.HandshakeWebSocketService;
import org.springframework.web.reactive.socket.server.support.WebSocketHandlerAdapter;

import java.util.LinkedHashMap;
import java.util.Map;

@Configuration
public class WebSocketConfig {

    @Bean
    public HandlerMapping webSocketHandlerMapping(ConnectionGateway gateway, AppProperties appProperties) {
        AppProperties.Websocket paths = appProperties.getWebsocket();
        Map<String, Object> urlMap = new LinkedHashMap<>();
        urlMap.put(withoutSlash(paths.getLiveSessionPath()) + "/{roomId}", gateway);
        urlMap.put(withoutSlash(paths.getLiveSessionPath()) + "/{roomId}/", gateway);
        urlMap.put(withoutSlash(paths.getChatPath()) + "/{roomId}", gateway);
        urlMap.put(withoutSlash(paths.getChatPath()) + "/{roomId}/", gateway);
        urlMap.put(withoutSlash(paths.getNotificationsPath()), gateway);
        urlMap.put(withoutSlash(paths.getNotificationsPath()) + "/", gateway);
        // Ahead of the annotated controllers.
        return new SimpleUrlHandlerMapping(urlMap, -1);
    }

    @Bean
    public WebSocketHandlerAdapter webSocketHandlerAdapter() {
        HandshakeWebSocketService webSocketService = new HandshakeWebSocketService();
        // Carries the handshake's correlation id into the socket session.
        webSocketService.setSessionAttributePredicate(CorrelationIdFilter.CORRELATION_ID_ATTRIBUTE::equals);
        return new WebSocketHandlerAdapter(webSocketService);
    }

    private static String withoutSlash(String path) {
        return path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
    }
}
