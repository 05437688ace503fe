package com.chatwire.realtime.common.config;

import com.chatwire.realtime.call.ws.CallWsHandler;
import com.chatwire.realtime.chat.ws.ChatWsHandler;
import com.chatwire.realtime.chat.ws.NotificationWsHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

import java.util.Arrays;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final ChatWsHandler chatWsHandler;
    private final CallWsHandler callWsHandler;
    private final NotificationWsHandler notificationWsHandler;
    private final String[] allowedOrigins;

    public WebSocketConfig(
            ChatWsHandler chatWsHandler,
            CallWsHandler callWsHandler,
            NotificationWsHandler notificationWsHandler,
            @Value("${app.ws.allowed-origins:*}") String allowedOriginsCsv
    ) {
        this.chatWsHandler = chatWsHandler;
        this.callWsHandler = callWsHandler;
        this.notificationWsHandler = notificationWsHandler;
        this.allowedOrigins = Arrays.stream(allowedOriginsCsv.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toArray(String[]::new);
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(chatWsHandler, "/ws/chat/*").setAllowedOriginPatterns(allowedOrigins);
        registry.addHandler(callWsHandler, "/ws/call/*").setAllowedOriginPatterns(allowedOrigins);
        registry.addHandler(notificationWsHandler, "/ws/notifications").setAllowedOriginPatterns(allowedOrigins);
    }
}
