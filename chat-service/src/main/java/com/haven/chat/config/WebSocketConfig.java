package com.haven.chat.config;

import com.haven.chat.websocket.ChatWebSocketHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.HandlerMapping;
import org.springframework.web.reactive.handler.SimpleUrlHandlerMapping;

import java.util.Map;

@Configuration
public class WebSocketConfig {

    public static final String CHAT_PATH = "/ws/chat";

    /**
     * Ordered ahead of the annotated controllers.
     */
    @Bean
    public HandlerMapping chatHandlerMapping(ChatWebSocketHandler chatWebSocketHandler) {
        return new SimpleUrlHandlerMapping(Map.of(CHAT_PATH, chatWebSocketHandler), -1);
    }
}
