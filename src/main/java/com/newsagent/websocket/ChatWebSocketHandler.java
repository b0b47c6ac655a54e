package com.newsagent.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.newsagent.model.ErrorMessage;
import com.newsagent.model.UserMessage;
import com.newsagent.service.ChatService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;

/**
 * Chat over a WebSocket: every text frame is a {@link UserMessage}, every reply a bot response
 * or an error message. Errors are reported on the socket and the session stays open.
 */
@Component
public class ChatWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(ChatWebSocketHandler.class);

    private final ChatService chatService;
    private final ObjectMapper objectMapper;

    public ChatWebSocketHandler(ChatService chatService, ObjectMapper objectMapper) {
        this.chatService = chatService;
        this.objectMapper = objectMapper;
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage frame) throws IOException {
        Object reply;
        try {
            UserMessage message = objectMapper.readValue(frame.getPayload(), UserMessage.class);
            if (message.content() == null || message.content().isBlank()) {
                reply = ErrorMessage.of("content must not be blank");
            } else {
                reply = chatService.reply(message);
            }
        } catch (JsonProcessingException e) {
            reply = ErrorMessage.of("Malformed message: " + e.getOriginalMessage());
        } catch (RuntimeException e) {
            log.error("Chat over WebSocket failed for session {}: {}", session.getId(), e.getMessage(), e);
            reply = ErrorMessage.of(e.getMessage());
        }
        session.sendMessage(new TextMessage(objectMapper.writeValueAsString(reply)));
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("WebSocket transport error on session {}: {}", session.getId(), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        log.debug("WebSocket session {} closed: {}", session.getId(), status);
    }
}
