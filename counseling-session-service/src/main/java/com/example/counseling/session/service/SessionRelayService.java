package com.example.counseling.session.service;

import com.example.counseling.session.fanout.ClientConnection;
import com.example.counseling.session.fanout.TopicRegistry;
import com.example.counseling.session.websocket.ConnectionContext;
import com.example.counseling.shared.config.AppProperties;
import com.example.counseling.shared.exception.FrameValidationException;
import com.example.counseling.shared.model.SessionMessage;
import com.example.counseling.shared.util.Constants.MessageType;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Validates in-room frames and rebroadcasts them to the room topic.
 * Signals are relayed untouched and never stored; chat messages are stored before they are broadcast.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SessionRelayService {

    private final TopicRegistry topicRegistry;
    private final LiveSessionService liveSessionService;
    private final FrameFactory frameFactory;
    private final AppProperties appProperties;

    public void relaySignal(ClientConnection sender, ConnectionContext context, JsonNode frame) {
        JsonNode signal = frame.get("signal");
        if (signal == null || !signal.isObject() || signal.isEmpty()) {
            throw new FrameValidationException("webrtc_signal requires a non-empty signal object");
        }
        JsonNode signalType = signal.get("type");
        if (signalType == null || !signalType.isTextual() || signalType.asText().isBlank()) {
            throw new FrameValidationException("webrtc_signal requires a signal type");
        }
        int delivered = topicRegistry.broadcast(context.topic(),
                frameFactory.webrtcSignal(signal, sender.getUser().userId(), frame.get("target")));
        log.debug("Relayed {} signal from {} to {} connections", signalType.asText(), sender.getUser().userId(), delivered);
    }

    public void relayChat(ClientConnection sender, ConnectionContext context, JsonNode frame) {
        JsonNode message = frame.get("message");
        if (message == null || !message.isTextual()) {
            throw new FrameValidationException("chat_message requires a message string");
        }
        String text = message.asText().trim();
        if (text.isEmpty()) {
            throw new FrameValidationException("chat_message requires non-empty text");
        }
        int maxLength = appProperties.getSession().getMaxChatLength();
        if (text.length() > maxLength) {
            throw new FrameValidationException("chat_message exceeds " + maxLength + " characters");
        }
        SessionMessage saved = liveSessionService.appendMessage(context.sessionId(), sender.getUser(), text, MessageType.TEXT);
        topicRegistry.broadcast(context.topic(), frameFactory.chatMessage(saved));
        log.debug("Chat message {} from {} broadcast on {}", saved.getId(), sender.getUser().userId(), context.topic());
    }
}
