package com.example.counseling.session.service;

import com.example.counseling.session.dto.NotificationResponse;
import com.example.counseling.session.identity.AuthenticatedUser;
import com.example.counseling.shared.model.SessionMessage;
import com.example.counseling.shared.util.Constants.FrameType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the JSON text frames sent to socket clients. Every frame carries a "type" tag first.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FrameFactory {

    private final ObjectMapper objectMapper;

    /**
     * Generic method to create any frame.
     * @param type The frame type tag.
     * @param fields Payload fields, written in iteration order after the tag.
     */
    public String createFrame(FrameType type, Map<String, ?> fields) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("type", type.getWireName());
        fields.forEach((name, value) -> node.set(name, objectMapper.valueToTree(value)));
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            log.error("Error serializing payload for frame type {}: {}", type, e.getMessage());
            throw new IllegalStateException("Unable to serialize " + type.getWireName() + " frame", e);
        }
    }

    public String userJoined(AuthenticatedUser user) {
        return createFrame(FrameType.USER_JOINED, userFields(user));
    }

    public String userLeft(AuthenticatedUser user) {
        return createFrame(FrameType.USER_LEFT, userFields(user));
    }

    public String sessionStarted(OffsetDateTime startedAt) {
        return createFrame(FrameType.SESSION_STARTED, Map.of(
                "status", "active",
                "started_at", startedAt.toString()));
    }

    public String sessionEnded(OffsetDateTime endedAt) {
        return createFrame(FrameType.SESSION_ENDED, Map.of(
                "status", "completed",
                "ended_at", endedAt.toString()));
    }

    public String sessionCancelled() {
        return createFrame(FrameType.SESSION_CANCELLED, Map.of("status", "cancelled"));
    }

    public String sessionNoShow(OffsetDateTime endedAt) {
        return createFrame(FrameType.SESSION_NO_SHOW, Map.of(
                "status", "no_show",
                "ended_at", endedAt.toString()));
    }

    public String webrtcSignal(JsonNode signal, String senderId, JsonNode target) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("signal", signal);
        fields.put("sender", senderId);
        if (target != null && !target.isNull()) {
            fields.put("target", target);
        }
        return createFrame(FrameType.WEBRTC_SIGNAL, fields);
    }

    public String chatMessage(SessionMessage message) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("message", message.getMessage());
        fields.put("sender", message.getSenderName());
        fields.put("sender_id", message.getSenderId());
        fields.put("message_id", message.getId());
        fields.put("timestamp", message.getTimestamp().toString());
        return createFrame(FrameType.CHAT_MESSAGE, fields);
    }

    public String newNotification(NotificationResponse notification) {
        return createFrame(FrameType.NEW_NOTIFICATION, Map.of("notification", notification));
    }

    public String notificationCount(long count) {
        return createFrame(FrameType.NOTIFICATION_COUNT, Map.of("count", count));
    }

    /**
     * Reply to get_notifications. {@code count} is the user's unread total, not the size of the page.
     */
    public String notifications(List<NotificationResponse> notifications, long unreadCount) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("notifications", notifications);
        fields.put("count", unreadCount);
        return createFrame(FrameType.NOTIFICATIONS, fields);
    }

    public String error(String message) {
        return createFrame(FrameType.ERROR, Map.of("message", message));
    }

    private Map<String, Object> userFields(AuthenticatedUser user) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("user_id", user.userId());
        fields.put("username", user.username());
        return fields;
    }
}
