package com.example.counseling.shared.util;

import java.util.Arrays;
import java.util.Optional;

public final class Constants {

    private Constants() {}

    public static final String LIVE_SESSION_TOPIC_PREFIX = "live_session_";
    public static final String CHAT_TOPIC_PREFIX = "chat_";
    public static final String NOTIFICATION_TOPIC_PREFIX = "notifications_";

    public static final String CORRELATION_ID_KEY = "correlation_id";

    public static String liveSessionTopic(String roomId) {
        return LIVE_SESSION_TOPIC_PREFIX + roomId;
    }

    public static String chatTopic(String roomId) {
        return CHAT_TOPIC_PREFIX + roomId;
    }

    public static String notificationTopic(String userId) {
        return NOTIFICATION_TOPIC_PREFIX + userId;
    }

    /**
     * Lifecycle of a live session. Values are persisted and sent on the wire in lower case.
     */
    public enum SessionStatus {
        SCHEDULED,
        WAITING,
        ACTIVE,
        COMPLETED,
        CANCELLED,
        NO_SHOW;

        public String value() {
            return name().toLowerCase();
        }

        public boolean isTerminal() {
            return this == COMPLETED || this == CANCELLED || this == NO_SHOW;
        }

        public boolean canTransitionTo(SessionStatus next) {
            return switch (this) {
                case SCHEDULED -> next == WAITING || next == CANCELLED;
                case WAITING -> next == ACTIVE || next == CANCELLED;
                case ACTIVE -> next == COMPLETED || next == NO_SHOW;
                case COMPLETED, CANCELLED, NO_SHOW -> false;
            };
        }

        public static SessionStatus fromValue(String value) {
            return valueOf(value.toUpperCase());
        }
    }

    public enum SessionType {
        VIDEO,
        AUDIO,
        CHAT;

        public String value() {
            return name().toLowerCase();
        }
    }

    public enum ParticipantRole {
        STUDENT,
        COUNSELOR,
        OBSERVER,
        NONE;

        public String value() {
            return name().toLowerCase();
        }
    }

    public enum MessageType {
        TEXT,
        SYSTEM;

        public String value() {
            return name().toLowerCase();
        }
    }

    public enum NotificationType {
        APPOINTMENT,
        REPORT,
        SYSTEM,
        REMINDER,
        FEEDBACK,
        FOLLOWUP,
        GENERAL;

        public String value() {
            return name().toLowerCase();
        }
    }

    public enum NotificationPriority {
        LOW,
        NORMAL,
        HIGH,
        URGENT;

        public String value() {
            return name().toLowerCase();
        }
    }

    /**
     * Tagged JSON frames exchanged over the WebSocket topics.
     */
    public enum FrameType {
        // client -> server
        WEBRTC_SIGNAL("webrtc_signal"),
        CHAT_MESSAGE("chat_message"),
        END_SESSION("end_session"),
        MARK_READ("mark_read"),
        MARK_ALL_READ("mark_all_read"),
        GET_NOTIFICATIONS("get_notifications"),
        DISMISS("dismiss"),
        // server -> client
        USER_JOINED("user_joined"),
        USER_LEFT("user_left"),
        SESSION_STARTED("session_started"),
        SESSION_ENDED("session_ended"),
        SESSION_CANCELLED("session_cancelled"),
        SESSION_NO_SHOW("session_no_show"),
        NEW_NOTIFICATION("new_notification"),
        NOTIFICATION_COUNT("notification_count"),
        NOTIFICATIONS("notifications"),
        ERROR("error");

        private final String wireName;

        FrameType(String wireName) {
            this.wireName = wireName;
        }

        public String getWireName() {
            return wireName;
        }

        public static Optional<FrameType> fromWireName(String wireName) {
            return Arrays.stream(values())
                    .filter(type -> type.wireName.equals(wireName))
                    .findFirst();
        }
    }
}
