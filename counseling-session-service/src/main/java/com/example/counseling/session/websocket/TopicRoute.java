package com.example.counseling.session.websocket;

import com.example.counseling.shared.config.AppProperties;
import com.example.counseling.shared.util.Constants;
import com.example.counseling.shared.util.Constants.FrameType;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Which kind of socket a handshake path addresses, and for rooms, which room.
 */
public record TopicRoute(Kind kind, String roomId) {

    private static final Pattern ROOM_ID = Pattern.compile("\\w+");

    public enum Kind {
        LIVE_SESSION(EnumSet.of(FrameType.WEBRTC_SIGNAL, FrameType.CHAT_MESSAGE, FrameType.END_SESSION)),
        CHAT(EnumSet.of(FrameType.CHAT_MESSAGE, FrameType.END_SESSION)),
        NOTIFICATIONS(EnumSet.of(FrameType.MARK_READ, FrameType.MARK_ALL_READ, FrameType.GET_NOTIFICATIONS, FrameType.DISMISS));

        private final Set<FrameType> inboundTypes;

        Kind(Set<FrameType> inboundTypes) {
            this.inboundTypes = inboundTypes;
        }

        public boolean accepts(FrameType type) {
            return inboundTypes.contains(type);
        }
    }

    public boolean isRoom() {
        return kind != Kind.NOTIFICATIONS;
    }

    /**
     * Topic a connection on this route joins. Notification topics are per user.
     */
    public String topicFor(String userId) {
        return switch (kind) {
            case LIVE_SESSION -> Constants.liveSessionTopic(roomId);
            case CHAT -> Constants.chatTopic(roomId);
            case NOTIFICATIONS -> Constants.notificationTopic(userId);
        };
    }

    public static Optional<TopicRoute> parse(String path, AppProperties.Websocket paths) {
        if (path == null) {
            return Optional.empty();
        }
        String normalized = path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
        if (normalized.equals(stripSlash(paths.getNotificationsPath()))) {
            return Optional.of(new TopicRoute(Kind.NOTIFICATIONS, null));
        }
        return room(normalized, paths.getLiveSessionPath(), Kind.LIVE_SESSION)
                .or(() -> room(normalized, paths.getChatPath(), Kind.CHAT));
    }

    private static Optional<TopicRoute> room(String path, String prefix, Kind kind) {
        String base = stripSlash(prefix) + "/";
        if (!path.startsWith(base)) {
            return Optional.empty();
        }
        String roomId = path.substring(base.length());
        if (!ROOM_ID.matcher(roomId).matches()) {
            return Optional.empty();
        }
        return Optional.of(new TopicRoute(kind, roomId));
    }

    private static String stripSlash(String value) {
        return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
    }
}
