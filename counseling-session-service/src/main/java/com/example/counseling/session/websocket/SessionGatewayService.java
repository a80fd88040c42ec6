package com.example.counseling.session.websocket;

import com.example.counseling.session.fanout.ClientConnection;
import com.example.counseling.session.fanout.TopicRegistry;
import com.example.counseling.session.identity.AuthenticatedUser;
import com.example.counseling.session.service.FrameFactory;
import com.example.counseling.session.service.LiveSessionService;
import com.example.counseling.session.service.RoleResolver;
import com.example.counseling.session.service.NotificationService;
import com.example.counseling.session.service.SessionCoordinator;
import com.example.counseling.session.service.SessionRelayService;
import com.example.counseling.shared.config.MonitoringConfig;
import com.example.counseling.shared.exception.CounselingClientException;
import com.example.counseling.shared.exception.FrameValidationException;
import com.example.counseling.shared.exception.SessionAccessDeniedException;
import com.example.counseling.shared.model.LiveSession;
import com.example.counseling.shared.util.Constants;
import com.example.counseling.shared.util.Constants.FrameType;
import com.example.counseling.shared.util.Constants.ParticipantRole;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Connection lifecycle for all three socket kinds: admit, open, per-frame dispatch, close.
 * Blocking; the reactive handler calls it on the JDBC scheduler.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SessionGatewayService {

    private final TopicRegistry topicRegistry;
    private final LiveSessionService liveSessionService;
    private final SessionCoordinator sessionCoordinator;
    private final SessionRelayService relayService;
    private final NotificationService notificationService;
    private final FrameFactory frameFactory;
    private final ObjectMapper objectMapper;
    private final MonitoringConfig.CounselingMetricsCollector metricsCollector;

    private final AtomicInteger openConnections = new AtomicInteger();

    /**
     * Resolves what the caller may connect to. Throws before anything is registered if the caller is refused.
     */
    public ConnectionContext admit(TopicRoute route, AuthenticatedUser user) {
        if (!route.isRoom()) {
            return ConnectionContext.forNotifications(route, user);
        }
        LiveSession session = liveSessionService.getByRoomId(route.roomId());
        ParticipantRole role = RoleResolver.resolveRole(session, user.userId());
        if (role == ParticipantRole.NONE) {
            throw new SessionAccessDeniedException("User " + user.userId() + " is not a participant of session " + route.roomId());
        }
        return ConnectionContext.forRoom(route, user, session.getId(), role);
    }

    public void open(ClientConnection connection, ConnectionContext context) {
        connection.lifecycleLock().lock();
        try {
            if (connection.isClosed()) {
                log.debug("Connection {} closed before it was opened", connection.getId());
                return;
            }
            topicRegistry.join(context.topic(), connection);
            updateGauges(openConnections.incrementAndGet());
            log.info("[CONNECT] user={} connection={} topic={}", context.user().userId(), connection.getId(), context.topic());

            if (!context.isRoom()) {
                connection.send(frameFactory.notificationCount(notificationService.unreadCount(context.user().userId())));
                return;
            }
            liveSessionService.recordJoin(context.sessionId(), context.user(), context.role());
            topicRegistry.broadcast(context.topic(), frameFactory.userJoined(context.user()));
            sessionCoordinator.onParticipantJoined(context.sessionId());
        } finally {
            connection.lifecycleLock().unlock();
        }
    }

    /**
     * Handles one inbound text frame. Client mistakes are answered with an error frame to the
     * sender only; anything else propagates and the caller closes the connection.
     */
    public void handleFrame(ClientConnection connection, ConnectionContext context, String payload) {
        try (MDC.MDCCloseable ignored = MDC.putCloseable(Constants.CORRELATION_ID_KEY, connection.getId())) {
            try {
                JsonNode frame = parse(payload);
                FrameType type = frameType(frame, context.route().kind());
                dispatch(connection, context, type, frame);
            } catch (CounselingClientException e) {
                metricsCollector.incrementCounter("counseling.frames.rejected");
                log.warn("Rejected frame from user {} on {}: {}", context.user().userId(), context.topic(), e.getMessage());
                connection.send(frameFactory.error(e.getMessage()));
            }
        }
    }

    private JsonNode parse(String payload) {
        try {
            JsonNode frame = objectMapper.readTree(payload);
            if (frame == null || !frame.isObject()) {
                throw new FrameValidationException("Frame must be a JSON object");
            }
            return frame;
        } catch (JsonProcessingException e) {
            throw new FrameValidationException("Invalid JSON format");
        }
    }

    private FrameType frameType(JsonNode frame, TopicRoute.Kind kind) {
        JsonNode typeNode = frame.get("type");
        if (typeNode == null || !typeNode.isTextual()) {
            throw new FrameValidationException("Frame type is required");
        }
        return FrameType.fromWireName(typeNode.asText())
                .filter(kind::accepts)
                .orElseThrow(() -> new FrameValidationException("Unknown message type: " + typeNode.asText()));
    }

    private void dispatch(ClientConnection connection, ConnectionContext context, FrameType type, JsonNode frame) {
        String userId = context.user().userId();
        switch (type) {
            case WEBRTC_SIGNAL -> relayService.relaySignal(connection, context, frame);
            case CHAT_MESSAGE -> relayService.relayChat(connection, context, frame);
            case END_SESSION -> sessionCoordinator.endSession(context.route().roomId(), context.user());
            case MARK_READ -> notificationService.markRead(notificationId(frame), userId);
            case MARK_ALL_READ -> notificationService.markAllRead(userId);
            case DISMISS -> notificationService.dismiss(notificationId(frame), userId);
            case GET_NOTIFICATIONS -> connection.send(frameFactory.notifications(
                    notificationService.listRecent(userId, null), notificationService.unreadCount(userId)));
            default -> throw new FrameValidationException("Unknown message type: " + type.getWireName());
        }
    }

    private Long notificationId(JsonNode frame) {
        JsonNode id = frame.get("notification_id");
        if (id == null || !id.canConvertToLong() || !id.isIntegralNumber()) {
            throw new FrameValidationException("notification_id must be an integer");
        }
        return id.asLong();
    }

    /**
     * Runs once per connection whatever happened before: closes the participant row, then leaves the fanout.
     */
    public void close(ClientConnection connection, ConnectionContext context) {
        connection.lifecycleLock().lock();
        try {
            if (!connection.markClosed()) {
                return;
            }
            // open() joins its topic first; no topics means it never ran.
            if (connection.getTopics().isEmpty()) {
                log.debug("Connection {} closed without being opened", connection.getId());
                return;
            }
            closeOpened(connection, context);
        } finally {
            connection.lifecycleLock().unlock();
        }
    }

    private void closeOpened(ClientConnection connection, ConnectionContext context) {
        try {
            if (context.isRoom()) {
                liveSessionService.recordLeave(context.sessionId(), context.user().userId());
            }
        } catch (RuntimeException e) {
            log.error("Failed to record departure of user {} from session {}", context.user().userId(), context.sessionId(), e);
        } finally {
            topicRegistry.leaveAll(connection);
            if (context.isRoom()) {
                topicRegistry.broadcast(context.topic(), frameFactory.userLeft(context.user()));
            }
            updateGauges(openConnections.decrementAndGet());
            log.info("[DISCONNECT] user={} connection={} topic={}", context.user().userId(), connection.getId(), context.topic());
        }
    }

    private void updateGauges(int connections) {
        metricsCollector.setGauge("counseling.ws.connections.active", connections);
        metricsCollector.setGauge("counseling.ws.topics.active", topicRegistry.topicCount());
    }
}
