package com.example.counseling.session.websocket;

import com.example.counseling.session.fanout.RecordingConnection;
import com.example.counseling.session.fanout.TopicRegistry;
import com.example.counseling.session.identity.AuthenticatedUser;
import com.example.counseling.session.service.FrameFactory;
import com.example.counseling.session.service.LiveSessionService;
import com.example.counseling.session.service.NotificationService;
import com.example.counseling.session.service.SessionCoordinator;
import com.example.counseling.session.service.SessionRelayService;
import com.example.counseling.shared.config.MonitoringConfig;
import com.example.counseling.shared.exception.ResourceNotFoundException;
import com.example.counseling.shared.exception.SessionAccessDeniedException;
import com.example.counseling.shared.model.LiveSession;
import com.example.counseling.shared.util.Constants.ParticipantRole;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SessionGatewayServiceTest {

    private static final TopicRoute ROOM = new TopicRoute(TopicRoute.Kind.LIVE_SESSION, "session_abc");
    private static final TopicRoute NOTIFICATIONS = new TopicRoute(TopicRoute.Kind.NOTIFICATIONS, null);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private TopicRegistry topicRegistry;
    private LiveSessionService liveSessionService;
    private SessionCoordinator coordinator;
    private SessionRelayService relayService;
    private NotificationService notificationService;
    private SessionGatewayService gateway;

    private final LiveSession session = LiveSession.builder()
            .id(7L).roomId("session_abc").studentId("s1").counselorId("c1").status("scheduled").build();

    @BeforeEach
    void setUp() {
        topicRegistry = new TopicRegistry();
        liveSessionService = mock(LiveSessionService.class);
        coordinator = mock(SessionCoordinator.class);
        relayService = mock(SessionRelayService.class);
        notificationService = mock(NotificationService.class);
        gateway = new SessionGatewayService(topicRegistry, liveSessionService, coordinator, relayService,
                notificationService, new FrameFactory(objectMapper), objectMapper,
                new MonitoringConfig.CounselingMetricsCollector(new SimpleMeterRegistry()));
        when(liveSessionService.getByRoomId("session_abc")).thenReturn(session);
    }

    @Test
    void nonPartyIsRefusedBeforeAnythingIsRegistered() {
        assertThrows(SessionAccessDeniedException.class,
                () -> gateway.admit(ROOM, new AuthenticatedUser("stranger", "stranger")));

        assertEquals(0, topicRegistry.topicCount());
        verify(liveSessionService, never()).recordJoin(anyLong(), any(), any());
    }

    @Test
    void unknownRoomIsNotFound() {
        when(liveSessionService.getByRoomId("session_zzz")).thenThrow(new ResourceNotFoundException("Session not found: session_zzz"));

        assertThrows(ResourceNotFoundException.class,
                () -> gateway.admit(new TopicRoute(TopicRoute.Kind.CHAT, "session_zzz"), new AuthenticatedUser("s1", "Sam")));
    }

    @Test
    void admittedPartyGetsTheirRole() {
        ConnectionContext context = gateway.admit(ROOM, new AuthenticatedUser("c1", "Dr. Cruz"));

        assertEquals(7L, context.sessionId());
        assertEquals(ParticipantRole.COUNSELOR, context.role());
        assertEquals("live_session_session_abc", context.topic());
    }

    @Test
    void openingRoomRecordsJoinBeforeAnnouncingAndCheckingActivation() {
        RecordingConnection peer = new RecordingConnection("c1");
        topicRegistry.join("live_session_session_abc", peer);
        RecordingConnection student = new RecordingConnection("s1", "Sam");
        ConnectionContext context = gateway.admit(ROOM, student.getUser());

        gateway.open(student, context);

        InOrder order = inOrder(liveSessionService, coordinator);
        order.verify(liveSessionService).recordJoin(7L, student.getUser(), ParticipantRole.STUDENT);
        order.verify(coordinator).onParticipantJoined(7L);
        JsonNode joined = peer.lastFrame();
        assertEquals("user_joined", joined.get("type").asText());
        assertEquals("s1", joined.get("user_id").asText());
        assertEquals("Sam", joined.get("username").asText());
    }

    @Test
    void notificationStreamStartsWithUnreadCount() {
        when(notificationService.unreadCount("u1")).thenReturn(4L);
        RecordingConnection stream = new RecordingConnection("u1");
        ConnectionContext context = gateway.admit(NOTIFICATIONS, stream.getUser());

        gateway.open(stream, context);

        assertEquals("notification_count", stream.lastFrame().get("type").asText());
        assertEquals(4L, stream.lastFrame().get("count").asLong());
        assertTrue(topicRegistry.hasTopic("notifications_u1"));
    }

    @Test
    void malformedJsonIsAnsweredWithErrorFrameAndConnectionStays() {
        RecordingConnection student = new RecordingConnection("s1");
        ConnectionContext context = gateway.admit(ROOM, student.getUser());
        gateway.open(student, context);
        student.clear();

        gateway.handleFrame(student, context, "{not json");

        assertEquals("error", student.lastFrame().get("type").asText());
        assertEquals("Invalid JSON format", student.lastFrame().get("message").asText());
        assertTrue(topicRegistry.hasTopic(context.topic()));
    }

    @Test
    void frameTypesAreCheckedAgainstTheSocketKind() {
        RecordingConnection stream = new RecordingConnection("u1");
        ConnectionContext context = gateway.admit(NOTIFICATIONS, stream.getUser());

        gateway.handleFrame(stream, context, "{\"type\":\"webrtc_signal\",\"signal\":{\"type\":\"offer\"}}");
        gateway.handleFrame(stream, context, "{\"type\":\"teleport\"}");
        gateway.handleFrame(stream, context, "{\"message\":\"no type\"}");

        assertEquals(3, stream.framesOfType("error").size());
        assertEquals("Unknown message type: webrtc_signal", stream.framesOfType("error").get(0).get("message").asText());
        assertEquals("Unknown message type: teleport", stream.framesOfType("error").get(1).get("message").asText());
        verify(relayService, never()).relaySignal(any(), any(), any());
    }

    @Test
    void markReadRequiresIntegerId() {
        RecordingConnection stream = new RecordingConnection("u1");
        ConnectionContext context = gateway.admit(NOTIFICATIONS, stream.getUser());

        gateway.handleFrame(stream, context, "{\"type\":\"mark_read\",\"notification_id\":\"abc\"}");
        gateway.handleFrame(stream, context, "{\"type\":\"mark_read\",\"notification_id\":15}");

        assertEquals(1, stream.framesOfType("error").size());
        verify(notificationService).markRead(15L, "u1");
    }

    @Test
    void clientErrorsFromHandlersBecomeErrorFrames() {
        RecordingConnection stream = new RecordingConnection("u1");
        ConnectionContext context = gateway.admit(NOTIFICATIONS, stream.getUser());
        doThrow(new ResourceNotFoundException("Notification not found: 99")).when(notificationService).dismiss(99L, "u1");

        gateway.handleFrame(stream, context, "{\"type\":\"dismiss\",\"notification_id\":99}");

        assertEquals("Notification not found: 99", stream.lastFrame().get("message").asText());
    }

    @Test
    void closeRunsOnceAndAnnouncesDeparture() {
        RecordingConnection peer = new RecordingConnection("c1");
        topicRegistry.join("live_session_session_abc", peer);
        RecordingConnection student = new RecordingConnection("s1");
        ConnectionContext context = gateway.admit(ROOM, student.getUser());
        gateway.open(student, context);
        peer.clear();

        gateway.close(student, context);
        gateway.close(student, context);

        verify(liveSessionService, times(1)).recordLeave(7L, "s1");
        assertEquals(1, peer.framesOfType("user_left").size());
        assertEquals(1, topicRegistry.memberCount("live_session_session_abc"));
    }

    @Test
    void failedDepartureWriteStillLeavesTheTopic() {
        RecordingConnection student = new RecordingConnection("s1");
        ConnectionContext context = gateway.admit(ROOM, student.getUser());
        gateway.open(student, context);
        doThrow(new IllegalStateException("db down")).when(liveSessionService).recordLeave(anyLong(), anyString());

        gateway.close(student, context);

        assertFalse(topicRegistry.hasTopic(context.topic()));
    }

    @Test
    void closeBeforeOpenLeavesNothingBehind() {
        RecordingConnection student = new RecordingConnection("s1");
        ConnectionContext context = gateway.admit(ROOM, student.getUser());

        gateway.close(student, context);
        gateway.open(student, context);

        verify(liveSessionService, never()).recordJoin(anyLong(), any(), any());
        verify(liveSessionService, never()).recordLeave(anyLong(), anyString());
        verify(coordinator, never()).onParticipantJoined(anyLong());
        assertFalse(topicRegistry.hasTopic(context.topic()));
        assertTrue(student.getTopics().isEmpty());
    }

    @Test
    void closeWaitsForAnOpenInProgress() throws Exception {
        RecordingConnection student = new RecordingConnection("s1");
        ConnectionContext context = gateway.admit(ROOM, student.getUser());
        CountDownLatch joining = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        doAnswer(invocation -> {
            joining.countDown();
            assertTrue(release.await(5, TimeUnit.SECONDS));
            return null;
        }).when(liveSessionService).recordJoin(anyLong(), any(), any());

        CompletableFuture<Void> opening = CompletableFuture.runAsync(() -> gateway.open(student, context));
        assertTrue(joining.await(5, TimeUnit.SECONDS));
        CompletableFuture<Void> closing = CompletableFuture.runAsync(() -> gateway.close(student, context));

        Thread.sleep(100);
        assertFalse(student.isClosed());
        verify(liveSessionService, never()).recordLeave(anyLong(), anyString());

        release.countDown();
        opening.get(5, TimeUnit.SECONDS);
        closing.get(5, TimeUnit.SECONDS);

        InOrder order = inOrder(liveSessionService);
        order.verify(liveSessionService).recordJoin(7L, student.getUser(), ParticipantRole.STUDENT);
        order.verify(liveSessionService).recordLeave(7L, "s1");
        assertFalse(topicRegistry.hasTopic(context.topic()));
    }
}
