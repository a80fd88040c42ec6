package com.example.counseling.session;

import com.example.counseling.session.dto.AppointmentDetails;
import com.example.counseling.session.dto.LiveSessionResponse;
import com.example.counseling.session.dto.SessionCreatedResponse;
import com.example.counseling.session.dto.SessionMessageResponse;
import com.example.counseling.session.fanout.RecordingConnection;
import com.example.counseling.session.identity.AuthenticatedUser;
import com.example.counseling.session.service.LiveSessionService;
import com.example.counseling.session.service.SessionCoordinator;
import com.example.counseling.session.websocket.ConnectionContext;
import com.example.counseling.session.websocket.SessionGatewayService;
import com.example.counseling.session.websocket.TopicRoute;
import com.example.counseling.shared.exception.InvalidSessionStateException;
import com.example.counseling.shared.exception.SessionAccessDeniedException;
import com.example.counseling.shared.model.LiveSession;
import com.example.counseling.shared.model.SessionParticipant;
import com.example.counseling.shared.repository.SessionParticipantRepository;
import com.example.counseling.shared.service.AppointmentService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@SpringBootTest
@ActiveProfiles("test")
class SessionLifecycleIntegrationTest {

    private static final AtomicLong APPOINTMENT_IDS = new AtomicLong(10_000);

    @Autowired
    private LiveSessionService liveSessionService;
    @Autowired
    private SessionCoordinator coordinator;
    @Autowired
    private SessionGatewayService gateway;
    @Autowired
    private SessionParticipantRepository participantRepository;
    @MockBean
    private AppointmentService appointmentService;

    private final AuthenticatedUser student = new AuthenticatedUser("student-1", "Sam Reyes");
    private final AuthenticatedUser counselor = new AuthenticatedUser("counselor-1", "Dr. Cruz");

    private AppointmentDetails newAppointment() {
        return AppointmentDetails.builder()
                .appointmentId(APPOINTMENT_IDS.incrementAndGet())
                .studentId(student.userId()).studentName(student.username())
                .counselorId(counselor.userId()).counselorName(counselor.username())
                .date(LocalDate.of(2024, 6, 3))
                .time(LocalTime.of(10, 0))
                .build();
    }

    private Joined join(String roomId, AuthenticatedUser user) {
        RecordingConnection connection = new RecordingConnection(user.userId(), user.username());
        ConnectionContext context = gateway.admit(new TopicRoute(TopicRoute.Kind.LIVE_SESSION, roomId), user);
        gateway.open(connection, context);
        return new Joined(connection, context);
    }

    private record Joined(RecordingConnection connection, ConnectionContext context) {
    }

    private String status(String roomId) {
        return liveSessionService.getByRoomId(roomId).getStatus();
    }

    @Test
    void creatingTwiceReturnsTheSameRoom() {
        AppointmentDetails appointment = newAppointment();

        SessionCreatedResponse first = liveSessionService.createSession(appointment, student);
        SessionCreatedResponse second = liveSessionService.createSession(appointment, counselor);

        assertTrue(first.isCreated());
        assertFalse(second.isCreated());
        assertEquals(first.getRoomId(), second.getRoomId());
        assertEquals("scheduled", first.getStatus());
        assertEquals("/live-session/" + first.getRoomId() + "/", first.getMeetingUrl());
        assertTrue(first.getRoomId().matches("session_[0-9a-f]{12}"));

        LiveSession stored = liveSessionService.getByRoomId(first.getRoomId());
        assertEquals(stored.getScheduledStart().plusMinutes(60), stored.getScheduledEnd());
        assertEquals("video", stored.getSessionType());
    }

    @Test
    void strangerCannotCreateTheSession() {
        assertThrows(SessionAccessDeniedException.class,
                () -> liveSessionService.createSession(newAppointment(), new AuthenticatedUser("intruder", "intruder")));
    }

    @Test
    void firstJoinWaitsAndSecondPartyActivates() {
        String roomId = liveSessionService.createSession(newAppointment(), student).getRoomId();

        Joined studentSide = join(roomId, student);
        assertEquals("waiting", status(roomId));
        assertTrue(studentSide.connection().framesOfType("session_started").isEmpty());

        Joined counselorSide = join(roomId, counselor);

        assertEquals("active", status(roomId));
        assertNotNull(liveSessionService.getByRoomId(roomId).getActualStart());
        assertEquals(1, studentSide.connection().framesOfType("session_started").size());
        assertEquals(1, counselorSide.connection().framesOfType("session_started").size());
        List<String> joinedUsers = studentSide.connection().framesOfType("user_joined").stream()
                .map(frame -> frame.get("user_id").asText())
                .toList();
        assertEquals(List.of("student-1", "counselor-1"), joinedUsers);
    }

    @Test
    void concurrentJoinsStartTheSessionExactlyOnce() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            for (int round = 0; round < 10; round++) {
                String roomId = liveSessionService.createSession(newAppointment(), student).getRoomId();
                CountDownLatch start = new CountDownLatch(1);
                Future<Joined> studentSide = pool.submit(() -> {
                    start.await();
                    return join(roomId, student);
                });
                Future<Joined> counselorSide = pool.submit(() -> {
                    start.await();
                    return join(roomId, counselor);
                });
                start.countDown();

                Joined s = studentSide.get(10, TimeUnit.SECONDS);
                Joined c = counselorSide.get(10, TimeUnit.SECONDS);

                assertEquals("active", status(roomId));
                assertEquals(1, s.connection().framesOfType("session_started").size());
                assertEquals(1, c.connection().framesOfType("session_started").size());
                long startedMessages = liveSessionService.getMessages(roomId, student).stream()
                        .filter(m -> "system".equals(m.getMessageType()) && "Session started".equals(m.getMessage()))
                        .count();
                assertEquals(1, startedMessages);
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void endSessionFrameCompletesOnceAndNotifiesAppointmentWorkflow() {
        AppointmentDetails appointment = newAppointment();
        String roomId = liveSessionService.createSession(appointment, student).getRoomId();
        Joined studentSide = join(roomId, student);
        Joined counselorSide = join(roomId, counselor);

        gateway.handleFrame(studentSide.connection(), studentSide.context(), "{\"type\":\"end_session\"}");
        gateway.handleFrame(counselorSide.connection(), counselorSide.context(), "{\"type\":\"end_session\"}");

        LiveSession ended = liveSessionService.getByRoomId(roomId);
        assertEquals("completed", ended.getStatus());
        assertNotNull(ended.getActualEnd());
        assertEquals(1, studentSide.connection().framesOfType("session_ended").size());
        assertEquals(1, counselorSide.connection().framesOfType("session_ended").size());
        assertTrue(counselorSide.connection().framesOfType("error").isEmpty());
        verify(appointmentService, times(1)).markCompleted(eq(appointment.getAppointmentId()), any(OffsetDateTime.class));
    }

    @Test
    void endBeforeActivationIsRejected() {
        String roomId = liveSessionService.createSession(newAppointment(), student).getRoomId();
        Joined studentSide = join(roomId, student);

        gateway.handleFrame(studentSide.connection(), studentSide.context(), "{\"type\":\"end_session\"}");

        assertEquals("waiting", status(roomId));
        assertEquals(1, studentSide.connection().framesOfType("error").size());
        assertThrows(InvalidSessionStateException.class, () -> coordinator.endSession(roomId, counselor));
        verify(appointmentService, never()).markCompleted(any(), any());
    }

    @Test
    void disconnectClosesParticipantRowEvenAfterTheSessionEnded() {
        String roomId = liveSessionService.createSession(newAppointment(), student).getRoomId();
        Joined studentSide = join(roomId, student);
        Joined counselorSide = join(roomId, counselor);
        coordinator.endSession(roomId, counselor);

        gateway.close(studentSide.connection(), studentSide.context());

        Long sessionId = studentSide.context().sessionId();
        SessionParticipant row = participantRepository.findBySessionIdAndUserId(sessionId, student.userId()).orElseThrow();
        assertNotNull(row.getLeftAt());
        assertEquals(1, counselorSide.connection().framesOfType("user_left").size());
        assertEquals("completed", status(roomId));
    }

    @Test
    void rejoinClearsDepartureAndKeepsOneRow() {
        String roomId = liveSessionService.createSession(newAppointment(), student).getRoomId();
        Joined first = join(roomId, student);
        gateway.close(first.connection(), first.context());

        join(roomId, student);

        List<SessionParticipant> rows = participantRepository.findBySessionId(first.context().sessionId());
        assertEquals(1, rows.size());
        assertNull(rows.get(0).getLeftAt());
        assertEquals("student", rows.get(0).getRole());
    }

    @Test
    void cancelIsAllowedOnlyBeforeTheSessionStarts() {
        AppointmentDetails pending = newAppointment();
        String pendingRoom = liveSessionService.createSession(pending, student).getRoomId();
        Joined watcher = join(pendingRoom, student);

        LiveSessionResponse cancelled = coordinator.cancelForAppointment(pending.getAppointmentId(), counselor);
        LiveSessionResponse again = coordinator.cancelForAppointment(pending.getAppointmentId(), student);

        assertEquals("cancelled", cancelled.getStatus());
        assertEquals("cancelled", again.getStatus());
        assertEquals(1, watcher.connection().framesOfType("session_cancelled").size());

        AppointmentDetails running = newAppointment();
        String runningRoom = liveSessionService.createSession(running, student).getRoomId();
        join(runningRoom, student);
        join(runningRoom, counselor);
        assertThrows(InvalidSessionStateException.class, () -> coordinator.cancelForAppointment(running.getAppointmentId(), counselor));
        assertEquals("active", status(runningRoom));
    }

    @Test
    void onlyTheCounselorMarksAnActiveSessionAsNoShow() {
        String roomId = liveSessionService.createSession(newAppointment(), student).getRoomId();
        assertThrows(InvalidSessionStateException.class, () -> coordinator.markNoShow(roomId, counselor));

        Joined studentSide = join(roomId, student);
        join(roomId, counselor);
        assertThrows(SessionAccessDeniedException.class, () -> coordinator.markNoShow(roomId, student));

        LiveSessionResponse response = coordinator.markNoShow(roomId, counselor);

        assertEquals("no_show", response.getStatus());
        assertNotNull(response.getActualEnd());
        assertEquals(1, studentSide.connection().framesOfType("session_no_show").size());
        verify(appointmentService, never()).markCompleted(any(), any());
    }

    @Test
    void chatIsBroadcastAndKeptInOrder() {
        String roomId = liveSessionService.createSession(newAppointment(), student).getRoomId();
        Joined studentSide = join(roomId, student);
        Joined counselorSide = join(roomId, counselor);

        gateway.handleFrame(studentSide.connection(), studentSide.context(), "{\"type\":\"chat_message\",\"message\":\"hi\"}");
        gateway.handleFrame(counselorSide.connection(), counselorSide.context(), "{\"type\":\"chat_message\",\"message\":\"hello Sam\"}");
        gateway.handleFrame(studentSide.connection(), studentSide.context(), "{\"type\":\"chat_message\",\"message\":\"   \"}");

        assertEquals(2, counselorSide.connection().framesOfType("chat_message").size());
        assertEquals(1, studentSide.connection().framesOfType("error").size());
        List<String> texts = liveSessionService.getMessages(roomId, counselor).stream()
                .filter(m -> "text".equals(m.getMessageType()))
                .map(SessionMessageResponse::getMessage)
                .toList();
        assertEquals(List.of("hi", "hello Sam"), texts);
    }

    @Test
    void oversizedChatIsAnsweredWithErrorAndNothingIsStored() {
        String roomId = liveSessionService.createSession(newAppointment(), student).getRoomId();
        Joined studentSide = join(roomId, student);
        Joined counselorSide = join(roomId, counselor);
        String longest = "a".repeat(4000);

        gateway.handleFrame(studentSide.connection(), studentSide.context(),
                "{\"type\":\"chat_message\",\"message\":\"" + "b".repeat(5000) + "\"}");
        gateway.handleFrame(studentSide.connection(), studentSide.context(),
                "{\"type\":\"chat_message\",\"message\":\"" + longest + "\"}");

        assertEquals(1, studentSide.connection().framesOfType("error").size());
        assertFalse(studentSide.connection().isClosed());
        assertEquals(1, counselorSide.connection().framesOfType("chat_message").size());
        List<String> texts = liveSessionService.getMessages(roomId, counselor).stream()
                .filter(m -> "text".equals(m.getMessageType()))
                .map(SessionMessageResponse::getMessage)
                .toList();
        assertEquals(List.of(longest), texts);
    }

    @Test
    void notesAreCounselorOnly() {
        String roomId = liveSessionService.createSession(newAppointment(), student).getRoomId();

        liveSessionService.updateNotes(roomId, "Discussed sleep routine", counselor);

        assertEquals("Discussed sleep routine", liveSessionService.getNotes(roomId, counselor).getNotes());
        assertThrows(SessionAccessDeniedException.class, () -> liveSessionService.getNotes(roomId, student));
    }
}
