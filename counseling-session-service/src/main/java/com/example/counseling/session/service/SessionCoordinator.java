package com.example.counseling.session.service;

import com.example.counseling.session.dto.LiveSessionResponse;
import com.example.counseling.session.identity.AuthenticatedUser;
import com.example.counseling.session.fanout.TopicRegistry;
import com.example.counseling.session.mapper.LiveSessionMapper;
import com.example.counseling.shared.aspect.Monitored;
import com.example.counseling.shared.config.MonitoringConfig;
import com.example.counseling.shared.exception.InvalidSessionStateException;
import com.example.counseling.shared.exception.SessionAccessDeniedException;
import com.example.counseling.shared.model.LiveSession;
import com.example.counseling.shared.model.SessionParticipant;
import com.example.counseling.shared.repository.LiveSessionRepository;
import com.example.counseling.shared.service.AppointmentService;
import com.example.counseling.shared.util.Constants;
import com.example.counseling.shared.util.Constants.MessageType;
import com.example.counseling.shared.util.Constants.ParticipantRole;
import com.example.counseling.shared.util.Constants.SessionStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Drives the live session lifecycle.
 *
 * <pre>
 * scheduled -> waiting -> active -> {completed, no_show}
 * scheduled | waiting -> cancelled
 * </pre>
 *
 * Every transition is a compare-and-set on the stored status, so of several concurrent
 * callers exactly one performs it and emits the matching broadcast. Terminal sessions
 * never change again; actions on them are no-ops.
 */
@Service
@Slf4j
@RequiredArgsConstructor
@Monitored("service")
public class SessionCoordinator {

    private static final int LOCK_STRIPES = 64;

    private final LiveSessionRepository liveSessionRepository;
    private final LiveSessionService liveSessionService;
    private final LiveSessionMapper liveSessionMapper;
    private final TopicRegistry topicRegistry;
    private final FrameFactory frameFactory;
    private final AppointmentService appointmentService;
    private final MonitoringConfig.CounselingMetricsCollector metricsCollector;

    private final Object[] activationLocks = createLocks();

    private static Object[] createLocks() {
        Object[] locks = new Object[LOCK_STRIPES];
        for (int i = 0; i < LOCK_STRIPES; i++) {
            locks[i] = new Object();
        }
        return locks;
    }

    /**
     * Called after a participant row has been written for a new room connection.
     */
    public void onParticipantJoined(Long sessionId) {
        // Same-instance joins are serialized per session; the status CAS covers other instances.
        synchronized (activationLocks[Math.floorMod(sessionId.hashCode(), LOCK_STRIPES)]) {
            LiveSession session = liveSessionService.getById(sessionId);
            SessionStatus status = SessionStatus.fromValue(session.getStatus());
            if (status.isTerminal() || status == SessionStatus.ACTIVE) {
                log.debug("Session {} is already {}; join does not change its status", session.getRoomId(), status.value());
                return;
            }
            if (status == SessionStatus.SCHEDULED
                    && liveSessionRepository.compareAndSetStatus(sessionId, SessionStatus.SCHEDULED.value(), SessionStatus.WAITING.value()) == 1) {
                log.info("Session {} moved scheduled -> waiting", session.getRoomId());
                metricsCollector.incrementCounter("counseling.sessions.transitions", "to", "waiting");
            }
            tryActivate(session);
        }
    }

    private void tryActivate(LiveSession session) {
        List<SessionParticipant> connected = liveSessionService.getConnectedParticipants(session.getId());
        boolean studentPresent = connected.stream().anyMatch(p -> ParticipantRole.STUDENT.value().equals(p.getRole()));
        boolean counselorPresent = connected.stream().anyMatch(p -> ParticipantRole.COUNSELOR.value().equals(p.getRole()));
        if (!studentPresent || !counselorPresent) {
            log.debug("Session {} waiting: student present={}, counselor present={}", session.getRoomId(), studentPresent, counselorPresent);
            return;
        }

        OffsetDateTime startedAt = OffsetDateTime.now(ZoneOffset.UTC);
        if (liveSessionRepository.activateIfWaiting(session.getId(), startedAt) == 1) {
            log.info("Session {} moved waiting -> active at {}", session.getRoomId(), startedAt);
            metricsCollector.incrementCounter("counseling.sessions.transitions", "to", "active");
            liveSessionService.appendMessage(session.getId(), systemSender(), "Session started", MessageType.SYSTEM);
            broadcastToRooms(session.getRoomId(), frameFactory.sessionStarted(startedAt));
        }
    }

    /**
     * Completes an active session on behalf of one of its parties.
     */
    public LiveSessionResponse endSession(String roomId, AuthenticatedUser caller) {
        LiveSession session = liveSessionService.getByRoomId(roomId);
        liveSessionService.requireParty(session, caller.userId());
        SessionStatus status = SessionStatus.fromValue(session.getStatus());
        if (status.isTerminal()) {
            log.info("Session {} is already in a terminal state ({}). No action taken.", roomId, status.value());
            return liveSessionMapper.toResponse(session);
        }
        if (status != SessionStatus.ACTIVE) {
            throw new InvalidSessionStateException("Session " + roomId + " cannot be completed while " + status.value());
        }

        OffsetDateTime endedAt = OffsetDateTime.now(ZoneOffset.UTC);
        if (liveSessionRepository.finishIfActive(session.getId(), SessionStatus.COMPLETED.value(), endedAt) == 1) {
            log.info("Session {} completed by {} at {}", roomId, caller.userId(), endedAt);
            metricsCollector.incrementCounter("counseling.sessions.transitions", "to", "completed");
            liveSessionService.appendMessage(session.getId(), systemSender(), "Session ended", MessageType.SYSTEM);
            appointmentService.markCompleted(session.getAppointmentId(), endedAt);
            broadcastToRooms(roomId, frameFactory.sessionEnded(endedAt));
        } else {
            log.info("Session {} was finished concurrently; end request by {} is a no-op", roomId, caller.userId());
        }
        return liveSessionMapper.toResponse(liveSessionService.getById(session.getId()));
    }

    /**
     * Cancels the appointment's session if it has not started yet.
     */
    public LiveSessionResponse cancelForAppointment(Long appointmentId, AuthenticatedUser caller) {
        LiveSession session = liveSessionService.getByAppointmentId(appointmentId);
        liveSessionService.requireParty(session, caller.userId());
        return transitionTo(session, SessionStatus.CANCELLED);
    }

    /**
     * Records that an active session ended as a no-show. Counselor only.
     */
    public LiveSessionResponse markNoShow(String roomId, AuthenticatedUser caller) {
        LiveSession session = liveSessionService.getByRoomId(roomId);
        if (liveSessionService.requireParty(session, caller.userId()) != ParticipantRole.COUNSELOR) {
            throw new SessionAccessDeniedException("Only the counselor can mark a session as no-show");
        }
        return transitionTo(session, SessionStatus.NO_SHOW);
    }

    private LiveSessionResponse transitionTo(LiveSession session, SessionStatus target) {
        SessionStatus current = SessionStatus.fromValue(session.getStatus());
        if (current.isTerminal()) {
            log.info("Session {} is already in a terminal state ({}). No action taken.", session.getRoomId(), current.value());
            return liveSessionMapper.toResponse(session);
        }
        if (!current.canTransitionTo(target)) {
            throw new InvalidSessionStateException("Session " + session.getRoomId() + " cannot move from " + current.value() + " to " + target.value());
        }

        OffsetDateTime now = OffsetDateTime.now(ZoneOffset.UTC);
        int updated = target == SessionStatus.NO_SHOW
                ? liveSessionRepository.finishIfActive(session.getId(), target.value(), now)
                : liveSessionRepository.compareAndSetStatus(session.getId(), current.value(), target.value());

        if (updated == 1) {
            log.info("Session {} moved {} -> {}", session.getRoomId(), current.value(), target.value());
            metricsCollector.incrementCounter("counseling.sessions.transitions", "to", target.value());
            broadcastToRooms(session.getRoomId(), target == SessionStatus.NO_SHOW
                    ? frameFactory.sessionNoShow(now)
                    : frameFactory.sessionCancelled());
            return liveSessionMapper.toResponse(liveSessionService.getById(session.getId()));
        }

        // Status moved underneath us; re-evaluate against the fresh row.
        LiveSession fresh = liveSessionService.getById(session.getId());
        if (SessionStatus.fromValue(fresh.getStatus()).isTerminal()) {
            return liveSessionMapper.toResponse(fresh);
        }
        return transitionTo(fresh, target);
    }

    private void broadcastToRooms(String roomId, String frame) {
        topicRegistry.broadcast(Constants.liveSessionTopic(roomId), frame);
        topicRegistry.broadcast(Constants.chatTopic(roomId), frame);
    }

    private static AuthenticatedUser systemSender() {
        return new AuthenticatedUser("system", "System");
    }
}
