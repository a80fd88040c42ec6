package com.example.counseling.session.service;

import com.example.counseling.session.dto.AppointmentDetails;
import com.example.counseling.session.dto.LiveSessionResponse;
import com.example.counseling.session.dto.SessionCreatedResponse;
import com.example.counseling.session.dto.SessionJoinResponse;
import com.example.counseling.session.dto.SessionMessageResponse;
import com.example.counseling.session.dto.SessionNotesResponse;
import com.example.counseling.session.identity.AuthenticatedUser;
import com.example.counseling.session.mapper.LiveSessionMapper;
import com.example.counseling.shared.aspect.Monitored;
import com.example.counseling.shared.config.AppProperties;
import com.example.counseling.shared.exception.InvalidSessionStateException;
import com.example.counseling.shared.exception.ResourceNotFoundException;
import com.example.counseling.shared.exception.SessionAccessDeniedException;
import com.example.counseling.shared.model.LiveSession;
import com.example.counseling.shared.model.SessionMessage;
import com.example.counseling.shared.model.SessionParticipant;
import com.example.counseling.shared.repository.LiveSessionRepository;
import com.example.counseling.shared.repository.SessionMessageRepository;
import com.example.counseling.shared.repository.SessionParticipantRepository;
import com.example.counseling.shared.util.Constants.MessageType;
import com.example.counseling.shared.util.Constants.ParticipantRole;
import com.example.counseling.shared.util.Constants.SessionStatus;
import com.example.counseling.shared.util.Constants.SessionType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Durable session state: live sessions, their participants and their chat log.
 */
@Service
@Slf4j
@RequiredArgsConstructor
@Monitored("service")
public class LiveSessionService {

    private static final Set<SessionStatus> JOINABLE = EnumSet.of(SessionStatus.SCHEDULED, SessionStatus.WAITING, SessionStatus.ACTIVE);

    private final LiveSessionRepository liveSessionRepository;
    private final SessionParticipantRepository participantRepository;
    private final SessionMessageRepository messageRepository;
    private final LiveSessionMapper liveSessionMapper;
    private final AppProperties appProperties;

    /**
     * Returns the appointment's live session, creating it on first call. Repeated calls return the same room.
     */
    public SessionCreatedResponse createSession(AppointmentDetails appointment, AuthenticatedUser caller) {
        if (RoleResolver.resolveRole(appointment, caller.userId()) == ParticipantRole.NONE) {
            throw new SessionAccessDeniedException("Only the appointment's student or counselor can create its live session");
        }

        return liveSessionRepository.findByAppointmentId(appointment.getAppointmentId())
                .map(existing -> {
                    log.info("Live session {} already exists for appointment {}", existing.getRoomId(), appointment.getAppointmentId());
                    return toCreatedResponse(existing, false);
                })
                .orElseGet(() -> insertSession(appointment));
    }

    private SessionCreatedResponse insertSession(AppointmentDetails appointment) {
        OffsetDateTime now = OffsetDateTime.now(ZoneOffset.UTC);
        OffsetDateTime start = appointment.getDate().atTime(appointment.getTime())
                .atZone(appProperties.getSession().getZone()).toOffsetDateTime();
        OffsetDateTime end = appointment.getEndTime() != null
                ? appointment.getDate().atTime(appointment.getEndTime()).atZone(appProperties.getSession().getZone()).toOffsetDateTime()
                : start.plus(appProperties.getSession().getDefaultDuration());

        LiveSession session = LiveSession.builder()
                .appointmentId(appointment.getAppointmentId())
                .studentId(appointment.getStudentId())
                .studentName(appointment.getStudentName())
                .counselorId(appointment.getCounselorId())
                .counselorName(appointment.getCounselorName())
                .sessionType(appointment.getSessionType() != null ? appointment.getSessionType() : SessionType.VIDEO.value())
                .status(SessionStatus.SCHEDULED.value())
                .roomId(generateRoomId())
                .scheduledStart(start)
                .scheduledEnd(end)
                .createdAt(now)
                .updatedAt(now)
                .build();
        try {
            LiveSession saved = liveSessionRepository.save(session);
            log.info("Created live session {} (room {}) for appointment {}", saved.getId(), saved.getRoomId(), saved.getAppointmentId());
            return toCreatedResponse(saved, true);
        } catch (DataIntegrityViolationException e) {
            // Lost a creation race for the same appointment: the winner's row is the answer.
            log.warn("Concurrent creation for appointment {}; returning the existing session", appointment.getAppointmentId());
            return liveSessionRepository.findByAppointmentId(appointment.getAppointmentId())
                    .map(existing -> toCreatedResponse(existing, false))
                    .orElseThrow(() -> e);
        }
    }

    public String generateRoomId() {
        return appProperties.getSession().getRoomIdPrefix() + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }

    public LiveSession getByRoomId(String roomId) {
        return liveSessionRepository.findByRoomId(roomId)
                .orElseThrow(() -> new ResourceNotFoundException("Session not found: " + roomId));
    }

    public LiveSession getById(Long sessionId) {
        return liveSessionRepository.findById(sessionId)
                .orElseThrow(() -> new ResourceNotFoundException("Session not found: " + sessionId));
    }

    public LiveSession getByAppointmentId(Long appointmentId) {
        return liveSessionRepository.findByAppointmentId(appointmentId)
                .orElseThrow(() -> new ResourceNotFoundException("No live session for appointment " + appointmentId));
    }

    /**
     * @return the caller's role in the session; never NONE.
     */
    public ParticipantRole requireParty(LiveSession session, String userId) {
        ParticipantRole role = RoleResolver.resolveRole(session, userId);
        if (role == ParticipantRole.NONE) {
            throw new SessionAccessDeniedException("User " + userId + " is not a participant of session " + session.getRoomId());
        }
        return role;
    }

    public SessionJoinResponse checkJoin(String roomId, AuthenticatedUser caller) {
        LiveSession session = getByRoomId(roomId);
        ParticipantRole role = requireParty(session, caller.userId());
        SessionStatus status = SessionStatus.fromValue(session.getStatus());
        if (!JOINABLE.contains(status)) {
            throw new InvalidSessionStateException("Session " + roomId + " is not available (status " + status.value() + ")");
        }
        return SessionJoinResponse.builder()
                .roomId(session.getRoomId())
                .sessionType(session.getSessionType())
                .status(session.getStatus())
                .participantRole(role.value())
                .build();
    }

    public LiveSessionResponse getDetails(String roomId, AuthenticatedUser caller) {
        LiveSession session = getByRoomId(roomId);
        requireParty(session, caller.userId());
        LiveSessionResponse response = liveSessionMapper.toResponse(session);
        response.setParticipants(liveSessionMapper.toParticipantResponses(participantRepository.findBySessionId(session.getId())));
        return response;
    }

    /**
     * Upserts the participant row: a returning user gets a fresh joinedAt and a cleared leftAt.
     * Committed on its own so the coordinator sees it immediately.
     */
    public void recordJoin(Long sessionId, AuthenticatedUser user, ParticipantRole role) {
        OffsetDateTime now = OffsetDateTime.now(ZoneOffset.UTC);
        if (participantRepository.rejoin(sessionId, user.userId(), user.username(), now) > 0) {
            log.debug("User {} rejoined session {}", user.userId(), sessionId);
            return;
        }
        try {
            participantRepository.save(SessionParticipant.builder()
                    .sessionId(sessionId)
                    .userId(user.userId())
                    .username(user.username())
                    .role(role.value())
                    .joinedAt(now)
                    .build());
            log.debug("User {} joined session {} as {}", user.userId(), sessionId, role.value());
        } catch (DataIntegrityViolationException e) {
            // A second socket of the same user inserted first.
            log.debug("Participant row for user {} in session {} already exists; refreshing it", user.userId(), sessionId);
            participantRepository.rejoin(sessionId, user.userId(), user.username(), now);
        }
    }

    public void recordLeave(Long sessionId, String userId) {
        int updated = participantRepository.markLeft(sessionId, userId, OffsetDateTime.now(ZoneOffset.UTC));
        if (updated == 0) {
            log.debug("No participant row to close for user {} in session {}", userId, sessionId);
        }
    }

    public List<SessionParticipant> getConnectedParticipants(Long sessionId) {
        return participantRepository.findConnectedBySessionId(sessionId);
    }

    public SessionMessage appendMessage(Long sessionId, AuthenticatedUser sender, String text, MessageType type) {
        SessionMessage message = SessionMessage.builder()
                .sessionId(sessionId)
                .senderId(sender.userId())
                .senderName(sender.username())
                .message(text)
                .messageType(type.value())
                .timestamp(OffsetDateTime.now(ZoneOffset.UTC))
                .build();
        return messageRepository.save(message);
    }

    public List<SessionMessageResponse> getMessages(String roomId, AuthenticatedUser caller) {
        LiveSession session = getByRoomId(roomId);
        requireParty(session, caller.userId());
        return liveSessionMapper.toMessageResponses(messageRepository.findBySessionIdOrdered(session.getId()));
    }

    public SessionNotesResponse getNotes(String roomId, AuthenticatedUser caller) {
        LiveSession session = requireCounselor(roomId, caller);
        return new SessionNotesResponse(session.getRoomId(), session.getNotes() != null ? session.getNotes() : "");
    }

    public SessionNotesResponse updateNotes(String roomId, String notes, AuthenticatedUser caller) {
        LiveSession session = requireCounselor(roomId, caller);
        liveSessionRepository.updateNotes(session.getId(), notes);
        log.info("Counselor {} updated notes for session {}", caller.userId(), roomId);
        return new SessionNotesResponse(session.getRoomId(), notes);
    }

    private LiveSession requireCounselor(String roomId, AuthenticatedUser caller) {
        LiveSession session = getByRoomId(roomId);
        if (requireParty(session, caller.userId()) != ParticipantRole.COUNSELOR) {
            throw new SessionAccessDeniedException("Only the counselor can access session notes");
        }
        return session;
    }

    private SessionCreatedResponse toCreatedResponse(LiveSession session, boolean created) {
        return SessionCreatedResponse.builder()
                .roomId(session.getRoomId())
                .sessionId(session.getId())
                .status(session.getStatus())
                .meetingUrl("/live-session/" + session.getRoomId() + "/")
                .created(created)
                .build();
    }
}
