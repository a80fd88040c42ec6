package com.example.counseling.session.mapper;

import com.example.counseling.session.dto.LiveSessionResponse;
import com.example.counseling.session.dto.ParticipantResponse;
import com.example.counseling.session.dto.SessionMessageResponse;
import com.example.counseling.shared.model.LiveSession;
import com.example.counseling.shared.model.SessionMessage;
import com.example.counseling.shared.model.SessionParticipant;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

import java.time.Duration;
import java.util.List;

@Mapper(componentModel = "spring")
public abstract class LiveSessionMapper {

    // Minutes between actual start and end; null until the session has both.
    protected Long durationMinutes(LiveSession session) {
        if (session.getActualStart() == null || session.getActualEnd() == null) {
            return null;
        }
        return Duration.between(session.getActualStart(), session.getActualEnd()).toMinutes();
    }

    @Mapping(source = "id", target = "sessionId")
    @Mapping(target = "durationMinutes", expression = "java(durationMinutes(session))")
    @Mapping(target = "participants", ignore = true) // filled in by the caller
    public abstract LiveSessionResponse toResponse(LiveSession session);

    @Mapping(target = "connected", expression = "java(participant.getLeftAt() == null)")
    public abstract ParticipantResponse toParticipantResponse(SessionParticipant participant);

    public abstract List<ParticipantResponse> toParticipantResponses(List<SessionParticipant> participants);

    @Mapping(source = "senderName", target = "sender")
    public abstract SessionMessageResponse toMessageResponse(SessionMessage message);

    public abstract List<SessionMessageResponse> toMessageResponses(List<SessionMessage> messages);
}
