package com.example.counseling.session.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LiveSessionResponse {
    private Long sessionId;
    private Long appointmentId;
    private String roomId;
    private String sessionType;
    private String status;
    private String studentId;
    private String studentName;
    private String counselorId;
    private String counselorName;
    private OffsetDateTime scheduledStart;
    private OffsetDateTime scheduledEnd;
    private OffsetDateTime actualStart;
    private OffsetDateTime actualEnd;
    private Long durationMinutes;
    private boolean consentGiven;
    private boolean recorded;
    private List<ParticipantResponse> participants;
}
