package com.example.counseling.shared.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

/**
 * A live counseling session backing exactly one appointment.
 * The two parties are copied from the appointment at creation time; the room id never changes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("live_sessions")
public class LiveSession {
    @Id
    private Long id;
    private Long appointmentId;
    private String studentId;
    private String studentName;
    private String counselorId;
    private String counselorName;
    private String sessionType; // video, audio, chat
    private String status; // scheduled, waiting, active, completed, cancelled, no_show
    private String roomId;
    private OffsetDateTime scheduledStart;
    private OffsetDateTime scheduledEnd;
    private OffsetDateTime actualStart;
    private OffsetDateTime actualEnd;
    private String notes;
    private boolean consentGiven;
    @Column("is_recorded")
    private boolean recorded;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;
}
