package com.example.counseling.shared.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

/**
 * One row per (session, user). A null leftAt means the user is currently connected.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("session_participants")
public class SessionParticipant {
    @Id
    private Long id;
    private Long sessionId;
    private String userId;
    private String username;
    private String role; // student, counselor, observer
    private OffsetDateTime joinedAt;
    private OffsetDateTime leftAt;
}
