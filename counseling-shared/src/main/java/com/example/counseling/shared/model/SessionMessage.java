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
 * Append-only chat log entry of a live session.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("session_messages")
public class SessionMessage {
    @Id
    private Long id;
    private Long sessionId;
    private String senderId;
    private String senderName;
    private String message;
    private String messageType; // text, system
    @Column("sent_at")
    private OffsetDateTime timestamp;
}
