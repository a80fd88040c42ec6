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
 * Durable notification for one recipient. The read and dismissed flags only ever go from false to true.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("notifications")
public class Notification {
    @Id
    private Long id;
    private String userId;
    private String message;
    private String notificationType;
    private String priority; // low, normal, high, urgent
    private String actionUrl;
    private String actionText;
    private String metadata; // JSON object
    private OffsetDateTime createdAt;
    private OffsetDateTime expiresAt;
    @Column("is_read")
    private boolean read;
    @Column("is_dismissed")
    private boolean dismissed;
}
