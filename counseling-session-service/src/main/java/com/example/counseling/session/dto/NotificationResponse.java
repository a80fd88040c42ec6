package com.example.counseling.session.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.Map;

/**
 * Notification as shown to its recipient, both over REST and inside notification frames.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class NotificationResponse {
    private Long id;
    private String message;
    private String type;
    private String priority;
    private String actionUrl;
    private String actionText;
    private String icon;
    private String color;
    private Map<String, Object> metadata;
    private OffsetDateTime createdAt;
    private OffsetDateTime expiresAt;
    private boolean read;
    private boolean dismissed;
}
