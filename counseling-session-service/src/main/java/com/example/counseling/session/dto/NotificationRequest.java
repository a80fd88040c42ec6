package com.example.counseling.session.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.Map;

/**
 * Request to persist and push one notification.
 * Expiry is either relative (expiresInHours) or absolute (expiresAt); relative wins when both are set.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationRequest {
    // Column widths of the notifications table.
    public static final int MAX_USER_ID_LENGTH = 255;
    public static final int MAX_MESSAGE_LENGTH = 2000;
    public static final int MAX_TYPE_LENGTH = 30;
    public static final int MAX_PRIORITY_LENGTH = 10;
    public static final int MAX_ACTION_URL_LENGTH = 500;
    public static final int MAX_ACTION_TEXT_LENGTH = 100;
    public static final int MAX_METADATA_LENGTH = 4000;

    @NotBlank(message = "Recipient user ID is required")
    @Size(max = MAX_USER_ID_LENGTH, message = "Recipient user ID must be at most 255 characters")
    private String userId;

    @NotBlank(message = "Message is required")
    @Size(max = MAX_MESSAGE_LENGTH, message = "Message must be at most 2000 characters")
    private String message;

    @Builder.Default
    @Size(max = MAX_TYPE_LENGTH, message = "Type must be at most 30 characters")
    private String type = "general"; // appointment, report, system, reminder, feedback, followup, general

    @Builder.Default
    @Pattern(regexp = "low|normal|high|urgent", message = "Priority must be one of low, normal, high, urgent")
    private String priority = "normal";

    @Size(max = MAX_ACTION_URL_LENGTH, message = "Action URL must be at most 500 characters")
    private String actionUrl;

    @Size(max = MAX_ACTION_TEXT_LENGTH, message = "Action text must be at most 100 characters")
    private String actionText;

    @Positive(message = "expiresInHours must be positive")
    private Integer expiresInHours;

    private OffsetDateTime expiresAt;

    private Map<String, Object> metadata;
}
