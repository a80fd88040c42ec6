package com.example.counseling.session.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SystemNotificationRequest {
    @NotEmpty(message = "At least one recipient is required")
    private List<String> userIds;

    @NotBlank(message = "Message is required")
    @Size(max = NotificationRequest.MAX_MESSAGE_LENGTH, message = "Message must be at most 2000 characters")
    private String message;

    @Builder.Default
    @Pattern(regexp = "low|normal|high|urgent", message = "Priority must be one of low, normal, high, urgent")
    private String priority = "normal";

    @Size(max = NotificationRequest.MAX_ACTION_URL_LENGTH, message = "Action URL must be at most 500 characters")
    private String actionUrl;

    @Size(max = NotificationRequest.MAX_ACTION_TEXT_LENGTH, message = "Action text must be at most 100 characters")
    private String actionText;
}
