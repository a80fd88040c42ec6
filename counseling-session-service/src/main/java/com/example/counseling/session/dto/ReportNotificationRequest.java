package com.example.counseling.session.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReportNotificationRequest {
    @NotNull(message = "Report ID is required")
    private Long reportId;

    @NotBlank(message = "Student ID is required")
    private String studentId;

    private String counselorName;
}
