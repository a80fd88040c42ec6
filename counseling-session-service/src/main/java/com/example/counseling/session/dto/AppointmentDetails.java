package com.example.counseling.session.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * The appointment a live session is created for, as supplied by the appointment workflow.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AppointmentDetails {
    @NotNull(message = "Appointment ID is required")
    private Long appointmentId;

    @NotBlank(message = "Student ID is required")
    private String studentId;

    private String studentName;

    @NotBlank(message = "Counselor ID is required")
    private String counselorId;

    private String counselorName;

    @Builder.Default
    @Pattern(regexp = "video|audio|chat", message = "Session type must be one of video, audio, chat")
    private String sessionType = "video";

    @NotNull(message = "Appointment date is required")
    private LocalDate date;

    @NotNull(message = "Appointment time is required")
    private LocalTime time;

    private LocalTime endTime;
}
