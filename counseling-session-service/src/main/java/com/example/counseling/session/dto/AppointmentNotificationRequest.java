package com.example.counseling.session.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Appointment workflow event that should reach the parties as notifications.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AppointmentNotificationRequest {

    public enum Event { BOOKED, REMINDER, CANCELLED }

    @NotNull(message = "Event is required")
    private Event event;

    @NotNull(message = "Appointment ID is required")
    private Long appointmentId;

    @NotBlank(message = "Student ID is required")
    private String studentId;

    private String studentName;

    @NotBlank(message = "Counselor ID is required")
    private String counselorId;

    private String counselorName;

    @NotNull(message = "Appointment date is required")
    private LocalDate date;

    @NotNull(message = "Appointment time is required")
    private LocalTime time;
}
