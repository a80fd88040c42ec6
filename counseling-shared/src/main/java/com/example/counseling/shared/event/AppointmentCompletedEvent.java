package com.example.counseling.shared.event;

import java.time.OffsetDateTime;

/**
 * Published once an appointment's live session has completed.
 */
public record AppointmentCompletedEvent(Long appointmentId, OffsetDateTime completedAt) {
}
