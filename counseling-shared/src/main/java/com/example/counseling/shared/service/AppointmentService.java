package com.example.counseling.shared.service;

import java.time.OffsetDateTime;

/**
 * The appointment workflow owns appointments; the session layer only reports back when a session finishes.
 */
public interface AppointmentService {

    void markCompleted(Long appointmentId, OffsetDateTime completedAt);
}
