package com.example.counseling.shared.service;

import com.example.counseling.shared.event.AppointmentCompletedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;

/**
 * Hands appointment completion to whoever listens for {@link AppointmentCompletedEvent}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class EventPublishingAppointmentService implements AppointmentService {

    private final ApplicationEventPublisher eventPublisher;

    @Override
    public void markCompleted(Long appointmentId, OffsetDateTime completedAt) {
        log.info("Marking appointment {} as completed at {}", appointmentId, completedAt);
        eventPublisher.publishEvent(new AppointmentCompletedEvent(appointmentId, completedAt));
    }
}
