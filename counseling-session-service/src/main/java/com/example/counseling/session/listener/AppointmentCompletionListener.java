package com.example.counseling.session.listener;

import com.example.counseling.session.service.WorkflowNotificationService;
import com.example.counseling.shared.event.AppointmentCompletedEvent;
import com.example.counseling.shared.repository.LiveSessionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Asks the student for feedback once their session's appointment has completed.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class AppointmentCompletionListener {

    private final LiveSessionRepository liveSessionRepository;
    private final WorkflowNotificationService workflowNotificationService;

    @Async
    @EventListener
    public void onAppointmentCompleted(AppointmentCompletedEvent event) {
        liveSessionRepository.findByAppointmentId(event.appointmentId()).ifPresentOrElse(
                session -> {
                    workflowNotificationService.feedbackRequested(session);
                    log.info("Requested feedback from student {} for appointment {}", session.getStudentId(), event.appointmentId());
                },
                () -> log.warn("Appointment {} completed but has no live session; no feedback request sent", event.appointmentId()));
    }
}
