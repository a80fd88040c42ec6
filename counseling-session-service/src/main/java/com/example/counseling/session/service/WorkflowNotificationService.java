package com.example.counseling.session.service;

import com.example.counseling.session.dto.AppointmentNotificationRequest;
import com.example.counseling.session.dto.NotificationRequest;
import com.example.counseling.session.dto.NotificationResponse;
import com.example.counseling.session.dto.ReportNotificationRequest;
import com.example.counseling.session.dto.SystemNotificationRequest;
import com.example.counseling.shared.model.LiveSession;
import com.example.counseling.shared.util.Constants.NotificationPriority;
import com.example.counseling.shared.util.Constants.NotificationType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Ready-made notifications for the appointment, report and feedback workflows.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class WorkflowNotificationService {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("hh:mm a", Locale.ENGLISH);

    private final NotificationService notificationService;

    public List<NotificationResponse> notifyAppointment(AppointmentNotificationRequest request) {
        return switch (request.getEvent()) {
            case BOOKED -> appointmentBooked(request);
            case REMINDER -> List.of(appointmentReminder(request));
            case CANCELLED -> List.of(appointmentCancelled(request));
        };
    }

    /**
     * Confirms the booking to the student and asks the counselor to review it.
     */
    public List<NotificationResponse> appointmentBooked(AppointmentNotificationRequest appointment) {
        List<NotificationResponse> created = new ArrayList<>();
        created.add(notificationService.createNotification(NotificationRequest.builder()
                .userId(appointment.getStudentId())
                .message("Your appointment with " + counselorName(appointment) + " on " + appointment.getDate()
                        + " at " + formatTime(appointment.getTime()) + " has been booked successfully.")
                .type(NotificationType.APPOINTMENT.value())
                .priority(NotificationPriority.NORMAL.value())
                .actionUrl("/appointment/" + appointment.getAppointmentId() + "/")
                .actionText("View Details")
                .expiresInHours(72)
                .metadata(Map.of("appointment_id", appointment.getAppointmentId()))
                .build()));
        created.add(notificationService.createNotification(NotificationRequest.builder()
                .userId(appointment.getCounselorId())
                .message("New appointment request from " + studentName(appointment) + " on " + appointment.getDate()
                        + " at " + formatTime(appointment.getTime()) + ".")
                .type(NotificationType.APPOINTMENT.value())
                .priority(NotificationPriority.HIGH.value())
                .actionUrl("/counselor/appointment/" + appointment.getAppointmentId() + "/")
                .actionText("Review")
                .expiresInHours(48)
                .metadata(Map.of("appointment_id", appointment.getAppointmentId()))
                .build()));
        return created;
    }

    public NotificationResponse appointmentReminder(AppointmentNotificationRequest appointment) {
        return notificationService.createNotification(NotificationRequest.builder()
                .userId(appointment.getStudentId())
                .message("Reminder: You have an appointment with " + counselorName(appointment)
                        + " tomorrow at " + formatTime(appointment.getTime()) + ".")
                .type(NotificationType.REMINDER.value())
                .priority(NotificationPriority.HIGH.value())
                .actionUrl("/appointment/" + appointment.getAppointmentId() + "/")
                .actionText("View Details")
                .expiresInHours(24)
                .metadata(Map.of("appointment_id", appointment.getAppointmentId()))
                .build());
    }

    public NotificationResponse appointmentCancelled(AppointmentNotificationRequest appointment) {
        return notificationService.createNotification(NotificationRequest.builder()
                .userId(appointment.getStudentId())
                .message("Your appointment with " + counselorName(appointment) + " on " + appointment.getDate() + " has been cancelled.")
                .type(NotificationType.APPOINTMENT.value())
                .priority(NotificationPriority.HIGH.value())
                .actionUrl("/scheduler/")
                .actionText("Book New")
                .expiresInHours(168)
                .metadata(Map.of("appointment_id", appointment.getAppointmentId()))
                .build());
    }

    public NotificationResponse reportCompleted(ReportNotificationRequest report) {
        String counselor = report.getCounselorName() != null ? report.getCounselorName() : "your counselor";
        return notificationService.createNotification(NotificationRequest.builder()
                .userId(report.getStudentId())
                .message("Your session report with " + counselor + " has been completed.")
                .type(NotificationType.REPORT.value())
                .priority(NotificationPriority.NORMAL.value())
                .actionUrl("/user-profile/")
                .actionText("View Report")
                .expiresInHours(168)
                .metadata(Map.of("report_id", report.getReportId()))
                .build());
    }

    public NotificationResponse feedbackRequested(LiveSession session) {
        String counselor = session.getCounselorName() != null ? session.getCounselorName() : "your counselor";
        return notificationService.createNotification(NotificationRequest.builder()
                .userId(session.getStudentId())
                .message("Please share your feedback about your session with " + counselor + ".")
                .type(NotificationType.FEEDBACK.value())
                .priority(NotificationPriority.NORMAL.value())
                .actionUrl("/feedback/" + session.getAppointmentId() + "/")
                .actionText("Give Feedback")
                .expiresInHours(168)
                .metadata(Map.of("appointment_id", session.getAppointmentId()))
                .build());
    }

    public List<NotificationResponse> systemNotification(SystemNotificationRequest request) {
        List<NotificationResponse> created = new ArrayList<>();
        for (String userId : request.getUserIds()) {
            created.add(notificationService.createNotification(NotificationRequest.builder()
                    .userId(userId)
                    .message(request.getMessage())
                    .type(NotificationType.SYSTEM.value())
                    .priority(request.getPriority() != null ? request.getPriority() : NotificationPriority.NORMAL.value())
                    .actionUrl(request.getActionUrl())
                    .actionText(request.getActionText())
                    .expiresInHours(72)
                    .build()));
        }
        log.info("Sent system notification to {} users", created.size());
        return created;
    }

    private static String formatTime(LocalTime time) {
        return time.format(TIME_FORMAT);
    }

    private static String counselorName(AppointmentNotificationRequest appointment) {
        return appointment.getCounselorName() != null ? appointment.getCounselorName() : "your counselor";
    }

    private static String studentName(AppointmentNotificationRequest appointment) {
        return appointment.getStudentName() != null ? appointment.getStudentName() : "a student";
    }
}
