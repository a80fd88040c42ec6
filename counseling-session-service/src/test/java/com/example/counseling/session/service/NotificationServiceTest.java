package com.example.counseling.session.service;

import com.example.counseling.session.dto.NotificationRequest;
import com.example.counseling.session.dto.NotificationResponse;
import com.example.counseling.session.fanout.RecordingConnection;
import com.example.counseling.session.fanout.TopicRegistry;
import com.example.counseling.session.mapper.NotificationMapperImpl;
import com.example.counseling.shared.config.AppProperties;
import com.example.counseling.shared.config.MonitoringConfig;
import com.example.counseling.shared.exception.FrameValidationException;
import com.example.counseling.shared.exception.ResourceNotFoundException;
import com.example.counseling.shared.model.Notification;
import com.example.counseling.shared.repository.NotificationRepository;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class NotificationServiceTest {

    private NotificationRepository repository;
    private TopicRegistry topicRegistry;
    private AppProperties appProperties;
    private NotificationService service;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        repository = mock(NotificationRepository.class);
        topicRegistry = new TopicRegistry();
        appProperties = new AppProperties();
        service = new NotificationService(repository, new NotificationMapperImpl(), topicRegistry,
                new FrameFactory(objectMapper), appProperties,
                new MonitoringConfig.CounselingMetricsCollector(new SimpleMeterRegistry()));
        when(repository.save(any(Notification.class))).thenAnswer(invocation -> {
            Notification n = invocation.getArgument(0);
            n.setId(101L);
            return n;
        });
    }

    @Test
    void createPersistsThenPushesNotificationAndCount() {
        RecordingConnection stream = new RecordingConnection("u1");
        topicRegistry.join("notifications_u1", stream);
        when(repository.countUnread("u1")).thenReturn(3L);

        NotificationResponse response = service.createNotification(NotificationRequest.builder()
                .userId("u1")
                .message("Your report is ready")
                .type("report")
                .priority("high")
                .metadata(Map.of("report_id", 5))
                .build());

        assertEquals(101L, response.getId());
        assertEquals("bx-file", response.getIcon());
        assertEquals("#fd7e14", response.getColor());
        assertEquals(5, response.getMetadata().get("report_id"));
        assertFalse(response.isRead());

        JsonNode pushed = stream.framesOfType("new_notification").get(0);
        assertEquals(101L, pushed.get("notification").get("id").asLong());
        assertEquals("Your report is ready", pushed.get("notification").get("message").asText());
        assertEquals(3L, stream.framesOfType("notification_count").get(0).get("count").asLong());
    }

    @Test
    void createWithoutOpenStreamStillPersists() {
        service.createNotification(NotificationRequest.builder().userId("offline").message("hi").build());

        verify(repository).save(any(Notification.class));
    }

    @Test
    void relativeExpiryIsResolvedAtCreation() {
        ArgumentCaptor<Notification> saved = ArgumentCaptor.forClass(Notification.class);
        OffsetDateTime before = OffsetDateTime.now(ZoneOffset.UTC);

        service.createNotification(NotificationRequest.builder().userId("u1").message("m").expiresInHours(72).build());

        verify(repository).save(saved.capture());
        OffsetDateTime expiresAt = saved.getValue().getExpiresAt();
        assertFalse(expiresAt.isBefore(before.plusHours(72)));
        assertTrue(expiresAt.isBefore(before.plusHours(72).plusMinutes(1)));
        assertEquals("normal", saved.getValue().getPriority());
    }

    @Test
    void noExpiryMeansNeverExpires() {
        NotificationResponse response = service.createNotification(NotificationRequest.builder().userId("u1").message("m").build());

        assertNull(response.getExpiresAt());
        assertEquals("bx-info-circle", response.getIcon());
        assertEquals("#007bff", response.getColor());
    }

    @Test
    void listRecentUsesDefaultAndCapsLimit() {
        when(repository.findRecent(anyString(), anyInt())).thenReturn(List.of());

        service.listRecent("u1", null);
        service.listRecent("u1", 500);

        verify(repository).findRecent("u1", 10);
        verify(repository).findRecent("u1", 50);
    }

    @Test
    void markReadOfAnotherUsersNotificationIsNotFound() {
        when(repository.findByIdAndUserId(9L, "intruder")).thenReturn(Optional.empty());

        assertThrows(ResourceNotFoundException.class, () -> service.markRead(9L, "intruder"));
        verify(repository, never()).markAsRead(anyLong(), anyString());
    }

    @Test
    void markReadPushesRefreshedCount() {
        RecordingConnection stream = new RecordingConnection("u1");
        topicRegistry.join("notifications_u1", stream);
        when(repository.findByIdAndUserId(9L, "u1")).thenReturn(Optional.of(Notification.builder().id(9L).userId("u1").build()));
        when(repository.countUnread("u1")).thenReturn(0L);

        service.markRead(9L, "u1");

        verify(repository).markAsRead(9L, "u1");
        assertEquals(0L, stream.lastFrame().get("count").asLong());
    }

    @Test
    void typeWiderThanItsColumnIsRejectedBeforeSaving() {
        NotificationRequest request = NotificationRequest.builder()
                .userId("u1")
                .message("Reminder")
                .type("t".repeat(NotificationRequest.MAX_TYPE_LENGTH + 1))
                .build();

        FrameValidationException error = assertThrows(FrameValidationException.class, () -> service.createNotification(request));

        assertTrue(error.getMessage().contains("type"));
        verify(repository, never()).save(any(Notification.class));
    }

    @Test
    void messageWiderThanItsColumnIsRejectedBeforeSaving() {
        NotificationRequest request = NotificationRequest.builder()
                .userId("u1")
                .message("m".repeat(NotificationRequest.MAX_MESSAGE_LENGTH + 1))
                .build();

        assertThrows(FrameValidationException.class, () -> service.createNotification(request));
        verify(repository, never()).save(any(Notification.class));
    }
}
