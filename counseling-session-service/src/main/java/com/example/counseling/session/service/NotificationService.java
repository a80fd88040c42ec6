package com.example.counseling.session.service;

import com.example.counseling.session.dto.NotificationRequest;
import com.example.counseling.session.dto.NotificationResponse;
import com.example.counseling.session.fanout.TopicRegistry;
import com.example.counseling.session.mapper.NotificationMapper;
import com.example.counseling.shared.aspect.Monitored;
import com.example.counseling.shared.config.AppProperties;
import com.example.counseling.shared.config.MonitoringConfig;
import com.example.counseling.shared.exception.FrameValidationException;
import com.example.counseling.shared.exception.ResourceNotFoundException;
import com.example.counseling.shared.model.Notification;
import com.example.counseling.shared.repository.NotificationRepository;
import com.example.counseling.shared.util.Constants;
import com.example.counseling.shared.util.Constants.NotificationPriority;
import com.example.counseling.shared.util.JsonUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Persists notifications and pushes them, plus refreshed unread counts, to the recipient's
 * notification topic. The store is authoritative: a push that reaches nobody is not an error.
 */
@Service
@Slf4j
@RequiredArgsConstructor
@Monitored("service")
public class NotificationService {

    private final NotificationRepository notificationRepository;
    private final NotificationMapper notificationMapper;
    private final TopicRegistry topicRegistry;
    private final FrameFactory frameFactory;
    private final AppProperties appProperties;
    private final MonitoringConfig.CounselingMetricsCollector metricsCollector;

    public NotificationResponse createNotification(NotificationRequest request) {
        if (request.getUserId() == null || request.getUserId().isBlank()) {
            throw new FrameValidationException("Notification recipient is required");
        }
        if (request.getMessage() == null || request.getMessage().isBlank()) {
            throw new FrameValidationException("Notification message is required");
        }
        String type = request.getType() != null ? request.getType() : Constants.NotificationType.GENERAL.value();
        String priority = request.getPriority() != null ? request.getPriority() : NotificationPriority.NORMAL.value();
        String metadata = JsonUtils.toJsonObject(request.getMetadata());
        requireMaxLength("userId", request.getUserId(), NotificationRequest.MAX_USER_ID_LENGTH);
        requireMaxLength("message", request.getMessage(), NotificationRequest.MAX_MESSAGE_LENGTH);
        requireMaxLength("type", type, NotificationRequest.MAX_TYPE_LENGTH);
        requireMaxLength("actionUrl", request.getActionUrl(), NotificationRequest.MAX_ACTION_URL_LENGTH);
        requireMaxLength("actionText", request.getActionText(), NotificationRequest.MAX_ACTION_TEXT_LENGTH);
        requireMaxLength("metadata", metadata, NotificationRequest.MAX_METADATA_LENGTH);
        requireMaxLength("priority", priority, NotificationRequest.MAX_PRIORITY_LENGTH);
        OffsetDateTime now = OffsetDateTime.now(ZoneOffset.UTC);
        Notification notification = Notification.builder()
                .userId(request.getUserId())
                .message(request.getMessage())
                .notificationType(type)
                .priority(priority)
                .actionUrl(request.getActionUrl())
                .actionText(request.getActionText())
                .metadata(metadata)
                .createdAt(now)
                .expiresAt(resolveExpiry(request, now))
                .read(false)
                .dismissed(false)
                .build();

        Notification saved = notificationRepository.save(notification);
        metricsCollector.incrementCounter("counseling.notifications.created", "type", saved.getNotificationType());
        log.info("Created {} notification {} for user {}", saved.getNotificationType(), saved.getId(), saved.getUserId());

        NotificationResponse response = notificationMapper.toResponse(saved);
        push(saved.getUserId(), frameFactory.newNotification(response));
        pushUnreadCount(saved.getUserId());
        return response;
    }

    private static void requireMaxLength(String field, String value, int maxLength) {
        if (value != null && value.length() > maxLength) {
            throw new FrameValidationException("Notification " + field + " must be at most " + maxLength + " characters");
        }
    }

    private OffsetDateTime resolveExpiry(NotificationRequest request, OffsetDateTime now) {
        if (request.getExpiresInHours() != null) {
            return now.plusHours(request.getExpiresInHours());
        }
        return request.getExpiresAt();
    }

    public long unreadCount(String userId) {
        return notificationRepository.countUnread(userId);
    }

    /**
     * Newest-first, undismissed notifications. The limit defaults to the configured recent limit and is capped.
     */
    public List<NotificationResponse> listRecent(String userId, Integer limit) {
        AppProperties.Notification settings = appProperties.getNotification();
        int effective = limit == null ? settings.getRecentLimit() : Math.max(1, Math.min(limit, settings.getMaxLimit()));
        return notificationMapper.toResponses(notificationRepository.findRecent(userId, effective));
    }

    public void markRead(Long notificationId, String userId) {
        requireOwned(notificationId, userId);
        int updated = notificationRepository.markAsRead(notificationId, userId);
        log.debug("mark_read {} for user {} updated {} rows", notificationId, userId, updated);
        pushUnreadCount(userId);
    }

    public int markAllRead(String userId) {
        int updated = notificationRepository.markAllAsRead(userId);
        log.info("Marked {} notifications as read for user {}", updated, userId);
        pushUnreadCount(userId);
        return updated;
    }

    public void dismiss(Long notificationId, String userId) {
        requireOwned(notificationId, userId);
        int updated = notificationRepository.dismiss(notificationId, userId);
        log.debug("dismiss {} for user {} updated {} rows", notificationId, userId, updated);
        pushUnreadCount(userId);
    }

    public int dismissAll(String userId) {
        int updated = notificationRepository.dismissAll(userId);
        log.info("Dismissed {} notifications for user {}", updated, userId);
        pushUnreadCount(userId);
        return updated;
    }

    public int deleteExpired(OffsetDateTime now) {
        return notificationRepository.deleteExpired(now);
    }

    public void pushUnreadCount(String userId) {
        push(userId, frameFactory.notificationCount(unreadCount(userId)));
    }

    private void requireOwned(Long notificationId, String userId) {
        // Another user's notification is reported as missing rather than forbidden.
        notificationRepository.findByIdAndUserId(notificationId, userId)
                .orElseThrow(() -> new ResourceNotFoundException("Notification not found: " + notificationId));
    }

    private void push(String userId, String frame) {
        int delivered = topicRegistry.broadcast(Constants.notificationTopic(userId), frame);
        if (delivered == 0) {
            log.debug("User {} has no open notification stream; push skipped", userId);
        }
    }
}
