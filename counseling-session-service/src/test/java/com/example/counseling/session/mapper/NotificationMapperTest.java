package com.example.counseling.session.mapper;

import com.example.counseling.session.dto.NotificationResponse;
import com.example.counseling.shared.model.Notification;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NotificationMapperTest {

    private final NotificationMapper mapper = new NotificationMapperImpl();

    @Test
    void iconFollowsType() {
        assertEquals("bx-calendar", NotificationMapper.iconFor("appointment"));
        assertEquals("bx-file", NotificationMapper.iconFor("report"));
        assertEquals("bx-cog", NotificationMapper.iconFor("system"));
        assertEquals("bx-bell", NotificationMapper.iconFor("reminder"));
        assertEquals("bx-message-dots", NotificationMapper.iconFor("feedback"));
        assertEquals("bx-info-circle", NotificationMapper.iconFor("followup"));
        assertEquals("bx-info-circle", NotificationMapper.iconFor(null));
    }

    @Test
    void colorFollowsPriority() {
        assertEquals("#6c757d", NotificationMapper.colorFor("low"));
        assertEquals("#007bff", NotificationMapper.colorFor("normal"));
        assertEquals("#fd7e14", NotificationMapper.colorFor("high"));
        assertEquals("#dc3545", NotificationMapper.colorFor("urgent"));
    }

    @Test
    void storedRowBecomesRecipientView() {
        OffsetDateTime created = OffsetDateTime.of(2024, 5, 1, 9, 0, 0, 0, ZoneOffset.UTC);
        Notification notification = Notification.builder()
                .id(3L).userId("u1").message("Report ready")
                .notificationType("report").priority("urgent")
                .actionUrl("/user-profile/").actionText("View Report")
                .metadata("{\"report_id\":8}")
                .createdAt(created).read(true)
                .build();

        NotificationResponse response = mapper.toResponse(notification);

        assertEquals("report", response.getType());
        assertEquals("bx-file", response.getIcon());
        assertEquals("#dc3545", response.getColor());
        assertEquals(8, response.getMetadata().get("report_id"));
        assertEquals(created, response.getCreatedAt());
        assertTrue(response.isRead());
    }

    @Test
    void brokenMetadataMapsToEmptyObject() {
        NotificationResponse response = mapper.toResponse(Notification.builder().id(4L).metadata("not json").build());

        assertTrue(response.getMetadata().isEmpty());
    }
}
