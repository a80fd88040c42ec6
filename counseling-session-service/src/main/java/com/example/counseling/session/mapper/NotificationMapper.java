package com.example.counseling.session.mapper;

import com.example.counseling.session.dto.NotificationResponse;
import com.example.counseling.shared.model.Notification;
import com.example.counseling.shared.util.JsonUtils;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

import java.util.List;

@Mapper(componentModel = "spring", imports = JsonUtils.class)
public abstract class NotificationMapper {

    @Named("iconFor")
    public static String iconFor(String type) {
        if (type == null) {
            return "bx-info-circle";
        }
        return switch (type) {
            case "appointment" -> "bx-calendar";
            case "report" -> "bx-file";
            case "system" -> "bx-cog";
            case "reminder" -> "bx-bell";
            case "feedback" -> "bx-message-dots";
            default -> "bx-info-circle";
        };
    }

    @Named("colorFor")
    public static String colorFor(String priority) {
        if (priority == null) {
            return "#007bff";
        }
        return switch (priority) {
            case "low" -> "#6c757d";
            case "high" -> "#fd7e14";
            case "urgent" -> "#dc3545";
            default -> "#007bff";
        };
    }

    @Mapping(source = "notificationType", target = "type")
    @Mapping(target = "icon", expression = "java(iconFor(notification.getNotificationType()))")
    @Mapping(target = "color", expression = "java(colorFor(notification.getPriority()))")
    @Mapping(target = "metadata", expression = "java(JsonUtils.parseJsonObject(notification.getMetadata()))")
    public abstract NotificationResponse toResponse(Notification notification);

    public abstract List<NotificationResponse> toResponses(List<Notification> notifications);
}
