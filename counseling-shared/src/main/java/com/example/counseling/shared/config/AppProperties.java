package com.example.counseling.shared.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.ZoneId;

@Data
@Validated
public class AppProperties {

    private String podName;

    private final Session session = new Session();
    private final Websocket websocket = new Websocket();
    private final Notification notification = new Notification();
    private final Identity identity = new Identity();
    private final H2Console h2Console = new H2Console();

    @Data
    public static class Session {
        @NotNull
        private Duration defaultDuration = Duration.ofMinutes(60);
        @NotBlank
        private String roomIdPrefix = "session_";
        // Appointment dates and times arrive without an offset and are interpreted in this zone.
        @NotNull
        private ZoneId zone = ZoneId.of("UTC");
        // Bounded by session_messages.message.
        @Positive
        private int maxChatLength = 4000;
    }

    @Data
    public static class Websocket {
        @NotBlank
        private String liveSessionPath = "/ws/live-session/";
        @NotBlank
        private String chatPath = "/ws/chat/";
        @NotBlank
        private String notificationsPath = "/ws/notifications";
        @Positive
        private int outboundBufferSize = 256;
    }

    @Data
    public static class Notification {
        @Positive
        private int recentLimit = 10;
        @Positive
        private int maxLimit = 50;
    }

    @Data
    public static class Identity {
        @NotBlank
        private String userHeader = "X-User-Id";
        @NotBlank
        private String usernameHeader = "X-Username";
        private String userQueryParameter = "userId";
        private String usernameQueryParameter = "username";
        private boolean allowQueryParameters = true;
    }

    @Data
    public static class H2Console {
        private boolean enabled = false;
        private String webPort = "8084";
        private String tcpPort = "9094";
    }
}
