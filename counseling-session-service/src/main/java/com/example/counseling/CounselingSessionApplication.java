package com.example.counseling;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;
import reactor.core.publisher.Hooks;

/**
 * Real-time session coordination and notification fanout for the counseling platform.
 *
 * Serves three WebSocket topics (live session rooms, chat rooms, per-user notification
 * streams) and the REST API the appointment and reporting workflows call into.
 */
@SpringBootApplication
@EnableAsync
public class CounselingSessionApplication {

    static {
        // Carries MDC values (correlation id) across Reactor thread hops.
        Hooks.enableAutomaticContextPropagation();
    }

    public static void main(String[] args) {
        SpringApplication.run(CounselingSessionApplication.class, args);
    }
}
