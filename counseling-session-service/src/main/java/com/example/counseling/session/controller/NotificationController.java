package com.example.counseling.session.controller;

import com.example.counseling.session.dto.AppointmentNotificationRequest;
import com.example.counseling.session.dto.BulkUpdateResponse;
import com.example.counseling.session.dto.NotificationRequest;
import com.example.counseling.session.dto.NotificationResponse;
import com.example.counseling.session.dto.ReportNotificationRequest;
import com.example.counseling.session.dto.SystemNotificationRequest;
import com.example.counseling.session.dto.UnreadCountResponse;
import com.example.counseling.session.identity.AuthenticatedUser;
import com.example.counseling.session.identity.IdentityResolver;
import com.example.counseling.session.service.NotificationService;
import com.example.counseling.session.service.WorkflowNotificationService;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.util.List;

@RestController
@RequestMapping("/api/notifications")
@RequiredArgsConstructor
@Slf4j
public class NotificationController {

    private final NotificationService notificationService;
    private final WorkflowNotificationService workflowNotificationService;
    private final IdentityResolver identityResolver;
    private final Scheduler jdbcScheduler;

    @GetMapping
    public Mono<List<NotificationResponse>> listRecent(@RequestParam(required = false) Integer limit, ServerWebExchange exchange) {
        AuthenticatedUser caller = caller(exchange);
        return Mono.fromCallable(() -> notificationService.listRecent(caller.userId(), limit)).subscribeOn(jdbcScheduler);
    }

    @GetMapping("/unread-count")
    public Mono<UnreadCountResponse> unreadCount(ServerWebExchange exchange) {
        AuthenticatedUser caller = caller(exchange);
        return Mono.fromCallable(() -> new UnreadCountResponse(notificationService.unreadCount(caller.userId()))).subscribeOn(jdbcScheduler);
    }

    @PostMapping
    @RateLimiter(name = "notificationCreateLimiter", fallbackMethod = "createFallback")
    public Mono<ResponseEntity<NotificationResponse>> createNotification(@Valid @RequestBody NotificationRequest request) {
        log.info("Creating {} notification for user {}", request.getType(), request.getUserId());
        return Mono.fromCallable(() -> notificationService.createNotification(request))
                .subscribeOn(jdbcScheduler)
                .map(response -> ResponseEntity.status(HttpStatus.CREATED).body(response));
    }

    public Mono<ResponseEntity<NotificationResponse>> createFallback(NotificationRequest request, RequestNotPermitted ex) {
        log.warn("Notification rate limit exceeded for user {}. Details: {}", request.getUserId(), ex.getMessage());
        return Mono.error(new ResponseStatusException(HttpStatus.TOO_MANY_REQUESTS, "Too many notifications. Please try again later."));
    }

    @PostMapping("/system")
    public Mono<ResponseEntity<List<NotificationResponse>>> systemNotification(@Valid @RequestBody SystemNotificationRequest request) {
        return Mono.fromCallable(() -> workflowNotificationService.systemNotification(request))
                .subscribeOn(jdbcScheduler)
                .map(created -> ResponseEntity.status(HttpStatus.CREATED).body(created));
    }

    @PostMapping("/appointments")
    public Mono<ResponseEntity<List<NotificationResponse>>> appointmentNotification(@Valid @RequestBody AppointmentNotificationRequest request) {
        log.info("Appointment {} notification for appointment {}", request.getEvent(), request.getAppointmentId());
        return Mono.fromCallable(() -> workflowNotificationService.notifyAppointment(request))
                .subscribeOn(jdbcScheduler)
                .map(created -> ResponseEntity.status(HttpStatus.CREATED).body(created));
    }

    @PostMapping("/reports")
    public Mono<ResponseEntity<NotificationResponse>> reportNotification(@Valid @RequestBody ReportNotificationRequest request) {
        return Mono.fromCallable(() -> workflowNotificationService.reportCompleted(request))
                .subscribeOn(jdbcScheduler)
                .map(created -> ResponseEntity.status(HttpStatus.CREATED).body(created));
    }

    @PostMapping("/{id}/read")
    public Mono<ResponseEntity<Void>> markRead(@PathVariable Long id, ServerWebExchange exchange) {
        AuthenticatedUser caller = caller(exchange);
        return Mono.fromRunnable(() -> notificationService.markRead(id, caller.userId()))
                .subscribeOn(jdbcScheduler)
                .then(Mono.just(ResponseEntity.noContent().<Void>build()));
    }

    @PostMapping("/read-all")
    public Mono<BulkUpdateResponse> markAllRead(ServerWebExchange exchange) {
        AuthenticatedUser caller = caller(exchange);
        return Mono.fromCallable(() -> {
                    int updated = notificationService.markAllRead(caller.userId());
                    return new BulkUpdateResponse(updated, notificationService.unreadCount(caller.userId()));
                })
                .subscribeOn(jdbcScheduler);
    }

    @PostMapping("/{id}/dismiss")
    public Mono<ResponseEntity<Void>> dismiss(@PathVariable Long id, ServerWebExchange exchange) {
        AuthenticatedUser caller = caller(exchange);
        return Mono.fromRunnable(() -> notificationService.dismiss(id, caller.userId()))
                .subscribeOn(jdbcScheduler)
                .then(Mono.just(ResponseEntity.noContent().<Void>build()));
    }

    @PostMapping("/dismiss-all")
    public Mono<BulkUpdateResponse> dismissAll(ServerWebExchange exchange) {
        AuthenticatedUser caller = caller(exchange);
        return Mono.fromCallable(() -> {
                    int updated = notificationService.dismissAll(caller.userId());
                    return new BulkUpdateResponse(updated, notificationService.unreadCount(caller.userId()));
                })
                .subscribeOn(jdbcScheduler);
    }

    private AuthenticatedUser caller(ServerWebExchange exchange) {
        return identityResolver.require(exchange.getRequest().getHeaders(), exchange.getRequest().getURI());
    }
}
