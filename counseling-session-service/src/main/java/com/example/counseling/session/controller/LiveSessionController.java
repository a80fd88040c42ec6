package com.example.counseling.session.controller;

import com.example.counseling.session.dto.AppointmentDetails;
import com.example.counseling.session.dto.LiveSessionResponse;
import com.example.counseling.session.dto.SessionCreatedResponse;
import com.example.counseling.session.dto.SessionJoinResponse;
import com.example.counseling.session.dto.SessionMessageResponse;
import com.example.counseling.session.dto.SessionNotesRequest;
import com.example.counseling.session.dto.SessionNotesResponse;
import com.example.counseling.session.identity.AuthenticatedUser;
import com.example.counseling.session.identity.IdentityResolver;
import com.example.counseling.session.service.LiveSessionService;
import com.example.counseling.session.service.SessionCoordinator;
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
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.util.List;

@RestController
@RequestMapping("/api/sessions")
@RequiredArgsConstructor
@Slf4j
public class LiveSessionController {

    private final LiveSessionService liveSessionService;
    private final SessionCoordinator sessionCoordinator;
    private final IdentityResolver identityResolver;
    private final Scheduler jdbcScheduler;

    @PostMapping
    @RateLimiter(name = "sessionCreateLimiter", fallbackMethod = "createFallback")
    public Mono<ResponseEntity<SessionCreatedResponse>> createSession(@Valid @RequestBody AppointmentDetails appointment,
                                                                      ServerWebExchange exchange) {
        AuthenticatedUser caller = caller(exchange);
        log.info("Live session requested for appointment {} by {}", appointment.getAppointmentId(), caller.userId());
        return Mono.fromCallable(() -> liveSessionService.createSession(appointment, caller))
                .subscribeOn(jdbcScheduler)
                .map(response -> ResponseEntity.status(response.isCreated() ? HttpStatus.CREATED : HttpStatus.OK).body(response));
    }

    public Mono<ResponseEntity<SessionCreatedResponse>> createFallback(AppointmentDetails appointment, ServerWebExchange exchange,
                                                                       RequestNotPermitted ex) {
        log.warn("Session creation rate limit exceeded for appointment {}. Details: {}", appointment.getAppointmentId(), ex.getMessage());
        return Mono.error(new ResponseStatusException(HttpStatus.TOO_MANY_REQUESTS, "Too many session requests. Please try again later."));
    }

    @PostMapping("/{roomId}/join")
    public Mono<SessionJoinResponse> checkJoin(@PathVariable String roomId, ServerWebExchange exchange) {
        AuthenticatedUser caller = caller(exchange);
        return Mono.fromCallable(() -> liveSessionService.checkJoin(roomId, caller)).subscribeOn(jdbcScheduler);
    }

    @GetMapping("/{roomId}")
    public Mono<LiveSessionResponse> getSession(@PathVariable String roomId, ServerWebExchange exchange) {
        AuthenticatedUser caller = caller(exchange);
        return Mono.fromCallable(() -> liveSessionService.getDetails(roomId, caller)).subscribeOn(jdbcScheduler);
    }

    @PostMapping("/{roomId}/end")
    public Mono<LiveSessionResponse> endSession(@PathVariable String roomId, ServerWebExchange exchange) {
        AuthenticatedUser caller = caller(exchange);
        log.info("End requested for session {} by {}", roomId, caller.userId());
        return Mono.fromCallable(() -> sessionCoordinator.endSession(roomId, caller)).subscribeOn(jdbcScheduler);
    }

    @PostMapping("/{roomId}/no-show")
    public Mono<LiveSessionResponse> markNoShow(@PathVariable String roomId, ServerWebExchange exchange) {
        AuthenticatedUser caller = caller(exchange);
        return Mono.fromCallable(() -> sessionCoordinator.markNoShow(roomId, caller)).subscribeOn(jdbcScheduler);
    }

    @PostMapping("/appointments/{appointmentId}/cancel")
    public Mono<LiveSessionResponse> cancelForAppointment(@PathVariable Long appointmentId, ServerWebExchange exchange) {
        AuthenticatedUser caller = caller(exchange);
        log.info("Cancellation requested for appointment {} by {}", appointmentId, caller.userId());
        return Mono.fromCallable(() -> sessionCoordinator.cancelForAppointment(appointmentId, caller)).subscribeOn(jdbcScheduler);
    }

    @GetMapping("/{roomId}/messages")
    public Mono<List<SessionMessageResponse>> getMessages(@PathVariable String roomId, ServerWebExchange exchange) {
        AuthenticatedUser caller = caller(exchange);
        return Mono.fromCallable(() -> liveSessionService.getMessages(roomId, caller)).subscribeOn(jdbcScheduler);
    }

    @GetMapping("/{roomId}/notes")
    public Mono<SessionNotesResponse> getNotes(@PathVariable String roomId, ServerWebExchange exchange) {
        AuthenticatedUser caller = caller(exchange);
        return Mono.fromCallable(() -> liveSessionService.getNotes(roomId, caller)).subscribeOn(jdbcScheduler);
    }

    @PutMapping("/{roomId}/notes")
    public Mono<SessionNotesResponse> updateNotes(@PathVariable String roomId, @Valid @RequestBody SessionNotesRequest request,
                                                  ServerWebExchange exchange) {
        AuthenticatedUser caller = caller(exchange);
        return Mono.fromCallable(() -> liveSessionService.updateNotes(roomId, request.getNotes(), caller)).subscribeOn(jdbcScheduler);
    }

    private AuthenticatedUser caller(ServerWebExchange exchange) {
        return identityResolver.require(exchange.getRequest().getHeaders(), exchange.getRequest().getURI());
    }
}
