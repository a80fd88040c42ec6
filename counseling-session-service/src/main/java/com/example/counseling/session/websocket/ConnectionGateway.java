package com.example.counseling.session.websocket;

import com.example.counseling.session.identity.AuthenticatedUser;
import com.example.counseling.session.identity.IdentityResolver;
import com.example.counseling.shared.config.AppProperties;
import com.example.counseling.shared.config.CorrelationIdFilter;
import com.example.counseling.shared.exception.ResourceNotFoundException;
import com.example.counseling.shared.exception.SessionAccessDeniedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.HandshakeInfo;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.util.Optional;

/**
 * Reactive entry point for /ws/live-session/{room}, /ws/chat/{room} and /ws/notifications.
 * Frames of one connection are processed strictly in arrival order.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ConnectionGateway implements WebSocketHandler {

    private final SessionGatewayService gatewayService;
    private final IdentityResolver identityResolver;
    private final AppProperties appProperties;
    private final Scheduler jdbcScheduler;

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        HandshakeInfo handshake = session.getHandshakeInfo();
        Optional<TopicRoute> route = TopicRoute.parse(handshake.getUri().getPath(), appProperties.getWebsocket());
        if (route.isEmpty()) {
            log.warn("[CONNECT_REJECTED] Unknown socket path {}", handshake.getUri().getPath());
            return session.close(CloseStatus.POLICY_VIOLATION.withReason("Unknown path"));
        }
        Optional<AuthenticatedUser> user = identityResolver.resolve(handshake.getHeaders(), handshake.getUri());
        if (user.isEmpty()) {
            log.warn("[CONNECT_REJECTED] Unauthenticated handshake on {} from {}", handshake.getUri().getPath(), handshake.getRemoteAddress());
            return session.close(CloseStatus.POLICY_VIOLATION.withReason("Authentication required"));
        }

        return Mono.fromCallable(() -> gatewayService.admit(route.get(), user.get()))
                .subscribeOn(jdbcScheduler)
                .flatMap(context -> serve(session, context))
                .onErrorResume(SessionAccessDeniedException.class, e -> reject(session, user.get(), e.getMessage()))
                .onErrorResume(ResourceNotFoundException.class, e -> reject(session, user.get(), e.getMessage()));
    }

    private Mono<Void> reject(WebSocketSession session, AuthenticatedUser user, String reason) {
        log.warn("[CONNECT_REJECTED] user={} path={}: {}", user.userId(), session.getHandshakeInfo().getUri().getPath(), reason);
        return session.close(CloseStatus.POLICY_VIOLATION.withReason(reason));
    }

    private Mono<Void> serve(WebSocketSession session, ConnectionContext context) {
        WebSocketClientConnection connection = new WebSocketClientConnection(
                session.getId(), context.user(), appProperties.getWebsocket().getOutboundBufferSize());
        log.debug("Serving connection {} of user {} (handshake correlation id {})",
                connection.getId(), context.user().userId(), session.getAttributes().get(CorrelationIdFilter.CORRELATION_ID_ATTRIBUTE));

        Mono<Void> outbound = session.send(connection.outbound().map(session::textMessage));

        Mono<Void> inbound = Mono.fromRunnable(() -> gatewayService.open(connection, context))
                .subscribeOn(jdbcScheduler)
                .thenMany(session.receive()
                        .map(WebSocketMessage::getPayloadAsText)
                        .concatMap(payload -> Mono.fromRunnable(() -> gatewayService.handleFrame(connection, context, payload))
                                .subscribeOn(jdbcScheduler)))
                .then()
                .onErrorResume(e -> {
                    log.error("Closing connection {} of user {} after handler failure", connection.getId(), context.user().userId(), e);
                    return session.close(CloseStatus.SERVER_ERROR);
                })
                .doFinally(signal -> connection.complete());

        return Mono.when(outbound, inbound)
                .onErrorResume(e -> {
                    log.debug("Connection {} terminated with {}", connection.getId(), e.toString());
                    return Mono.empty();
                })
                .doFinally(signal -> jdbcScheduler.schedule(() -> gatewayService.close(connection, context)));
    }
}
