package com.example.counseling.session.websocket;

import com.example.counseling.session.fanout.ClientConnection;
import com.example.counseling.session.identity.AuthenticatedUser;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.util.concurrent.Queues;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Outbound side of one WebSocket: a bounded unicast sink drained by the session's send loop.
 */
public class WebSocketClientConnection implements ClientConnection {

    private final String id;
    private final AuthenticatedUser user;
    private final Sinks.Many<String> sink;
    private final Set<String> topics = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean closed = new AtomicBoolean();
    private final Lock lifecycleLock = new ReentrantLock();

    public WebSocketClientConnection(String id, AuthenticatedUser user, int bufferSize) {
        this.id = id;
        this.user = user;
        this.sink = Sinks.many().unicast().onBackpressureBuffer(Queues.<String>get(bufferSize).get());
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public AuthenticatedUser getUser() {
        return user;
    }

    // Emission is serialized so concurrent broadcasts cannot trip FAIL_NON_SERIALIZED.
    @Override
    public synchronized boolean send(String frame) {
        return sink.tryEmitNext(frame).isSuccess();
    }

    @Override
    public Set<String> getTopics() {
        return topics;
    }

    @Override
    public boolean markClosed() {
        return closed.compareAndSet(false, true);
    }

    @Override
    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public Lock lifecycleLock() {
        return lifecycleLock;
    }

    public Flux<String> outbound() {
        return sink.asFlux();
    }

    public synchronized void complete() {
        sink.tryEmitComplete();
    }
}
