package com.example.counseling.session.fanout;

import com.example.counseling.session.identity.AuthenticatedUser;

import java.util.Set;
import java.util.concurrent.locks.Lock;

/**
 * One open socket as seen by the fanout layer.
 */
public interface ClientConnection {

    String getId();

    AuthenticatedUser getUser();

    /**
     * Queues a frame for this connection without blocking.
     *
     * @return false if the frame could not be queued (closed or overflowing connection).
     */
    boolean send(String frame);

    /**
     * Topics this connection currently belongs to. Maintained by {@link TopicRegistry}.
     */
    Set<String> getTopics();

    /**
     * Flips the connection to closed.
     *
     * @return true for the first caller only.
     */
    boolean markClosed();

    boolean isClosed();

    /**
     * Held while the connection is being opened or closed, so the two never interleave.
     * Never held while sending.
     */
    Lock lifecycleLock();
}
