package com.example.counseling.session.websocket;

import com.example.counseling.session.identity.AuthenticatedUser;
import com.example.counseling.shared.util.Constants.ParticipantRole;

/**
 * What admission established for one socket: route, caller, and for room sockets the session and the caller's role.
 */
public record ConnectionContext(TopicRoute route, AuthenticatedUser user, Long sessionId, ParticipantRole role) {

    public static ConnectionContext forNotifications(TopicRoute route, AuthenticatedUser user) {
        return new ConnectionContext(route, user, null, ParticipantRole.NONE);
    }

    public static ConnectionContext forRoom(TopicRoute route, AuthenticatedUser user, Long sessionId, ParticipantRole role) {
        return new ConnectionContext(route, user, sessionId, role);
    }

    public String topic() {
        return route.topicFor(user.userId());
    }

    public boolean isRoom() {
        return route.isRoom();
    }
}
