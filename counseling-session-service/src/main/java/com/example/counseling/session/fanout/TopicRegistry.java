package com.example.counseling.session.fanout;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process publish/subscribe keyed by topic name.
 * A topic exists only while it has at least one member.
 */
@Component
@Slf4j
public class TopicRegistry {

    private final Map<String, Set<ClientConnection>> subscribers = new ConcurrentHashMap<>();

    public void join(String topic, ClientConnection connection) {
        // Membership changes happen inside compute so a concurrent leave cannot drop the topic under us.
        subscribers.compute(topic, (key, members) -> {
            Set<ClientConnection> target = members != null ? members : ConcurrentHashMap.newKeySet();
            target.add(connection);
            return target;
        });
        connection.getTopics().add(topic);
        log.debug("Connection {} joined topic {}", connection.getId(), topic);
    }

    public void leave(String topic, ClientConnection connection) {
        subscribers.computeIfPresent(topic, (key, members) -> {
            members.remove(connection);
            return members.isEmpty() ? null : members;
        });
        connection.getTopics().remove(topic);
        log.debug("Connection {} left topic {}", connection.getId(), topic);
    }

    public void leaveAll(ClientConnection connection) {
        for (String topic : List.copyOf(connection.getTopics())) {
            leave(topic, connection);
        }
    }

    /**
     * Hands the frame to every current member of the topic, the sender included.
     * A member that cannot take the frame is skipped; the others still receive it.
     *
     * @return the number of members that accepted the frame.
     */
    public int broadcast(String topic, String frame) {
        Set<ClientConnection> members = subscribers.get(topic);
        if (members == null || members.isEmpty()) {
            log.debug("No members on topic {}, frame dropped", topic);
            return 0;
        }
        int delivered = 0;
        for (ClientConnection connection : List.copyOf(members)) {
            try {
                if (connection.send(frame)) {
                    delivered++;
                } else {
                    log.warn("Failed to queue frame on topic {} for connection {} (user {})",
                            topic, connection.getId(), connection.getUser().userId());
                }
            } catch (RuntimeException e) {
                log.warn("Error delivering frame on topic {} to connection {}: {}", topic, connection.getId(), e.getMessage());
            }
        }
        return delivered;
    }

    public int memberCount(String topic) {
        Set<ClientConnection> members = subscribers.get(topic);
        return members == null ? 0 : members.size();
    }

    public boolean hasTopic(String topic) {
        return subscribers.containsKey(topic);
    }

    public int topicCount() {
        return subscribers.size();
    }
}
