package com.example.counseling.shared.repository;

import com.example.counseling.shared.model.SessionMessage;
import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.Repository;
import org.springframework.data.repository.query.Param;

import java.util.List;

/**
 * Append-only: exposes insert and ordered reads, nothing that edits or removes a message.
 */
@org.springframework.stereotype.Repository
public interface SessionMessageRepository extends Repository<SessionMessage, Long> {

    SessionMessage save(SessionMessage message);

    @Query("SELECT * FROM session_messages WHERE session_id = :sessionId ORDER BY sent_at ASC, id ASC")
    List<SessionMessage> findBySessionIdOrdered(@Param("sessionId") Long sessionId);
}
