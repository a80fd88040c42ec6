package com.example.counseling.shared.repository;

import com.example.counseling.shared.model.SessionParticipant;
import org.springframework.data.jdbc.repository.query.Modifying;
import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface SessionParticipantRepository extends CrudRepository<SessionParticipant, Long> {

    Optional<SessionParticipant> findBySessionIdAndUserId(Long sessionId, String userId);

    @Query("SELECT * FROM session_participants WHERE session_id = :sessionId ORDER BY joined_at ASC, id ASC")
    List<SessionParticipant> findBySessionId(@Param("sessionId") Long sessionId);

    @Query("SELECT * FROM session_participants WHERE session_id = :sessionId AND left_at IS NULL")
    List<SessionParticipant> findConnectedBySessionId(@Param("sessionId") Long sessionId);

    @Modifying
    @Query("""
        UPDATE session_participants
        SET joined_at = :joinedAt, left_at = NULL, username = :username
        WHERE session_id = :sessionId AND user_id = :userId
    """)
    int rejoin(@Param("sessionId") Long sessionId, @Param("userId") String userId,
               @Param("username") String username, @Param("joinedAt") OffsetDateTime joinedAt);

    @Modifying
    @Query("UPDATE session_participants SET left_at = :leftAt WHERE session_id = :sessionId AND user_id = :userId")
    int markLeft(@Param("sessionId") Long sessionId, @Param("userId") String userId, @Param("leftAt") OffsetDateTime leftAt);
}
