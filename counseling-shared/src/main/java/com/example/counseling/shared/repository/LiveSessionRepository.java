package com.example.counseling.shared.repository;

import com.example.counseling.shared.model.LiveSession;
import org.springframework.data.jdbc.repository.query.Modifying;
import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.Optional;

@Repository
public interface LiveSessionRepository extends CrudRepository<LiveSession, Long> {

    // Derived Queries
    Optional<LiveSession> findByAppointmentId(Long appointmentId);
    Optional<LiveSession> findByRoomId(String roomId);

    // Status changes are compare-and-set: only the caller that observed the expected status wins.
    @Modifying
    @Query("UPDATE live_sessions SET status = :next, updated_at = CURRENT_TIMESTAMP WHERE id = :id AND status = :expected")
    int compareAndSetStatus(@Param("id") Long id, @Param("expected") String expected, @Param("next") String next);

    @Modifying
    @Query("""
        UPDATE live_sessions
        SET status = 'active', actual_start = :startedAt, updated_at = CURRENT_TIMESTAMP
        WHERE id = :id AND status = 'waiting'
    """)
    int activateIfWaiting(@Param("id") Long id, @Param("startedAt") OffsetDateTime startedAt);

    @Modifying
    @Query("""
        UPDATE live_sessions
        SET status = :next, actual_end = :endedAt, updated_at = CURRENT_TIMESTAMP
        WHERE id = :id AND status = 'active'
    """)
    int finishIfActive(@Param("id") Long id, @Param("next") String next, @Param("endedAt") OffsetDateTime endedAt);

    @Modifying
    @Query("UPDATE live_sessions SET notes = :notes, updated_at = CURRENT_TIMESTAMP WHERE id = :id")
    int updateNotes(@Param("id") Long id, @Param("notes") String notes);
}
