package com.example.counseling.shared.repository;

import com.example.counseling.shared.model.Notification;
import org.springframework.data.jdbc.repository.query.Modifying;
import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface NotificationRepository extends CrudRepository<Notification, Long> {

    Optional<Notification> findByIdAndUserId(Long id, String userId);

    @Query("SELECT COUNT(*) FROM notifications WHERE user_id = :userId AND is_read = FALSE AND is_dismissed = FALSE")
    long countUnread(@Param("userId") String userId);

    @Query("""
        SELECT * FROM notifications
        WHERE user_id = :userId AND is_dismissed = FALSE
        ORDER BY created_at DESC, id DESC
        LIMIT :limit
    """)
    List<Notification> findRecent(@Param("userId") String userId, @Param("limit") int limit);

    @Modifying
    @Query("UPDATE notifications SET is_read = TRUE WHERE id = :id AND user_id = :userId AND is_read = FALSE")
    int markAsRead(@Param("id") Long id, @Param("userId") String userId);

    @Modifying
    @Query("UPDATE notifications SET is_read = TRUE WHERE user_id = :userId AND is_read = FALSE")
    int markAllAsRead(@Param("userId") String userId);

    @Modifying
    @Query("UPDATE notifications SET is_dismissed = TRUE WHERE id = :id AND user_id = :userId AND is_dismissed = FALSE")
    int dismiss(@Param("id") Long id, @Param("userId") String userId);

    @Modifying
    @Query("UPDATE notifications SET is_dismissed = TRUE WHERE user_id = :userId AND is_dismissed = FALSE")
    int dismissAll(@Param("userId") String userId);

    @Modifying
    @Query("DELETE FROM notifications WHERE expires_at IS NOT NULL AND expires_at < :now")
    int deleteExpired(@Param("now") OffsetDateTime now);
}
