package com.example.counseling.session.scheduler;

import com.example.counseling.session.service.NotificationService;
import com.example.counseling.shared.aspect.Monitored;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * Deletes notifications whose expiry has passed.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class NotificationExpirationService {

    private final NotificationService notificationService;

    @Monitored("scheduler")
    @Scheduled(fixedRateString = "${counseling.notification.expiry-sweep-interval-ms:3600000}")
    @SchedulerLock(name = "purgeExpiredNotifications", lockAtLeastFor = "PT10S", lockAtMostFor = "PT5M")
    public void purgeExpiredNotifications() {
        int deleted = notificationService.deleteExpired(OffsetDateTime.now(ZoneOffset.UTC));
        if (deleted > 0) {
            log.info("Purged {} expired notifications", deleted);
        } else {
            log.debug("No expired notifications to purge");
        }
    }
}
