package com.cred.freestyle.enrollment.infrastructure.notification;

import com.cred.freestyle.enrollment.infrastructure.cache.ReminderCacheService;
import com.cred.freestyle.enrollment.infrastructure.metrics.EnrollmentMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Delivers notification events once the originating transaction has committed.
 *
 * Runs on the async executor. Delivery failures are logged and counted but
 * never reach the caller: the state transition has already been committed.
 * Events published outside a transaction (reminder sweep) are delivered immediately.
 *
 * A reminder that fails to reach the broker has its sent-marker released, so
 * the next reminder sweep picks the registration up again.
 *
 * @author Enrollment Team
 */
@Component
public class EnrollmentNotificationListener {

    private static final Logger logger = LoggerFactory.getLogger(EnrollmentNotificationListener.class);

    private final KafkaNotificationPublisher notificationPublisher;
    private final ReminderCacheService reminderCacheService;
    private final EnrollmentMetricsService metricsService;

    public EnrollmentNotificationListener(
            KafkaNotificationPublisher notificationPublisher,
            ReminderCacheService reminderCacheService,
            EnrollmentMetricsService metricsService
    ) {
        this.notificationPublisher = notificationPublisher;
        this.reminderCacheService = reminderCacheService;
        this.metricsService = metricsService;
    }

    @Async
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onNotification(EnrollmentNotificationEvent event) {
        try {
            notificationPublisher.publish(event).whenComplete((result, ex) -> {
                if (ex != null) {
                    onDeliveryFailure(event, ex);
                }
            });
        } catch (Exception e) {
            onDeliveryFailure(event, e);
        }
    }

    private void onDeliveryFailure(EnrollmentNotificationEvent event, Throwable cause) {
        logger.error("Failed to deliver {} notification to subject {} for offering {}",
                event.getKind(), event.getSubjectId(), event.getOfferingId(), cause);
        metricsService.recordError("NOTIFICATION_DELIVERY_ERROR", event.getKind().name());

        if (event.getKind() == NotificationKind.EVENT_REMINDER) {
            Object registrationId = event.getPayload().get("registrationId");
            if (registrationId != null) {
                reminderCacheService.clearReminderSent(registrationId.toString());
            }
        }
    }
}
