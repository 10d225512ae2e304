package com.cred.freestyle.enrollment.infrastructure.notification;

import com.cred.freestyle.enrollment.infrastructure.cache.ReminderCacheService;
import com.cred.freestyle.enrollment.infrastructure.metrics.EnrollmentMetricsService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.support.SendResult;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for EnrollmentNotificationListener.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("EnrollmentNotificationListener Unit Tests")
class EnrollmentNotificationListenerTest {

    @Mock
    private KafkaNotificationPublisher notificationPublisher;

    @Mock
    private ReminderCacheService reminderCacheService;

    @Mock
    private EnrollmentMetricsService metricsService;

    @InjectMocks
    private EnrollmentNotificationListener listener;

    private final EnrollmentNotificationEvent event = new EnrollmentNotificationEvent(
            NotificationKind.REGISTRATION_CONFIRMED, "member-1", "member-1@example.org", "OFF-001",
            Map.of("registrationId", "REG-1"), Instant.parse("2026-03-02T10:00:00Z"));

    private final EnrollmentNotificationEvent reminder = new EnrollmentNotificationEvent(
            NotificationKind.EVENT_REMINDER, "member-1", "member-1@example.org", "OFF-001",
            Map.of("registrationId", "REG-1"), Instant.parse("2026-03-02T10:00:00Z"));

    private static CompletableFuture<SendResult<String, String>> failedSend() {
        CompletableFuture<SendResult<String, String>> failed = new CompletableFuture<>();
        failed.completeExceptionally(new RuntimeException("broker down"));
        return failed;
    }

    // ========================================
    // Delivery
    // ========================================

    @Test
    @DisplayName("onNotification - Should hand the event to the publisher")
    void onNotification_Publishes() {
        // Given
        when(notificationPublisher.publish(event))
                .thenReturn(CompletableFuture.completedFuture(null));

        // When
        listener.onNotification(event);

        // Then
        verify(notificationPublisher).publish(event);
        verifyNoInteractions(metricsService, reminderCacheService);
    }

    @Test
    @DisplayName("onNotification - Publisher fails: Should count the error and not rethrow")
    void onNotification_PublisherFails_Swallowed() {
        // Given
        doThrow(new IllegalStateException("producer closed")).when(notificationPublisher).publish(event);

        // When / Then
        assertThatCode(() -> listener.onNotification(event)).doesNotThrowAnyException();
        verify(metricsService).recordError("NOTIFICATION_DELIVERY_ERROR", "REGISTRATION_CONFIRMED");
        verifyNoInteractions(reminderCacheService);
    }

    // ========================================
    // Reminder retry
    // ========================================

    @Test
    @DisplayName("onNotification - Reminder send rejected by the broker: Should release the reminder claim")
    void onNotification_ReminderSendFails_ReleasesClaim() {
        // Given
        when(notificationPublisher.publish(reminder)).thenReturn(failedSend());

        // When
        listener.onNotification(reminder);

        // Then
        verify(reminderCacheService).clearReminderSent("REG-1");
        verify(metricsService).recordError("NOTIFICATION_DELIVERY_ERROR", "EVENT_REMINDER");
    }

    @Test
    @DisplayName("onNotification - Reminder publish throws: Should release the reminder claim")
    void onNotification_ReminderPublishThrows_ReleasesClaim() {
        // Given
        doThrow(new IllegalStateException("producer closed")).when(notificationPublisher).publish(reminder);

        // When
        listener.onNotification(reminder);

        // Then
        verify(reminderCacheService).clearReminderSent("REG-1");
    }

    @Test
    @DisplayName("onNotification - Other notification send fails: Should leave reminder claims alone")
    void onNotification_NonReminderSendFails_KeepsClaims() {
        // Given
        when(notificationPublisher.publish(event)).thenReturn(failedSend());

        // When
        listener.onNotification(event);

        // Then
        verify(metricsService).recordError("NOTIFICATION_DELIVERY_ERROR", "REGISTRATION_CONFIRMED");
        verifyNoInteractions(reminderCacheService);
    }

    @Test
    @DisplayName("onNotification - Reminder delivered: Should keep the reminder claim")
    void onNotification_ReminderDelivered_KeepsClaim() {
        // Given
        when(notificationPublisher.publish(reminder))
                .thenReturn(CompletableFuture.completedFuture(null));

        // When
        listener.onNotification(reminder);

        // Then
        verify(reminderCacheService, never()).clearReminderSent(anyString());
    }
}
