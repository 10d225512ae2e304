package com.cred.freestyle.enrollment.infrastructure.notification;

/**
 * Kinds of subject-facing notifications emitted by enrollment operations.
 *
 * @author Enrollment Team
 */
public enum NotificationKind {
    REGISTRATION_CONFIRMED,
    REGISTRATION_CANCELLED,
    PAYMENT_FAILED,

    /**
     * Payment succeeded after the last seat was taken. The registration was
     * cancelled and the payment must be refunded.
     */
    REFUND_REQUIRED,

    WAITLIST_JOINED,
    WAITLIST_SPOT_AVAILABLE,
    WAITLIST_OFFER_EXPIRED,
    OFFERING_CANCELLED,
    EVENT_REMINDER
}
