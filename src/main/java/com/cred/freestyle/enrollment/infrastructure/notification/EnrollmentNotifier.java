package com.cred.freestyle.enrollment.infrastructure.notification;

import com.cred.freestyle.enrollment.domain.model.Offering;
import com.cred.freestyle.enrollment.domain.model.Registration;
import com.cred.freestyle.enrollment.domain.model.WaitlistEntry;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds notification events for registration and waitlist transitions and
 * hands them to the application event publisher.
 *
 * Delivery happens in {@link EnrollmentNotificationListener} after the
 * surrounding transaction commits, so a rolled-back transition never notifies.
 *
 * @author Enrollment Team
 */
@Component
public class EnrollmentNotifier {

    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public EnrollmentNotifier(ApplicationEventPublisher eventPublisher, Clock clock) {
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    public void registrationConfirmed(Registration registration, Offering offering) {
        Map<String, Object> payload = basePayload(offering);
        payload.put("registrationId", registration.getRegistrationId());
        publish(NotificationKind.REGISTRATION_CONFIRMED, registration, offering, payload);
    }

    public void registrationCancelled(Registration registration, Offering offering) {
        Map<String, Object> payload = basePayload(offering);
        payload.put("registrationId", registration.getRegistrationId());
        payload.put("reason", registration.getCancelReason());
        publish(NotificationKind.REGISTRATION_CANCELLED, registration, offering, payload);
    }

    public void paymentFailed(Registration registration, Offering offering) {
        Map<String, Object> payload = basePayload(offering);
        payload.put("registrationId", registration.getRegistrationId());
        publish(NotificationKind.PAYMENT_FAILED, registration, offering, payload);
    }

    public void refundRequired(Registration registration, Offering offering) {
        Map<String, Object> payload = basePayload(offering);
        payload.put("registrationId", registration.getRegistrationId());
        payload.put("paymentReference", registration.getPaymentReference());
        publish(NotificationKind.REFUND_REQUIRED, registration, offering, payload);
    }

    public void eventReminder(Registration registration, Offering offering) {
        Map<String, Object> payload = basePayload(offering);
        payload.put("registrationId", registration.getRegistrationId());
        publish(NotificationKind.EVENT_REMINDER, registration, offering, payload);
    }

    public void offeringCancelled(Registration registration, Offering offering) {
        Map<String, Object> payload = basePayload(offering);
        payload.put("registrationId", registration.getRegistrationId());
        publish(NotificationKind.OFFERING_CANCELLED, registration, offering, payload);
    }

    public void offeringCancelled(WaitlistEntry entry, Offering offering) {
        Map<String, Object> payload = basePayload(offering);
        payload.put("waitlistEntryId", entry.getEntryId());
        publish(NotificationKind.OFFERING_CANCELLED, entry, offering, payload);
    }

    public void waitlistJoined(WaitlistEntry entry, Offering offering) {
        Map<String, Object> payload = basePayload(offering);
        payload.put("waitlistEntryId", entry.getEntryId());
        payload.put("position", entry.getPosition());
        publish(NotificationKind.WAITLIST_JOINED, entry, offering, payload);
    }

    public void waitlistSpotAvailable(WaitlistEntry entry, Offering offering) {
        Map<String, Object> payload = basePayload(offering);
        payload.put("waitlistEntryId", entry.getEntryId());
        payload.put("responseDeadline", String.valueOf(entry.getResponseDeadline()));
        publish(NotificationKind.WAITLIST_SPOT_AVAILABLE, entry, offering, payload);
    }

    public void waitlistOfferExpired(WaitlistEntry entry, Offering offering) {
        Map<String, Object> payload = basePayload(offering);
        payload.put("waitlistEntryId", entry.getEntryId());
        publish(NotificationKind.WAITLIST_OFFER_EXPIRED, entry, offering, payload);
    }

    private Map<String, Object> basePayload(Offering offering) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("offeringTitle", offering.getTitle());
        payload.put("startsAt", String.valueOf(offering.getStartsAt()));
        return payload;
    }

    private void publish(NotificationKind kind, Registration registration, Offering offering, Map<String, Object> payload) {
        eventPublisher.publishEvent(new EnrollmentNotificationEvent(
                kind,
                registration.getSubjectId(),
                registration.getContactEmail(),
                offering.getOfferingId(),
                payload,
                clock.instant()
        ));
    }

    private void publish(NotificationKind kind, WaitlistEntry entry, Offering offering, Map<String, Object> payload) {
        eventPublisher.publishEvent(new EnrollmentNotificationEvent(
                kind,
                entry.getSubjectId(),
                entry.getContactEmail(),
                offering.getOfferingId(),
                payload,
                clock.instant()
        ));
    }
}
