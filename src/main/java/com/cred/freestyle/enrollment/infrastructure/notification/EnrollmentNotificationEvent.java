package com.cred.freestyle.enrollment.infrastructure.notification;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Application event carrying one notification for one subject.
 * Published inside the business transaction and delivered after commit.
 *
 * @author Enrollment Team
 */
public class EnrollmentNotificationEvent {

    private final NotificationKind kind;
    private final String subjectId;
    private final String recipient;
    private final String offeringId;
    private final Map<String, Object> payload;
    private final Instant occurredAt;

    public EnrollmentNotificationEvent(
            NotificationKind kind,
            String subjectId,
            String recipient,
            String offeringId,
            Map<String, Object> payload,
            Instant occurredAt
    ) {
        this.kind = kind;
        this.subjectId = subjectId;
        this.recipient = recipient;
        this.offeringId = offeringId;
        this.payload = Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        this.occurredAt = occurredAt;
    }

    public NotificationKind getKind() {
        return kind;
    }

    public String getSubjectId() {
        return subjectId;
    }

    /**
     * Contact address, or null when the subject never supplied one.
     */
    public String getRecipient() {
        return recipient;
    }

    public String getOfferingId() {
        return offeringId;
    }

    public Map<String, Object> getPayload() {
        return payload;
    }

    public Instant getOccurredAt() {
        return occurredAt;
    }

    @Override
    public String toString() {
        return "EnrollmentNotificationEvent{kind=" + kind + ", subjectId=" + subjectId
                + ", offeringId=" + offeringId + "}";
    }
}
