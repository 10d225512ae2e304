package com.cred.freestyle.enrollment.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.Instant;
import java.util.UUID;

/**
 * Registration entity: one subject's claim on a seat of an offering.
 * Registrations can be:
 * - PENDING_PAYMENT: Created for a paid offering, no seat held yet
 * - CONFIRMED: Holds a seat
 * - CANCELLED: Terminal, cancelled by the subject, a sweep or an administrator
 * - COMPLETED: Terminal, the offering took place
 *
 * At most one live (PENDING_PAYMENT or CONFIRMED) registration exists per
 * (offering, subject). This is enforced by the unique live_key column, which
 * is rewritten whenever the registration leaves the live set.
 *
 * @author Enrollment Team
 */
@Entity
@Table(name = "registrations", indexes = {
    @Index(name = "idx_registration_offering_status", columnList = "offering_id, status"),
    @Index(name = "idx_registration_subject", columnList = "subject_id, offering_id"),
    @Index(name = "idx_registration_status_registered", columnList = "status, registered_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Registration {

    @Id
    @Column(name = "registration_id", nullable = false, length = 36)
    private String registrationId;

    @Column(name = "offering_id", nullable = false, length = 36)
    private String offeringId;

    /**
     * Read-only association used for the cascading foreign key. Writes go through offeringId.
     */
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "offering_id", insertable = false, updatable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Offering offering;

    @Column(name = "subject_id", nullable = false, length = 64)
    private String subjectId;

    /**
     * Contact address captured at registration time, used by sweeps and notifications.
     */
    @Column(name = "contact_email", length = 320)
    private String contactEmail;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private RegistrationStatus status;

    /**
     * Payment shadow status. Null for free offerings.
     */
    @Enumerated(EnumType.STRING)
    @Column(name = "payment_status", length = 20)
    private PaymentStatus paymentStatus;

    @Column(name = "checkout_session_id", length = 255)
    private String checkoutSessionId;

    @Column(name = "checkout_url", length = 1024)
    private String checkoutUrl;

    @Column(name = "payment_reference", length = 255)
    private String paymentReference;

    /**
     * Uniqueness key for live registrations.
     * Format while live: {offering_id}:{subject_id}
     * Format once terminal: {offering_id}:{subject_id}:{STATUS}:{registration_id}
     */
    @Column(name = "live_key", nullable = false, unique = true, length = 255)
    private String liveKey;

    @Column(name = "registered_at", nullable = false, updatable = false)
    private Instant registeredAt;

    @Column(name = "confirmed_at")
    private Instant confirmedAt;

    @Column(name = "cancelled_at")
    private Instant cancelledAt;

    @Column(name = "cancel_reason", length = 500)
    private String cancelReason;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Version
    @Column(name = "version")
    private Long version;

    @PrePersist
    protected void onCreate() {
        if (registrationId == null) {
            registrationId = UUID.randomUUID().toString();
        }
        if (registeredAt == null) {
            registeredAt = Instant.now();
        }
        if (liveKey == null) {
            liveKey = liveKeyFor(offeringId, subjectId);
        }
    }

    /**
     * Build the live uniqueness key for an (offering, subject) pair.
     */
    public static String liveKeyFor(String offeringId, String subjectId) {
        return offeringId + ":" + subjectId;
    }

    /**
     * @return true if the registration is PENDING_PAYMENT or CONFIRMED
     */
    public boolean isLive() {
        return status == RegistrationStatus.PENDING_PAYMENT || status == RegistrationStatus.CONFIRMED;
    }

    public boolean holdsSeat() {
        return status == RegistrationStatus.CONFIRMED;
    }

    /**
     * Move to CONFIRMED. Valid from PENDING_PAYMENT, or for a brand-new registration.
     */
    public void confirm(Instant now) {
        if (status != null && status != RegistrationStatus.PENDING_PAYMENT) {
            throw new IllegalStateException("Cannot confirm registration " + registrationId + " in status " + status);
        }
        this.status = RegistrationStatus.CONFIRMED;
        this.confirmedAt = now;
    }

    /**
     * Move to CANCELLED and release the live key so the subject may register again.
     */
    public void cancel(Instant now, String reason) {
        if (!isLive()) {
            throw new IllegalStateException("Cannot cancel registration " + registrationId + " in status " + status);
        }
        this.status = RegistrationStatus.CANCELLED;
        this.cancelledAt = now;
        this.cancelReason = reason;
        retireLiveKey();
    }

    /**
     * Move a CONFIRMED registration to COMPLETED once the offering has taken place.
     */
    public void complete(Instant now) {
        if (status != RegistrationStatus.CONFIRMED) {
            throw new IllegalStateException("Cannot complete registration " + registrationId + " in status " + status);
        }
        this.status = RegistrationStatus.COMPLETED;
        this.completedAt = now;
        retireLiveKey();
    }

    private void retireLiveKey() {
        this.liveKey = liveKeyFor(offeringId, subjectId) + ":" + status.name() + ":" + registrationId;
    }

    /**
     * Registration status enum.
     */
    public enum RegistrationStatus {
        /**
         * Awaiting payment for a paid offering. Does not hold a seat.
         */
        PENDING_PAYMENT,

        /**
         * Holds a seat.
         */
        CONFIRMED,

        /**
         * Cancelled. Terminal.
         */
        CANCELLED,

        /**
         * Offering took place. Terminal.
         */
        COMPLETED
    }

    /**
     * Payment shadow status for paid offerings.
     */
    public enum PaymentStatus {
        PENDING,
        COMPLETED,
        FAILED
    }
}
