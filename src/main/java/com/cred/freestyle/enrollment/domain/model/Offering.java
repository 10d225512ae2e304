package com.cred.freestyle.enrollment.domain.model;

import com.cred.freestyle.enrollment.exception.SeatInvariantViolationException;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Offering entity: a scheduled, capacity-bounded item subjects can register for.
 *
 * The row doubles as the serialization point for every mutation of its
 * registrations and waitlist: callers take a PESSIMISTIC_WRITE lock on it
 * before reading or changing either.
 *
 * confirmedSeats is maintained only through {@link #occupySeat()} and
 * {@link #releaseSeat()} and always stays within [0, capacity].
 *
 * @author Enrollment Team
 */
@Entity
@Table(name = "offerings", indexes = {
    @Index(name = "idx_offering_status_starts", columnList = "status, starts_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Offering {

    @Id
    @Column(name = "offering_id", nullable = false, length = 36)
    private String offeringId;

    @Column(name = "title", nullable = false, length = 255)
    private String title;

    @Column(name = "starts_at", nullable = false)
    private Instant startsAt;

    /**
     * Scheduled end. Null for offerings without a fixed end, in which case
     * the start time is used when closing past offerings.
     */
    @Column(name = "ends_at")
    private Instant endsAt;

    @Column(name = "capacity", nullable = false)
    private Integer capacity;

    /**
     * Number of CONFIRMED registrations. Never recomputed on the hot path.
     */
    @Column(name = "confirmed_seats", nullable = false)
    @Builder.Default
    private Integer confirmedSeats = 0;

    @Column(name = "is_free", nullable = false)
    @Builder.Default
    private Boolean free = Boolean.TRUE;

    @Column(name = "price", precision = 10, scale = 2)
    private BigDecimal price;

    @Column(name = "currency", length = 3)
    @Builder.Default
    private String currency = "USD";

    /**
     * Optional registration cut-off. Null means registration stays open until the offering closes.
     */
    @Column(name = "registration_deadline")
    private Instant registrationDeadline;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private OfferingStatus status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "cancelled_at")
    private Instant cancelledAt;

    @Column(name = "closed_at")
    private Instant closedAt;

    @Version
    @Column(name = "version")
    private Long version;

    @PrePersist
    protected void onCreate() {
        if (offeringId == null) {
            offeringId = UUID.randomUUID().toString();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (status == null) {
            status = OfferingStatus.DRAFT;
        }
        if (confirmedSeats == null) {
            confirmedSeats = 0;
        }
    }

    public boolean isOpen() {
        return status == OfferingStatus.OPEN;
    }

    public boolean isPaid() {
        return !Boolean.TRUE.equals(free);
    }

    /**
     * Check whether the registration deadline has passed.
     *
     * @param now Current time
     * @return true if a deadline is set and now is after it
     */
    public boolean isDeadlinePassed(Instant now) {
        return registrationDeadline != null && now.isAfter(registrationDeadline);
    }

    /**
     * @return capacity minus confirmed seats, never negative
     */
    public int getAvailableSeats() {
        return Math.max(0, capacity - confirmedSeats);
    }

    public boolean hasAvailableSeat() {
        return confirmedSeats < capacity;
    }

    /**
     * Time after which the offering is considered past and eligible for closing.
     */
    public Instant getClosesAt() {
        return endsAt != null ? endsAt : startsAt;
    }

    /**
     * Take one seat for a registration entering CONFIRMED.
     *
     * @throws SeatInvariantViolationException if the offering is already full
     */
    public void occupySeat() {
        if (confirmedSeats >= capacity) {
            throw new SeatInvariantViolationException(offeringId,
                    "Cannot occupy seat: " + confirmedSeats + " of " + capacity + " already confirmed");
        }
        confirmedSeats = confirmedSeats + 1;
    }

    /**
     * Give back one seat for a registration leaving CONFIRMED.
     *
     * @throws SeatInvariantViolationException if no seat is currently held
     */
    public void releaseSeat() {
        if (confirmedSeats <= 0) {
            throw new SeatInvariantViolationException(offeringId,
                    "Cannot release seat: confirmed seat count is already zero");
        }
        confirmedSeats = confirmedSeats - 1;
    }

    public void cancel(Instant now) {
        this.status = OfferingStatus.CANCELLED;
        this.cancelledAt = now;
    }

    public void close(Instant now) {
        this.status = OfferingStatus.CLOSED;
        this.closedAt = now;
    }

    /**
     * Offering lifecycle status.
     */
    public enum OfferingStatus {
        /**
         * Being prepared, not yet accepting registrations.
         */
        DRAFT,

        /**
         * Accepting registrations and waitlist entries.
         */
        OPEN,

        /**
         * Cancelled by an administrator.
         */
        CANCELLED,

        /**
         * Scheduled end has passed.
         */
        CLOSED
    }
}
