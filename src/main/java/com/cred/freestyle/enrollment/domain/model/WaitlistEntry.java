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

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Waitlist entry: a subject's place in the queue for a full offering.
 * Entries can be:
 * - WAITING: Queued, no offer yet
 * - OFFERED: A seat was offered and the response window is running
 * - ACCEPTED / DECLINED / EXPIRED: Terminal
 *
 * Live entries (WAITING or OFFERED) of one offering carry the dense positions 1..N.
 *
 * @author Enrollment Team
 */
@Entity
@Table(name = "waitlist_entries", indexes = {
    @Index(name = "idx_waitlist_offering_status_position", columnList = "offering_id, status, queue_position"),
    @Index(name = "idx_waitlist_status_deadline", columnList = "status, response_deadline")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WaitlistEntry {

    @Id
    @Column(name = "entry_id", nullable = false, length = 36)
    private String entryId;

    @Column(name = "offering_id", nullable = false, length = 36)
    private String offeringId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "offering_id", insertable = false, updatable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Offering offering;

    @Column(name = "subject_id", nullable = false, length = 64)
    private String subjectId;

    /**
     * Contact address, denormalized so offer notifications need no identity lookup.
     */
    @Column(name = "contact_email", length = 320)
    private String contactEmail;

    /**
     * 1-based queue position. Only meaningful while the entry is live.
     */
    @Column(name = "queue_position", nullable = false)
    private Integer position;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private WaitlistStatus status;

    @Column(name = "joined_at", nullable = false, updatable = false)
    private Instant joinedAt;

    @Column(name = "offered_at")
    private Instant offeredAt;

    /**
     * Set when the entry moves to OFFERED.
     */
    @Column(name = "response_deadline")
    private Instant responseDeadline;

    @Column(name = "responded_at")
    private Instant respondedAt;

    /**
     * Same scheme as {@link Registration#getLiveKey()}: unique while live, rewritten once terminal.
     */
    @Column(name = "live_key", nullable = false, unique = true, length = 255)
    private String liveKey;

    @Version
    @Column(name = "version")
    private Long version;

    @PrePersist
    protected void onCreate() {
        if (entryId == null) {
            entryId = UUID.randomUUID().toString();
        }
        if (joinedAt == null) {
            joinedAt = Instant.now();
        }
        if (status == null) {
            status = WaitlistStatus.WAITING;
        }
        if (liveKey == null) {
            liveKey = Registration.liveKeyFor(offeringId, subjectId);
        }
    }

    public boolean isLive() {
        return status == WaitlistStatus.WAITING || status == WaitlistStatus.OFFERED;
    }

    /**
     * @return true if the entry holds an offer whose response deadline is before now
     */
    public boolean isOfferExpired(Instant now) {
        return status == WaitlistStatus.OFFERED
                && responseDeadline != null
                && responseDeadline.isBefore(now);
    }

    public void offer(Instant now, Duration responseWindow) {
        if (status != WaitlistStatus.WAITING) {
            throw new IllegalStateException("Cannot offer entry " + entryId + " in status " + status);
        }
        this.status = WaitlistStatus.OFFERED;
        this.offeredAt = now;
        this.responseDeadline = now.plus(responseWindow);
    }

    public void accept(Instant now) {
        respond(WaitlistStatus.ACCEPTED, now);
    }

    public void decline(Instant now) {
        respond(WaitlistStatus.DECLINED, now);
    }

    private void respond(WaitlistStatus outcome, Instant now) {
        if (status != WaitlistStatus.OFFERED) {
            throw new IllegalStateException("Entry " + entryId + " has no active offer (status " + status + ")");
        }
        this.status = outcome;
        this.respondedAt = now;
        retireLiveKey();
    }

    /**
     * Expire a live entry: either a lapsed offer or an entry removed because its offering ended.
     */
    public void expire(Instant now) {
        if (!isLive()) {
            throw new IllegalStateException("Cannot expire entry " + entryId + " in status " + status);
        }
        this.status = WaitlistStatus.EXPIRED;
        this.respondedAt = now;
        retireLiveKey();
    }

    private void retireLiveKey() {
        this.liveKey = Registration.liveKeyFor(offeringId, subjectId) + ":" + status.name() + ":" + entryId;
    }

    /**
     * Waitlist entry status enum.
     */
    public enum WaitlistStatus {
        /**
         * Queued, waiting for a seat.
         */
        WAITING,

        /**
         * Seat offered, awaiting response until the deadline.
         */
        OFFERED,

        /**
         * Offer accepted, a registration was created.
         */
        ACCEPTED,

        /**
         * Offer lapsed, or the offering ended while the entry was live.
         */
        EXPIRED,

        /**
         * Offer declined by the subject.
         */
        DECLINED
    }
}
