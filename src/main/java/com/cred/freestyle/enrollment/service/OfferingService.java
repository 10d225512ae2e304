package com.cred.freestyle.enrollment.service;

import com.cred.freestyle.enrollment.domain.model.Offering;
import com.cred.freestyle.enrollment.domain.model.Offering.OfferingStatus;
import com.cred.freestyle.enrollment.domain.model.Registration;
import com.cred.freestyle.enrollment.domain.model.Registration.RegistrationStatus;
import com.cred.freestyle.enrollment.domain.model.WaitlistEntry;
import com.cred.freestyle.enrollment.exception.EnrollmentException;
import com.cred.freestyle.enrollment.exception.ErrorCode;
import com.cred.freestyle.enrollment.infrastructure.notification.EnrollmentNotifier;
import com.cred.freestyle.enrollment.repository.OfferingRepository;
import com.cred.freestyle.enrollment.repository.RegistrationRepository;
import com.cred.freestyle.enrollment.repository.WaitlistEntryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;

/**
 * Offering-level operations: availability, administrative cancellation and
 * closing offerings whose scheduled end has passed.
 *
 * @author Enrollment Team
 */
@Service
public class OfferingService {

    private static final Logger logger = LoggerFactory.getLogger(OfferingService.class);

    static final String OFFERING_CLOSED_REASON = "Offering closed";

    private final OfferingRepository offeringRepository;
    private final RegistrationRepository registrationRepository;
    private final WaitlistEntryRepository waitlistEntryRepository;
    private final RegistrationLedgerService registrationLedgerService;
    private final WaitlistQueueService waitlistQueueService;
    private final EnrollmentNotifier notifier;
    private final Clock clock;

    public OfferingService(
            OfferingRepository offeringRepository,
            RegistrationRepository registrationRepository,
            WaitlistEntryRepository waitlistEntryRepository,
            RegistrationLedgerService registrationLedgerService,
            WaitlistQueueService waitlistQueueService,
            EnrollmentNotifier notifier,
            Clock clock
    ) {
        this.offeringRepository = offeringRepository;
        this.registrationRepository = registrationRepository;
        this.waitlistEntryRepository = waitlistEntryRepository;
        this.registrationLedgerService = registrationLedgerService;
        this.waitlistQueueService = waitlistQueueService;
        this.notifier = notifier;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public OfferingAvailability getAvailability(String offeringId) {
        Offering offering = offeringRepository.findById(offeringId)
                .orElseThrow(() -> new EnrollmentException(ErrorCode.OFFERING_NOT_FOUND)
                        .withDetail("offeringId", offeringId));
        return new OfferingAvailability(
                offering,
                waitlistQueueService.outstandingOffers(offeringId),
                waitlistQueueService.liveEntries(offeringId).size(),
                clock.instant()
        );
    }

    /**
     * Cancel an offering: every live registration is cancelled with the given
     * reason, every live waitlist entry is expired, and all affected subjects
     * are notified.
     *
     * @param offeringId Offering ID
     * @param reason Reason recorded on each cancelled registration
     * @return Cancelled offering
     * @throws EnrollmentException OFFERING_NOT_OPEN if already cancelled or closed
     */
    @Transactional
    public Offering cancelOffering(String offeringId, String reason) {
        Instant now = clock.instant();
        Offering offering = lockOffering(offeringId);

        if (offering.getStatus() == OfferingStatus.CANCELLED || offering.getStatus() == OfferingStatus.CLOSED) {
            throw new EnrollmentException(ErrorCode.OFFERING_NOT_OPEN)
                    .withDetail("offeringId", offeringId)
                    .withDetail("status", offering.getStatus().name());
        }

        List<Registration> live = registrationRepository.findByOfferingIdAndStatusIn(
                offeringId, EnumSet.of(RegistrationStatus.PENDING_PAYMENT, RegistrationStatus.CONFIRMED));
        for (Registration registration : live) {
            registrationLedgerService.cancel(offering, registration, reason, now);
            notifier.offeringCancelled(registration, offering);
        }

        List<WaitlistEntry> entries = waitlistQueueService.liveEntries(offeringId);
        for (WaitlistEntry entry : entries) {
            entry.expire(now);
            notifier.offeringCancelled(entry, offering);
        }
        waitlistEntryRepository.saveAll(entries);

        offering.cancel(now);
        offeringRepository.save(offering);

        logger.info("Cancelled offering {}: {} registrations cancelled, {} waitlist entries expired",
                offeringId, live.size(), entries.size());
        return offering;
    }

    /**
     * Close an OPEN offering whose end has passed: confirmed registrations
     * become COMPLETED, pending ones are cancelled, live waitlist entries expire.
     * Idempotent: returns false if the offering is not due.
     *
     * @param offeringId Offering ID
     * @param now Sweep time
     * @return true if the offering was closed
     */
    @Transactional
    public boolean closeOffering(String offeringId, Instant now) {
        Offering offering = lockOffering(offeringId);
        if (!offering.isOpen() || !offering.getClosesAt().isBefore(now)) {
            return false;
        }

        int completed = 0;
        int cancelled = 0;
        List<Registration> live = registrationRepository.findByOfferingIdAndStatusIn(
                offeringId, EnumSet.of(RegistrationStatus.PENDING_PAYMENT, RegistrationStatus.CONFIRMED));
        for (Registration registration : live) {
            if (registration.holdsSeat()) {
                registrationLedgerService.complete(offering, registration, now);
                completed++;
            } else {
                registrationLedgerService.cancel(offering, registration, OFFERING_CLOSED_REASON, now);
                cancelled++;
            }
        }

        List<WaitlistEntry> entries = waitlistQueueService.liveEntries(offeringId);
        for (WaitlistEntry entry : entries) {
            entry.expire(now);
        }
        waitlistEntryRepository.saveAll(entries);

        offering.close(now);
        offeringRepository.save(offering);

        logger.info("Closed offering {}: {} completed, {} pending cancelled, {} waitlist entries expired",
                offeringId, completed, cancelled, entries.size());
        return true;
    }

    @Transactional(readOnly = true)
    public List<String> findOfferingIdsDueForClosing(Instant now) {
        return offeringRepository.findIdsEndedBefore(OfferingStatus.OPEN, now);
    }

    private Offering lockOffering(String offeringId) {
        return offeringRepository.findByIdForUpdate(offeringId)
                .orElseThrow(() -> new EnrollmentException(ErrorCode.OFFERING_NOT_FOUND)
                        .withDetail("offeringId", offeringId));
    }
}
