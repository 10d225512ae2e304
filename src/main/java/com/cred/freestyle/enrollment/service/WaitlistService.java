package com.cred.freestyle.enrollment.service;

import com.cred.freestyle.enrollment.domain.model.Offering;
import com.cred.freestyle.enrollment.domain.model.Registration;
import com.cred.freestyle.enrollment.domain.model.WaitlistEntry;
import com.cred.freestyle.enrollment.domain.model.WaitlistEntry.WaitlistStatus;
import com.cred.freestyle.enrollment.exception.EnrollmentException;
import com.cred.freestyle.enrollment.exception.ErrorCode;
import com.cred.freestyle.enrollment.infrastructure.metrics.EnrollmentMetricsService;
import com.cred.freestyle.enrollment.infrastructure.notification.EnrollmentNotifier;
import com.cred.freestyle.enrollment.repository.OfferingRepository;
import com.cred.freestyle.enrollment.repository.RegistrationRepository;
import com.cred.freestyle.enrollment.repository.WaitlistEntryRepository;
import com.cred.freestyle.enrollment.security.SubjectContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Waitlist operations: promotion, offer responses and offer expiry.
 *
 * Every mutating operation takes the offering row lock first and then
 * re-reads the entry, so concurrent accept/decline/expire calls on the same
 * entry see each other's committed result.
 *
 * Offers are made only while the offering is OPEN and the number of
 * outstanding offers is below the number of free seats, so one freed seat is
 * never offered to two subjects at once.
 *
 * @author Enrollment Team
 */
@Service
public class WaitlistService {

    private static final Logger logger = LoggerFactory.getLogger(WaitlistService.class);

    private final OfferingRepository offeringRepository;
    private final WaitlistEntryRepository waitlistEntryRepository;
    private final RegistrationRepository registrationRepository;
    private final WaitlistQueueService waitlistQueueService;
    private final RegistrationLedgerService registrationLedgerService;
    private final CheckoutService checkoutService;
    private final EnrollmentNotifier notifier;
    private final EnrollmentMetricsService metricsService;
    private final Clock clock;
    private final TransactionTemplate transactionTemplate;
    private final Duration offerWindow;

    public WaitlistService(
            OfferingRepository offeringRepository,
            WaitlistEntryRepository waitlistEntryRepository,
            RegistrationRepository registrationRepository,
            WaitlistQueueService waitlistQueueService,
            RegistrationLedgerService registrationLedgerService,
            CheckoutService checkoutService,
            EnrollmentNotifier notifier,
            EnrollmentMetricsService metricsService,
            Clock clock,
            PlatformTransactionManager transactionManager,
            @Value("${enrollment.waitlist.offer-window:PT48H}") String offerWindow
    ) {
        this.offeringRepository = offeringRepository;
        this.waitlistEntryRepository = waitlistEntryRepository;
        this.registrationRepository = registrationRepository;
        this.waitlistQueueService = waitlistQueueService;
        this.registrationLedgerService = registrationLedgerService;
        this.checkoutService = checkoutService;
        this.notifier = notifier;
        this.metricsService = metricsService;
        this.clock = clock;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.offerWindow = Duration.parse(offerWindow);
    }

    // ========================================
    // Promotion
    // ========================================

    /**
     * Offer a freed seat to the first WAITING entry of an offering.
     * Also used by administrators to restart a stalled queue.
     *
     * @param offeringId Offering ID
     * @return The entry that received the offer, if any
     */
    @Transactional
    public Optional<WaitlistEntry> promoteNext(String offeringId) {
        Offering offering = lockOffering(offeringId);
        return promoteNextLocked(offering, clock.instant());
    }

    /**
     * Promotion for callers already holding the offering lock inside their transaction.
     *
     * @param offering Locked offering
     * @param now Current time
     * @return The entry that received the offer, if any
     */
    public Optional<WaitlistEntry> promoteNextLocked(Offering offering, Instant now) {
        String offeringId = offering.getOfferingId();
        if (!offering.isOpen()) {
            logger.debug("Offering {} is {}; no promotion", offeringId, offering.getStatus());
            return Optional.empty();
        }

        long outstanding = waitlistQueueService.outstandingOffers(offeringId);
        if (offering.getAvailableSeats() - outstanding <= 0) {
            logger.debug("No unoffered seat on offering {} (available={}, outstanding offers={})",
                    offeringId, offering.getAvailableSeats(), outstanding);
            return Optional.empty();
        }

        Optional<WaitlistEntry> next = waitlistEntryRepository
                .findFirstByOfferingIdAndStatusOrderByPositionAsc(offeringId, WaitlistStatus.WAITING);
        if (next.isEmpty()) {
            logger.debug("Waitlist of offering {} has no waiting entries", offeringId);
            return Optional.empty();
        }

        WaitlistEntry entry = next.get();
        entry.offer(now, offerWindow);
        entry = waitlistEntryRepository.save(entry);

        notifier.waitlistSpotAvailable(entry, offering);
        metricsService.recordWaitlistTransition("OFFERED");

        logger.info("Offered seat on offering {} to subject {} (entry {}), respond by {}",
                offeringId, entry.getSubjectId(), entry.getEntryId(), entry.getResponseDeadline());
        return Optional.of(entry);
    }

    // ========================================
    // Offer responses
    // ========================================

    /**
     * Accept an outstanding offer, turning the entry into a registration.
     *
     * An offer found past its deadline is expired (and the next subject
     * promoted) in a committed transaction before OFFER_EXPIRED is raised.
     *
     * @param subject Accepting subject, must own the entry
     * @param entryId Waitlist entry ID
     * @return CONFIRMED for free offerings, CHECKOUT_REQUIRED with a session for paid ones
     */
    public RegistrationResult acceptOffer(SubjectContext subject, String entryId) {
        Instant now = clock.instant();

        Optional<RegistrationResult> accepted = transactionTemplate.execute(status -> acceptLocked(subject, entryId, now));

        if (accepted == null || accepted.isEmpty()) {
            throw new EnrollmentException(ErrorCode.OFFER_EXPIRED).withDetail("waitlistEntryId", entryId);
        }

        RegistrationResult result = accepted.get();
        if (result.requiresCheckout()) {
            result = checkoutService.startCheckout(result.getOffering(), result.getRegistration());
        }
        return result;
    }

    private Optional<RegistrationResult> acceptLocked(SubjectContext subject, String entryId, Instant now) {
        Offering offering = lockOfferingOfEntry(entryId);
        WaitlistEntry entry = loadOwnedOffer(subject, entryId);

        if (entry.isOfferExpired(now)) {
            logger.info("Offer on entry {} expired at {}; expiring on accept", entryId, entry.getResponseDeadline());
            expireLocked(offering, entry, now);
            return Optional.empty();
        }

        if (!offering.hasAvailableSeat()) {
            logger.warn("Offer on entry {} accepted but offering {} has no free seat",
                    entryId, offering.getOfferingId());
            throw new EnrollmentException(ErrorCode.NO_CAPACITY).withDetail("offeringId", offering.getOfferingId());
        }

        if (registrationRepository.findByLiveKey(
                Registration.liveKeyFor(offering.getOfferingId(), entry.getSubjectId())).isPresent()) {
            throw new EnrollmentException(ErrorCode.ALREADY_REGISTERED).withDetail("offeringId", offering.getOfferingId());
        }

        entry.accept(now);
        waitlistEntryRepository.save(entry);
        waitlistQueueService.closeGap(entry);

        SubjectContext registrant = new SubjectContext(entry.getSubjectId(), subject.getRole(),
                entry.getContactEmail() != null ? entry.getContactEmail() : subject.getEmail());
        Registration registration = registrationLedgerService.open(offering, registrant, now);
        if (registration.holdsSeat()) {
            notifier.registrationConfirmed(registration, offering);
        }
        metricsService.recordWaitlistTransition("ACCEPTED");

        logger.info("Subject {} accepted offer on entry {}, registration {} is {}",
                entry.getSubjectId(), entryId, registration.getRegistrationId(), registration.getStatus());
        return Optional.of(RegistrationResult.registered(offering, registration));
    }

    /**
     * Decline an outstanding offer and pass the seat to the next in line.
     *
     * @param subject Declining subject, must own the entry
     * @param entryId Waitlist entry ID
     * @return The declined entry
     */
    @Transactional
    public WaitlistEntry declineOffer(SubjectContext subject, String entryId) {
        Instant now = clock.instant();
        Offering offering = lockOfferingOfEntry(entryId);
        WaitlistEntry entry = loadOwnedOffer(subject, entryId);

        entry.decline(now);
        entry = waitlistEntryRepository.save(entry);
        waitlistQueueService.closeGap(entry);
        metricsService.recordWaitlistTransition("DECLINED");

        logger.info("Subject {} declined offer on entry {}", entry.getSubjectId(), entryId);

        promoteNextLocked(offering, now);
        return entry;
    }

    // ========================================
    // Expiry
    // ========================================

    /**
     * Expire one lapsed offer. Idempotent: returns false if the entry no longer
     * holds an offer past its deadline.
     *
     * @param entryId Waitlist entry ID
     * @param now Sweep time
     * @return true if the entry was expired
     */
    @Transactional
    public boolean expireOffer(String entryId, Instant now) {
        Optional<String> offeringId = waitlistEntryRepository.findOfferingIdByEntryId(entryId);
        if (offeringId.isEmpty()) {
            return false;
        }
        Offering offering = lockOffering(offeringId.get());
        WaitlistEntry entry = waitlistEntryRepository.findById(entryId).orElse(null);
        if (entry == null || !entry.isOfferExpired(now)) {
            logger.debug("Entry {} has no lapsed offer; skipping", entryId);
            return false;
        }
        expireLocked(offering, entry, now);
        return true;
    }

    private void expireLocked(Offering offering, WaitlistEntry entry, Instant now) {
        entry.expire(now);
        waitlistEntryRepository.save(entry);
        waitlistQueueService.closeGap(entry);

        notifier.waitlistOfferExpired(entry, offering);
        metricsService.recordWaitlistTransition("EXPIRED");
        logger.info("Expired offer on entry {} for subject {}", entry.getEntryId(), entry.getSubjectId());

        promoteNextLocked(offering, now);
    }

    // ========================================
    // Queries
    // ========================================

    /**
     * The subject's most recent waitlist entry for an offering, in any status.
     */
    @Transactional(readOnly = true)
    public Optional<WaitlistEntry> findMyEntry(String subjectId, String offeringId) {
        return waitlistEntryRepository.findFirstByOfferingIdAndSubjectIdOrderByJoinedAtDesc(offeringId, subjectId);
    }

    @Transactional(readOnly = true)
    public List<WaitlistEntry> getLiveWaitlist(String offeringId) {
        return waitlistQueueService.liveEntries(offeringId);
    }

    // ========================================
    // Helpers
    // ========================================

    private Offering lockOffering(String offeringId) {
        return offeringRepository.findByIdForUpdate(offeringId)
                .orElseThrow(() -> new EnrollmentException(ErrorCode.OFFERING_NOT_FOUND)
                        .withDetail("offeringId", offeringId));
    }

    private Offering lockOfferingOfEntry(String entryId) {
        String offeringId = waitlistEntryRepository.findOfferingIdByEntryId(entryId)
                .orElseThrow(() -> new EnrollmentException(ErrorCode.WAITLIST_ENTRY_NOT_FOUND)
                        .withDetail("waitlistEntryId", entryId));
        return lockOffering(offeringId);
    }

    private WaitlistEntry loadOwnedOffer(SubjectContext subject, String entryId) {
        WaitlistEntry entry = waitlistEntryRepository.findById(entryId)
                .orElseThrow(() -> new EnrollmentException(ErrorCode.WAITLIST_ENTRY_NOT_FOUND)
                        .withDetail("waitlistEntryId", entryId));
        if (!entry.getSubjectId().equals(subject.getSubjectId())) {
            throw new EnrollmentException(ErrorCode.NOT_AUTHORIZED).withDetail("waitlistEntryId", entryId);
        }
        if (entry.getStatus() != WaitlistStatus.OFFERED) {
            throw new EnrollmentException(ErrorCode.OFFER_NOT_ACTIVE)
                    .withDetail("waitlistEntryId", entryId)
                    .withDetail("status", entry.getStatus().name());
        }
        return entry;
    }
}
