package com.cred.freestyle.enrollment.service;

import com.cred.freestyle.enrollment.domain.model.Offering;
import com.cred.freestyle.enrollment.domain.model.Registration;
import com.cred.freestyle.enrollment.domain.model.Registration.PaymentStatus;
import com.cred.freestyle.enrollment.domain.model.Registration.RegistrationStatus;
import com.cred.freestyle.enrollment.domain.model.WaitlistEntry;
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
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Registration operations: register, payment outcomes, cancellation.
 *
 * Each mutating operation runs in one transaction that starts by locking the
 * offering row (SELECT ... FOR UPDATE). Every check and write of that
 * operation happens under the lock, so concurrent calls for the same offering
 * are serialized and the seat count cannot be oversold.
 *
 * Checkout for paid offerings is created after the registration transaction
 * commits, so no lock is held while the payment provider is called.
 *
 * @author Enrollment Team
 */
@Service
public class RegistrationService {

    private static final Logger logger = LoggerFactory.getLogger(RegistrationService.class);

    static final String CAPACITY_REACHED_REASON = "Capacity reached before payment completed";
    static final String PAYMENT_TIMEOUT_REASON = "Payment timeout";

    private final OfferingRepository offeringRepository;
    private final RegistrationRepository registrationRepository;
    private final WaitlistEntryRepository waitlistEntryRepository;
    private final RegistrationLedgerService registrationLedgerService;
    private final WaitlistQueueService waitlistQueueService;
    private final WaitlistService waitlistService;
    private final CheckoutService checkoutService;
    private final EnrollmentNotifier notifier;
    private final EnrollmentMetricsService metricsService;
    private final Clock clock;
    private final TransactionTemplate transactionTemplate;

    public RegistrationService(
            OfferingRepository offeringRepository,
            RegistrationRepository registrationRepository,
            WaitlistEntryRepository waitlistEntryRepository,
            RegistrationLedgerService registrationLedgerService,
            WaitlistQueueService waitlistQueueService,
            WaitlistService waitlistService,
            CheckoutService checkoutService,
            EnrollmentNotifier notifier,
            EnrollmentMetricsService metricsService,
            Clock clock,
            PlatformTransactionManager transactionManager
    ) {
        this.offeringRepository = offeringRepository;
        this.registrationRepository = registrationRepository;
        this.waitlistEntryRepository = waitlistEntryRepository;
        this.registrationLedgerService = registrationLedgerService;
        this.waitlistQueueService = waitlistQueueService;
        this.waitlistService = waitlistService;
        this.checkoutService = checkoutService;
        this.notifier = notifier;
        this.metricsService = metricsService;
        this.clock = clock;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    // ========================================
    // Register
    // ========================================

    /**
     * Register a subject for an offering.
     *
     * Process (under the offering lock):
     * 1. Offering must be OPEN and before its registration deadline
     * 2. Reject if the subject already has a live registration or waitlist entry
     * 3. If every seat is confirmed or promised to an outstanding waitlist offer, join the waitlist
     * 4. Otherwise create the registration: CONFIRMED (free) or PENDING_PAYMENT (paid)
     *
     * For paid offerings the checkout session is created after commit.
     *
     * @param subject Registering subject
     * @param offeringId Offering ID
     * @return Outcome: CONFIRMED, CHECKOUT_REQUIRED or WAITLISTED
     */
    public RegistrationResult register(SubjectContext subject, String offeringId) {
        long startTime = System.currentTimeMillis();
        try {
            RegistrationResult result = transactionTemplate.execute(status -> registerLocked(subject, offeringId));
            if (result.requiresCheckout()) {
                result = checkoutService.startCheckout(result.getOffering(), result.getRegistration());
            }
            metricsService.recordRegistrationOutcome(result.getOutcome().name());
            return result;
        } catch (EnrollmentException e) {
            metricsService.recordRegistrationRejected(e.getErrorCode().name());
            throw e;
        } finally {
            metricsService.recordRegistrationLatency(System.currentTimeMillis() - startTime);
        }
    }

    private RegistrationResult registerLocked(SubjectContext subject, String offeringId) {
        Instant now = clock.instant();
        Offering offering = lockOffering(offeringId);

        if (!offering.isOpen()) {
            throw new EnrollmentException(ErrorCode.OFFERING_NOT_OPEN)
                    .withDetail("offeringId", offeringId)
                    .withDetail("status", offering.getStatus().name());
        }
        if (offering.isDeadlinePassed(now)) {
            throw new EnrollmentException(ErrorCode.DEADLINE_PASSED)
                    .withDetail("offeringId", offeringId)
                    .withDetail("registrationDeadline", String.valueOf(offering.getRegistrationDeadline()));
        }

        String liveKey = Registration.liveKeyFor(offeringId, subject.getSubjectId());
        if (registrationRepository.findByLiveKey(liveKey).isPresent()) {
            throw new EnrollmentException(ErrorCode.ALREADY_REGISTERED).withDetail("offeringId", offeringId);
        }
        if (waitlistEntryRepository.findByLiveKey(liveKey).isPresent()) {
            throw new EnrollmentException(ErrorCode.ALREADY_WAITLISTED).withDetail("offeringId", offeringId);
        }

        long outstandingOffers = waitlistQueueService.outstandingOffers(offeringId);
        if (offering.getAvailableSeats() - outstandingOffers <= 0) {
            WaitlistEntry entry = waitlistQueueService.enqueue(offering, subject, now);
            notifier.waitlistJoined(entry, offering);
            metricsService.recordWaitlistTransition("JOINED");
            return RegistrationResult.waitlisted(offering, entry);
        }

        Registration registration = registrationLedgerService.open(offering, subject, now);
        if (registration.holdsSeat()) {
            notifier.registrationConfirmed(registration, offering);
        }
        return RegistrationResult.registered(offering, registration);
    }

    /**
     * Create a fresh checkout session for a pending registration whose
     * earlier checkout failed or was abandoned.
     *
     * @param subject Registration owner
     * @param registrationId Registration ID
     * @return CHECKOUT_REQUIRED result with the new session
     */
    public RegistrationResult retryCheckout(SubjectContext subject, String registrationId) {
        Registration registration = registrationRepository.findById(registrationId)
                .orElseThrow(() -> new EnrollmentException(ErrorCode.REGISTRATION_NOT_FOUND)
                        .withDetail("registrationId", registrationId));
        if (!registration.getSubjectId().equals(subject.getSubjectId())) {
            throw new EnrollmentException(ErrorCode.NOT_AUTHORIZED).withDetail("registrationId", registrationId);
        }
        if (registration.getStatus() != RegistrationStatus.PENDING_PAYMENT) {
            throw new EnrollmentException(ErrorCode.REGISTRATION_NOT_PENDING).withDetail("registrationId", registrationId);
        }
        Offering offering = offeringRepository.findById(registration.getOfferingId())
                .orElseThrow(() -> new EnrollmentException(ErrorCode.OFFERING_NOT_FOUND)
                        .withDetail("offeringId", registration.getOfferingId()));

        logger.info("Retrying checkout for registration {}", registrationId);
        return checkoutService.startCheckout(offering, registration);
    }

    // ========================================
    // Payment outcomes
    // ========================================

    /**
     * Confirm a pending registration after the provider reports payment success.
     *
     * If every seat was confirmed while the payment was in flight, the
     * registration is cancelled instead, the payment is recorded as completed
     * and a refund notification is emitted.
     *
     * A payment arriving for a registration that was already cancelled (payment
     * timeout, offering cancelled) is recorded and flagged for refund once; the
     * call still fails with REGISTRATION_NOT_PENDING so provider retries stay no-ops.
     *
     * @param registrationId Registration ID echoed by the provider
     * @param paymentReference Provider payment reference
     * @return Updated registration
     * @throws EnrollmentException REGISTRATION_NOT_PENDING on duplicate or late callbacks
     */
    public Registration confirmPayment(String registrationId, String paymentReference) {
        Instant now = clock.instant();

        PaymentOutcome outcome = transactionTemplate.execute(
                status -> confirmPaymentLocked(registrationId, paymentReference, now));

        // thrown after commit so a late payment's refund record survives
        if (outcome.isRejected()) {
            throw new EnrollmentException(ErrorCode.REGISTRATION_NOT_PENDING)
                    .withDetail("registrationId", registrationId)
                    .withDetail("status", outcome.getRegistration().getStatus().name());
        }
        return outcome.getRegistration();
    }

    private PaymentOutcome confirmPaymentLocked(String registrationId, String paymentReference, Instant now) {
        Offering offering = lockOfferingOfRegistration(registrationId);
        Registration registration = loadRegistration(registrationId);

        if (registration.getStatus() != RegistrationStatus.PENDING_PAYMENT) {
            if (registration.getStatus() == RegistrationStatus.CANCELLED
                    && (registration.getPaymentStatus() == PaymentStatus.PENDING
                    || registration.getPaymentStatus() == PaymentStatus.FAILED)) {
                logger.warn("Payment {} arrived for cancelled registration {}; flagging for refund",
                        paymentReference, registrationId);
                registration.setPaymentStatus(PaymentStatus.COMPLETED);
                registration.setPaymentReference(paymentReference);
                registration = registrationRepository.save(registration);
                notifier.refundRequired(registration, offering);
                metricsService.recordPaymentWithoutSeat();
            } else {
                logger.info("Ignoring payment success for registration {} in status {}",
                        registrationId, registration.getStatus());
            }
            return PaymentOutcome.rejected(registration);
        }

        if (!offering.hasAvailableSeat()) {
            logger.warn("Payment {} for registration {} arrived after offering {} filled up; cancelling for refund",
                    paymentReference, registrationId, offering.getOfferingId());
            registration.setPaymentStatus(PaymentStatus.COMPLETED);
            registration.setPaymentReference(paymentReference);
            registration = registrationLedgerService.cancel(offering, registration, CAPACITY_REACHED_REASON, now);
            notifier.refundRequired(registration, offering);
            metricsService.recordPaymentWithoutSeat();
            return PaymentOutcome.applied(registration);
        }

        registration = registrationLedgerService.confirm(offering, registration, paymentReference, now);
        notifier.registrationConfirmed(registration, offering);
        metricsService.recordPaymentConfirmed();

        logger.info("Payment {} confirmed registration {} on offering {} ({}/{})",
                paymentReference, registrationId, offering.getOfferingId(),
                offering.getConfirmedSeats(), offering.getCapacity());
        return PaymentOutcome.applied(registration);
    }

    /**
     * Record a failed payment. The registration stays PENDING_PAYMENT so the
     * subject can retry; repeated failure reports change nothing further.
     *
     * @param registrationId Registration ID echoed by the provider
     * @return Registration after recording the failure
     */
    @Transactional
    public Registration recordPaymentFailure(String registrationId) {
        Offering offering = lockOfferingOfRegistration(registrationId);
        Registration registration = loadRegistration(registrationId);

        if (registration.getStatus() != RegistrationStatus.PENDING_PAYMENT) {
            throw new EnrollmentException(ErrorCode.REGISTRATION_NOT_PENDING)
                    .withDetail("registrationId", registrationId)
                    .withDetail("status", registration.getStatus().name());
        }
        if (registration.getPaymentStatus() == PaymentStatus.FAILED) {
            logger.debug("Payment failure already recorded for registration {}", registrationId);
            return registration;
        }

        registration.setPaymentStatus(PaymentStatus.FAILED);
        registration = registrationRepository.save(registration);
        notifier.paymentFailed(registration, offering);
        metricsService.recordPaymentFailed();

        logger.info("Recorded payment failure for registration {}", registrationId);
        return registration;
    }

    // ========================================
    // Cancellation
    // ========================================

    /**
     * Cancel the subject's live registration for an offering. A released
     * seat is offered to the waitlist in the same transaction.
     *
     * @param subject Registration owner
     * @param offeringId Offering ID
     * @param reason Optional free-text reason
     * @return Cancelled registration
     */
    @Transactional
    public Registration cancelRegistration(SubjectContext subject, String offeringId, String reason) {
        Instant now = clock.instant();
        Offering offering = offeringRepository.findByIdForUpdate(offeringId)
                .orElseThrow(() -> new EnrollmentException(ErrorCode.REGISTRATION_NOT_FOUND)
                        .withDetail("offeringId", offeringId));

        Optional<Registration> live = registrationRepository.findByLiveKey(
                Registration.liveKeyFor(offeringId, subject.getSubjectId()));
        if (live.isEmpty()) {
            // latest row only picks the error code
            Registration latest = registrationRepository
                    .findFirstByOfferingIdAndSubjectIdOrderByRegisteredAtDesc(offeringId, subject.getSubjectId())
                    .orElseThrow(() -> new EnrollmentException(ErrorCode.REGISTRATION_NOT_FOUND)
                            .withDetail("offeringId", offeringId));
            throw new EnrollmentException(ErrorCode.CANCELLATION_NOT_ALLOWED)
                    .withDetail("registrationId", latest.getRegistrationId())
                    .withDetail("status", latest.getStatus().name());
        }

        return cancelLocked(offering, live.get(), reason, now);
    }

    /**
     * Cancel a registration still awaiting payment after the cutoff.
     * Re-checked under the lock; returns false if it was paid or cancelled meanwhile.
     *
     * @param registrationId Registration ID
     * @param cutoff Registrations created before this are stale
     * @return true if the registration was cancelled
     */
    @Transactional
    public boolean cancelStalePendingRegistration(String registrationId, Instant cutoff) {
        Optional<String> offeringId = registrationRepository.findOfferingIdByRegistrationId(registrationId);
        if (offeringId.isEmpty()) {
            return false;
        }
        Offering offering = lockOffering(offeringId.get());
        Registration registration = registrationRepository.findById(registrationId).orElse(null);
        if (registration == null
                || registration.getStatus() != RegistrationStatus.PENDING_PAYMENT
                || !registration.getRegisteredAt().isBefore(cutoff)) {
            return false;
        }
        cancelLocked(offering, registration, PAYMENT_TIMEOUT_REASON, clock.instant());
        return true;
    }

    private Registration cancelLocked(Offering offering, Registration registration, String reason, Instant now) {
        RegistrationStatus previous = registration.getStatus();
        registration = registrationLedgerService.cancel(offering, registration, reason, now);

        notifier.registrationCancelled(registration, offering);
        metricsService.recordCancellation(previous.name());
        logger.info("Cancelled registration {} ({}) for subject {} on offering {}: {}",
                registration.getRegistrationId(), previous, registration.getSubjectId(),
                offering.getOfferingId(), reason);

        if (previous == RegistrationStatus.CONFIRMED) {
            waitlistService.promoteNextLocked(offering, now);
        }
        return registration;
    }

    // ========================================
    // Queries
    // ========================================

    /**
     * The subject's live registration for an offering, else the most recent one in any status.
     */
    @Transactional(readOnly = true)
    public Optional<Registration> findMyRegistration(String subjectId, String offeringId) {
        Optional<Registration> live = registrationRepository.findByLiveKey(Registration.liveKeyFor(offeringId, subjectId));
        if (live.isPresent()) {
            return live;
        }
        return registrationRepository.findFirstByOfferingIdAndSubjectIdOrderByRegisteredAtDesc(offeringId, subjectId);
    }

    /**
     * Confirmed registrations of an offering in confirmation order.
     */
    @Transactional(readOnly = true)
    public List<Registration> getAttendees(String offeringId) {
        return registrationRepository.findByOfferingIdAndStatusOrderByConfirmedAtAsc(
                offeringId, RegistrationStatus.CONFIRMED);
    }

    // ========================================
    // Helpers
    // ========================================

    private Offering lockOffering(String offeringId) {
        return offeringRepository.findByIdForUpdate(offeringId)
                .orElseThrow(() -> new EnrollmentException(ErrorCode.OFFERING_NOT_FOUND)
                        .withDetail("offeringId", offeringId));
    }

    private Offering lockOfferingOfRegistration(String registrationId) {
        String offeringId = registrationRepository.findOfferingIdByRegistrationId(registrationId)
                .orElseThrow(() -> new EnrollmentException(ErrorCode.REGISTRATION_NOT_FOUND)
                        .withDetail("registrationId", registrationId));
        return lockOffering(offeringId);
    }

    private Registration loadRegistration(String registrationId) {
        return registrationRepository.findById(registrationId)
                .orElseThrow(() -> new EnrollmentException(ErrorCode.REGISTRATION_NOT_FOUND)
                        .withDetail("registrationId", registrationId));
    }

    private static final class PaymentOutcome {
        private final Registration registration;
        private final boolean rejected;

        private PaymentOutcome(Registration registration, boolean rejected) {
            this.registration = registration;
            this.rejected = rejected;
        }

        static PaymentOutcome applied(Registration registration) {
            return new PaymentOutcome(registration, false);
        }

        static PaymentOutcome rejected(Registration registration) {
            return new PaymentOutcome(registration, true);
        }

        Registration getRegistration() {
            return registration;
        }

        boolean isRejected() {
            return rejected;
        }
    }
}
