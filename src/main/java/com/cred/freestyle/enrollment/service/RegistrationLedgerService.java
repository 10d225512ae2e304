package com.cred.freestyle.enrollment.service;

import com.cred.freestyle.enrollment.domain.model.Offering;
import com.cred.freestyle.enrollment.domain.model.Registration;
import com.cred.freestyle.enrollment.domain.model.Registration.PaymentStatus;
import com.cred.freestyle.enrollment.domain.model.Registration.RegistrationStatus;
import com.cred.freestyle.enrollment.exception.EnrollmentException;
import com.cred.freestyle.enrollment.exception.ErrorCode;
import com.cred.freestyle.enrollment.repository.RegistrationRepository;
import com.cred.freestyle.enrollment.security.SubjectContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Single write path for registration rows. Every creation and status change
 * goes through here so the seat count is adjusted in the same unit of work.
 *
 * Callers hold the offering row lock and run inside a transaction.
 *
 * @author Enrollment Team
 */
@Service
public class RegistrationLedgerService {

    private static final Logger logger = LoggerFactory.getLogger(RegistrationLedgerService.class);

    private final RegistrationRepository registrationRepository;
    private final SeatAccountingService seatAccountingService;

    public RegistrationLedgerService(
            RegistrationRepository registrationRepository,
            SeatAccountingService seatAccountingService
    ) {
        this.registrationRepository = registrationRepository;
        this.seatAccountingService = seatAccountingService;
    }

    /**
     * Create a live registration. Free offerings start CONFIRMED and take a
     * seat; paid offerings start PENDING_PAYMENT with payment status PENDING.
     *
     * @param offering Locked offering
     * @param subject Registering subject
     * @param now Current time
     * @return Persisted registration
     * @throws EnrollmentException ALREADY_REGISTERED if a live registration slipped in concurrently
     */
    public Registration open(Offering offering, SubjectContext subject, Instant now) {
        Registration registration = Registration.builder()
                .offeringId(offering.getOfferingId())
                .subjectId(subject.getSubjectId())
                .contactEmail(subject.getEmail())
                .registeredAt(now)
                .liveKey(Registration.liveKeyFor(offering.getOfferingId(), subject.getSubjectId()))
                .build();

        if (offering.isPaid()) {
            registration.setStatus(RegistrationStatus.PENDING_PAYMENT);
            registration.setPaymentStatus(PaymentStatus.PENDING);
        } else {
            registration.confirm(now);
        }

        seatAccountingService.applyTransition(offering, null, registration.getStatus());

        try {
            registration = registrationRepository.saveAndFlush(registration);
        } catch (DataIntegrityViolationException e) {
            logger.warn("Live registration already exists for subject {} on offering {}",
                    subject.getSubjectId(), offering.getOfferingId());
            throw new EnrollmentException(ErrorCode.ALREADY_REGISTERED)
                    .withDetail("offeringId", offering.getOfferingId());
        }

        logger.info("Opened registration {} ({}) for subject {} on offering {}",
                registration.getRegistrationId(), registration.getStatus(),
                subject.getSubjectId(), offering.getOfferingId());
        return registration;
    }

    /**
     * Confirm a pending registration after successful payment.
     */
    public Registration confirm(Offering offering, Registration registration, String paymentReference, Instant now) {
        RegistrationStatus from = registration.getStatus();
        registration.confirm(now);
        registration.setPaymentStatus(PaymentStatus.COMPLETED);
        registration.setPaymentReference(paymentReference);
        seatAccountingService.applyTransition(offering, from, registration.getStatus());
        return registrationRepository.save(registration);
    }

    /**
     * Cancel a live registration, releasing its seat if it held one.
     */
    public Registration cancel(Offering offering, Registration registration, String reason, Instant now) {
        RegistrationStatus from = registration.getStatus();
        registration.cancel(now, reason);
        seatAccountingService.applyTransition(offering, from, registration.getStatus());
        return registrationRepository.save(registration);
    }

    /**
     * Mark a confirmed registration completed after the offering took place.
     */
    public Registration complete(Offering offering, Registration registration, Instant now) {
        RegistrationStatus from = registration.getStatus();
        registration.complete(now);
        seatAccountingService.applyTransition(offering, from, registration.getStatus());
        return registrationRepository.save(registration);
    }
}
