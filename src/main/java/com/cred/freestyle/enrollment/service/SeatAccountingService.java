package com.cred.freestyle.enrollment.service;

import com.cred.freestyle.enrollment.domain.model.Offering;
import com.cred.freestyle.enrollment.domain.model.Registration.RegistrationStatus;
import com.cred.freestyle.enrollment.exception.EnrollmentException;
import com.cred.freestyle.enrollment.exception.ErrorCode;
import com.cred.freestyle.enrollment.exception.SeatInvariantViolationException;
import com.cred.freestyle.enrollment.infrastructure.metrics.EnrollmentMetricsService;
import com.cred.freestyle.enrollment.repository.OfferingRepository;
import com.cred.freestyle.enrollment.repository.RegistrationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Keeps an offering's confirmed seat count in step with its registrations.
 *
 * Rules applied on every registration status change:
 * - Entering CONFIRMED from anything else: +1
 * - Leaving CONFIRMED for anything else: -1
 * - Any other change: no effect
 *
 * Callers must hold the offering row lock and pass the managed, locked
 * Offering instance so the change commits with the registration write.
 *
 * @author Enrollment Team
 */
@Service
public class SeatAccountingService {

    private static final Logger logger = LoggerFactory.getLogger(SeatAccountingService.class);

    private final OfferingRepository offeringRepository;
    private final RegistrationRepository registrationRepository;
    private final EnrollmentMetricsService metricsService;

    public SeatAccountingService(
            OfferingRepository offeringRepository,
            RegistrationRepository registrationRepository,
            EnrollmentMetricsService metricsService
    ) {
        this.offeringRepository = offeringRepository;
        this.registrationRepository = registrationRepository;
        this.metricsService = metricsService;
    }

    /**
     * Apply the seat effect of one registration transition.
     *
     * @param offering Locked offering
     * @param from Previous status, null for a new registration
     * @param to New status
     * @throws SeatInvariantViolationException if the count would leave [0, capacity]
     */
    public void applyTransition(Offering offering, RegistrationStatus from, RegistrationStatus to) {
        boolean heldSeat = from == RegistrationStatus.CONFIRMED;
        boolean holdsSeat = to == RegistrationStatus.CONFIRMED;

        if (!heldSeat && holdsSeat) {
            offering.occupySeat();
            logger.debug("Seat occupied on offering {}: {}/{}",
                    offering.getOfferingId(), offering.getConfirmedSeats(), offering.getCapacity());
        } else if (heldSeat && !holdsSeat) {
            offering.releaseSeat();
            logger.debug("Seat released on offering {}: {}/{}",
                    offering.getOfferingId(), offering.getConfirmedSeats(), offering.getCapacity());
        }
    }

    /**
     * Recompute the confirmed seat count from the CONFIRMED registrations and
     * overwrite the stored value if they differ. Administrative recovery only.
     *
     * @param offeringId Offering ID
     * @return Seat count after reconciliation
     */
    @Transactional
    public int reconcile(String offeringId) {
        Offering offering = offeringRepository.findByIdForUpdate(offeringId)
                .orElseThrow(() -> new EnrollmentException(ErrorCode.OFFERING_NOT_FOUND)
                        .withDetail("offeringId", offeringId));

        int actual = (int) registrationRepository.countByOfferingIdAndStatus(
                offeringId, RegistrationStatus.CONFIRMED);
        int stored = offering.getConfirmedSeats();

        if (actual != stored) {
            logger.warn("Seat count drift on offering {}: stored={}, confirmed rows={}",
                    offeringId, stored, actual);
            metricsService.recordSeatDrift(offeringId, stored - actual);
            offering.setConfirmedSeats(actual);
            offeringRepository.save(offering);
        }
        if (actual > offering.getCapacity()) {
            logger.error("Offering {} has {} confirmed registrations for capacity {}",
                    offeringId, actual, offering.getCapacity());
        }
        return actual;
    }
}
