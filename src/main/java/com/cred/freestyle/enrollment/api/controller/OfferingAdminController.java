package com.cred.freestyle.enrollment.api.controller;

import com.cred.freestyle.enrollment.api.dto.CancelOfferingRequest;
import com.cred.freestyle.enrollment.api.dto.OfferingAvailabilityResponse;
import com.cred.freestyle.enrollment.api.dto.SweepRunResponse;
import com.cred.freestyle.enrollment.api.dto.WaitlistEntryResponse;
import com.cred.freestyle.enrollment.domain.model.Offering;
import com.cred.freestyle.enrollment.exception.EnrollmentException;
import com.cred.freestyle.enrollment.exception.ErrorCode;
import com.cred.freestyle.enrollment.service.OfferingService;
import com.cred.freestyle.enrollment.service.SeatAccountingService;
import com.cred.freestyle.enrollment.service.SweepService;
import com.cred.freestyle.enrollment.service.WaitlistService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;

/**
 * Administrative operations for recovery and maintenance.
 *
 * Authorization: ADMIN only
 *
 * @author Enrollment Team
 */
@RestController
@RequestMapping("/api/v1/admin")
@PreAuthorize("hasRole('ADMIN')")
public class OfferingAdminController {

    private static final Logger logger = LoggerFactory.getLogger(OfferingAdminController.class);

    private final WaitlistService waitlistService;
    private final OfferingService offeringService;
    private final SeatAccountingService seatAccountingService;
    private final SweepService sweepService;
    private final Clock clock;

    public OfferingAdminController(
            WaitlistService waitlistService,
            OfferingService offeringService,
            SeatAccountingService seatAccountingService,
            SweepService sweepService,
            Clock clock
    ) {
        this.waitlistService = waitlistService;
        this.offeringService = offeringService;
        this.seatAccountingService = seatAccountingService;
        this.sweepService = sweepService;
        this.clock = clock;
    }

    /**
     * Offer a free seat to the next waiting subject, if any.
     *
     * @return 200 with the promoted entry, 204 if nobody was promoted
     */
    @PostMapping("/offerings/{offeringId}/promote")
    public ResponseEntity<WaitlistEntryResponse> promoteNext(@PathVariable String offeringId) {
        logger.info("Manual promotion requested for offering: {}", offeringId);

        return waitlistService.promoteNext(offeringId)
                .map(WaitlistEntryResponse::fromEntity)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.noContent().build());
    }

    @PostMapping("/offerings/{offeringId}/cancel")
    public ResponseEntity<OfferingAvailabilityResponse> cancelOffering(
            @PathVariable String offeringId,
            @Valid @RequestBody CancelOfferingRequest request
    ) {
        logger.info("Cancelling offering {}: {}", offeringId, request.getReason());

        Offering cancelled = offeringService.cancelOffering(offeringId, request.getReason());
        return ResponseEntity.ok(OfferingAvailabilityResponse.fromAvailability(
                offeringService.getAvailability(cancelled.getOfferingId())));
    }

    /**
     * Recount confirmed registrations and correct the stored seat count.
     *
     * @return Seat count after reconciliation
     */
    @PostMapping("/offerings/{offeringId}/reconcile-seats")
    public ResponseEntity<Map<String, Object>> reconcileSeats(@PathVariable String offeringId) {
        int confirmedSeats = seatAccountingService.reconcile(offeringId);
        return ResponseEntity.ok(Map.of("offeringId", offeringId, "confirmedSeats", confirmedSeats));
    }

    /**
     * Run one sweep immediately.
     *
     * @param sweep expire-offers, pending-registrations, reminders or close-offerings
     */
    @PostMapping("/sweeps/{sweep}")
    public ResponseEntity<SweepRunResponse> runSweep(@PathVariable String sweep) {
        Instant now = clock.instant();
        logger.info("Manual sweep run requested: {}", sweep);

        int processed;
        switch (sweep) {
            case "expire-offers":
                processed = sweepService.expireStaleOffers(now);
                break;
            case "pending-registrations":
                processed = sweepService.cleanupStalePendingRegistrations(now);
                break;
            case "reminders":
                processed = sweepService.sendUpcomingReminders(now);
                break;
            case "close-offerings":
                processed = sweepService.closePastOfferings(now);
                break;
            default:
                throw new EnrollmentException(ErrorCode.INVALID_REQUEST, "Unknown sweep: " + sweep)
                        .withDetail("sweep", sweep);
        }
        return ResponseEntity.ok(new SweepRunResponse(sweep, processed, now));
    }
}
