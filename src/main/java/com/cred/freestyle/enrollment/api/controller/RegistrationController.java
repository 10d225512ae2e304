package com.cred.freestyle.enrollment.api.controller;

import com.cred.freestyle.enrollment.api.dto.CancelRegistrationRequest;
import com.cred.freestyle.enrollment.api.dto.OfferingAvailabilityResponse;
import com.cred.freestyle.enrollment.api.dto.RegistrationOutcomeResponse;
import com.cred.freestyle.enrollment.api.dto.RegistrationResponse;
import com.cred.freestyle.enrollment.domain.model.Registration;
import com.cred.freestyle.enrollment.security.SecurityUtils;
import com.cred.freestyle.enrollment.security.SubjectContext;
import com.cred.freestyle.enrollment.service.OfferingService;
import com.cred.freestyle.enrollment.service.RegistrationResult;
import com.cred.freestyle.enrollment.service.RegistrationService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST controller for registration operations.
 * Handles registering, cancelling, checkout retries and registration queries.
 *
 * @author Enrollment Team
 */
@RestController
@RequestMapping("/api/v1")
public class RegistrationController {

    private static final Logger logger = LoggerFactory.getLogger(RegistrationController.class);

    private final RegistrationService registrationService;
    private final OfferingService offeringService;

    public RegistrationController(
            RegistrationService registrationService,
            OfferingService offeringService
    ) {
        this.registrationService = registrationService;
        this.offeringService = offeringService;
    }

    /**
     * Register the caller for an offering.
     *
     * Returns 201 with outcome CONFIRMED (free offering), CHECKOUT_REQUIRED
     * (paid offering, carries the checkout URL) or WAITLISTED (offering full).
     *
     * @param offeringId Offering ID
     * @return Registration outcome
     */
    @PostMapping("/offerings/{offeringId}/registrations")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<RegistrationOutcomeResponse> register(@PathVariable String offeringId) {
        SubjectContext subject = SecurityUtils.currentSubject();
        logger.info("Register request - subject: {}, offering: {}", subject.getSubjectId(), offeringId);

        RegistrationResult result = registrationService.register(subject, offeringId);

        logger.info("Register completed - subject: {}, offering: {}, outcome: {}",
                subject.getSubjectId(), offeringId, result.getOutcome());
        return ResponseEntity.status(HttpStatus.CREATED).body(RegistrationOutcomeResponse.fromResult(result));
    }

    /**
     * Cancel the caller's live registration for an offering.
     *
     * @param offeringId Offering ID
     * @param request Optional cancellation reason
     * @return Cancelled registration
     */
    @DeleteMapping("/offerings/{offeringId}/registrations/me")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<RegistrationResponse> cancelMyRegistration(
            @PathVariable String offeringId,
            @Valid @RequestBody(required = false) CancelRegistrationRequest request
    ) {
        SubjectContext subject = SecurityUtils.currentSubject();
        String reason = request != null ? request.getReason() : null;
        logger.info("Cancel request - subject: {}, offering: {}", subject.getSubjectId(), offeringId);

        Registration cancelled = registrationService.cancelRegistration(subject, offeringId, reason);
        return ResponseEntity.ok(RegistrationResponse.fromEntity(cancelled));
    }

    /**
     * Get the caller's most recent registration for an offering.
     */
    @GetMapping("/offerings/{offeringId}/registrations/me")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<RegistrationResponse> getMyRegistration(@PathVariable String offeringId) {
        SubjectContext subject = SecurityUtils.currentSubject();

        return registrationService.findMyRegistration(subject.getSubjectId(), offeringId)
                .map(RegistrationResponse::fromEntity)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * Attendee list: confirmed registrations in confirmation order.
     *
     * Authorization: ADMIN only
     */
    @GetMapping("/offerings/{offeringId}/attendees")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<List<RegistrationResponse>> getAttendees(@PathVariable String offeringId) {
        logger.debug("Fetching attendees for offering: {}", offeringId);

        List<RegistrationResponse> attendees = registrationService.getAttendees(offeringId).stream()
                .map(RegistrationResponse::fromEntity)
                .collect(Collectors.toList());
        return ResponseEntity.ok(attendees);
    }

    @GetMapping("/offerings/{offeringId}/availability")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<OfferingAvailabilityResponse> getAvailability(@PathVariable String offeringId) {
        return ResponseEntity.ok(OfferingAvailabilityResponse.fromAvailability(
                offeringService.getAvailability(offeringId)));
    }

    /**
     * Create a fresh checkout session for the caller's pending registration.
     *
     * @param registrationId Registration ID
     * @return CHECKOUT_REQUIRED outcome with the new checkout URL
     */
    @PostMapping("/registrations/{registrationId}/checkout")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<RegistrationOutcomeResponse> retryCheckout(@PathVariable String registrationId) {
        SubjectContext subject = SecurityUtils.currentSubject();
        logger.info("Checkout retry - subject: {}, registration: {}", subject.getSubjectId(), registrationId);

        RegistrationResult result = registrationService.retryCheckout(subject, registrationId);
        return ResponseEntity.ok(RegistrationOutcomeResponse.fromResult(result));
    }
}
