package com.cred.freestyle.enrollment.api.controller;

import com.cred.freestyle.enrollment.api.dto.RegistrationOutcomeResponse;
import com.cred.freestyle.enrollment.api.dto.WaitlistEntryResponse;
import com.cred.freestyle.enrollment.domain.model.WaitlistEntry;
import com.cred.freestyle.enrollment.security.SecurityUtils;
import com.cred.freestyle.enrollment.security.SubjectContext;
import com.cred.freestyle.enrollment.service.RegistrationResult;
import com.cred.freestyle.enrollment.service.WaitlistService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST controller for waitlist operations.
 *
 * @author Enrollment Team
 */
@RestController
@RequestMapping("/api/v1")
public class WaitlistController {

    private static final Logger logger = LoggerFactory.getLogger(WaitlistController.class);

    private final WaitlistService waitlistService;

    public WaitlistController(WaitlistService waitlistService) {
        this.waitlistService = waitlistService;
    }

    /**
     * Get the caller's most recent waitlist entry (with position) for an offering.
     */
    @GetMapping("/offerings/{offeringId}/waitlist/me")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<WaitlistEntryResponse> getMyEntry(@PathVariable String offeringId) {
        SubjectContext subject = SecurityUtils.currentSubject();

        return waitlistService.findMyEntry(subject.getSubjectId(), offeringId)
                .map(WaitlistEntryResponse::fromEntity)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * Full live waitlist of an offering in position order.
     *
     * Authorization: ADMIN only
     */
    @GetMapping("/offerings/{offeringId}/waitlist")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<List<WaitlistEntryResponse>> getWaitlist(@PathVariable String offeringId) {
        List<WaitlistEntryResponse> entries = waitlistService.getLiveWaitlist(offeringId).stream()
                .map(WaitlistEntryResponse::fromEntity)
                .collect(Collectors.toList());
        return ResponseEntity.ok(entries);
    }

    /**
     * Accept an outstanding seat offer.
     *
     * @param entryId Waitlist entry ID
     * @return CONFIRMED or CHECKOUT_REQUIRED outcome
     */
    @PostMapping("/waitlist/{entryId}/accept")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<RegistrationOutcomeResponse> acceptOffer(@PathVariable String entryId) {
        SubjectContext subject = SecurityUtils.currentSubject();
        logger.info("Accept offer - subject: {}, entry: {}", subject.getSubjectId(), entryId);

        RegistrationResult result = waitlistService.acceptOffer(subject, entryId);
        return ResponseEntity.ok(RegistrationOutcomeResponse.fromResult(result));
    }

    @PostMapping("/waitlist/{entryId}/decline")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<WaitlistEntryResponse> declineOffer(@PathVariable String entryId) {
        SubjectContext subject = SecurityUtils.currentSubject();
        logger.info("Decline offer - subject: {}, entry: {}", subject.getSubjectId(), entryId);

        WaitlistEntry declined = waitlistService.declineOffer(subject, entryId);
        return ResponseEntity.ok(WaitlistEntryResponse.fromEntity(declined));
    }
}
