package com.cred.freestyle.enrollment.service;

import com.cred.freestyle.enrollment.domain.model.Offering;
import com.cred.freestyle.enrollment.domain.model.Offering.OfferingStatus;
import com.cred.freestyle.enrollment.domain.model.Registration;
import com.cred.freestyle.enrollment.domain.model.Registration.RegistrationStatus;
import com.cred.freestyle.enrollment.domain.model.WaitlistEntry.WaitlistStatus;
import com.cred.freestyle.enrollment.infrastructure.cache.ReminderCacheService;
import com.cred.freestyle.enrollment.infrastructure.metrics.EnrollmentMetricsService;
import com.cred.freestyle.enrollment.infrastructure.notification.EnrollmentNotifier;
import com.cred.freestyle.enrollment.repository.OfferingRepository;
import com.cred.freestyle.enrollment.repository.RegistrationRepository;
import com.cred.freestyle.enrollment.repository.WaitlistEntryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Periodic maintenance over all offerings.
 *
 * Sweeps:
 * - expireStaleOffers: OFFERED entries past their deadline become EXPIRED, next subject promoted
 * - cleanupStalePendingRegistrations: PENDING_PAYMENT older than the timeout are cancelled
 * - sendUpcomingReminders: confirmed subjects of offerings starting in 24-48h are reminded once
 * - closePastOfferings: OPEN offerings whose end has passed are closed
 *
 * Every item is processed in its own transaction through the regular service
 * operations, so an item failure is logged and skipped without affecting the
 * rest, and a sweep racing a user action sees the action's committed result.
 * All sweeps take the current time as a parameter and are safe to re-run.
 *
 * @author Enrollment Team
 */
@Service
public class SweepService {

    private static final Logger logger = LoggerFactory.getLogger(SweepService.class);

    private final WaitlistEntryRepository waitlistEntryRepository;
    private final RegistrationRepository registrationRepository;
    private final OfferingRepository offeringRepository;
    private final WaitlistService waitlistService;
    private final RegistrationService registrationService;
    private final OfferingService offeringService;
    private final ReminderCacheService reminderCacheService;
    private final EnrollmentNotifier notifier;
    private final EnrollmentMetricsService metricsService;
    private final Duration pendingTimeout;
    private final Duration reminderWindowStart;
    private final Duration reminderWindowEnd;

    public SweepService(
            WaitlistEntryRepository waitlistEntryRepository,
            RegistrationRepository registrationRepository,
            OfferingRepository offeringRepository,
            WaitlistService waitlistService,
            RegistrationService registrationService,
            OfferingService offeringService,
            ReminderCacheService reminderCacheService,
            EnrollmentNotifier notifier,
            EnrollmentMetricsService metricsService,
            @Value("${enrollment.payment.pending-timeout:PT24H}") String pendingTimeout,
            @Value("${enrollment.reminders.window-start:PT24H}") String reminderWindowStart,
            @Value("${enrollment.reminders.window-end:PT48H}") String reminderWindowEnd
    ) {
        this.waitlistEntryRepository = waitlistEntryRepository;
        this.registrationRepository = registrationRepository;
        this.offeringRepository = offeringRepository;
        this.waitlistService = waitlistService;
        this.registrationService = registrationService;
        this.offeringService = offeringService;
        this.reminderCacheService = reminderCacheService;
        this.notifier = notifier;
        this.metricsService = metricsService;
        this.pendingTimeout = Duration.parse(pendingTimeout);
        this.reminderWindowStart = Duration.parse(reminderWindowStart);
        this.reminderWindowEnd = Duration.parse(reminderWindowEnd);
    }

    /**
     * Expire every lapsed waitlist offer and promote the next waiting subject.
     *
     * @param now Sweep time
     * @return Number of offers expired
     */
    public int expireStaleOffers(Instant now) {
        long startTime = System.currentTimeMillis();
        List<String> entryIds = waitlistEntryRepository.findIdsByStatusDeadlineBefore(WaitlistStatus.OFFERED, now);

        int expired = 0;
        for (String entryId : entryIds) {
            try {
                if (waitlistService.expireOffer(entryId, now)) {
                    expired++;
                }
            } catch (Exception e) {
                logger.error("Error expiring waitlist offer: {}", entryId, e);
                metricsService.recordError("SWEEP_ITEM_ERROR", "expireStaleOffers");
            }
        }

        finish("expireStaleOffers", entryIds.size(), expired, startTime);
        return expired;
    }

    /**
     * Cancel registrations still awaiting payment after the pending timeout.
     *
     * @param now Sweep time
     * @return Number of registrations cancelled
     */
    public int cleanupStalePendingRegistrations(Instant now) {
        long startTime = System.currentTimeMillis();
        Instant cutoff = now.minus(pendingTimeout);
        List<String> registrationIds = registrationRepository.findIdsByStatusRegisteredBefore(
                RegistrationStatus.PENDING_PAYMENT, cutoff);

        int cancelled = 0;
        for (String registrationId : registrationIds) {
            try {
                if (registrationService.cancelStalePendingRegistration(registrationId, cutoff)) {
                    cancelled++;
                }
            } catch (Exception e) {
                logger.error("Error cancelling stale pending registration: {}", registrationId, e);
                metricsService.recordError("SWEEP_ITEM_ERROR", "cleanupStalePendingRegistrations");
            }
        }

        finish("cleanupStalePendingRegistrations", registrationIds.size(), cancelled, startTime);
        return cancelled;
    }

    /**
     * Remind confirmed subjects of OPEN offerings starting between
     * now + window-start and now + window-end. Each registration is reminded
     * once across runs; a reminder whose delivery failed is sent again by a later run.
     *
     * @param now Sweep time
     * @return Number of reminders sent
     */
    public int sendUpcomingReminders(Instant now) {
        long startTime = System.currentTimeMillis();
        List<Offering> offerings = offeringRepository.findByStatusStartingBetween(
                OfferingStatus.OPEN, now.plus(reminderWindowStart), now.plus(reminderWindowEnd));

        int candidates = 0;
        int sent = 0;
        for (Offering offering : offerings) {
            List<Registration> attendees = registrationRepository.findByOfferingIdAndStatusOrderByRegisteredAtAsc(
                    offering.getOfferingId(), RegistrationStatus.CONFIRMED);
            candidates += attendees.size();
            for (Registration registration : attendees) {
                try {
                    if (reminderCacheService.markReminderSent(registration.getRegistrationId())) {
                        notifier.eventReminder(registration, offering);
                        sent++;
                    }
                } catch (Exception e) {
                    logger.error("Error sending reminder for registration: {}", registration.getRegistrationId(), e);
                    metricsService.recordError("SWEEP_ITEM_ERROR", "sendUpcomingReminders");
                }
            }
        }

        finish("sendUpcomingReminders", candidates, sent, startTime);
        return sent;
    }

    /**
     * Close OPEN offerings whose scheduled end has passed.
     *
     * @param now Sweep time
     * @return Number of offerings closed
     */
    public int closePastOfferings(Instant now) {
        long startTime = System.currentTimeMillis();
        List<String> offeringIds = offeringService.findOfferingIdsDueForClosing(now);

        int closed = 0;
        for (String offeringId : offeringIds) {
            try {
                if (offeringService.closeOffering(offeringId, now)) {
                    closed++;
                }
            } catch (Exception e) {
                logger.error("Error closing offering: {}", offeringId, e);
                metricsService.recordError("SWEEP_ITEM_ERROR", "closePastOfferings");
            }
        }

        finish("closePastOfferings", offeringIds.size(), closed, startTime);
        return closed;
    }

    private void finish(String sweep, int candidates, int processed, long startTime) {
        long duration = System.currentTimeMillis() - startTime;
        metricsService.recordSweep(sweep, processed, duration);
        if (candidates > 0) {
            logger.info("{} completed: {} candidates, {} processed, duration: {}ms",
                    sweep, candidates, processed, duration);
        } else {
            logger.debug("{} found nothing to do", sweep);
        }
    }
}
