package com.cred.freestyle.enrollment.infrastructure.scheduler;

import com.cred.freestyle.enrollment.infrastructure.metrics.EnrollmentMetricsService;
import com.cred.freestyle.enrollment.service.SweepService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Drives the sweeps on their schedules.
 *
 * Default cadence (each configurable):
 * - Lapsed waitlist offers: every 15 minutes
 * - Stale pending registrations: hourly
 * - Past offerings: hourly
 * - Reminders: hourly, on the hour (failed deliveries are retried while the offering is in the window)
 *
 * Fixed delay means a run starts only after the previous one completed, so
 * runs of the same sweep never overlap within one instance. Running several
 * instances is safe because every item is re-checked under its offering lock.
 *
 * @author Enrollment Team
 */
@Component
public class EnrollmentSweepScheduler {

    private static final Logger logger = LoggerFactory.getLogger(EnrollmentSweepScheduler.class);

    private final SweepService sweepService;
    private final EnrollmentMetricsService metricsService;
    private final Clock clock;

    @Value("${enrollment.sweeps.enabled:true}")
    private boolean sweepsEnabled;

    public EnrollmentSweepScheduler(
            SweepService sweepService,
            EnrollmentMetricsService metricsService,
            Clock clock
    ) {
        this.sweepService = sweepService;
        this.metricsService = metricsService;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${enrollment.sweeps.expire-offers-delay-ms:900000}",
               initialDelayString = "${enrollment.sweeps.initial-delay-ms:60000}")
    public void expireStaleOffers() {
        if (!sweepsEnabled) {
            logger.debug("Sweeps are disabled");
            return;
        }
        try {
            sweepService.expireStaleOffers(clock.instant());
        } catch (Exception e) {
            logger.error("Error in stale offer sweep", e);
            metricsService.recordError("SWEEP_ERROR", "expireStaleOffers");
        }
    }

    @Scheduled(fixedDelayString = "${enrollment.sweeps.pending-cleanup-delay-ms:3600000}",
               initialDelayString = "${enrollment.sweeps.initial-delay-ms:60000}")
    public void cleanupStalePendingRegistrations() {
        if (!sweepsEnabled) {
            return;
        }
        try {
            sweepService.cleanupStalePendingRegistrations(clock.instant());
        } catch (Exception e) {
            logger.error("Error in stale pending registration sweep", e);
            metricsService.recordError("SWEEP_ERROR", "cleanupStalePendingRegistrations");
        }
    }

    @Scheduled(fixedDelayString = "${enrollment.sweeps.close-offerings-delay-ms:3600000}",
               initialDelayString = "${enrollment.sweeps.initial-delay-ms:60000}")
    public void closePastOfferings() {
        if (!sweepsEnabled) {
            return;
        }
        try {
            sweepService.closePastOfferings(clock.instant());
        } catch (Exception e) {
            logger.error("Error in past offering sweep", e);
            metricsService.recordError("SWEEP_ERROR", "closePastOfferings");
        }
    }

    @Scheduled(cron = "${enrollment.sweeps.reminders-cron:0 0 * * * *}", zone = "UTC")
    public void sendUpcomingReminders() {
        if (!sweepsEnabled) {
            return;
        }
        try {
            sweepService.sendUpcomingReminders(clock.instant());
        } catch (Exception e) {
            logger.error("Error in reminder sweep", e);
            metricsService.recordError("SWEEP_ERROR", "sendUpcomingReminders");
        }
    }
}
