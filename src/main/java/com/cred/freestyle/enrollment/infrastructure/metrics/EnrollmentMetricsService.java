package com.cred.freestyle.enrollment.infrastructure.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Metrics service for registration and waitlist activity.
 * Publishes to whatever MeterRegistry is configured (CloudWatch in production).
 *
 * Key Metrics:
 * - Registration outcomes and rejections
 * - Payment confirmations and failures
 * - Waitlist offers, acceptances, declines and expiries
 * - Sweep progress and errors
 * - Seat count drift found by reconciliation
 *
 * @author Enrollment Team
 */
@Service
public class EnrollmentMetricsService {

    private static final Logger logger = LoggerFactory.getLogger(EnrollmentMetricsService.class);

    private final MeterRegistry meterRegistry;

    private static final String METRIC_PREFIX = "enrollment.";
    private static final String REGISTRATION_PREFIX = METRIC_PREFIX + "registration.";
    private static final String PAYMENT_PREFIX = METRIC_PREFIX + "payment.";
    private static final String WAITLIST_PREFIX = METRIC_PREFIX + "waitlist.";
    private static final String SWEEP_PREFIX = METRIC_PREFIX + "sweep.";

    public EnrollmentMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    /**
     * Record the outcome of a register call.
     *
     * @param outcome CONFIRMED, CHECKOUT_REQUIRED or WAITLISTED
     */
    public void recordRegistrationOutcome(String outcome) {
        Counter.builder(REGISTRATION_PREFIX + "outcome")
                .tag("outcome", outcome)
                .description("Registration attempts by outcome")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded registration outcome: {}", outcome);
    }

    /**
     * Record a register call rejected with a business error.
     *
     * @param errorCode Error code name
     */
    public void recordRegistrationRejected(String errorCode) {
        Counter.builder(REGISTRATION_PREFIX + "rejected")
                .tag("reason", errorCode)
                .description("Rejected registration attempts")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded registration rejection: {}", errorCode);
    }

    public void recordRegistrationLatency(long durationMs) {
        Timer.builder(REGISTRATION_PREFIX + "latency")
                .description("Register operation latency")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Record a registration cancellation.
     *
     * @param previousStatus Status the registration left
     */
    public void recordCancellation(String previousStatus) {
        Counter.builder(REGISTRATION_PREFIX + "cancelled")
                .tag("previous_status", previousStatus)
                .description("Cancelled registrations")
                .register(meterRegistry)
                .increment();
    }

    public void recordPaymentConfirmed() {
        Counter.builder(PAYMENT_PREFIX + "confirmed")
                .description("Payments confirmed")
                .register(meterRegistry)
                .increment();
    }

    public void recordPaymentFailed() {
        Counter.builder(PAYMENT_PREFIX + "failed")
                .description("Payment failures reported by the provider")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record a successful payment that arrived after every seat was taken.
     */
    public void recordPaymentWithoutSeat() {
        Counter.builder(PAYMENT_PREFIX + "without_seat")
                .description("Payments completed after capacity was exhausted")
                .register(meterRegistry)
                .increment();
        logger.warn("Recorded payment completed without an available seat");
    }

    public void recordCheckoutFailure() {
        Counter.builder(PAYMENT_PREFIX + "checkout.failure")
                .description("Checkout session creation failures")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record a waitlist transition.
     *
     * @param transition JOINED, OFFERED, ACCEPTED, DECLINED or EXPIRED
     */
    public void recordWaitlistTransition(String transition) {
        Counter.builder(WAITLIST_PREFIX + "transition")
                .tag("transition", transition)
                .description("Waitlist entry transitions")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded waitlist transition: {}", transition);
    }

    /**
     * Record items processed by a sweep run.
     *
     * @param sweep Sweep name
     * @param processed Items processed
     * @param durationMs Run duration in milliseconds
     */
    public void recordSweep(String sweep, int processed, long durationMs) {
        Counter.builder(SWEEP_PREFIX + "processed")
                .tag("sweep", sweep)
                .description("Items processed by sweeps")
                .register(meterRegistry)
                .increment(processed);

        Timer.builder(SWEEP_PREFIX + "latency")
                .tag("sweep", sweep)
                .description("Sweep run duration")
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Record a difference between the stored seat count and the confirmed rows.
     *
     * @param offeringId Offering ID
     * @param drift Stored count minus actual count
     */
    public void recordSeatDrift(String offeringId, int drift) {
        Counter.builder(METRIC_PREFIX + "seat.drift")
                .tag("offering_id", offeringId)
                .description("Seat count corrections made by reconciliation")
                .register(meterRegistry)
                .increment(Math.abs(drift));
        logger.warn("Recorded seat drift for offering {}: {}", offeringId, drift);
    }

    /**
     * Record error occurrence.
     *
     * @param errorType Error type (e.g., "SWEEP_ITEM_ERROR", "NOTIFICATION_ERROR")
     * @param operation Operation where error occurred
     */
    public void recordError(String errorType, String operation) {
        Counter.builder(METRIC_PREFIX + "error")
                .tag("error_type", errorType)
                .tag("operation", operation)
                .description("System errors")
                .register(meterRegistry)
                .increment();
        logger.warn("Recorded error: type={}, operation={}", errorType, operation);
    }
}
