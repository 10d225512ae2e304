package com.cred.freestyle.enrollment.service;

import com.cred.freestyle.enrollment.domain.model.Offering;
import com.cred.freestyle.enrollment.domain.model.Registration;
import com.cred.freestyle.enrollment.domain.model.Registration.PaymentStatus;
import com.cred.freestyle.enrollment.domain.model.Registration.RegistrationStatus;
import com.cred.freestyle.enrollment.exception.EnrollmentException;
import com.cred.freestyle.enrollment.exception.ErrorCode;
import com.cred.freestyle.enrollment.infrastructure.metrics.EnrollmentMetricsService;
import com.cred.freestyle.enrollment.infrastructure.payment.CheckoutRequest;
import com.cred.freestyle.enrollment.infrastructure.payment.CheckoutSession;
import com.cred.freestyle.enrollment.infrastructure.payment.PaymentGateway;
import com.cred.freestyle.enrollment.infrastructure.payment.PaymentGatewayException;
import com.cred.freestyle.enrollment.repository.RegistrationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Starts checkout for pending registrations.
 *
 * The payment provider is called with no transaction open and no lock held.
 * The session is then attached in a short transaction of its own, and only if
 * the registration is still pending (it may have been cancelled meanwhile).
 * A failed provider call leaves the registration pending; the subject can
 * retry, and the stale-pending sweep cleans up otherwise.
 *
 * @author Enrollment Team
 */
@Service
public class CheckoutService {

    private static final Logger logger = LoggerFactory.getLogger(CheckoutService.class);

    private final PaymentGateway paymentGateway;
    private final RegistrationRepository registrationRepository;
    private final EnrollmentMetricsService metricsService;
    private final TransactionTemplate transactionTemplate;

    public CheckoutService(
            PaymentGateway paymentGateway,
            RegistrationRepository registrationRepository,
            EnrollmentMetricsService metricsService,
            PlatformTransactionManager transactionManager
    ) {
        this.paymentGateway = paymentGateway;
        this.registrationRepository = registrationRepository;
        this.metricsService = metricsService;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * Create a checkout session for a pending registration and attach it.
     *
     * @param offering Offering snapshot (price, currency, title)
     * @param registration Pending registration
     * @return CHECKOUT_REQUIRED result carrying the session
     * @throws EnrollmentException CHECKOUT_CREATION_FAILED if the provider call fails
     */
    public RegistrationResult startCheckout(Offering offering, Registration registration) {
        String registrationId = registration.getRegistrationId();
        CheckoutRequest request = new CheckoutRequest(
                registrationId,
                offering.getTitle(),
                offering.getPrice(),
                offering.getCurrency(),
                registration.getContactEmail()
        );

        CheckoutSession session;
        try {
            session = paymentGateway.createCheckout(request);
        } catch (PaymentGatewayException e) {
            logger.error("Checkout creation failed for registration {} on offering {}",
                    registrationId, offering.getOfferingId(), e);
            metricsService.recordCheckoutFailure();
            throw new EnrollmentException(ErrorCode.CHECKOUT_CREATION_FAILED, ErrorCode.CHECKOUT_CREATION_FAILED.getMessage(), e)
                    .withDetail("registrationId", registrationId);
        }

        Registration attached = transactionTemplate.execute(status -> attachSession(registrationId, session));
        return RegistrationResult.checkoutRequired(offering, attached != null ? attached : registration, session);
    }

    private Registration attachSession(String registrationId, CheckoutSession session) {
        Registration current = registrationRepository.findById(registrationId).orElse(null);
        if (current == null || current.getStatus() != RegistrationStatus.PENDING_PAYMENT) {
            logger.warn("Registration {} is no longer pending; checkout session {} not attached",
                    registrationId, session.getSessionId());
            return current;
        }
        current.setCheckoutSessionId(session.getSessionId());
        current.setCheckoutUrl(session.getRedirectUrl());
        current.setPaymentStatus(PaymentStatus.PENDING);
        logger.info("Attached checkout session {} to registration {}", session.getSessionId(), registrationId);
        return registrationRepository.save(current);
    }
}
