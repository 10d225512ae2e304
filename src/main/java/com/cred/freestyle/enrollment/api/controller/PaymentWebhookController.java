package com.cred.freestyle.enrollment.api.controller;

import com.cred.freestyle.enrollment.api.dto.PaymentCallbackRequest;
import com.cred.freestyle.enrollment.api.dto.PaymentCallbackResponse;
import com.cred.freestyle.enrollment.domain.model.Registration;
import com.cred.freestyle.enrollment.exception.EnrollmentException;
import com.cred.freestyle.enrollment.exception.ErrorCode;
import com.cred.freestyle.enrollment.service.RegistrationService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Payment provider callbacks.
 *
 * Providers redeliver callbacks until they get a 2xx, so a callback for a
 * registration that is no longer pending is acknowledged as "ignored"
 * instead of being reported as an error.
 *
 * @author Enrollment Team
 */
@RestController
@RequestMapping("/internal/payments")
public class PaymentWebhookController {

    private static final Logger logger = LoggerFactory.getLogger(PaymentWebhookController.class);

    private static final String PROCESSED = "processed";
    private static final String IGNORED = "ignored";

    private final RegistrationService registrationService;

    public PaymentWebhookController(RegistrationService registrationService) {
        this.registrationService = registrationService;
    }

    @PostMapping("/succeeded")
    @PreAuthorize("hasAnyRole('PAYMENT_PROVIDER', 'ADMIN')")
    public ResponseEntity<PaymentCallbackResponse> paymentSucceeded(
            @Valid @RequestBody PaymentCallbackRequest request
    ) {
        logger.info("Payment succeeded callback - registration: {}, reference: {}",
                request.getRegistrationId(), request.getPaymentReference());
        try {
            Registration registration = registrationService.confirmPayment(
                    request.getRegistrationId(), request.getPaymentReference());
            return ResponseEntity.ok(new PaymentCallbackResponse(
                    registration.getRegistrationId(), PROCESSED, registration.getStatus().name()));
        } catch (EnrollmentException e) {
            return acknowledgeIfNotPending(request, e);
        }
    }

    @PostMapping("/failed")
    @PreAuthorize("hasAnyRole('PAYMENT_PROVIDER', 'ADMIN')")
    public ResponseEntity<PaymentCallbackResponse> paymentFailed(
            @Valid @RequestBody PaymentCallbackRequest request
    ) {
        logger.info("Payment failed callback - registration: {}", request.getRegistrationId());
        try {
            Registration registration = registrationService.recordPaymentFailure(request.getRegistrationId());
            return ResponseEntity.ok(new PaymentCallbackResponse(
                    registration.getRegistrationId(), PROCESSED, registration.getStatus().name()));
        } catch (EnrollmentException e) {
            return acknowledgeIfNotPending(request, e);
        }
    }

    private ResponseEntity<PaymentCallbackResponse> acknowledgeIfNotPending(
            PaymentCallbackRequest request,
            EnrollmentException e
    ) {
        if (e.getErrorCode() != ErrorCode.REGISTRATION_NOT_PENDING) {
            throw e;
        }
        Object status = e.getDetails().get("status");
        logger.info("Ignoring callback for registration {} no longer pending ({})",
                request.getRegistrationId(), status);
        return ResponseEntity.ok(new PaymentCallbackResponse(
                request.getRegistrationId(), IGNORED, status != null ? status.toString() : null));
    }
}
