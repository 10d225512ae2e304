package com.cred.freestyle.enrollment.infrastructure.payment;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * In-process payment gateway for non-production profiles.
 *
 * Simulation rules:
 * - Amount missing or not positive: rejected with PaymentGatewayException
 * - Otherwise: a session with a generated ID and a redirect URL under the configured base
 *
 * Payment outcomes are not simulated here. Tests and local runs drive them
 * through the payment callback endpoints.
 *
 * @author Enrollment Team
 */
@Service
@Profile("!prod")
public class MockPaymentGateway implements PaymentGateway {

    private static final Logger logger = LoggerFactory.getLogger(MockPaymentGateway.class);

    private final String checkoutBaseUrl;

    public MockPaymentGateway(
            @Value("${enrollment.payment.mock-checkout-base-url:https://checkout.example.test/session/}") String checkoutBaseUrl
    ) {
        this.checkoutBaseUrl = checkoutBaseUrl;
    }

    @Override
    public CheckoutSession createCheckout(CheckoutRequest request) {
        BigDecimal amount = request.getAmount();
        if (amount == null || amount.signum() <= 0) {
            logger.warn("Mock gateway rejecting checkout for registration {}: invalid amount {}",
                    request.getRegistrationId(), amount);
            throw new PaymentGatewayException("Invalid checkout amount: " + amount);
        }

        String sessionId = "cs_mock_" + UUID.randomUUID().toString().replace("-", "").substring(0, 16);
        logger.info("Mock gateway created checkout session {} for registration {} ({} {})",
                sessionId, request.getRegistrationId(), amount, request.getCurrency());

        return new CheckoutSession(sessionId, checkoutBaseUrl + sessionId);
    }
}
