package com.cred.freestyle.enrollment.infrastructure.payment;

/**
 * Payment provider abstraction used to start checkout for paid offerings.
 *
 * Implementations talk to an external provider and are always called outside
 * any database transaction. The provider later reports the outcome through
 * the payment callback endpoints.
 *
 * Current implementations:
 * - MockPaymentGateway: Non-production stand-in that never leaves the process
 *
 * @author Enrollment Team
 */
public interface PaymentGateway {

    /**
     * Create a hosted checkout session.
     *
     * @param request Amount, currency, contact and the registration reference
     * @return Session ID and redirect URL
     * @throws PaymentGatewayException if the provider rejects the request or is unreachable
     */
    CheckoutSession createCheckout(CheckoutRequest request);
}
