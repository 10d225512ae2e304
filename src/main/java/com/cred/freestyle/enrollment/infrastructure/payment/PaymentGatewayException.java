package com.cred.freestyle.enrollment.infrastructure.payment;

/**
 * Thrown when the payment provider cannot create a checkout session.
 *
 * @author Enrollment Team
 */
public class PaymentGatewayException extends RuntimeException {

    public PaymentGatewayException(String message) {
        super(message);
    }

    public PaymentGatewayException(String message, Throwable cause) {
        super(message, cause);
    }
}
