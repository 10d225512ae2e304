package com.cred.freestyle.enrollment.service;

import com.cred.freestyle.enrollment.domain.model.Offering;

import java.time.Instant;

/**
 * Read-only snapshot of an offering's seat and waitlist state.
 *
 * @author Enrollment Team
 */
public class OfferingAvailability {

    private final Offering offering;
    private final long outstandingOffers;
    private final int waitlistLength;
    private final boolean registrationOpen;

    public OfferingAvailability(Offering offering, long outstandingOffers, int waitlistLength, Instant now) {
        this.offering = offering;
        this.outstandingOffers = outstandingOffers;
        this.waitlistLength = waitlistLength;
        this.registrationOpen = offering.isOpen() && !offering.isDeadlinePassed(now);
    }

    public Offering getOffering() {
        return offering;
    }

    /**
     * Seats neither confirmed nor promised to an outstanding waitlist offer.
     */
    public long getUnclaimedSeats() {
        return Math.max(0, offering.getAvailableSeats() - outstandingOffers);
    }

    public long getOutstandingOffers() {
        return outstandingOffers;
    }

    public int getWaitlistLength() {
        return waitlistLength;
    }

    public boolean isRegistrationOpen() {
        return registrationOpen;
    }
}
