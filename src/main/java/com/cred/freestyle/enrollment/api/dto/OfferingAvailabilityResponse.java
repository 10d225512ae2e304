package com.cred.freestyle.enrollment.api.dto;

import com.cred.freestyle.enrollment.domain.model.Offering;
import com.cred.freestyle.enrollment.service.OfferingAvailability;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Response DTO for offering availability.
 *
 * @author Enrollment Team
 */
public class OfferingAvailabilityResponse {

    private String offeringId;
    private String title;
    private String status;
    private Instant startsAt;
    private Instant registrationDeadline;
    private Boolean free;
    private BigDecimal price;
    private String currency;
    private Integer capacity;
    private Integer confirmedSeats;
    private Long seatsLeft;
    private Long outstandingOffers;
    private Integer waitlistLength;
    private Boolean registrationOpen;

    public OfferingAvailabilityResponse() {
    }

    /**
     * Create response from an availability snapshot.
     * seatsLeft excludes seats already offered to the waitlist.
     */
    public static OfferingAvailabilityResponse fromAvailability(OfferingAvailability availability) {
        Offering offering = availability.getOffering();
        OfferingAvailabilityResponse response = new OfferingAvailabilityResponse();
        response.setOfferingId(offering.getOfferingId());
        response.setTitle(offering.getTitle());
        response.setStatus(offering.getStatus().name());
        response.setStartsAt(offering.getStartsAt());
        response.setRegistrationDeadline(offering.getRegistrationDeadline());
        response.setFree(!offering.isPaid());
        response.setPrice(offering.getPrice());
        response.setCurrency(offering.getCurrency());
        response.setCapacity(offering.getCapacity());
        response.setConfirmedSeats(offering.getConfirmedSeats());
        response.setSeatsLeft(availability.getUnclaimedSeats());
        response.setOutstandingOffers(availability.getOutstandingOffers());
        response.setWaitlistLength(availability.getWaitlistLength());
        response.setRegistrationOpen(availability.isRegistrationOpen());
        return response;
    }

    // Getters and setters
    public String getOfferingId() {
        return offeringId;
    }

    public void setOfferingId(String offeringId) {
        this.offeringId = offeringId;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public Instant getStartsAt() {
        return startsAt;
    }

    public void setStartsAt(Instant startsAt) {
        this.startsAt = startsAt;
    }

    public Instant getRegistrationDeadline() {
        return registrationDeadline;
    }

    public void setRegistrationDeadline(Instant registrationDeadline) {
        this.registrationDeadline = registrationDeadline;
    }

    public Boolean getFree() {
        return free;
    }

    public void setFree(Boolean free) {
        this.free = free;
    }

    public BigDecimal getPrice() {
        return price;
    }

    public void setPrice(BigDecimal price) {
        this.price = price;
    }

    public String getCurrency() {
        return currency;
    }

    public void setCurrency(String currency) {
        this.currency = currency;
    }

    public Integer getCapacity() {
        return capacity;
    }

    public void setCapacity(Integer capacity) {
        this.capacity = capacity;
    }

    public Integer getConfirmedSeats() {
        return confirmedSeats;
    }

    public void setConfirmedSeats(Integer confirmedSeats) {
        this.confirmedSeats = confirmedSeats;
    }

    public Long getSeatsLeft() {
        return seatsLeft;
    }

    public void setSeatsLeft(Long seatsLeft) {
        this.seatsLeft = seatsLeft;
    }

    public Long getOutstandingOffers() {
        return outstandingOffers;
    }

    public void setOutstandingOffers(Long outstandingOffers) {
        this.outstandingOffers = outstandingOffers;
    }

    public Integer getWaitlistLength() {
        return waitlistLength;
    }

    public void setWaitlistLength(Integer waitlistLength) {
        this.waitlistLength = waitlistLength;
    }

    public Boolean getRegistrationOpen() {
        return registrationOpen;
    }

    public void setRegistrationOpen(Boolean registrationOpen) {
        this.registrationOpen = registrationOpen;
    }
}
