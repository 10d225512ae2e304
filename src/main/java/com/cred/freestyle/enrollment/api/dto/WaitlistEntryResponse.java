package com.cred.freestyle.enrollment.api.dto;

import com.cred.freestyle.enrollment.domain.model.WaitlistEntry;

import java.time.Instant;

/**
 * Response DTO for a waitlist entry. Position is only meaningful while the
 * entry is WAITING or OFFERED.
 *
 * @author Enrollment Team
 */
public class WaitlistEntryResponse {

    private String entryId;
    private String offeringId;
    private String subjectId;
    private Integer position;
    private String status;
    private Instant joinedAt;
    private Instant offeredAt;
    private Instant responseDeadline;

    public WaitlistEntryResponse() {
    }

    public static WaitlistEntryResponse fromEntity(WaitlistEntry entry) {
        WaitlistEntryResponse response = new WaitlistEntryResponse();
        response.setEntryId(entry.getEntryId());
        response.setOfferingId(entry.getOfferingId());
        response.setSubjectId(entry.getSubjectId());
        response.setPosition(entry.isLive() ? entry.getPosition() : null);
        response.setStatus(entry.getStatus().name());
        response.setJoinedAt(entry.getJoinedAt());
        response.setOfferedAt(entry.getOfferedAt());
        response.setResponseDeadline(entry.getResponseDeadline());
        return response;
    }

    // Getters and setters
    public String getEntryId() {
        return entryId;
    }

    public void setEntryId(String entryId) {
        this.entryId = entryId;
    }

    public String getOfferingId() {
        return offeringId;
    }

    public void setOfferingId(String offeringId) {
        this.offeringId = offeringId;
    }

    public String getSubjectId() {
        return subjectId;
    }

    public void setSubjectId(String subjectId) {
        this.subjectId = subjectId;
    }

    public Integer getPosition() {
        return position;
    }

    public void setPosition(Integer position) {
        this.position = position;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public Instant getJoinedAt() {
        return joinedAt;
    }

    public void setJoinedAt(Instant joinedAt) {
        this.joinedAt = joinedAt;
    }

    public Instant getOfferedAt() {
        return offeredAt;
    }

    public void setOfferedAt(Instant offeredAt) {
        this.offeredAt = offeredAt;
    }

    public Instant getResponseDeadline() {
        return responseDeadline;
    }

    public void setResponseDeadline(Instant responseDeadline) {
        this.responseDeadline = responseDeadline;
    }
}
