package com.cred.freestyle.enrollment.api.dto;

import java.time.Instant;

/**
 * Result of an on-demand sweep run.
 *
 * @author Enrollment Team
 */
public class SweepRunResponse {

    private String sweep;
    private Integer processed;
    private Instant ranAt;

    public SweepRunResponse() {
    }

    public SweepRunResponse(String sweep, Integer processed, Instant ranAt) {
        this.sweep = sweep;
        this.processed = processed;
        this.ranAt = ranAt;
    }

    public String getSweep() {
        return sweep;
    }

    public void setSweep(String sweep) {
        this.sweep = sweep;
    }

    public Integer getProcessed() {
        return processed;
    }

    public void setProcessed(Integer processed) {
        this.processed = processed;
    }

    public Instant getRanAt() {
        return ranAt;
    }

    public void setRanAt(Instant ranAt) {
        this.ranAt = ranAt;
    }
}
