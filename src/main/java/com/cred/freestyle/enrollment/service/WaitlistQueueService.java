package com.cred.freestyle.enrollment.service;

import com.cred.freestyle.enrollment.domain.model.Offering;
import com.cred.freestyle.enrollment.domain.model.WaitlistEntry;
import com.cred.freestyle.enrollment.domain.model.WaitlistEntry.WaitlistStatus;
import com.cred.freestyle.enrollment.exception.EnrollmentException;
import com.cred.freestyle.enrollment.exception.ErrorCode;
import com.cred.freestyle.enrollment.repository.WaitlistEntryRepository;
import com.cred.freestyle.enrollment.security.SubjectContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Position bookkeeping for an offering's waitlist.
 *
 * Live entries (WAITING or OFFERED) always hold positions 1..N without gaps:
 * new entries go to N+1 and every removal shifts the entries behind it up by one.
 * Callers hold the offering row lock and run inside a transaction.
 *
 * @author Enrollment Team
 */
@Service
public class WaitlistQueueService {

    private static final Logger logger = LoggerFactory.getLogger(WaitlistQueueService.class);

    static final Set<WaitlistStatus> LIVE_STATUSES = EnumSet.of(WaitlistStatus.WAITING, WaitlistStatus.OFFERED);

    private final WaitlistEntryRepository waitlistEntryRepository;

    public WaitlistQueueService(WaitlistEntryRepository waitlistEntryRepository) {
        this.waitlistEntryRepository = waitlistEntryRepository;
    }

    /**
     * Append a WAITING entry at the end of the queue.
     *
     * @param offering Locked offering
     * @param subject Subject joining the queue
     * @param now Current time
     * @return Persisted entry
     * @throws EnrollmentException ALREADY_WAITLISTED if a live entry slipped in concurrently
     */
    public WaitlistEntry enqueue(Offering offering, SubjectContext subject, Instant now) {
        Integer maxPosition = waitlistEntryRepository.findMaxPosition(offering.getOfferingId(), LIVE_STATUSES);
        int position = maxPosition == null ? 1 : maxPosition + 1;

        WaitlistEntry entry = WaitlistEntry.builder()
                .offeringId(offering.getOfferingId())
                .subjectId(subject.getSubjectId())
                .contactEmail(subject.getEmail())
                .position(position)
                .status(WaitlistStatus.WAITING)
                .joinedAt(now)
                .build();

        try {
            entry = waitlistEntryRepository.saveAndFlush(entry);
        } catch (DataIntegrityViolationException e) {
            logger.warn("Live waitlist entry already exists for subject {} on offering {}",
                    subject.getSubjectId(), offering.getOfferingId());
            throw new EnrollmentException(ErrorCode.ALREADY_WAITLISTED)
                    .withDetail("offeringId", offering.getOfferingId());
        }

        logger.info("Subject {} joined waitlist of offering {} at position {}",
                subject.getSubjectId(), offering.getOfferingId(), position);
        return entry;
    }

    /**
     * Close the gap left by an entry that has just left the live set.
     * The entry's own status change must already be applied.
     *
     * @param removed Entry that became terminal
     * @return Number of entries shifted
     */
    public int closeGap(WaitlistEntry removed) {
        List<WaitlistEntry> behind = waitlistEntryRepository
                .findByOfferingIdAndStatusInAndPositionGreaterThanOrderByPositionAsc(
                        removed.getOfferingId(), LIVE_STATUSES, removed.getPosition());

        for (WaitlistEntry entry : behind) {
            entry.setPosition(entry.getPosition() - 1);
        }
        waitlistEntryRepository.saveAll(behind);

        if (!behind.isEmpty()) {
            logger.debug("Shifted {} waitlist entries behind position {} on offering {}",
                    behind.size(), removed.getPosition(), removed.getOfferingId());
        }
        return behind.size();
    }

    /**
     * @return Live entries of an offering in queue order
     */
    public List<WaitlistEntry> liveEntries(String offeringId) {
        return waitlistEntryRepository.findByOfferingIdAndStatusInOrderByPositionAsc(offeringId, LIVE_STATUSES);
    }

    public long outstandingOffers(String offeringId) {
        return waitlistEntryRepository.countByOfferingIdAndStatus(offeringId, WaitlistStatus.OFFERED);
    }
}
