package com.cred.freestyle.enrollment.repository;

import com.cred.freestyle.enrollment.domain.model.WaitlistEntry;
import com.cred.freestyle.enrollment.domain.model.WaitlistEntry.WaitlistStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for WaitlistEntry entity.
 *
 * @author Enrollment Team
 */
@Repository
public interface WaitlistEntryRepository extends JpaRepository<WaitlistEntry, String> {

    Optional<WaitlistEntry> findByLiveKey(String liveKey);

    Optional<WaitlistEntry> findFirstByOfferingIdAndSubjectIdOrderByJoinedAtDesc(
            String offeringId,
            String subjectId
    );

    @Query("SELECT w.offeringId FROM WaitlistEntry w WHERE w.entryId = :entryId")
    Optional<String> findOfferingIdByEntryId(@Param("entryId") String entryId);

    /**
     * Highest position among the given statuses, or null when there is none.
     *
     * @param offeringId Offering ID
     * @param statuses Live statuses
     * @return Max position or null
     */
    @Query("SELECT MAX(w.position) FROM WaitlistEntry w WHERE w.offeringId = :offeringId " +
           "AND w.status IN :statuses")
    Integer findMaxPosition(
            @Param("offeringId") String offeringId,
            @Param("statuses") Collection<WaitlistStatus> statuses
    );

    Optional<WaitlistEntry> findFirstByOfferingIdAndStatusOrderByPositionAsc(
            String offeringId,
            WaitlistStatus status
    );

    List<WaitlistEntry> findByOfferingIdAndStatusInOrderByPositionAsc(
            String offeringId,
            Collection<WaitlistStatus> statuses
    );

    List<WaitlistEntry> findByOfferingIdAndStatusInAndPositionGreaterThanOrderByPositionAsc(
            String offeringId,
            Collection<WaitlistStatus> statuses,
            Integer position
    );

    long countByOfferingIdAndStatus(String offeringId, WaitlistStatus status);

    /**
     * Find entries in a status whose response deadline is before now.
     * Used by the stale-offer sweep.
     */
    @Query("SELECT w.entryId FROM WaitlistEntry w WHERE w.status = :status " +
           "AND w.responseDeadline < :now ORDER BY w.responseDeadline ASC")
    List<String> findIdsByStatusDeadlineBefore(
            @Param("status") WaitlistStatus status,
            @Param("now") Instant now
    );
}
