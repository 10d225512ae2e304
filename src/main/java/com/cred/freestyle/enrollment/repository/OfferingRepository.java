package com.cred.freestyle.enrollment.repository;

import com.cred.freestyle.enrollment.domain.model.Offering;
import com.cred.freestyle.enrollment.domain.model.Offering.OfferingStatus;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Offering entity.
 *
 * @author Enrollment Team
 */
@Repository
public interface OfferingRepository extends JpaRepository<Offering, String> {

    /**
     * Find offering by ID with a pessimistic write lock (SELECT ... FOR UPDATE).
     * Every mutation of an offering's registrations or waitlist starts here,
     * which serializes them per offering.
     *
     * @param offeringId Offering ID
     * @return Optional containing the locked offering
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints({@QueryHint(name = "jakarta.persistence.lock.timeout", value = "5000")})
    @Query("SELECT o FROM Offering o WHERE o.offeringId = :offeringId")
    Optional<Offering> findByIdForUpdate(@Param("offeringId") String offeringId);

    /**
     * Find offerings in a status whose end (or start, when no end is set) is before the given time.
     *
     * @param status Offering status, normally OPEN
     * @param now Current time
     * @return IDs of offerings due for closing
     */
    @Query("SELECT o.offeringId FROM Offering o WHERE o.status = :status " +
           "AND COALESCE(o.endsAt, o.startsAt) < :now")
    List<String> findIdsEndedBefore(
            @Param("status") OfferingStatus status,
            @Param("now") Instant now
    );

    /**
     * Find offerings in a status starting inside [from, to).
     * Used by the reminder sweep.
     */
    @Query("SELECT o FROM Offering o WHERE o.status = :status " +
           "AND o.startsAt >= :from AND o.startsAt < :to")
    List<Offering> findByStatusStartingBetween(
            @Param("status") OfferingStatus status,
            @Param("from") Instant from,
            @Param("to") Instant to
    );
}
