package com.cred.freestyle.enrollment.repository;

import com.cred.freestyle.enrollment.domain.model.Registration;
import com.cred.freestyle.enrollment.domain.model.Registration.RegistrationStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Registration entity.
 *
 * @author Enrollment Team
 */
@Repository
public interface RegistrationRepository extends JpaRepository<Registration, String> {

    /**
     * Find the live registration holding the given live key.
     * Only live registrations carry the bare {offering_id}:{subject_id} key.
     *
     * @param liveKey Key built by {@link Registration#liveKeyFor(String, String)}
     * @return Optional containing the live registration
     */
    Optional<Registration> findByLiveKey(String liveKey);

    /**
     * Find the subject's most recent registration for an offering, in any status.
     */
    Optional<Registration> findFirstByOfferingIdAndSubjectIdOrderByRegisteredAtDesc(
            String offeringId,
            String subjectId
    );

    /**
     * Resolve the offering of a registration without loading the entity,
     * so the offering lock can be taken before the row is read.
     */
    @Query("SELECT r.offeringId FROM Registration r WHERE r.registrationId = :registrationId")
    Optional<String> findOfferingIdByRegistrationId(@Param("registrationId") String registrationId);

    /**
     * Attendee list: confirmed registrations in confirmation order.
     */
    List<Registration> findByOfferingIdAndStatusOrderByConfirmedAtAsc(String offeringId, RegistrationStatus status);

    List<Registration> findByOfferingIdAndStatusOrderByRegisteredAtAsc(
            String offeringId,
            RegistrationStatus status
    );

    List<Registration> findByOfferingIdAndStatusIn(
            String offeringId,
            Collection<RegistrationStatus> statuses
    );

    long countByOfferingIdAndStatus(String offeringId, RegistrationStatus status);

    /**
     * Find registrations in a status created before the cutoff.
     * Used by the stale pending-payment sweep.
     *
     * @param status Registration status, normally PENDING_PAYMENT
     * @param cutoff Registrations created before this time qualify
     * @return Registration IDs
     */
    @Query("SELECT r.registrationId FROM Registration r WHERE r.status = :status " +
           "AND r.registeredAt < :cutoff ORDER BY r.registeredAt ASC")
    List<String> findIdsByStatusRegisteredBefore(
            @Param("status") RegistrationStatus status,
            @Param("cutoff") Instant cutoff
    );
}
