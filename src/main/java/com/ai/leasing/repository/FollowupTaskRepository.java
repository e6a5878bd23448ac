package com.ai.leasing.repository;

import com.ai.leasing.entity.FollowupMessageType;
import com.ai.leasing.entity.FollowupTask;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface FollowupTaskRepository extends JpaRepository<FollowupTask, Long> {

    boolean existsByLead_IdAndAppointment_IdAndMessageTypeAndStatus(
            Long leadId, Long appointmentId, FollowupMessageType messageType, FollowupTask.Status status);

    boolean existsByLead_IdAndAppointmentIsNullAndMessageTypeAndStatus(
            Long leadId, FollowupMessageType messageType, FollowupTask.Status status);

    boolean existsByLead_IdAndMessageTypeAndCreatedAtAfter(
            Long leadId, FollowupMessageType messageType, Instant after);

    @Query("SELECT f.id FROM FollowupTask f WHERE f.status = :status AND f.sendAt <= :now "
            + "AND (f.nextAttemptAt IS NULL OR f.nextAttemptAt <= :now) ORDER BY f.sendAt ASC, f.id ASC")
    List<Long> findDueIds(@Param("status") FollowupTask.Status status,
                          @Param("now") Instant now,
                          Pageable page);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT f FROM FollowupTask f WHERE f.id = :id")
    Optional<FollowupTask> findByIdForUpdate(@Param("id") Long id);

    /** Only rows still pending are touched, so a task already sent keeps its status. */
    @Modifying(flushAutomatically = true)
    @Query("UPDATE FollowupTask f SET f.status = :to WHERE f.appointment.id = :appointmentId AND f.status = :from")
    int transitionForAppointment(@Param("appointmentId") Long appointmentId,
                                 @Param("from") FollowupTask.Status from,
                                 @Param("to") FollowupTask.Status to);

    @Modifying(flushAutomatically = true)
    @Query("UPDATE FollowupTask f SET f.status = :to WHERE f.lead.id = :leadId "
            + "AND f.messageType = :type AND f.status = :from")
    int transitionForLead(@Param("leadId") Long leadId,
                          @Param("type") FollowupMessageType type,
                          @Param("from") FollowupTask.Status from,
                          @Param("to") FollowupTask.Status to);
}
