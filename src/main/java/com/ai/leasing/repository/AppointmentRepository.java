package com.ai.leasing.repository;

import com.ai.leasing.entity.Appointment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface AppointmentRepository extends JpaRepository<Appointment, Long> {

    Optional<Appointment> findFirstByLead_IdAndStatusOrderByIdDesc(Long leadId, Appointment.Status status);

    Optional<Appointment> findByExternalEventId(String externalEventId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM Appointment a WHERE a.id = :id")
    Optional<Appointment> findByIdForUpdate(@Param("id") Long id);

    /** Tours of other leads on the unit that start before {@code end}; callers check the actual overlap. */
    @Query("SELECT a FROM Appointment a WHERE a.unit.id = :unitId AND a.status = :status "
            + "AND a.lead.id <> :leadId AND a.scheduledTime < :end")
    List<Appointment> findUnitToursStartingBefore(@Param("unitId") Long unitId,
                                                  @Param("leadId") Long leadId,
                                                  @Param("status") Appointment.Status status,
                                                  @Param("end") Instant end);

    @Query("SELECT a.lead.phoneNumber FROM Appointment a WHERE a.id = :id")
    Optional<String> findLeadPhoneByAppointmentId(@Param("id") Long id);

    long countByCreatedAtGreaterThanEqualAndCreatedAtLessThan(Instant from, Instant to);

    long countByCompletedAtGreaterThanEqualAndCompletedAtLessThan(Instant from, Instant to);
}
