package com.ai.leasing.repository;

import com.ai.leasing.entity.Unit;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;

@Repository
public interface UnitRepository extends JpaRepository<Unit, Long> {

    /** Units in the given status with their property loaded, for matching outside the session. */
    @Query("SELECT u FROM Unit u JOIN FETCH u.property WHERE u.status = :status ORDER BY u.id")
    List<Unit> findSnapshotByStatus(@Param("status") Unit.Status status);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT u FROM Unit u WHERE u.id = :id")
    Optional<Unit> findByIdForUpdate(@Param("id") Long id);
}
