package com.ai.leasing.repository;

import com.ai.leasing.conversation.LeadStage;
import com.ai.leasing.entity.Lead;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface LeadRepository extends JpaRepository<Lead, Long> {

    Optional<Lead> findByPhoneNumber(String phoneNumber);

    @Query("SELECT l FROM Lead l WHERE l.stage IN :stages AND l.lastInteraction < :cutoff ORDER BY l.lastInteraction ASC")
    List<Lead> findInactiveSince(@Param("stages") Collection<LeadStage> stages, @Param("cutoff") Instant cutoff);

    long countByCreatedAtGreaterThanEqualAndCreatedAtLessThan(Instant from, Instant to);

    long countByQualifiedAtGreaterThanEqualAndQualifiedAtLessThan(Instant from, Instant to);
}
