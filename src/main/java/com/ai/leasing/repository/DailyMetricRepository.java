package com.ai.leasing.repository;

import com.ai.leasing.entity.DailyMetric;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface DailyMetricRepository extends JpaRepository<DailyMetric, Long> {

    Optional<DailyMetric> findByDate(LocalDate date);

    List<DailyMetric> findByDateBetweenOrderByDateAsc(LocalDate from, LocalDate to);
}
