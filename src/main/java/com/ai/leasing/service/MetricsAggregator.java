package com.ai.leasing.service;

import com.ai.leasing.dto.MetricsSummary;
import com.ai.leasing.entity.DailyMetric;
import com.ai.leasing.repository.AppointmentRepository;
import com.ai.leasing.repository.DailyMetricRepository;
import com.ai.leasing.repository.LeadRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;

/**
 * Daily funnel counts. Day boundaries are local midnight in the operator's zone.
 */
@Service
public class MetricsAggregator {

    private static final Logger log = LoggerFactory.getLogger(MetricsAggregator.class);

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    static final int MAX_RECENT_DAYS = 90;

    private final LeadRepository leadRepository;
    private final AppointmentRepository appointmentRepository;
    private final DailyMetricRepository metricRepository;
    private final TransactionTemplate rollupTransaction;
    private final Clock clock;

    public MetricsAggregator(LeadRepository leadRepository,
                             AppointmentRepository appointmentRepository,
                             DailyMetricRepository metricRepository,
                             PlatformTransactionManager transactionManager,
                             Clock clock) {
        this.leadRepository = leadRepository;
        this.appointmentRepository = appointmentRepository;
        this.metricRepository = metricRepository;
        this.rollupTransaction = new TransactionTemplate(transactionManager);
        this.rollupTransaction.setIsolationLevel(TransactionDefinition.ISOLATION_REPEATABLE_READ);
        this.clock = clock;
    }

    /**
     * Recomputes the row for {@code date} from scratch. Running it again for the same date
     * overwrites the same row. When another rollup inserts the row first, the computation is
     * repeated once in a new transaction and updates that row.
     */
    public DailyMetric rollup(LocalDate date) {
        try {
            return rollupTransaction.execute(status -> computeAndSave(date));
        } catch (DataIntegrityViolationException e) {
            log.info("Metrics row for {} was created concurrently, updating it instead", date);
            return rollupTransaction.execute(status -> computeAndSave(date));
        }
    }

    @Transactional(readOnly = true)
    public Optional<DailyMetric> find(LocalDate date) {
        return metricRepository.findByDate(date);
    }

    /**
     * Rows of the last {@code days} local days, today included, with their totals.
     * Days without a rollup are absent from the list.
     */
    @Transactional(readOnly = true)
    public MetricsSummary recent(int days) {
        if (days < 1 || days > MAX_RECENT_DAYS) {
            throw new IllegalArgumentException("days must be between 1 and " + MAX_RECENT_DAYS);
        }
        LocalDate to = LocalDate.now(clock);
        LocalDate from = to.minusDays(days - 1L);
        List<DailyMetric> rows = metricRepository.findByDateBetweenOrderByDateAsc(from, to);
        return MetricsSummary.of(from, to, rows, clock.instant());
    }

    private DailyMetric computeAndSave(LocalDate date) {
        ZoneId zone = clock.getZone();
        Instant from = date.atStartOfDay(zone).toInstant();
        Instant to = date.plusDays(1).atStartOfDay(zone).toInstant();

        int inquiries = Math.toIntExact(leadRepository.countByCreatedAtGreaterThanEqualAndCreatedAtLessThan(from, to));
        int qualified = Math.toIntExact(leadRepository.countByQualifiedAtGreaterThanEqualAndQualifiedAtLessThan(from, to));
        int scheduled = Math.toIntExact(appointmentRepository.countByCreatedAtGreaterThanEqualAndCreatedAtLessThan(from, to));
        int completed = Math.toIntExact(appointmentRepository.countByCompletedAtGreaterThanEqualAndCompletedAtLessThan(from, to));

        Instant now = clock.instant();
        DailyMetric metric = metricRepository.findByDate(date)
                .orElseGet(() -> DailyMetric.builder().date(date).createdAt(now).build());
        metric.setTotalInquiries(inquiries);
        metric.setQualifiedLeads(qualified);
        metric.setToursScheduled(scheduled);
        metric.setToursCompleted(completed);
        metric.setConversionRateQualified(percentage(qualified, inquiries));
        metric.setConversionRateTours(percentage(scheduled, qualified));
        metric.setUpdatedAt(now);
        DailyMetric saved = metricRepository.saveAndFlush(metric);

        log.info("Metrics for {}: inquiries={} qualified={} toursScheduled={} toursCompleted={}",
                date, inquiries, qualified, scheduled, completed);
        return saved;
    }

    /** Percentage with two decimals; zero when there is nothing to divide by. */
    static BigDecimal percentage(int numerator, int denominator) {
        if (denominator == 0) {
            return BigDecimal.ZERO.setScale(2);
        }
        return BigDecimal.valueOf(numerator)
                .multiply(HUNDRED)
                .divide(BigDecimal.valueOf(denominator), 2, RoundingMode.HALF_UP);
    }
}
