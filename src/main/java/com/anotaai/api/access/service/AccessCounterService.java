package com.anotaai.api.access.service;

import com.anotaai.api.access.dto.AccessDtos;
import com.anotaai.api.access.entity.AccessCounter;
import com.anotaai.api.access.repo.AccessCounterRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Counter operations. Every mutation is one native upsert statement; the row is read back
 * inside the same transaction, so the value returned is the one this call produced.
 */
@Slf4j
@Service
public class AccessCounterService {

    private static final long ID = AccessCounter.SINGLETON_ID;

    private final AccessCounterRepository repo;
    private final Clock clock;

    public AccessCounterService(AccessCounterRepository repo, Clock clock) {
        this.repo = repo;
        this.clock = clock;
    }

    @Transactional
    public AccessDtos.CounterDto increment() {
        repo.upsertIncrement(ID, clock.instant());
        AccessCounter row = readBack();
        log.info("counter_incremented count={}", row.getCount());
        return toDto(row);
    }

    /** Never creates the row: an uninitialized counter reads as zero. */
    @Transactional(readOnly = true)
    public AccessDtos.CounterDto currentCount() {
        return repo.findById(ID)
                .map(AccessCounterService::toDto)
                .orElseGet(() -> new AccessDtos.CounterDto(0L, clock.instant()));
    }

    @Transactional
    public AccessDtos.CounterDto reset() {
        repo.upsertReset(ID, clock.instant());
        AccessCounter row = readBack();
        log.warn("counter_reset count={}", row.getCount());
        return toDto(row);
    }

    @Transactional(readOnly = true)
    public AccessDtos.CounterStatisticsDto statistics() {
        Optional<AccessCounter> found = repo.findById(ID);
        if (found.isEmpty()) {
            return new AccessDtos.CounterStatisticsDto(0L, clock.instant(), null, null);
        }

        AccessCounter row = found.get();
        Double average = null;
        if (row.getCreatedAt() != null) {
            long days = Duration.between(row.getCreatedAt(), clock.instant()).toDays();
            average = (double) row.getCount() / Math.max(1L, days);
        }
        return new AccessDtos.CounterStatisticsDto(row.getCount(), row.getLastUpdated(), average, row.getCreatedAt());
    }

    /**
     * false when more than one row exists or the count went negative.
     * Store failures are reported as false as well, so no surrounding transaction:
     * a failing statement would leave it rollback-only and the commit would throw.
     */
    public boolean validateIntegrity() {
        try {
            long rows = repo.count();
            if (rows > 1) {
                log.error("counter_integrity_failed reason=multiple_rows rows={}", rows);
                return false;
            }
            Optional<AccessCounter> row = repo.findById(ID);
            if (row.isPresent() && row.get().getCount() < 0) {
                log.error("counter_integrity_failed reason=negative_count count={}", row.get().getCount());
                return false;
            }
            return true;
        } catch (RuntimeException e) {
            log.error("counter_integrity_check_error err={}", e.toString(), e);
            return false;
        }
    }

    private AccessCounter readBack() {
        return repo.findById(ID)
                .orElseThrow(() -> new CounterStateException("Counter in inconsistent state"));
    }

    private static AccessDtos.CounterDto toDto(AccessCounter row) {
        return new AccessDtos.CounterDto(row.getCount(), row.getLastUpdated());
    }
}
