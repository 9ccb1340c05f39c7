package com.anotaai.api.access;

import com.anotaai.api.access.dto.AccessDtos;
import com.anotaai.api.access.entity.AccessCounter;
import com.anotaai.api.access.repo.AccessCounterRepository;
import com.anotaai.api.access.service.AccessCounterService;
import com.anotaai.api.access.service.CounterStateException;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;

class AccessCounterServiceUnitTest {

    private static final Instant NOW = Instant.parse("2026-03-15T12:00:00Z");
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    private static AccessCounter row(long count, Instant createdAt) {
        AccessCounter c = new AccessCounter();
        c.setId(AccessCounter.SINGLETON_ID);
        c.setCount(count);
        c.setCreatedAt(createdAt);
        c.setLastUpdated(NOW.minusSeconds(60));
        return c;
    }

    @Test
    void average_uses_whole_days_since_creation() {
        AccessCounterRepository repo = Mockito.mock(AccessCounterRepository.class);
        // 10 days and 5 hours -> 10 whole days
        Mockito.when(repo.findById(AccessCounter.SINGLETON_ID))
                .thenReturn(Optional.of(row(50, NOW.minus(Duration.ofDays(10).plusHours(5)))));

        AccessDtos.CounterStatisticsDto s = new AccessCounterService(repo, clock).statistics();

        assertEquals(50L, s.count());
        assertEquals(5.0, s.averageAccessesPerDay());
    }

    @Test
    void average_never_divides_by_less_than_one_day() {
        AccessCounterRepository repo = Mockito.mock(AccessCounterRepository.class);
        Mockito.when(repo.findById(AccessCounter.SINGLETON_ID))
                .thenReturn(Optional.of(row(7, NOW.minus(Duration.ofHours(2)))));

        AccessDtos.CounterStatisticsDto s = new AccessCounterService(repo, clock).statistics();

        assertEquals(7.0, s.averageAccessesPerDay());
    }

    @Test
    void current_count_without_record_reports_now() {
        AccessCounterRepository repo = Mockito.mock(AccessCounterRepository.class);
        Mockito.when(repo.findById(anyLong())).thenReturn(Optional.empty());

        AccessDtos.CounterDto r = new AccessCounterService(repo, clock).currentCount();

        assertEquals(0L, r.count());
        assertEquals(NOW, r.lastUpdated());
        Mockito.verify(repo, Mockito.never()).upsertIncrement(anyLong(), any());
        Mockito.verify(repo, Mockito.never()).upsertReset(anyLong(), any());
    }

    @Test
    void increment_goes_through_the_upsert_with_the_clock_time() {
        AccessCounterRepository repo = Mockito.mock(AccessCounterRepository.class);
        Mockito.when(repo.upsertIncrement(AccessCounter.SINGLETON_ID, NOW)).thenReturn(1);
        Mockito.when(repo.findById(AccessCounter.SINGLETON_ID)).thenReturn(Optional.of(row(4, NOW)));

        AccessDtos.CounterDto r = new AccessCounterService(repo, clock).increment();

        assertEquals(4L, r.count());
        Mockito.verify(repo).upsertIncrement(AccessCounter.SINGLETON_ID, NOW);
        Mockito.verify(repo, Mockito.never()).save(any());
    }

    @Test
    void increment_with_missing_row_after_upsert_is_an_inconsistent_state() {
        AccessCounterRepository repo = Mockito.mock(AccessCounterRepository.class);
        Mockito.when(repo.findById(anyLong())).thenReturn(Optional.empty());

        CounterStateException ex = assertThrows(CounterStateException.class,
                () -> new AccessCounterService(repo, clock).increment());
        assertEquals("Counter in inconsistent state", ex.getMessage());
    }

    @Test
    void integrity_fails_with_more_than_one_row() {
        AccessCounterRepository repo = Mockito.mock(AccessCounterRepository.class);
        Mockito.when(repo.count()).thenReturn(2L);

        assertFalse(new AccessCounterService(repo, clock).validateIntegrity());
    }

    @Test
    void integrity_check_store_failure_reads_as_false() {
        AccessCounterRepository repo = Mockito.mock(AccessCounterRepository.class);
        Mockito.when(repo.count()).thenThrow(new DataAccessResourceFailureException("down"));

        assertFalse(new AccessCounterService(repo, clock).validateIntegrity());
    }
}
