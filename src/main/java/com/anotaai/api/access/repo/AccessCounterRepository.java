package com.anotaai.api.access.repo;

import com.anotaai.api.access.entity.AccessCounter;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;

public interface AccessCounterRepository extends JpaRepository<AccessCounter, Long> {

    /** row absent: insert with count 1; present: count + 1 in the same statement */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(
            value = """
        INSERT INTO access_counter(id, access_count, last_updated, created_at)
        VALUES (:id, 1, :now, :now)
        ON DUPLICATE KEY UPDATE
            access_count = access_count + 1,
            last_updated = :now
        """,
            nativeQuery = true
    )
    int upsertIncrement(@Param("id") long id, @Param("now") Instant now);

    /** row absent: insert with count 0; present: count back to 0 */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(
            value = """
        INSERT INTO access_counter(id, access_count, last_updated, created_at)
        VALUES (:id, 0, :now, :now)
        ON DUPLICATE KEY UPDATE
            access_count = 0,
            last_updated = :now
        """,
            nativeQuery = true
    )
    int upsertReset(@Param("id") long id, @Param("now") Instant now);
}
