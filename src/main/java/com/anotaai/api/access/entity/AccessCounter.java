package com.anotaai.api.access.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/**
 * The one counter row. Always id = {@link #SINGLETON_ID}; written only through the native upserts
 * in the repository, so no JPA lifecycle callbacks here.
 */
@Getter
@Setter
@Entity
@Table(name = "access_counter")
public class AccessCounter {

    public static final long SINGLETON_ID = 1L;

    @Id
    private Long id;

    @Column(name = "access_count", nullable = false)
    private long count;

    @Column(name = "last_updated", nullable = false)
    private Instant lastUpdated;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
