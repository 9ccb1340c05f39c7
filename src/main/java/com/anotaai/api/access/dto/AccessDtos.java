package com.anotaai.api.access.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

public class AccessDtos {

    public record CounterDto(long count, Instant lastUpdated) {}

    /** averageAccessesPerDay and createdAt only when a record exists */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record CounterStatisticsDto(
            long count,
            Instant lastUpdated,
            Double averageAccessesPerDay,
            Instant createdAt
    ) {}

    public record CounterHealthDto(String status, boolean valid) {}
}
