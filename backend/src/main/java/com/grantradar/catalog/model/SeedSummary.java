package com.grantradar.catalog.model;

public record SeedSummary(
    String path,
    int existingCount,
    int addedCount,
    int totalCount
) {
}
