package com.grantradar.catalog.model;

public record EnrichmentSummary(
    String inputPath,
    String outputPath,
    int recordsEnriched,
    int typesInferred,
    int jurisdictionsInferred,
    int lgasTagged,
    int closeDatesExtracted,
    int lastSeenStamped,
    int classificationFailures,
    long durationMs
) {
}
