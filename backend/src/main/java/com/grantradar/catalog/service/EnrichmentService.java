package com.grantradar.catalog.service;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.grantradar.catalog.classify.OpportunityClassifier;
import com.grantradar.catalog.model.EnrichmentSummary;
import com.grantradar.catalog.model.Opportunity;
import com.grantradar.catalog.normalize.OpportunityNormalizer;
import com.grantradar.catalog.store.CatalogStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * The enrichment pass: load a catalog file, classify every record and write the result back.
 */
@Service
public class EnrichmentService {
    private static final Logger log = LoggerFactory.getLogger(EnrichmentService.class);

    private final CatalogStore store;
    private final OpportunityNormalizer normalizer;
    private final OpportunityClassifier classifier;
    private final ExecutorService enrichmentExecutor;

    public EnrichmentService(
        CatalogStore store,
        OpportunityNormalizer normalizer,
        OpportunityClassifier classifier,
        @Qualifier("enrichmentExecutor") ExecutorService enrichmentExecutor
    ) {
        this.store = store;
        this.normalizer = normalizer;
        this.classifier = classifier;
        this.enrichmentExecutor = enrichmentExecutor;
    }

    /**
     * Enriches {@code input} and writes to {@code output}, or back over the input when
     * {@code output} is null. The output format follows the output path's extension.
     */
    public EnrichmentSummary enrich(Path input, Path output) {
        Instant startedAt = Instant.now();
        Path target = output == null ? input : output;

        List<ObjectNode> raw = store.readRaw(input);
        List<Opportunity> rows = new ArrayList<>(raw.size());
        for (ObjectNode node : raw) {
            rows.add(normalizer.normalize(node));
        }

        List<Opportunity> enriched = new ArrayList<>(rows.size());
        int failures = classifyAll(rows, enriched);
        store.write(target, enriched);

        EnrichmentSummary summary = summarize(input, target, rows, enriched, failures, startedAt);
        log.info("Enriched {} records -> {}", summary.recordsEnriched(), target);
        log.info(
            "Enrichment inferred: types={}, jurisdictions={}, lgas={}, closeDates={}, lastSeen={}, failures={}",
            summary.typesInferred(),
            summary.jurisdictionsInferred(),
            summary.lgasTagged(),
            summary.closeDatesExtracted(),
            summary.lastSeenStamped(),
            summary.classificationFailures()
        );
        return summary;
    }

    /**
     * Classifies records in memory, preserving order.
     */
    public List<Opportunity> enrich(List<Opportunity> rows) {
        List<Opportunity> enriched = new ArrayList<>(rows.size());
        classifyAll(rows, enriched);
        return enriched;
    }

    private int classifyAll(List<Opportunity> rows, List<Opportunity> out) {
        List<CompletableFuture<Opportunity>> futures = new ArrayList<>(rows.size());
        for (Opportunity row : rows) {
            futures.add(CompletableFuture.supplyAsync(() -> classifier.classify(row), enrichmentExecutor));
        }
        int failures = 0;
        for (int i = 0; i < futures.size(); i++) {
            Opportunity original = rows.get(i);
            try {
                out.add(futures.get(i).join());
            } catch (CompletionException e) {
                // keep the record as loaded; one bad listing must not sink the batch
                failures++;
                log.warn("Classification failed for record {}", original.id(), e);
                out.add(original);
            }
        }
        return failures;
    }

    private EnrichmentSummary summarize(
        Path input,
        Path output,
        List<Opportunity> before,
        List<Opportunity> after,
        int failures,
        Instant startedAt
    ) {
        int types = 0;
        int jurisdictions = 0;
        int lgas = 0;
        int closeDates = 0;
        int lastSeen = 0;
        for (int i = 0; i < before.size(); i++) {
            Opportunity a = before.get(i);
            Opportunity b = after.get(i);
            if (isBlank(a.type()) && !isBlank(b.type())) {
                types++;
            }
            if (isBlank(a.jurisdiction()) && !isBlank(b.jurisdiction())) {
                jurisdictions++;
            }
            if (isBlank(a.lga()) && !isBlank(b.lga())) {
                lgas++;
            }
            if (isBlank(a.closeDate()) && !isBlank(b.closeDate())) {
                closeDates++;
            }
            if (isBlank(a.lastSeen()) && !isBlank(b.lastSeen())) {
                lastSeen++;
            }
        }
        return new EnrichmentSummary(
            input.toString(),
            output.toString(),
            after.size(),
            types,
            jurisdictions,
            lgas,
            closeDates,
            lastSeen,
            failures,
            Duration.between(startedAt, Instant.now()).toMillis()
        );
    }

    private boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
