package com.grantradar.catalog.service;

import com.grantradar.catalog.classify.ClassificationRules;
import com.grantradar.catalog.model.Opportunity;
import com.grantradar.catalog.model.OpportunityType;
import com.grantradar.catalog.model.SeedSummary;
import com.grantradar.catalog.store.CatalogStore;
import com.grantradar.catalog.util.HashUtils;
import com.grantradar.catalog.util.UrlUtils;
import com.grantradar.config.RadarProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Adds the configured landing pages to the catalog so a fresh install has something to show.
 * Seeds are matched on id only; an id already present is left alone.
 */
@Service
public class CatalogSeeder {
    private static final Logger log = LoggerFactory.getLogger(CatalogSeeder.class);

    private final CatalogStore store;
    private final ClassificationRules rules;
    private final RadarProperties properties;
    private final Clock clock;

    public CatalogSeeder(CatalogStore store, ClassificationRules rules, RadarProperties properties, Clock clock) {
        this.store = store;
        this.rules = rules;
        this.properties = properties;
        this.clock = clock;
    }

    public SeedSummary seed(Path path) {
        List<Opportunity> current = Files.exists(path) ? store.load(path) : List.of();
        Set<String> ids = new HashSet<>();
        for (Opportunity row : current) {
            if (row.id() != null) {
                ids.add(row.id());
            }
        }

        List<Opportunity> out = new ArrayList<>(current);
        for (RadarProperties.Seed seed : properties.getSeeds()) {
            if (seed.getTitle() == null || seed.getUrl() == null) {
                log.warn("Skipping incomplete seed entry title={} url={}", seed.getTitle(), seed.getUrl());
                continue;
            }
            Opportunity record = seedRecord(seed.getTitle(), seed.getUrl());
            if (ids.add(record.id())) {
                out.add(record);
            }
        }
        store.write(path, out);

        int added = out.size() - current.size();
        log.info("Added {} seed records. Total now {}.", added, out.size());
        return new SeedSummary(path.toString(), current.size(), added, out.size());
    }

    public Opportunity seedRecord(String title, String url) {
        String netloc = UrlUtils.netloc(url);
        String councilHost = properties.getCouncilHostPattern();
        boolean council = councilHost != null
            && !councilHost.isBlank()
            && netloc.contains(councilHost.toLowerCase(Locale.ROOT));
        return Opportunity.builder()
            .id(HashUtils.listingId("seed", title, url))
            .source("seed")
            .type(OpportunityType.GRANT.wireValue())
            .url(url)
            .title(title)
            .description("")
            .jurisdiction(rules.jurisdictionFor(netloc).orElse(null))
            .lga(council ? properties.getLocality() : null)
            .audience(council ? List.of("community") : List.of("business"))
            .status("open")
            .lastSeen(LocalDate.now(clock).toString())
            .build();
    }
}
