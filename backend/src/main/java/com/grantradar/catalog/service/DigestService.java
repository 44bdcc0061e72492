package com.grantradar.catalog.service;

import com.grantradar.catalog.filter.OpportunityFilter;
import com.grantradar.catalog.model.DigestSummary;
import com.grantradar.catalog.model.Opportunity;
import com.grantradar.catalog.views.TemporalViews;
import com.grantradar.config.RadarProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Assembles the weekly digest sections. Rendering and delivery of the digest happen elsewhere.
 */
@Service
public class DigestService {
    private static final Logger log = LoggerFactory.getLogger(DigestService.class);

    private final CatalogQueryService queryService;
    private final TemporalViews views;
    private final RadarProperties properties;
    private final Clock clock;

    public DigestService(
        CatalogQueryService queryService,
        TemporalViews views,
        RadarProperties properties,
        Clock clock
    ) {
        this.queryService = queryService;
        this.views = views;
        this.properties = properties;
        this.clock = clock;
    }

    public DigestSummary buildDigest() {
        return buildDigest(queryService.loadCatalog(), properties.getDigest().isOnlyLocality());
    }

    public DigestSummary buildDigest(List<Opportunity> rows, boolean onlyLocality) {
        RadarProperties.Digest digest = properties.getDigest();
        int closingDays = digest.getClosingDays() == null
            ? properties.getClosingWindowDays()
            : digest.getClosingDays();

        List<Opportunity> scoped = scope(rows, onlyLocality);
        List<Opportunity> fresh = views.recentlyObserved(scoped);
        List<Opportunity> closing = views.closingSoon(scoped, closingDays);

        String subject = String.format(
            "%s Grants & Tenders: %d new, %d closing soon",
            digest.getSubjectPrefix() == null ? "" : digest.getSubjectPrefix(),
            fresh.size(),
            closing.size()
        ).trim();
        log.info("Digest built: inScope={}, new={}, closing={}", scoped.size(), fresh.size(), closing.size());

        return new DigestSummary(
            properties.getCouncil(),
            subject,
            LocalDate.now(clock),
            closingDays,
            scoped.size(),
            fresh.size(),
            closing.size(),
            limit(fresh, digest.getLimit()),
            limit(closing, digest.getLimit())
        );
    }

    /**
     * Preferred jurisdictions plus listings whose jurisdiction is unknown; with
     * {@code onlyLocality}, only listings that mention the locality.
     */
    public List<Opportunity> scope(List<Opportunity> rows, boolean onlyLocality) {
        Set<String> preferred = new HashSet<>();
        for (String jurisdiction : properties.getPreferredJurisdictions()) {
            preferred.add(jurisdiction.toUpperCase(Locale.ROOT));
        }
        String locality = properties.getLocality();
        List<Opportunity> out = new ArrayList<>();
        for (Opportunity row : rows) {
            boolean keep;
            if (onlyLocality) {
                keep = OpportunityFilter.mentionsLocality(row, locality);
            } else {
                String jurisdiction = row.jurisdiction() == null ? "" : row.jurisdiction().toUpperCase(Locale.ROOT);
                keep = jurisdiction.isBlank() || preferred.contains(jurisdiction);
            }
            if (keep) {
                out.add(row);
            }
        }
        return out;
    }

    private List<Opportunity> limit(List<Opportunity> rows, int max) {
        return rows.size() <= max ? rows : List.copyOf(rows.subList(0, max));
    }
}
