package com.grantradar.catalog.service;

import com.grantradar.catalog.filter.OpportunityFilter;
import com.grantradar.catalog.model.CatalogFacets;
import com.grantradar.catalog.model.FilterCriteria;
import com.grantradar.catalog.model.Opportunity;
import com.grantradar.catalog.store.CatalogStore;
import com.grantradar.catalog.views.TemporalViews;
import com.grantradar.config.RadarProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;

@Service
public class CatalogQueryService {
    private static final Logger log = LoggerFactory.getLogger(CatalogQueryService.class);
    private static final double DEFAULT_AMOUNT_CEILING = 1_000_000.0;

    private final CatalogStore store;
    private final OpportunityFilter filter;
    private final TemporalViews views;
    private final RadarProperties properties;

    public CatalogQueryService(
        CatalogStore store,
        OpportunityFilter filter,
        TemporalViews views,
        RadarProperties properties
    ) {
        this.store = store;
        this.filter = filter;
        this.views = views;
        this.properties = properties;
    }

    /**
     * Loads the whole catalog. No data file at any default location reads as an empty catalog.
     */
    public List<Opportunity> loadCatalog() {
        Optional<Path> path = store.locateDataFile();
        if (path.isEmpty()) {
            log.info("No catalog file found in {}", properties.getData().getCandidates());
            return List.of();
        }
        return store.load(path.get());
    }

    public List<Opportunity> search(FilterCriteria criteria) {
        return filter.apply(loadCatalog(), criteria);
    }

    public List<Opportunity> recentlyObserved(FilterCriteria criteria) {
        return views.recentlyObserved(search(criteria));
    }

    public List<Opportunity> closingSoon(FilterCriteria criteria, Integer windowDays) {
        int days = windowDays == null
            ? properties.getClosingWindowDays()
            : RadarProperties.clampWindow(windowDays);
        return views.closingSoon(search(criteria), days);
    }

    public CatalogFacets facets() {
        return facets(loadCatalog());
    }

    public CatalogFacets facets(List<Opportunity> rows) {
        TreeSet<String> types = new TreeSet<>();
        TreeSet<String> jurisdictions = new TreeSet<>();
        TreeSet<String> audiences = new TreeSet<>();
        TreeSet<String> disciplines = new TreeSet<>();
        Double floor = null;
        Double ceiling = null;
        int preferred = 0;
        for (Opportunity row : rows) {
            addIfPresent(types, row.type());
            addIfPresent(jurisdictions, row.jurisdiction());
            audiences.addAll(row.audience());
            disciplines.addAll(row.discipline());
            if (row.amountMin() != null) {
                floor = floor == null ? row.amountMin() : Math.min(floor, row.amountMin());
            }
            if (row.amountMax() != null) {
                ceiling = ceiling == null ? row.amountMax() : Math.max(ceiling, row.amountMax());
            }
            if (row.jurisdiction() != null && properties.getPreferredJurisdictions().contains(row.jurisdiction())) {
                preferred++;
            }
        }
        return new CatalogFacets(
            rows.size(),
            preferred,
            List.copyOf(types),
            List.copyOf(jurisdictions),
            List.copyOf(audiences),
            List.copyOf(disciplines),
            floor == null ? 0.0 : floor,
            ceiling == null ? DEFAULT_AMOUNT_CEILING : ceiling,
            defaultsPresent(properties.getPreferredJurisdictions(), jurisdictions),
            defaultsPresent(properties.getAudienceDefaults(), audiences),
            properties.getClosingWindowDays()
        );
    }

    /**
     * Configured defaults that actually occur in the catalog, or everything present when none do.
     */
    private List<String> defaultsPresent(Collection<String> defaults, Collection<String> present) {
        List<String> out = new ArrayList<>();
        for (String value : defaults) {
            if (present.contains(value)) {
                out.add(value);
            }
        }
        return out.isEmpty() ? List.copyOf(present) : out;
    }

    private void addIfPresent(Collection<String> out, String value) {
        if (value != null && !value.isBlank()) {
            out.add(value);
        }
    }
}
