package com.grantradar.catalog.api;

import com.grantradar.catalog.model.CatalogFacets;
import com.grantradar.catalog.model.DigestSummary;
import com.grantradar.catalog.model.EnrichmentSummary;
import com.grantradar.catalog.model.FilterCriteria;
import com.grantradar.catalog.model.Opportunity;
import com.grantradar.catalog.model.SeedSummary;
import com.grantradar.catalog.service.CatalogQueryService;
import com.grantradar.catalog.service.CatalogSeeder;
import com.grantradar.catalog.service.DigestService;
import com.grantradar.catalog.service.EnrichmentService;
import com.grantradar.catalog.store.CatalogStore;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

@RestController
@RequestMapping("/api")
public class CatalogController {
    private final CatalogQueryService queryService;
    private final EnrichmentService enrichmentService;
    private final DigestService digestService;
    private final CatalogSeeder seeder;
    private final CatalogStore store;

    public CatalogController(
        CatalogQueryService queryService,
        EnrichmentService enrichmentService,
        DigestService digestService,
        CatalogSeeder seeder,
        CatalogStore store
    ) {
        this.queryService = queryService;
        this.enrichmentService = enrichmentService;
        this.digestService = digestService;
        this.seeder = seeder;
        this.store = store;
    }

    @GetMapping("/opportunities")
    public List<Opportunity> getOpportunities(
        @RequestParam(name = "type", required = false) List<String> types,
        @RequestParam(name = "jurisdiction", required = false) List<String> jurisdictions,
        @RequestParam(name = "audience", required = false) List<String> audiences,
        @RequestParam(name = "discipline", required = false) List<String> disciplines,
        @RequestParam(name = "amountMin", required = false) Double amountMin,
        @RequestParam(name = "amountMax", required = false) Double amountMax,
        @RequestParam(name = "q", required = false) String query,
        @RequestParam(name = "localityOnly", required = false, defaultValue = "false") boolean localityOnly
    ) {
        return queryService.search(criteria(types, jurisdictions, audiences, disciplines, amountMin, amountMax, query, localityOnly));
    }

    @GetMapping("/opportunities/recent")
    public List<Opportunity> getRecentlyObserved(
        @RequestParam(name = "type", required = false) List<String> types,
        @RequestParam(name = "jurisdiction", required = false) List<String> jurisdictions,
        @RequestParam(name = "audience", required = false) List<String> audiences,
        @RequestParam(name = "discipline", required = false) List<String> disciplines,
        @RequestParam(name = "amountMin", required = false) Double amountMin,
        @RequestParam(name = "amountMax", required = false) Double amountMax,
        @RequestParam(name = "q", required = false) String query,
        @RequestParam(name = "localityOnly", required = false, defaultValue = "false") boolean localityOnly
    ) {
        return queryService.recentlyObserved(
            criteria(types, jurisdictions, audiences, disciplines, amountMin, amountMax, query, localityOnly)
        );
    }

    @GetMapping("/opportunities/closing-soon")
    public List<Opportunity> getClosingSoon(
        @RequestParam(name = "days", required = false) Integer days,
        @RequestParam(name = "type", required = false) List<String> types,
        @RequestParam(name = "jurisdiction", required = false) List<String> jurisdictions,
        @RequestParam(name = "audience", required = false) List<String> audiences,
        @RequestParam(name = "discipline", required = false) List<String> disciplines,
        @RequestParam(name = "amountMin", required = false) Double amountMin,
        @RequestParam(name = "amountMax", required = false) Double amountMax,
        @RequestParam(name = "q", required = false) String query,
        @RequestParam(name = "localityOnly", required = false, defaultValue = "false") boolean localityOnly
    ) {
        if (days != null && days < 0) {
            throw new ResponseStatusException(BAD_REQUEST, "days must not be negative");
        }
        return queryService.closingSoon(
            criteria(types, jurisdictions, audiences, disciplines, amountMin, amountMax, query, localityOnly),
            days
        );
    }

    @GetMapping("/opportunities/facets")
    public CatalogFacets getFacets() {
        return queryService.facets();
    }

    @GetMapping("/digest")
    public DigestSummary getDigest(@RequestParam(name = "onlyLocality", required = false) Boolean onlyLocality) {
        if (onlyLocality == null) {
            return digestService.buildDigest();
        }
        return digestService.buildDigest(queryService.loadCatalog(), onlyLocality);
    }

    /**
     * Enriches the configured catalog file in place. Other files can only be enriched through
     * the {@code radar.cli.*} startup run.
     */
    @PostMapping("/enrich")
    public EnrichmentSummary enrich() {
        Path input = store.locateDataFile()
            .orElseThrow(() -> new ResponseStatusException(BAD_REQUEST, "No catalog file to enrich"));
        return enrichmentService.enrich(input, null);
    }

    @PostMapping("/seed")
    public SeedSummary seed() {
        return seeder.seed(store.locateDataFile().orElse(Path.of("grants.json")));
    }

    private FilterCriteria criteria(
        List<String> types,
        List<String> jurisdictions,
        List<String> audiences,
        List<String> disciplines,
        Double amountMin,
        Double amountMax,
        String query,
        boolean localityOnly
    ) {
        if (amountMin != null && amountMax != null && amountMin > amountMax) {
            throw new ResponseStatusException(BAD_REQUEST, "amountMin must not exceed amountMax");
        }
        return new FilterCriteria(
            types == null ? null : new HashSet<>(types),
            jurisdictions == null ? null : new HashSet<>(jurisdictions),
            audiences == null ? null : new HashSet<>(audiences),
            disciplines == null ? null : new HashSet<>(disciplines),
            amountMin,
            amountMax,
            query,
            localityOnly
        );
    }
}
