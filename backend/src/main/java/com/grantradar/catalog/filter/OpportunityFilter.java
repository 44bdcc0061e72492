package com.grantradar.catalog.filter;

import com.grantradar.catalog.model.FilterCriteria;
import com.grantradar.catalog.model.Opportunity;
import com.grantradar.config.RadarProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Conjunctive multi-criteria filter. An empty criterion imposes no constraint and the input
 * order is preserved.
 */
@Component
public class OpportunityFilter {
    private final RadarProperties properties;

    public OpportunityFilter(RadarProperties properties) {
        this.properties = properties;
    }

    public List<Opportunity> apply(List<Opportunity> rows, FilterCriteria criteria) {
        return apply(rows, criteria, properties.getLocality());
    }

    public List<Opportunity> apply(List<Opportunity> rows, FilterCriteria criteria, String locality) {
        FilterCriteria safe = criteria == null ? FilterCriteria.none() : criteria;
        List<String> terms = terms(safe.textQuery());
        List<Opportunity> out = new ArrayList<>();
        for (Opportunity row : rows) {
            if (matches(row, safe, terms, locality)) {
                out.add(row);
            }
        }
        return out;
    }

    boolean matches(Opportunity row, FilterCriteria criteria, List<String> terms, String locality) {
        // an unclassified record has no type and never matches a type filter
        if (!criteria.types().isEmpty() && (row.type() == null || !criteria.types().contains(row.type()))) {
            return false;
        }
        // an unknown jurisdiction may simply be impossible to infer, so it is never filtered out
        if (!criteria.jurisdictions().isEmpty()
            && row.jurisdiction() != null
            && !row.jurisdiction().isBlank()
            && !criteria.jurisdictions().contains(row.jurisdiction())) {
            return false;
        }
        if (!criteria.audiences().isEmpty() && !intersects(criteria.audiences(), row.audience())) {
            return false;
        }
        if (!criteria.disciplines().isEmpty() && !intersects(criteria.disciplines(), row.discipline())) {
            return false;
        }
        if (!withinAmountRange(row, criteria.amountMin(), criteria.amountMax())) {
            return false;
        }
        if (criteria.localityOnly() && !mentionsLocality(row, locality)) {
            return false;
        }
        return matchesText(row, terms);
    }

    /**
     * Only a known bound can exclude a record: unknown amounts always pass.
     */
    public static boolean withinAmountRange(Opportunity row, Double requestedMin, Double requestedMax) {
        if (requestedMin != null && row.amountMax() != null && row.amountMax() < requestedMin) {
            return false;
        }
        return requestedMax == null || row.amountMin() == null || row.amountMin() <= requestedMax;
    }

    public static boolean mentionsLocality(Opportunity row, String locality) {
        if (locality == null || locality.isBlank()) {
            return false;
        }
        if (locality.equals(row.lga())) {
            return true;
        }
        String text = (row.title() + " " + row.description() + " " + (row.agency() == null ? "" : row.agency()))
            .toLowerCase(Locale.ROOT);
        return text.contains(locality.toLowerCase(Locale.ROOT));
    }

    /**
     * Every term has to occur in the title or in the description; different terms may be found
     * in different fields.
     */
    public static boolean matchesText(Opportunity row, List<String> terms) {
        if (terms.isEmpty()) {
            return true;
        }
        String title = row.title().toLowerCase(Locale.ROOT);
        String description = row.description().toLowerCase(Locale.ROOT);
        for (String term : terms) {
            if (!title.contains(term) && !description.contains(term)) {
                return false;
            }
        }
        return true;
    }

    public static List<String> terms(String query) {
        List<String> out = new ArrayList<>();
        if (query == null || query.isBlank()) {
            return out;
        }
        for (String term : query.trim().toLowerCase(Locale.ROOT).split("\\s+")) {
            if (!term.isEmpty()) {
                out.add(term);
            }
        }
        return out;
    }

    private static boolean intersects(Set<String> requested, Collection<String> present) {
        for (String tag : present) {
            if (requested.contains(tag)) {
                return true;
            }
        }
        return false;
    }
}
