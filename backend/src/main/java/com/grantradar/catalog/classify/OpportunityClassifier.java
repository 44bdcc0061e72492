package com.grantradar.catalog.classify;

import com.grantradar.catalog.dates.DateResolver;
import com.grantradar.catalog.model.Opportunity;
import com.grantradar.catalog.model.OpportunityType;
import com.grantradar.catalog.normalize.OpportunityNormalizer;
import com.grantradar.catalog.util.TextUtils;
import com.grantradar.catalog.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Backfills inferred attributes on a normalized record. Values already present on the record
 * are kept; tag sets only grow. Running it twice gives the same result as running it once.
 * Type, locality and tag rules run against {@code title + " " + description} as stored.
 */
@Component
public class OpportunityClassifier {
    private static final Logger log = LoggerFactory.getLogger(OpportunityClassifier.class);

    private final ClassificationRules rules;
    private final OpportunityNormalizer normalizer;
    private final Clock clock;

    public OpportunityClassifier(ClassificationRules rules, OpportunityNormalizer normalizer, Clock clock) {
        this.rules = rules;
        this.normalizer = normalizer;
        this.clock = clock;
    }

    public Opportunity classify(Opportunity opportunity) {
        String text = opportunity.titleAndDescription();
        String url = opportunity.url() == null ? "" : opportunity.url().trim();
        String netloc = UrlUtils.netloc(url);
        LocalDate today = LocalDate.now(clock);

        Opportunity.Builder builder = opportunity.toBuilder();
        if (isBlank(opportunity.type())) {
            builder.type(inferType(url, text).wireValue());
        }
        if (isBlank(opportunity.jurisdiction())) {
            builder.jurisdiction(rules.jurisdictionFor(netloc).orElse(null));
        }
        if (isBlank(opportunity.lga()) && belongsToLocality(netloc, text)) {
            builder.lga(rules.locality());
        }
        builder.audience(union(opportunity.audience(), rules.audience(), text));
        builder.discipline(union(opportunity.discipline(), rules.discipline(), text));
        if (isBlank(opportunity.closeDate())) {
            LocalDate closes = DateResolver.extractCloseDate(visibleText(opportunity), rules.closeDateMarker(), today);
            builder.closeDate(closes == null ? null : closes.toString());
        }
        if (isBlank(opportunity.lastSeen())) {
            builder.lastSeen(today.toString());
        }

        Opportunity classified = normalizer.refreshDerived(builder.build());
        if (log.isDebugEnabled()) {
            log.debug(
                "Classified {}: type={}, jurisdiction={}, lga={}, audience={}, discipline={}, closeDate={}",
                opportunity.id(),
                classified.type(),
                classified.jurisdiction(),
                classified.lga(),
                classified.audience(),
                classified.discipline(),
                classified.closeDate()
            );
        }
        return classified;
    }

    public OpportunityType inferType(String url, String text) {
        if ((url != null && rules.tenderUrl().matcher(url).find())
            || (text != null && rules.tenderText().matcher(text).find())) {
            return OpportunityType.TENDER;
        }
        return OpportunityType.GRANT;
    }

    public Set<String> matchingTags(List<TagRule> table, String text) {
        Set<String> tags = new TreeSet<>();
        for (TagRule rule : table) {
            if (rule.matches(text)) {
                tags.add(rule.tag());
            }
        }
        return tags;
    }

    private boolean belongsToLocality(String netloc, String text) {
        String hostPattern = rules.councilHostPattern();
        if (hostPattern != null && !hostPattern.isBlank() && netloc.contains(hostPattern.toLowerCase(Locale.ROOT))) {
            return true;
        }
        return TextUtils.containsIgnoreCase(text, rules.locality());
    }

    private Set<String> union(Collection<String> existing, List<TagRule> table, String text) {
        Set<String> tags = new TreeSet<>(existing);
        tags.addAll(matchingTags(table, text));
        return tags;
    }

    /**
     * Title and description with markup removed, for close-date extraction only.
     */
    private String visibleText(Opportunity opportunity) {
        return TextUtils.plainText(opportunity.title()) + " " + TextUtils.plainText(opportunity.description());
    }

    private boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
