package com.grantradar.catalog.classify;

import com.grantradar.catalog.model.Opportunity;
import com.grantradar.catalog.model.OpportunityType;
import com.grantradar.catalog.normalize.OpportunityNormalizer;
import com.grantradar.config.RadarProperties;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.grantradar.catalog.TestSupport.CLOCK;
import static com.grantradar.catalog.TestSupport.listing;
import static org.assertj.core.api.Assertions.assertThat;

class OpportunityClassifierTest {
    private final ClassificationRules rules = ClassificationRules.fromProperties(new RadarProperties());
    private final OpportunityClassifier classifier =
        new OpportunityClassifier(rules, new OpportunityNormalizer(CLOCK), CLOCK);

    @Test
    void infersJurisdictionFromUrlHost() {
        assertThat(classifier.classify(listing("a").url("https://business.vic.gov.au/x").build()).jurisdiction())
            .isEqualTo("VIC");
        assertThat(classifier.classify(listing("b").url("https://www.grants.gov.au/go/list").build()).jurisdiction())
            .isEqualTo("Commonwealth");
        assertThat(classifier.classify(listing("c").url("https://www.tenders.gov.au/austender/x").build()).jurisdiction())
            .isNull();
        assertThat(classifier.classify(listing("d").url("https://example.com/grants").build()).jurisdiction())
            .isNull();
        assertThat(classifier.classify(listing("e").build()).jurisdiction()).isNull();
    }

    @Test
    void firstMatchingJurisdictionRuleWins() {
        RadarProperties properties = new RadarProperties();
        properties.getRules().setJurisdictions(List.of(
            new RadarProperties.JurisdictionRule(RadarProperties.HostMatch.SUFFIX, ".vic.gov.au", "VIC"),
            new RadarProperties.JurisdictionRule(RadarProperties.HostMatch.CONTAINS, "grants", "Commonwealth")
        ));
        ClassificationRules reordered = ClassificationRules.fromProperties(properties);

        assertThat(reordered.jurisdictionFor("grants.vic.gov.au")).contains("VIC");
        assertThat(rules.jurisdictionFor("grants.gov.au")).contains("Commonwealth");
        assertThat(rules.jurisdictionFor("austender.gov.au")).contains("Commonwealth");
    }

    @Test
    void infersTenderFromUrlOrTextAndFallsBackToGrant() {
        Opportunity tender = classifier.classify(listing("t").url("https://example.com/rft-12345").title("Road works").build());
        Opportunity grant = classifier.classify(listing("g").title("Community Grants Round 2").build());
        Opportunity textTender = classifier.classify(listing("x").title("Request for Tender: cleaning services").build());

        assertThat(tender.type()).isEqualTo("tender");
        assertThat(grant.type()).isEqualTo("grant");
        assertThat(textTender.type()).isEqualTo("tender");
        assertThat(classifier.inferType("", "")).isEqualTo(OpportunityType.GRANT);
    }

    @Test
    void neverOverwritesSuppliedSingularValues() {
        Opportunity supplied = listing("s")
            .type("grant")
            .jurisdiction("NSW")
            .lga("Hume")
            .url("https://www.wyndham.vic.gov.au/rft-1")
            .title("Wyndham tender for parks")
            .closeDate("2025-09-01")
            .lastSeen("2025-05-01")
            .build();

        Opportunity classified = classifier.classify(supplied);

        assertThat(classified.type()).isEqualTo("grant");
        assertThat(classified.jurisdiction()).isEqualTo("NSW");
        assertThat(classified.lga()).isEqualTo("Hume");
        assertThat(classified.closeDate()).isEqualTo("2025-09-01");
        assertThat(classified.lastSeen()).isEqualTo("2025-05-01");
    }

    @Test
    void tagsLocalityFromCouncilHostOrText() {
        assertThat(classifier.classify(listing("h").url("https://www.wyndham.vic.gov.au/grants").build()).lga())
            .isEqualTo("Wyndham");
        assertThat(classifier.classify(listing("t").title("Grants for WYNDHAM residents").build()).lga())
            .isEqualTo("Wyndham");
        assertThat(classifier.classify(listing("n").title("Melbourne arts grants").build()).lga()).isNull();
    }

    @Test
    void unionsTagsWithExistingOnes() {
        Opportunity classified = classifier.classify(listing("u")
            .audience(List.of("custom"))
            .title("Community health clinic upgrades")
            .description("Waste, energy and recreation facilities")
            .build());

        assertThat(classified.audience()).containsExactly("community", "custom");
        assertThat(classified.discipline()).containsExactly("environment", "health", "sport");
    }

    @Test
    void classificationIsIdempotent() {
        Opportunity raw = listing("i")
            .url("https://business.gov.au/grants-and-programs/startup-rd")
            .title("Startup R&D commercialisation grant")
            .description("For SMEs and research fellowship holders. Applications close 30 June 2025.")
            .build();

        Opportunity once = classifier.classify(raw);
        Opportunity twice = classifier.classify(once);

        assertThat(twice).isEqualTo(once);
        assertThat(once.audience()).isEqualTo(classifier.matchingTags(rules.audience(), raw.titleAndDescription()));
        assertThat(once.discipline()).isEqualTo(classifier.matchingTags(rules.discipline(), raw.titleAndDescription()));
        assertThat(once.audience()).containsExactly("business", "research");
    }

    @Test
    void extractsCloseDateAndStampsLastSeen() {
        Opportunity classified = classifier.classify(listing("c")
            .title("Sport facilities fund")
            .description("Applications close 30 June 2025. Apply online.")
            .build());

        assertThat(classified.closeDate()).isEqualTo("2025-06-30");
        assertThat(classified.daysToClose()).isEqualTo(29L);
        assertThat(classified.lastSeen()).isEqualTo("2025-06-01");
    }

    @Test
    void emptyTextYieldsNoTags() {
        Opportunity classified = classifier.classify(listing("empty").build());

        assertThat(classified.audience()).isEmpty();
        assertThat(classified.discipline()).isEmpty();
        assertThat(classified.type()).isEqualTo("grant");
        assertThat(classified.closeDate()).isNull();
        assertThat(classified.lga()).isNull();
    }

    @Test
    void tagRulesSeeTheStoredMarkup() {
        Opportunity raw = listing("html")
            .description("<p>Support for <b>sport</b> clubs. <a href=\"https://example.org/health\">Details</a></p>")
            .build();

        Opportunity classified = classifier.classify(raw);

        assertThat(classified.audience()).containsExactly("community");
        assertThat(classified.discipline()).containsExactly("health", "sport");
        assertThat(classified.discipline())
            .isEqualTo(classifier.matchingTags(rules.discipline(), raw.titleAndDescription()));
    }

    @Test
    void closeDateIsReadThroughMarkup() {
        Opportunity classified = classifier.classify(listing("html-date")
            .description("<p>Applications close <strong>30 June 2025</strong>.</p>")
            .build());

        assertThat(classified.closeDate()).isEqualTo("2025-06-30");
    }
}
