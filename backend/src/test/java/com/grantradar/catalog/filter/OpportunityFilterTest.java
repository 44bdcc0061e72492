package com.grantradar.catalog.filter;

import com.grantradar.catalog.model.FilterCriteria;
import com.grantradar.catalog.model.Opportunity;
import com.grantradar.config.RadarProperties;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.grantradar.catalog.TestSupport.listing;
import static org.assertj.core.api.Assertions.assertThat;

class OpportunityFilterTest {
    private final OpportunityFilter filter = new OpportunityFilter(new RadarProperties());

    private final Opportunity vicGrant = listing("vic")
        .type("grant")
        .jurisdiction("VIC")
        .audience(List.of("community"))
        .discipline(List.of("arts"))
        .title("Creative Communities Grant")
        .amountMin(1000.0)
        .amountMax(5000.0)
        .build();
    private final Opportunity federalTender = listing("cth")
        .type("tender")
        .jurisdiction("Commonwealth")
        .audience(List.of("business"))
        .title("Road Maintenance Tender")
        .description("Infrastructure works")
        .amountMin(50000.0)
        .amountMax(200000.0)
        .build();
    private final Opportunity unknownEverything = listing("unknown")
        .title("Health Innovation Grant")
        .build();

    private final List<Opportunity> rows = List.of(vicGrant, federalTender, unknownEverything);

    private static FilterCriteria criteria(Set<String> types, Set<String> jurisdictions) {
        return new FilterCriteria(types, jurisdictions, null, null, null, null, null, false);
    }

    private static FilterCriteria amounts(Double min, Double max) {
        return new FilterCriteria(null, null, null, null, min, max, null, false);
    }

    private static FilterCriteria text(String query) {
        return new FilterCriteria(null, null, null, null, null, null, query, false);
    }

    @Test
    void emptyCriteriaKeepEverythingInOrder() {
        assertThat(filter.apply(rows, FilterCriteria.none())).containsExactly(vicGrant, federalTender, unknownEverything);
        assertThat(filter.apply(rows, null)).containsExactly(vicGrant, federalTender, unknownEverything);
    }

    @Test
    void filtersByTypeMembership() {
        assertThat(filter.apply(rows, criteria(Set.of("tender"), null))).containsExactly(federalTender);
        assertThat(filter.apply(rows, criteria(Set.of("grant", "tender"), null))).containsExactly(vicGrant, federalTender);
    }

    @Test
    void unclassifiedRecordsFailATypeFilterWithoutError() {
        Opportunity untyped = listing("untyped").title("Regional Events Program").build();

        assertThat(filter.apply(List.of(vicGrant, untyped, federalTender), criteria(Set.of("grant"), null)))
            .containsExactly(vicGrant);
        assertThat(filter.apply(List.of(untyped), FilterCriteria.none())).containsExactly(untyped);
    }

    @Test
    void unknownJurisdictionAlwaysPasses() {
        assertThat(filter.apply(rows, criteria(null, Set.of("VIC")))).containsExactly(vicGrant, unknownEverything);
        assertThat(filter.apply(rows, criteria(null, Set.of("NSW")))).containsExactly(unknownEverything);
    }

    @Test
    void tagCriteriaNeedAnOverlap() {
        FilterCriteria audience = new FilterCriteria(null, null, Set.of("business", "students"), null, null, null, null, false);
        FilterCriteria discipline = new FilterCriteria(null, null, null, Set.of("arts"), null, null, null, false);

        assertThat(filter.apply(rows, audience)).containsExactly(federalTender);
        assertThat(filter.apply(rows, discipline)).containsExactly(vicGrant);
    }

    @Test
    void unknownAmountsAreNeverExcluded() {
        for (double[] range : new double[][] {{0, 0}, {1e9, 2e9}, {-5, 10}, {100_000, 100_000}}) {
            assertThat(filter.apply(List.of(unknownEverything), amounts(range[0], range[1])))
                .containsExactly(unknownEverything);
        }
        assertThat(filter.apply(List.of(unknownEverything), amounts(null, 10.0))).containsExactly(unknownEverything);
    }

    @Test
    void knownBoundsOutsideRangeExclude() {
        assertThat(filter.apply(rows, amounts(10_000.0, null))).containsExactly(federalTender, unknownEverything);
        assertThat(filter.apply(rows, amounts(null, 10_000.0))).containsExactly(vicGrant, unknownEverything);
        assertThat(filter.apply(rows, amounts(5000.0, 50000.0))).containsExactly(vicGrant, federalTender, unknownEverything);
    }

    @Test
    void singleKnownBoundIsCheckedOnItsOwn() {
        Opportunity onlyMin = listing("min").amountMin(20_000.0).build();
        Opportunity onlyMax = listing("max").amountMax(500.0).build();

        assertThat(filter.apply(List.of(onlyMin, onlyMax), amounts(null, 10_000.0))).containsExactly(onlyMax);
        assertThat(filter.apply(List.of(onlyMin, onlyMax), amounts(1000.0, null))).containsExactly(onlyMin);
    }

    @Test
    void localityOnlyMatchesLgaOrText() {
        Opportunity byLga = listing("lga").lga("Wyndham").build();
        Opportunity byAgency = listing("agency").agency("Wyndham City Council").build();
        Opportunity byDescription = listing("desc").description("Open to wyndham residents").build();
        Opportunity elsewhere = listing("else").lga("Hume").title("Hume grants").build();
        FilterCriteria localityOnly = new FilterCriteria(null, null, null, null, null, null, null, true);

        assertThat(filter.apply(List.of(byLga, byAgency, byDescription, elsewhere), localityOnly))
            .containsExactly(byLga, byAgency, byDescription);
        assertThat(filter.apply(List.of(byLga, elsewhere), localityOnly, "Hume")).containsExactly(elsewhere);
    }

    @Test
    void everyQueryTermMustAppearInTitleOrDescription() {
        assertThat(filter.apply(List.of(unknownEverything), text("health grant"))).containsExactly(unknownEverything);
        assertThat(filter.apply(List.of(unknownEverything), text("health tender"))).isEmpty();
        assertThat(filter.apply(List.of(unknownEverything), text("  HEALTH   "))).containsExactly(unknownEverything);
        assertThat(filter.apply(rows, text("   "))).hasSize(3);
    }

    @Test
    void termsMayBeFoundInDifferentFields() {
        assertThat(filter.apply(rows, text("road infrastructure"))).containsExactly(federalTender);
        assertThat(filter.apply(rows, text("maintenance works"))).containsExactly(federalTender);
        assertThat(filter.apply(rows, text("road arts"))).isEmpty();
    }

    @Test
    void criteriaAreConjunctive() {
        FilterCriteria combined = new FilterCriteria(
            Set.of("grant", "tender"),
            Set.of("VIC", "Commonwealth"),
            Set.of("community", "business"),
            null,
            1000.0,
            null,
            "grant",
            false
        );
        assertThat(filter.apply(rows, combined)).containsExactly(vicGrant);
    }
}
