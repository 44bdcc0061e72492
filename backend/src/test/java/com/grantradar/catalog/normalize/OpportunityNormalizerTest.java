package com.grantradar.catalog.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import com.grantradar.catalog.model.Opportunity;
import com.grantradar.catalog.store.CatalogStore;
import com.grantradar.config.RadarProperties;
import org.junit.jupiter.api.Test;

import static com.grantradar.catalog.TestSupport.CLOCK;
import static com.grantradar.catalog.TestSupport.MAPPER;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OpportunityNormalizerTest {
    private final OpportunityNormalizer normalizer = new OpportunityNormalizer(CLOCK);

    @Test
    void fillsDefaultsForMissingKeys() throws Exception {
        Opportunity opportunity = normalizer.normalize(MAPPER.readTree("{\"title\":\"Only a title\"}"));

        assertThat(opportunity.title()).isEqualTo("Only a title");
        assertThat(opportunity.description()).isEmpty();
        assertThat(opportunity.id()).isNull();
        assertThat(opportunity.type()).isNull();
        assertThat(opportunity.jurisdiction()).isNull();
        assertThat(opportunity.audience()).isEmpty();
        assertThat(opportunity.discipline()).isEmpty();
        assertThat(opportunity.closeDate()).isNull();
        assertThat(opportunity.amountMin()).isNull();
        assertThat(opportunity.daysToClose()).isNull();
        assertThat(opportunity.extras()).isEmpty();
    }

    @Test
    void computesDaysToCloseIncludingNegativeValues() throws Exception {
        assertThat(normalizer.normalize(MAPPER.readTree("{\"close_date\":\"2025-06-08\"}")).daysToClose()).isEqualTo(7L);
        assertThat(normalizer.normalize(MAPPER.readTree("{\"close_date\":\"2025/06/01\"}")).daysToClose()).isEqualTo(0L);
        assertThat(normalizer.normalize(MAPPER.readTree("{\"close_date\":\"2025-05-25\"}")).daysToClose()).isEqualTo(-7L);
    }

    @Test
    void garbageCloseDateIsKeptButUnresolved() throws Exception {
        Opportunity opportunity = normalizer.normalize(MAPPER.readTree("{\"close_date\":\"when funds run out\"}"));
        assertThat(opportunity.closeDate()).isEqualTo("when funds run out");
        assertThat(opportunity.daysToClose()).isNull();
    }

    @Test
    void keepsUnknownKeysAndIgnoresStaleDerivedValues() throws Exception {
        Opportunity opportunity = normalizer.normalize(MAPPER.readTree(
            "{\"id\":\"x\",\"region\":\"Hunter\",\"tags\":[1,2],\"days_to_close\":99}"
        ));
        assertThat(opportunity.extras()).containsOnlyKeys("region", "tags");
        assertThat(opportunity.extras().get("region").asText()).isEqualTo("Hunter");
        assertThat(opportunity.daysToClose()).isNull();
    }

    @Test
    void degradesOddValueShapesPerField() throws Exception {
        Opportunity opportunity = normalizer.normalize(MAPPER.readTree(
            "{\"audience\":\"community\",\"discipline\":[\"health\",null,\"health\"],"
                + "\"amount_min\":\"$5,000\",\"amount_max\":\"n/a\",\"id\":42}"
        ));
        assertThat(opportunity.audience()).containsExactly("community");
        assertThat(opportunity.discipline()).containsExactly("health");
        assertThat(opportunity.amountMin()).isEqualTo(5000.0);
        assertThat(opportunity.amountMax()).isNull();
        assertThat(opportunity.id()).isEqualTo("42");
    }

    @Test
    void rejectsNonObjectListings() throws Exception {
        JsonNode array = MAPPER.readTree("[1,2]");
        assertThatThrownBy(() -> normalizer.normalize(array)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void normalizingAFullyPopulatedRecordChangesNothing() throws Exception {
        JsonNode raw = MAPPER.readTree("""
            {
              "id": "wyn-001",
              "source": "wyndham",
              "type": "tender",
              "url": "https://www.wyndham.vic.gov.au/x",
              "title": "Title",
              "description": "Description",
              "agency": "Agency",
              "jurisdiction": "VIC",
              "lga": "Wyndham",
              "audience": ["business", "community"],
              "discipline": ["arts"],
              "open_date": "2025-05-01",
              "close_date": "2025-06-30",
              "status": "open",
              "amount_min": 1000,
              "amount_max": 2500.5,
              "last_seen": "2025-05-30T10:00:00",
              "region": "West"
            }
            """);
        Opportunity once = normalizer.normalize(raw);
        CatalogStore store = new CatalogStore(MAPPER, normalizer, new RadarProperties());
        Opportunity twice = normalizer.normalize(store.toJson(once));

        assertThat(twice).isEqualTo(once);
        assertThat(once.type()).isEqualTo("tender");
        assertThat(once.jurisdiction()).isEqualTo("VIC");
        assertThat(once.lastSeen()).isEqualTo("2025-05-30T10:00:00");
        assertThat(once.amountMax()).isEqualTo(2500.5);
        assertThat(store.toJson(once).get("title").asText()).isEqualTo(raw.get("title").asText());
        assertThat(store.toJson(once).get("region")).isEqualTo(raw.get("region"));
    }
}
