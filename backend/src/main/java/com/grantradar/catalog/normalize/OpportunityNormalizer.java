package com.grantradar.catalog.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import com.grantradar.catalog.dates.DateResolver;
import com.grantradar.catalog.model.DateResolution;
import com.grantradar.catalog.model.Opportunity;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Single boundary where raw listing objects become {@link Opportunity} records. Every known
 * attribute gets its default here, unknown keys are carried along untouched and
 * {@code days_to_close} is recomputed against today's date.
 */
@Component
public class OpportunityNormalizer {
    public static final List<String> KNOWN_FIELDS = List.of(
        "id",
        "source",
        "type",
        "url",
        "title",
        "description",
        "agency",
        "jurisdiction",
        "lga",
        "audience",
        "discipline",
        "open_date",
        "close_date",
        "status",
        "amount_min",
        "amount_max",
        "last_seen"
    );

    private static final Set<String> DERIVED_FIELDS = Set.of("days_to_close");

    private final Clock clock;

    public OpportunityNormalizer(Clock clock) {
        this.clock = clock;
    }

    public Opportunity normalize(JsonNode raw) {
        if (raw == null || !raw.isObject()) {
            throw new IllegalArgumentException("listing must be a JSON object");
        }
        Map<String, JsonNode> extras = new LinkedHashMap<>();
        raw.fields().forEachRemaining(entry -> {
            if (!KNOWN_FIELDS.contains(entry.getKey()) && !DERIVED_FIELDS.contains(entry.getKey())) {
                extras.put(entry.getKey(), entry.getValue());
            }
        });

        Opportunity opportunity = Opportunity.builder()
            .id(text(raw, "id"))
            .source(text(raw, "source"))
            .type(text(raw, "type"))
            .url(text(raw, "url"))
            .title(text(raw, "title"))
            .description(text(raw, "description"))
            .agency(text(raw, "agency"))
            .jurisdiction(text(raw, "jurisdiction"))
            .lga(text(raw, "lga"))
            .audience(tags(raw.get("audience")))
            .discipline(tags(raw.get("discipline")))
            .openDate(text(raw, "open_date"))
            .closeDate(text(raw, "close_date"))
            .status(text(raw, "status"))
            .amountMin(amount(raw.get("amount_min")))
            .amountMax(amount(raw.get("amount_max")))
            .lastSeen(text(raw, "last_seen"))
            .extras(extras)
            .build();
        return refreshDerived(opportunity);
    }

    /**
     * Recomputes the derived attributes of an already-normalized record, for instance after the
     * classifier filled in a close date.
     */
    public Opportunity refreshDerived(Opportunity opportunity) {
        return opportunity.toBuilder()
            .daysToClose(daysToClose(opportunity.closeDate()))
            .build();
    }

    public Long daysToClose(String closeDate) {
        DateResolution resolution = DateResolver.resolve(closeDate);
        if (!resolution.isResolved()) {
            return null;
        }
        return ChronoUnit.DAYS.between(LocalDate.now(clock), resolution.date());
    }

    private String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isTextual() || value.isNumber() || value.isBoolean()) {
            return value.asText();
        }
        return value.toString();
    }

    private Set<String> tags(JsonNode node) {
        Set<String> out = new LinkedHashSet<>();
        if (node == null || node.isNull()) {
            return out;
        }
        if (node.isArray()) {
            for (JsonNode item : node) {
                if (item != null && !item.isNull() && item.isValueNode()) {
                    out.add(item.asText());
                }
            }
            return out;
        }
        if (node.isValueNode()) {
            out.add(node.asText());
        }
        return out;
    }

    private Double amount(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.asDouble();
        }
        if (node.isTextual()) {
            String cleaned = node.asText().replace("$", "").replace(",", "").trim();
            if (cleaned.isEmpty()) {
                return null;
            }
            try {
                return Double.parseDouble(cleaned);
            } catch (NumberFormatException ignored) {
                return null;
            }
        }
        return null;
    }
}
