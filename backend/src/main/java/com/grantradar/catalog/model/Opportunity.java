package com.grantradar.catalog.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * A single grant or tender listing after normalization. Every attribute is present; absent
 * values are {@code null} (or empty for text and tag sets). {@code daysToClose} is derived
 * from {@code closeDate} at normalization time and is never persisted.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Opportunity(
    String id,
    String source,
    String type,
    String url,
    String title,
    String description,
    String agency,
    String jurisdiction,
    String lga,
    SortedSet<String> audience,
    SortedSet<String> discipline,
    String openDate,
    String closeDate,
    String status,
    Double amountMin,
    Double amountMax,
    String lastSeen,
    Long daysToClose,
    @JsonIgnore Map<String, JsonNode> extras
) {
    public Opportunity {
        title = title == null ? "" : title;
        description = description == null ? "" : description;
        audience = tagSet(audience);
        discipline = tagSet(discipline);
        extras = extras == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(extras));
    }

    @JsonAnyGetter
    public Map<String, JsonNode> additionalFields() {
        return extras;
    }

    /** Title and description joined by a single space, the text every rule runs against. */
    public String titleAndDescription() {
        return title + " " + description;
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public static Builder builder() {
        return new Builder();
    }

    private static SortedSet<String> tagSet(Collection<String> tags) {
        TreeSet<String> copy = new TreeSet<>();
        if (tags != null) {
            for (String tag : tags) {
                if (tag != null && !tag.isBlank()) {
                    copy.add(tag);
                }
            }
        }
        return Collections.unmodifiableSortedSet(copy);
    }

    public static final class Builder {
        private String id;
        private String source;
        private String type;
        private String url;
        private String title;
        private String description;
        private String agency;
        private String jurisdiction;
        private String lga;
        private Collection<String> audience;
        private Collection<String> discipline;
        private String openDate;
        private String closeDate;
        private String status;
        private Double amountMin;
        private Double amountMax;
        private String lastSeen;
        private Long daysToClose;
        private Map<String, JsonNode> extras;

        private Builder() {
        }

        private Builder(Opportunity o) {
            this.id = o.id;
            this.source = o.source;
            this.type = o.type;
            this.url = o.url;
            this.title = o.title;
            this.description = o.description;
            this.agency = o.agency;
            this.jurisdiction = o.jurisdiction;
            this.lga = o.lga;
            this.audience = o.audience;
            this.discipline = o.discipline;
            this.openDate = o.openDate;
            this.closeDate = o.closeDate;
            this.status = o.status;
            this.amountMin = o.amountMin;
            this.amountMax = o.amountMax;
            this.lastSeen = o.lastSeen;
            this.daysToClose = o.daysToClose;
            this.extras = o.extras;
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder url(String url) {
            this.url = url;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder agency(String agency) {
            this.agency = agency;
            return this;
        }

        public Builder jurisdiction(String jurisdiction) {
            this.jurisdiction = jurisdiction;
            return this;
        }

        public Builder lga(String lga) {
            this.lga = lga;
            return this;
        }

        public Builder audience(Collection<String> audience) {
            this.audience = audience;
            return this;
        }

        public Builder discipline(Collection<String> discipline) {
            this.discipline = discipline;
            return this;
        }

        public Builder openDate(String openDate) {
            this.openDate = openDate;
            return this;
        }

        public Builder closeDate(String closeDate) {
            this.closeDate = closeDate;
            return this;
        }

        public Builder status(String status) {
            this.status = status;
            return this;
        }

        public Builder amountMin(Double amountMin) {
            this.amountMin = amountMin;
            return this;
        }

        public Builder amountMax(Double amountMax) {
            this.amountMax = amountMax;
            return this;
        }

        public Builder lastSeen(String lastSeen) {
            this.lastSeen = lastSeen;
            return this;
        }

        public Builder daysToClose(Long daysToClose) {
            this.daysToClose = daysToClose;
            return this;
        }

        public Builder extras(Map<String, JsonNode> extras) {
            this.extras = extras;
            return this;
        }

        public Opportunity build() {
            return new Opportunity(
                id,
                source,
                type,
                url,
                title,
                description,
                agency,
                jurisdiction,
                lga,
                toSortedSet(audience),
                toSortedSet(discipline),
                openDate,
                closeDate,
                status,
                amountMin,
                amountMax,
                lastSeen,
                daysToClose,
                extras
            );
        }

        private static SortedSet<String> toSortedSet(Collection<String> tags) {
            return tags == null ? null : tagSet(tags);
        }
    }
}
