package com.grantradar.catalog.model;

import java.util.Set;

public record FilterCriteria(
    Set<String> types,
    Set<String> jurisdictions,
    Set<String> audiences,
    Set<String> disciplines,
    Double amountMin,
    Double amountMax,
    String textQuery,
    boolean localityOnly
) {
    public FilterCriteria {
        types = types == null ? Set.of() : Set.copyOf(types);
        jurisdictions = jurisdictions == null ? Set.of() : Set.copyOf(jurisdictions);
        audiences = audiences == null ? Set.of() : Set.copyOf(audiences);
        disciplines = disciplines == null ? Set.of() : Set.copyOf(disciplines);
        textQuery = textQuery == null ? "" : textQuery;
    }

    public static FilterCriteria none() {
        return new FilterCriteria(null, null, null, null, null, null, null, false);
    }
}
