package com.grantradar.catalog.model;

import java.util.List;

public record CatalogFacets(
    int total,
    int preferredJurisdictionCount,
    List<String> types,
    List<String> jurisdictions,
    List<String> audiences,
    List<String> disciplines,
    double amountFloor,
    double amountCeiling,
    List<String> defaultJurisdictions,
    List<String> defaultAudiences,
    int closingWindowDays
) {
}
