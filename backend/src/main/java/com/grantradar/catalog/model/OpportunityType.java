package com.grantradar.catalog.model;

import java.util.Locale;

public enum OpportunityType {
    GRANT,
    TENDER;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
