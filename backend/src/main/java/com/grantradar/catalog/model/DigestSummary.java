package com.grantradar.catalog.model;

import java.time.LocalDate;
import java.util.List;

public record DigestSummary(
    String council,
    String subject,
    LocalDate generatedOn,
    int closingWindowDays,
    int inScopeCount,
    int newCount,
    int closingCount,
    List<Opportunity> newThisWeek,
    List<Opportunity> closingSoon
) {
}
