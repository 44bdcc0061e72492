package com.grantradar.catalog.views;

import com.grantradar.catalog.dates.DateResolver;
import com.grantradar.catalog.model.DateResolution;
import com.grantradar.catalog.model.Opportunity;
import com.grantradar.config.RadarProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * The two smart lists: recently observed listings and listings closing soon. Both work on an
 * already-filtered collection and return a new, explicitly sorted list.
 */
@Component
public class TemporalViews {
    private final RadarProperties properties;
    private final Clock clock;

    public TemporalViews(RadarProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    public List<Opportunity> recentlyObserved(List<Opportunity> rows) {
        return recentlyObserved(rows, properties.getRecentDays());
    }

    /**
     * Listings whose {@code last_seen} falls in {@code [today - days, today]}, newest first.
     */
    public List<Opportunity> recentlyObserved(List<Opportunity> rows, int days) {
        LocalDate today = LocalDate.now(clock);
        LocalDate earliest = today.minusDays(Math.max(0, days));
        List<Seen> seen = new ArrayList<>();
        for (Opportunity row : rows) {
            DateResolution lastSeen = DateResolver.resolveTimestamp(row.lastSeen());
            if (!lastSeen.isResolved()) {
                continue;
            }
            LocalDate date = lastSeen.date();
            if (!date.isBefore(earliest) && !date.isAfter(today)) {
                seen.add(new Seen(row, date));
            }
        }
        seen.sort(Comparator.comparing(Seen::date).reversed());
        return seen.stream().map(Seen::opportunity).toList();
    }

    public List<Opportunity> closingSoon(List<Opportunity> rows) {
        return closingSoon(rows, properties.getClosingWindowDays());
    }

    /**
     * Listings with a known close date between today and {@code windowDays} ahead, soonest
     * first. Already-closed listings and listings without a readable close date are left out.
     */
    public List<Opportunity> closingSoon(List<Opportunity> rows, int windowDays) {
        List<Opportunity> out = new ArrayList<>();
        for (Opportunity row : rows) {
            Long days = row.daysToClose();
            if (days != null && days >= 0 && days <= windowDays) {
                out.add(row);
            }
        }
        out.sort(Comparator.comparing(Opportunity::daysToClose));
        return out;
    }

    private record Seen(Opportunity opportunity, LocalDate date) {
    }
}
