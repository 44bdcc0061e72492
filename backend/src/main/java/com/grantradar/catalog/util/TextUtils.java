package com.grantradar.catalog.util;

import org.jsoup.Jsoup;

import java.util.Locale;

public final class TextUtils {
    private TextUtils() {
    }

    /**
     * Scraped descriptions sometimes carry markup; rules should only see the visible text.
     */
    public static String plainText(String value) {
        if (value == null || value.isBlank()) {
            return "";
        }
        if (value.indexOf('<') < 0) {
            return value.trim();
        }
        return Jsoup.parse(value).text().trim();
    }

    public static boolean containsIgnoreCase(String haystack, String needle) {
        if (haystack == null || needle == null || needle.isEmpty()) {
            return false;
        }
        return haystack.toLowerCase(Locale.ROOT).contains(needle.toLowerCase(Locale.ROOT));
    }

    public static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
